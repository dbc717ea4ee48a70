package ai.pipestream.supervisor.health;

import ai.pipestream.supervisor.readiness.ReadinessManager;
import ai.pipestream.supervisor.registry.ServiceRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Exposes the platform readiness latch.
 * Automatically available via:
 * - REST: /q/health/ready
 * - gRPC: grpc.health.v1.Health service
 * <p>
 * The per-service data lists every configured service, so an operator can see which one
 * is holding the platform back.
 */
@Readiness
@ApplicationScoped
public class SystemReadinessHealthCheck implements HealthCheck {

    @Inject
    ReadinessManager readinessManager;

    @Inject
    ServiceRegistry serviceRegistry;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder responseBuilder = HealthCheckResponse.named("platform-services");

        serviceRegistry.configuredServiceStatus()
            .forEach(responseBuilder::withData);

        if (readinessManager.isSystemReady()) {
            readinessManager.readyTimestamp()
                .ifPresent(readyAt -> responseBuilder.withData("ready-since", readyAt.toString()));
            return responseBuilder.up().build();
        }
        return responseBuilder.down().build();
    }
}
