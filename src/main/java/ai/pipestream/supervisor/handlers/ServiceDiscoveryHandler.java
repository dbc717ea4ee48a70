package ai.pipestream.supervisor.handlers;

import ai.pipestream.platform.supervisor.GetServiceStatusRequest;
import ai.pipestream.platform.supervisor.HealthUpdate;
import ai.pipestream.platform.supervisor.ListServicesRequest;
import ai.pipestream.platform.supervisor.ListServicesResponse;
import ai.pipestream.platform.supervisor.ServiceStatus;
import ai.pipestream.platform.supervisor.SystemStatus;
import ai.pipestream.platform.supervisor.WatchServiceHealthRequest;
import ai.pipestream.supervisor.entity.ServiceStatusSnapshot;
import ai.pipestream.supervisor.health.HealthMonitor;
import ai.pipestream.supervisor.readiness.ReadinessManager;
import ai.pipestream.supervisor.registry.ServiceRegistry;
import io.grpc.Status;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.List;

/**
 * Read side of the control plane: status lookups, listings, system readiness and health watches.
 */
@ApplicationScoped
public class ServiceDiscoveryHandler {

    private static final Logger LOG = Logger.getLogger(ServiceDiscoveryHandler.class);

    @Inject
    ServiceRegistry registry;

    @Inject
    HealthMonitor healthMonitor;

    @Inject
    ReadinessManager readinessManager;

    @Inject
    Clock clock;

    /**
     * Get one service's status
     * @return a Uni failing with NOT_FOUND when the id is unknown
     */
    public Uni<ServiceStatus> getServiceStatus(GetServiceStatusRequest request) {
        return Uni.createFrom().item(() -> registry.status(request.getServiceId())
            .map(ProtoConversions::toProto)
            .orElseThrow(() -> Status.NOT_FOUND
                .withDescription("Service not found: " + request.getServiceId())
                .asRuntimeException()));
    }

    /**
     * List registered services matching the optional state filter and name pattern
     */
    public Uni<ListServicesResponse> listServices(ListServicesRequest request) {
        return Uni.createFrom().item(() -> {
            List<ServiceStatusSnapshot> services = registry.list(
                ProtoConversions.fromProto(request.getStateFilter()), request.getNamePattern());
            ListServicesResponse.Builder response = ListServicesResponse.newBuilder()
                .setTotalCount(services.size())
                .setAsOf(ProtoConversions.toTimestamp(clock.instant()));
            services.forEach(service -> response.addServices(ProtoConversions.toProto(service)));
            return response.build();
        });
    }

    /**
     * Readiness latch plus a diagnostic line per configured service
     */
    public Uni<SystemStatus> getSystemStatus() {
        return Uni.createFrom().item(() -> {
            SystemStatus.Builder status = SystemStatus.newBuilder()
                .setReady(readinessManager.isSystemReady())
                .putAllServices(registry.configuredServiceStatus());
            readinessManager.readyTimestamp()
                .ifPresent(readyAt -> status.setReadySince(ProtoConversions.toTimestamp(readyAt)));
            return status.build();
        });
    }

    /**
     * Stream health transitions until the caller cancels.
     * Updates that arrive while the caller lags behind a full buffer are dropped.
     */
    public Multi<HealthUpdate> watchServiceHealth(WatchServiceHealthRequest request) {
        if (request.getServiceIdsList().stream().anyMatch(String::isBlank)) {
            return Multi.createFrom().failure(Status.INVALID_ARGUMENT
                .withDescription("service_ids must not contain blank entries")
                .asRuntimeException());
        }

        List<String> serviceIds = request.getServiceIdsList();
        return healthMonitor.watch(serviceIds, Infrastructure.getDefaultWorkerPool())
            .onSubscription().invoke(subscription -> LOG.debugf("Health watch opened for %s",
                serviceIds.isEmpty() ? "all services" : serviceIds))
            .map(ProtoConversions::toProto);
    }
}
