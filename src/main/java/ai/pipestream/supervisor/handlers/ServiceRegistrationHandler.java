package ai.pipestream.supervisor.handlers;

import ai.pipestream.platform.supervisor.HeartbeatRequest;
import ai.pipestream.platform.supervisor.HeartbeatResponse;
import ai.pipestream.platform.supervisor.RegisterServiceRequest;
import ai.pipestream.platform.supervisor.RegisterServiceResponse;
import ai.pipestream.platform.supervisor.ServiceConfiguration;
import ai.pipestream.platform.supervisor.ServiceInfo;
import ai.pipestream.platform.supervisor.UnregisterServiceRequest;
import ai.pipestream.platform.supervisor.UnregisterServiceResponse;
import ai.pipestream.supervisor.entity.HealthStatus;
import ai.pipestream.supervisor.entity.PendingCommand;
import ai.pipestream.supervisor.entity.ServiceMetricsSnapshot;
import ai.pipestream.supervisor.entity.ServiceStatusSnapshot;
import ai.pipestream.supervisor.events.SupervisorEventsProducer;
import ai.pipestream.supervisor.health.HealthMonitor;
import ai.pipestream.supervisor.registry.Registration;
import ai.pipestream.supervisor.registry.ServiceNotFoundException;
import ai.pipestream.supervisor.registry.ServiceRegistry;
import ai.pipestream.supervisor.registry.WorkerIdentity;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Handles the calls workers make about themselves: register, unregister and heartbeat.
 * Caller errors are answered in the response, never as a transport failure.
 */
@ApplicationScoped
public class ServiceRegistrationHandler {

    private static final Logger LOG = Logger.getLogger(ServiceRegistrationHandler.class);

    @Inject
    ServiceRegistry registry;

    @Inject
    HealthMonitor healthMonitor;

    @Inject
    SupervisorEventsProducer eventsProducer;

    /**
     * Register a worker and seed its health tracking
     */
    public Uni<RegisterServiceResponse> registerService(RegisterServiceRequest request) {
        return Uni.createFrom().item(() -> {
                ServiceInfo info = request.getService();
                WorkerIdentity identity = new WorkerIdentity(info.getName(), info.getInstanceId(),
                    info.getVersion(), info.getHost(), info.getPort());

                Registration registration = registry.register(identity, request.getCapabilitiesList());
                registration.replacedServiceIds().forEach(healthMonitor::removeService);
                healthMonitor.addService(registration.serviceId(), registration.serviceName());
                if (registry.status(registration.serviceId()).isEmpty()) {
                    // A concurrent re-registration replaced this record before it was tracked
                    healthMonitor.removeService(registration.serviceId());
                }
                eventsProducer.emitServiceRegistered(registration.serviceId(), identity);

                RegisterServiceResponse.Builder response = RegisterServiceResponse.newBuilder()
                    .setSuccess(true)
                    .setMessage("Service registered successfully")
                    .setServiceId(registration.serviceId());
                registration.initialConfig().ifPresent(initial -> response.setInitialConfig(
                    ServiceConfiguration.newBuilder()
                        .putAllConfig(initial.config())
                        .putAllEnvironment(initial.environment())
                        .build()));
                return response.build();
            })
            .onFailure().recoverWithItem(error -> {
                LOG.warnf("Rejected registration for '%s': %s", request.getService().getName(), error.getMessage());
                return RegisterServiceResponse.newBuilder()
                    .setSuccess(false)
                    .setMessage("Registration failed: " + error.getMessage())
                    .build();
            });
    }

    /**
     * Unregister a worker. Subscribers see a final STOPPED update.
     */
    public Uni<UnregisterServiceResponse> unregisterService(UnregisterServiceRequest request) {
        String serviceId = request.getServiceId();
        return Uni.createFrom().item(() -> {
                ServiceStatusSnapshot removed = registry.unregister(serviceId);
                healthMonitor.removeService(serviceId);
                eventsProducer.emitServiceUnregistered(removed, request.getReason());
                if (!request.getReason().isEmpty()) {
                    LOG.infof("Service %s unregistered: %s", removed.serviceName(), request.getReason());
                }
                return UnregisterServiceResponse.newBuilder()
                    .setSuccess(true)
                    .setMessage("Service unregistered successfully")
                    .build();
            })
            .onFailure(ServiceNotFoundException.class).recoverWithItem(error -> {
                // Still drop any monitor state left behind by a racing unregister
                healthMonitor.removeService(serviceId);
                return UnregisterServiceResponse.newBuilder()
                    .setSuccess(false)
                    .setMessage(error.getMessage())
                    .build();
            })
            .onFailure().recoverWithItem(error -> {
                LOG.errorf(error, "Failed to unregister service %s", serviceId);
                return UnregisterServiceResponse.newBuilder()
                    .setSuccess(false)
                    .setMessage("Unregistration failed: " + error.getMessage())
                    .build();
            });
    }

    /**
     * Record a heartbeat and hand back everything queued for the worker
     */
    public Uni<HeartbeatResponse> sendHeartbeat(HeartbeatRequest request) {
        String serviceId = request.getServiceId();
        HealthStatus status = ProtoConversions.fromProto(request.getHealthStatus());
        if (status == null) {
            return Uni.createFrom().item(HeartbeatResponse.newBuilder()
                .setAcknowledged(false)
                .setMessage("Heartbeat must carry a health status")
                .build());
        }
        if (!status.isReportable()) {
            LOG.debugf("Rejected heartbeat from %s reporting %s", serviceId, status);
            return Uni.createFrom().item(HeartbeatResponse.newBuilder()
                .setAcknowledged(false)
                .setMessage("Heartbeat cannot report " + status + "; use HEALTHY, DEGRADED or UNHEALTHY")
                .build());
        }

        return Uni.createFrom().item(() -> {
                ServiceMetricsSnapshot metrics = request.hasMetrics()
                    ? ProtoConversions.fromProto(request.getMetrics())
                    : ServiceMetricsSnapshot.EMPTY;
                registry.updateHeartbeat(serviceId, status, metrics);
                healthMonitor.recordHeartbeat(serviceId, status);

                List<PendingCommand> commands = healthMonitor.pendingCommands(serviceId);
                HeartbeatResponse.Builder response = HeartbeatResponse.newBuilder()
                    .setAcknowledged(true)
                    .setMessage("Heartbeat received");
                commands.forEach(command -> response.addCommands(ProtoConversions.toProto(command)));
                if (!commands.isEmpty()) {
                    LOG.debugf("Delivering %d commands to service %s", commands.size(), serviceId);
                }
                return response.build();
            })
            .onFailure(ServiceNotFoundException.class).recoverWithItem(error -> {
                LOG.debugf("Heartbeat from unknown service %s", serviceId);
                return HeartbeatResponse.newBuilder()
                    .setAcknowledged(false)
                    .setMessage(error.getMessage())
                    .build();
            });
    }
}
