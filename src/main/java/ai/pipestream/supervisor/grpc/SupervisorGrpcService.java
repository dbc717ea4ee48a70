package ai.pipestream.supervisor.grpc;

import ai.pipestream.platform.supervisor.GetServiceLogsRequest;
import ai.pipestream.platform.supervisor.GetServiceLogsResponse;
import ai.pipestream.platform.supervisor.GetServiceStatusRequest;
import ai.pipestream.platform.supervisor.HealthUpdate;
import ai.pipestream.platform.supervisor.HeartbeatRequest;
import ai.pipestream.platform.supervisor.HeartbeatResponse;
import ai.pipestream.platform.supervisor.ListServicesRequest;
import ai.pipestream.platform.supervisor.ListServicesResponse;
import ai.pipestream.platform.supervisor.LogEntry;
import ai.pipestream.platform.supervisor.MutinySupervisorGrpc;
import ai.pipestream.platform.supervisor.RegisterServiceRequest;
import ai.pipestream.platform.supervisor.RegisterServiceResponse;
import ai.pipestream.platform.supervisor.SendCommandRequest;
import ai.pipestream.platform.supervisor.SendCommandResponse;
import ai.pipestream.platform.supervisor.ServiceOperationResponse;
import ai.pipestream.platform.supervisor.ServiceStatus;
import ai.pipestream.platform.supervisor.StartServiceRequest;
import ai.pipestream.platform.supervisor.StopServiceRequest;
import ai.pipestream.platform.supervisor.StreamLogsResponse;
import ai.pipestream.platform.supervisor.SystemStatus;
import ai.pipestream.platform.supervisor.UnregisterServiceRequest;
import ai.pipestream.platform.supervisor.UnregisterServiceResponse;
import ai.pipestream.platform.supervisor.WatchServiceHealthRequest;
import ai.pipestream.supervisor.handlers.LogIngestionHandler;
import ai.pipestream.supervisor.handlers.ServiceDiscoveryHandler;
import ai.pipestream.supervisor.handlers.ServiceLifecycleHandler;
import ai.pipestream.supervisor.handlers.ServiceRegistrationHandler;
import com.google.protobuf.Empty;
import io.quarkus.grpc.GrpcService;
import io.smallrye.common.annotation.Blocking;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Supervisor control plane
 */
@GrpcService
public class SupervisorGrpcService extends MutinySupervisorGrpc.SupervisorImplBase {

    private static final Logger LOG = Logger.getLogger(SupervisorGrpcService.class);

    @Inject
    ServiceRegistrationHandler registrationHandler;

    @Inject
    ServiceLifecycleHandler lifecycleHandler;

    @Inject
    ServiceDiscoveryHandler discoveryHandler;

    @Inject
    LogIngestionHandler logHandler;

    @Override
    public Uni<RegisterServiceResponse> registerService(RegisterServiceRequest request) {
        LOG.infof("Received service registration request for: %s (instance %s) at %s:%d",
            request.getService().getName(), request.getService().getInstanceId(),
            request.getService().getHost(), request.getService().getPort());
        return registrationHandler.registerService(request);
    }

    @Override
    public Uni<UnregisterServiceResponse> unregisterService(UnregisterServiceRequest request) {
        LOG.infof("Received unregistration request for: %s", request.getServiceId());
        return registrationHandler.unregisterService(request);
    }

    @Blocking
    @Override
    public Uni<ServiceOperationResponse> startService(StartServiceRequest request) {
        LOG.infof("Received start request for: %s", request.getServiceName());
        return lifecycleHandler.startService(request);
    }

    @Blocking
    @Override
    public Uni<ServiceOperationResponse> stopService(StopServiceRequest request) {
        LOG.infof("Received stop request for: %s (force=%s)",
            request.hasServiceId() ? request.getServiceId() : request.getServiceName(), request.getForce());
        return lifecycleHandler.stopService(request);
    }

    @Override
    public Uni<ServiceStatus> getServiceStatus(GetServiceStatusRequest request) {
        LOG.debugf("Looking up service by ID: %s", request.getServiceId());
        return discoveryHandler.getServiceStatus(request);
    }

    @Override
    public Uni<ListServicesResponse> listServices(ListServicesRequest request) {
        LOG.debug("Received request to list services");
        return discoveryHandler.listServices(request);
    }

    @Override
    public Uni<SystemStatus> getSystemStatus(Empty request) {
        return discoveryHandler.getSystemStatus();
    }

    @Override
    public Uni<HeartbeatResponse> sendHeartbeat(HeartbeatRequest request) {
        LOG.tracef("Heartbeat from %s: %s", request.getServiceId(), request.getHealthStatus());
        return registrationHandler.sendHeartbeat(request);
    }

    @Override
    public Uni<SendCommandResponse> sendCommand(SendCommandRequest request) {
        LOG.infof("Received command %s for: %s", request.getCommand(), request.getServiceId());
        return lifecycleHandler.sendCommand(request);
    }

    @Override
    public Multi<HealthUpdate> watchServiceHealth(WatchServiceHealthRequest request) {
        LOG.debugf("Opening health watch for: %s", request.getServiceIdsList());
        return discoveryHandler.watchServiceHealth(request);
    }

    @Override
    public Uni<StreamLogsResponse> streamLogs(Multi<LogEntry> request) {
        return logHandler.streamLogs(request);
    }

    @Override
    public Uni<GetServiceLogsResponse> getServiceLogs(GetServiceLogsRequest request) {
        return logHandler.getServiceLogs(request);
    }
}
