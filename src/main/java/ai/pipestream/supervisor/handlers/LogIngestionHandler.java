package ai.pipestream.supervisor.handlers;

import ai.pipestream.platform.supervisor.GetServiceLogsRequest;
import ai.pipestream.platform.supervisor.GetServiceLogsResponse;
import ai.pipestream.platform.supervisor.LogEntry;
import ai.pipestream.platform.supervisor.StreamLogsResponse;
import ai.pipestream.supervisor.entity.ServiceStatusSnapshot;
import ai.pipestream.supervisor.logs.ServiceLogStore;
import ai.pipestream.supervisor.registry.ServiceRegistry;
import io.grpc.Status;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.stream.Collectors;

/**
 * Receives worker log streams and serves the buffered lines back.
 */
@ApplicationScoped
public class LogIngestionHandler {

    private static final Logger LOG = Logger.getLogger(LogIngestionHandler.class);

    static final int DEFAULT_LIMIT = 100;

    @Inject
    ServiceLogStore logStore;

    @Inject
    ServiceRegistry registry;

    @Inject
    Clock clock;

    /**
     * Consume a client stream of log entries
     * @return the number of entries stored, once the client completes the stream
     */
    public Uni<StreamLogsResponse> streamLogs(Multi<LogEntry> entries) {
        return entries
            .onItem().invoke(this::store)
            .collect().with(Collectors.counting())
            .onItem().transform(count -> {
                LOG.debugf("Log stream completed with %d entries", count);
                return StreamLogsResponse.newBuilder()
                    .setAcknowledged(true)
                    .setEntriesReceived(count)
                    .build();
            });
    }

    public Uni<GetServiceLogsResponse> getServiceLogs(GetServiceLogsRequest request) {
        if (request.getServiceId().isBlank()) {
            return Uni.createFrom().failure(Status.INVALID_ARGUMENT
                .withDescription("service_id is required")
                .asRuntimeException());
        }
        int limit = request.getLimit() > 0 ? request.getLimit() : DEFAULT_LIMIT;
        return Uni.createFrom().item(() -> {
            GetServiceLogsResponse.Builder response = GetServiceLogsResponse.newBuilder();
            logStore.recent(request.getServiceId(), limit)
                .forEach(entry -> response.addEntries(ProtoConversions.toProto(entry)));
            return response.build();
        });
    }

    private void store(LogEntry entry) {
        if (entry.getServiceId().isBlank()) {
            throw Status.INVALID_ARGUMENT
                .withDescription("Log entry without service_id")
                .asRuntimeException();
        }
        String serviceName = registry.status(entry.getServiceId())
            .map(ServiceStatusSnapshot::serviceName)
            .orElse(entry.getServiceId());
        logStore.append(ProtoConversions.fromProto(entry, clock.instant()), serviceName);
    }
}
