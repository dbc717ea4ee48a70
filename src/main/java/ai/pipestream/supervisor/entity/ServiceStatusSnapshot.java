package ai.pipestream.supervisor.entity;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a {@link ServiceRecord}.
 */
public record ServiceStatusSnapshot(String serviceId,
                                    String serviceName,
                                    String instanceId,
                                    String host,
                                    int port,
                                    String version,
                                    List<String> capabilities,
                                    ServiceState state,
                                    HealthStatus health,
                                    Instant registeredAt,
                                    Instant lastUpdate,
                                    Instant lastHealthy,
                                    ServiceMetricsSnapshot metrics) {

    public ServiceStatusSnapshot {
        capabilities = List.copyOf(capabilities);
    }
}
