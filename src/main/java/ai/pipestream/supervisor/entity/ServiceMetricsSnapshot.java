package ai.pipestream.supervisor.entity;

import java.util.Map;

/**
 * Last metrics reported by a service heartbeat.
 */
public record ServiceMetricsSnapshot(double cpuUsagePercent,
                                     long memoryUsageBytes,
                                     long requestsProcessed,
                                     long errorsCount,
                                     Map<String, String> custom) {

    public static final ServiceMetricsSnapshot EMPTY = new ServiceMetricsSnapshot(0, 0, 0, 0, Map.of());

    public ServiceMetricsSnapshot {
        custom = Map.copyOf(custom);
    }
}
