package ai.pipestream.supervisor.health;

import ai.pipestream.supervisor.entity.HealthStatus;

import java.time.Instant;

/**
 * A health transition of one service. Only emitted when the status actually changes.
 */
public record HealthUpdate(String serviceId, String serviceName, HealthStatus oldStatus, HealthStatus newStatus,
                           Instant timestamp) {
}
