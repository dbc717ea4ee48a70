package ai.pipestream.supervisor.entity;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Registry entry for a service that called home.
 * Instances are mutated only while the owning registry holds its write lock;
 * readers get a {@link ServiceStatusSnapshot} instead.
 */
public class ServiceRecord {

    /** Generated identifier, opaque to the worker */
    public String serviceId;

    /** Name of the service, matches the configured descriptor name */
    public String serviceName;

    /** Worker supplied instance identifier, may be empty */
    public String instanceId;

    /** Host the worker serves on */
    public String host;

    /** Port the worker serves on */
    public int port;

    /** Version reported by the worker */
    public String version;

    /** Capabilities declared at registration */
    public List<String> capabilities = List.of();

    /** Current lifecycle state */
    public ServiceState state = ServiceState.STARTING;

    /** Current health */
    public HealthStatus health = HealthStatus.STARTING;

    /** Timestamp of the registration */
    public Instant registeredAt;

    /** Timestamp of the last heartbeat or registration */
    public Instant lastUpdate;

    /** Timestamp of the last healthy report, null until the first one */
    public Instant lastHealthy;

    /** Metrics carried by the last heartbeat */
    public ServiceMetricsSnapshot metrics = ServiceMetricsSnapshot.EMPTY;

    /**
     * Factory method to create a new record in STARTING with a fresh identifier
     * @param serviceName The name of the service
     * @param instanceId The worker instance id
     * @param now Registration time
     * @return A new ServiceRecord
     */
    public static ServiceRecord create(String serviceName, String instanceId, Instant now) {
        ServiceRecord record = new ServiceRecord();
        record.serviceId = generateServiceId();
        record.serviceName = serviceName;
        record.instanceId = instanceId == null ? "" : instanceId;
        record.registeredAt = now;
        record.lastUpdate = now;
        return record;
    }

    /**
     * Identifiers are random so they never collide with a previous incarnation of the same worker.
     */
    public static String generateServiceId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Apply a health value. Entering HEALTHY stamps lastHealthy and promotes a starting service to running.
     * @param status The new health
     * @param now Time of the change
     */
    public void applyHealth(HealthStatus status, Instant now) {
        this.health = status;
        if (status == HealthStatus.HEALTHY) {
            this.lastHealthy = now;
            if (state == ServiceState.STARTING) {
                state = ServiceState.RUNNING;
            }
        }
    }

    /**
     * Immutable copy for readers outside the lock
     */
    public ServiceStatusSnapshot snapshot() {
        return new ServiceStatusSnapshot(serviceId, serviceName, instanceId, host, port, version,
                capabilities, state, health, registeredAt, lastUpdate, lastHealthy, metrics);
    }
}
