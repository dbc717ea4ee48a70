package ai.pipestream.supervisor.registry;

import ai.pipestream.supervisor.entity.HealthStatus;
import ai.pipestream.supervisor.entity.ServiceDescriptor;
import ai.pipestream.supervisor.entity.ServiceMetricsSnapshot;
import ai.pipestream.supervisor.entity.ServiceRecord;
import ai.pipestream.supervisor.entity.ServiceState;
import ai.pipestream.supervisor.entity.ServiceStatusSnapshot;
import ai.pipestream.supervisor.health.HealthTransitionListener;
import ai.pipestream.supervisor.health.HealthUpdate;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * In-memory table of registered services.
 * <p>
 * Reads take the read lock, registration, unregistration, heartbeats and health transitions
 * take the write lock. The registry never calls out to other components while locked.
 */
public class ServiceRegistry implements HealthTransitionListener {

    private static final Logger LOG = Logger.getLogger(ServiceRegistry.class);

    private final Map<String, ServiceRecord> services = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ServiceDescriptor> configured;
    private final String instanceGroupId;
    private final int portOffset;
    private final Clock clock;

    public ServiceRegistry(List<ServiceDescriptor> configured, String instanceGroupId, int portOffset, Clock clock) {
        Map<String, ServiceDescriptor> byName = new LinkedHashMap<>();
        configured.stream()
            .sorted(Comparator.comparing(ServiceDescriptor::name))
            .forEach(d -> byName.put(d.name(), d));
        this.configured = byName;
        this.instanceGroupId = instanceGroupId;
        this.portOffset = portOffset;
        this.clock = clock;
    }

    /**
     * Register a worker under a fresh identifier in STARTING.
     * A previous record with the same name and instance id is replaced.
     *
     * @throws IllegalArgumentException if the name is blank
     */
    public Registration register(WorkerIdentity identity, List<String> capabilities) {
        if (identity == null || identity.name() == null || identity.name().isBlank()) {
            throw new IllegalArgumentException("Service name is required");
        }

        Instant now = clock.instant();
        ServiceRecord record = ServiceRecord.create(identity.name(), identity.instanceId(), now);
        record.version = identity.version();
        record.host = identity.host();
        record.port = identity.port();
        record.capabilities = List.copyOf(capabilities);

        List<String> replaced = new ArrayList<>();
        lock.writeLock().lock();
        try {
            if (!record.instanceId.isEmpty()) {
                services.values().removeIf(existing -> {
                    boolean stale = existing.serviceName.equals(record.serviceName)
                        && existing.instanceId.equals(record.instanceId);
                    if (stale) {
                        LOG.warnf("Service %s instance %s registered again, replacing stale registration %s",
                            record.serviceName, record.instanceId, existing.serviceId);
                        replaced.add(existing.serviceId);
                    }
                    return stale;
                });
            }
            services.put(record.serviceId, record);
        } finally {
            lock.writeLock().unlock();
        }

        ServiceDescriptor descriptor = configured.get(identity.name());
        if (descriptor == null) {
            LOG.infof("Registered service %s with ID %s (no config found)", identity.name(), record.serviceId);
            return new Registration(record.serviceId, record.serviceName, replaced, Optional.empty());
        }

        Map<String, String> config = new HashMap<>(descriptor.config());
        config.put("instance_group.group_id", instanceGroupId);
        config.put("instance_group.port_offset", Integer.toString(portOffset));
        LOG.infof("Registered service %s with ID %s", identity.name(), record.serviceId);
        return new Registration(record.serviceId, record.serviceName, replaced,
            Optional.of(new Registration.InitialConfig(config, descriptor.environment())));
    }

    /**
     * Remove a registration
     * @return the removed record's final state
     * @throws ServiceNotFoundException if the identifier is unknown
     */
    public ServiceStatusSnapshot unregister(String serviceId) {
        ServiceRecord removed;
        lock.writeLock().lock();
        try {
            removed = services.remove(serviceId);
            if (removed == null) {
                throw new ServiceNotFoundException(serviceId);
            }
            removed.state = ServiceState.STOPPED;
            removed.health = HealthStatus.STOPPED;
        } finally {
            lock.writeLock().unlock();
        }
        LOG.infof("Unregistered service %s (ID: %s)", removed.serviceName, serviceId);
        return removed.snapshot();
    }

    public Optional<ServiceStatusSnapshot> status(String serviceId) {
        lock.readLock().lock();
        try {
            ServiceRecord record = services.get(serviceId);
            return record == null ? Optional.empty() : Optional.of(record.snapshot());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Registered services matching both filters
     * @param stateFilter Required state, or null for any
     * @param namePattern Name with optional {@code *} wildcards, blank for any
     */
    public List<ServiceStatusSnapshot> list(ServiceState stateFilter, String namePattern) {
        Pattern pattern = compileNamePattern(namePattern);
        lock.readLock().lock();
        try {
            return services.values().stream()
                .filter(record -> stateFilter == null || record.state == stateFilter)
                .filter(record -> pattern == null || pattern.matcher(record.serviceName).matches())
                .sorted(Comparator.comparing((ServiceRecord r) -> r.serviceName).thenComparing(r -> r.registeredAt))
                .map(ServiceRecord::snapshot)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Record a heartbeat. Succeeds even when the status is unchanged.
     * @throws ServiceNotFoundException if the identifier is unknown
     * @throws IllegalArgumentException if the status is not one a worker may report
     */
    public ServiceStatusSnapshot updateHeartbeat(String serviceId, HealthStatus status, ServiceMetricsSnapshot metrics) {
        if (!status.isReportable()) {
            throw new IllegalArgumentException("Heartbeat cannot report " + status);
        }
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            ServiceRecord record = services.get(serviceId);
            if (record == null) {
                throw new ServiceNotFoundException(serviceId);
            }
            record.lastUpdate = now;
            record.metrics = metrics == null ? ServiceMetricsSnapshot.EMPTY : metrics;
            if (record.state == ServiceState.STARTING && status == HealthStatus.HEALTHY) {
                LOG.infof("Service %s transitioned to RUNNING state", record.serviceName);
            }
            record.applyHealth(status, now);
            return record.snapshot();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Mark a service as being stopped by the supervisor
     */
    public void markStopping(String serviceId) {
        lock.writeLock().lock();
        try {
            ServiceRecord record = services.get(serviceId);
            if (record != null) {
                record.state = ServiceState.STOPPING;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Keeps records in step with transitions the health monitor decides on its own, e.g. the stale sweep.
     */
    @Override
    public void onHealthChanged(HealthUpdate update) {
        if (update.newStatus() == HealthStatus.STOPPED) {
            return;
        }
        lock.writeLock().lock();
        try {
            ServiceRecord record = services.get(update.serviceId());
            if (record != null && record.health != update.newStatus()) {
                record.applyHealth(update.newStatus(), update.timestamp());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Identifiers of registered services with the given name, most recent registration first
     */
    public List<String> findIdsByName(String serviceName) {
        lock.readLock().lock();
        try {
            return services.values().stream()
                .filter(record -> record.serviceName.equals(serviceName))
                .sorted(Comparator.comparing((ServiceRecord r) -> r.registeredAt).reversed())
                .map(record -> record.serviceId)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRegistered(String serviceName) {
        return !findIdsByName(serviceName).isEmpty();
    }

    /**
     * Whether a service with this name is registered and HEALTHY or DEGRADED
     */
    public boolean isServiceOperational(String serviceName) {
        lock.readLock().lock();
        try {
            return findRecordByName(serviceName)
                .map(record -> record.health.isOperational())
                .orElse(false);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Readiness aggregate over the configured set: every enabled, required service must be
     * registered and operational. A required service that never registered is not ready.
     */
    public boolean areAllConfiguredServicesHealthy() {
        lock.readLock().lock();
        try {
            for (ServiceDescriptor descriptor : configured.values()) {
                if (!descriptor.enabled() || !descriptor.required()) {
                    continue;
                }
                boolean operational = findRecordByName(descriptor.name())
                    .map(record -> record.health.isOperational())
                    .orElse(false);
                if (!operational) {
                    return false;
                }
            }
            return true;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Human readable status for every configured service, for diagnostics
     */
    public Map<String, String> configuredServiceStatus() {
        lock.readLock().lock();
        try {
            Map<String, String> status = new LinkedHashMap<>();
            for (ServiceDescriptor descriptor : configured.values()) {
                status.put(descriptor.name(), describe(descriptor));
            }
            return status;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ServiceDescriptor> configuredServices() {
        return new ArrayList<>(configured.values());
    }

    private String describe(ServiceDescriptor descriptor) {
        if (!descriptor.enabled()) {
            return "disabled";
        }
        Optional<ServiceRecord> record = findRecordByName(descriptor.name());
        if (record.isEmpty()) {
            return descriptor.required() ? "not started (required)" : "not started (optional)";
        }
        HealthStatus health = record.get().health;
        if (health == HealthStatus.HEALTHY) {
            return "healthy";
        }
        if (health == HealthStatus.DEGRADED) {
            return "degraded but operational";
        }
        return String.format("unhealthy (state: %s, health: %s)", record.get().state, health);
    }

    // Caller holds the lock
    private Optional<ServiceRecord> findRecordByName(String serviceName) {
        return services.values().stream()
            .filter(record -> record.serviceName.equals(serviceName))
            .max(Comparator.comparing(record -> record.registeredAt));
    }

    static Pattern compileNamePattern(String namePattern) {
        if (namePattern == null || namePattern.isBlank() || "*".equals(namePattern)) {
            return null;
        }
        String[] parts = namePattern.split("\\*", -1);
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                regex.append(".*");
            }
            regex.append(Pattern.quote(parts[i]));
        }
        return Pattern.compile(regex.toString());
    }
}
