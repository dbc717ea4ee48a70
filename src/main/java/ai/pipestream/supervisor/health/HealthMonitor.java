package ai.pipestream.supervisor.health;

import ai.pipestream.supervisor.entity.HealthStatus;
import ai.pipestream.supervisor.entity.PendingCommand;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.subscription.BackPressureStrategy;
import io.smallrye.mutiny.subscription.Cancellable;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracks per-service health, sweeps for services that went silent and fans out
 * transitions to subscribers. Also holds the commands waiting for each service's
 * next heartbeat.
 * <p>
 * Everything is guarded by one read/write lock. Notifications are dispatched under the
 * write lock, which keeps per-service ordering, and are always non-blocking.
 */
public class HealthMonitor {

    private static final Logger LOG = Logger.getLogger(HealthMonitor.class);

    private final Map<String, TrackedService> services = new HashMap<>();
    private final Map<String, HealthSubscription> subscribers = new LinkedHashMap<>();
    private final Map<String, Deque<PendingCommand>> pendingCommands = new HashMap<>();
    private final List<HealthTransitionListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Clock clock;
    private final Duration checkInterval;
    private final Duration heartbeatTimeout;
    private final int subscriberCapacity;

    private Cancellable sweepTask;

    public HealthMonitor(Clock clock, Duration checkInterval, Duration heartbeatTimeout, int subscriberCapacity) {
        if (heartbeatTimeout.compareTo(checkInterval) <= 0) {
            throw new IllegalArgumentException("Heartbeat timeout " + heartbeatTimeout
                + " must be longer than the health check interval " + checkInterval);
        }
        if (subscriberCapacity <= 0) {
            throw new IllegalArgumentException("Subscriber capacity must be positive");
        }
        this.clock = clock;
        this.checkInterval = checkInterval;
        this.heartbeatTimeout = heartbeatTimeout;
        this.subscriberCapacity = subscriberCapacity;
    }

    /**
     * Start the periodic stale-service sweep
     */
    public synchronized void start() {
        if (sweepTask != null) {
            return;
        }
        sweepTask = Multi.createFrom().ticks()
            .startingAfter(checkInterval)
            .every(checkInterval)
            .subscribe().with(
                tick -> runSweep(),
                failure -> LOG.error("Health sweep stopped unexpectedly", failure)
            );
        LOG.infof("Health monitor started (check interval: %s, heartbeat timeout: %s)", checkInterval, heartbeatTimeout);
    }

    /**
     * Cancel the sweep and close every subscription
     */
    public synchronized void stop() {
        if (sweepTask != null) {
            sweepTask.cancel();
            sweepTask = null;
        }
        List<HealthSubscription> open;
        lock.writeLock().lock();
        try {
            open = new ArrayList<>(subscribers.values());
            subscribers.clear();
        } finally {
            lock.writeLock().unlock();
        }
        open.forEach(HealthSubscription::close);
        LOG.info("Health monitor stopped");
    }

    public void addTransitionListener(HealthTransitionListener listener) {
        listeners.add(listener);
    }

    /**
     * Begin tracking a freshly registered service in STARTING
     */
    public void addService(String serviceId, String serviceName) {
        lock.writeLock().lock();
        try {
            services.put(serviceId, new TrackedService(serviceName, HealthStatus.STARTING, clock.instant()));
            pendingCommands.putIfAbsent(serviceId, new ArrayDeque<>());
        } finally {
            lock.writeLock().unlock();
        }
        LOG.debugf("Tracking health of %s (%s)", serviceName, serviceId);
    }

    /**
     * Stop tracking a service. Subscribers see a final transition to STOPPED.
     * @return false if the service was not tracked
     */
    public boolean removeService(String serviceId) {
        lock.writeLock().lock();
        try {
            pendingCommands.remove(serviceId);
            TrackedService removed = services.remove(serviceId);
            if (removed == null) {
                LOG.debugf("Service %s was not tracked, nothing to remove", serviceId);
                return false;
            }
            if (removed.status != HealthStatus.STOPPED) {
                dispatch(new HealthUpdate(serviceId, removed.name, removed.status, HealthStatus.STOPPED, clock.instant()));
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * A heartbeat arrived: refresh the liveness timestamp and apply the reported status.
     * STARTING and STOPPED are not reportable and leave the service untouched.
     */
    public void recordHeartbeat(String serviceId, HealthStatus status) {
        if (!status.isReportable()) {
            LOG.debugf("Ignoring heartbeat for %s reporting %s", serviceId, status);
            return;
        }
        lock.writeLock().lock();
        try {
            TrackedService tracked = services.get(serviceId);
            if (tracked == null) {
                LOG.debugf("Ignoring heartbeat for untracked service %s", serviceId);
                return;
            }
            tracked.lastUpdate = clock.instant();
            transition(serviceId, tracked, status);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Apply a status. Unknown services are ignored: a late heartbeat racing an unregister is expected.
     * Only {@link #addService} enters STARTING and only {@link #removeService} enters STOPPED.
     * @return true if the status changed and was published
     */
    public boolean updateHealth(String serviceId, HealthStatus status) {
        if (!status.isReportable()) {
            LOG.debugf("Ignoring %s health update for %s", status, serviceId);
            return false;
        }
        lock.writeLock().lock();
        try {
            TrackedService tracked = services.get(serviceId);
            if (tracked == null) {
                LOG.debugf("Ignoring health update for untracked service %s", serviceId);
                return false;
            }
            return transition(serviceId, tracked, status);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Mark services silent for longer than the heartbeat timeout as UNHEALTHY
     * @return number of services that transitioned
     */
    public int sweepStaleServices() {
        Instant now = clock.instant();
        int transitioned = 0;
        lock.writeLock().lock();
        try {
            for (Map.Entry<String, TrackedService> entry : services.entrySet()) {
                TrackedService tracked = entry.getValue();
                if (tracked.status == HealthStatus.UNHEALTHY || tracked.status == HealthStatus.STOPPED) {
                    continue;
                }
                Duration silence = Duration.between(tracked.lastUpdate, now);
                if (silence.compareTo(heartbeatTimeout) > 0) {
                    LOG.warnf("Service %s (%s) missed heartbeats for %s, marking unhealthy",
                        tracked.name, entry.getKey(), silence);
                    if (transition(entry.getKey(), tracked, HealthStatus.UNHEALTHY)) {
                        transitioned++;
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return transitioned;
    }

    public Optional<HealthStatus> status(String serviceId) {
        lock.readLock().lock();
        try {
            TrackedService tracked = services.get(serviceId);
            return tracked == null ? Optional.empty() : Optional.of(tracked.status);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stream health transitions until the subscriber cancels or the monitor stops.
     * <p>
     * Each subscriber may have at most the configured number of updates waiting for delivery.
     * Beyond that its updates are dropped, without slowing the monitor or other subscribers.
     * @param serviceIds Services of interest, empty for all
     * @param executor Where updates are delivered, one at a time and in order
     */
    public Multi<HealthUpdate> watch(Collection<String> serviceIds, Executor executor) {
        Set<String> filter = new HashSet<>(serviceIds);
        return Multi.createFrom().deferred(() -> {
            HealthSubscription subscription = new HealthSubscription(filter, subscriberCapacity);
            return Multi.createFrom().<HealthUpdate>emitter(emitter -> {
                    subscription.bind(emitter);
                    emitter.onTermination(() -> unsubscribe(subscription));
                    register(subscription);
                }, BackPressureStrategy.IGNORE)
                .onOverflow().invoke(subscription::discarded).drop()
                .emitOn(executor)
                .onItem().invoke(subscription::delivered);
        });
    }

    private void register(HealthSubscription subscription) {
        lock.writeLock().lock();
        try {
            subscribers.put(subscription.id(), subscription);
        } finally {
            lock.writeLock().unlock();
        }
        LOG.debugf("Health subscriber %s added (filter: %s)", subscription.id(),
            subscription.serviceIds().isEmpty() ? "all services" : subscription.serviceIds());
    }

    private void unsubscribe(HealthSubscription subscription) {
        lock.writeLock().lock();
        try {
            subscribers.remove(subscription.id());
        } finally {
            lock.writeLock().unlock();
        }
        subscription.close();
        LOG.debugf("Health subscriber %s removed (%d updates dropped)", subscription.id(), subscription.droppedCount());
    }

    public int subscriberCount() {
        lock.readLock().lock();
        try {
            return subscribers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Queue a command for delivery on the service's next heartbeat
     * @return the queued command, empty if the service is not tracked
     */
    public Optional<PendingCommand> queueCommand(String serviceId, String command, Map<String, String> parameters) {
        lock.writeLock().lock();
        try {
            if (!services.containsKey(serviceId)) {
                return Optional.empty();
            }
            PendingCommand pending = new PendingCommand(UUID.randomUUID().toString(), command, parameters, clock.instant());
            pendingCommands.computeIfAbsent(serviceId, id -> new ArrayDeque<>()).addLast(pending);
            LOG.debugf("Queued command %s (%s) for service %s", command, pending.commandId(), serviceId);
            return Optional.of(pending);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Return and clear everything queued for a service
     */
    public List<PendingCommand> pendingCommands(String serviceId) {
        lock.writeLock().lock();
        try {
            Deque<PendingCommand> queue = pendingCommands.get(serviceId);
            if (queue == null || queue.isEmpty()) {
                return List.of();
            }
            List<PendingCommand> drained = new ArrayList<>(queue);
            queue.clear();
            return drained;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void runSweep() {
        try {
            sweepStaleServices();
        } catch (RuntimeException e) {
            LOG.error("Health sweep failed", e);
        }
    }

    // Caller holds the write lock
    private boolean transition(String serviceId, TrackedService tracked, HealthStatus newStatus) {
        if (tracked.status == newStatus) {
            return false;
        }
        HealthStatus oldStatus = tracked.status;
        tracked.status = newStatus;
        LOG.infof("Service %s (%s) health changed: %s -> %s", tracked.name, serviceId, oldStatus, newStatus);
        dispatch(new HealthUpdate(serviceId, tracked.name, oldStatus, newStatus, clock.instant()));
        return true;
    }

    // Caller holds the write lock
    private void dispatch(HealthUpdate update) {
        for (HealthTransitionListener listener : listeners) {
            try {
                listener.onHealthChanged(update);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Health transition listener failed for %s", update.serviceId());
            }
        }
        for (HealthSubscription subscription : subscribers.values()) {
            if (subscription.isInterestedIn(update.serviceId()) && !subscription.offer(update)) {
                LOG.debugf("Dropped health update for %s: subscriber %s is full", update.serviceId(), subscription.id());
            }
        }
    }

    private static final class TrackedService {
        final String name;
        HealthStatus status;
        Instant lastUpdate;

        TrackedService(String name, HealthStatus status, Instant lastUpdate) {
            this.name = name;
            this.status = status;
            this.lastUpdate = lastUpdate;
        }
    }
}
