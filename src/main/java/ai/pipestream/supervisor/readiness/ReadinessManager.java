package ai.pipestream.supervisor.readiness;

import ai.pipestream.supervisor.registry.ServiceRegistry;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.subscription.Cancellable;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides when the platform as a whole is ready.
 * <p>
 * Readiness is a one-way latch: once every required, enabled configured service is healthy or
 * degraded, the manager flips to ready, stamps the time and launches each registered callback
 * exactly once. It never goes back to not-ready.
 */
public class ReadinessManager {

    private static final Logger LOG = Logger.getLogger(ReadinessManager.class);

    private final ServiceRegistry registry;
    private final Duration pollInterval;
    private final Duration logInterval;
    private final Clock clock;
    private final Executor callbackExecutor;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean ready;
    private Instant readyTimestamp;
    private Instant lastLogged;

    private Cancellable pollTask;

    public ReadinessManager(ServiceRegistry registry, Duration pollInterval, Duration logInterval,
                            Clock clock, Executor callbackExecutor) {
        this.registry = registry;
        this.pollInterval = pollInterval;
        this.logInterval = logInterval;
        this.clock = clock;
        this.callbackExecutor = callbackExecutor;
    }

    /**
     * Run one check right away, then poll on the configured interval
     */
    public synchronized void start() {
        if (pollTask != null) {
            return;
        }
        checkReadiness();
        pollTask = Multi.createFrom().ticks()
            .startingAfter(pollInterval)
            .every(pollInterval)
            .subscribe().with(
                tick -> poll(),
                failure -> LOG.error("Readiness polling stopped unexpectedly", failure)
            );
        LOG.debugf("Readiness polling every %s", pollInterval);
    }

    public synchronized void stop() {
        if (pollTask != null) {
            pollTask.cancel();
            pollTask = null;
        }
    }

    /**
     * Evaluate readiness once.
     * @return the latch value after the check
     */
    public boolean checkReadiness() {
        if (ready) {
            return true;
        }
        // Consult the registry without holding our own lock
        boolean allHealthy = registry.areAllConfiguredServicesHealthy();
        if (!allHealthy) {
            logNotReady();
            return false;
        }

        List<Runnable> toFire;
        Instant readyAt;
        lock.lock();
        try {
            if (ready) {
                return true;
            }
            readyAt = clock.instant();
            readyTimestamp = readyAt;
            ready = true;
            toFire = new ArrayList<>(callbacks);
        } finally {
            lock.unlock();
        }

        LOG.infof("All required services are operational, system ready at %s", readyAt);
        toFire.forEach(this::launch);
        return true;
    }

    public boolean isSystemReady() {
        return ready;
    }

    public Optional<Instant> readyTimestamp() {
        lock.lock();
        try {
            return Optional.ofNullable(readyTimestamp);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Register work to run once the system is ready. Fires straight away if it already is.
     */
    public void addSystemReadyCallback(Runnable callback) {
        boolean fireNow;
        lock.lock();
        try {
            fireNow = ready;
            if (!fireNow) {
                callbacks.add(callback);
            }
        } finally {
            lock.unlock();
        }
        if (fireNow) {
            launch(callback);
        }
    }

    private void poll() {
        try {
            checkReadiness();
        } catch (RuntimeException e) {
            LOG.error("Readiness check failed", e);
        }
    }

    private void launch(Runnable callback) {
        try {
            callbackExecutor.execute(() -> {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    LOG.error("System ready callback failed", e);
                }
            });
        } catch (RuntimeException e) {
            LOG.errorf(e, "Could not schedule system ready callback");
        }
    }

    private void logNotReady() {
        Instant now = clock.instant();
        lock.lock();
        try {
            if (lastLogged != null && Duration.between(lastLogged, now).compareTo(logInterval) < 0) {
                return;
            }
            lastLogged = now;
        } finally {
            lock.unlock();
        }
        Map<String, String> status = registry.configuredServiceStatus();
        StringBuilder line = new StringBuilder("Waiting for services to become ready:");
        status.forEach((name, description) -> line.append(' ').append(name).append('=').append(description).append(';'));
        LOG.info(line);
    }
}
