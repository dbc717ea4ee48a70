package ai.pipestream.supervisor.process;

import ai.pipestream.supervisor.entity.RestartPolicy;
import ai.pipestream.supervisor.entity.ServiceDescriptor;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runtime handle for one configured service: at most one live OS process at a time.
 * Start and stop on the same service serialize on this handle's lock; different services
 * never contend.
 */
public class ServiceProcess {

    private static final Logger LOG = Logger.getLogger(ServiceProcess.class);

    /** Upper bound on waiting for a killed process to be reaped */
    static final Duration FORCE_KILL_WAIT = Duration.ofSeconds(5);
    static final Duration MAX_RESTART_BACKOFF = Duration.ofSeconds(30);

    private final ServiceDescriptor descriptor;
    private final PortOffsetRewriter portOffset;
    private final ProcessEnvironment environment;
    private final Duration initialRestartBackoff;
    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private Process process;
    private boolean stopRequested;
    private int restarts;
    private Cancellable pendingRestart;

    public ServiceProcess(ServiceDescriptor descriptor, PortOffsetRewriter portOffset, ProcessEnvironment environment) {
        this(descriptor, portOffset, environment, Duration.ofSeconds(1));
    }

    ServiceProcess(ServiceDescriptor descriptor, PortOffsetRewriter portOffset, ProcessEnvironment environment,
                   Duration initialRestartBackoff) {
        this.descriptor = descriptor;
        this.portOffset = portOffset;
        this.environment = environment;
        this.initialRestartBackoff = initialRestartBackoff;
    }

    public ServiceDescriptor descriptor() {
        return descriptor;
    }

    /**
     * Launch the process.
     * @throws ProcessStartException if it is already running or cannot be spawned
     */
    public void start() {
        lock.lock();
        try {
            restarts = 0;
            launch();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ask the process to terminate and wait up to {@code gracePeriod} for it to go away.
     * The returned Uni fails with {@link ProcessStopException} when the process had to be killed.
     * Succeeds immediately when nothing is running.
     *
     * @param force Skip the grace period and kill right away
     * @param gracePeriod How long a terminating process may take
     */
    public Uni<Void> stop(boolean force, Duration gracePeriod) {
        Process current;
        lock.lock();
        try {
            stopRequested = true;
            cancelPendingRestart();
            current = process;
            if (current == null || !current.isAlive()) {
                process = null;
                return Uni.createFrom().voidItem();
            }
        } finally {
            lock.unlock();
        }

        String name = descriptor.name();
        if (force) {
            LOG.infof("Force killing service %s (pid %d)", name, current.pid());
            current.destroyForcibly();
            return awaitExit(current)
                .ifNoItem().after(FORCE_KILL_WAIT)
                .failWith(() -> new ProcessStopException("Service " + name + " did not exit after being killed"))
                .onItem().invoke(this::clearHandle)
                .replaceWithVoid();
        }

        LOG.infof("Sending termination signal to service %s (pid %d), grace period %s", name, current.pid(), gracePeriod);
        current.destroy();
        return awaitExit(current)
            .ifNoItem().after(gracePeriod)
            .recoverWithUni(() -> {
                LOG.warnf("Service %s did not exit within %s, killing it", name, gracePeriod);
                current.destroyForcibly();
                return Uni.createFrom().<Process>failure(new ProcessStopException(
                    "Service " + name + " did not exit gracefully within " + gracePeriod + " and was killed"));
            })
            .onItem().invoke(this::clearHandle)
            .replaceWithVoid();
    }

    /**
     * @return true iff a live process handle exists
     */
    public boolean isRunning() {
        lock.lock();
        try {
            return process != null && process.isAlive();
        } finally {
            lock.unlock();
        }
    }

    public OptionalLong pid() {
        lock.lock();
        try {
            return process == null ? OptionalLong.empty() : OptionalLong.of(process.pid());
        } finally {
            lock.unlock();
        }
    }

    int restartCount() {
        lock.lock();
        try {
            return restarts;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Executable followed by the argument template with internal ports shifted
     */
    List<String> command() {
        List<String> command = new ArrayList<>();
        command.add(descriptor.executable());
        command.addAll(portOffset.rewrite(descriptor.args()));
        return command;
    }

    private void launch() {
        if (process != null && process.isAlive()) {
            throw new ProcessStartException("Service " + descriptor.name() + " is already running (pid " + process.pid() + ")");
        }

        List<String> command = command();
        ProcessBuilder builder = new ProcessBuilder(command).inheritIO();
        environment.applyTo(builder.environment(), descriptor);

        Process started;
        try {
            started = builder.start();
        } catch (IOException e) {
            process = null;
            throw new ProcessStartException("Failed to launch service " + descriptor.name() + ": " + e.getMessage(), e);
        }

        process = started;
        stopRequested = false;
        LOG.infof("Started service %s (pid %d): %s", descriptor.name(), started.pid(), String.join(" ", command));
        started.onExit().thenAccept(this::onExit);
    }

    private void onExit(Process exited) {
        lock.lock();
        try {
            if (process != exited) {
                return;
            }
            process = null;
            int exitCode = exited.exitValue();
            if (stopRequested) {
                LOG.infof("Service %s exited with code %d after stop request", descriptor.name(), exitCode);
                return;
            }

            LOG.warnf("Service %s exited unexpectedly with code %d", descriptor.name(), exitCode);
            if (descriptor.restartPolicy() != RestartPolicy.ON_FAILURE || exitCode == 0) {
                return;
            }
            if (restarts >= descriptor.maxRestarts()) {
                LOG.errorf("Service %s exhausted its %d restarts, leaving it stopped", descriptor.name(), descriptor.maxRestarts());
                return;
            }
            restarts++;
            Duration delay = restartBackoff(restarts);
            LOG.infof("Restarting service %s in %s (attempt %d/%d)", descriptor.name(), delay, restarts, descriptor.maxRestarts());
            pendingRestart = Uni.createFrom().voidItem()
                .onItem().delayIt().by(delay)
                .subscribe().with(
                    ignored -> relaunch(),
                    error -> LOG.errorf(error, "Restart of service %s failed", descriptor.name())
                );
        } finally {
            lock.unlock();
        }
    }

    private void relaunch() {
        lock.lock();
        try {
            pendingRestart = null;
            if (stopRequested) {
                return;
            }
            launch();
        } catch (ProcessStartException e) {
            LOG.errorf("Restart of service %s failed: %s", descriptor.name(), e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    Duration restartBackoff(int attempt) {
        Duration delay = initialRestartBackoff.multipliedBy(1L << Math.min(attempt - 1, 16));
        return delay.compareTo(MAX_RESTART_BACKOFF) > 0 ? MAX_RESTART_BACKOFF : delay;
    }

    private void cancelPendingRestart() {
        if (pendingRestart != null) {
            pendingRestart.cancel();
            pendingRestart = null;
        }
    }

    private void clearHandle(Process exited) {
        lock.lock();
        try {
            if (process == exited) {
                process = null;
            }
        } finally {
            lock.unlock();
        }
    }

    private static Uni<Process> awaitExit(Process process) {
        return Uni.createFrom().completionStage(process::onExit);
    }
}
