package ai.pipestream.supervisor.handlers;

import ai.pipestream.platform.supervisor.SendCommandRequest;
import ai.pipestream.platform.supervisor.SendCommandResponse;
import ai.pipestream.platform.supervisor.ServiceOperationResponse;
import ai.pipestream.platform.supervisor.StartServiceRequest;
import ai.pipestream.platform.supervisor.StopServiceRequest;
import ai.pipestream.supervisor.config.SupervisorConfig;
import ai.pipestream.supervisor.entity.ServiceDescriptor;
import ai.pipestream.supervisor.entity.ServiceStatusSnapshot;
import ai.pipestream.supervisor.health.HealthMonitor;
import ai.pipestream.supervisor.process.ProcessController;
import ai.pipestream.supervisor.process.ProcessStartException;
import ai.pipestream.supervisor.process.ProcessStopException;
import ai.pipestream.supervisor.registry.ServiceRegistry;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Process lifecycle operations: start, stop and commands for running workers.
 */
@ApplicationScoped
public class ServiceLifecycleHandler {

    private static final Logger LOG = Logger.getLogger(ServiceLifecycleHandler.class);

    static final String STOP_COMMAND = "stop";
    static final Duration INITIAL_POLL_DELAY = Duration.ofSeconds(1);
    static final Duration MAX_POLL_DELAY = Duration.ofSeconds(5);
    static final double POLL_BACKOFF_FACTOR = 1.5;

    @Inject
    ProcessController processController;

    @Inject
    ServiceRegistry registry;

    @Inject
    HealthMonitor healthMonitor;

    @Inject
    SupervisorConfig config;

    @Inject
    Clock clock;

    /**
     * Launch a configured service, optionally waiting until it has registered
     */
    public Uni<ServiceOperationResponse> startService(StartServiceRequest request) {
        String name = request.getServiceName();
        if (name.isBlank()) {
            return Uni.createFrom().item(failed("service_name is required"));
        }

        return Uni.createFrom().item(() -> {
                processController.start(name);
                return name;
            })
            .onItem().transformToUni(started -> {
                if (!request.getWaitForRegistration()) {
                    return Uni.createFrom().item(succeeded("Service " + name + " started"));
                }
                return awaitRegistration(name);
            })
            .onFailure(ProcessStartException.class).recoverWithItem(error -> {
                LOG.warnf("Could not start %s: %s", name, error.getMessage());
                return failed(error.getMessage());
            })
            .onFailure().recoverWithItem(error -> {
                LOG.errorf(error, "Unexpected failure starting %s", name);
                return failed("Failed to start " + name + ": " + error.getMessage());
            });
    }

    /**
     * Stop a service by id or name. Registered workers also get a "stop" command on their next heartbeat.
     */
    public Uni<ServiceOperationResponse> stopService(StopServiceRequest request) {
        String name;
        List<String> serviceIds;
        switch (request.getTargetCase()) {
            case SERVICE_ID:
                Optional<ServiceStatusSnapshot> status = registry.status(request.getServiceId());
                if (status.isEmpty()) {
                    return Uni.createFrom().item(failed("Service not found: " + request.getServiceId()));
                }
                name = status.get().serviceName();
                serviceIds = List.of(request.getServiceId());
                break;
            case SERVICE_NAME:
                name = request.getServiceName();
                serviceIds = registry.findIdsByName(name);
                if (serviceIds.isEmpty() && processController.descriptor(name).isEmpty()) {
                    return Uni.createFrom().item(failed("Unknown service: " + name));
                }
                break;
            default:
                return Uni.createFrom().item(failed("service_id or service_name is required"));
        }

        Map<String, String> parameters = Map.of("force", Boolean.toString(request.getForce()));
        for (String serviceId : serviceIds) {
            registry.markStopping(serviceId);
            healthMonitor.queueCommand(serviceId, STOP_COMMAND, parameters);
        }

        if (processController.descriptor(name).isEmpty()) {
            return Uni.createFrom().item(
                succeeded("Stop command queued for " + serviceIds.size() + " instance(s) of " + name));
        }

        Duration gracePeriod = request.hasGracePeriod()
            ? ProtoConversions.toDuration(request.getGracePeriod())
            : config.stopGracePeriod();
        return processController.stop(name, request.getForce(), gracePeriod)
            .onItem().transform(v -> succeeded("Service " + name + " stopped"))
            .onFailure(ProcessStopException.class).recoverWithItem(error -> failed(error.getMessage()))
            .onFailure().recoverWithItem(error -> {
                LOG.errorf(error, "Failed to stop %s", name);
                return failed("Failed to stop " + name + ": " + error.getMessage());
            });
    }

    /**
     * Queue a command for delivery on the worker's next heartbeat
     */
    public Uni<SendCommandResponse> sendCommand(SendCommandRequest request) {
        if (request.getCommand().isBlank()) {
            return Uni.createFrom().item(SendCommandResponse.newBuilder()
                .setSuccess(false)
                .setMessage("command is required")
                .build());
        }
        return Uni.createFrom().item(() -> healthMonitor
            .queueCommand(request.getServiceId(), request.getCommand(), request.getParametersMap())
            .map(queued -> SendCommandResponse.newBuilder()
                .setSuccess(true)
                .setMessage("Command queued")
                .setCommandId(queued.commandId())
                .build())
            .orElseGet(() -> SendCommandResponse.newBuilder()
                .setSuccess(false)
                .setMessage("Service not found: " + request.getServiceId())
                .build()));
    }

    /**
     * Launch every enabled service in dependency order. Before each launch, wait (bounded by
     * the registration timeout) for its dependencies to become operational.
     */
    public Uni<Void> startConfiguredServices() {
        List<String> order = processController.startupOrder();
        LOG.infof("Starting services in order: %s", order);
        return Multi.createFrom().iterable(order)
            .onItem().transformToUniAndConcatenate(this::startWhenDependenciesReady)
            .collect().last()
            .replaceWithVoid();
    }

    private Uni<Void> startWhenDependenciesReady(String name) {
        ServiceDescriptor descriptor = processController.descriptor(name).orElseThrow();
        List<String> dependencies = descriptor.dependencies();
        Uni<Boolean> ready = dependencies.isEmpty()
            ? Uni.createFrom().item(true)
            : waitUntil(() -> dependencies.stream().allMatch(registry::isServiceOperational),
                clock.instant().plus(config.registrationTimeout()), INITIAL_POLL_DELAY);

        return ready.onItem().transform(dependenciesReady -> {
                if (!dependenciesReady) {
                    LOG.warnf("Dependencies %s of %s are not operational yet, starting it anyway", dependencies, name);
                }
                if (processController.isRunning(name)) {
                    return null;
                }
                try {
                    processController.start(name);
                } catch (ProcessStartException e) {
                    LOG.errorf("Failed to start %s: %s", name, e.getMessage());
                }
                return null;
            })
            .replaceWithVoid();
    }

    private Uni<ServiceOperationResponse> awaitRegistration(String name) {
        Duration timeout = config.registrationTimeout();
        Instant deadline = clock.instant().plus(timeout);
        return waitUntil(() -> registry.isRegistered(name) || !processController.isRunning(name), deadline, INITIAL_POLL_DELAY)
            .onItem().transformToUni(done -> {
                if (registry.isRegistered(name)) {
                    return Uni.createFrom().item(succeeded("Service " + name + " started and registered"));
                }
                if (!processController.isRunning(name)) {
                    return Uni.createFrom().item(failed("Service " + name + " exited before registering"));
                }
                LOG.warnf("Service %s did not register within %s, stopping it", name, timeout);
                return processController.stop(name, false, config.stopGracePeriod())
                    .onFailure().invoke(error -> LOG.warnf("Stopping unregistered service %s: %s", name, error.getMessage()))
                    .onFailure().recoverWithNull()
                    .replaceWith(failed("Service " + name + " did not register within " + timeout));
            });
    }

    /**
     * Poll {@code condition} with a growing delay until it holds or the deadline passes
     * @return whether the condition held
     */
    Uni<Boolean> waitUntil(BooleanSupplier condition, Instant deadline, Duration delay) {
        return Uni.createFrom().deferred(() -> {
            if (condition.getAsBoolean()) {
                return Uni.createFrom().item(true);
            }
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                return Uni.createFrom().item(false);
            }
            Duration wait = delay.compareTo(remaining) < 0 ? delay : remaining;
            Duration next = Duration.ofMillis(Math.min((long) (delay.toMillis() * POLL_BACKOFF_FACTOR), MAX_POLL_DELAY.toMillis()));
            return Uni.createFrom().voidItem()
                .onItem().delayIt().by(wait)
                .onItem().transformToUni(v -> waitUntil(condition, deadline, next));
        });
    }

    private static ServiceOperationResponse succeeded(String message) {
        return ServiceOperationResponse.newBuilder().setSuccess(true).setMessage(message).build();
    }

    private static ServiceOperationResponse failed(String message) {
        return ServiceOperationResponse.newBuilder().setSuccess(false).setMessage(message).build();
    }
}
