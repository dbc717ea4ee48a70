package ai.pipestream.supervisor.config;

import ai.pipestream.supervisor.entity.ServiceDescriptor;
import ai.pipestream.supervisor.events.SupervisorEventsProducer;
import ai.pipestream.supervisor.health.HealthMonitor;
import ai.pipestream.supervisor.logs.ServiceLogStore;
import ai.pipestream.supervisor.process.PortOffsetRewriter;
import ai.pipestream.supervisor.process.ProcessController;
import ai.pipestream.supervisor.process.ProcessEnvironment;
import ai.pipestream.supervisor.readiness.ReadinessManager;
import ai.pipestream.supervisor.registry.ServiceRegistry;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the supervisor core from configuration.
 * The core classes are plain Java so they can be constructed directly in tests.
 */
@ApplicationScoped
public class SupervisorComponentsProducer {

    private static final Logger LOG = Logger.getLogger(SupervisorComponentsProducer.class);

    @Inject
    SupervisorConfig config;

    @Inject
    SupervisorEventsProducer eventsProducer;

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public PortOffsetRewriter portOffsetRewriter() {
        int offset = config.instanceGroup().portOffset();
        if (offset != 0) {
            LOG.infof("Applying port offset %d to internal ports", offset);
        }
        return config.internalPortFlags()
            .map(flags -> new PortOffsetRewriter(offset, flags))
            .orElseGet(() -> new PortOffsetRewriter(offset));
    }

    @Produces
    @Singleton
    public ProcessEnvironment processEnvironment(PortOffsetRewriter portOffset) {
        ProcessEnvironment.PassthroughSettings settings = new ProcessEnvironment.PassthroughSettings(
            config.database().name(),
            config.database().user(),
            config.keyring().backend(),
            config.keyring().path(),
            config.instanceGroup().groupId());
        ProcessEnvironment environment = ProcessEnvironment.resolve(settings, System::getenv, portOffset);
        LOG.infof("Instance group %s, passthrough variables: %s",
            environment.instanceGroupId(), environment.passthrough().keySet());
        return environment;
    }

    @Produces
    @Singleton
    public ProcessController processController(PortOffsetRewriter portOffset, ProcessEnvironment environment) {
        List<ServiceDescriptor> descriptors = descriptors();
        LOG.infof("Configured services: %s", descriptors.stream().map(ServiceDescriptor::name).collect(Collectors.toList()));
        return new ProcessController(descriptors, portOffset, environment);
    }

    @Produces
    @Singleton
    public ServiceRegistry serviceRegistry(ProcessEnvironment environment, PortOffsetRewriter portOffset, Clock clock) {
        return new ServiceRegistry(descriptors(), environment.instanceGroupId(), portOffset.offset(), clock);
    }

    /**
     * Registry records and lifecycle events both follow the monitor's transitions
     */
    @Produces
    @Singleton
    public HealthMonitor healthMonitor(ServiceRegistry registry, Clock clock) {
        HealthMonitor monitor = new HealthMonitor(clock, config.healthCheckInterval(), config.heartbeatTimeout(),
            config.subscriberBufferSize());
        monitor.addTransitionListener(registry);
        monitor.addTransitionListener(eventsProducer);
        return monitor;
    }

    void stopHealthMonitor(@Disposes HealthMonitor monitor) {
        monitor.stop();
    }

    @Produces
    @Singleton
    public ReadinessManager readinessManager(ServiceRegistry registry, Clock clock) {
        return new ReadinessManager(registry, config.readiness().pollInterval(), config.readiness().logInterval(),
            clock, Infrastructure.getDefaultWorkerPool());
    }

    void stopReadinessManager(@Disposes ReadinessManager manager) {
        manager.stop();
    }

    @Produces
    @Singleton
    public ServiceLogStore serviceLogStore() {
        return new ServiceLogStore(config.logs().maxEntries());
    }

    List<ServiceDescriptor> descriptors() {
        return config.services().entrySet().stream()
            .map(SupervisorComponentsProducer::toDescriptor)
            .collect(Collectors.toList());
    }

    static ServiceDescriptor toDescriptor(Map.Entry<String, SupervisorConfig.ServiceConfig> entry) {
        SupervisorConfig.ServiceConfig service = entry.getValue();
        return new ServiceDescriptor(
            entry.getKey(),
            service.executable(),
            service.args().orElse(List.of()),
            service.environment(),
            service.grpcPort(),
            service.externalPort(),
            service.restApiPort(),
            service.dependencies().orElse(List.of()),
            service.required(),
            service.enabled(),
            service.config(),
            service.restartPolicy(),
            service.maxRestarts());
    }
}
