package ai.pipestream.supervisor.startup;

import ai.pipestream.supervisor.config.SupervisorConfig;
import ai.pipestream.supervisor.events.SupervisorEventsProducer;
import ai.pipestream.supervisor.handlers.ServiceLifecycleHandler;
import ai.pipestream.supervisor.health.HealthMonitor;
import ai.pipestream.supervisor.process.ProcessController;
import ai.pipestream.supervisor.process.ProcessEnvironment;
import ai.pipestream.supervisor.readiness.ReadinessManager;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Starts the background loops and, unless disabled, the configured services.
 * On shutdown every child process is stopped before the loops are torn down.
 */
@ApplicationScoped
public class SupervisorStartup {

    private static final Logger LOG = Logger.getLogger(SupervisorStartup.class);

    @Inject
    SupervisorConfig config;

    @Inject
    HealthMonitor healthMonitor;

    @Inject
    ReadinessManager readinessManager;

    @Inject
    ProcessController processController;

    @Inject
    ProcessEnvironment processEnvironment;

    @Inject
    ServiceLifecycleHandler lifecycleHandler;

    @Inject
    SupervisorEventsProducer eventsProducer;

    @ConfigProperty(name = "quarkus.application.name", defaultValue = "platform-supervisor")
    String applicationName;

    void onStart(@Observes StartupEvent ev) {
        LOG.infof("Starting %s for instance group %s", applicationName, processEnvironment.instanceGroupId());

        readinessManager.addSystemReadyCallback(() -> readinessManager.readyTimestamp()
            .ifPresent(readyAt -> eventsProducer.emitSystemReady(processEnvironment.instanceGroupId(), readyAt)));
        readinessManager.addSystemReadyCallback(() -> LOG.infof("Platform is ready, %s accepting traffic", applicationName));

        healthMonitor.start();
        readinessManager.start();

        if (!config.autostart()) {
            LOG.info("Service autostart disabled");
            return;
        }
        lifecycleHandler.startConfiguredServices()
            .subscribe().with(
                done -> LOG.info("All configured services launched"),
                throwable -> LOG.error("Launching configured services failed", throwable)
            );
    }

    void onStop(@Observes ShutdownEvent ev) {
        Duration grace = config.stopGracePeriod();
        LOG.infof("Shutting down, stopping services (grace period %s)", grace);
        try {
            processController.stopAll(grace)
                .await().atMost(grace.plusSeconds(10));
        } catch (RuntimeException e) {
            LOG.error("Failed to stop all services cleanly", e);
        }
        readinessManager.stop();
        healthMonitor.stop();
    }
}
