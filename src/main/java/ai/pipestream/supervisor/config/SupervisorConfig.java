package ai.pipestream.supervisor.config;

import ai.pipestream.supervisor.entity.RestartPolicy;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Supervisor settings, bound from {@code supervisor.*}.
 */
@ConfigMapping(prefix = "supervisor")
public interface SupervisorConfig {

    /**
     * How often the health sweep looks for silent services
     */
    @WithDefault("10s")
    Duration healthCheckInterval();

    /**
     * Silence after which a service is marked unhealthy. Must be longer than the check interval.
     */
    @WithDefault("30s")
    Duration heartbeatTimeout();

    /**
     * Capacity of each WatchServiceHealth subscriber channel
     */
    @WithDefault("100")
    int subscriberBufferSize();

    /**
     * Default grace period for stopping a process
     */
    @WithDefault("30s")
    Duration stopGracePeriod();

    /**
     * How long StartService waits for the worker to register
     */
    @WithDefault("60s")
    Duration registrationTimeout();

    /**
     * Launch every enabled service at startup
     */
    @WithDefault("true")
    boolean autostart();

    /**
     * Flags whose port is shifted by the instance port offset. Defaults to the built-in set.
     */
    Optional<Set<String>> internalPortFlags();

    Readiness readiness();

    Database database();

    Keyring keyring();

    InstanceGroup instanceGroup();

    Logs logs();

    /**
     * Configured services, keyed by name
     */
    Map<String, ServiceConfig> services();

    interface Readiness {

        @WithDefault("2s")
        Duration pollInterval();

        /**
         * Minimum gap between two "not ready yet" log lines
         */
        @WithDefault("20s")
        Duration logInterval();
    }

    interface Database {

        Optional<String> name();

        Optional<String> user();
    }

    interface Keyring {

        Optional<String> backend();

        Optional<String> path();
    }

    interface InstanceGroup {

        Optional<String> groupId();

        @WithDefault("0")
        int portOffset();
    }

    interface Logs {

        @WithDefault("10000")
        int maxEntries();
    }

    interface ServiceConfig {

        String executable();

        Optional<List<String>> args();

        Map<String, String> environment();

        OptionalInt grpcPort();

        OptionalInt externalPort();

        OptionalInt restApiPort();

        Optional<List<String>> dependencies();

        @WithDefault("true")
        boolean required();

        @WithDefault("true")
        boolean enabled();

        /**
         * Initial configuration returned to the worker when it registers
         */
        Map<String, String> config();

        @WithDefault("never")
        RestartPolicy restartPolicy();

        @WithDefault("3")
        int maxRestarts();
    }
}
