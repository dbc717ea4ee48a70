package ai.pipestream.supervisor.registry;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a successful registration.
 *
 * @param serviceId          the generated identifier
 * @param serviceName        the registered name
 * @param replacedServiceIds stale registrations of the same instance that were dropped
 * @param initialConfig      configuration the worker should adopt, absent for unconfigured services
 */
public record Registration(String serviceId, String serviceName, List<String> replacedServiceIds,
                           Optional<InitialConfig> initialConfig) {

    public Registration {
        replacedServiceIds = List.copyOf(replacedServiceIds);
    }

    /**
     * Configuration payload returned to the worker
     */
    public record InitialConfig(Map<String, String> config, Map<String, String> environment) {

        public InitialConfig {
            config = Map.copyOf(config);
            environment = Map.copyOf(environment);
        }
    }
}
