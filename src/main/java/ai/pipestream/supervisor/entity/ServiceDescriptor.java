package ai.pipestream.supervisor.entity;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Declared identity of a configured service. Built once from configuration at startup.
 *
 * @param name          unique service name, also the name the worker registers with
 * @param executable    path of the binary to launch
 * @param args          argument template, before port-offset rewriting
 * @param environment   service specific environment variables
 * @param grpcPort      internal gRPC port, subject to the instance port offset
 * @param externalPort  operator-declared external port, never offset
 * @param restApiPort   REST API port, never offset
 * @param dependencies  names of services that must be started first
 * @param required      whether system readiness waits for this service
 * @param enabled       whether the service is launched and considered at all
 * @param config        initial configuration handed to the worker on registration
 * @param restartPolicy behaviour on unrequested process exit
 * @param maxRestarts   restart budget for {@link RestartPolicy#ON_FAILURE}
 */
public record ServiceDescriptor(
        String name,
        String executable,
        List<String> args,
        Map<String, String> environment,
        OptionalInt grpcPort,
        OptionalInt externalPort,
        OptionalInt restApiPort,
        List<String> dependencies,
        boolean required,
        boolean enabled,
        Map<String, String> config,
        RestartPolicy restartPolicy,
        int maxRestarts) {

    public ServiceDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(executable, "executable");
        args = List.copyOf(args);
        environment = Map.copyOf(environment);
        dependencies = List.copyOf(dependencies);
        config = Map.copyOf(config);
        restartPolicy = restartPolicy == null ? RestartPolicy.NEVER : restartPolicy;
    }

    /**
     * Minimal descriptor with no ports, dependencies or restarts.
     */
    public static ServiceDescriptor of(String name, String executable, List<String> args,
                                       boolean required, boolean enabled) {
        return new ServiceDescriptor(name, executable, args, Map.of(),
                OptionalInt.empty(), OptionalInt.empty(), OptionalInt.empty(),
                List.of(), required, enabled, Map.of(), RestartPolicy.NEVER, 0);
    }
}
