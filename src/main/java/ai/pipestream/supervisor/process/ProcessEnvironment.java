package ai.pipestream.supervisor.process;

import ai.pipestream.supervisor.entity.ServiceDescriptor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Environment handed to every child process.
 * <p>
 * Values are layered: the inherited environment, then the descriptor's own variables,
 * then the platform passthrough set (database, keyring, instance group) and the port
 * variables. Passthrough values come from supervisor configuration and fall back to the
 * supervisor's own environment when not configured.
 */
public class ProcessEnvironment {

    public static final String DATABASE_NAME = "PLATFORM_DATABASE_NAME";
    public static final String DATABASE_USER = "PLATFORM_DATABASE_USER";
    public static final String KEYRING_BACKEND = "PLATFORM_KEYRING_BACKEND";
    public static final String KEYRING_PATH = "PLATFORM_KEYRING_PATH";
    public static final String INSTANCE_GROUP_ID = "PLATFORM_INSTANCE_GROUP_ID";
    public static final String PORT_OFFSET = "PLATFORM_PORT_OFFSET";
    public static final String GRPC_PORT = "PLATFORM_GRPC_PORT";
    public static final String EXTERNAL_PORT = "PLATFORM_EXTERNAL_PORT";
    public static final String REST_API_PORT = "PLATFORM_REST_API_PORT";

    public static final String DEFAULT_GROUP = "default";

    private final Map<String, String> passthrough;
    private final PortOffsetRewriter portOffset;

    ProcessEnvironment(Map<String, String> passthrough, PortOffsetRewriter portOffset) {
        this.passthrough = Map.copyOf(passthrough);
        this.portOffset = portOffset;
    }

    /**
     * Resolve the passthrough set once at startup.
     * @param settings Configured values, any of which may be absent
     * @param envLookup Lookup into the supervisor's own environment, usually {@code System::getenv}
     * @param portOffset The instance port offset
     */
    public static ProcessEnvironment resolve(PassthroughSettings settings,
                                             Function<String, String> envLookup,
                                             PortOffsetRewriter portOffset) {
        Map<String, String> values = new LinkedHashMap<>();
        putResolved(values, DATABASE_NAME, settings.databaseName(), envLookup);
        putResolved(values, DATABASE_USER, settings.databaseUser(), envLookup);
        putResolved(values, KEYRING_BACKEND, settings.keyringBackend(), envLookup);

        String groupId = settings.instanceGroupId()
            .filter(s -> !s.isBlank())
            .or(() -> Optional.ofNullable(envLookup.apply(INSTANCE_GROUP_ID)).filter(s -> !s.isBlank()))
            .orElse(DEFAULT_GROUP);
        values.put(INSTANCE_GROUP_ID, groupId);

        Optional<String> keyringPath = settings.keyringPath()
            .filter(s -> !s.isBlank())
            .map(path -> DEFAULT_GROUP.equals(groupId) ? path : path + "-" + groupId);
        putResolved(values, KEYRING_PATH, keyringPath, envLookup);

        values.put(PORT_OFFSET, Integer.toString(portOffset.offset()));
        return new ProcessEnvironment(values, portOffset);
    }

    /**
     * Layer the descriptor's variables and the passthrough set over {@code target}, which
     * already holds the inherited environment.
     */
    public void applyTo(Map<String, String> target, ServiceDescriptor descriptor) {
        target.putAll(descriptor.environment());
        target.putAll(passthrough);
        descriptor.grpcPort().ifPresent(port -> target.put(GRPC_PORT, Integer.toString(portOffset.applyOffset(port))));
        // External and REST ports are operator declared and stay as configured
        descriptor.externalPort().ifPresent(port -> target.put(EXTERNAL_PORT, Integer.toString(port)));
        descriptor.restApiPort().ifPresent(port -> target.put(REST_API_PORT, Integer.toString(port)));
    }

    public Map<String, String> passthrough() {
        return passthrough;
    }

    public String instanceGroupId() {
        return passthrough.get(INSTANCE_GROUP_ID);
    }

    private static void putResolved(Map<String, String> values, String variable, Optional<String> configured,
                                    Function<String, String> envLookup) {
        Optional<String> value = configured.filter(s -> !s.isBlank());
        if (value.isEmpty()) {
            value = Optional.ofNullable(envLookup.apply(variable)).filter(s -> !s.isBlank());
        }
        value.ifPresent(v -> values.put(variable, v));
    }

    /**
     * Configured passthrough values
     */
    public record PassthroughSettings(Optional<String> databaseName,
                                      Optional<String> databaseUser,
                                      Optional<String> keyringBackend,
                                      Optional<String> keyringPath,
                                      Optional<String> instanceGroupId) {

        public static PassthroughSettings none() {
            return new PassthroughSettings(Optional.empty(), Optional.empty(), Optional.empty(),
                Optional.empty(), Optional.empty());
        }
    }
}
