package ai.pipestream.supervisor.process;

import ai.pipestream.supervisor.entity.RestartPolicy;
import ai.pipestream.supervisor.entity.ServiceDescriptor;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ProcessEnvironmentTest {

    private static final PortOffsetRewriter OFFSET = new PortOffsetRewriter(100);

    @Test
    void resolve_prefersConfiguredValues_overEnvironment() {
        ProcessEnvironment.PassthroughSettings settings = new ProcessEnvironment.PassthroughSettings(
            Optional.of("platform"), Optional.empty(), Optional.of("file"), Optional.empty(), Optional.empty());
        Map<String, String> env = Map.of(
            ProcessEnvironment.DATABASE_NAME, "ignored",
            ProcessEnvironment.DATABASE_USER, "admin");

        ProcessEnvironment environment = ProcessEnvironment.resolve(settings, env::get, OFFSET);

        assertEquals("platform", environment.passthrough().get(ProcessEnvironment.DATABASE_NAME));
        assertEquals("admin", environment.passthrough().get(ProcessEnvironment.DATABASE_USER));
        assertEquals("file", environment.passthrough().get(ProcessEnvironment.KEYRING_BACKEND));
        assertFalse(environment.passthrough().containsKey(ProcessEnvironment.KEYRING_PATH));
        assertEquals("default", environment.instanceGroupId());
        assertEquals("100", environment.passthrough().get(ProcessEnvironment.PORT_OFFSET));
    }

    @Test
    void resolve_nonDefaultGroup_suffixesKeyringPath() {
        ProcessEnvironment.PassthroughSettings settings = new ProcessEnvironment.PassthroughSettings(
            Optional.empty(), Optional.empty(), Optional.empty(), Optional.of("/var/lib/keyring"), Optional.of("blue"));

        ProcessEnvironment environment = ProcessEnvironment.resolve(settings, name -> null, OFFSET);

        assertEquals("blue", environment.instanceGroupId());
        assertEquals("/var/lib/keyring-blue", environment.passthrough().get(ProcessEnvironment.KEYRING_PATH));
    }

    @Test
    void resolve_groupFromEnvironment_whenNotConfigured() {
        ProcessEnvironment environment = ProcessEnvironment.resolve(ProcessEnvironment.PassthroughSettings.none(),
            Map.of(ProcessEnvironment.INSTANCE_GROUP_ID, "green")::get, OFFSET);

        assertEquals("green", environment.instanceGroupId());
    }

    @Test
    void applyTo_offsetsGrpcPort_butNotExternalPorts() {
        ServiceDescriptor descriptor = new ServiceDescriptor("core", "core-bin", List.of(),
            Map.of("CORE_MODE", "fast"),
            OptionalInt.of(50051), OptionalInt.of(8080), OptionalInt.of(8081),
            List.of(), true, true, Map.of(), RestartPolicy.NEVER, 0);
        ProcessEnvironment environment = ProcessEnvironment.resolve(ProcessEnvironment.PassthroughSettings.none(),
            name -> null, OFFSET);
        Map<String, String> target = new HashMap<>(Map.of("PATH", "/usr/bin"));

        environment.applyTo(target, descriptor);

        assertEquals("/usr/bin", target.get("PATH"));
        assertEquals("fast", target.get("CORE_MODE"));
        assertEquals("50151", target.get(ProcessEnvironment.GRPC_PORT));
        assertEquals("8080", target.get(ProcessEnvironment.EXTERNAL_PORT));
        assertEquals("8081", target.get(ProcessEnvironment.REST_API_PORT));
        assertEquals("default", target.get(ProcessEnvironment.INSTANCE_GROUP_ID));
    }
}
