package ai.pipestream.supervisor.config;

import ai.pipestream.supervisor.entity.RestartPolicy;
import ai.pipestream.supervisor.entity.ServiceDescriptor;
import ai.pipestream.supervisor.process.ProcessController;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
class SupervisorConfigTest {

    @Inject
    SupervisorConfig config;

    @Inject
    ProcessController processController;

    @Test
    void testProfile_overridesIntervals() {
        assertEquals(Duration.ofSeconds(1), config.healthCheckInterval());
        assertEquals(Duration.ofSeconds(3), config.heartbeatTimeout());
        assertEquals(Duration.ofMillis(200), config.readiness().pollInterval());
        assertEquals(Duration.ofSeconds(20), config.readiness().logInterval());
        assertFalse(config.autostart());
        assertEquals(0, config.instanceGroup().portOffset());
    }

    @Test
    void bufferSizes_keepTheirDefaults() {
        assertEquals(100, config.subscriberBufferSize());
        assertEquals(10000, config.logs().maxEntries());
    }

    @Test
    void services_areBuiltIntoDescriptors() {
        ServiceDescriptor sleeper = processController.descriptor("sleeper").orElseThrow();

        assertEquals("sleep", sleeper.executable());
        assertEquals(List.of("60"), sleeper.args());
        assertEquals("hello", sleeper.config().get("greeting"));
        assertFalse(sleeper.required());
        assertTrue(sleeper.enabled());
        assertEquals(RestartPolicy.NEVER, sleeper.restartPolicy());
        assertTrue(sleeper.dependencies().isEmpty());

        ServiceDescriptor disabled = processController.descriptor("disabled-worker").orElseThrow();
        assertFalse(disabled.enabled());
        assertTrue(disabled.required());
    }

    @Test
    void startupOrder_excludesDisabledServices() {
        assertEquals(List.of("sleeper"), processController.startupOrder());
    }
}
