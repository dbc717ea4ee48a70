package ai.pipestream.supervisor.health;

import ai.pipestream.supervisor.readiness.ReadinessManager;
import ai.pipestream.supervisor.registry.ServiceRegistry;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SystemReadinessHealthCheckTest {

    private SystemReadinessHealthCheck healthCheck;
    private ReadinessManager readinessManager;
    private ServiceRegistry serviceRegistry;

    @BeforeEach
    void setUp() {
        readinessManager = mock(ReadinessManager.class);
        serviceRegistry = mock(ServiceRegistry.class);
        healthCheck = new SystemReadinessHealthCheck();
        healthCheck.readinessManager = readinessManager;
        healthCheck.serviceRegistry = serviceRegistry;

        Map<String, String> status = new LinkedHashMap<>();
        status.put("core", "healthy");
        status.put("security", "not started (required)");
        when(serviceRegistry.configuredServiceStatus()).thenReturn(status);
    }

    @Test
    void call_notReady_isDown_withPerServiceData() {
        when(readinessManager.isSystemReady()).thenReturn(false);

        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertEquals("platform-services", response.getName());
        Map<String, Object> data = response.getData().orElseThrow();
        assertEquals("healthy", data.get("core"));
        assertEquals("not started (required)", data.get("security"));
        assertFalse(data.containsKey("ready-since"));
    }

    @Test
    void call_ready_isUp_withReadySince() {
        Instant readyAt = Instant.parse("2024-01-01T00:00:05Z");
        when(readinessManager.isSystemReady()).thenReturn(true);
        when(readinessManager.readyTimestamp()).thenReturn(Optional.of(readyAt));

        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals(readyAt.toString(), response.getData().orElseThrow().get("ready-since"));
    }
}
