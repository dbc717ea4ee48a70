package ai.pipestream.supervisor.registry;

import ai.pipestream.supervisor.MutableClock;
import ai.pipestream.supervisor.entity.HealthStatus;
import ai.pipestream.supervisor.entity.RestartPolicy;
import ai.pipestream.supervisor.entity.ServiceDescriptor;
import ai.pipestream.supervisor.entity.ServiceMetricsSnapshot;
import ai.pipestream.supervisor.entity.ServiceState;
import ai.pipestream.supervisor.entity.ServiceStatusSnapshot;
import ai.pipestream.supervisor.health.HealthUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ServiceRegistryTest {

    private MutableClock clock;
    private ServiceRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        ServiceDescriptor security = new ServiceDescriptor("security", "security-bin", List.of(), Map.of("SEC_MODE", "strict"),
            OptionalInt.empty(), OptionalInt.empty(), OptionalInt.empty(), List.of(),
            true, true, Map.of("auth.issuer", "platform"), RestartPolicy.NEVER, 0);
        registry = new ServiceRegistry(List.of(
            security,
            ServiceDescriptor.of("core", "core-bin", List.of(), true, true),
            ServiceDescriptor.of("analytics", "analytics-bin", List.of(), false, true),
            ServiceDescriptor.of("legacy", "legacy-bin", List.of(), true, false)
        ), "blue", 1000, clock);
    }

    @Test
    void register_assignsFreshId_inStarting() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 20; i++) {
            Registration registration = registry.register(worker("core", ""), List.of());
            assertFalse(registration.serviceId().isEmpty());
            assertTrue(ids.add(registration.serviceId()), "identifier reused");

            ServiceStatusSnapshot status = registry.status(registration.serviceId()).orElseThrow();
            assertEquals(HealthStatus.STARTING, status.health());
            assertEquals(ServiceState.STARTING, status.state());
        }
    }

    @Test
    void register_configuredService_returnsInitialConfig() {
        Registration registration = registry.register(worker("security", "sec-1"), List.of("auth"));

        Registration.InitialConfig initial = registration.initialConfig().orElseThrow();
        assertEquals("platform", initial.config().get("auth.issuer"));
        assertEquals("blue", initial.config().get("instance_group.group_id"));
        assertEquals("1000", initial.config().get("instance_group.port_offset"));
        assertEquals("strict", initial.environment().get("SEC_MODE"));
        assertEquals(List.of("auth"), registry.status(registration.serviceId()).orElseThrow().capabilities());
    }

    @Test
    void register_unconfiguredService_hasNoInitialConfig() {
        Registration registration = registry.register(worker("adhoc", ""), List.of());

        assertTrue(registration.initialConfig().isEmpty());
    }

    @Test
    void register_blankName_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(worker(" ", ""), List.of()));
    }

    @Test
    void register_sameInstanceAgain_replacesStaleRecord() {
        Registration first = registry.register(worker("core", "core-1"), List.of());
        clock.advance(Duration.ofSeconds(1));
        Registration second = registry.register(worker("core", "core-1"), List.of());

        assertNotEquals(first.serviceId(), second.serviceId());
        assertEquals(List.of(first.serviceId()), second.replacedServiceIds());
        assertTrue(registry.status(first.serviceId()).isEmpty());
        assertEquals(List.of(second.serviceId()), registry.findIdsByName("core"));
    }

    @Test
    void unregister_unknownId_throws() {
        ServiceNotFoundException error = assertThrows(ServiceNotFoundException.class, () -> registry.unregister("missing"));
        assertEquals("missing", error.getServiceId());
    }

    @Test
    void unregister_returnsStoppedSnapshot_andRemoves() {
        Registration registration = registry.register(worker("core", ""), List.of());

        ServiceStatusSnapshot removed = registry.unregister(registration.serviceId());

        assertEquals(HealthStatus.STOPPED, removed.health());
        assertEquals(ServiceState.STOPPED, removed.state());
        assertTrue(registry.status(registration.serviceId()).isEmpty());
    }

    @Test
    void updateHeartbeat_healthy_movesToRunning_andStampsLastHealthy() {
        Registration registration = registry.register(worker("core", ""), List.of());
        clock.advance(Duration.ofSeconds(5));

        ServiceStatusSnapshot status = registry.updateHeartbeat(registration.serviceId(), HealthStatus.HEALTHY,
            new ServiceMetricsSnapshot(12.5, 1024, 10, 0, Map.of("queue", "3")));

        assertEquals(ServiceState.RUNNING, status.state());
        assertEquals(HealthStatus.HEALTHY, status.health());
        assertEquals(clock.instant(), status.lastHealthy());
        assertEquals(clock.instant(), status.lastUpdate());
        assertEquals("3", status.metrics().custom().get("queue"));
    }

    @Test
    void updateHeartbeat_unknownId_throws() {
        assertThrows(ServiceNotFoundException.class,
            () -> registry.updateHeartbeat("missing", HealthStatus.HEALTHY, ServiceMetricsSnapshot.EMPTY));
    }

    @Test
    void updateHeartbeat_lifecycleOnlyStatus_isRejected() {
        Registration registration = registry.register(worker("core", ""), List.of());
        registry.updateHeartbeat(registration.serviceId(), HealthStatus.HEALTHY, ServiceMetricsSnapshot.EMPTY);

        assertThrows(IllegalArgumentException.class,
            () -> registry.updateHeartbeat(registration.serviceId(), HealthStatus.STOPPED, ServiceMetricsSnapshot.EMPTY));
        assertThrows(IllegalArgumentException.class,
            () -> registry.updateHeartbeat(registration.serviceId(), HealthStatus.STARTING, ServiceMetricsSnapshot.EMPTY));
        assertEquals(HealthStatus.HEALTHY, registry.status(registration.serviceId()).orElseThrow().health());
    }

    @Test
    void list_filtersByStateAndNamePattern() {
        Registration core = registry.register(worker("core", ""), List.of());
        registry.register(worker("core-indexer", ""), List.of());
        registry.register(worker("security", ""), List.of());
        registry.updateHeartbeat(core.serviceId(), HealthStatus.HEALTHY, ServiceMetricsSnapshot.EMPTY);

        assertEquals(3, registry.list(null, "").size());
        assertEquals(3, registry.list(null, "*").size());
        assertEquals(List.of("core", "core-indexer"), names(registry.list(null, "core*")));
        assertEquals(List.of("core-indexer"), names(registry.list(null, "*index*")));
        assertEquals(List.of("core"), names(registry.list(ServiceState.RUNNING, "core*")));
        assertEquals(List.of("core-indexer"), names(registry.list(ServiceState.STARTING, "core*")));
        assertTrue(registry.list(null, "co.e").isEmpty());
    }

    @Test
    void areAllConfiguredServicesHealthy_requiresEveryRequiredEnabledService() {
        assertFalse(registry.areAllConfiguredServicesHealthy(), "nothing registered yet");

        Registration security = registry.register(worker("security", ""), List.of());
        Registration core = registry.register(worker("core", ""), List.of());
        registry.updateHeartbeat(security.serviceId(), HealthStatus.HEALTHY, ServiceMetricsSnapshot.EMPTY);
        assertFalse(registry.areAllConfiguredServicesHealthy(), "core still starting");

        registry.updateHeartbeat(core.serviceId(), HealthStatus.DEGRADED, ServiceMetricsSnapshot.EMPTY);
        assertTrue(registry.areAllConfiguredServicesHealthy(), "optional and disabled services do not count");
    }

    @Test
    void configuredServiceStatus_describesEachService() {
        Registration core = registry.register(worker("core", ""), List.of());
        registry.updateHeartbeat(core.serviceId(), HealthStatus.UNHEALTHY, ServiceMetricsSnapshot.EMPTY);

        Map<String, String> status = registry.configuredServiceStatus();

        assertEquals("not started (required)", status.get("security"));
        assertEquals("not started (optional)", status.get("analytics"));
        assertEquals("disabled", status.get("legacy"));
        assertTrue(status.get("core").startsWith("unhealthy"));
    }

    @Test
    void onHealthChanged_appliesMonitorTransitions_butIgnoresStopped() {
        Registration core = registry.register(worker("core", ""), List.of());

        registry.onHealthChanged(new HealthUpdate(core.serviceId(), "core", HealthStatus.STARTING,
            HealthStatus.UNHEALTHY, clock.instant()));
        assertEquals(HealthStatus.UNHEALTHY, registry.status(core.serviceId()).orElseThrow().health());

        registry.onHealthChanged(new HealthUpdate(core.serviceId(), "core", HealthStatus.UNHEALTHY,
            HealthStatus.STOPPED, clock.instant()));
        assertEquals(HealthStatus.UNHEALTHY, registry.status(core.serviceId()).orElseThrow().health());
    }

    @Test
    void isServiceOperational_followsNewestRegistration() {
        Registration old = registry.register(worker("core", "a"), List.of());
        registry.updateHeartbeat(old.serviceId(), HealthStatus.HEALTHY, ServiceMetricsSnapshot.EMPTY);
        assertTrue(registry.isServiceOperational("core"));

        clock.advance(Duration.ofSeconds(1));
        registry.register(worker("core", "b"), List.of());

        assertFalse(registry.isServiceOperational("core"));
        assertTrue(registry.isRegistered("core"));
        assertFalse(registry.isRegistered("gateway"));
    }

    private static WorkerIdentity worker(String name, String instanceId) {
        return new WorkerIdentity(name, instanceId, "1.0.0", "localhost", 50051);
    }

    private static List<String> names(List<ServiceStatusSnapshot> services) {
        return services.stream().map(ServiceStatusSnapshot::serviceName).collect(Collectors.toList());
    }
}
