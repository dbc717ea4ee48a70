package ai.pipestream.supervisor.process;

import ai.pipestream.supervisor.entity.RestartPolicy;
import ai.pipestream.supervisor.entity.ServiceDescriptor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ProcessControllerTest {

    private static final PortOffsetRewriter NO_OFFSET = new PortOffsetRewriter(0);
    private static final ProcessEnvironment ENVIRONMENT = ProcessEnvironment.resolve(
        ProcessEnvironment.PassthroughSettings.none(), name -> null, NO_OFFSET);

    @Test
    void startupOrder_placesDependenciesFirst() {
        ProcessController controller = controller(
            withDependencies("gateway", "core", "security"),
            withDependencies("core", "security"),
            withDependencies("security"),
            withDependencies("analytics", "core"));

        List<String> order = controller.startupOrder();

        assertEquals(4, order.size());
        assertTrue(order.indexOf("security") < order.indexOf("core"));
        assertTrue(order.indexOf("core") < order.indexOf("gateway"));
        assertTrue(order.indexOf("core") < order.indexOf("analytics"));
    }

    @Test
    void startupOrder_toleratesCycles() {
        ProcessController controller = controller(
            withDependencies("a", "b"),
            withDependencies("b", "a"),
            withDependencies("c"));

        List<String> order = controller.startupOrder();

        assertEquals(3, order.size());
        assertTrue(order.containsAll(List.of("a", "b", "c")));
    }

    @Test
    void startupOrder_skipsDisabledAndUnknown() {
        ProcessController controller = controller(
            withDependencies("core", "missing"),
            ServiceDescriptor.of("off", "sleep", List.of("60"), true, false));

        assertEquals(List.of("core"), controller.startupOrder());
    }

    @Test
    void start_unknownService_fails() {
        ProcessController controller = controller(withDependencies("core"));

        ProcessStartException error = assertThrows(ProcessStartException.class, () -> controller.start("nope"));
        assertTrue(error.getMessage().contains("not configured"));
    }

    @Test
    void start_disabledService_fails() {
        ProcessController controller = controller(ServiceDescriptor.of("off", "sleep", List.of("60"), true, false));

        assertThrows(ProcessStartException.class, () -> controller.start("off"));
        assertFalse(controller.isRunning("off"));
    }

    @Test
    void stop_unknownService_fails() {
        ProcessController controller = controller(withDependencies("core"));

        assertThrows(IllegalArgumentException.class,
            () -> controller.stop("nope", false, Duration.ofSeconds(1)).await().atMost(Duration.ofSeconds(1)));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void stopAll_stopsEveryRunningProcess() {
        ProcessController controller = controller(
            ServiceDescriptor.of("one", "sleep", List.of("60"), true, true),
            ServiceDescriptor.of("two", "sleep", List.of("60"), true, true));
        controller.start("one");
        controller.start("two");

        controller.stopAll(Duration.ofSeconds(5)).await().atMost(Duration.ofSeconds(10));

        assertFalse(controller.isRunning("one"));
        assertFalse(controller.isRunning("two"));
    }

    private static ProcessController controller(ServiceDescriptor... descriptors) {
        return new ProcessController(List.of(descriptors), NO_OFFSET, ENVIRONMENT);
    }

    private static ServiceDescriptor withDependencies(String name, String... dependencies) {
        return new ServiceDescriptor(name, "sleep", List.of("60"), Map.of(),
            OptionalInt.empty(), OptionalInt.empty(), OptionalInt.empty(), List.of(dependencies),
            true, true, Map.of(), RestartPolicy.NEVER, 0);
    }
}
