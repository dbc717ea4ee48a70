package ai.pipestream.supervisor.logs;

import ai.pipestream.supervisor.entity.ServiceLogEntry;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ServiceLogStoreTest {

    @Test
    void recent_returnsNewestEntriesForService_oldestFirst() {
        ServiceLogStore store = new ServiceLogStore(100);
        for (int i = 0; i < 5; i++) {
            store.append(entry("svc-1", "line " + i), "core");
            store.append(entry("svc-2", "other " + i), "security");
        }

        List<String> messages = store.recent("svc-1", 3).stream()
            .map(ServiceLogEntry::message)
            .collect(Collectors.toList());

        assertEquals(List.of("line 2", "line 3", "line 4"), messages);
    }

    @Test
    void append_beyondCapacity_evictsOldest() {
        ServiceLogStore store = new ServiceLogStore(3);
        for (int i = 0; i < 5; i++) {
            store.append(entry("svc-1", "line " + i), null);
        }

        assertEquals(3, store.size());
        assertEquals("line 2", store.recent("svc-1", 10).get(0).message());
    }

    @Test
    void recent_unknownServiceOrZeroLimit_isEmpty() {
        ServiceLogStore store = new ServiceLogStore(10);
        store.append(entry("svc-1", "hello"), "core");

        assertTrue(store.recent("svc-9", 10).isEmpty());
        assertTrue(store.recent("svc-1", 0).isEmpty());
    }

    @Test
    void toLevel_mapsWorkerLevels() {
        assertEquals(Logger.Level.WARN, ServiceLogStore.toLevel("warn"));
        assertEquals(Logger.Level.ERROR, ServiceLogStore.toLevel("ERROR"));
        assertEquals(Logger.Level.INFO, ServiceLogStore.toLevel("verbose"));
        assertEquals(Logger.Level.INFO, ServiceLogStore.toLevel(null));
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ServiceLogStore(0));
    }

    private static ServiceLogEntry entry(String serviceId, String message) {
        return new ServiceLogEntry(serviceId, Instant.now(), "INFO", message, Map.of("k", "v"));
    }
}
