package ai.pipestream.supervisor.entity;

import java.time.Instant;
import java.util.Map;

/**
 * A log line shipped by a worker over the log stream.
 */
public record ServiceLogEntry(String serviceId, Instant timestamp, String level, String message,
                              Map<String, String> fields) {

    public ServiceLogEntry {
        fields = Map.copyOf(fields);
    }
}
