package ai.pipestream.supervisor.entity;

import java.time.Instant;
import java.util.Map;

/**
 * Command waiting for the target service's next heartbeat.
 */
public record PendingCommand(String commandId, String command, Map<String, String> parameters, Instant issuedAt) {

    public PendingCommand {
        parameters = Map.copyOf(parameters);
    }
}
