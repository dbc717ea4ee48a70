package ai.pipestream.supervisor.registry;

/**
 * What a worker says about itself when it registers.
 */
public record WorkerIdentity(String name, String instanceId, String version, String host, int port) {
}
