package ai.pipestream.supervisor.entity;

/**
 * Lifecycle state of a registered service
 */
public enum ServiceState {
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED
}
