package ai.pipestream.supervisor.entity;

/**
 * What the process controller does when a child process exits on its own.
 */
public enum RestartPolicy {
    /** Observe the exit, take no action */
    NEVER,
    /** Relaunch with exponential backoff after a non-zero exit */
    ON_FAILURE
}
