package ai.pipestream.supervisor.process;

/**
 * Raised when a process had to be killed because it ignored the termination signal.
 */
public class ProcessStopException extends RuntimeException {

    public ProcessStopException(String message) {
        super(message);
    }
}
