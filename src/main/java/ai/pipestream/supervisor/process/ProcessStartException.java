package ai.pipestream.supervisor.process;

/**
 * Raised when a service process cannot be launched. No process handle is kept.
 */
public class ProcessStartException extends RuntimeException {

    public ProcessStartException(String message) {
        super(message);
    }

    public ProcessStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
