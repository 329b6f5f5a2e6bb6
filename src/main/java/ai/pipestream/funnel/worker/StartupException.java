package ai.pipestream.funnel.worker;

/**
 * Thrown when the worker pool cannot be brought up. Fatal for the run.
 */
public class StartupException extends RuntimeException {

    public StartupException(String message) {
        super(message);
    }

    public StartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
