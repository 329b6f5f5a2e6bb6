package ai.pipestream.funnel.job;

import java.util.Objects;

/**
 * Result of a single attempt of a job.
 */
public record AttemptResult(Status status, Exception cause) {

    public enum Status {
        SUCCEEDED,
        TRANSIENT,
        REJECTED
    }

    private static final AttemptResult SUCCESS = new AttemptResult(Status.SUCCEEDED, null);

    public AttemptResult {
        Objects.requireNonNull(status, "status must not be null");
    }

    public static AttemptResult succeeded() {
        return SUCCESS;
    }

    public static AttemptResult transientFailure(Exception cause) {
        return new AttemptResult(Status.TRANSIENT, cause);
    }

    public static AttemptResult rejected(Exception cause) {
        return new AttemptResult(Status.REJECTED, cause);
    }

    public String describeCause() {
        return cause == null ? "unknown" : cause.getMessage();
    }
}
