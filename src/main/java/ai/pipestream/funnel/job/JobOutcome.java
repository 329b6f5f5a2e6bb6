package ai.pipestream.funnel.job;

/**
 * Terminal state of a job.
 */
public enum JobOutcome {
    SUCCEEDED,
    /** Rejected by the server or failed locally in a way a retry cannot fix. */
    FAILED,
    /** Every allowed attempt hit a transient failure. */
    RETRIES_EXHAUSTED
}
