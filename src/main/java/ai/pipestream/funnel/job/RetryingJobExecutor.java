package ai.pipestream.funnel.job;

import ai.pipestream.funnel.worker.Toolbox;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Runs a job to a terminal state.
 * <p>
 * Pending → Attempting → Succeeded | TerminalFailed | RetryWait → Attempting ... → RetriesExhausted.
 * A job is attempted at most {@link JobOptions#retriesAllowed()} times; no sleep follows the last attempt.
 */
public class RetryingJobExecutor {

    private static final Logger LOG = Logger.getLogger(RetryingJobExecutor.class);

    private final ExponentialBackoff backoff;
    private final Sleeper sleeper;

    public RetryingJobExecutor(ExponentialBackoff backoff, Sleeper sleeper) {
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    public JobResult execute(TransferJob job, Toolbox toolbox) {
        int retriesAllowed = job.options().retriesAllowed();
        AttemptResult last = null;

        for (int attempt = 1; attempt <= retriesAllowed; attempt++) {
            last = job.attempt(toolbox);
            switch (last.status()) {
                case SUCCEEDED:
                    LOG.debugf("%s succeeded (attempt %d)", job, attempt);
                    return new JobResult(JobOutcome.SUCCEEDED, attempt);
                case REJECTED:
                    LOG.errorf("%s failed: %s", job, last.describeCause());
                    job.discardPartialResult();
                    return new JobResult(JobOutcome.FAILED, attempt);
                case TRANSIENT:
                default:
                    if (attempt == retriesAllowed) {
                        break;
                    }
                    Duration delay = backoff.delayFor(attempt);
                    LOG.warnf("%s attempt %d/%d failed, retrying in %d ms: %s",
                            job, attempt, retriesAllowed, delay.toMillis(), last.describeCause());
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        LOG.errorf("%s abandoned: interrupted during backoff", job);
                        job.discardPartialResult();
                        return new JobResult(JobOutcome.FAILED, attempt);
                    }
            }
        }

        LOG.errorf("%s gave up after %d attempts: %s", job, retriesAllowed,
                last == null ? "no attempt made" : last.describeCause());
        job.discardPartialResult();
        return new JobResult(JobOutcome.RETRIES_EXHAUSTED, retriesAllowed);
    }
}
