package ai.pipestream.funnel.job;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Per-run options shared by every job of the run.
 *
 * @param retriesAllowed maximum number of attempts per job, at least 1
 * @param accessPolicy   ACL for uploads
 */
public record JobOptions(int retriesAllowed, AccessPolicy accessPolicy) {

    public static final int DEFAULT_RETRIES = 5;

    public JobOptions {
        Preconditions.checkArgument(retriesAllowed >= 1, "retriesAllowed must be >= 1, was %s", retriesAllowed);
        Objects.requireNonNull(accessPolicy, "accessPolicy must not be null");
    }

    public static JobOptions defaults() {
        return new JobOptions(DEFAULT_RETRIES, AccessPolicy.PRIVATE);
    }
}
