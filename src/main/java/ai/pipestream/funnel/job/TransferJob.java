package ai.pipestream.funnel.job;

import ai.pipestream.funnel.cli.Operation;
import ai.pipestream.funnel.store.ObjectStoreException;
import ai.pipestream.funnel.store.RejectedRequestException;
import ai.pipestream.funnel.store.TransientStoreException;
import ai.pipestream.funnel.worker.Toolbox;

import java.util.Objects;

/**
 * One unit of bulk work bound to a single object key. Immutable.
 * <p>
 * Subclasses perform one attempt against a worker's {@link Toolbox}; the retry loop lives in
 * {@link RetryingJobExecutor}.
 */
public abstract class TransferJob {

    private final String key;
    private final JobOptions options;

    protected TransferJob(String key, JobOptions options) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public String key() {
        return key;
    }

    public JobOptions options() {
        return options;
    }

    public abstract Operation operation();

    /**
     * Makes one attempt and classifies its result. Never throws for store failures.
     */
    public final AttemptResult attempt(Toolbox toolbox) {
        try {
            perform(toolbox);
            return AttemptResult.succeeded();
        } catch (TransientStoreException e) {
            return AttemptResult.transientFailure(e);
        } catch (RejectedRequestException e) {
            return AttemptResult.rejected(e);
        } catch (ObjectStoreException e) {
            return AttemptResult.transientFailure(e);
        }
    }

    protected abstract void perform(Toolbox toolbox) throws ObjectStoreException;

    /**
     * Removes whatever a failed attempt left behind. Called once when the job ends without success.
     */
    public void discardPartialResult() {
    }

    @Override
    public String toString() {
        return operation().label() + " " + key;
    }
}
