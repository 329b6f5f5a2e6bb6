package ai.pipestream.funnel.job;

import ai.pipestream.funnel.cli.Operation;
import ai.pipestream.funnel.store.ObjectStoreException;
import ai.pipestream.funnel.worker.Toolbox;

/**
 * Deletes one key.
 */
public class DeleteJob extends TransferJob {

    public DeleteJob(String key, JobOptions options) {
        super(key, options);
    }

    @Override
    public Operation operation() {
        return Operation.DELETE;
    }

    @Override
    protected void perform(Toolbox toolbox) throws ObjectStoreException {
        toolbox.store().delete(toolbox.bucket(), key());
    }
}
