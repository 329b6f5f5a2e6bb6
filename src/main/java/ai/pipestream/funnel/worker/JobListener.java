package ai.pipestream.funnel.worker;

import ai.pipestream.funnel.job.JobResult;
import ai.pipestream.funnel.job.TransferJob;

/**
 * Receives the terminal result of every job, on the worker thread that ran it.
 */
@FunctionalInterface
public interface JobListener {

    JobListener NONE = (job, result) -> { };

    void onCompleted(TransferJob job, JobResult result);
}
