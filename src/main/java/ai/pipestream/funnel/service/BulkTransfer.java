package ai.pipestream.funnel.service;

import ai.pipestream.funnel.cli.Operation;
import ai.pipestream.funnel.cli.RunConfiguration;
import ai.pipestream.funnel.dispatch.StopSignal;
import ai.pipestream.funnel.dispatch.TransferDispatcher;
import ai.pipestream.funnel.input.InputEnumerator;
import ai.pipestream.funnel.job.DeleteJob;
import ai.pipestream.funnel.job.GetJob;
import ai.pipestream.funnel.job.JobOptions;
import ai.pipestream.funnel.job.PutJob;
import ai.pipestream.funnel.job.RetryingJobExecutor;
import ai.pipestream.funnel.job.TransferJob;
import ai.pipestream.funnel.worker.JobListener;
import ai.pipestream.funnel.worker.ToolboxFactory;
import ai.pipestream.funnel.worker.WorkerPool;

import java.nio.file.Path;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * One get, put or delete run: start the pool, feed it from the input, drain it.
 */
public class BulkTransfer {

    private final ToolboxFactory toolboxFactory;
    private final RetryingJobExecutor executor;
    private final JobListener listener;
    private final int retriesAllowed;
    private final Path outputDir;

    public BulkTransfer(ToolboxFactory toolboxFactory,
                        RetryingJobExecutor executor,
                        JobListener listener,
                        int retriesAllowed,
                        Path outputDir) {
        this.toolboxFactory = toolboxFactory;
        this.executor = executor;
        this.listener = listener;
        this.retriesAllowed = retriesAllowed;
        this.outputDir = outputDir;
    }

    /**
     * @return number of jobs submitted
     * @throws ai.pipestream.funnel.worker.StartupException if the pool cannot start; no job runs
     */
    public long run(RunConfiguration run, InputEnumerator inputs, StopSignal signal) {
        JobOptions options = new JobOptions(retriesAllowed, run.accessPolicy());
        Function<String, TransferJob> jobs = jobFactory(run.operation(), options);

        WorkerPool pool = WorkerPool.start(run.threads(), toolboxFactory, executor, listener);
        try (Stream<String> items = inputs.resolve(run.manifest(), run.items(), run.operation())) {
            return new TransferDispatcher(signal).dispatch(items.iterator(), jobs, pool);
        } finally {
            pool.shutdown();
        }
    }

    Function<String, TransferJob> jobFactory(Operation operation, JobOptions options) {
        return switch (operation) {
            case GET -> key -> GetJob.into(outputDir, key, options);
            case PUT -> path -> PutJob.fromPath(path, options);
            case DELETE -> key -> new DeleteJob(key, options);
            case LIST -> throw new IllegalArgumentException("list is not a bulk operation");
        };
    }
}
