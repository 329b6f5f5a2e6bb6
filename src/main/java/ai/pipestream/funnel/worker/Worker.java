package ai.pipestream.funnel.worker;

import ai.pipestream.funnel.job.JobOutcome;
import ai.pipestream.funnel.job.JobResult;
import ai.pipestream.funnel.job.RetryingJobExecutor;
import ai.pipestream.funnel.job.TransferJob;
import org.jboss.logging.Logger;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Body of one pool thread: obtain a toolbox, then execute queued jobs until the pool drains.
 */
final class Worker implements Runnable {

    private static final Logger LOG = Logger.getLogger(Worker.class);

    static final long POLL_INTERVAL_MS = 50;

    private final BlockingQueue<TransferJob> queue;
    private final ToolboxFactory toolboxFactory;
    private final RetryingJobExecutor executor;
    private final JobListener listener;
    private final BooleanSupplier shutdownRequested;
    private final StartupLatch startup;

    Worker(BlockingQueue<TransferJob> queue,
           ToolboxFactory toolboxFactory,
           RetryingJobExecutor executor,
           JobListener listener,
           BooleanSupplier shutdownRequested,
           StartupLatch startup) {
        this.queue = queue;
        this.toolboxFactory = toolboxFactory;
        this.executor = executor;
        this.listener = listener;
        this.shutdownRequested = shutdownRequested;
        this.startup = startup;
    }

    @Override
    public void run() {
        Toolbox toolbox;
        try {
            toolbox = toolboxFactory.create();
        } catch (RuntimeException | Error e) {
            LOG.errorf(e, "Worker %s could not create its toolbox", Thread.currentThread().getName());
            startup.failed(e);
            if (e instanceof Error) {
                throw (Error) e;
            }
            return;
        }
        startup.ready();

        try (toolbox) {
            LOG.debugf("Worker %s started", Thread.currentThread().getName());
            while (true) {
                // Read the flag before polling: once it is set no further job can be enqueued,
                // so an empty poll after that means the queue is drained for good.
                boolean stopping = shutdownRequested.getAsBoolean();
                TransferJob job = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (job == null) {
                    if (stopping) {
                        break;
                    }
                    continue;
                }
                listener.onCompleted(job, runSafely(job, toolbox));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Worker %s interrupted while waiting for jobs", Thread.currentThread().getName());
        }
        LOG.debugf("Worker %s stopped", Thread.currentThread().getName());
    }

    private JobResult runSafely(TransferJob job, Toolbox toolbox) {
        try {
            return executor.execute(job, toolbox);
        } catch (RuntimeException e) {
            LOG.errorf(e, "%s failed unexpectedly", job);
            job.discardPartialResult();
            return new JobResult(JobOutcome.FAILED, 1);
        }
    }
}
