package ai.pipestream.funnel.worker;

import ai.pipestream.funnel.job.RetryingJobExecutor;
import ai.pipestream.funnel.job.TransferJob;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fixed set of worker threads consuming jobs from a bounded FIFO queue.
 * <p>
 * {@link #submit} blocks while the queue is full, which is the only flow control of a run.
 * {@link #shutdown} lets every queued and running job finish before joining the workers.
 * Both are meant to be called from a single dispatching thread.
 */
public class WorkerPool {

    private static final Logger LOG = Logger.getLogger(WorkerPool.class);

    /** Queue slots per worker. */
    public static final int QUEUE_FACTOR = 2;

    private final int workerCount;
    private final int queueCapacity;
    private final BlockingQueue<TransferJob> queue;
    private final List<Thread> workers;
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final AtomicBoolean joined = new AtomicBoolean(false);

    /**
     * Starts a pool whose queue holds {@value #QUEUE_FACTOR} jobs per worker.
     */
    public static WorkerPool start(int workerCount,
                                   ToolboxFactory toolboxFactory,
                                   RetryingJobExecutor executor,
                                   JobListener listener) {
        Preconditions.checkArgument(workerCount >= 1, "workerCount must be >= 1, was %s", workerCount);
        return new WorkerPool(workerCount, QUEUE_FACTOR * workerCount, toolboxFactory, executor, listener);
    }

    /**
     * Starts {@code workerCount} workers and waits until each has created its toolbox.
     *
     * @throws StartupException if a thread cannot be started or a toolbox cannot be created
     */
    public WorkerPool(int workerCount,
                      int queueCapacity,
                      ToolboxFactory toolboxFactory,
                      RetryingJobExecutor executor,
                      JobListener listener) {
        Preconditions.checkArgument(workerCount >= 1, "workerCount must be >= 1, was %s", workerCount);
        Preconditions.checkArgument(queueCapacity >= 1, "queueCapacity must be >= 1, was %s", queueCapacity);
        Objects.requireNonNull(toolboxFactory, "toolboxFactory must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        this.workerCount = workerCount;
        this.queueCapacity = queueCapacity;
        this.queue = new ArrayBlockingQueue<>(queueCapacity, true);
        this.workers = new ArrayList<>(workerCount);

        ThreadFactory threads = new ThreadFactoryBuilder()
                .setNameFormat("funnel-worker-%d")
                .setDaemon(false)
                .build();
        StartupLatch startup = new StartupLatch(workerCount);

        for (int i = 0; i < workerCount; i++) {
            Worker worker = new Worker(queue, toolboxFactory, executor, listener, shutdownRequested::get, startup);
            try {
                Thread thread = threads.newThread(worker);
                thread.start();
                workers.add(thread);
            } catch (OutOfMemoryError | RuntimeException e) {
                for (int j = i; j < workerCount; j++) {
                    startup.abandon();
                }
                abortStartup();
                throw new StartupException("Could not start worker " + (i + 1) + " of " + workerCount, e);
            }
        }

        Throwable failure;
        try {
            failure = startup.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abortStartup();
            throw new StartupException("Interrupted while starting workers", e);
        }
        if (failure != null) {
            abortStartup();
            throw new StartupException("Worker could not create its toolbox: " + failure, failure);
        }

        LOG.infof("Worker pool started: workers=%d, queueCapacity=%d", workerCount, queueCapacity);
    }

    /**
     * Enqueues a job, blocking while the queue is full.
     *
     * @throws IllegalStateException once {@link #shutdown} has been called
     * @throws InterruptedException  if interrupted while waiting for space; the job was not enqueued
     */
    public void submit(TransferJob job) throws InterruptedException {
        Objects.requireNonNull(job, "job must not be null");
        if (shutdownRequested.get()) {
            throw new IllegalStateException("Worker pool is shut down; cannot accept " + job);
        }
        queue.put(job);
    }

    /**
     * Stops accepting jobs, waits for the queue to drain and every running job to finish, then joins
     * every worker. Later calls return immediately.
     */
    public void shutdown() {
        shutdownRequested.set(true);
        if (!joined.compareAndSet(false, true)) {
            return;
        }
        LOG.debugf("Shutting down worker pool: %d job(s) still queued", queue.size());

        boolean interrupted = false;
        for (Thread worker : workers) {
            while (true) {
                try {
                    worker.join();
                    break;
                } catch (InterruptedException e) {
                    // shutdown only returns once every running job is done
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        LOG.debug("Worker pool stopped");
    }

    public int workerCount() {
        return workerCount;
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    public int queuedJobs() {
        return queue.size();
    }

    public boolean isShutdown() {
        return shutdownRequested.get();
    }

    private void abortStartup() {
        shutdownRequested.set(true);
        joined.set(true);
        for (Thread worker : workers) {
            try {
                worker.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
