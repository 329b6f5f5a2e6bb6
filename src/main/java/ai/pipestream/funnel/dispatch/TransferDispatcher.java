package ai.pipestream.funnel.dispatch;

import ai.pipestream.funnel.job.TransferJob;
import ai.pipestream.funnel.worker.WorkerPool;
import org.jboss.logging.Logger;

import java.util.Iterator;
import java.util.function.Function;

/**
 * Feeds input items to a worker pool as jobs until the input ends or the stop signal is set,
 * then shuts the pool down.
 */
public class TransferDispatcher {

    private static final Logger LOG = Logger.getLogger(TransferDispatcher.class);

    private final StopSignal signal;

    public TransferDispatcher(StopSignal signal) {
        this.signal = signal;
    }

    /**
     * Blocks until every submitted job has reached a terminal state.
     *
     * @return number of jobs submitted
     */
    public long dispatch(Iterator<String> items, Function<String, ? extends TransferJob> jobFactory, WorkerPool pool) {
        long submitted = 0;
        try {
            // The signal is checked before pulling each item, never while a job runs
            while (!signal.isStopped() && items.hasNext()) {
                String item = items.next();
                TransferJob job;
                try {
                    job = jobFactory.apply(item);
                } catch (RuntimeException e) {
                    LOG.errorf("Skipping '%s': %s", item, e.getMessage());
                    continue;
                }
                pool.submit(job);
                submitted++;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            signal.trigger("dispatch thread interrupted");
        } finally {
            if (signal.isStopped()) {
                LOG.infof("Dispatch stopped after %d job(s); draining the pool", submitted);
            } else {
                LOG.debugf("Input exhausted after %d job(s); draining the pool", submitted);
            }
            pool.shutdown();
        }
        return submitted;
    }
}
