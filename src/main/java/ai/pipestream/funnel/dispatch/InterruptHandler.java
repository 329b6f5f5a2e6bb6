package ai.pipestream.funnel.dispatch;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Bridges a process interrupt to the {@link StopSignal} of one run.
 * <p>
 * The interrupt arrives on a shutdown thread; the process exits as soon as that thread returns, so
 * {@link #onInterrupt()} holds it until the run reports {@link #finished()} or the grace period ends.
 */
public final class InterruptHandler {

    private static final Logger LOG = Logger.getLogger(InterruptHandler.class);

    private final StopSignal signal;
    private final Duration gracePeriod;
    private final CountDownLatch done = new CountDownLatch(1);

    public InterruptHandler(StopSignal signal, Duration gracePeriod) {
        this.signal = signal;
        this.gracePeriod = gracePeriod;
    }

    /**
     * Stops dispatch and waits for running jobs to drain.
     *
     * @return {@code true} if the run drained within the grace period
     */
    public boolean onInterrupt() {
        if (isFinished()) {
            return true;
        }
        signal.trigger("interrupt");
        try {
            if (done.await(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            LOG.errorf("Running jobs did not finish within %s; exiting anyway", gracePeriod);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    /**
     * Called once the pool has drained.
     */
    public void finished() {
        done.countDown();
    }

    public boolean isFinished() {
        return done.getCount() == 0;
    }

    public StopSignal signal() {
        return signal;
    }
}
