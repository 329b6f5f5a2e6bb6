package ai.pipestream.funnel.dispatch;

import org.jboss.logging.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Set-once flag telling the dispatch loop to stop feeding new jobs. Running jobs are not affected.
 */
public final class StopSignal {

    private static final Logger LOG = Logger.getLogger(StopSignal.class);

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    /**
     * Sets the signal. Only the first call logs and returns {@code true}.
     */
    public boolean trigger(String reason) {
        if (stopped.compareAndSet(false, true)) {
            LOG.warnf("Stop requested (%s): no new jobs will be started, waiting for running jobs to finish", reason);
            return true;
        }
        return false;
    }

    public boolean isStopped() {
        return stopped.get();
    }
}
