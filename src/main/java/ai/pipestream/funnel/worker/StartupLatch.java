package ai.pipestream.funnel.worker;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lets the pool constructor wait until every worker holds its toolbox, or learn why one could not.
 */
final class StartupLatch {

    private final CountDownLatch pending;
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    StartupLatch(int workers) {
        this.pending = new CountDownLatch(workers);
    }

    void ready() {
        pending.countDown();
    }

    void failed(Throwable cause) {
        failure.compareAndSet(null, cause);
        pending.countDown();
    }

    /**
     * Marks a worker that never started as accounted for.
     */
    void abandon() {
        pending.countDown();
    }

    Throwable await() throws InterruptedException {
        pending.await();
        return failure.get();
    }
}
