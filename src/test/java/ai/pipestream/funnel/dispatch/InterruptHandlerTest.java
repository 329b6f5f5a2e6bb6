package ai.pipestream.funnel.dispatch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
class InterruptHandlerTest {

    @Test
    void interruptAfterRunFinishedDoesNothing() {
        StopSignal signal = new StopSignal();
        InterruptHandler handler = new InterruptHandler(signal, Duration.ofSeconds(5));
        handler.finished();

        assertTrue(handler.onInterrupt());
        assertFalse(signal.isStopped());
    }

    @Test
    void interruptStopsDispatchAndWaitsForDrain() throws Exception {
        StopSignal signal = new StopSignal();
        InterruptHandler handler = new InterruptHandler(signal, Duration.ofSeconds(10));
        AtomicBoolean drained = new AtomicBoolean();
        CountDownLatch returned = new CountDownLatch(1);

        Thread hook = new Thread(() -> {
            drained.set(handler.onInterrupt());
            returned.countDown();
        });
        hook.start();

        while (!signal.isStopped()) {
            Thread.sleep(5);
        }
        assertFalse(returned.await(100, TimeUnit.MILLISECONDS), "must wait for running jobs");

        handler.finished();
        assertTrue(returned.await(5, TimeUnit.SECONDS));
        assertTrue(drained.get());
    }

    @Test
    void gracePeriodBoundsTheWait() {
        InterruptHandler handler = new InterruptHandler(new StopSignal(), Duration.ofMillis(50));

        assertFalse(handler.onInterrupt());
        assertTrue(handler.signal().isStopped());
    }
}
