package ai.pipestream.funnel.dispatch;

import ai.pipestream.funnel.job.DeleteJob;
import ai.pipestream.funnel.job.ExponentialBackoff;
import ai.pipestream.funnel.job.JobOptions;
import ai.pipestream.funnel.job.JobResult;
import ai.pipestream.funnel.job.RetryingJobExecutor;
import ai.pipestream.funnel.job.TransferJob;
import ai.pipestream.funnel.store.InMemoryObjectStore;
import ai.pipestream.funnel.worker.Toolbox;
import ai.pipestream.funnel.worker.WorkerPool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
class TransferDispatcherTest {

    private final InMemoryObjectStore store = new InMemoryObjectStore();
    private final List<String> completed = new CopyOnWriteArrayList<>();

    private WorkerPool startPool(int workers) {
        RetryingJobExecutor executor = new RetryingJobExecutor(
                new ExponentialBackoff(Duration.ofMillis(1), Duration.ofMillis(1)), duration -> { });
        return WorkerPool.start(workers, () -> new Toolbox(store, "test-bucket"), executor,
                (TransferJob job, JobResult result) -> completed.add(job.key()));
    }

    private static List<String> keys(int count) {
        List<String> keys = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            keys.add("key-" + i);
        }
        return keys;
    }

    @Test
    void submitsEveryItemAndDrainsThePool() {
        WorkerPool pool = startPool(2);

        long submitted = new TransferDispatcher(new StopSignal())
                .dispatch(keys(7).iterator(), key -> new DeleteJob(key, JobOptions.defaults()), pool);

        assertEquals(7, submitted);
        assertTrue(pool.isShutdown());
        assertEquals(7, completed.size());
    }

    @Test
    void itemThatCannotBecomeAJobIsSkipped() {
        WorkerPool pool = startPool(1);
        Function<String, TransferJob> jobs = key -> {
            if (key.equals("key-2")) {
                throw new IllegalArgumentException("Illegal char <\u0000>");
            }
            return new DeleteJob(key, JobOptions.defaults());
        };

        long submitted = new TransferDispatcher(new StopSignal()).dispatch(keys(3).iterator(), jobs, pool);

        assertEquals(2, submitted);
        assertTrue(pool.isShutdown());
        assertEquals(List.of("key-1", "key-3"), completed);
    }

    @Test
    void stopSignalAfterFirstSubmissionPreventsTheRest() {
        StopSignal signal = new StopSignal();
        WorkerPool pool = startPool(2);
        AtomicInteger created = new AtomicInteger();
        Function<String, TransferJob> jobs = key -> {
            TransferJob job = new DeleteJob(key, JobOptions.defaults());
            if (created.incrementAndGet() == 1) {
                signal.trigger("test interrupt");
            }
            return job;
        };
        Iterator<String> items = keys(5).iterator();

        long submitted = new TransferDispatcher(signal).dispatch(items, jobs, pool);

        assertEquals(1, submitted);
        assertEquals(1, created.get());
        assertEquals(List.of("key-1"), completed);
        // the remaining entries were never consumed
        assertEquals("key-2", items.next());
    }

    @Test
    void alreadyStoppedSignalSubmitsNothing() {
        StopSignal signal = new StopSignal();
        signal.trigger("before start");
        WorkerPool pool = startPool(1);

        long submitted = new TransferDispatcher(signal)
                .dispatch(keys(3).iterator(), key -> new DeleteJob(key, JobOptions.defaults()), pool);

        assertEquals(0, submitted);
        assertTrue(pool.isShutdown());
        assertTrue(completed.isEmpty());
    }
}
