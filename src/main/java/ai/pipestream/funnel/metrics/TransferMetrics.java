package ai.pipestream.funnel.metrics;

import ai.pipestream.funnel.cli.Operation;
import ai.pipestream.funnel.job.JobOutcome;
import ai.pipestream.funnel.job.JobResult;
import ai.pipestream.funnel.job.TransferJob;
import ai.pipestream.funnel.worker.JobListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.search.Search;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Locale;

/**
 * Job outcome counters, fed by workers and read back for the end-of-run summary.
 */
@ApplicationScoped
public class TransferMetrics implements JobListener {

    static final String JOBS_TOTAL = "funnel_jobs_total";
    static final String RETRIES_TOTAL = "funnel_job_retries_total";

    private final MeterRegistry registry;
    private final Counter retries;

    @Inject
    public TransferMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.retries = Counter.builder(RETRIES_TOTAL)
                .description("Attempts beyond the first, over all jobs")
                .register(registry);
    }

    @Override
    public void onCompleted(TransferJob job, JobResult result) {
        jobs(job.operation(), result.outcome()).increment();
        if (result.attempts() > 1) {
            retries.increment(result.attempts() - 1);
        }
    }

    private Counter jobs(Operation operation, JobOutcome outcome) {
        return Counter.builder(JOBS_TOTAL)
                .description("Jobs that reached a terminal state")
                .tag("operation", operation.label())
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry);
    }

    public long count(JobOutcome outcome) {
        return (long) Search.in(registry)
                .name(JOBS_TOTAL)
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .counters()
                .stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    public long retries() {
        return (long) retries.count();
    }

    public String summary() {
        return String.format("%d succeeded, %d failed, %d gave up after retries, %d retries",
                count(JobOutcome.SUCCEEDED), count(JobOutcome.FAILED),
                count(JobOutcome.RETRIES_EXHAUSTED), retries());
    }
}
