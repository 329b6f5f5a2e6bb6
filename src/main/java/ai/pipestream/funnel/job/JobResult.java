package ai.pipestream.funnel.job;

/**
 * Terminal outcome of a job together with the number of attempts it took.
 */
public record JobResult(JobOutcome outcome, int attempts) {

    public boolean succeeded() {
        return outcome == JobOutcome.SUCCEEDED;
    }
}
