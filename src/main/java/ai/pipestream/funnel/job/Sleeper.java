package ai.pipestream.funnel.job;

import java.time.Duration;

/**
 * Blocks the calling thread for a backoff delay.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
