package ai.pipestream.funnel.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Defaults for a run. All keys are namespaced under {@code funnel.*};
 * command-line flags take precedence where both exist.
 */
@ConfigMapping(prefix = "funnel")
public interface FunnelConfiguration {

    Pool pool();

    Job job();

    Get get();

    Shutdown shutdown();

    interface Pool {
        /**
         * Worker count when {@code --threads} is not given.
         * Default: 1.
         */
        @WithDefault("1")
        int threads();
    }

    interface Job {
        /**
         * Maximum attempts per job.
         * Default: 5.
         */
        @WithDefault("5")
        int retries();

        /**
         * Delay after the first failed attempt; doubles after each further one.
         * Default: 100ms.
         */
        @WithDefault("PT0.1S")
        Duration backoffBase();

        /**
         * Upper bound for a single backoff delay.
         * Default: 10 seconds.
         */
        @WithDefault("PT10S")
        Duration backoffMax();
    }

    interface Get {
        /**
         * Directory downloads are written under.
         * Default: the working directory.
         */
        @WithDefault(".")
        String outputDir();
    }

    interface Shutdown {
        /**
         * How long an interrupted run may keep draining running jobs before the process exits.
         * Default: 5 minutes.
         */
        @WithDefault("PT5M")
        Duration gracePeriod();
    }
}
