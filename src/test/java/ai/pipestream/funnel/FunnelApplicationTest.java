package ai.pipestream.funnel;

import io.quarkus.test.junit.main.Launch;
import io.quarkus.test.junit.main.LaunchResult;
import io.quarkus.test.junit.main.QuarkusMainTest;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;

/**
 * Exit codes of the command-line entry point for invocations that never reach S3.
 */
@QuarkusMainTest
class FunnelApplicationTest {

    @Test
    @Launch(value = {}, exitCode = FunnelApplication.EXIT_USAGE)
    void noArgumentsIsAUsageError(LaunchResult result) {
        assertThat(result.getErrorOutput(), containsString("BUCKET and OPERATION are required"));
    }

    @Test
    @Launch(value = {"--help"}, exitCode = 0)
    void helpPrintsUsage(LaunchResult result) {
        assertThat(result.getOutput(), containsString("s3-funnel BUCKET OPERATION"));
    }

    @Test
    @Launch(value = {"my-bucket", "copy", "-a", "key", "-s", "secret"}, exitCode = FunnelApplication.EXIT_USAGE)
    void unknownOperationIsAUsageError(LaunchResult result) {
        assertThat(result.getErrorOutput(), containsString("Unknown operation 'copy'"));
    }

    @Test
    @Launch(value = {"my-bucket", "get", "-t", "0", "-a", "key", "-s", "secret"},
            exitCode = FunnelApplication.EXIT_USAGE)
    void zeroThreadsIsAUsageError(LaunchResult result) {
        assertThat(result.getErrorOutput(), containsString("at least 1"));
    }
}
