package ai.pipestream.funnel.s3;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Connection settings for the S3 endpoint.
 * <p>
 * Credentials are not part of this mapping; they come from the command line or the environment per run.
 */
@ConfigMapping(prefix = "funnel.s3")
public interface S3Config {

    @WithDefault("us-east-1")
    String region();

    /**
     * Endpoint override for S3-compatible stores such as MinIO. AWS is used when absent.
     */
    Optional<String> endpoint();

    /**
     * Whether to use path-style access (required for most MinIO setups).
     */
    @WithDefault("false")
    boolean pathStyleAccess();
}
