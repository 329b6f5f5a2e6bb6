package ai.pipestream.funnel.s3;

import java.util.Objects;

/**
 * Access key pair used to sign every request of a run.
 */
public record StoreCredentials(String accessKey, String secretKey) {

    public StoreCredentials {
        Objects.requireNonNull(accessKey, "accessKey must not be null");
        Objects.requireNonNull(secretKey, "secretKey must not be null");
    }

    @Override
    public String toString() {
        return "StoreCredentials[accessKey=" + accessKey + ", secretKey=****]";
    }
}
