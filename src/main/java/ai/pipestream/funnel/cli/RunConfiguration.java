package ai.pipestream.funnel.cli;

import ai.pipestream.funnel.job.AccessPolicy;
import ai.pipestream.funnel.s3.StoreCredentials;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one invocation asked for. Built once, before any work starts.
 *
 * @param bucket       target bucket
 * @param operation    requested operation
 * @param credentials  resolved key pair
 * @param threads      worker count, at least 1
 * @param startKey     list only: start listing after this key
 * @param accessPolicy put only: ACL of uploaded objects
 * @param manifest     manifest path, {@code -} for stdin
 * @param verbose      debug logging
 * @param items        positional arguments after the operation
 */
public record RunConfiguration(
        String bucket,
        Operation operation,
        StoreCredentials credentials,
        int threads,
        Optional<String> startKey,
        AccessPolicy accessPolicy,
        Optional<String> manifest,
        boolean verbose,
        List<String> items) {

    public RunConfiguration {
        Objects.requireNonNull(bucket, "bucket must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(credentials, "credentials must not be null");
        Objects.requireNonNull(startKey, "startKey must not be null");
        Objects.requireNonNull(accessPolicy, "accessPolicy must not be null");
        Objects.requireNonNull(manifest, "manifest must not be null");
        items = List.copyOf(items);
    }
}
