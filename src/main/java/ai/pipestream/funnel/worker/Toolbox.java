package ai.pipestream.funnel.worker;

import ai.pipestream.funnel.store.ObjectStore;

import java.util.Objects;

/**
 * A worker's own store handle and the bucket it operates on. Never shared between workers.
 */
public record Toolbox(ObjectStore store, String bucket) implements AutoCloseable {

    public Toolbox {
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(bucket, "bucket must not be null");
    }

    @Override
    public void close() {
        store.close();
    }
}
