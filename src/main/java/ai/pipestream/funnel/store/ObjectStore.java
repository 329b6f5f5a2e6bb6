package ai.pipestream.funnel.store;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Single-object calls against one bucket.
 * <p>
 * Implementations classify every failure as either {@link TransientStoreException} or
 * {@link RejectedRequestException}; callers never see provider-specific exceptions.
 * An instance is confined to the thread that created it.
 */
public interface ObjectStore extends AutoCloseable {

    /**
     * Download {@code key} into {@code target}, replacing any existing file.
     * A failed download may leave a partial file behind; cleaning it up is the caller's job.
     */
    void get(String bucket, String key, Path target) throws ObjectStoreException;

    /**
     * Upload {@code source} as {@code key} with the given canned ACL ({@code public-read} or {@code private}).
     */
    void put(String bucket, String key, Path source, String cannedAcl) throws ObjectStoreException;

    /**
     * Delete {@code key}. Deleting a missing key succeeds.
     */
    void delete(String bucket, String key) throws ObjectStoreException;

    /**
     * Lazily list the keys of the bucket in lexicographic order, starting after {@code startAfter} when present.
     * Failures while paging surface as {@link StoreListingException}.
     */
    Iterable<String> list(String bucket, Optional<String> startAfter);

    @Override
    void close();
}
