package ai.pipestream.funnel.store;

/**
 * Unchecked wrapper for a failure raised while iterating a listing lazily.
 */
public class StoreListingException extends RuntimeException {

    public StoreListingException(ObjectStoreException cause) {
        super(cause.getMessage(), cause);
    }

    @Override
    public synchronized ObjectStoreException getCause() {
        return (ObjectStoreException) super.getCause();
    }
}
