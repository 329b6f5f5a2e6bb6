package ai.pipestream.funnel.store;

/**
 * Thrown when a store call failed for a reason that may go away on its own:
 * connection reset, truncated body, client-side I/O error, 5xx or throttling responses.
 */
public class TransientStoreException extends ObjectStoreException {

    public TransientStoreException(String operation, String bucket, String key, Throwable cause) {
        super(operation, bucket, key, describe(cause), cause);
    }

    public TransientStoreException(String operation, String bucket, String key, String details) {
        super(operation, bucket, key, details, null);
    }

    private static String describe(Throwable cause) {
        return cause == null ? "transient failure" : cause.toString();
    }
}
