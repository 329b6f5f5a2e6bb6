package ai.pipestream.funnel.store;

/**
 * Base exception for single-object store calls.
 * Carries the operation, bucket and key so a log line identifies the object without extra context.
 */
public class ObjectStoreException extends Exception {

    private final String operation;
    private final String bucket;
    private final String key;

    public ObjectStoreException(String operation, String bucket, String key, String details, Throwable cause) {
        super(String.format("%s failed: bucket=%s, key=%s, details=%s", operation, bucket, key, details), cause);
        this.operation = operation;
        this.bucket = bucket;
        this.key = key;
    }

    public String getOperation() {
        return operation;
    }

    public String getBucket() {
        return bucket;
    }

    public String getKey() {
        return key;
    }
}
