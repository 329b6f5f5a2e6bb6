package ai.pipestream.funnel.store;

/**
 * Thrown when the remote service explicitly refused the request (authorization, not-found, bad request).
 * Retrying the same request will not help.
 */
public class RejectedRequestException extends ObjectStoreException {

    private final int statusCode;

    public RejectedRequestException(String operation, String bucket, String key, int statusCode, Throwable cause) {
        super(operation, bucket, key, "rejected with status " + statusCode + ": " + cause.getMessage(), cause);
        this.statusCode = statusCode;
    }

    public RejectedRequestException(String operation, String bucket, String key, int statusCode, String details) {
        super(operation, bucket, key, "rejected with status " + statusCode + ": " + details, null);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
