package vn.com.fecredit.filestore.client;

/**
 * Failure reported by the file store server or raised while talking to it.
 *
 * <p>
 * {@code statusCode} is the HTTP status of the failed exchange, or {@code -1}
 * when the failure happened before a response was received. {@code errorCode}
 * is the server's error code ({@code SessionNotFound}, {@code IncompleteUpload},
 * ...) when the response carried one.
 */
public class FileStoreClientException extends RuntimeException {

    private final int statusCode;
    private final String errorCode;

    public FileStoreClientException(String message, int statusCode, String errorCode) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public FileStoreClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.errorCode = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Client errors are not retried: repeating the same request gives the same answer.
     */
    public boolean isRetryable() {
        return statusCode < 0 || statusCode >= 500;
    }
}
