package vn.com.fecredit.filestore.exception;

/**
 * Storage failure while merging chunks into the final artifact.
 * The session stays open so the finish call can be retried.
 */
public class MergeIOException extends FileStoreException {

    public MergeIOException(String message, Throwable cause) {
        super("MergeIOError", message, 500, cause);
    }
}
