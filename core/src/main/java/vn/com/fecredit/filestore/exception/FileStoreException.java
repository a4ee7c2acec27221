package vn.com.fecredit.filestore.exception;

import lombok.Getter;

/**
 * Base exception of the file store.
 *
 * <p>
 * Carries a stable error code and the HTTP status the web layer answers with,
 * so every failure is scoped to a single request and reported with enough
 * detail to drive a corrective retry.
 */
@Getter
public class FileStoreException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;

    public FileStoreException(String errorCode, String message, int httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public FileStoreException(String errorCode, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }
}
