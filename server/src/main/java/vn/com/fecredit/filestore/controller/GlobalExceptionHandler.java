package vn.com.fecredit.filestore.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import vn.com.fecredit.filestore.exception.FileStoreException;
import vn.com.fecredit.filestore.exception.IncompleteUploadException;
import vn.com.fecredit.filestore.exception.RangeRejectedException;
import vn.com.fecredit.filestore.model.ErrorResponse;

/**
 * Global exception handler
 * <p>
 * Converts exceptions to the JSON error body
 * {@code {code, message, missingIndices?, missingCount?, unexpectedIndices?}}.
 * <p>
 * Not restricted to a package: multipart limits are enforced while the request
 * is parsed, before any handler is chosen, and must still get a JSON body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(FileStoreException.class)
    public ResponseEntity<ErrorResponse> handleFileStoreException(FileStoreException ex) {
        if (ex.getHttpStatus() >= 500) {
            log.error("File store error: {} - {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("File store error: {} - {}", ex.getErrorCode(), ex.getMessage());
        }

        ErrorResponse error = new ErrorResponse(ex.getErrorCode(), ex.getMessage());
        if (ex instanceof IncompleteUploadException) {
            IncompleteUploadException incomplete = (IncompleteUploadException) ex;
            error.setMissingIndices(incomplete.getMissingIndices());
            error.setMissingCount(incomplete.getMissingCount());
            error.setUnexpectedIndices(incomplete.getUnexpectedIndices());
        }

        HttpHeaders headers = new HttpHeaders();
        if (ex instanceof RangeRejectedException && ex.getHttpStatus() == HttpStatus.REQUESTED_RANGE_NOT_SATISFIABLE.value()) {
            headers.set(HttpHeaders.CONTENT_RANGE, "bytes */" + ((RangeRejectedException) ex).getTotalLength());
        }
        return ResponseEntity.status(ex.getHttpStatus())
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "InvalidRequest", ex.getMessage());
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "InvalidRequest", ex.getMessage());
    }

    /**
     * A part over {@code spring.servlet.multipart.max-file-size}. The session is
     * not known yet at this point, so this is a 400 even for an unknown session.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Multipart request too large: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "ChunkTooLarge", ex.getMessage());
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ErrorResponse> handleMultipart(MultipartException ex) {
        log.warn("Malformed multipart request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "InvalidRequest", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        if (ex instanceof org.springframework.web.ErrorResponse) {
            HttpStatusCode status = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
            log.debug("Request rejected by the framework: {} - {}", status, ex.getMessage());
            return error(status, status.value() == 404 ? "NotFound" : "InvalidRequest", ex.getMessage());
        }
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalError", "Internal server error");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatusCode status, String code, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(code, message));
    }
}
