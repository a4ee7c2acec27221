package vn.com.fecredit.filestore.exception;

/**
 * The upload session is unknown, already closed, or owned by another tenant.
 * Clients recover by opening a new session.
 */
public class SessionNotFoundException extends FileStoreException {

    public SessionNotFoundException(String sessionId) {
        super("SessionNotFound", "Upload session not found or expired: " + sessionId, 404);
    }
}
