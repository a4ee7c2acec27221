package vn.com.fecredit.filestore.exception;

/**
 * The requested artifact does not exist (or no longer exists) in the tenant's storage.
 */
public class ArtifactNotFoundException extends FileStoreException {

    public ArtifactNotFoundException(String artifactPath) {
        super("NotFound", "File not found: " + artifactPath, 404);
    }

    public ArtifactNotFoundException(String artifactPath, Throwable cause) {
        super("NotFound", "File not found: " + artifactPath, 404, cause);
    }
}
