package vn.com.fecredit.filestore.client;

/**
 * Size, and optionally SHA-256 digest, of a stored artifact as reported by a HEAD probe.
 */
public class ArtifactInfo {

    private final long length;
    private final String sha256Hex;

    public ArtifactInfo(long length, String sha256Hex) {
        this.length = length;
        this.sha256Hex = sha256Hex;
    }

    public long getLength() {
        return length;
    }

    /**
     * @return hex digest, or {@code null} when it was not requested or not sent
     */
    public String getSha256Hex() {
        return sha256Hex;
    }
}
