package vn.com.fecredit.filestore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Result of a successful finish call: the merged artifact as stored.
 *
 * <p>
 * {@code artifactId} is the path to pass to the download endpoint. It equals
 * {@code finalName}, which differs from {@code originalName} when the requested
 * display name was already taken.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FinishResponse {

    /** Download key of the stored artifact. */
    private String artifactId;
    /** Name the artifact was stored under. */
    private String finalName;
    /** Display name requested by the client. */
    private String originalName;
    /** Artifact length in bytes. */
    private long size;
    /** Lowercase hex SHA-256 of the merged bytes. */
    private String digestHex;

    public FinishResponse() {
    }

    public FinishResponse(String artifactId, String finalName, String originalName, long size, String digestHex) {
        this.artifactId = artifactId;
        this.finalName = finalName;
        this.originalName = originalName;
        this.size = size;
        this.digestHex = digestHex;
    }

    public String getArtifactId() { return artifactId; }
    public void setArtifactId(String artifactId) { this.artifactId = artifactId; }
    public String getFinalName() { return finalName; }
    public void setFinalName(String finalName) { this.finalName = finalName; }
    public String getOriginalName() { return originalName; }
    public void setOriginalName(String originalName) { this.originalName = originalName; }
    public long getSize() { return size; }
    public void setSize(long size) { this.size = size; }
    public String getDigestHex() { return digestHex; }
    public void setDigestHex(String digestHex) { this.digestHex = digestHex; }
}
