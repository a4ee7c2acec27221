package vn.com.fecredit.filestore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Response returned by the server when a new upload session is opened.
 *
 * <p>
 * Clients keep the {@code sessionId} for every following chunk, status,
 * finish and abort call, and must not send chunks larger than
 * {@code maxChunkSize} bytes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InitResponse {

    /** Upload session identifier assigned by the server. */
    private String sessionId;
    /** Instant the session was opened. */
    private Instant createdAt;
    /** Largest chunk body the server accepts, in bytes. */
    private int maxChunkSize;

    /**
     * Default constructor for JSON deserialization.
     */
    public InitResponse() {
    }

    public InitResponse(String sessionId, Instant createdAt, int maxChunkSize) {
        this.sessionId = sessionId;
        this.createdAt = createdAt;
        this.maxChunkSize = maxChunkSize;
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public int getMaxChunkSize() { return maxChunkSize; }
    public void setMaxChunkSize(int maxChunkSize) { this.maxChunkSize = maxChunkSize; }
}
