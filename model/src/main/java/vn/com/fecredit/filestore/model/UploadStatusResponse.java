package vn.com.fecredit.filestore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;

/**
 * Progress snapshot of an open upload session, used by resuming clients to
 * work out which chunks still have to be sent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UploadStatusResponse {

    private String sessionId;
    /** Received chunk indices in ascending order. */
    private List<Integer> receivedIndices;
    private Instant createdAt;
    /** Declared chunk count, {@code null} until a finish call has been made. */
    private Integer totalChunks;
    /** Session state: OPEN, FINALIZING or CLOSED. */
    private String state;
    /** Largest chunk the server accepts; resuming clients must not cut larger chunks. */
    private int maxChunkSize;

    public UploadStatusResponse() {
    }

    public UploadStatusResponse(String sessionId, List<Integer> receivedIndices, Instant createdAt,
                                Integer totalChunks, String state, int maxChunkSize) {
        this.sessionId = sessionId;
        this.receivedIndices = receivedIndices;
        this.createdAt = createdAt;
        this.totalChunks = totalChunks;
        this.state = state;
        this.maxChunkSize = maxChunkSize;
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public List<Integer> getReceivedIndices() { return receivedIndices; }
    public void setReceivedIndices(List<Integer> receivedIndices) { this.receivedIndices = receivedIndices; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Integer getTotalChunks() { return totalChunks; }
    public void setTotalChunks(Integer totalChunks) { this.totalChunks = totalChunks; }
    public String getState() { return state; }
    public void setState(String state) { this.state = state; }
    public int getMaxChunkSize() { return maxChunkSize; }
    public void setMaxChunkSize(int maxChunkSize) { this.maxChunkSize = maxChunkSize; }
}
