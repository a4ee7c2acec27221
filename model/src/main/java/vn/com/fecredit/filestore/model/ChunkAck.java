package vn.com.fecredit.filestore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Acknowledgement for a single accepted chunk.
 *
 * <p>
 * {@code duplicate} is {@code true} when the index had already been received
 * and the body was discarded without rewriting the stored chunk.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChunkAck {

    private String sessionId;
    private int index;
    private long size;
    private boolean duplicate;

    public ChunkAck() {
    }

    public ChunkAck(String sessionId, int index, long size, boolean duplicate) {
        this.sessionId = sessionId;
        this.index = index;
        this.size = size;
        this.duplicate = duplicate;
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public int getIndex() { return index; }
    public void setIndex(int index) { this.index = index; }
    public long getSize() { return size; }
    public void setSize(long size) { this.size = size; }
    public boolean isDuplicate() { return duplicate; }
    public void setDuplicate(boolean duplicate) { this.duplicate = duplicate; }
}
