package vn.com.fecredit.filestore.core;

import lombok.Value;

/**
 * Outcome of a successful chunk submission.
 */
@Value
public class ChunkAcceptance {
    String sessionId;
    int index;
    long size;
    /** {@code true} when the index was already received and nothing was written. */
    boolean duplicate;
}
