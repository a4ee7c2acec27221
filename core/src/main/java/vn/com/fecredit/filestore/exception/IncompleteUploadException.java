package vn.com.fecredit.filestore.exception;

import lombok.Getter;

import java.util.List;

/**
 * The received chunk set does not match {@code 0..totalChunks-1} exactly.
 *
 * <p>
 * {@link #getMissingIndices()} lists the indices still to be sent, and
 * {@link #getUnexpectedIndices()} the received indices at or beyond the
 * declared total. Both lists may be truncated for very large uploads;
 * {@link #getMissingCount()} is the exact number of missing chunks.
 */
@Getter
public class IncompleteUploadException extends FileStoreException {

    private final List<Integer> missingIndices;
    private final int missingCount;
    private final List<Integer> unexpectedIndices;

    public IncompleteUploadException(String sessionId, List<Integer> missingIndices, List<Integer> unexpectedIndices) {
        this(sessionId, missingIndices, missingIndices.size(), unexpectedIndices);
    }

    public IncompleteUploadException(String sessionId, List<Integer> missingIndices, int missingCount,
                                     List<Integer> unexpectedIndices) {
        super("IncompleteUpload", describe(sessionId, missingIndices, missingCount, unexpectedIndices), 400);
        this.missingIndices = List.copyOf(missingIndices);
        this.missingCount = missingCount;
        this.unexpectedIndices = List.copyOf(unexpectedIndices);
    }

    private static String describe(String sessionId, List<Integer> missing, int missingCount,
                                   List<Integer> unexpected) {
        StringBuilder sb = new StringBuilder("Upload ").append(sessionId).append(" is incomplete");
        if (missingCount > missing.size()) {
            sb.append(", ").append(missingCount).append(" missing chunks, first: ").append(missing);
        } else if (!missing.isEmpty()) {
            sb.append(", missing chunks: ").append(missing);
        }
        if (!unexpected.isEmpty()) {
            sb.append(", chunks beyond declared total: ").append(unexpected);
        }
        return sb.toString();
    }
}
