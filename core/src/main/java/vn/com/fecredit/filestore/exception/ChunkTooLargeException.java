package vn.com.fecredit.filestore.exception;

/**
 * A chunk body exceeded the configured maximum chunk size.
 */
public class ChunkTooLargeException extends FileStoreException {

    public ChunkTooLargeException(int index, long size, long maxChunkSize) {
        super("ChunkTooLarge",
                "Chunk " + index + " is " + size + " bytes, limit is " + maxChunkSize + " bytes", 400);
    }
}
