package vn.com.fecredit.filestore.exception;

/**
 * Storage failure while persisting a chunk. The chunk is not marked received.
 */
public class ChunkWriteException extends FileStoreException {

    public ChunkWriteException(String sessionId, int index, Throwable cause) {
        super("ChunkWriteError", "Failed to store chunk " + index + " of upload " + sessionId, 500, cause);
    }
}
