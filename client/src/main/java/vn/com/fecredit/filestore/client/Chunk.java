package vn.com.fecredit.filestore.client;

/**
 * One segment of a file being uploaded.
 *
 * <p>
 * The byte array is not copied; callers must not modify it after the chunk
 * is handed to a worker. An index of {@code -1} marks the end-of-work
 * sentinel used by the upload workers.
 */
public class Chunk {

    static final Chunk POISON = new Chunk(new byte[0], -1);

    private final byte[] data;
    private final int index;

    public Chunk(byte[] data, int index) {
        this.data = data;
        this.index = index;
    }

    public byte[] getData() {
        return data;
    }

    public int getIndex() {
        return index;
    }

    boolean isPoison() {
        return index < 0;
    }
}
