package vn.com.fecredit.filestore.range;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads exactly {@code length} bytes of a file starting at {@code start},
 * never past the window.
 */
public class ByteWindowReader implements Closeable {

    private final FileChannel channel;
    private final long end;
    private long position;

    private ByteWindowReader(FileChannel channel, long start, long length) {
        this.channel = channel;
        this.position = start;
        this.end = start + length;
    }

    /**
     * Opens the file for reading. The file is opened immediately so that a
     * missing file fails here, before anything is written to the caller.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     */
    public static ByteWindowReader open(Path file, long start, long length) throws IOException {
        if (start < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid window start=" + start + ", length=" + length);
        }
        return new ByteWindowReader(FileChannel.open(file, StandardOpenOption.READ), start, length);
    }

    public long remaining() {
        return end - position;
    }

    /**
     * Reads up to {@code buffer.length} bytes of the window.
     *
     * @return bytes read, or {@code -1} when the window is exhausted
     * @throws EOFException if the file ends before the window does
     */
    public int read(byte[] buffer) throws IOException {
        long remaining = remaining();
        if (remaining <= 0) {
            return -1;
        }
        int wanted = (int) Math.min(buffer.length, remaining);
        ByteBuffer bb = ByteBuffer.wrap(buffer, 0, wanted);
        int n = channel.read(bb, position);
        if (n < 0) {
            throw new EOFException("File ended at " + position + " before window end " + end);
        }
        position += n;
        return n;
    }

    /**
     * Copies the rest of the window to {@code out} through a buffer of {@code bufferSize} bytes.
     *
     * @return number of bytes copied
     */
    public long transferTo(OutputStream out, int bufferSize) throws IOException {
        byte[] buffer = new byte[bufferSize];
        long copied = 0;
        int n;
        while ((n = read(buffer)) != -1) {
            out.write(buffer, 0, n);
            copied += n;
        }
        return copied;
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
