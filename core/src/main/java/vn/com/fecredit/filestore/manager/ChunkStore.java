package vn.com.fecredit.filestore.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Holds the in-flight chunks of upload sessions on disk.
 *
 * <p>
 * Layout:
 * <pre>
 * uploadRoot/
 *   &lt;sessionId&gt;/
 *     chunk_000000
 *     chunk_000001
 *     chunk_000002.&lt;uuid&gt;.tmp   (staged, not yet committed)
 * </pre>
 *
 * <p>
 * A chunk is written in two steps: {@link #stage} writes the bytes to a
 * uniquely named temporary file and forces them to disk, {@link #commit}
 * renames the temporary file to its final {@code chunk_NNNNNN} name. Only
 * committed chunks are ever merged, so a half-written chunk can never be
 * mistaken for a received one.
 */
public class ChunkStore {

    private static final Logger log = LoggerFactory.getLogger(ChunkStore.class);

    static final String CHUNK_PREFIX = "chunk_";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path uploadRoot;

    public ChunkStore(Path uploadRoot) throws IOException {
        this.uploadRoot = uploadRoot;
        Files.createDirectories(uploadRoot);
    }

    public Path getUploadRoot() {
        return uploadRoot;
    }

    /**
     * Creates the scratch directory owned by one session.
     *
     * @param sessionId session identifier, used as directory name
     * @return the new, empty directory
     * @throws IOException if the directory cannot be created or already exists
     */
    public Path createSessionDir(String sessionId) throws IOException {
        Path dir = uploadRoot.resolve(sessionId);
        Files.createDirectory(dir);
        log.debug("Created chunk directory {}", dir);
        return dir;
    }

    /**
     * Fixed-width, zero-padded chunk file name for an index.
     */
    public static String chunkFileName(int index) {
        return String.format("%s%06d", CHUNK_PREFIX, index);
    }

    public Path chunkPath(Path sessionDir, int index) {
        return sessionDir.resolve(chunkFileName(index));
    }

    /**
     * Writes chunk bytes to a temporary file in the session directory.
     *
     * @param sessionDir session scratch directory
     * @param index      chunk index
     * @param data       chunk bytes
     * @return the staged temporary file, to be passed to {@link #commit} or {@link #discard}
     * @throws IOException if the bytes cannot be written
     */
    public Path stage(Path sessionDir, int index, byte[] data) throws IOException {
        Path staged = sessionDir.resolve(chunkFileName(index) + "." + UUID.randomUUID() + TEMP_SUFFIX);
        try (FileChannel ch = FileChannel.open(staged, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(data);
            while (buffer.hasRemaining()) {
                ch.write(buffer);
            }
            ch.force(true);
        } catch (IOException e) {
            discard(staged);
            throw e;
        }
        return staged;
    }

    /**
     * Moves a staged chunk to its final name.
     *
     * @param staged     file returned by {@link #stage}
     * @param sessionDir session scratch directory
     * @param index      chunk index
     * @return the committed chunk path
     * @throws IOException if the rename fails
     */
    public Path commit(Path staged, Path sessionDir, int index) throws IOException {
        Path target = chunkPath(sessionDir, index);
        try {
            Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    /**
     * Deletes a staged chunk that will not be committed. Failures are logged only.
     */
    public void discard(Path staged) {
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            log.warn("Failed to delete staged chunk {}: {}", staged, e.getMessage());
        }
    }

    /**
     * Lists the committed chunks {@code 0..totalChunks-1} in merge order.
     */
    public List<Path> orderedChunks(Path sessionDir, int totalChunks) {
        List<Path> chunks = new ArrayList<>(totalChunks);
        for (int i = 0; i < totalChunks; i++) {
            chunks.add(chunkPath(sessionDir, i));
        }
        return chunks;
    }

    /**
     * Recursively deletes a session's scratch directory. Missing directories are ignored.
     *
     * @throws IOException if an entry cannot be deleted
     */
    public void deleteSessionDir(Path sessionDir) throws IOException {
        if (!Files.exists(sessionDir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(sessionDir)) {
            List<Path> entries = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path entry : entries) {
                Files.deleteIfExists(entry);
            }
        }
        log.debug("Deleted chunk directory {}", sessionDir);
    }
}
