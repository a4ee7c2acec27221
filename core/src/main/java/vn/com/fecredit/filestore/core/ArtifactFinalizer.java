package vn.com.fecredit.filestore.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.filestore.exception.MergeIOException;
import vn.com.fecredit.filestore.model.util.ChecksumUtil;
import vn.com.fecredit.filestore.util.FileNameValidator;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Merges the chunks of a complete upload into one artifact in permanent storage.
 *
 * <p>
 * Chunks are concatenated in the given order into a temporary file under
 * {@code storageRoot/.staging}, hashing the bytes with SHA-256 as they are
 * written. Only after the temporary file is forced to disk is it renamed to
 * {@code storageRoot/<tenant>/<name>}, so a failed or interrupted merge never
 * leaves a truncated file under a final name.
 *
 * <p>
 * When {@code <name>} is taken, {@code <base>_<yyyyMMdd_HHmmss>_<counter>.<ext>}
 * is tried with an increasing counter. Name choice and rename are serialized
 * per target directory through a fixed set of striped locks; the merge itself
 * is not.
 */
public class ArtifactFinalizer {

    private static final Logger log = LoggerFactory.getLogger(ArtifactFinalizer.class);

    static final String STAGING_DIR = ".staging";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int COPY_BUFFER_SIZE = 64 * 1024;
    static final int NAMING_LOCK_STRIPES = 64;

    private final Path storageRoot;
    private final Path stagingDir;
    private final Clock clock;
    private final ReentrantLock[] namingLocks = new ReentrantLock[NAMING_LOCK_STRIPES];

    public ArtifactFinalizer(Path storageRoot, Clock clock) throws IOException {
        this.storageRoot = storageRoot;
        this.stagingDir = storageRoot.resolve(STAGING_DIR);
        this.clock = clock;
        for (int i = 0; i < namingLocks.length; i++) {
            namingLocks[i] = new ReentrantLock();
        }
        Files.createDirectories(stagingDir);
    }

    public Path getStorageRoot() {
        return storageRoot;
    }

    /**
     * Storage directory of one tenant.
     *
     * @throws IllegalArgumentException if the tenant id is not a single valid path segment
     *                                  or is a hidden name reserved for internal directories
     */
    public Path tenantDir(String tenantId) {
        FileNameValidator.requireValid(tenantId, "tenant id");
        if (tenantId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid tenant id: " + tenantId);
        }
        return storageRoot.resolve(tenantId);
    }

    /**
     * Merges {@code chunks} into a new artifact named after {@code displayName}.
     *
     * @param tenantId    owner of the artifact
     * @param chunks      chunk files in merge order
     * @param displayName requested artifact name
     * @return the stored artifact
     * @throws MergeIOException if a chunk cannot be read or the artifact cannot be written
     */
    public FinalizedArtifact finalizeUpload(String tenantId, List<Path> chunks, String displayName) {
        FileNameValidator.requireValid(displayName, "display name");
        Path targetDir = tenantDir(tenantId);
        Path temp = stagingDir.resolve(UUID.randomUUID() + ".partial");
        try {
            Files.createDirectories(targetDir);
            MessageDigest digest = ChecksumUtil.newDigest();
            long size = merge(chunks, temp, digest);
            String digestHex = ChecksumUtil.toHex(digest.digest());

            Path finalPath = publish(temp, targetDir, displayName);
            String finalName = finalPath.getFileName().toString();
            log.info("Finalized artifact tenant={}, name={}, size={}, sha256={}", tenantId, finalName, size, digestHex);
            return new FinalizedArtifact(finalPath, finalName, displayName, size, digestHex);
        } catch (IOException e) {
            deleteQuietly(temp);
            log.error("Failed to merge {} chunks into {} for tenant={}: {}", chunks.size(), displayName, tenantId, e.getMessage(), e);
            throw new MergeIOException("Failed to merge chunks into " + displayName + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            deleteQuietly(temp);
            throw e;
        }
    }

    private long merge(List<Path> chunks, Path temp, MessageDigest digest) throws IOException {
        try (FileChannel ch = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            OutputStream out = new DigestOutputStream(
                    new BufferedOutputStream(Channels.newOutputStream(ch), COPY_BUFFER_SIZE), digest);
            long size = 0;
            for (int i = 0; i < chunks.size(); i++) {
                size += Files.copy(chunks.get(i), out);
                log.debug("Merged chunk {}/{} into {}", i + 1, chunks.size(), temp.getFileName());
            }
            out.flush();
            ch.force(true);
            return size;
        }
    }

    private Path publish(Path temp, Path targetDir, String displayName) throws IOException {
        ReentrantLock lock = namingLock(targetDir);
        lock.lock();
        try {
            Path target = targetDir.resolve(resolveFreeName(targetDir, displayName));
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target);
            }
            return target;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Directories sharing a stripe also share the lock.
     */
    ReentrantLock namingLock(Path dir) {
        return namingLocks[Math.floorMod(dir.hashCode(), namingLocks.length)];
    }

    /**
     * First name not present in {@code dir}: the display name itself, then
     * disambiguated variants with counter 1, 2, ...
     */
    String resolveFreeName(Path dir, String displayName) {
        String candidate = displayName;
        if (!Files.exists(dir.resolve(candidate), LinkOption.NOFOLLOW_LINKS)) {
            return candidate;
        }
        String stamp = STAMP.format(LocalDateTime.now(clock));
        int counter = 1;
        do {
            candidate = disambiguate(displayName, stamp, counter++);
        } while (Files.exists(dir.resolve(candidate), LinkOption.NOFOLLOW_LINKS));
        log.debug("Name {} is taken in {}, using {}", displayName, dir, candidate);
        return candidate;
    }

    /**
     * {@code report.pdf} becomes {@code report_<stamp>_<counter>.pdf}; names
     * without an extension (or starting with their only dot) get the suffix appended.
     */
    static String disambiguate(String displayName, String stamp, int counter) {
        int dot = displayName.lastIndexOf('.');
        if (dot > 0) {
            return displayName.substring(0, dot) + "_" + stamp + "_" + counter + displayName.substring(dot);
        }
        return displayName + "_" + stamp + "_" + counter;
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete partial artifact {}: {}", temp, e.getMessage());
        }
    }
}
