package vn.com.fecredit.filestore.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.filestore.exception.ChunkTooLargeException;
import vn.com.fecredit.filestore.exception.ChunkWriteException;
import vn.com.fecredit.filestore.exception.IncompleteUploadException;
import vn.com.fecredit.filestore.exception.SessionNotFoundException;
import vn.com.fecredit.filestore.manager.ChunkStore;
import vn.com.fecredit.filestore.port.interfaces.SessionStore;
import vn.com.fecredit.filestore.util.FileNameValidator;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks chunked uploads from {@code init} to {@code finish}.
 *
 * <p>
 * Concurrency model:
 * <ul>
 * <li>Sessions live in a {@link SessionStore}; there is no lock across sessions.</li>
 * <li>Chunk bytes are staged outside any lock, so parallel chunks of one
 * session are written concurrently.</li>
 * <li>Committing a staged chunk and adding its index happen under the
 * session lock, as do the completeness check and the merge of
 * {@link #finishUpload}. A finish therefore never sees a stale index set, and
 * no chunk can be accepted while the session is being merged.</li>
 * </ul>
 *
 * <p>
 * A session is removed only after its artifact has been renamed into
 * permanent storage. When the merge fails the session goes back to
 * {@link SessionState#OPEN} with every received chunk intact.
 */
public class UploadSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(UploadSessionRegistry.class);

    public static final int DEFAULT_MAX_CHUNKS_PER_UPLOAD = 1_000_000;

    /** Upper bound on each index list carried by an {@link IncompleteUploadException}. */
    static final int MAX_REPORTED_INDICES = 1000;

    private final SessionStore sessionStore;
    private final ChunkStore chunkStore;
    private final ArtifactFinalizer finalizer;
    private final int maxChunkSize;
    private final int maxChunksPerUpload;
    private final Clock clock;

    public UploadSessionRegistry(SessionStore sessionStore, ChunkStore chunkStore, ArtifactFinalizer finalizer,
                                 int maxChunkSize, Clock clock) {
        this(sessionStore, chunkStore, finalizer, maxChunkSize, DEFAULT_MAX_CHUNKS_PER_UPLOAD, clock);
    }

    /**
     * @param maxChunkSize       largest accepted chunk, in bytes
     * @param maxChunksPerUpload largest {@code totalChunks} a finish call may declare
     */
    public UploadSessionRegistry(SessionStore sessionStore, ChunkStore chunkStore, ArtifactFinalizer finalizer,
                                 int maxChunkSize, int maxChunksPerUpload, Clock clock) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive: " + maxChunkSize);
        }
        if (maxChunksPerUpload <= 0) {
            throw new IllegalArgumentException("maxChunksPerUpload must be positive: " + maxChunksPerUpload);
        }
        this.sessionStore = sessionStore;
        this.chunkStore = chunkStore;
        this.finalizer = finalizer;
        this.maxChunkSize = maxChunkSize;
        this.maxChunksPerUpload = maxChunksPerUpload;
        this.clock = clock;
    }

    public int getMaxChunkSize() {
        return maxChunkSize;
    }

    public int getMaxChunksPerUpload() {
        return maxChunksPerUpload;
    }

    /**
     * Opens a new session with its own chunk directory.
     *
     * @param tenantId tenant the session belongs to
     * @return the new session
     * @throws UncheckedIOException if the chunk directory cannot be created
     */
    public UploadSession initUpload(String tenantId) {
        String sessionId = UUID.randomUUID().toString();
        Path chunkDir;
        try {
            chunkDir = chunkStore.createSessionDir(sessionId);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create chunk directory for upload " + sessionId, e);
        }
        UploadSession session = new UploadSession(sessionId, tenantId, chunkDir, clock.instant());
        sessionStore.save(session);
        log.info("Upload initialized: sessionId={}, tenant={}", sessionId, tenantId);
        return session;
    }

    /**
     * Stores one chunk. Re-sending an index that was already received is a
     * successful no-op.
     *
     * @throws SessionNotFoundException if the session is unknown or closed
     * @throws ChunkTooLargeException   if {@code data} exceeds the maximum chunk size
     * @throws ChunkWriteException      if the chunk cannot be stored
     */
    public ChunkAcceptance putChunk(String tenantId, String sessionId, int index, byte[] data) {
        if (index < 0) {
            throw new IllegalArgumentException("Chunk index must not be negative: " + index);
        }
        if (data == null) {
            throw new IllegalArgumentException("Chunk data is required");
        }
        UploadSession session = requireSession(tenantId, sessionId);
        if (data.length > maxChunkSize) {
            throw new ChunkTooLargeException(index, data.length, maxChunkSize);
        }
        if (session.isReceived(index)) {
            log.info("Chunk already received, skipped: sessionId={}, chunk={}", sessionId, index);
            return new ChunkAcceptance(sessionId, index, data.length, true);
        }

        Path staged;
        try {
            staged = chunkStore.stage(session.getChunkDir(), index, data);
        } catch (IOException e) {
            if (session.getState() == SessionState.CLOSED) {
                throw new SessionNotFoundException(sessionId);
            }
            log.error("Chunk upload failed: sessionId={}, chunk={}, error={}", sessionId, index, e.getMessage());
            throw new ChunkWriteException(sessionId, index, e);
        }

        ReentrantLock lock = session.getLock();
        lock.lock();
        try {
            if (session.getState() == SessionState.CLOSED) {
                chunkStore.discard(staged);
                throw new SessionNotFoundException(sessionId);
            }
            if (session.isReceived(index)) {
                chunkStore.discard(staged);
                log.info("Chunk already received, skipped: sessionId={}, chunk={}", sessionId, index);
                return new ChunkAcceptance(sessionId, index, data.length, true);
            }
            try {
                chunkStore.commit(staged, session.getChunkDir(), index);
            } catch (IOException e) {
                chunkStore.discard(staged);
                log.error("Chunk commit failed: sessionId={}, chunk={}, error={}", sessionId, index, e.getMessage());
                throw new ChunkWriteException(sessionId, index, e);
            }
            session.markReceived(index, clock.instant());
        } finally {
            lock.unlock();
        }
        log.debug("Chunk stored: sessionId={}, chunk={}, size={}", sessionId, index, data.length);
        return new ChunkAcceptance(sessionId, index, data.length, false);
    }

    /**
     * @throws SessionNotFoundException if the session is unknown or closed
     */
    public SessionStatus queryStatus(String tenantId, String sessionId) {
        return SessionStatus.of(requireSession(tenantId, sessionId));
    }

    /**
     * Merges a complete session into an artifact and closes the session.
     *
     * @param tenantId    tenant owning the session
     * @param sessionId   session to finish
     * @param displayName requested artifact name
     * @param totalChunks declared number of chunks
     * @return the stored artifact
     * @throws SessionNotFoundException   if the session is unknown or closed
     * @throws IllegalArgumentException   if the name is invalid or {@code totalChunks} is negative or above
     *                                    {@link #getMaxChunksPerUpload()}
     * @throws IncompleteUploadException  if the received indices differ from {@code 0..totalChunks-1}
     * @throws vn.com.fecredit.filestore.exception.MergeIOException if the merge fails; the session stays open
     */
    public FinalizedArtifact finishUpload(String tenantId, String sessionId, String displayName, int totalChunks) {
        FileNameValidator.requireValid(displayName, "display name");
        if (totalChunks < 0) {
            throw new IllegalArgumentException("totalChunks must not be negative: " + totalChunks);
        }
        if (totalChunks > maxChunksPerUpload) {
            throw new IllegalArgumentException("totalChunks " + totalChunks + " exceeds the limit of "
                    + maxChunksPerUpload + " chunks per upload");
        }
        UploadSession session = requireSession(tenantId, sessionId);

        ReentrantLock lock = session.getLock();
        lock.lock();
        try {
            if (session.getState() == SessionState.CLOSED) {
                throw new SessionNotFoundException(sessionId);
            }
            session.setDeclaredTotal(totalChunks);
            checkComplete(session, totalChunks);

            session.setState(SessionState.FINALIZING);
            FinalizedArtifact artifact;
            try {
                artifact = finalizer.finalizeUpload(tenantId,
                        chunkStore.orderedChunks(session.getChunkDir(), totalChunks), displayName);
            } catch (RuntimeException e) {
                session.setState(SessionState.OPEN);
                log.warn("Finalize failed, session kept for retry: sessionId={}, error={}", sessionId, e.getMessage());
                throw e;
            }

            session.setState(SessionState.CLOSED);
            sessionStore.remove(sessionId);
            deleteChunks(session);
            log.info("Upload finished: sessionId={}, artifact={}, size={}", sessionId, artifact.getFinalName(),
                    artifact.getSizeBytes());
            return artifact;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discards an open session and its chunks.
     *
     * @throws SessionNotFoundException if the session is unknown or closed
     */
    public void abortUpload(String tenantId, String sessionId) {
        UploadSession session = requireSession(tenantId, sessionId);
        ReentrantLock lock = session.getLock();
        lock.lock();
        try {
            if (session.getState() == SessionState.CLOSED) {
                throw new SessionNotFoundException(sessionId);
            }
            close(session);
        } finally {
            lock.unlock();
        }
        log.info("Upload aborted: sessionId={}, tenant={}", sessionId, tenantId);
    }

    /**
     * Closes open sessions that have not accepted a chunk for longer than
     * {@code idleTimeout}. Sessions busy with a write or a merge are left for
     * the next sweep.
     *
     * @return number of sessions reaped
     */
    public int reapIdle(Duration idleTimeout) {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int reaped = 0;
        for (UploadSession session : sessionStore.findAll()) {
            if (!session.getLastActivityAt().isBefore(cutoff)) {
                continue;
            }
            ReentrantLock lock = session.getLock();
            if (!lock.tryLock()) {
                log.debug("Session busy, not reaped this time: sessionId={}", session.getId());
                continue;
            }
            try {
                if (session.getState() == SessionState.OPEN && session.getLastActivityAt().isBefore(cutoff)) {
                    close(session);
                    reaped++;
                    log.info("Reaped idle upload: sessionId={}, tenant={}, lastActivity={}", session.getId(),
                            session.getTenantId(), session.getLastActivityAt());
                }
            } finally {
                lock.unlock();
            }
        }
        return reaped;
    }

    /**
     * Compares the received set with {@code 0..totalChunks-1}. Only the first
     * {@link #MAX_REPORTED_INDICES} indices of each kind are listed; the
     * missing count is always exact.
     */
    private void checkComplete(UploadSession session, int totalChunks) {
        int receivedInRange = 0;
        List<Integer> unexpected = new ArrayList<>();
        for (Integer index : session.receivedSnapshot()) {
            if (index < totalChunks) {
                receivedInRange++;
            } else if (unexpected.size() < MAX_REPORTED_INDICES) {
                unexpected.add(index);
            }
        }
        int missingCount = totalChunks - receivedInRange;
        int toReport = Math.min(missingCount, MAX_REPORTED_INDICES);
        List<Integer> missing = new ArrayList<>(toReport);
        for (int i = 0; i < totalChunks && missing.size() < toReport; i++) {
            if (!session.isReceived(i)) {
                missing.add(i);
            }
        }
        if (missingCount > 0 || !unexpected.isEmpty()) {
            throw new IncompleteUploadException(session.getId(), missing, missingCount, unexpected);
        }
    }

    private void close(UploadSession session) {
        session.setState(SessionState.CLOSED);
        sessionStore.remove(session.getId());
        deleteChunks(session);
    }

    private void deleteChunks(UploadSession session) {
        try {
            chunkStore.deleteSessionDir(session.getChunkDir());
        } catch (IOException e) {
            log.warn("Failed to delete chunk directory {}: {}", session.getChunkDir(), e.getMessage());
        }
    }

    private UploadSession requireSession(String tenantId, String sessionId) {
        return sessionStore.find(sessionId)
                .filter(session -> session.getTenantId().equals(tenantId))
                .filter(session -> session.getState() != SessionState.CLOSED)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
