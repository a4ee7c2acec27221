package vn.com.fecredit.filestore.core;

import lombok.AccessLevel;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Server-side record of one in-progress chunked upload.
 *
 * <p>
 * The received-index set is concurrent so status probes never block. All
 * mutations (chunk commit, finalize, abort, reap) happen while holding
 * {@link #getLock()}, the single serialization point of the session.
 */
@Getter
public class UploadSession {

    private final String id;
    private final String tenantId;
    private final Path chunkDir;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final Set<Integer> receivedIndices = ConcurrentHashMap.newKeySet();

    @Getter(AccessLevel.PACKAGE)
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Instant lastActivityAt;
    private volatile Integer declaredTotal;
    private volatile SessionState state = SessionState.OPEN;

    public UploadSession(String id, String tenantId, Path chunkDir, Instant createdAt) {
        this.id = id;
        this.tenantId = tenantId;
        this.chunkDir = chunkDir;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
    }

    public boolean isReceived(int index) {
        return receivedIndices.contains(index);
    }

    /**
     * @return received chunk indices in ascending order
     */
    public List<Integer> receivedSnapshot() {
        List<Integer> snapshot = new ArrayList<>(receivedIndices);
        Collections.sort(snapshot);
        return snapshot;
    }

    public int receivedCount() {
        return receivedIndices.size();
    }

    void markReceived(int index, Instant now) {
        receivedIndices.add(index);
        lastActivityAt = now;
    }

    void setDeclaredTotal(Integer declaredTotal) {
        this.declaredTotal = declaredTotal;
    }

    void setState(SessionState state) {
        this.state = state;
    }
}
