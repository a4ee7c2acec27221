package vn.com.fecredit.filestore.port.interfaces;

import vn.com.fecredit.filestore.core.UploadSession;

import java.util.Collection;
import java.util.Optional;

/**
 * Port for keeping upload session records.
 *
 * <p>
 * The registry only needs keyed access plus a full scan for the idle reaper.
 * The default adapter is in-memory; a durable adapter can be swapped in
 * without touching the upload protocol.
 */
public interface SessionStore {

    /**
     * Stores a new session record.
     *
     * @param session the session to keep
     */
    void save(UploadSession session);

    /**
     * Finds a session by its identifier.
     *
     * @param sessionId the session identifier
     * @return the session, or empty if none is stored under that id
     */
    Optional<UploadSession> find(String sessionId);

    /**
     * Removes a session record. No-op if absent.
     *
     * @param sessionId the session identifier
     */
    void remove(String sessionId);

    /**
     * @return a weakly consistent view of every stored session
     */
    Collection<UploadSession> findAll();
}
