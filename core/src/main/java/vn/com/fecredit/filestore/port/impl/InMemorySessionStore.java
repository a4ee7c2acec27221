package vn.com.fecredit.filestore.port.impl;

import vn.com.fecredit.filestore.core.UploadSession;
import vn.com.fecredit.filestore.port.interfaces.SessionStore;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default in-memory implementation of {@link SessionStore}. Sessions do not
 * survive a restart.
 */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, UploadSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void save(UploadSession session) {
        if (session == null || session.getId() == null) {
            throw new IllegalArgumentException("Session or session id cannot be null");
        }
        sessions.put(session.getId(), session);
    }

    @Override
    public Optional<UploadSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void remove(String sessionId) {
        if (sessionId != null) {
            sessions.remove(sessionId);
        }
    }

    @Override
    public Collection<UploadSession> findAll() {
        return List.copyOf(sessions.values());
    }
}
