package vn.com.fecredit.filestore.core;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable progress snapshot of a session.
 */
@Value
public class SessionStatus {
    String sessionId;
    List<Integer> receivedIndices;
    Instant createdAt;
    Integer declaredTotal;
    SessionState state;

    static SessionStatus of(UploadSession session) {
        return new SessionStatus(session.getId(), List.copyOf(session.receivedSnapshot()), session.getCreatedAt(),
                session.getDeclaredTotal(), session.getState());
    }
}
