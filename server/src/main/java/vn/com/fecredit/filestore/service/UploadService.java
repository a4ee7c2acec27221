package vn.com.fecredit.filestore.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import vn.com.fecredit.filestore.core.ChunkAcceptance;
import vn.com.fecredit.filestore.core.FinalizedArtifact;
import vn.com.fecredit.filestore.core.SessionStatus;
import vn.com.fecredit.filestore.core.UploadSession;
import vn.com.fecredit.filestore.core.UploadSessionRegistry;
import vn.com.fecredit.filestore.exception.ChunkTooLargeException;
import vn.com.fecredit.filestore.exception.ChunkWriteException;
import vn.com.fecredit.filestore.model.ChunkAck;
import vn.com.fecredit.filestore.model.FinishResponse;
import vn.com.fecredit.filestore.model.InitResponse;
import vn.com.fecredit.filestore.model.UploadStatusResponse;

import java.io.IOException;

/**
 * Web-facing side of the upload pipeline: translates requests into
 * {@link UploadSessionRegistry} calls and results into response DTOs.
 */
@Service
public class UploadService {

    private static final Logger log = LoggerFactory.getLogger(UploadService.class);

    private final UploadSessionRegistry registry;

    public UploadService(UploadSessionRegistry registry) {
        this.registry = registry;
    }

    public InitResponse initUpload(String tenantId) {
        UploadSession session = registry.initUpload(tenantId);
        return new InitResponse(session.getId(), session.getCreatedAt(), registry.getMaxChunkSize());
    }

    /**
     * Stores one multipart chunk. The declared part size is checked before the
     * bytes are buffered so an oversize chunk is refused without reading it.
     */
    public ChunkAck putChunk(String tenantId, String sessionId, int index, MultipartFile file) {
        if (file.getSize() > registry.getMaxChunkSize()) {
            // still a 404 for unknown sessions
            registry.queryStatus(tenantId, sessionId);
            throw new ChunkTooLargeException(index, file.getSize(), registry.getMaxChunkSize());
        }
        byte[] data;
        try {
            data = file.getBytes();
        } catch (IOException e) {
            log.error("Failed to read chunk body: sessionId={}, chunk={}, error={}", sessionId, index, e.getMessage());
            throw new ChunkWriteException(sessionId, index, e);
        }
        ChunkAcceptance acceptance = registry.putChunk(tenantId, sessionId, index, data);
        return new ChunkAck(acceptance.getSessionId(), acceptance.getIndex(), acceptance.getSize(),
                acceptance.isDuplicate());
    }

    public UploadStatusResponse queryStatus(String tenantId, String sessionId) {
        SessionStatus status = registry.queryStatus(tenantId, sessionId);
        return new UploadStatusResponse(status.getSessionId(), status.getReceivedIndices(), status.getCreatedAt(),
                status.getDeclaredTotal(), status.getState().name(), registry.getMaxChunkSize());
    }

    public FinishResponse finishUpload(String tenantId, String sessionId, String displayName, int totalChunks) {
        FinalizedArtifact artifact = registry.finishUpload(tenantId, sessionId, displayName, totalChunks);
        return new FinishResponse(artifact.getFinalName(), artifact.getFinalName(), artifact.getOriginalName(),
                artifact.getSizeBytes(), artifact.getDigestHex());
    }

    public void abortUpload(String tenantId, String sessionId) {
        registry.abortUpload(tenantId, sessionId);
    }
}
