package vn.com.fecredit.filestore.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import vn.com.fecredit.filestore.model.ChunkAck;
import vn.com.fecredit.filestore.model.FinishResponse;
import vn.com.fecredit.filestore.model.InitResponse;
import vn.com.fecredit.filestore.model.UploadStatusResponse;
import vn.com.fecredit.filestore.service.UploadService;
import vn.com.fecredit.filestore.tenant.TenantResolver;

import java.security.Principal;

/**
 * REST controller for chunked file uploads.
 *
 * <p>
 * Exposes endpoints for:
 * <ul>
 * <li>Opening upload sessions</li>
 * <li>Uploading chunks in any order, any number of times</li>
 * <li>Finishing a session into a stored artifact</li>
 * <li>Checking upload status</li>
 * <li>Aborting uploads</li>
 * </ul>
 * Errors are translated by {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/upload")
public class UploadController {
    private static final Logger log = LoggerFactory.getLogger(UploadController.class);

    private final UploadService uploadService;
    private final TenantResolver tenantResolver;

    public UploadController(UploadService uploadService, TenantResolver tenantResolver) {
        this.uploadService = uploadService;
        this.tenantResolver = tenantResolver;
    }

    /**
     * Opens a new upload session.
     *
     * @return the session id and the chunk size limit
     */
    @PostMapping("/init")
    public ResponseEntity<InitResponse> initUpload(Principal principal, HttpServletRequest request) {
        String tenant = tenantResolver.resolve(principal, request);
        return ResponseEntity.ok(uploadService.initUpload(tenant));
    }

    /**
     * Uploads a single chunk for an open session.
     *
     * @param sessionId Upload session ID
     * @param index     Chunk index (0-based)
     * @param file      Chunk data
     */
    @PostMapping("/chunk")
    public ResponseEntity<ChunkAck> uploadChunk(
            @RequestParam("sessionId") String sessionId,
            @RequestParam("index") int index,
            @RequestPart("file") MultipartFile file,
            Principal principal, HttpServletRequest request) {
        String tenant = tenantResolver.resolve(principal, request);
        log.debug("Received chunk: sessionId={}, index={}, size={}", sessionId, index, file.getSize());
        return ResponseEntity.ok(uploadService.putChunk(tenant, sessionId, index, file));
    }

    /**
     * Merges the received chunks into an artifact named {@code displayName}.
     *
     * @param sessionId   Upload session ID
     * @param displayName Requested artifact name
     * @param totalChunks Number of chunks the client sent
     */
    @PostMapping("/finish")
    public ResponseEntity<FinishResponse> finishUpload(
            @RequestParam("sessionId") String sessionId,
            @RequestParam("displayName") String displayName,
            @RequestParam("totalChunks") int totalChunks,
            Principal principal, HttpServletRequest request) {
        String tenant = tenantResolver.resolve(principal, request);
        return ResponseEntity.ok(uploadService.finishUpload(tenant, sessionId, displayName, totalChunks));
    }

    @GetMapping("/status/{sessionId}")
    public ResponseEntity<UploadStatusResponse> getStatus(@PathVariable("sessionId") String sessionId,
                                                          Principal principal, HttpServletRequest request) {
        String tenant = tenantResolver.resolve(principal, request);
        return ResponseEntity.ok(uploadService.queryStatus(tenant, sessionId));
    }

    /**
     * Aborts an open upload session and drops its chunks.
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> abort(@PathVariable("sessionId") String sessionId,
                                      Principal principal, HttpServletRequest request) {
        String tenant = tenantResolver.resolve(principal, request);
        uploadService.abortUpload(tenant, sessionId);
        return ResponseEntity.noContent().build();
    }
}
