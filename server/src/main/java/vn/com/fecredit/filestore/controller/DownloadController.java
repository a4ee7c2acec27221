package vn.com.fecredit.filestore.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;
import vn.com.fecredit.filestore.range.ByteWindowReader;
import vn.com.fecredit.filestore.service.RangeDownloadService;
import vn.com.fecredit.filestore.service.RangeDownloadService.PreparedDownload;
import vn.com.fecredit.filestore.tenant.TenantResolver;

import java.io.IOException;
import java.security.Principal;

/**
 * Serves stored artifacts with single byte-range support.
 *
 * <ul>
 * <li>{@code GET /download/{path}}: 200 with the whole artifact, or 206 with the
 * window named by {@code Range}</li>
 * <li>{@code HEAD /download/{path}}: the same framing headers without a body,
 * plus the SHA-256 digest when asked for with {@code Want-Digest}</li>
 * </ul>
 */
@RestController
@RequestMapping("/download")
public class DownloadController {
    private static final Logger log = LoggerFactory.getLogger(DownloadController.class);

    private final RangeDownloadService downloadService;
    private final TenantResolver tenantResolver;

    public DownloadController(RangeDownloadService downloadService, TenantResolver tenantResolver) {
        this.downloadService = downloadService;
        this.tenantResolver = tenantResolver;
    }

    @GetMapping("/{*artifactPath}")
    public ResponseEntity<StreamingResponseBody> download(
            @PathVariable("artifactPath") String artifactPath,
            @RequestHeader(value = HttpHeaders.RANGE, required = false) String range,
            Principal principal, HttpServletRequest request) {
        String tenant = tenantResolver.resolve(principal, request);
        PreparedDownload prepared = downloadService.open(tenant, artifactPath, range);

        HttpHeaders headers = downloadService.framingHeaders(prepared.getFile());
        headers.setContentLength(prepared.getContentLength());
        HttpStatus status = HttpStatus.OK;
        if (prepared.isPartial()) {
            status = HttpStatus.PARTIAL_CONTENT;
            headers.set(HttpHeaders.CONTENT_RANGE, prepared.getContentRange());
        }

        int bufferSize = downloadService.getBufferSize();
        StreamingResponseBody body = out -> {
            try (ByteWindowReader reader = prepared.getReader()) {
                long sent = reader.transferTo(out, bufferSize);
                log.debug("Download complete: path={}, bytes={}", artifactPath, sent);
            } catch (IOException e) {
                log.info("Download interrupted: path={}, error={}", artifactPath, e.getMessage());
                throw e;
            }
        };
        return ResponseEntity.status(status).headers(headers).body(body);
    }

    @RequestMapping(value = "/{*artifactPath}", method = RequestMethod.HEAD)
    public ResponseEntity<Void> head(
            @PathVariable("artifactPath") String artifactPath,
            @RequestHeader(value = RangeDownloadService.WANT_DIGEST, required = false) String wantDigest,
            Principal principal, HttpServletRequest request) {
        String tenant = tenantResolver.resolve(principal, request);
        return ResponseEntity.ok().headers(downloadService.describe(tenant, artifactPath, wantDigest)).build();
    }
}
