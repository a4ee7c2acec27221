package vn.com.fecredit.filestore.service;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Service;
import vn.com.fecredit.filestore.config.FileStoreProperties;
import vn.com.fecredit.filestore.core.ArtifactLocator;
import vn.com.fecredit.filestore.exception.ArtifactNotFoundException;
import vn.com.fecredit.filestore.exception.RangeRejectedException;
import vn.com.fecredit.filestore.model.util.ChecksumUtil;
import vn.com.fecredit.filestore.range.ByteWindowReader;
import vn.com.fecredit.filestore.range.RangePlan;
import vn.com.fecredit.filestore.range.RangePlanner;
import vn.com.fecredit.filestore.range.RangeWindow;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Locale;

/**
 * Serves stored artifacts, whole or by a single byte range.
 *
 * <p>
 * The artifact is located, measured and opened before the controller commits
 * a response, so a missing file or an unservable range is still reported with
 * a proper status code.
 */
@Service
public class RangeDownloadService {

    private static final Logger log = LoggerFactory.getLogger(RangeDownloadService.class);

    static final String DIGEST_ALGORITHM_TOKEN = "sha-256";
    public static final String WANT_DIGEST = "Want-Digest";
    public static final String DIGEST = "Digest";
    public static final String CONTENT_SHA256 = "X-Content-SHA256";

    private final ArtifactLocator locator;
    private final FileStoreProperties properties;

    public RangeDownloadService(ArtifactLocator locator, FileStoreProperties properties) {
        this.locator = locator;
        this.properties = properties;
    }

    /**
     * An artifact opened for streaming: the whole file, or one window of it.
     */
    @Getter
    public static class PreparedDownload {
        private final Path file;
        private final long totalLength;
        private final RangeWindow window;
        private final ByteWindowReader reader;

        PreparedDownload(Path file, long totalLength, RangeWindow window, ByteWindowReader reader) {
            this.file = file;
            this.totalLength = totalLength;
            this.window = window;
            this.reader = reader;
        }

        public boolean isPartial() {
            return window != null;
        }

        public long getContentLength() {
            return window != null ? window.length() : totalLength;
        }

        public String getContentRange() {
            return window == null ? null
                    : "bytes " + window.getStart() + "-" + window.getEnd() + "/" + totalLength;
        }
    }

    /**
     * Opens an artifact for a GET request.
     *
     * @throws ArtifactNotFoundException if the artifact does not exist for the tenant
     * @throws RangeRejectedException    if {@code rangeHeader} cannot be served
     */
    public PreparedDownload open(String tenantId, String artifactPath, String rangeHeader) {
        Path file = locator.locate(tenantId, artifactPath);
        long total = sizeOf(file, artifactPath);

        RangePlan plan = RangePlanner.plan(rangeHeader, total);
        if (plan.getKind() == RangePlan.Kind.REJECTED) {
            log.debug("Range rejected: tenant={}, path={}, range={}, plan={}", tenantId, artifactPath, rangeHeader, plan);
            throw new RangeRejectedException(plan.getRejection(), rangeHeader, total);
        }
        RangeWindow window = plan.getKind() == RangePlan.Kind.WINDOW ? plan.getWindow() : null;
        long start = window != null ? window.getStart() : 0;
        long length = window != null ? window.length() : total;
        try {
            ByteWindowReader reader = ByteWindowReader.open(file, start, length);
            log.info("Download started: tenant={}, path={}, range={}, bytes={}", tenantId, artifactPath,
                    window != null ? window.getStart() + "-" + window.getEnd() : "full", length);
            return new PreparedDownload(file, total, window, reader);
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(artifactPath, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open " + artifactPath, e);
        }
    }

    /**
     * Headers of a metadata probe. When {@code wantDigest} asks for SHA-256 the
     * digest is recomputed from the stored bytes.
     *
     * @throws ArtifactNotFoundException if the artifact does not exist for the tenant
     */
    public HttpHeaders describe(String tenantId, String artifactPath, String wantDigest) {
        Path file = locator.locate(tenantId, artifactPath);
        long total = sizeOf(file, artifactPath);
        HttpHeaders headers = framingHeaders(file);
        headers.setContentLength(total);
        if (wantsSha256(wantDigest)) {
            try {
                byte[] digest = ChecksumUtil.digest(file);
                headers.set(DIGEST, DIGEST_ALGORITHM_TOKEN + "=" + Base64.getEncoder().encodeToString(digest));
                headers.set(CONTENT_SHA256, ChecksumUtil.toHex(digest));
            } catch (NoSuchFileException e) {
                throw new ArtifactNotFoundException(artifactPath, e);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to digest " + artifactPath, e);
            }
        }
        return headers;
    }

    /**
     * {@code Content-Type}, {@code Content-Disposition} and {@code Accept-Ranges} of an artifact.
     */
    public HttpHeaders framingHeaders(Path file) {
        String name = file.getFileName().toString();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaTypeFactory.getMediaType(name).orElse(MediaType.APPLICATION_OCTET_STREAM));
        headers.setContentDisposition(contentDisposition(name));
        headers.set(HttpHeaders.ACCEPT_RANGES, "bytes");
        return headers;
    }

    public int getBufferSize() {
        return properties.getDownloadBufferSize();
    }

    static ContentDisposition contentDisposition(String name) {
        if (isPlainAscii(name)) {
            return ContentDisposition.attachment().filename(name).build();
        }
        return ContentDisposition.attachment().filename(name, StandardCharsets.UTF_8).build();
    }

    static boolean wantsSha256(String wantDigest) {
        if (wantDigest == null) {
            return false;
        }
        for (String token : wantDigest.split(",")) {
            String algorithm = token.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
            if (DIGEST_ALGORITHM_TOKEN.equals(algorithm)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isPlainAscii(String name) {
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c < 0x20 || c > 0x7e || c == '"' || c == '\\' || c == '%') {
                return false;
            }
        }
        return true;
    }

    private static long sizeOf(Path file, String artifactPath) {
        try {
            return Files.size(file);
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(artifactPath, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat " + artifactPath, e);
        }
    }
}
