package vn.com.fecredit.filestore.integration;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import vn.com.fecredit.filestore.model.ChunkAck;
import vn.com.fecredit.filestore.model.ErrorResponse;
import vn.com.fecredit.filestore.model.FinishResponse;
import vn.com.fecredit.filestore.model.InitResponse;
import vn.com.fecredit.filestore.model.util.ChecksumUtil;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Random;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Uploads over real HTTP and reads the artifacts back through the range server.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"filestore.max-chunk-size=64KB", "filestore.download-buffer-size=1000"})
public class FileStoreIntegrationTest {

    private static final String TENANT_HEADER = "X-Tenant-Id";

    @Autowired
    private TestRestTemplate restTemplate;

    @DynamicPropertySource
    static void storage(DynamicPropertyRegistry registry) throws IOException {
        Path root = Files.createTempDirectory("filestore-it");
        registry.add("filestore.upload-dir", () -> root.resolve("in-progress").toString());
        registry.add("filestore.storage-dir", () -> root.resolve("storage").toString());
    }

    @Test
    public void testUploadThenRangeDownload() {
        String tenant = newTenant();
        String sessionId = init(tenant);
        putChunk(tenant, sessionId, 2, bytes("ef"));
        putChunk(tenant, sessionId, 0, bytes("ab"));
        putChunk(tenant, sessionId, 1, bytes("cd"));

        FinishResponse finished = finish(tenant, sessionId, "x.txt", 3);
        assertEquals("x.txt", finished.getArtifactId());
        assertEquals(6, finished.getSize());
        assertEquals(ChecksumUtil.checksumOf(bytes("abcdef")), finished.getDigestHex());

        ResponseEntity<byte[]> full = get(tenant, "x.txt", null);
        assertEquals(HttpStatus.OK, full.getStatusCode());
        assertEquals("abcdef", new String(full.getBody(), StandardCharsets.UTF_8));
        assertEquals("bytes", full.getHeaders().getFirst(HttpHeaders.ACCEPT_RANGES));
        assertEquals(6, full.getHeaders().getContentLength());
        assertEquals(MediaType.TEXT_PLAIN, full.getHeaders().getContentType());
        assertEquals("attachment; filename=\"x.txt\"", full.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION));

        ResponseEntity<byte[]> window = get(tenant, "x.txt", "bytes=2-4");
        assertEquals(HttpStatus.PARTIAL_CONTENT, window.getStatusCode());
        assertEquals("cde", new String(window.getBody(), StandardCharsets.UTF_8));
        assertEquals("bytes 2-4/6", window.getHeaders().getFirst(HttpHeaders.CONTENT_RANGE));
        assertEquals(3, window.getHeaders().getContentLength());

        assertEquals("ef", new String(get(tenant, "x.txt", "bytes=-2").getBody(), StandardCharsets.UTF_8));
        assertEquals("bcdef", new String(get(tenant, "x.txt", "bytes=1-").getBody(), StandardCharsets.UTF_8));
    }

    @Test
    public void testRangeRejections() {
        String tenant = newTenant();
        upload(tenant, "r.bin", bytes("abcdef"), 4);

        ResponseEntity<byte[]> unsatisfiable = get(tenant, "r.bin", "bytes=10-20");
        assertEquals(HttpStatus.REQUESTED_RANGE_NOT_SATISFIABLE, unsatisfiable.getStatusCode());
        assertEquals("bytes */6", unsatisfiable.getHeaders().getFirst(HttpHeaders.CONTENT_RANGE));

        ResponseEntity<byte[]> multi = get(tenant, "r.bin", "bytes=0-1,3-4");
        assertEquals(HttpStatus.REQUESTED_RANGE_NOT_SATISFIABLE, multi.getStatusCode());
        assertEquals("bytes */6", multi.getHeaders().getFirst(HttpHeaders.CONTENT_RANGE));

        ResponseEntity<ErrorResponse> malformed = restTemplate.exchange("/download/{path}", HttpMethod.GET,
                new HttpEntity<>(rangeHeaders(tenant, "bytes=abc")), ErrorResponse.class, "r.bin");
        assertEquals(HttpStatus.BAD_REQUEST, malformed.getStatusCode());
        assertEquals("InvalidRange", malformed.getBody().getCode());
    }

    @Test
    public void testMissingArtifactAndOtherTenant() {
        String tenant = newTenant();
        upload(tenant, "mine.txt", bytes("secret"), 16);

        ResponseEntity<ErrorResponse> missing = restTemplate.exchange("/download/{path}", HttpMethod.GET,
                new HttpEntity<>(rangeHeaders(tenant, null)), ErrorResponse.class, "nothing-here.txt");
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
        assertEquals("NotFound", missing.getBody().getCode());

        assertEquals(HttpStatus.NOT_FOUND, get(newTenant(), "mine.txt", null).getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, head(newTenant(), "mine.txt", null).getStatusCode());
    }

    @Test
    public void testHeadWithDigest() {
        String tenant = newTenant();
        byte[] content = bytes("abcdef");
        upload(tenant, "probe.txt", content, 2);

        ResponseEntity<Void> plain = head(tenant, "probe.txt", null);
        assertEquals(HttpStatus.OK, plain.getStatusCode());
        assertEquals(6, plain.getHeaders().getContentLength());
        assertEquals("bytes", plain.getHeaders().getFirst(HttpHeaders.ACCEPT_RANGES));
        assertNull(plain.getHeaders().getFirst("Digest"));

        ResponseEntity<Void> withDigest = head(tenant, "probe.txt", "sha-256");
        String hex = ChecksumUtil.checksumOf(content);
        assertEquals(hex, withDigest.getHeaders().getFirst("X-Content-SHA256"));
        assertEquals("sha-256=" + Base64.getEncoder().encodeToString(HexFormat.of().parseHex(hex)),
                withDigest.getHeaders().getFirst("Digest"));
    }

    @Test
    public void testNameCollision() {
        String tenant = newTenant();
        FinishResponse first = upload(tenant, "report.pdf", bytes("one"), 16);
        FinishResponse second = upload(tenant, "report.pdf", bytes("two"), 16);

        assertEquals("report.pdf", first.getFinalName());
        assertTrue(second.getFinalName().matches("report_\\d{8}_\\d{6}_1\\.pdf"), second.getFinalName());
        assertEquals("report.pdf", second.getOriginalName());
        assertEquals("one", new String(get(tenant, first.getArtifactId(), null).getBody(), StandardCharsets.UTF_8));
        assertEquals("two", new String(get(tenant, second.getArtifactId(), null).getBody(), StandardCharsets.UTF_8));
    }

    @Test
    public void testNonAsciiNameUsesExtendedDisposition() {
        String tenant = newTenant();
        upload(tenant, "résumé.txt", bytes("cv"), 16);

        ResponseEntity<byte[]> response = get(tenant, "résumé.txt", null);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        String disposition = response.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION);
        assertNotNull(disposition);
        assertTrue(disposition.startsWith("attachment;"));
        assertTrue(disposition.contains("filename*=UTF-8''r%C3%A9sum%C3%A9.txt"));
    }

    @Test
    public void testLargeRoundTripOverRanges() {
        String tenant = newTenant();
        byte[] content = new byte[300_000];
        new Random(42).nextBytes(content);

        FinishResponse finished = upload(tenant, "random.bin", content, 64 * 1024);
        assertEquals(content.length, finished.getSize());
        assertEquals(ChecksumUtil.checksumOf(content), finished.getDigestHex());

        ResponseEntity<byte[]> full = get(tenant, "random.bin", null);
        assertArrayEquals(content, full.getBody());
        assertEquals(MediaType.APPLICATION_OCTET_STREAM, full.getHeaders().getContentType());

        ByteArrayOutputStream reassembled = new ByteArrayOutputStream();
        int step = 70_001;
        for (int start = 0; start < content.length; start += step) {
            int end = Math.min(start + step, content.length) - 1;
            ResponseEntity<byte[]> part = get(tenant, "random.bin", "bytes=" + start + "-" + end);
            assertEquals(HttpStatus.PARTIAL_CONTENT, part.getStatusCode());
            assertEquals(end - start + 1, part.getBody().length);
            reassembled.writeBytes(part.getBody());
        }
        assertEquals(ChecksumUtil.checksumOf(content), ChecksumUtil.checksumOf(reassembled.toByteArray()));
    }

    private FinishResponse upload(String tenant, String name, byte[] content, int chunkSize) {
        String sessionId = init(tenant);
        int total = (content.length + chunkSize - 1) / chunkSize;
        for (int i = total - 1; i >= 0; i--) {
            int from = i * chunkSize;
            putChunk(tenant, sessionId, i, Arrays.copyOfRange(content, from, Math.min(from + chunkSize, content.length)));
        }
        return finish(tenant, sessionId, name, total);
    }

    private String init(String tenant) {
        ResponseEntity<InitResponse> response = restTemplate.exchange("/upload/init", HttpMethod.POST,
                new HttpEntity<>(tenantHeaders(tenant)), InitResponse.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return response.getBody().getSessionId();
    }

    private void putChunk(String tenant, String sessionId, int index, byte[] data) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ByteArrayResource(data) {
            @Override
            public String getFilename() {
                return "chunk_" + index;
            }
        });
        HttpHeaders headers = tenantHeaders(tenant);
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        ResponseEntity<ChunkAck> response = restTemplate.postForEntity("/upload/chunk?sessionId={id}&index={index}",
                new HttpEntity<>(body, headers), ChunkAck.class, sessionId, index);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(data.length, response.getBody().getSize());
    }

    private FinishResponse finish(String tenant, String sessionId, String name, int total) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("sessionId", sessionId);
        form.add("displayName", name);
        form.add("totalChunks", String.valueOf(total));
        HttpHeaders headers = tenantHeaders(tenant);
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        ResponseEntity<FinishResponse> response = restTemplate.postForEntity("/upload/finish",
                new HttpEntity<>(form, headers), FinishResponse.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return response.getBody();
    }

    private ResponseEntity<byte[]> get(String tenant, String path, String range) {
        return restTemplate.exchange("/download/{path}", HttpMethod.GET, new HttpEntity<>(rangeHeaders(tenant, range)),
                byte[].class, path);
    }

    private ResponseEntity<Void> head(String tenant, String path, String wantDigest) {
        HttpHeaders headers = tenantHeaders(tenant);
        if (wantDigest != null) {
            headers.set("Want-Digest", wantDigest);
        }
        return restTemplate.exchange("/download/{path}", HttpMethod.HEAD, new HttpEntity<>(headers), Void.class, path);
    }

    private static HttpHeaders rangeHeaders(String tenant, String range) {
        HttpHeaders headers = tenantHeaders(tenant);
        if (range != null) {
            headers.set(HttpHeaders.RANGE, range);
        }
        return headers;
    }

    private static HttpHeaders tenantHeaders(String tenant) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(TENANT_HEADER, tenant);
        return headers;
    }

    private static String newTenant() {
        return "tenant-" + UUID.randomUUID();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
