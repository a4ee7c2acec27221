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
import vn.com.fecredit.filestore.model.ErrorResponse;
import vn.com.fecredit.filestore.model.InitResponse;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Chunks rejected by the servlet multipart limits, before the upload session is looked up.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"filestore.max-chunk-size=512B",
                "spring.servlet.multipart.max-file-size=1KB",
                "spring.servlet.multipart.max-request-size=2KB"})
public class MultipartLimitIntegrationTest {

    private static final String TENANT_HEADER = "X-Tenant-Id";
    private static final String TENANT = "limits";

    @Autowired
    private TestRestTemplate restTemplate;

    @DynamicPropertySource
    static void storage(DynamicPropertyRegistry registry) throws IOException {
        Path root = Files.createTempDirectory("filestore-limits");
        registry.add("filestore.upload-dir", () -> root.resolve("in-progress").toString());
        registry.add("filestore.storage-dir", () -> root.resolve("storage").toString());
    }

    @Test
    public void testPartOverMultipartLimitIsChunkTooLarge() {
        String sessionId = init();

        ResponseEntity<ErrorResponse> known = putChunk(sessionId, new byte[4096]);
        assertEquals(HttpStatus.BAD_REQUEST, known.getStatusCode());
        assertEquals("ChunkTooLarge", known.getBody().getCode());

        ResponseEntity<ErrorResponse> unknown = putChunk("no-such-session", new byte[4096]);
        assertEquals(HttpStatus.BAD_REQUEST, unknown.getStatusCode());
        assertEquals("ChunkTooLarge", unknown.getBody().getCode());
    }

    @Test
    public void testPartOverChunkLimitOnlyIsCheckedAgainstSession() {
        String sessionId = init();

        ResponseEntity<ErrorResponse> known = putChunk(sessionId, new byte[600]);
        assertEquals(HttpStatus.BAD_REQUEST, known.getStatusCode());
        assertEquals("ChunkTooLarge", known.getBody().getCode());

        ResponseEntity<ErrorResponse> unknown = putChunk("no-such-session", new byte[600]);
        assertEquals(HttpStatus.NOT_FOUND, unknown.getStatusCode());
        assertEquals("SessionNotFound", unknown.getBody().getCode());
    }

    private String init() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(TENANT_HEADER, TENANT);
        ResponseEntity<InitResponse> response = restTemplate.exchange("/upload/init", HttpMethod.POST,
                new HttpEntity<>(headers), InitResponse.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return response.getBody().getSessionId();
    }

    private ResponseEntity<ErrorResponse> putChunk(String sessionId, byte[] data) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ByteArrayResource(data) {
            @Override
            public String getFilename() {
                return "chunk_0";
            }
        });
        HttpHeaders headers = new HttpHeaders();
        headers.set(TENANT_HEADER, TENANT);
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        return restTemplate.postForEntity("/upload/chunk?sessionId={id}&index=0",
                new HttpEntity<>(body, headers), ErrorResponse.class, sessionId);
    }
}
