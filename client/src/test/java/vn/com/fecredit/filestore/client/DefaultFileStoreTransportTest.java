package vn.com.fecredit.filestore.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import vn.com.fecredit.filestore.model.ChunkAck;
import vn.com.fecredit.filestore.model.InitResponse;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@SuppressWarnings("unchecked")
@ExtendWith(MockitoExtension.class)
class DefaultFileStoreTransportTest {

    private static final String BASE_URL = "http://localhost:8080";

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<Object> response;

    private FileStoreClient.DefaultFileStoreTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class))).thenReturn(response);
        transport = new FileStoreClient.DefaultFileStoreTransport(httpClient, "X-Tenant-Id");
    }

    private HttpRequest sentRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
        return captor.getValue();
    }

    @Test
    void testInitUpload() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(
                "{\"sessionId\":\"s-1\",\"createdAt\":\"2024-01-02T03:04:05Z\",\"maxChunkSize\":4194304,\"extra\":1}");

        InitResponse init = transport.initUpload(BASE_URL, "alice");

        assertEquals("s-1", init.getSessionId());
        assertEquals(4194304, init.getMaxChunkSize());
        HttpRequest request = sentRequest();
        assertEquals("POST", request.method());
        assertEquals(BASE_URL + "/upload/init", request.uri().toString());
        assertEquals("alice", request.headers().firstValue("X-Tenant-Id").orElse(null));
    }

    @Test
    void testUploadChunk_SendsMultipart() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"sessionId\":\"s 1\",\"index\":3,\"size\":2,\"duplicate\":true}");

        ChunkAck ack = transport.uploadChunk(BASE_URL, null, "s 1", new Chunk(new byte[]{1, 2}, 3));

        assertTrue(ack.isDuplicate());
        HttpRequest request = sentRequest();
        assertEquals(BASE_URL + "/upload/chunk?sessionId=s+1&index=3", request.uri().toString());
        assertTrue(request.headers().firstValue("Content-Type").orElse("").startsWith("multipart/form-data; boundary="));
        assertTrue(request.headers().firstValue("X-Tenant-Id").isEmpty());
    }

    @Test
    void testErrorBodyBecomesException() {
        when(response.statusCode()).thenReturn(400);
        when(response.body()).thenReturn(
                "{\"code\":\"IncompleteUpload\",\"message\":\"Upload is incomplete\",\"missingIndices\":[1]}");

        FileStoreClientException ex = assertThrows(FileStoreClientException.class,
                () -> transport.finishUpload(BASE_URL, "alice", "s-1", "a.txt", 3));

        assertEquals(400, ex.getStatusCode());
        assertEquals("IncompleteUpload", ex.getErrorCode());
        assertFalse(ex.isRetryable());
        assertTrue(ex.getMessage().contains("missing [1]"));
    }

    @Test
    void testServerErrorWithoutJsonIsRetryable() {
        when(response.statusCode()).thenReturn(502);
        when(response.body()).thenReturn("Bad Gateway");

        FileStoreClientException ex = assertThrows(FileStoreClientException.class,
                () -> transport.queryStatus(BASE_URL, "alice", "s-1"));

        assertNull(ex.getErrorCode());
        assertTrue(ex.isRetryable());
        assertTrue(ex.getMessage().contains("Bad Gateway"));
    }

    @Test
    void testProbeReadsLengthAndDigest() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.headers()).thenReturn(HttpHeaders.of(Map.of(
                "Content-Length", List.of("6"),
                "X-Content-SHA256", List.of("abc123")), (name, value) -> true));

        ArtifactInfo info = transport.probe(BASE_URL, "alice", "docs/résumé 1.txt", true);

        assertEquals(6, info.getLength());
        assertEquals("abc123", info.getSha256Hex());
        HttpRequest request = sentRequest();
        assertEquals("HEAD", request.method());
        assertEquals(BASE_URL + "/download/docs/r%C3%A9sum%C3%A9%201.txt", request.uri().toString());
        assertEquals("sha-256", request.headers().firstValue("Want-Digest").orElse(null));
    }

    @Test
    void testDownloadFromOffsetSendsRange() throws Exception {
        when(response.statusCode()).thenReturn(206);
        when(response.body()).thenReturn(new ByteArrayInputStream("cdef".getBytes(StandardCharsets.US_ASCII)));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertEquals(4, transport.download(BASE_URL, "alice", "a.txt", 2, out));

        assertEquals("cdef", out.toString(StandardCharsets.US_ASCII));
        assertEquals("bytes=2-", sentRequest().headers().firstValue("Range").orElse(null));
    }

    @Test
    void testDownloadRejectsFullResponseToRangedRequest() {
        InputStream body = new ByteArrayInputStream("abcdef".getBytes(StandardCharsets.US_ASCII));
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(body);

        FileStoreClientException ex = assertThrows(FileStoreClientException.class,
                () -> transport.download(BASE_URL, "alice", "a.txt", 2, new ByteArrayOutputStream()));
        assertEquals(200, ex.getStatusCode());
    }
}
