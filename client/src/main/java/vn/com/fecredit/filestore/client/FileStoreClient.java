package vn.com.fecredit.filestore.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.filestore.model.ChunkAck;
import vn.com.fecredit.filestore.model.ErrorResponse;
import vn.com.fecredit.filestore.model.FinishResponse;
import vn.com.fecredit.filestore.model.InitResponse;
import vn.com.fecredit.filestore.model.UploadStatusResponse;
import vn.com.fecredit.filestore.model.util.ChecksumUtil;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Client for the file store: parallel chunked upload with resume, and
 * resumable ranged download.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Concurrent chunk uploads with configurable thread count</li>
 * <li>Retry with exponential backoff for network errors and 5xx answers</li>
 * <li>Resume of interrupted uploads from the server's received-index set</li>
 * <li>SHA-256 verification of uploaded and downloaded content</li>
 * <li>Downloads that continue a partial local file with a {@code Range} request</li>
 * </ul>
 *
 * <p>
 * Usage:
 * <pre>
 * FileStoreClient client = new FileStoreClient.Builder()
 *     .baseUrl("http://server:8080")
 *     .tenant("alice")
 *     .build();
 *
 * FinishResponse stored = client.upload(filePath, "report.pdf");
 * client.download(stored.getArtifactId(), Paths.get("copy.pdf"));
 * </pre>
 */
public class FileStoreClient {

    private static final Logger log = LoggerFactory.getLogger(FileStoreClient.class);

    /**
     * Pluggable transport layer for the HTTP exchanges with the server.
     *
     * <p>
     * Every method performs exactly one request. Non-success answers are
     * reported as {@link FileStoreClientException}; retries are the client's
     * business.
     *
     * @see DefaultFileStoreTransport
     */
    public interface FileStoreTransport {

        InitResponse initUpload(String baseUrl, String tenant) throws IOException, InterruptedException;

        ChunkAck uploadChunk(String baseUrl, String tenant, String sessionId, Chunk chunk)
                throws IOException, InterruptedException;

        FinishResponse finishUpload(String baseUrl, String tenant, String sessionId, String displayName,
                                    int totalChunks) throws IOException, InterruptedException;

        UploadStatusResponse queryStatus(String baseUrl, String tenant, String sessionId)
                throws IOException, InterruptedException;

        /**
         * HEAD probe of an artifact.
         *
         * @param withDigest ask the server to recompute the SHA-256 digest
         */
        ArtifactInfo probe(String baseUrl, String tenant, String artifactPath, boolean withDigest)
                throws IOException, InterruptedException;

        /**
         * Streams the artifact from {@code offset} to its end into {@code out}.
         *
         * @return number of bytes written to {@code out}
         */
        long download(String baseUrl, String tenant, String artifactPath, long offset, OutputStream out)
                throws IOException, InterruptedException;
    }

    /**
     * {@link FileStoreTransport} over {@link java.net.http.HttpClient}.
     */
    public static class DefaultFileStoreTransport implements FileStoreTransport {

        private static final String CRLF = "\r\n";

        private final ObjectMapper objectMapper;
        private final HttpClient httpClient;
        private final String tenantHeader;

        /**
         * @param httpClient   client to use, or {@code null} for a default one
         * @param tenantHeader request header naming the tenant
         */
        public DefaultFileStoreTransport(HttpClient httpClient, String tenantHeader) {
            this.objectMapper = new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            this.httpClient = httpClient != null ? httpClient : HttpClient.newHttpClient();
            this.tenantHeader = tenantHeader;
        }

        @Override
        public InitResponse initUpload(String baseUrl, String tenant) throws IOException, InterruptedException {
            HttpRequest request = newRequest(baseUrl + "/upload/init", tenant)
                    .POST(HttpRequest.BodyPublishers.noBody())
                    .build();
            return readJson(send(request, "initialize upload"), InitResponse.class);
        }

        @Override
        public ChunkAck uploadChunk(String baseUrl, String tenant, String sessionId, Chunk chunk)
                throws IOException, InterruptedException {
            String boundary = "----Boundary" + UUID.randomUUID();
            String url = baseUrl + "/upload/chunk?sessionId=" + encode(sessionId) + "&index=" + chunk.getIndex();
            HttpRequest request = newRequest(url, tenant)
                    .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(multipartBody(boundary, chunk)))
                    .build();
            return readJson(send(request, "upload chunk " + chunk.getIndex()), ChunkAck.class);
        }

        @Override
        public FinishResponse finishUpload(String baseUrl, String tenant, String sessionId, String displayName,
                                           int totalChunks) throws IOException, InterruptedException {
            String form = "sessionId=" + encode(sessionId)
                    + "&displayName=" + encode(displayName)
                    + "&totalChunks=" + totalChunks;
            HttpRequest request = newRequest(baseUrl + "/upload/finish", tenant)
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString(form))
                    .build();
            return readJson(send(request, "finish upload " + sessionId), FinishResponse.class);
        }

        @Override
        public UploadStatusResponse queryStatus(String baseUrl, String tenant, String sessionId)
                throws IOException, InterruptedException {
            HttpRequest request = newRequest(baseUrl + "/upload/status/" + encodePath(sessionId), tenant)
                    .GET()
                    .build();
            return readJson(send(request, "query status of " + sessionId), UploadStatusResponse.class);
        }

        @Override
        public ArtifactInfo probe(String baseUrl, String tenant, String artifactPath, boolean withDigest)
                throws IOException, InterruptedException {
            HttpRequest.Builder builder = newRequest(downloadUrl(baseUrl, artifactPath), tenant)
                    .method("HEAD", HttpRequest.BodyPublishers.noBody());
            if (withDigest) {
                builder.header("Want-Digest", "sha-256");
            }
            HttpResponse<Void> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() != 200) {
                throw new FileStoreClientException("Failed to probe " + artifactPath + ": HTTP " + response.statusCode(),
                        response.statusCode(), null);
            }
            long length = response.headers().firstValueAsLong("Content-Length")
                    .orElseThrow(() -> new IOException("Failed to probe " + artifactPath + ": no Content-Length"));
            return new ArtifactInfo(length, response.headers().firstValue("X-Content-SHA256").orElse(null));
        }

        @Override
        public long download(String baseUrl, String tenant, String artifactPath, long offset, OutputStream out)
                throws IOException, InterruptedException {
            HttpRequest.Builder builder = newRequest(downloadUrl(baseUrl, artifactPath), tenant).GET();
            if (offset > 0) {
                builder.header("Range", "bytes=" + offset + "-");
            }
            HttpResponse<InputStream> response = httpClient.send(builder.build(),
                    HttpResponse.BodyHandlers.ofInputStream());
            int expected = offset > 0 ? 206 : 200;
            try (InputStream in = response.body()) {
                if (response.statusCode() != expected) {
                    throw failure("download " + artifactPath, response.statusCode(),
                            new String(in.readAllBytes(), StandardCharsets.UTF_8));
                }
                return in.transferTo(out);
            }
        }

        private HttpRequest.Builder newRequest(String url, String tenant) {
            HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(url));
            if (tenant != null) {
                builder.header(tenantHeader, tenant);
            }
            return builder;
        }

        private HttpResponse<String> send(HttpRequest request, String action) throws IOException, InterruptedException {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw failure(action, response.statusCode(), response.body());
            }
            return response;
        }

        private FileStoreClientException failure(String action, int status, String body) {
            String code = null;
            String message = body;
            if (body != null && !body.isBlank()) {
                try {
                    ErrorResponse error = objectMapper.readValue(body, ErrorResponse.class);
                    code = error.getCode();
                    message = error.getMessage();
                    if (error.getMissingIndices() != null && !error.getMissingIndices().isEmpty()) {
                        message += " (missing " + error.getMissingIndices() + ")";
                    }
                } catch (IOException e) {
                    log.debug("Error body is not JSON: {}", e.getMessage());
                }
            }
            return new FileStoreClientException("Failed to " + action + ": HTTP " + status + " " + message, status, code);
        }

        private <T> T readJson(HttpResponse<String> response, Class<T> type) throws IOException {
            return objectMapper.readValue(response.body(), type);
        }

        private static byte[] multipartBody(String boundary, Chunk chunk) {
            byte[] header = ("--" + boundary + CRLF
                    + "Content-Disposition: form-data; name=\"file\"; filename=\"chunk_" + chunk.getIndex() + "\"" + CRLF
                    + "Content-Type: application/octet-stream" + CRLF + CRLF).getBytes(StandardCharsets.UTF_8);
            byte[] footer = (CRLF + "--" + boundary + "--" + CRLF).getBytes(StandardCharsets.UTF_8);
            byte[] data = chunk.getData();

            byte[] body = new byte[header.length + data.length + footer.length];
            System.arraycopy(header, 0, body, 0, header.length);
            System.arraycopy(data, 0, body, header.length, data.length);
            System.arraycopy(footer, 0, body, header.length + data.length, footer.length);
            return body;
        }

        private static String downloadUrl(String baseUrl, String artifactPath) {
            String path = artifactPath.startsWith("/") ? artifactPath.substring(1) : artifactPath;
            StringBuilder url = new StringBuilder(baseUrl).append("/download");
            for (String segment : path.split("/")) {
                url.append('/').append(encodePath(segment));
            }
            return url.toString();
        }

        private static String encode(String value) {
            return URLEncoder.encode(value, StandardCharsets.UTF_8);
        }

        private static String encodePath(String segment) {
            return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
        }
    }

    private final String baseUrl;
    private final String tenant;
    private final int chunkSize;
    private final int retryTimes;
    private final long retryBackoffMillis;
    private final int threadCounts;
    private final boolean verifyDownloads;
    private final FileStoreTransport transport;

    private FileStoreClient(Builder builder) {
        this.baseUrl = builder.baseUrl.endsWith("/")
                ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1) : builder.baseUrl;
        this.tenant = builder.tenant;
        this.chunkSize = builder.chunkSize;
        this.retryTimes = builder.retryTimes;
        this.retryBackoffMillis = builder.retryBackoffMillis;
        this.threadCounts = builder.threadCounts;
        this.verifyDownloads = builder.verifyDownloads;
        this.transport = builder.transport != null ? builder.transport
                : new DefaultFileStoreTransport(builder.httpClient, builder.tenantHeader);
    }

    /**
     * Uploads a file as a new artifact.
     *
     * @param filePath    file to upload, must exist
     * @param displayName name to store the artifact under
     * @return the stored artifact; its {@code finalName} may differ from {@code displayName}
     * @throws IllegalArgumentException if the file does not exist
     * @throws FileStoreClientException if the upload fails or the stored digest differs from the local one
     */
    public FinishResponse upload(Path filePath, String displayName) {
        requireFile(filePath);
        try {
            InitResponse init = transport.initUpload(baseUrl, tenant);
            log.info("Upload session {} opened for {}", init.getSessionId(), filePath);
            return sendAndFinish(init.getSessionId(), filePath, displayName,
                    effectiveChunkSize(init.getMaxChunkSize()), Set.of());
        } catch (IOException e) {
            throw new FileStoreClientException("Failed to upload " + filePath + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FileStoreClientException("Upload of " + filePath + " interrupted", e);
        }
    }

    /**
     * Continues an interrupted upload: asks the server which chunks it has and
     * sends only the others. The chunk size must be the one used by the
     * original upload; like {@link #upload}, it is capped by the server limit.
     *
     * @param sessionId   session returned by the original upload
     * @param filePath    the same file as the original upload
     * @param displayName name to store the artifact under
     * @return the stored artifact
     * @throws FileStoreClientException if the session is gone, the server holds chunks the file
     *                                  cannot have at this chunk size, or the upload fails
     */
    public FinishResponse resumeUpload(String sessionId, Path filePath, String displayName) {
        requireFile(filePath);
        try {
            UploadStatusResponse status = transport.queryStatus(baseUrl, tenant, sessionId);
            Set<Integer> received = new HashSet<>(status.getReceivedIndices());
            log.info("Resuming upload {}: {} chunks already on the server", sessionId, received.size());
            return sendAndFinish(sessionId, filePath, displayName,
                    effectiveChunkSize(status.getMaxChunkSize()), received);
        } catch (IOException e) {
            throw new FileStoreClientException("Failed to resume upload " + sessionId + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FileStoreClientException("Resume of upload " + sessionId + " interrupted", e);
        }
    }

    /**
     * Downloads an artifact to {@code target}. When {@code target} already
     * holds a prefix of the artifact only the remaining bytes are requested.
     *
     * @return size of the artifact
     * @throws FileStoreClientException if the download fails or the content does not match the server digest
     */
    public long download(String artifactPath, Path target) {
        try {
            ArtifactInfo info = transport.probe(baseUrl, tenant, artifactPath, verifyDownloads);
            long total = info.getLength();
            int attempt = 0;
            while (true) {
                long existing = Files.exists(target) ? Files.size(target) : 0;
                if (existing > total) {
                    log.warn("Local file {} is larger than {} ({} > {}), starting over", target, artifactPath, existing, total);
                    existing = 0;
                }
                if (existing == total) {
                    // a missing target still has to be created for empty artifacts
                    if (!Files.exists(target)) {
                        Files.createFile(target);
                    }
                    break;
                }
                try (OutputStream out = existing > 0
                        ? Files.newOutputStream(target, StandardOpenOption.WRITE, StandardOpenOption.APPEND)
                        : Files.newOutputStream(target, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.WRITE)) {
                    log.info("Downloading {} from byte {} of {}", artifactPath, existing, total);
                    transport.download(baseUrl, tenant, artifactPath, existing, out);
                } catch (IOException | FileStoreClientException e) {
                    if (!isRetryable(e) || attempt >= retryTimes) {
                        throw e;
                    }
                    attempt++;
                    log.warn("Download of {} interrupted ({}), retry {}/{}", artifactPath, e.getMessage(), attempt, retryTimes);
                    backoff(attempt);
                }
            }
            verifyDownload(artifactPath, target, info);
            return total;
        } catch (IOException e) {
            throw new FileStoreClientException("Failed to download " + artifactPath + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FileStoreClientException("Download of " + artifactPath + " interrupted", e);
        }
    }

    private void verifyDownload(String artifactPath, Path target, ArtifactInfo info) throws IOException {
        long size = Files.size(target);
        if (size != info.getLength()) {
            throw new FileStoreClientException("Size mismatch for " + artifactPath + ": expected " + info.getLength()
                    + " bytes, got " + size, -1, null);
        }
        if (info.getSha256Hex() != null) {
            String local = ChecksumUtil.generateChecksum(target);
            if (!local.equalsIgnoreCase(info.getSha256Hex())) {
                throw new FileStoreClientException("Checksum mismatch for " + artifactPath, -1, null);
            }
        }
        log.info("Downloaded {} to {} ({} bytes)", artifactPath, target, size);
    }

    private FinishResponse sendAndFinish(String sessionId, Path filePath, String displayName, int size,
                                         Set<Integer> alreadyReceived) throws IOException, InterruptedException {
        long fileSize = Files.size(filePath);
        int totalChunks = Math.toIntExact((fileSize + size - 1) / size);
        for (Integer index : alreadyReceived) {
            if (index >= totalChunks) {
                throw new FileStoreClientException("Upload " + sessionId + " holds chunk " + index + " but "
                        + filePath + " has only " + totalChunks + " chunks of " + size
                        + " bytes; it was started with a different chunk size", -1, null);
            }
        }
        List<Integer> pending = new ArrayList<>();
        for (int i = 0; i < totalChunks; i++) {
            if (!alreadyReceived.contains(i)) {
                pending.add(i);
            }
        }
        uploadChunks(sessionId, filePath, fileSize, size, pending);

        FinishResponse finished = transport.finishUpload(baseUrl, tenant, sessionId, displayName, totalChunks);
        String localDigest = ChecksumUtil.generateChecksum(filePath);
        if (!localDigest.equalsIgnoreCase(finished.getDigestHex())) {
            throw new FileStoreClientException("Checksum mismatch for upload " + sessionId + ": local " + localDigest
                    + ", server " + finished.getDigestHex(), -1, null);
        }
        log.info("Upload {} stored as {} ({} bytes)", sessionId, finished.getFinalName(), finished.getSize());
        return finished;
    }

    /**
     * Producer-consumer upload of the pending chunks: this thread reads the
     * file, {@code threadCounts} workers send. The first worker failure stops
     * the producer and is rethrown.
     */
    private void uploadChunks(String sessionId, Path filePath, long fileSize, int size, List<Integer> pending)
            throws IOException, InterruptedException {
        if (pending.isEmpty()) {
            return;
        }
        int numWorkers = Math.min(threadCounts, pending.size());
        ExecutorService executor = Executors.newFixedThreadPool(numWorkers);
        BlockingQueue<Chunk> queue = new ArrayBlockingQueue<>(numWorkers * 2);
        AtomicReference<Exception> failure = new AtomicReference<>();
        CountDownLatch finished = new CountDownLatch(numWorkers);
        try {
            for (int i = 0; i < numWorkers; i++) {
                executor.execute(() -> {
                    try {
                        for (Chunk chunk = queue.take(); !chunk.isPoison(); chunk = queue.take()) {
                            uploadWithRetry(sessionId, chunk);
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } catch (Exception e) {
                        failure.compareAndSet(null, e);
                    } finally {
                        finished.countDown();
                    }
                });
            }

            try (FileChannel channel = FileChannel.open(filePath, StandardOpenOption.READ)) {
                for (Integer index : pending) {
                    if (!enqueue(queue, readChunk(channel, index, fileSize, size), failure)) {
                        break;
                    }
                }
            }
            for (int i = 0; i < numWorkers; i++) {
                if (!enqueue(queue, Chunk.POISON, failure)) {
                    break;
                }
            }
            while (failure.get() == null && !finished.await(100, TimeUnit.MILLISECONDS)) {
                log.trace("Waiting for upload workers of {}", sessionId);
            }
        } finally {
            executor.shutdownNow();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }

        Exception e = failure.get();
        if (e instanceof FileStoreClientException) {
            throw (FileStoreClientException) e;
        }
        if (e instanceof IOException) {
            throw (IOException) e;
        }
        if (e != null) {
            throw new FileStoreClientException("Failed to upload chunks of " + sessionId, e);
        }
    }

    private int effectiveChunkSize(int serverMaxChunkSize) {
        return serverMaxChunkSize > 0 ? Math.min(chunkSize, serverMaxChunkSize) : chunkSize;
    }

    private static boolean enqueue(BlockingQueue<Chunk> queue, Chunk chunk, AtomicReference<Exception> failure)
            throws InterruptedException {
        while (failure.get() == null) {
            if (queue.offer(chunk, 100, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    private static Chunk readChunk(FileChannel channel, int index, long fileSize, int size) throws IOException {
        long position = (long) index * size;
        int length = (int) Math.min(size, fileSize - position);
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer, position + buffer.position()) < 0) {
                throw new IOException("File shrank while reading chunk " + index);
            }
        }
        return new Chunk(buffer.array(), index);
    }

    private void uploadWithRetry(String sessionId, Chunk chunk) throws IOException, InterruptedException {
        int attempt = 0;
        while (true) {
            try {
                ChunkAck ack = transport.uploadChunk(baseUrl, tenant, sessionId, chunk);
                log.debug("Chunk {} of {} sent ({} bytes, duplicate={})", chunk.getIndex(), sessionId, ack.getSize(),
                        ack.isDuplicate());
                return;
            } catch (IOException | FileStoreClientException e) {
                if (!isRetryable(e) || attempt >= retryTimes) {
                    log.error("Failed to upload chunk {} of {} after {} attempts: {}", chunk.getIndex(), sessionId,
                            attempt + 1, e.getMessage());
                    throw e;
                }
                attempt++;
                log.warn("Chunk {} of {} failed ({}), retry {}/{}", chunk.getIndex(), sessionId, e.getMessage(),
                        attempt, retryTimes);
                backoff(attempt);
            }
        }
    }

    private static boolean isRetryable(Exception e) {
        return !(e instanceof FileStoreClientException) || ((FileStoreClientException) e).isRetryable();
    }

    private void backoff(int attempt) throws InterruptedException {
        if (retryBackoffMillis > 0) {
            Thread.sleep(retryBackoffMillis << Math.min(attempt - 1, 10));
        }
    }

    private static void requireFile(Path filePath) {
        if (filePath == null || !Files.isRegularFile(filePath)) {
            throw new IllegalArgumentException("filePath is required and must exist");
        }
    }

    /**
     * Builder for {@link FileStoreClient}.
     *
     * <p>
     * Required: {@code baseUrl}. Optional: {@code tenant} (server default
     * tenant when absent), {@code tenantHeader} (default {@code X-Tenant-Id}),
     * {@code chunkSize} (default 1 MiB, capped by the server limit),
     * {@code retryTimes} (default 2), {@code retryBackoffMillis} (default 200),
     * {@code threadCounts} (default 4), {@code verifyDownloads} (default true),
     * {@code httpClient}, {@code transport}.
     */
    public static class Builder {
        private String baseUrl;
        private String tenant;
        private String tenantHeader = "X-Tenant-Id";
        private int chunkSize = 1024 * 1024;
        private int retryTimes = 2;
        private long retryBackoffMillis = 200;
        private int threadCounts = 4;
        private boolean verifyDownloads = true;
        private HttpClient httpClient;
        private FileStoreTransport transport;

        /**
         * @param baseUrl server root, e.g. {@code http://localhost:8080}
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder tenant(String tenant) {
            this.tenant = tenant;
            return this;
        }

        public Builder tenantHeader(String tenantHeader) {
            this.tenantHeader = tenantHeader;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder retryTimes(int retryTimes) {
            this.retryTimes = retryTimes;
            return this;
        }

        public Builder retryBackoffMillis(long retryBackoffMillis) {
            this.retryBackoffMillis = retryBackoffMillis;
            return this;
        }

        public Builder threadCounts(int threadCounts) {
            this.threadCounts = threadCounts;
            return this;
        }

        public Builder verifyDownloads(boolean verifyDownloads) {
            this.verifyDownloads = verifyDownloads;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder transport(FileStoreTransport transport) {
            this.transport = transport;
            return this;
        }

        public FileStoreClient build() {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalStateException("baseUrl is required");
            }
            if (chunkSize <= 0 || threadCounts <= 0 || retryTimes < 0) {
                throw new IllegalStateException("chunkSize and threadCounts must be positive, retryTimes not negative");
            }
            return new FileStoreClient(this);
        }
    }
}
