package vn.com.fecredit.filestore.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * File store settings, bound from {@code filestore.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "filestore")
public class FileStoreProperties {

    /**
     * Scratch directory holding the chunks of open upload sessions.
     */
    @NotBlank
    private String uploadDir = "uploads/in-progress";

    /**
     * Root of permanent storage, one sub-directory per tenant.
     */
    @NotBlank
    private String storageDir = "uploads/storage";

    /**
     * Largest accepted chunk.
     */
    @NotNull
    private DataSize maxChunkSize = DataSize.ofMegabytes(4);

    /**
     * Largest number of chunks a single upload may declare.
     */
    @Min(1)
    private int maxChunksPerUpload = 1_000_000;

    /**
     * Buffer used to stream downloads, in bytes.
     */
    @Min(512)
    private int downloadBufferSize = 8192;

    /**
     * Request header naming the tenant when no authenticated principal is present.
     */
    @NotBlank
    private String tenantHeader = "X-Tenant-Id";

    /**
     * Tenant used when neither a principal nor the tenant header is present.
     */
    @NotBlank
    private String defaultTenant = "default";

    @Valid
    private Session session = new Session();

    @Data
    public static class Session {

        /**
         * Open sessions without an accepted chunk for this long are reaped.
         */
        @NotNull
        private Duration idleTimeout = Duration.ofMinutes(30);

        /**
         * Delay between two reaper sweeps, in milliseconds.
         */
        @Min(1000)
        private long reapIntervalMs = 300000;
    }
}
