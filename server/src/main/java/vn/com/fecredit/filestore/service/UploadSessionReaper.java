package vn.com.fecredit.filestore.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import vn.com.fecredit.filestore.config.FileStoreProperties;
import vn.com.fecredit.filestore.core.UploadSessionRegistry;

import java.time.Duration;

/**
 * Background cleanup of abandoned upload sessions.
 * Runs every {@code filestore.session.reap-interval-ms} and closes open
 * sessions idle for longer than {@code filestore.session.idle-timeout}.
 */
@Service
public class UploadSessionReaper {

    private static final Logger log = LoggerFactory.getLogger(UploadSessionReaper.class);

    private final UploadSessionRegistry registry;
    private final Duration idleTimeout;

    public UploadSessionReaper(UploadSessionRegistry registry, FileStoreProperties properties) {
        this.registry = registry;
        this.idleTimeout = properties.getSession().getIdleTimeout();
        log.info("Upload session reaper initialized with idle timeout: {}", idleTimeout);
    }

    @Scheduled(fixedDelayString = "${filestore.session.reap-interval-ms:300000}",
            initialDelayString = "${filestore.session.reap-interval-ms:300000}")
    public void reapIdleSessions() {
        log.debug("Starting cleanup of idle upload sessions");
        try {
            int reaped = registry.reapIdle(idleTimeout);
            if (reaped > 0) {
                log.info("Reaped {} idle upload sessions (idle longer than {})", reaped, idleTimeout);
            }
        } catch (RuntimeException e) {
            log.error("Error during idle upload session cleanup: {}", e.getMessage(), e);
        }
    }
}
