package vn.com.fecredit.filestore.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import vn.com.fecredit.filestore.core.ArtifactFinalizer;
import vn.com.fecredit.filestore.core.ArtifactLocator;
import vn.com.fecredit.filestore.core.UploadSessionRegistry;
import vn.com.fecredit.filestore.manager.ChunkStore;
import vn.com.fecredit.filestore.port.impl.InMemorySessionStore;
import vn.com.fecredit.filestore.port.interfaces.SessionStore;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Wires the framework-free upload and download engine into the Spring context.
 */
@Configuration
public class FileStoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionStore sessionStore() {
        return new InMemorySessionStore();
    }

    @Bean
    public ChunkStore chunkStore(FileStoreProperties properties) throws IOException {
        return new ChunkStore(Paths.get(properties.getUploadDir()));
    }

    @Bean
    public ArtifactFinalizer artifactFinalizer(FileStoreProperties properties, Clock clock) throws IOException {
        return new ArtifactFinalizer(Paths.get(properties.getStorageDir()), clock);
    }

    @Bean
    public ArtifactLocator artifactLocator(ArtifactFinalizer artifactFinalizer) {
        return new ArtifactLocator(artifactFinalizer);
    }

    @Bean
    public UploadSessionRegistry uploadSessionRegistry(SessionStore sessionStore, ChunkStore chunkStore,
                                                       ArtifactFinalizer artifactFinalizer,
                                                       FileStoreProperties properties, Clock clock) {
        return new UploadSessionRegistry(sessionStore, chunkStore, artifactFinalizer,
                Math.toIntExact(properties.getMaxChunkSize().toBytes()), properties.getMaxChunksPerUpload(), clock);
    }
}
