package vn.com.fecredit.filestore.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import vn.com.fecredit.filestore.exception.ChunkWriteException;
import vn.com.fecredit.filestore.exception.MergeIOException;
import vn.com.fecredit.filestore.exception.SessionNotFoundException;
import vn.com.fecredit.filestore.manager.ChunkStore;
import vn.com.fecredit.filestore.port.impl.InMemorySessionStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UploadSessionRegistryStorageFailureTest {

    private static final String TENANT = "alice";

    @TempDir
    Path chunkDir;

    @Mock
    private ChunkStore chunkStore;

    @Mock
    private ArtifactFinalizer finalizer;

    private InMemorySessionStore sessionStore;
    private UploadSessionRegistry registry;

    @BeforeEach
    void setUp() {
        sessionStore = new InMemorySessionStore();
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        registry = new UploadSessionRegistry(sessionStore, chunkStore, finalizer, 16, clock);
    }

    private String openSession() throws IOException {
        when(chunkStore.createSessionDir(anyString())).thenReturn(chunkDir);
        return registry.initUpload(TENANT).getId();
    }

    @Test
    void testInitUpload_DirectoryFailure() throws Exception {
        when(chunkStore.createSessionDir(anyString())).thenThrow(new IOException("disk full"));

        assertThrows(UncheckedIOException.class, () -> registry.initUpload(TENANT));
        assertTrue(sessionStore.findAll().isEmpty());
    }

    @Test
    void testPutChunk_StageFailure() throws Exception {
        String id = openSession();
        when(chunkStore.stage(eq(chunkDir), eq(0), any())).thenThrow(new IOException("disk full"));

        ChunkWriteException ex = assertThrows(ChunkWriteException.class,
                () -> registry.putChunk(TENANT, id, 0, new byte[]{1, 2}));

        assertEquals(500, ex.getHttpStatus());
        assertTrue(registry.queryStatus(TENANT, id).getReceivedIndices().isEmpty());
        verify(chunkStore, never()).commit(any(), any(), anyInt());
    }

    @Test
    void testPutChunk_CommitFailureDiscardsStagedChunk() throws Exception {
        String id = openSession();
        Path staged = chunkDir.resolve("chunk_000000.staged.tmp");
        when(chunkStore.stage(eq(chunkDir), eq(0), any())).thenReturn(staged);
        when(chunkStore.commit(staged, chunkDir, 0)).thenThrow(new IOException("rename failed"));

        assertThrows(ChunkWriteException.class, () -> registry.putChunk(TENANT, id, 0, new byte[]{1, 2}));

        verify(chunkStore).discard(staged);
        assertTrue(registry.queryStatus(TENANT, id).getReceivedIndices().isEmpty());
    }

    @Test
    void testFinishUpload_CleanupFailureStillClosesSession() throws Exception {
        String id = openSession();
        Path staged = chunkDir.resolve("chunk_000000.staged.tmp");
        Path committed = chunkDir.resolve("chunk_000000");
        when(chunkStore.stage(eq(chunkDir), eq(0), any())).thenReturn(staged);
        when(chunkStore.commit(staged, chunkDir, 0)).thenReturn(committed);
        registry.putChunk(TENANT, id, 0, new byte[]{1, 2});

        when(chunkStore.orderedChunks(chunkDir, 1)).thenReturn(List.of(committed));
        FinalizedArtifact stored = new FinalizedArtifact(Path.of("a.bin"), "a.bin", "a.bin", 2, "00");
        when(finalizer.finalizeUpload(TENANT, List.of(committed), "a.bin")).thenReturn(stored);
        doThrow(new IOException("directory busy")).when(chunkStore).deleteSessionDir(chunkDir);

        assertSame(stored, registry.finishUpload(TENANT, id, "a.bin", 1));
        assertThrows(SessionNotFoundException.class, () -> registry.queryStatus(TENANT, id));
    }

    @Test
    void testFinishUpload_FinalizerFailureKeepsChunks() throws Exception {
        String id = openSession();
        when(chunkStore.orderedChunks(chunkDir, 0)).thenReturn(List.of());
        when(finalizer.finalizeUpload(TENANT, List.of(), "a.bin"))
                .thenThrow(new MergeIOException("Failed to merge chunks into a.bin", new IOException("disk full")));

        assertThrows(MergeIOException.class, () -> registry.finishUpload(TENANT, id, "a.bin", 0));

        assertEquals(SessionState.OPEN, registry.queryStatus(TENANT, id).getState());
        verify(chunkStore, never()).deleteSessionDir(any());
    }
}
