package de.jwiegmann.archive.control.upload;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.control.batch.ManifestBatcher;
import de.jwiegmann.archive.control.exception.TransientStorageException;
import de.jwiegmann.archive.control.exception.UploadValidationException;
import de.jwiegmann.archive.control.repository.JsonFileUploadSessionRepository;
import de.jwiegmann.archive.control.storage.ChunkAck;
import de.jwiegmann.archive.control.storage.FilesystemBlobStore;
import de.jwiegmann.archive.control.storage.RemoteBlobStore;
import de.jwiegmann.archive.entity.ManifestFile;
import de.jwiegmann.archive.entity.UploadSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.IntFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UploadSessionManagerTest {

    @TempDir
    Path tmp;

    private final RemoteBlobStore blobStore = mock(RemoteBlobStore.class);
    private final ManifestBatcher manifestBatcher = mock(ManifestBatcher.class);
    private final ContributorRateLimiterTest.MutableClock clock =
            new ContributorRateLimiterTest.MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

    private VaultProperties properties;
    private JsonFileUploadSessionRepository sessions;
    private UploadSessionManager manager;
    private FilesystemBlobStore durableStore;

    @BeforeEach
    void setUp() {
        properties = new VaultProperties();
        properties.getStorage().setRoot(tmp);
        properties.setContributors(Map.of("tok-anna", "Anna"));
        properties.getUpload().setRateLimitPerHour(2);
        sessions = new JsonFileUploadSessionRepository(properties, new ObjectMapper().findAndRegisterModules());
        manager = new UploadSessionManager(sessions, blobStore, new ContributorRegistry(properties),
                new ContributorRateLimiter(new InMemoryRateLimitStore(), properties, clock),
                manifestBatcher, properties, clock);
        when(blobStore.openResumableSession(any())).thenReturn("handle-1");
    }

    @Test
    void transientStoreFailureLeavesOffsetUntouched() {
        UploadSession session = manager.initUpload("tok-anna", "film.mp4", "video/mp4", 10, null);
        when(blobStore.uploadChunk(eq("handle-1"), eq(0L), any(), eq(10L)))
                .thenThrow(new TransientStorageException("timeout"))
                .thenReturn(ChunkAck.partial(5));

        assertThatThrownBy(() -> manager.putChunk(session.getSessionId(), ContentRange.parse("bytes 0-4/10"), new byte[5]))
                .isInstanceOf(TransientStorageException.class);
        assertThat(sessions.find(session.getSessionId())).map(UploadSession::getCommittedOffset).contains(0L);

        ChunkResult retry = manager.putChunk(session.getSessionId(), ContentRange.parse("bytes 0-4/10"), new byte[5]);

        assertThat(retry.getOutcome()).isEqualTo(ChunkResult.Outcome.ACCEPTED);
        assertThat(retry.getNextOffset()).isEqualTo(5);
    }

    @Test
    void completedUploadIsAppendedToItsBatch() {
        UploadSession session = manager.initUpload("tok-anna", "brief.txt", "text/plain", 4, "batch_1");
        when(blobStore.uploadChunk(eq("handle-1"), eq(0L), any(), eq(4L))).thenReturn(ChunkAck.complete(4, "file-9"));

        ChunkResult result = manager.putChunk(session.getSessionId(), ContentRange.parse("bytes 0-3/4"), new byte[4]);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.getOriginFileId()).isEqualTo("file-9");
        assertThat(manager.find(session.getSessionId())).isEmpty();
        ArgumentCaptor<ManifestFile> appended = ArgumentCaptor.forClass(ManifestFile.class);
        verify(manifestBatcher).appendFile(eq("batch_1"), appended.capture());
        assertThat(appended.getValue().getRemoteFileId()).isEqualTo("file-9");
        assertThat(appended.getValue().getOriginalName()).isEqualTo("brief.txt");
    }

    @Test
    void probeFindsUploadFinishedByTheStore() {
        UploadSession session = manager.initUpload("tok-anna", "a.bin", null, 8, null);
        when(blobStore.queryReceivedBytes("handle-1")).thenReturn(8L);
        when(blobStore.completedFileId("handle-1")).thenReturn(Optional.of("file-1"));

        ChunkResult result = manager.putChunk(session.getSessionId(), ContentRange.parse("bytes */8"), null);

        assertThat(result.isComplete()).isTrue();
        assertThat(result.getOriginFileId()).isEqualTo("file-1");
        verify(blobStore, never()).uploadChunk(any(), anyLong(), any(), anyLong());
    }

    @Test
    void storeBehindCommittedOffsetIsAnInvariantViolation() {
        UploadSession session = manager.initUpload("tok-anna", "a.bin", null, 8, null);
        session.setCommittedOffset(6);
        sessions.save(session);
        when(blobStore.queryReceivedBytes("handle-1")).thenReturn(2L);
        when(blobStore.completedFileId("handle-1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> manager.putChunk(session.getSessionId(), ContentRange.parse("bytes */8"), null))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rateLimitPerContributor() {
        manager.initUpload("tok-anna", "1.jpg", "image/jpeg", 1, null);
        manager.initUpload("tok-anna", "2.jpg", "image/jpeg", 1, null);

        assertThatThrownBy(() -> manager.initUpload("tok-anna", "3.jpg", "image/jpeg", 1, null))
                .isInstanceOf(UploadValidationException.class)
                .extracting(e -> ((UploadValidationException) e).getErrorCode())
                .isEqualTo("RATE_LIMITED");
    }

    @Test
    void invalidInitCreatesNoState() {
        assertThatThrownBy(() -> manager.initUpload("tok-nobody", "a.jpg", "image/jpeg", 1, null))
                .isInstanceOf(UploadValidationException.class);
        assertThatThrownBy(() -> manager.initUpload("tok-anna", "a.jpg", "image/jpeg", 0, null))
                .isInstanceOf(UploadValidationException.class);

        assertThat(sessions.findAll()).isEmpty();
        verify(blobStore, never()).openResumableSession(any());
    }

    @Test
    void reaperRemovesIdleSessions() {
        UploadSession idle = manager.initUpload("tok-anna", "old.mov", "video/quicktime", 100, null);
        clock.advance(Duration.ofHours(25));
        when(blobStore.openResumableSession(any())).thenReturn("handle-2");
        UploadSession fresh = manager.initUpload("tok-anna", "new.mov", "video/quicktime", 100, null);

        int reaped = manager.reapExpired();

        assertThat(reaped).isEqualTo(1);
        assertThat(manager.find(idle.getSessionId())).isEmpty();
        assertThat(manager.find(fresh.getSessionId())).isPresent();
        verify(blobStore).abandon("handle-1");
        verify(blobStore, never()).abandon("handle-2");
    }

    @Test
    void failedBatchAppendKeepsSessionForRetry() {
        UploadSession session = manager.initUpload("tok-anna", "brief.txt", "text/plain", 4, "batch_1");
        when(blobStore.uploadChunk(eq("handle-1"), eq(0L), any(), eq(4L))).thenReturn(ChunkAck.complete(4, "file-9"));
        doThrow(new UncheckedIOException("cannot write batch", new IOException("disk full")))
                .doNothing()
                .when(manifestBatcher).appendFile(eq("batch_1"), any());

        assertThatThrownBy(() -> manager.putChunk(session.getSessionId(), ContentRange.parse("bytes 0-3/4"), new byte[4]))
                .isInstanceOf(TransientStorageException.class);
        assertThat(manager.find(session.getSessionId())).isPresent();

        ChunkResult retry = manager.putChunk(session.getSessionId(), ContentRange.parse("bytes 0-3/4"), new byte[4]);

        assertThat(retry.getOriginFileId()).isEqualTo("file-9");
        assertThat(manager.find(session.getSessionId())).isEmpty();
        verify(manifestBatcher, times(2)).appendFile(eq("batch_1"), any());
    }

    @Test
    void interruptedUploadResumesAfterRestart() throws Exception {
        byte[] content = bytes(10, 7);
        UploadSessionManager beforeCrash = durableManager();
        UploadSession session = beforeCrash.initUpload("tok-anna", "film.mp4", "video/mp4", 10, null);
        beforeCrash.putChunk(session.getSessionId(), ContentRange.parse("bytes 0-3/10"), Arrays.copyOfRange(content, 0, 4));

        UploadSessionManager afterRestart = durableManager();

        assertThat(afterRestart.find(session.getSessionId())).map(UploadSession::getCommittedOffset).contains(4L);
        ChunkResult status = afterRestart.putChunk(session.getSessionId(), ContentRange.parse("bytes */10"), null);
        assertThat(status.getOutcome()).isEqualTo(ChunkResult.Outcome.RESUME);
        assertThat(status.getNextOffset()).isEqualTo(4);

        ChunkResult done = afterRestart.putChunk(session.getSessionId(), ContentRange.parse("bytes 4-9/10"), Arrays.copyOfRange(content, 4, 10));

        assertThat(done.isComplete()).isTrue();
        assertThat(read(done.getOriginFileId())).isEqualTo(content);
    }

    @Test
    void concurrentIdenticalChunksOnOneSessionAreWrittenOnce() throws Exception {
        byte[] content = bytes(10, 3);
        UploadSessionManager durable = durableManager();
        String sessionId = durable.initUpload("tok-anna", "memo.wav", "audio/wav", 10, null).getSessionId();

        List<ChunkResult> results = inParallel(8, i ->
                durable.putChunk(sessionId, ContentRange.parse("bytes 0-4/10"), Arrays.copyOfRange(content, 0, 5)));

        assertThat(results).filteredOn(r -> r.getOutcome() == ChunkResult.Outcome.ACCEPTED).hasSize(1);
        assertThat(results).allSatisfy(r -> assertThat(r.getNextOffset()).isEqualTo(5));

        ChunkResult done = durable.putChunk(sessionId, ContentRange.parse("bytes 5-9/10"), Arrays.copyOfRange(content, 5, 10));
        assertThat(read(done.getOriginFileId())).isEqualTo(content);
    }

    @Test
    void sessionsUploadInParallel() throws Exception {
        properties.getUpload().setRateLimitPerHour(100);
        UploadSessionManager durable = durableManager();

        List<ChunkResult> results = inParallel(6, i -> {
            byte[] content = bytes(9, i);
            String sessionId = durable.initUpload("tok-anna", "scan-" + i + ".jpg", "image/jpeg", 9, null).getSessionId();
            durable.putChunk(sessionId, ContentRange.parse("bytes 0-2/9"), Arrays.copyOfRange(content, 0, 3));
            durable.putChunk(sessionId, ContentRange.parse("bytes 3-5/9"), Arrays.copyOfRange(content, 3, 6));
            return durable.putChunk(sessionId, ContentRange.parse("bytes 6-8/9"), Arrays.copyOfRange(content, 6, 9));
        });

        assertThat(results).allMatch(ChunkResult::isComplete);
        for (ChunkResult result : results) {
            byte[] stored = read(result.getOriginFileId());
            assertThat(stored).hasSize(9);
            assertThat(stored).isEqualTo(bytes(9, stored[0]));
        }
    }

    private UploadSessionManager durableManager() {
        properties.getStorage().setBlobRoot(tmp.resolve("blobs"));
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        durableStore = new FilesystemBlobStore(properties, objectMapper);
        return new UploadSessionManager(new JsonFileUploadSessionRepository(properties, objectMapper), durableStore,
                new ContributorRegistry(properties),
                new ContributorRateLimiter(new InMemoryRateLimitStore(), properties, clock),
                manifestBatcher, properties, clock);
    }

    private byte[] read(String fileId) throws IOException {
        try (InputStream in = durableStore.openStream(fileId)) {
            return in.readAllBytes();
        }
    }

    private static byte[] bytes(int length, int seed) {
        byte[] content = new byte[length];
        Arrays.fill(content, (byte) seed);
        return content;
    }

    private static List<ChunkResult> inParallel(int count, IntFunction<ChunkResult> task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(count);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ChunkResult>> futures = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int index = i;
            futures.add(pool.submit(() -> {
                start.await();
                return task.apply(index);
            }));
        }
        start.countDown();
        List<ChunkResult> results = new ArrayList<>();
        for (Future<ChunkResult> future : futures) {
            results.add(future.get(10, TimeUnit.SECONDS));
        }
        pool.shutdown();
        return results;
    }
}
