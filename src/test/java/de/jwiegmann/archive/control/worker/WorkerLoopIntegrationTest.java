package de.jwiegmann.archive.control.worker;

import de.jwiegmann.archive.control.pipeline.AssetPersistenceService;
import de.jwiegmann.archive.control.pipeline.DiskSpaceProbe;
import de.jwiegmann.archive.control.pipeline.enrichment.TranscriptEnricher;
import de.jwiegmann.archive.control.pipeline.enrichment.TranscriptSegment;
import de.jwiegmann.archive.control.repository.AssetRepository;
import de.jwiegmann.archive.control.repository.DuplicateLinkRepository;
import de.jwiegmann.archive.control.repository.SidecarRepository;
import de.jwiegmann.archive.control.storage.RemoteBlobStore;
import de.jwiegmann.archive.control.storage.RemoteFile;
import de.jwiegmann.archive.entity.Asset;
import de.jwiegmann.archive.entity.AssetStatus;
import de.jwiegmann.archive.entity.DedupMethod;
import de.jwiegmann.archive.entity.DuplicateLink;
import de.jwiegmann.archive.entity.SidecarSnapshot;
import de.jwiegmann.archive.entity.StorageLocation;
import de.jwiegmann.archive.support.TempStorage;
import de.jwiegmann.archive.support.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest
class WorkerLoopIntegrationTest {

    private static final Path STORAGE = TempStorage.create("worker-loop");

    @DynamicPropertySource
    static void storage(DynamicPropertyRegistry registry) {
        TempStorage.register(registry, STORAGE);
        registry.add("vault.backpressure.min-free-disk-bytes", () -> "1024");
        registry.add("vault.enrichment.transcribe-max-duration", () -> "PT1S");
    }

    @TestConfiguration
    static class Enrichers {

        @Bean
        CountingTranscriptEnricher transcriptEnricher() {
            return new CountingTranscriptEnricher();
        }
    }

    @MockBean
    private DiskSpaceProbe diskSpaceProbe;

    @Autowired
    private WorkerLoop workerLoop;

    @Autowired
    private RemoteBlobStore blobStore;

    @Autowired
    private AssetRepository assetRepository;

    @Autowired
    private DuplicateLinkRepository duplicateLinkRepository;

    @Autowired
    private SidecarRepository sidecarRepository;

    @Autowired
    private AssetPersistenceService persistence;

    @Autowired
    private CountingTranscriptEnricher transcriptEnricher;

    private final Random random = new Random();

    @BeforeEach
    void setUp() {
        when(diskSpaceProbe.usableBytes(any())).thenReturn(Long.MAX_VALUE);
    }

    @Test
    void rerunNeverCreatesASecondAsset() {
        RemoteFile file = inbox("scan.txt", "text/plain", randomBytes(64));

        workerLoop.runCycle();
        Asset first = assetRepository.findByOriginFileId(file.getId()).orElseThrow();

        WorkerCycleReport second = workerLoop.runCycle();

        assertThat(second.getProcessed()).isZero();
        assertThat(assetRepository.findAll()).filteredOn(a -> a.getOriginFileId().equals(file.getId())).hasSize(1);
        assertThat(assetRepository.findByOriginFileId(file.getId())).contains(first);
        assertThat(blobStore.list(StorageLocation.HOLDING_NEEDS_REVIEW)).extracting(RemoteFile::getId).contains(file.getId());

        SidecarSnapshot sidecar = sidecarRepository.find(first.getAssetId()).orElseThrow();
        assertThat(sidecar.getSnapshotVersion()).isEqualTo(1);
        assertThat(sidecar.getAsset().getStatus()).isEqualTo(AssetStatus.NEEDS_REVIEW);
    }

    @Test
    void fileClaimedBeforeACrashIsSkipped() {
        RemoteFile file = inbox("half-done.txt", "text/plain", randomBytes(32));
        persistence.claim(Asset.builder()
                .assetId("crashed-" + file.getId())
                .originFileId(file.getId())
                .status(AssetStatus.PROCESSING)
                .build());

        WorkerCycleReport report = workerLoop.runCycle();

        assertThat(report.getSkippedExisting()).isGreaterThanOrEqualTo(1);
        assertThat(assetRepository.findByOriginFileId(file.getId()))
                .map(Asset::getAssetId)
                .contains("crashed-" + file.getId());
    }

    @Test
    void identicalBytesAreExactDuplicates() {
        byte[] content = randomBytes(256);
        RemoteFile a = inbox("IMG_1.bin", "application/octet-stream", content);
        RemoteFile b = inbox("IMG_1 (copy).bin", "application/octet-stream", content);

        workerLoop.runCycle();

        Asset assetA = assetRepository.findByOriginFileId(a.getId()).orElseThrow();
        Asset assetB = assetRepository.findByOriginFileId(b.getId()).orElseThrow();
        Asset duplicate = assetA.getStatus() == AssetStatus.POSSIBLE_DUPLICATE ? assetA : assetB;
        Asset original = duplicate == assetA ? assetB : assetA;

        assertThat(original.getStatus()).isEqualTo(AssetStatus.NEEDS_REVIEW);
        assertThat(duplicate.getStatus()).isEqualTo(AssetStatus.POSSIBLE_DUPLICATE);
        assertThat(duplicate.getDuplicateOf()).isEqualTo(original.getAssetId());
        assertThat(duplicate.getDuplicateMethod()).isEqualTo(DedupMethod.EXACT);
        assertThat(duplicate.getLocation()).isEqualTo(StorageLocation.HOLDING_DUPLICATES);

        DuplicateLink link = duplicateLinkRepository.find(duplicate.getAssetId()).orElseThrow();
        assertThat(link.getDuplicateOf()).isEqualTo(original.getAssetId());
        assertThat(link.getMethod()).isEqualTo(DedupMethod.EXACT);
        assertThat(link.getDistance()).isNull();
    }

    @Test
    void visuallyIdenticalImagesAreNearDuplicates() {
        long seed = random.nextLong();
        RemoteFile a = inbox("beach.png", "image/png", TestImages.png(TestImages.blocks(seed, 0)));
        RemoteFile b = inbox("beach_brighter.png", "image/png", TestImages.png(TestImages.blocks(seed, 4)));
        RemoteFile other = inbox("garden.png", "image/png", TestImages.png(TestImages.blocks(seed + 1, 0)));

        workerLoop.runCycle();

        Asset assetA = assetRepository.findByOriginFileId(a.getId()).orElseThrow();
        Asset assetB = assetRepository.findByOriginFileId(b.getId()).orElseThrow();
        Asset duplicate = assetA.getStatus() == AssetStatus.POSSIBLE_DUPLICATE ? assetA : assetB;
        Asset original = duplicate == assetA ? assetB : assetA;

        assertThat(duplicate.getDuplicateMethod()).isEqualTo(DedupMethod.NEAR);
        assertThat(duplicate.getDuplicateOf()).isEqualTo(original.getAssetId());
        assertThat(original.getPhash()).isEqualTo(duplicate.getPhash());
        assertThat(original.getSha256()).isNotEqualTo(duplicate.getSha256());
        assertThat(assetRepository.findByOriginFileId(other.getId()).orElseThrow().getStatus())
                .isEqualTo(AssetStatus.NEEDS_REVIEW);
    }

    @Test
    void duplicateCheckPrecedesDeferredTranscription() throws Exception {
        byte[] longAudio = wav(2.0);
        RemoteFile first = inbox("interview.wav", "audio/wav", longAudio);
        RemoteFile copy = inbox("interview_copy.wav", "audio/wav", longAudio);
        int runsBefore = transcriptEnricher.runs.get();

        workerLoop.runCycle();

        List<AssetStatus> statuses = List.of(
                assetRepository.findByOriginFileId(first.getId()).orElseThrow().getStatus(),
                assetRepository.findByOriginFileId(copy.getId()).orElseThrow().getStatus());
        assertThat(statuses).containsExactlyInAnyOrder(AssetStatus.TRANSCRIBE_LATER, AssetStatus.POSSIBLE_DUPLICATE);
        assertThat(transcriptEnricher.runs.get()).isEqualTo(runsBefore);

        Asset deferred = assetRepository.findByOriginFileId(first.getId())
                .filter(a -> a.getStatus() == AssetStatus.TRANSCRIBE_LATER)
                .orElseGet(() -> assetRepository.findByOriginFileId(copy.getId()).orElseThrow());
        assertThat(deferred.getDurationSeconds()).isEqualTo(2.0);
        assertThat(deferred.getLocation()).isEqualTo(StorageLocation.HOLDING_TRANSCRIBE_LATER);
        assertThat(sidecarRepository.find(deferred.getAssetId()).orElseThrow().isTranscriptionDeferred()).isTrue();
    }

    @Test
    void shortAudioIsTranscribed() throws Exception {
        RemoteFile file = inbox("voicemail.wav", "audio/wav", wav(0.5));

        workerLoop.runCycle();

        Asset asset = assetRepository.findByOriginFileId(file.getId()).orElseThrow();
        assertThat(asset.getStatus()).isEqualTo(AssetStatus.NEEDS_REVIEW);
        assertThat(asset.getTranscriptRef()).isEqualTo(asset.getAssetId() + "_transcript.json");
        assertThat(sidecarRepository.resolveArtifact(asset.getTranscriptRef())).exists();
    }

    @Test
    void lowDiskStopsIntakeForTheCycle() {
        RemoteFile file = inbox("later.txt", "text/plain", randomBytes(16));
        when(diskSpaceProbe.usableBytes(any())).thenReturn(10L);

        WorkerCycleReport blocked = workerLoop.runCycle();

        assertThat(blocked.isStoppedByBackpressure()).isTrue();
        assertThat(assetRepository.findByOriginFileId(file.getId())).isEmpty();

        when(diskSpaceProbe.usableBytes(any())).thenReturn(Long.MAX_VALUE);
        WorkerCycleReport resumed = workerLoop.runCycle();

        assertThat(resumed.isStoppedByBackpressure()).isFalse();
        assertThat(assetRepository.findByOriginFileId(file.getId())).isPresent();
    }

    private RemoteFile inbox(String name, String mimeType, byte[] content) {
        return blobStore.upload(StorageLocation.INBOX_UPLOADS, name, mimeType, content);
    }

    private byte[] randomBytes(int size) {
        byte[] bytes = new byte[size];
        random.nextBytes(bytes);
        return bytes;
    }

    private byte[] wav(double seconds) throws Exception {
        AudioFormat format = new AudioFormat(8000f, 8, 1, true, false);
        byte[] samples = randomBytes((int) (seconds * 8000));
        try (AudioInputStream in = new AudioInputStream(new ByteArrayInputStream(samples), format, samples.length);
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            AudioSystem.write(in, AudioFileFormat.Type.WAVE, out);
            return out.toByteArray();
        }
    }

    static class CountingTranscriptEnricher implements TranscriptEnricher {
        final AtomicInteger runs = new AtomicInteger();

        @Override
        public void load() {
        }

        @Override
        public List<TranscriptSegment> run(Path path) {
            runs.incrementAndGet();
            return List.of(new TranscriptSegment(0.0, 0.5, "Hallo, hier ist Oma"));
        }

        @Override
        public void unload() {
        }
    }
}
