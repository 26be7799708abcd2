package de.jwiegmann.archive.control.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.control.UploadErrorFactory;
import de.jwiegmann.archive.control.repository.BatchRepository;
import de.jwiegmann.archive.control.storage.RemoteBlobStore;
import de.jwiegmann.archive.control.storage.RemoteFile;
import de.jwiegmann.archive.control.upload.ContributorRegistry;
import de.jwiegmann.archive.entity.Batch;
import de.jwiegmann.archive.entity.BatchContext;
import de.jwiegmann.archive.entity.Manifest;
import de.jwiegmann.archive.entity.ManifestFile;
import de.jwiegmann.archive.entity.StorageLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Fasst die Uploads eines Contributors zu einem Batch zusammen und schreibt beim Abschluss
 * genau ein unveränderliches Manifest in den Remote-Store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManifestBatcher {

    private static final DateTimeFormatter BATCH_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final BatchRepository batchRepository;
    private final RemoteBlobStore blobStore;
    private final ContributorRegistry contributors;
    private final VaultProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Batch createBatch(String contributorToken) {
        contributors.requireKnown(contributorToken);

        LocalDateTime now = LocalDateTime.now(clock);
        String batchId = "batch_" + now.format(BATCH_ID_TIME) + "_" + UUID.randomUUID().toString().substring(0, 8);
        Batch batch = Batch.builder()
                .batchId(batchId)
                .contributorToken(contributorToken)
                .status(Batch.Status.OPEN)
                .createdAt(now)
                .build();
        batchRepository.saveIfAbsent(batch);
        log.info("Created batch {} for contributor {}", batchId, contributorToken);
        return batch;
    }

    /**
     * Prüft, dass der Batch existiert, dem Contributor gehört und noch offen ist.
     */
    public Batch requireOpenBatch(String batchId, String contributorToken) {
        Batch batch = requireOwnedBatch(batchId, contributorToken);
        if (batch.getStatus() != Batch.Status.OPEN) {
            throw UploadErrorFactory.batchAlreadyFinished(batchId);
        }
        return batch;
    }

    /**
     * Hängt eine fertig hochgeladene Datei an einen offenen Batch an.
     * Ist der Batch inzwischen abgeschlossen, bleibt das Manifest unverändert.
     */
    public synchronized void appendFile(String batchId, ManifestFile file) {
        Batch batch = batchRepository.find(batchId).orElse(null);
        if (batch == null) {
            log.warn("Completed upload {} references unknown batch {}", file.getRemoteFileId(), batchId);
            return;
        }
        if (batch.getStatus() != Batch.Status.OPEN) {
            log.warn("Batch {} already finished, file {} is processed without batch context", batchId, file.getRemoteFileId());
            return;
        }
        boolean known = batch.getFiles().stream()
                .anyMatch(existing -> file.getRemoteFileId().equals(existing.getRemoteFileId()));
        if (!known) {
            batch.getFiles().add(file);
        }
        // auch bei bekannter Datei schreiben: ein vorheriger Versuch kann beim Speichern gescheitert sein
        batchRepository.save(batch);
    }

    public synchronized FinishBatchResult finishBatch(String contributorToken, String batchId,
                                                      List<ManifestFile> files, BatchContext context) {
        contributors.requireKnown(contributorToken);
        List<ManifestFile> requested = files == null ? List.of() : files;
        int maxFiles = properties.getBatch().getMaxFiles();
        if (requested.size() > maxFiles) {
            throw UploadErrorFactory.tooManyFiles(requested.size(), maxFiles);
        }

        Batch batch = requireOwnedBatch(batchId, contributorToken);

        // idempotent: ein abgeschlossener Batch liefert das bestehende Ergebnis
        if (batch.getStatus() == Batch.Status.FINISHED) {
            return FinishBatchResult.builder()
                    .batchId(batchId)
                    .manifestFileId(batch.getManifestFileId())
                    .totalProcessedCount(batch.getFiles().size())
                    .alreadyFinished(true)
                    .build();
        }

        List<ManifestFile> merged = merge(batch.getFiles(), requested);
        if (merged.size() > maxFiles) {
            throw UploadErrorFactory.tooManyFiles(merged.size(), maxFiles);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Manifest manifest = Manifest.builder()
                .batchId(batchId)
                .contributorToken(contributorToken)
                .contributorDisplayName(contributors.displayName(contributorToken).orElse(null))
                .createdAt(batch.getCreatedAt())
                .finishedAt(now)
                .context(context == null ? BatchContext.empty() : context)
                .files(merged)
                .totalFiles(merged.size())
                .totalBytes(merged.stream().mapToLong(ManifestFile::getSizeBytes).sum())
                .build();

        RemoteFile written = blobStore.upload(StorageLocation.INBOX_MANIFESTS,
                batchId + ".json", "application/json", toJson(manifest));

        batch.setFiles(merged);
        batch.setStatus(Batch.Status.FINISHED);
        batch.setManifestFileId(written.getId());
        batch.setFinishedAt(now);
        batch.setContext(manifest.getContext());
        batchRepository.save(batch);

        log.info("Finished batch {} with {} files, manifest {}", batchId, merged.size(), written.getId());
        return FinishBatchResult.builder()
                .batchId(batchId)
                .manifestFileId(written.getId())
                .totalProcessedCount(merged.size())
                .alreadyFinished(false)
                .build();
    }

    private Batch requireOwnedBatch(String batchId, String contributorToken) {
        Batch batch = batchRepository.find(batchId)
                .orElseThrow(() -> UploadErrorFactory.batchNotFound(batchId));
        if (!batch.getContributorToken().equals(contributorToken)) {
            throw UploadErrorFactory.batchContributorMismatch(batchId);
        }
        return batch;
    }

    private static List<ManifestFile> merge(List<ManifestFile> accumulated, List<ManifestFile> requested) {
        Map<String, ManifestFile> byId = new LinkedHashMap<>();
        for (ManifestFile f : accumulated) {
            byId.putIfAbsent(f.getRemoteFileId(), f);
        }
        for (ManifestFile f : requested) {
            if (f.getRemoteFileId() == null || f.getRemoteFileId().isBlank()) {
                throw UploadErrorFactory.invalidBatchPayload("manifest file without remoteFileId");
            }
            byId.putIfAbsent(f.getRemoteFileId(), f);
        }
        return new ArrayList<>(byId.values());
    }

    private byte[] toJson(Manifest manifest) {
        try {
            return objectMapper.writeValueAsBytes(manifest);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize manifest " + manifest.getBatchId(), e);
        }
    }
}
