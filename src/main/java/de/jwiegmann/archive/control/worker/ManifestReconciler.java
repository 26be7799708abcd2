package de.jwiegmann.archive.control.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.jwiegmann.archive.control.repository.BatchRepository;
import de.jwiegmann.archive.control.storage.RemoteBlobStore;
import de.jwiegmann.archive.control.storage.RemoteFile;
import de.jwiegmann.archive.entity.Batch;
import de.jwiegmann.archive.entity.BatchContext;
import de.jwiegmann.archive.entity.Manifest;
import de.jwiegmann.archive.entity.ManifestFile;
import de.jwiegmann.archive.entity.StorageLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Liest abgeschlossene Manifeste aus dem Remote-Store und baut daraus die Zuordnung
 * Datei → Batch/Contributor/Kontext auf. Jedes Manifest wird pro Prozess einmal gelesen.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ManifestReconciler {

    private final RemoteBlobStore blobStore;
    private final BatchRepository batchRepository;
    private final ObjectMapper objectMapper;

    private final Set<String> reconciledManifests = ConcurrentHashMap.newKeySet();
    private final Map<String, Attribution> attributionByFileId = new ConcurrentHashMap<>();

    /**
     * @return Anzahl der in diesem Aufruf neu übernommenen Manifeste
     */
    public int reconcile() {
        int reconciled = 0;
        for (RemoteFile file : blobStore.list(StorageLocation.INBOX_MANIFESTS)) {
            if (reconciledManifests.contains(file.getId())) {
                continue;
            }
            Manifest manifest;
            try (InputStream in = blobStore.openStream(file.getId())) {
                manifest = objectMapper.readValue(in, Manifest.class);
            } catch (IOException e) {
                log.warn("Skipping unreadable manifest {}: {}", file.getName(), e.getMessage());
                continue;
            }
            if (manifest.getBatchId() == null) {
                log.warn("Skipping manifest {} without batch id", file.getName());
                continue;
            }

            recordBatch(manifest, file.getId());
            Attribution attribution = new Attribution(manifest.getBatchId(), manifest.getContributorToken(),
                    manifest.getContext() == null ? BatchContext.empty() : manifest.getContext());
            if (manifest.getFiles() != null) {
                for (ManifestFile mf : manifest.getFiles()) {
                    attributionByFileId.putIfAbsent(mf.getRemoteFileId(), attribution);
                }
            }
            reconciledManifests.add(file.getId());
            reconciled++;
            log.info("Reconciled manifest of batch {} ({} files)", manifest.getBatchId(), manifest.getTotalFiles());
        }
        return reconciled;
    }

    /**
     * Zuordnung aus einem Manifest; ersatzweise aus einem noch offenen Batch, dann ohne Kontext.
     */
    public Optional<Attribution> attributionFor(String remoteFileId) {
        Attribution fromManifest = attributionByFileId.get(remoteFileId);
        if (fromManifest != null) {
            return Optional.of(fromManifest);
        }
        return batchRepository.findAll().stream()
                .filter(b -> b.getFiles().stream().anyMatch(f -> remoteFileId.equals(f.getRemoteFileId())))
                .findFirst()
                .map(b -> new Attribution(b.getBatchId(), b.getContributorToken(),
                        b.getContext() == null ? BatchContext.empty() : b.getContext()));
    }

    // Batches aus fremden Instanzen (oder nach Datenverlust) werden aus dem Manifest nachgetragen
    private void recordBatch(Manifest manifest, String manifestFileId) {
        boolean inserted = batchRepository.saveIfAbsent(Batch.builder()
                .batchId(manifest.getBatchId())
                .contributorToken(manifest.getContributorToken())
                .status(Batch.Status.FINISHED)
                .files(manifest.getFiles() == null ? new ArrayList<>() : new ArrayList<>(manifest.getFiles()))
                .context(manifest.getContext())
                .manifestFileId(manifestFileId)
                .createdAt(manifest.getCreatedAt())
                .finishedAt(manifest.getFinishedAt())
                .build());
        if (inserted) {
            log.info("Recorded batch {} from manifest", manifest.getBatchId());
        }
    }
}
