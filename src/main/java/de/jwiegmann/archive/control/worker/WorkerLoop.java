package de.jwiegmann.archive.control.worker;

import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.control.pipeline.BackpressureGovernor;
import de.jwiegmann.archive.control.repository.AssetRepository;
import de.jwiegmann.archive.control.storage.RemoteBlobStore;
import de.jwiegmann.archive.control.storage.RemoteFile;
import de.jwiegmann.archive.entity.StorageLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Ein Durchlauf des Workers: Manifeste abgleichen, dann alle noch unbekannten Dateien der Inbox
 * nacheinander verarbeiten. Dateien mit bestehendem Asset werden übersprungen, daher ist ein erneuter
 * Lauf nach einem Absturz unkritisch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkerLoop {

    private final ManifestReconciler manifestReconciler;
    private final RemoteBlobStore blobStore;
    private final AssetRepository assetRepository;
    private final BackpressureGovernor backpressure;
    private final AssetPipeline pipeline;
    private final VaultProperties properties;

    // ein Zyklus zur Zeit, auch wenn Scheduler und manueller Aufruf zusammenfallen
    public synchronized WorkerCycleReport runCycle() {
        WorkerCycleReport report = new WorkerCycleReport();
        report.setManifestsReconciled(manifestReconciler.reconcile());

        List<RemoteFile> inbox = blobStore.list(StorageLocation.INBOX_UPLOADS);
        int limit = properties.getWorker().getMaxFilesPerCycle();

        for (RemoteFile file : inbox) {
            report.setFilesSeen(report.getFilesSeen() + 1);
            if (assetRepository.findByOriginFileId(file.getId()).isPresent()) {
                report.setSkippedExisting(report.getSkippedExisting() + 1);
                continue;
            }
            if (limit > 0 && report.getProcessed() + report.getErrors() >= limit) {
                report.setStoppedByCycleLimit(true);
                break;
            }
            if (!backpressure.allowIntake()) {
                report.setStoppedByBackpressure(true);
                break;
            }

            Attribution attribution = manifestReconciler.attributionFor(file.getId()).orElseGet(Attribution::none);
            switch (pipeline.process(file, attribution)) {
                case PROCESSED -> report.setProcessed(report.getProcessed() + 1);
                case FAILED -> report.setErrors(report.getErrors() + 1);
                case SKIPPED -> report.setSkippedExisting(report.getSkippedExisting() + 1);
            }
        }

        log.info("Worker cycle: {} manifests, {} files seen, {} skipped, {} processed, {} errors{}",
                report.getManifestsReconciled(), report.getFilesSeen(), report.getSkippedExisting(),
                report.getProcessed(), report.getErrors(),
                report.isStoppedByBackpressure() ? ", stopped by backpressure" : "");
        return report;
    }
}
