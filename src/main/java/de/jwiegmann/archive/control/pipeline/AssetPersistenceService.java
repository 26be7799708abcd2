package de.jwiegmann.archive.control.pipeline;

import de.jwiegmann.archive.control.pipeline.dedup.DedupMatch;
import de.jwiegmann.archive.control.pipeline.enrichment.EnrichmentResult;
import de.jwiegmann.archive.control.repository.AssetRepository;
import de.jwiegmann.archive.control.repository.DuplicateLinkRepository;
import de.jwiegmann.archive.control.repository.SidecarRepository;
import de.jwiegmann.archive.entity.Asset;
import de.jwiegmann.archive.entity.DedupMethod;
import de.jwiegmann.archive.entity.DuplicateLink;
import de.jwiegmann.archive.entity.SidecarSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Einziger Schreibpfad der Pipeline für Assets, DuplicateLinks und Sidecars.
 */
@Service
@RequiredArgsConstructor
public class AssetPersistenceService {

    private final AssetRepository assetRepository;
    private final DuplicateLinkRepository duplicateLinkRepository;
    private final SidecarRepository sidecarRepository;
    private final Clock clock;

    /**
     * Legt das Asset an, sofern für dessen originFileId noch keines existiert.
     *
     * @return false wenn die Datei bereits von einem anderen Durchlauf übernommen wurde
     */
    public boolean claim(Asset asset) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (asset.getCreatedAt() == null) {
            asset.setCreatedAt(now);
        }
        asset.setUpdatedAt(now);
        return assetRepository.createIfAbsent(asset);
    }

    public Asset update(Asset asset) {
        asset.setUpdatedAt(LocalDateTime.now(clock));
        return assetRepository.save(asset);
    }

    /**
     * Schreibt das Ergebnis eines vollständigen Durchlaufs: Asset, ggf. DuplicateLink und Sidecar.
     */
    public SidecarSnapshot recordOutcome(Asset asset, DedupMatch duplicate, EnrichmentResult enrichment) {
        LocalDateTime now = LocalDateTime.now(clock);
        asset.setProcessedAt(now);
        update(asset);

        if (duplicate != null) {
            duplicateLinkRepository.saveIfAbsent(DuplicateLink.builder()
                    .assetId(asset.getAssetId())
                    .duplicateOf(duplicate.getDuplicateOf())
                    .method(duplicate.getMethod())
                    .distance(duplicate.getMethod() == DedupMethod.NEAR ? duplicate.getDistance() : null)
                    .createdAt(now)
                    .build());
        }

        return sidecarRepository.write(SidecarSnapshot.builder()
                .writtenAt(now)
                .asset(asset)
                .faces(enrichment == null || enrichment.getFaces() == null ? List.of() : enrichment.getFaces())
                .duplicateDistance(duplicate == null ? null : duplicate.getDistance())
                .transcriptionDeferred(enrichment != null && enrichment.isTranscriptionDeferred())
                .build());
    }

    /**
     * Hält ein fehlgeschlagenes Asset fest. Es bleibt zur manuellen Prüfung sichtbar.
     */
    public SidecarSnapshot recordFailure(Asset asset) {
        asset.setProcessedAt(LocalDateTime.now(clock));
        update(asset);
        return sidecarRepository.write(SidecarSnapshot.builder()
                .writtenAt(asset.getProcessedAt())
                .asset(asset)
                .faces(List.of())
                .build());
    }
}
