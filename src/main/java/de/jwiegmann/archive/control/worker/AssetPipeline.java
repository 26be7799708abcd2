package de.jwiegmann.archive.control.worker;

import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.control.exception.PipelineException;
import de.jwiegmann.archive.control.pipeline.AssetPersistenceService;
import de.jwiegmann.archive.control.pipeline.dedup.DedupMatch;
import de.jwiegmann.archive.control.pipeline.dedup.DedupResolver;
import de.jwiegmann.archive.control.pipeline.enrichment.EnrichmentError;
import de.jwiegmann.archive.control.pipeline.enrichment.EnrichmentOrchestrator;
import de.jwiegmann.archive.control.pipeline.enrichment.EnrichmentResult;
import de.jwiegmann.archive.control.pipeline.enrichment.MediaDurationProbe;
import de.jwiegmann.archive.control.pipeline.fingerprint.Fingerprint;
import de.jwiegmann.archive.control.pipeline.fingerprint.FingerprintEngine;
import de.jwiegmann.archive.control.pipeline.fingerprint.PerceptualHash;
import de.jwiegmann.archive.control.pipeline.metadata.ExifMetadata;
import de.jwiegmann.archive.control.pipeline.metadata.ExifMetadataReader;
import de.jwiegmann.archive.control.pipeline.routing.RoutingDecision;
import de.jwiegmann.archive.control.pipeline.routing.RoutingStateMachine;
import de.jwiegmann.archive.control.storage.RemoteBlobStore;
import de.jwiegmann.archive.control.storage.RemoteFile;
import de.jwiegmann.archive.entity.Asset;
import de.jwiegmann.archive.entity.AssetStatus;
import de.jwiegmann.archive.entity.AssetType;
import de.jwiegmann.archive.entity.BatchContext;
import de.jwiegmann.archive.entity.StorageLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Verarbeitet genau eine Datei aus der Inbox vollständig:
 * übernehmen → nach PROCESSING verschieben → lokal ablegen → Fingerprint → EXIF → Dedup → Enrichment → Routing
 * → an den Zielort verschieben → Asset und Sidecar schreiben → lokale Kopie löschen.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssetPipeline {

    private static final double EXIF_DECADE_CONFIDENCE = 0.6;

    private final RemoteBlobStore blobStore;
    private final FingerprintEngine fingerprintEngine;
    private final DedupResolver dedupResolver;
    private final ExifMetadataReader exifReader;
    private final MediaDurationProbe durationProbe;
    private final EnrichmentOrchestrator enrichmentOrchestrator;
    private final RoutingStateMachine routing;
    private final AssetPersistenceService persistence;
    private final VaultProperties properties;

    public ProcessingOutcome process(RemoteFile file, Attribution attribution) {
        Asset asset = newAsset(file, attribution);
        try {
            if (!persistence.claim(asset)) {
                log.info("Origin file {} already has an asset, skipping", file.getId());
                return ProcessingOutcome.SKIPPED;
            }
        } catch (RuntimeException e) {
            // Claim ist zurückgerollt, die Datei bleibt in der Inbox und kommt im nächsten Zyklus wieder
            log.error("Could not claim origin file {} ({}), leaving it in the inbox", file.getId(), file.getName(), e);
            return ProcessingOutcome.FAILED;
        }

        Path local = null;
        String stage = "move-to-processing";
        try {
            routing.transition(asset, AssetStatus.PROCESSING);
            blobStore.move(file.getId(), StorageLocation.PROCESSING);
            asset.setLocation(StorageLocation.PROCESSING);
            persistence.update(asset);

            stage = "download";
            local = stage(file, asset.getAssetId());

            stage = "fingerprint";
            Fingerprint fingerprint = fingerprintEngine.fingerprint(local, asset.getMimeType());
            asset.setSha256(fingerprint.getSha256());
            asset.setPhash(fingerprint.perceptualHash().map(PerceptualHash::toHex).orElse(null));
            persistence.update(asset);

            if (asset.getAssetType() == AssetType.IMAGE) {
                stage = "metadata";
                applyExif(asset, exifReader.read(local));
            }

            stage = "dedup";
            Optional<DedupMatch> duplicate = dedupResolver.resolve(asset);
            duplicate.ifPresent(d -> {
                asset.setDuplicateOf(d.getDuplicateOf());
                asset.setDuplicateMethod(d.getMethod());
            });

            stage = "enrichment";
            AssetType type = asset.getAssetType();
            if (type.isTimeBased()) {
                asset.setDurationSeconds(durationProbe.durationSeconds(local, asset.getMimeType()).orElse(null));
            }
            EnrichmentResult enrichment = enrichmentOrchestrator.enrich(asset.getAssetId(), local, type, asset.getDurationSeconds());
            applyEnrichment(asset, enrichment);

            stage = "route";
            RoutingDecision decision = routing.route(duplicate, type, enrichment.isTranscriptionDeferred());
            blobStore.move(file.getId(), decision.getLocation());
            routing.transition(asset, decision.getStatus());
            asset.setLocation(decision.getLocation());

            stage = "persist";
            persistence.recordOutcome(asset, duplicate.orElse(null), enrichment);
            log.info("Asset {} ({}) routed to {}", asset.getAssetId(), file.getName(), decision.getStatus());
            return ProcessingOutcome.PROCESSED;
        } catch (IOException | RuntimeException e) {
            fail(asset, new PipelineException(stage, describe(e), e));
            return ProcessingOutcome.FAILED;
        } finally {
            deleteQuietly(local);
        }
    }

    private Asset newAsset(RemoteFile file, Attribution attribution) {
        BatchContext context = attribution.getContext() == null ? BatchContext.empty() : attribution.getContext();
        boolean hasDecade = context.getDecade() != null && !context.getDecade().isBlank();
        return Asset.builder()
                .assetId(UUID.randomUUID().toString())
                .originFileId(file.getId())
                .contributorToken(attribution.getContributorToken())
                .batchId(attribution.getBatchId())
                .event(context.getEvent())
                .notes(context.getNotes())
                .decadeEstimate(hasDecade ? context.getDecade() : null)
                .decadeConfidence(hasDecade ? 1.0 : null)
                .originalFilename(file.getName())
                .mimeType(file.getMimeType())
                .sizeBytes(file.getSize())
                .status(AssetStatus.UPLOADED)
                .location(StorageLocation.INBOX_UPLOADS)
                .build();
    }

    private Path stage(RemoteFile file, String assetId) throws IOException {
        Path cacheDir = properties.getStorage().getCacheDir();
        Files.createDirectories(cacheDir);
        Path target = cacheDir.resolve(assetId + extensionOf(file.getName()));
        blobStore.downloadTo(file.getId(), target);
        return target;
    }

    private static void applyExif(Asset asset, ExifMetadata exif) {
        asset.setExifDate(exif.getDateTaken());
        asset.setGpsLat(exif.getLatitude());
        asset.setGpsLon(exif.getLongitude());
        if (asset.getDecadeEstimate() == null) {
            exif.decade().ifPresent(decade -> {
                asset.setDecadeEstimate(decade);
                asset.setDecadeConfidence(EXIF_DECADE_CONFIDENCE);
            });
        }
    }

    private static void applyEnrichment(Asset asset, EnrichmentResult enrichment) {
        if (enrichment.getFaces() != null) {
            asset.setFaceCount(enrichment.getFaces().size());
        }
        asset.setCaption(enrichment.getCaption());
        asset.setEmbeddingRef(enrichment.getEmbeddingRef());
        asset.setTranscriptRef(enrichment.getTranscriptRef());
        asset.setEnrichmentErrors(enrichment.getErrors().stream()
                .map(EnrichmentError::toString)
                .collect(Collectors.toList()));
    }

    private void fail(Asset asset, PipelineException e) {
        log.error("Processing of asset {} ({}) failed in stage {}", asset.getAssetId(), asset.getOriginalFilename(), e.getStage(), e);
        asset.setStatus(routing.failure().getStatus());
        asset.setErrorMessage(e.getMessage());
        try {
            persistence.recordFailure(asset);
        } catch (RuntimeException persistError) {
            log.error("Could not record failure of asset {}", asset.getAssetId(), persistError);
        }
    }

    private static void deleteQuietly(Path local) {
        if (local == null) {
            return;
        }
        try {
            Files.deleteIfExists(local);
        } catch (IOException e) {
            log.warn("Could not delete staging copy {}: {}", local, e.getMessage());
        }
    }

    private static String extensionOf(String name) {
        if (name == null) {
            return "";
        }
        int dot = name.lastIndexOf('.');
        return dot < 0 || dot == name.length() - 1 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
