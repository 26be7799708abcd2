package de.jwiegmann.archive.control.pipeline.enrichment;

import de.jwiegmann.archive.config.VaultProperties;
import de.jwiegmann.archive.control.repository.SidecarRepository;
import de.jwiegmann.archive.entity.AssetType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Führt die zum Medientyp passenden Enricher nacheinander aus, nie parallel.
 * Jeder Enricher wird unmittelbar vor seinem Lauf geladen und danach entladen, sodass immer höchstens
 * ein Modell im Speicher liegt. Fehler eines Enrichers werden gesammelt und beenden den Lauf nicht.
 */
@Slf4j
@Service
public class EnrichmentOrchestrator {

    private final FaceEnricher faceEnricher;
    private final CaptionEnricher captionEnricher;
    private final EmbeddingEnricher embeddingEnricher;
    private final TranscriptEnricher transcriptEnricher;
    private final SidecarRepository sidecarRepository;
    private final VaultProperties properties;

    @Autowired
    public EnrichmentOrchestrator(ObjectProvider<FaceEnricher> faceEnricher,
                                  ObjectProvider<CaptionEnricher> captionEnricher,
                                  ObjectProvider<EmbeddingEnricher> embeddingEnricher,
                                  ObjectProvider<TranscriptEnricher> transcriptEnricher,
                                  SidecarRepository sidecarRepository,
                                  VaultProperties properties) {
        this(faceEnricher.getIfAvailable(), captionEnricher.getIfAvailable(), embeddingEnricher.getIfAvailable(),
                transcriptEnricher.getIfAvailable(), sidecarRepository, properties);
    }

    EnrichmentOrchestrator(FaceEnricher faceEnricher,
                           CaptionEnricher captionEnricher,
                           EmbeddingEnricher embeddingEnricher,
                           TranscriptEnricher transcriptEnricher,
                           SidecarRepository sidecarRepository,
                           VaultProperties properties) {
        this.faceEnricher = faceEnricher;
        this.captionEnricher = captionEnricher;
        this.embeddingEnricher = embeddingEnricher;
        this.transcriptEnricher = transcriptEnricher;
        this.sidecarRepository = sidecarRepository;
        this.properties = properties;
    }

    /**
     * @param declaredDurationSeconds Laufzeit bei Audio/Video, null wenn unbekannt
     */
    public EnrichmentResult enrich(String assetId, Path localPath, AssetType assetType, Double declaredDurationSeconds) {
        EnrichmentResult result = new EnrichmentResult();

        if (isActive(faceEnricher, assetType)) {
            runScoped(faceEnricher, localPath, result).ifPresent(result::setFaces);
        }
        if (isActive(captionEnricher, assetType)) {
            runScoped(captionEnricher, localPath, result).ifPresent(result::setCaption);
        }
        if (isActive(embeddingEnricher, assetType)) {
            runScoped(embeddingEnricher, localPath, result)
                    .filter(vector -> !vector.isEmpty())
                    .flatMap(vector -> writeArtifact(assetId, EnrichmentKind.EMBEDDING, "embedding", vector, result))
                    .ifPresent(result::setEmbeddingRef);
        }
        if (isActive(transcriptEnricher, assetType)) {
            if (exceedsTranscriptionLimit(declaredDurationSeconds)) {
                log.info("Asset {} runs {}s, over the transcription limit; deferring", assetId, declaredDurationSeconds);
                result.setTranscriptionDeferred(true);
            } else {
                runScoped(transcriptEnricher, localPath, result)
                        .filter(segments -> !segments.isEmpty())
                        .flatMap(segments -> writeArtifact(assetId, EnrichmentKind.TRANSCRIPT, "transcript", segments, result))
                        .ifPresent(result::setTranscriptRef);
            }
        }
        return result;
    }

    private boolean isActive(LoadableEnricher<?> enricher, AssetType assetType) {
        return enricher != null
                && enricher.kind().appliesTo(assetType)
                && properties.getEnrichment().getEnabledKinds().contains(enricher.kind());
    }

    private boolean exceedsTranscriptionLimit(Double durationSeconds) {
        if (durationSeconds == null) {
            return false;
        }
        return durationSeconds > properties.getEnrichment().getTranscribeMaxDuration().toSeconds();
    }

    private <T> Optional<T> runScoped(LoadableEnricher<T> enricher, Path path, EnrichmentResult result) {
        EnrichmentKind kind = enricher.kind();
        try {
            enricher.load();
            return Optional.ofNullable(enricher.run(path));
        } catch (Exception e) {
            log.warn("Enricher {} failed on {}: {}", kind, path.getFileName(), e.toString());
            result.getErrors().add(new EnrichmentError(kind, describe(e)));
            return Optional.empty();
        } finally {
            try {
                enricher.unload();
            } catch (RuntimeException e) {
                log.warn("Enricher {} failed to unload: {}", kind, e.toString());
                result.getErrors().add(new EnrichmentError(kind, "unload failed: " + describe(e)));
            }
        }
    }

    private Optional<String> writeArtifact(String assetId, EnrichmentKind kind, String name, Object payload,
                                           EnrichmentResult result) {
        try {
            return Optional.of(sidecarRepository.writeArtifact(assetId, name, payload));
        } catch (UncheckedIOException e) {
            log.warn("Could not store {} artifact of asset {}: {}", name, assetId, e.getMessage());
            result.getErrors().add(new EnrichmentError(kind, "artifact not stored: " + describe(e)));
            return Optional.empty();
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
