package de.jwiegmann.archive.control.pipeline.enrichment;

import de.jwiegmann.archive.entity.DetectedFace;

import java.util.List;

public interface FaceEnricher extends LoadableEnricher<List<DetectedFace>> {

    @Override
    default EnrichmentKind kind() {
        return EnrichmentKind.FACES;
    }
}
