package de.jwiegmann.archive.control.pipeline.enrichment;

import java.util.List;

public interface EmbeddingEnricher extends LoadableEnricher<List<Float>> {

    @Override
    default EnrichmentKind kind() {
        return EnrichmentKind.EMBEDDING;
    }
}
