package de.jwiegmann.archive.control.pipeline.enrichment;

import java.util.List;

public interface TranscriptEnricher extends LoadableEnricher<List<TranscriptSegment>> {

    @Override
    default EnrichmentKind kind() {
        return EnrichmentKind.TRANSCRIPT;
    }
}
