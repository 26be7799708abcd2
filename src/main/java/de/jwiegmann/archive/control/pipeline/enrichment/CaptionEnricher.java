package de.jwiegmann.archive.control.pipeline.enrichment;

public interface CaptionEnricher extends LoadableEnricher<String> {

    @Override
    default EnrichmentKind kind() {
        return EnrichmentKind.CAPTION;
    }
}
