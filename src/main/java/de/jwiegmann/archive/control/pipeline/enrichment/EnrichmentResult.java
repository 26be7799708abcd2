package de.jwiegmann.archive.control.pipeline.enrichment;

import de.jwiegmann.archive.entity.DetectedFace;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class EnrichmentResult {

    private List<DetectedFace> faces;
    private String caption;
    private String embeddingRef;
    private String transcriptRef;

    // Transkription wegen Überlänge übersprungen
    private boolean transcriptionDeferred;

    private final List<EnrichmentError> errors = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
