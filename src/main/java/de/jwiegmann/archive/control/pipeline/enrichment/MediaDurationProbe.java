package de.jwiegmann.archive.control.pipeline.enrichment;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Ermittelt die Laufzeit von Audio/Video. Leer, wenn das Format nicht bekannt ist.
 */
public interface MediaDurationProbe {

    Optional<Double> durationSeconds(Path path, String mimeType);
}
