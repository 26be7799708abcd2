package de.jwiegmann.archive.control.pipeline.enrichment;

import java.nio.file.Path;

/**
 * Schmale Schnittstelle zu einem Modell. Der Orchestrator ruft immer load() direkt vor run()
 * und unload() direkt danach auf, auch wenn load() oder run() fehlschlagen.
 *
 * @param <T> Ausgabe des Modells
 */
public interface LoadableEnricher<T> {

    EnrichmentKind kind();

    void load() throws Exception;

    T run(Path path) throws Exception;

    void unload();
}
