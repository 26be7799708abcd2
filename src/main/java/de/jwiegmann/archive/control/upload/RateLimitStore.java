package de.jwiegmann.archive.control.upload;

import java.time.Instant;
import java.util.Deque;
import java.util.function.Function;

/**
 * Key-Value-Store für die Zeitfenster des Rate-Limits.
 */
public interface RateLimitStore {

    /**
     * Führt {@code update} atomar auf der Zeitstempel-Liste des Schlüssels aus.
     */
    <R> R compute(String key, Function<Deque<Instant>, R> update);
}
