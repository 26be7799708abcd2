package de.jwiegmann.archive.control.exception;

import lombok.Getter;

/**
 * Nicht behebbarer Fehler während der Verarbeitung einer Datei (Download, Hashing, Persistenz).
 */
@Getter
public class PipelineException extends RuntimeException {

    private final String stage;

    public PipelineException(String stage, String message, Throwable cause) {
        super(stage + ": " + message, cause);
        this.stage = stage;
    }
}
