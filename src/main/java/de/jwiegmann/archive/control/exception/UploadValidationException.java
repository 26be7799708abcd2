package de.jwiegmann.archive.control.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Abgelehnte Client-Anfrage an Upload- oder Batch-Endpunkte. Trägt Fehlercode und HTTP-Status für die Antwort.
 */
@Getter
public class UploadValidationException extends RuntimeException {

    private final String errorCode;
    private final HttpStatus status;
    private final Map<String, Object> details;

    public UploadValidationException(String errorCode, HttpStatus status, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.status = status;
        this.details = details == null ? Map.of() : details;
    }
}
