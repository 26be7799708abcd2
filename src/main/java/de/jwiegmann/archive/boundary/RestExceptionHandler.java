package de.jwiegmann.archive.boundary;

import de.jwiegmann.archive.boundary.dto.error.UploadError;
import de.jwiegmann.archive.control.UploadErrorFactory;
import de.jwiegmann.archive.control.exception.TransientStorageException;
import de.jwiegmann.archive.control.exception.UploadValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

    @ExceptionHandler(UploadValidationException.class)
    public ResponseEntity<UploadError> validation(UploadValidationException e) {
        log.debug("Rejected request: {} {}", e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(e.getStatus()).body(UploadErrorFactory.toError(e));
    }

    @ExceptionHandler(TransientStorageException.class)
    public ResponseEntity<UploadError> storageUnavailable(TransientStorageException e) {
        log.warn("Remote store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(UploadErrorFactory.storageUnavailable(e.getMessage()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<UploadError> missingHeader(MissingRequestHeaderException e) {
        UploadValidationException mapped = UploadRestController.SESSION_HEADER.equalsIgnoreCase(e.getHeaderName())
                ? UploadErrorFactory.sessionNotFound(null)
                : UploadErrorFactory.invalidContentRange(null, "missing header");
        return validation(mapped);
    }
}
