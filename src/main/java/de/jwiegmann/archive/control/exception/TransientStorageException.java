package de.jwiegmann.archive.control.exception;

/**
 * Vorübergehender Fehler des Remote-Stores (Timeout, Verbindungsabbruch).
 * Wird an den Client durchgereicht, der über das Resume-Protokoll erneut sendet.
 */
public class TransientStorageException extends RuntimeException {

    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
