package de.jwiegmann.archive.control;

import de.jwiegmann.archive.boundary.dto.error.UploadError;
import de.jwiegmann.archive.control.exception.UploadValidationException;
import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Zentrale Stelle für Fehlercodes der Upload- und Batch-Schnittstelle.
 */
public final class UploadErrorFactory {

    private UploadErrorFactory() {
    }

    public static UploadValidationException invalidToken() {
        return new UploadValidationException("INVALID_TOKEN", HttpStatus.FORBIDDEN,
                "unknown contributor token", Map.of());
    }

    public static UploadValidationException invalidInitPayload(String details) {
        return new UploadValidationException("INVALID_INIT_PAYLOAD", HttpStatus.BAD_REQUEST,
                "invalid init payload: " + details, Map.of("details", details));
    }

    public static UploadValidationException fileTooLarge(long sizeBytes, long maxBytes) {
        return new UploadValidationException("FILE_TOO_LARGE", HttpStatus.PAYLOAD_TOO_LARGE,
                "file exceeds maximum upload size",
                Map.of("sizeBytes", sizeBytes, "maxBytes", maxBytes));
    }

    public static UploadValidationException rateLimited(int limitPerHour) {
        return new UploadValidationException("RATE_LIMITED", HttpStatus.TOO_MANY_REQUESTS,
                "too many uploads started within the last hour", Map.of("limitPerHour", limitPerHour));
    }

    public static UploadValidationException sessionNotFound(String sessionId) {
        return new UploadValidationException("SESSION_NOT_FOUND", HttpStatus.NOT_FOUND,
                "upload session not found", Map.of("sessionId", String.valueOf(sessionId)));
    }

    public static UploadValidationException invalidContentRange(String header, String reason) {
        return new UploadValidationException("INVALID_CONTENT_RANGE", HttpStatus.BAD_REQUEST,
                "invalid Content-Range: " + reason, Map.of("contentRange", String.valueOf(header)));
    }

    public static UploadValidationException invalidBatchPayload(String details) {
        return new UploadValidationException("INVALID_BATCH_PAYLOAD", HttpStatus.BAD_REQUEST,
                "invalid batch payload: " + details, Map.of("details", details));
    }

    public static UploadValidationException batchNotFound(String batchId) {
        return new UploadValidationException("BATCH_NOT_FOUND", HttpStatus.NOT_FOUND,
                "batch not found", Map.of("batchId", String.valueOf(batchId)));
    }

    public static UploadValidationException batchContributorMismatch(String batchId) {
        return new UploadValidationException("BATCH_CONTRIBUTOR_MISMATCH", HttpStatus.FORBIDDEN,
                "batch belongs to another contributor", Map.of("batchId", batchId));
    }

    public static UploadValidationException batchAlreadyFinished(String batchId) {
        return new UploadValidationException("BATCH_ALREADY_FINISHED", HttpStatus.CONFLICT,
                "batch already finished", Map.of("batchId", batchId));
    }

    public static UploadValidationException tooManyFiles(int count, int maxFiles) {
        return new UploadValidationException("TOO_MANY_FILES", HttpStatus.BAD_REQUEST,
                "too many files in batch (max " + maxFiles + ")",
                Map.of("count", count, "maxFiles", maxFiles));
    }

    public static UploadError storageUnavailable(String message) {
        return UploadError.builder()
                .code("STORAGE_UNAVAILABLE")
                .message("remote store temporarily unavailable, retry the chunk")
                .details(Map.of("cause", String.valueOf(message)))
                .build();
    }

    public static UploadError toError(UploadValidationException e) {
        return UploadError.builder()
                .code(e.getErrorCode())
                .message(e.getMessage())
                .details(e.getDetails())
                .build();
    }
}
