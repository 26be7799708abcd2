package de.jwiegmann.archive.boundary.dto.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Fehlerantwort der Intake-API. {@code code} ist stabil und für Clients maschinenlesbar.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadError {
    private String code;
    private String message;
    private Object details;

    @Builder.Default
    private Instant timestamp = Instant.now();
}
