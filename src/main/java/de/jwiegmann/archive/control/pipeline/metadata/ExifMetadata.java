package de.jwiegmann.archive.control.pipeline.metadata;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Optional;

@Getter
@ToString
@AllArgsConstructor
public class ExifMetadata {

    private final LocalDateTime dateTaken;
    private final Double latitude;
    private final Double longitude;

    public static ExifMetadata empty() {
        return new ExifMetadata(null, null, null);
    }

    /**
     * Jahrzehnt des Aufnahmedatums im Format "1980s".
     */
    public Optional<String> decade() {
        if (dateTaken == null) {
            return Optional.empty();
        }
        return Optional.of(dateTaken.getYear() / 10 * 10 + "s");
    }
}
