package de.jwiegmann.archive.control.pipeline.metadata;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.GeoLocation;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Liest Aufnahmedatum (DateTimeOriginal) und GPS-Position aus den EXIF-Daten eines Bildes.
 * Fehlende oder kaputte EXIF-Daten ergeben leere Felder, nie einen Fehler.
 */
@Slf4j
@Component
public class ExifMetadataReader {

    private static final DateTimeFormatter EXIF_DATE = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    public ExifMetadata read(Path image) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(image.toFile());
        } catch (ImageProcessingException | IOException e) {
            log.debug("No EXIF data in {}: {}", image.getFileName(), e.getMessage());
            return ExifMetadata.empty();
        }

        LocalDateTime dateTaken = null;
        ExifSubIFDDirectory exif = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        if (exif != null) {
            dateTaken = parseDate(exif.getString(ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL), image);
        }

        Double latitude = null;
        Double longitude = null;
        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        GeoLocation location = gps == null ? null : gps.getGeoLocation();
        if (location != null && !location.isZero()) {
            latitude = location.getLatitude();
            longitude = location.getLongitude();
        }
        return new ExifMetadata(dateTaken, latitude, longitude);
    }

    private static LocalDateTime parseDate(String value, Path image) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim(), EXIF_DATE);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring malformed DateTimeOriginal '{}' in {}", value, image.getFileName());
            return null;
        }
    }
}
