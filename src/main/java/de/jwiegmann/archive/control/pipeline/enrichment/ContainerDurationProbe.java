package de.jwiegmann.archive.control.pipeline.enrichment;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.mov.QuickTimeDirectory;
import com.drew.metadata.mp4.Mp4Directory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Laufzeit aus dem Movie-Header (mvhd) von MP4/M4A- und QuickTime-Containern.
 * Andere Formate gehen an {@link SampledAudioDurationProbe}.
 */
@Slf4j
@Component
public class ContainerDurationProbe implements MediaDurationProbe {

    private final MediaDurationProbe fallback;

    public ContainerDurationProbe() {
        this(new SampledAudioDurationProbe());
    }

    ContainerDurationProbe(MediaDurationProbe fallback) {
        this.fallback = fallback;
    }

    @Override
    public Optional<Double> durationSeconds(Path path, String mimeType) {
        Optional<Double> fromContainer = readContainer(path);
        return fromContainer.isPresent() ? fromContainer : fallback.durationSeconds(path, mimeType);
    }

    private Optional<Double> readContainer(Path path) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(path.toFile());
        } catch (ImageProcessingException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.debug("Cannot read container of {}: {}", path.getFileName(), e.getMessage());
            return Optional.empty();
        }

        Optional<Double> mp4 = duration(metadata.getFirstDirectoryOfType(Mp4Directory.class),
                Mp4Directory.TAG_DURATION, Mp4Directory.TAG_TIME_SCALE);
        if (mp4.isPresent()) {
            return mp4;
        }
        return duration(metadata.getFirstDirectoryOfType(QuickTimeDirectory.class),
                QuickTimeDirectory.TAG_DURATION, QuickTimeDirectory.TAG_TIME_SCALE);
    }

    private static Optional<Double> duration(Directory directory, int durationTag, int timeScaleTag) {
        if (directory == null) {
            return Optional.empty();
        }
        Long duration = directory.getLongObject(durationTag);
        Long timeScale = directory.getLongObject(timeScaleTag);
        if (duration == null || timeScale == null || timeScale <= 0) {
            return Optional.empty();
        }
        return Optional.of(duration / (double) timeScale);
    }
}
