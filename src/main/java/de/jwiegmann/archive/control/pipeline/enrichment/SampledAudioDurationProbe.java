package de.jwiegmann.archive.control.pipeline.enrichment;

import lombok.extern.slf4j.Slf4j;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Liest die Laufzeit aus den Headern der von javax.sound unterstützten Formate (WAV, AIFF, AU).
 * Rückfallebene von {@link ContainerDurationProbe}.
 */
@Slf4j
public class SampledAudioDurationProbe implements MediaDurationProbe {

    @Override
    public Optional<Double> durationSeconds(Path path, String mimeType) {
        try {
            AudioFileFormat fileFormat = AudioSystem.getAudioFileFormat(path.toFile());
            AudioFormat format = fileFormat.getFormat();
            long frames = fileFormat.getFrameLength();
            if (frames == AudioSystem.NOT_SPECIFIED || format.getFrameRate() <= 0) {
                return Optional.empty();
            }
            return Optional.of(frames / (double) format.getFrameRate());
        } catch (UnsupportedAudioFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.debug("Cannot probe duration of {}: {}", path.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }
}
