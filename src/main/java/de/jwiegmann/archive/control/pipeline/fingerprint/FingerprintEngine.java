package de.jwiegmann.archive.control.pipeline.fingerprint;

import de.jwiegmann.archive.entity.AssetType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Berechnet SHA-256 (immer, gestreamt) und für Bilder zusätzlich den Perceptual Hash.
 */
@Slf4j
@Service
public class FingerprintEngine {

    /**
     * @throws IOException wenn die Datei nicht gelesen werden kann; ein fehlgeschlagener pHash ist dagegen kein Fehler
     */
    public Fingerprint fingerprint(Path localPath, String mimeType) throws IOException {
        String sha256;
        try (InputStream in = Files.newInputStream(localPath)) {
            sha256 = DigestUtils.sha256Hex(in);
        }

        PerceptualHash phash = null;
        if (AssetType.fromMimeType(mimeType) == AssetType.IMAGE) {
            phash = perceptualHash(localPath);
        }
        return new Fingerprint(sha256, phash);
    }

    private PerceptualHash perceptualHash(Path localPath) {
        try {
            BufferedImage image = ImageIO.read(localPath.toFile());
            if (image == null) {
                log.warn("No image reader for {}, continuing without perceptual hash", localPath.getFileName());
                return null;
            }
            return PerceptualHash.compute(image);
        } catch (IOException | RuntimeException e) {
            log.warn("Perceptual hash failed for {}: {}", localPath.getFileName(), e.getMessage());
            return null;
        }
    }
}
