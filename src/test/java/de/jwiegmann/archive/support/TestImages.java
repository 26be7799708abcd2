package de.jwiegmann.archive.support;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Random;

/**
 * Erzeugt reproduzierbare Testbilder aus zufälligen Graustufen-Blöcken.
 */
public final class TestImages {

    private static final int SIZE = 256;
    private static final int BLOCK = 16;

    private TestImages() {
    }

    /**
     * @param brightnessShift wird auf jeden Grauwert addiert; ändert nur den Gleichanteil
     */
    public static BufferedImage blocks(long seed, int brightnessShift) {
        Random random = new Random(seed);
        BufferedImage image = new BufferedImage(SIZE, SIZE, BufferedImage.TYPE_INT_RGB);
        for (int by = 0; by < SIZE; by += BLOCK) {
            for (int bx = 0; bx < SIZE; bx += BLOCK) {
                int gray = 30 + random.nextInt(190) + brightnessShift;
                int rgb = (gray << 16) | (gray << 8) | gray;
                for (int y = by; y < by + BLOCK; y++) {
                    for (int x = bx; x < bx + BLOCK; x++) {
                        image.setRGB(x, y, rgb);
                    }
                }
            }
        }
        return image;
    }

    public static byte[] png(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
