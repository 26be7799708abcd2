package de.jwiegmann.archive.control.pipeline.fingerprint;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * 64-Bit DCT-Hash (pHash): Graustufen auf 32x32, DCT-II, linke obere 8x8 Koeffizienten gegen deren Median.
 * Hex-Darstellung mit 16 Zeichen, Bit 63 zuerst.
 */
public final class PerceptualHash {

    public static final int BITS = 64;

    private static final int SIZE = 32;
    private static final int LOW = 8;
    private static final double[][] DCT = dctMatrix(SIZE);

    private final long bits;

    private PerceptualHash(long bits) {
        this.bits = bits;
    }

    public static PerceptualHash of(long bits) {
        return new PerceptualHash(bits);
    }

    public static PerceptualHash fromHex(String hex) {
        if (hex == null || hex.length() != 16) {
            throw new IllegalArgumentException("perceptual hash must be 16 hex characters: " + hex);
        }
        return new PerceptualHash(HexFormat.fromHexDigitsToLong(hex));
    }

    public static PerceptualHash compute(BufferedImage image) {
        double[][] pixels = grayscale(image);
        double[][] coefficients = multiply(multiply(DCT, pixels), transpose(DCT));

        double[] low = new double[LOW * LOW];
        for (int y = 0; y < LOW; y++) {
            for (int x = 0; x < LOW; x++) {
                low[y * LOW + x] = coefficients[y][x];
            }
        }
        double[] sorted = low.clone();
        Arrays.sort(sorted);
        double median = (sorted[31] + sorted[32]) / 2.0;

        long hash = 0L;
        for (double value : low) {
            hash = (hash << 1) | (value > median ? 1L : 0L);
        }
        return new PerceptualHash(hash);
    }

    public int distanceTo(PerceptualHash other) {
        return Long.bitCount(bits ^ other.bits);
    }

    public String toHex() {
        return HexFormat.of().toHexDigits(bits);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PerceptualHash other && other.bits == bits;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bits);
    }

    @Override
    public String toString() {
        return toHex();
    }

    // Mittelwert-Skalierung auf SIZE x SIZE, Luminanz nach ITU-R BT.601
    private static double[][] grayscale(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        double[][] out = new double[SIZE][SIZE];
        for (int y = 0; y < SIZE; y++) {
            int y0 = y * height / SIZE;
            int y1 = Math.max(y0 + 1, (y + 1) * height / SIZE);
            for (int x = 0; x < SIZE; x++) {
                int x0 = x * width / SIZE;
                int x1 = Math.max(x0 + 1, (x + 1) * width / SIZE);
                double sum = 0;
                int count = 0;
                for (int yy = y0; yy < y1 && yy < height; yy++) {
                    for (int xx = x0; xx < x1 && xx < width; xx++) {
                        int rgb = image.getRGB(xx, yy);
                        int r = (rgb >> 16) & 0xff;
                        int g = (rgb >> 8) & 0xff;
                        int b = rgb & 0xff;
                        sum += 0.299 * r + 0.587 * g + 0.114 * b;
                        count++;
                    }
                }
                out[y][x] = count == 0 ? 0 : sum / count;
            }
        }
        return out;
    }

    private static double[][] dctMatrix(int n) {
        double[][] m = new double[n][n];
        for (int k = 0; k < n; k++) {
            double scale = k == 0 ? Math.sqrt(1.0 / n) : Math.sqrt(2.0 / n);
            for (int i = 0; i < n; i++) {
                m[k][i] = scale * Math.cos(Math.PI * (2 * i + 1) * k / (2.0 * n));
            }
        }
        return m;
    }

    private static double[][] multiply(double[][] a, double[][] b) {
        int n = a.length;
        int p = b[0].length;
        double[][] out = new double[n][p];
        for (int i = 0; i < n; i++) {
            for (int k = 0; k < b.length; k++) {
                double aik = a[i][k];
                for (int j = 0; j < p; j++) {
                    out[i][j] += aik * b[k][j];
                }
            }
        }
        return out;
    }

    private static double[][] transpose(double[][] m) {
        double[][] t = new double[m[0].length][m.length];
        for (int i = 0; i < m.length; i++) {
            for (int j = 0; j < m[0].length; j++) {
                t[j][i] = m[i][j];
            }
        }
        return t;
    }
}
