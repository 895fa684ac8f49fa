package com.sifinder.fingerprint;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * DCT based perceptual hash. The image is reduced to a 32x32 grayscale grid, transformed with a
 * 2D DCT-II and the 8x8 low-frequency block is thresholded against the median of its AC terms.
 */
public class PerceptualHashExtractor implements FingerprintExtractor {
    static final int SAMPLE_SIZE = 32;
    static final int BLOCK_SIZE = 8;

    private static final double[][] COSINES = cosineTable();

    private final ImageDecoder decoder;

    public PerceptualHashExtractor() {
        this(new ImageDecoder());
    }

    public PerceptualHashExtractor(ImageDecoder decoder) {
        this.decoder = decoder;
    }

    @Override
    public Fingerprint compute(Path image) throws DecodeException {
        return compute(decoder.decode(image));
    }

    @Override
    public Fingerprint compute(BufferedImage image) {
        double[][] pixels = resample(luminance(image), image.getWidth(), image.getHeight());
        double[][] block = lowFrequencyDct(pixels);
        double median = acMedian(block);

        long bits = 0L;
        for (int u = 0; u < BLOCK_SIZE; u++) {
            for (int v = 0; v < BLOCK_SIZE; v++) {
                bits <<= 1;
                if (block[u][v] > median) {
                    bits |= 1L;
                }
            }
        }
        return new Fingerprint(bits);
    }

    static double[] luminance(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        double[] gray = new double[argb.length];
        for (int i = 0; i < argb.length; i++) {
            int r = (argb[i] >> 16) & 0xFF;
            int g = (argb[i] >> 8) & 0xFF;
            int b = argb[i] & 0xFF;
            gray[i] = 0.299 * r + 0.587 * g + 0.114 * b;
        }
        return gray;
    }

    /**
     * Area-averaging resample of a row-major grayscale raster to SAMPLE_SIZE x SAMPLE_SIZE. Each
     * target cell is the coverage-weighted mean of the source pixels it overlaps, which works for
     * both down- and upscaling.
     */
    static double[][] resample(double[] gray, int width, int height) {
        double[][] out = new double[SAMPLE_SIZE][SAMPLE_SIZE];
        double scaleX = (double) width / SAMPLE_SIZE;
        double scaleY = (double) height / SAMPLE_SIZE;
        for (int ty = 0; ty < SAMPLE_SIZE; ty++) {
            double y0 = ty * scaleY;
            double y1 = y0 + scaleY;
            for (int tx = 0; tx < SAMPLE_SIZE; tx++) {
                double x0 = tx * scaleX;
                double x1 = x0 + scaleX;
                double sum = 0.0;
                double area = 0.0;
                for (int sy = (int) Math.floor(y0); sy < Math.min(height, (int) Math.ceil(y1)); sy++) {
                    double wy = Math.min(y1, sy + 1) - Math.max(y0, sy);
                    if (wy <= 0) {
                        continue;
                    }
                    for (int sx = (int) Math.floor(x0); sx < Math.min(width, (int) Math.ceil(x1)); sx++) {
                        double wx = Math.min(x1, sx + 1) - Math.max(x0, sx);
                        if (wx <= 0) {
                            continue;
                        }
                        double w = wx * wy;
                        sum += gray[sy * width + sx] * w;
                        area += w;
                    }
                }
                out[ty][tx] = area == 0.0 ? 0.0 : sum / area;
            }
        }
        return out;
    }

    static double[][] lowFrequencyDct(double[][] pixels) {
        // rows first: SAMPLE_SIZE rows x BLOCK_SIZE horizontal frequencies
        double[][] rows = new double[SAMPLE_SIZE][BLOCK_SIZE];
        for (int y = 0; y < SAMPLE_SIZE; y++) {
            for (int v = 0; v < BLOCK_SIZE; v++) {
                double sum = 0.0;
                for (int x = 0; x < SAMPLE_SIZE; x++) {
                    sum += pixels[y][x] * COSINES[v][x];
                }
                rows[y][v] = sum;
            }
        }
        double[][] block = new double[BLOCK_SIZE][BLOCK_SIZE];
        for (int u = 0; u < BLOCK_SIZE; u++) {
            for (int v = 0; v < BLOCK_SIZE; v++) {
                double sum = 0.0;
                for (int y = 0; y < SAMPLE_SIZE; y++) {
                    sum += rows[y][v] * COSINES[u][y];
                }
                block[u][v] = sum;
            }
        }
        return block;
    }

    static double acMedian(double[][] block) {
        double[] ac = new double[BLOCK_SIZE * BLOCK_SIZE - 1];
        int i = 0;
        for (int u = 0; u < BLOCK_SIZE; u++) {
            for (int v = 0; v < BLOCK_SIZE; v++) {
                if (u == 0 && v == 0) {
                    continue;
                }
                ac[i++] = block[u][v];
            }
        }
        Arrays.sort(ac);
        return ac[ac.length / 2];
    }

    private static double[][] cosineTable() {
        double[][] table = new double[BLOCK_SIZE][SAMPLE_SIZE];
        for (int k = 0; k < BLOCK_SIZE; k++) {
            for (int n = 0; n < SAMPLE_SIZE; n++) {
                table[k][n] = Math.cos(Math.PI * k * (2 * n + 1) / (2.0 * SAMPLE_SIZE));
            }
        }
        return table;
    }
}
