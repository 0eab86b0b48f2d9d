package guraa.photoclean.visual;

import guraa.photoclean.util.GrayImage;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * 64-bit perceptual hashes. Bits are packed most significant first in
 * row-major order, so the bucket prefix of a hash is its top rows.
 */
@Component
public class PerceptualHasher {

    /**
     * Identifies the pHash bit layout. Stored hashes with another layout are not comparable.
     */
    public static final String PHASH_LAYOUT = "phash-ac63-msb-rowmajor-v1";

    /**
     * Identifies the dHash bit layout.
     */
    public static final String DHASH_LAYOUT = "dhash-rowmajor-msb-v1";

    private static final int DCT_SIZE = 32;
    private static final int LOW_FREQ = 8;
    private static final double[][] DCT_MATRIX = createDctMatrix(DCT_SIZE);

    /**
     * DCT hash: the image is reduced to 32x32, transformed with an orthonormal
     * 2D DCT-II, and the 63 AC coefficients of the low 8x8 block are compared
     * against their median. The DC term is skipped, so the lowest bit is always 0.
     *
     * @param gray The luminance raster
     * @return The hash
     */
    public long phash(GrayImage gray) {
        GrayImage small = gray.resizeArea(DCT_SIZE, DCT_SIZE);
        float[] pixels = small.getData();

        // Only the low 8x8 block is needed: C * P * C^T restricted to its top-left corner
        double[][] rowPass = new double[LOW_FREQ][DCT_SIZE];
        for (int u = 0; u < LOW_FREQ; u++) {
            for (int x = 0; x < DCT_SIZE; x++) {
                double acc = 0.0;
                for (int y = 0; y < DCT_SIZE; y++) {
                    acc += DCT_MATRIX[u][y] * pixels[y * DCT_SIZE + x];
                }
                rowPass[u][x] = acc;
            }
        }

        double[] coefficients = new double[LOW_FREQ * LOW_FREQ - 1];
        int index = 0;
        for (int u = 0; u < LOW_FREQ; u++) {
            for (int v = 0; v < LOW_FREQ; v++) {
                double acc = 0.0;
                for (int x = 0; x < DCT_SIZE; x++) {
                    acc += rowPass[u][x] * DCT_MATRIX[v][x];
                }
                if (u == 0 && v == 0) {
                    continue;
                }
                coefficients[index++] = acc;
            }
        }

        double[] sorted = coefficients.clone();
        Arrays.sort(sorted);
        double median = sorted[sorted.length / 2];

        long hash = 0L;
        for (double coefficient : coefficients) {
            hash = (hash << 1) | (coefficient > median ? 1L : 0L);
        }
        return hash << 1;
    }

    /**
     * Difference hash: the image is reduced to 9x8 and each bit records whether
     * a pixel is darker than its right neighbour.
     *
     * @param gray The luminance raster
     * @return The hash
     */
    public long dhash(GrayImage gray) {
        GrayImage small = gray.resizeArea(9, 8);
        long hash = 0L;
        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 8; x++) {
                hash = (hash << 1) | (small.get(x, y) < small.get(x + 1, y) ? 1L : 0L);
            }
        }
        return hash;
    }

    /**
     * Number of differing bits.
     */
    public static int hammingDistance(long hash1, long hash2) {
        return Long.bitCount(hash1 ^ hash2);
    }

    private static double[][] createDctMatrix(int n) {
        double[][] matrix = new double[n][n];
        for (int k = 0; k < n; k++) {
            double scale = k == 0 ? Math.sqrt(1.0 / n) : Math.sqrt(2.0 / n);
            for (int i = 0; i < n; i++) {
                matrix[k][i] = scale * Math.cos(Math.PI * (2 * i + 1) * k / (2.0 * n));
            }
        }
        return matrix;
    }
}
