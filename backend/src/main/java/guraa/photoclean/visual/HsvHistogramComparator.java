package guraa.photoclean.visual;

import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Colour similarity through 2D hue/saturation histograms compared by correlation.
 * Brightness is left out so that exposure differences between shots of the same
 * scene do not count against them.
 */
@Component
public class HsvHistogramComparator {

    static final int HUE_BINS = 50;
    static final int SATURATION_BINS = 60;

    /**
     * Build the L2-normalised hue/saturation histogram of an image.
     *
     * @param image The image, usually already reduced to the comparison size
     * @return {@code HUE_BINS * SATURATION_BINS} bins, hue-major
     */
    public double[] histogram(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        double[] bins = new double[HUE_BINS * SATURATION_BINS];
        float[] hsb = new float[3];
        int[] row = new int[width];

        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                int rgb = row[x];
                Color.RGBtoHSB((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF, hsb);
                int h = Math.min(HUE_BINS - 1, (int) (hsb[0] * HUE_BINS));
                int s = Math.min(SATURATION_BINS - 1, (int) (hsb[1] * SATURATION_BINS));
                bins[h * SATURATION_BINS + s]++;
            }
        }

        double norm = 0.0;
        for (double bin : bins) {
            norm += bin * bin;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < bins.length; i++) {
                bins[i] /= norm;
            }
        }
        return bins;
    }

    /**
     * Pearson correlation of two histograms, in [-1, 1]. Two flat histograms have no
     * variance to correlate; they score 1 when equal and 0 otherwise.
     *
     * @param h1 First histogram
     * @param h2 Second histogram
     * @return The correlation
     */
    public double correlation(double[] h1, double[] h2) {
        if (h1.length != h2.length) {
            throw new IllegalArgumentException("Histogram sizes differ: " + h1.length + " vs " + h2.length);
        }
        int n = h1.length;
        double mean1 = 0.0;
        double mean2 = 0.0;
        for (int i = 0; i < n; i++) {
            mean1 += h1[i];
            mean2 += h2[i];
        }
        mean1 /= n;
        mean2 /= n;

        double cov = 0.0;
        double var1 = 0.0;
        double var2 = 0.0;
        for (int i = 0; i < n; i++) {
            double d1 = h1[i] - mean1;
            double d2 = h2[i] - mean2;
            cov += d1 * d2;
            var1 += d1 * d1;
            var2 += d2 * d2;
        }

        double denominator = Math.sqrt(var1 * var2);
        if (denominator == 0.0) {
            return Arrays.equals(h1, h2) ? 1.0 : 0.0;
        }
        return cov / denominator;
    }
}
