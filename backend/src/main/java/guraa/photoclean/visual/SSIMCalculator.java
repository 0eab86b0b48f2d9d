package guraa.photoclean.visual;

import guraa.photoclean.util.GrayImage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Calculator for the Structural Similarity Index (SSIM) between two luminance rasters.
 * SSIM compares local means, variances and covariance, so it reacts to structural
 * change rather than to uniform brightness or contrast shifts.
 */
@Slf4j
@Component
public class SSIMCalculator {

    // Constants for SSIM calculation
    private static final double K1 = 0.01;
    private static final double K2 = 0.03;
    private static final int WINDOW_SIZE = 8;
    private static final double C1 = Math.pow(255 * K1, 2);
    private static final double C2 = Math.pow(255 * K2, 2);

    // Number of window positions sampled along the shorter side
    private static final int WINDOWS_PER_SIDE = 64;

    /**
     * Calculate the mean windowed SSIM between two rasters of equal size.
     *
     * @param img1 The first raster
     * @param img2 The second raster
     * @return The SSIM value, 1.0 for identical rasters
     */
    public double calculate(GrayImage img1, GrayImage img2) {
        if (img1.getWidth() != img2.getWidth() || img1.getHeight() != img2.getHeight()) {
            throw new IllegalArgumentException("SSIM needs equally sized images: "
                    + img1.getWidth() + "x" + img1.getHeight() + " vs " + img2.getWidth() + "x" + img2.getHeight());
        }

        int width = img1.getWidth();
        int height = img1.getHeight();
        int numWindowsY = height - WINDOW_SIZE + 1;
        int numWindowsX = width - WINDOW_SIZE + 1;

        if (numWindowsX <= 0 || numWindowsY <= 0) {
            // Images are too small for the window size
            return windowSSIM(img1.getData(), img2.getData(), 0, width, width, height);
        }

        // Overlapping windows with a stride keep the cost flat as the comparison size grows
        int stride = Math.max(1, Math.min(width, height) / WINDOWS_PER_SIDE);

        double ssimSum = 0.0;
        int numWindows = 0;
        for (int y = 0; y < numWindowsY; y += stride) {
            for (int x = 0; x < numWindowsX; x += stride) {
                ssimSum += windowSSIM(img1.getData(), img2.getData(), y * width + x, width, WINDOW_SIZE, WINDOW_SIZE);
                numWindows++;
            }
        }

        double ssim = numWindows > 0 ? ssimSum / numWindows : 0.0;
        log.trace("SSIM over {} windows (stride {}): {}", numWindows, stride, ssim);
        return ssim;
    }

    /**
     * SSIM of one rectangular window.
     *
     * @param a First raster samples
     * @param b Second raster samples
     * @param offset Index of the window's top-left sample
     * @param stride Row length of the rasters
     * @param windowWidth Window width
     * @param windowHeight Window height
     * @return The window SSIM
     */
    private double windowSSIM(float[] a, float[] b, int offset, int stride, int windowWidth, int windowHeight) {
        int n = windowWidth * windowHeight;

        // Compute means
        double mean1 = 0;
        double mean2 = 0;
        boolean identical = true;
        for (int j = 0; j < windowHeight; j++) {
            int row = offset + j * stride;
            for (int i = 0; i < windowWidth; i++) {
                float v1 = a[row + i];
                float v2 = b[row + i];
                mean1 += v1;
                mean2 += v2;
                identical &= v1 == v2;
            }
        }
        // Quick shortcut for identical windows
        if (identical) {
            return 1.0;
        }
        mean1 /= n;
        mean2 /= n;

        // Compute variances and covariance
        double variance1 = 0;
        double variance2 = 0;
        double covariance = 0;
        for (int j = 0; j < windowHeight; j++) {
            int row = offset + j * stride;
            for (int i = 0; i < windowWidth; i++) {
                double diff1 = a[row + i] - mean1;
                double diff2 = b[row + i] - mean2;
                variance1 += diff1 * diff1;
                variance2 += diff2 * diff2;
                covariance += diff1 * diff2;
            }
        }
        variance1 /= n;
        variance2 /= n;
        covariance /= n;

        double numerator = (2 * mean1 * mean2 + C1) * (2 * covariance + C2);
        double denominator = (mean1 * mean1 + mean2 * mean2 + C1) * (variance1 + variance2 + C2);
        return numerator / denominator;
    }
}
