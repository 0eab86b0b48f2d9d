package guraa.photoclean.visual;

import guraa.photoclean.model.BlurSettings;
import guraa.photoclean.util.GrayImage;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Focus measures on luminance rasters. Higher values mean sharper images.
 */
@Component
public class BlurMetrics {

    /**
     * Full blur score pipeline: optional downsampling of large images, Gaussian
     * pre-blur, then multi-scale Laplacian variance.
     *
     * @param gray The luminance raster
     * @param settings Pipeline parameters
     * @return The aggregated score, 0 or greater
     */
    public double blurScore(GrayImage gray, BlurSettings settings) {
        GrayImage prepared = gray.limitLongSide(settings.getMaxSide());
        prepared = gaussianBlur(prepared, settings.getGaussianKernel());
        return multiScaleLaplacianVariance(prepared, settings);
    }

    /**
     * Evaluate the Laplacian variance at every configured scale and combine the results.
     */
    public double multiScaleLaplacianVariance(GrayImage gray, BlurSettings settings) {
        List<Double> scales = settings.getScales();
        double[] values = new double[scales.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = laplacianVariance(gray.scale(scales.get(i)));
        }
        return settings.getAggregation().apply(values);
    }

    /**
     * Variance of the 4-neighbour Laplacian over interior pixels.
     *
     * @param gray The luminance raster
     * @return The variance, or 0 when the image has no interior
     */
    public double laplacianVariance(GrayImage gray) {
        int w = gray.getWidth();
        int h = gray.getHeight();
        if (w < 3 || h < 3) {
            return 0.0;
        }

        float[] d = gray.getData();
        double sum = 0.0;
        double sumSq = 0.0;
        long n = 0;
        for (int y = 1; y < h - 1; y++) {
            int row = y * w;
            for (int x = 1; x < w - 1; x++) {
                int i = row + x;
                double lap = d[i - 1] + d[i + 1] + d[i - w] + d[i + w] - 4.0 * d[i];
                sum += lap;
                sumSq += lap * lap;
                n++;
            }
        }
        double mean = sum / n;
        return Math.max(0.0, sumSq / n - mean * mean);
    }

    /**
     * Tenengrad focus measure: mean squared 3x3 Sobel gradient magnitude over interior pixels.
     *
     * @param gray The luminance raster
     * @return The measure, or 0 when the image has no interior
     */
    public double tenengrad(GrayImage gray) {
        int w = gray.getWidth();
        int h = gray.getHeight();
        if (w < 3 || h < 3) {
            return 0.0;
        }

        float[] d = gray.getData();
        double sum = 0.0;
        long n = 0;
        for (int y = 1; y < h - 1; y++) {
            int row = y * w;
            for (int x = 1; x < w - 1; x++) {
                int i = row + x;
                double gx = (d[i - w + 1] + 2.0 * d[i + 1] + d[i + w + 1])
                        - (d[i - w - 1] + 2.0 * d[i - 1] + d[i + w - 1]);
                double gy = (d[i + w - 1] + 2.0 * d[i + w] + d[i + w + 1])
                        - (d[i - w - 1] + 2.0 * d[i - w] + d[i - w + 1]);
                sum += gx * gx + gy * gy;
                n++;
            }
        }
        return sum / n;
    }

    /**
     * Separable Gaussian blur with reflected borders. The sigma follows the usual
     * derivation from the kernel size: {@code 0.3 * ((k - 1) * 0.5 - 1) + 0.8}.
     *
     * @param gray The luminance raster
     * @param kernelSize Odd kernel size; values below 3 return the input unchanged
     * @return The blurred raster
     */
    public GrayImage gaussianBlur(GrayImage gray, int kernelSize) {
        if (kernelSize < 3) {
            return gray;
        }
        int k = kernelSize % 2 == 0 ? kernelSize + 1 : kernelSize;
        double[] kernel = gaussianKernel(k);
        int radius = k / 2;

        int w = gray.getWidth();
        int h = gray.getHeight();
        float[] src = gray.getData();
        float[] tmp = new float[src.length];
        float[] out = new float[src.length];

        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) {
                double acc = 0.0;
                for (int j = -radius; j <= radius; j++) {
                    acc += kernel[j + radius] * src[row + reflect(x + j, w)];
                }
                tmp[row + x] = (float) acc;
            }
        }
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double acc = 0.0;
                for (int j = -radius; j <= radius; j++) {
                    acc += kernel[j + radius] * tmp[reflect(y + j, h) * w + x];
                }
                out[y * w + x] = (float) acc;
            }
        }
        return new GrayImage(w, h, out);
    }

    static double[] gaussianKernel(int size) {
        double sigma = 0.3 * ((size - 1) * 0.5 - 1) + 0.8;
        double[] kernel = new double[size];
        int radius = size / 2;
        double total = 0.0;
        for (int i = 0; i < size; i++) {
            int x = i - radius;
            kernel[i] = Math.exp(-(x * x) / (2 * sigma * sigma));
            total += kernel[i];
        }
        for (int i = 0; i < size; i++) {
            kernel[i] /= total;
        }
        return kernel;
    }

    /**
     * Mirror an index at the borders without repeating the edge sample.
     */
    private static int reflect(int i, int n) {
        if (n == 1) {
            return 0;
        }
        while (i < 0 || i >= n) {
            if (i < 0) {
                i = -i;
            }
            if (i >= n) {
                i = 2 * (n - 1) - i;
            }
        }
        return i;
    }
}
