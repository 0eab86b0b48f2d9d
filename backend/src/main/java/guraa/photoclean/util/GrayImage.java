package guraa.photoclean.util;

import java.awt.image.BufferedImage;

/**
 * Single channel luminance raster with values in 0-255, stored row-major.
 */
public final class GrayImage {

    private final int width;
    private final int height;
    private final float[] data;

    public GrayImage(int width, int height, float[] data) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (data.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " samples, got " + data.length);
        }
        this.width = width;
        this.height = height;
        this.data = data;
    }

    /**
     * Convert an image to luminance using the integer weights 76/150/29,
     * which approximate 0.299R + 0.587G + 0.114B.
     *
     * @param image The source image
     * @return The luminance raster
     */
    public static GrayImage fromImage(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        float[] data = new float[width * height];

        // One row at a time keeps the intermediate RGB buffer small for big photos
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            int offset = y * width;
            for (int x = 0; x < width; x++) {
                int rgb = row[x];
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                data[offset + x] = (r * 76 + g * 150 + b * 29) >> 8;
            }
        }
        return new GrayImage(width, height, data);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public float get(int x, int y) {
        return data[y * width + x];
    }

    /**
     * Raw row-major samples. Callers must not modify the array.
     */
    public float[] getData() {
        return data;
    }

    /**
     * Resize by area averaging: every target pixel is the mean of the source
     * area it covers, weighted by fractional overlap. Upscaling degenerates to
     * nearest-area sampling.
     *
     * @param targetWidth Target width
     * @param targetHeight Target height
     * @return The resized raster, or this instance when the size is unchanged
     */
    public GrayImage resizeArea(int targetWidth, int targetHeight) {
        if (targetWidth == width && targetHeight == height) {
            return this;
        }
        if (targetWidth <= 0 || targetHeight <= 0) {
            throw new IllegalArgumentException("Target dimensions must be positive: " + targetWidth + "x" + targetHeight);
        }

        double scaleX = (double) width / targetWidth;
        double scaleY = (double) height / targetHeight;
        float[] out = new float[targetWidth * targetHeight];

        for (int ty = 0; ty < targetHeight; ty++) {
            double y0 = ty * scaleY;
            double y1 = Math.min(height, (ty + 1) * scaleY);
            int yStart = (int) Math.floor(y0);
            int yEnd = Math.min(height, (int) Math.ceil(y1));

            for (int tx = 0; tx < targetWidth; tx++) {
                double x0 = tx * scaleX;
                double x1 = Math.min(width, (tx + 1) * scaleX);
                int xStart = (int) Math.floor(x0);
                int xEnd = Math.min(width, (int) Math.ceil(x1));

                double sum = 0.0;
                double weightSum = 0.0;
                for (int sy = yStart; sy < yEnd; sy++) {
                    double wy = Math.min(y1, sy + 1) - Math.max(y0, sy);
                    if (wy <= 0) {
                        continue;
                    }
                    int rowOffset = sy * width;
                    for (int sx = xStart; sx < xEnd; sx++) {
                        double wx = Math.min(x1, sx + 1) - Math.max(x0, sx);
                        if (wx <= 0) {
                            continue;
                        }
                        double w = wx * wy;
                        sum += data[rowOffset + sx] * w;
                        weightSum += w;
                    }
                }
                out[ty * targetWidth + tx] = weightSum > 0 ? (float) (sum / weightSum) : 0f;
            }
        }
        return new GrayImage(targetWidth, targetHeight, out);
    }

    /**
     * Scale both sides by a factor, keeping at least one pixel per side.
     *
     * @param factor Scale factor in (0, 1]
     * @return The scaled raster
     */
    public GrayImage scale(double factor) {
        if (factor == 1.0) {
            return this;
        }
        int w = Math.max(1, (int) Math.round(width * factor));
        int h = Math.max(1, (int) Math.round(height * factor));
        return resizeArea(w, h);
    }

    /**
     * Downsample so the longer side does not exceed the limit, keeping the aspect ratio.
     *
     * @param maxSide Longest allowed side; 0 or less disables the limit
     * @return The limited raster
     */
    public GrayImage limitLongSide(int maxSide) {
        int longSide = Math.max(width, height);
        if (maxSide <= 0 || longSide <= maxSide) {
            return this;
        }
        return scale((double) maxSide / longSide);
    }
}
