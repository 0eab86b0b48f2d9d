package guraa.photoclean.util;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Decoding and resizing helpers around ImageIO.
 * Decode failures are reported as {@code null}, never as exceptions, because a
 * corrupt file must not abort a scan.
 */
@Slf4j
public final class ImageLoader {

    private ImageLoader() {
    }

    /**
     * Decode an image file.
     *
     * @param path The file
     * @return The decoded image, or null if the file is unreadable or not a supported image
     */
    public static BufferedImage read(Path path) {
        try {
            BufferedImage image = ImageIO.read(path.toFile());
            if (image == null) {
                log.debug("No image reader accepted {}", path);
                return null;
            }
            if (image.getWidth() <= 0 || image.getHeight() <= 0) {
                log.debug("Image {} has no pixels", path);
                return null;
            }
            return image;
        } catch (IOException e) {
            log.debug("Failed to decode {}: {}", path, e.getMessage());
            return null;
        } catch (RuntimeException e) {
            // Some ImageIO plugins signal truncated or malformed data with unchecked exceptions
            log.debug("Decoder error for {}: {}", path, e.toString());
            return null;
        }
    }

    /**
     * Decode an image and convert it to luminance.
     *
     * @param path The file
     * @return The luminance raster, or null if decoding failed
     */
    public static GrayImage readGray(Path path) {
        BufferedImage image = read(path);
        return image != null ? GrayImage.fromImage(image) : null;
    }

    /**
     * Resize an image to RGB with bilinear interpolation.
     *
     * @param image The image to resize
     * @param width The target width
     * @param height The target height
     * @return The resized image
     */
    public static BufferedImage resize(BufferedImage image, int width, int height) {
        BufferedImage resized = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = resized.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(image, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return resized;
    }

    /**
     * Read the pixel count from the image header without decoding pixel data.
     *
     * @param path The file
     * @return width * height, or 0 if the header cannot be read
     */
    public static long readPixelCount(Path path) {
        try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
            if (input == null) {
                return 0L;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return 0L;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return (long) reader.getWidth(0) * reader.getHeight(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Could not read image header of {}: {}", path, e.getMessage());
            return 0L;
        }
    }
}
