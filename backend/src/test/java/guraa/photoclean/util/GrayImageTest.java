package guraa.photoclean.util;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GrayImageTest {

    @Test
    void luminanceUsesIntegerWeights() {
        BufferedImage image = TestImages.solid(2, 2, 0xFF0000);
        GrayImage gray = GrayImage.fromImage(image);

        assertThat(gray.get(0, 0)).isEqualTo((255 * 76) >> 8);
    }

    @Test
    void areaResizeAveragesCoveredPixels() {
        float[] data = {0, 100, 200, 50};
        GrayImage gray = new GrayImage(2, 2, data);

        GrayImage one = gray.resizeArea(1, 1);

        assertThat(one.get(0, 0)).isCloseTo(87.5f, within(1e-4f));
    }

    @Test
    void areaResizeHandlesFractionalCoverage() {
        GrayImage gray = new GrayImage(3, 1, new float[]{0, 30, 60});

        GrayImage two = gray.resizeArea(2, 1);

        // left covers [0, 1.5): 0 * 1 + 30 * 0.5, right covers [1.5, 3): 30 * 0.5 + 60 * 1
        assertThat(two.get(0, 0)).isCloseTo(10f, within(1e-4f));
        assertThat(two.get(1, 0)).isCloseTo(50f, within(1e-4f));
    }

    @Test
    void limitLongSideKeepsAspectRatio() {
        GrayImage gray = new GrayImage(400, 200, new float[400 * 200]);

        GrayImage limited = gray.limitLongSide(100);

        assertThat(limited.getWidth()).isEqualTo(100);
        assertThat(limited.getHeight()).isEqualTo(50);
        assertThat(gray.limitLongSide(0)).isSameAs(gray);
        assertThat(gray.limitLongSide(1000)).isSameAs(gray);
    }

    @Test
    void rejectsMismatchedBuffer() {
        assertThatThrownBy(() -> new GrayImage(2, 2, new float[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
