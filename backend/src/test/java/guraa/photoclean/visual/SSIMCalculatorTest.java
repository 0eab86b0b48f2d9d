package guraa.photoclean.visual;

import guraa.photoclean.util.GrayImage;
import guraa.photoclean.util.TestImages;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SSIMCalculatorTest {

    private final SSIMCalculator calculator = new SSIMCalculator();

    @Test
    void identicalImagesScoreOne() {
        GrayImage image = TestImages.gray(TestImages.cells(3, 256, 256, 8));

        assertThat(calculator.calculate(image, image)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void unrelatedImagesScoreLow() {
        GrayImage a = TestImages.gray(TestImages.cells(3, 256, 256, 8));
        GrayImage b = TestImages.gray(TestImages.cells(4, 256, 256, 8));

        assertThat(calculator.calculate(a, b)).isLessThan(0.5);
    }

    @Test
    void smallImagesUseOneWindow() {
        GrayImage a = new GrayImage(4, 4, new float[16]);

        assertThat(calculator.calculate(a, a)).isEqualTo(1.0);
    }

    @Test
    void rejectsDifferentSizes() {
        GrayImage a = new GrayImage(16, 16, new float[256]);
        GrayImage b = new GrayImage(8, 8, new float[64]);

        assertThatThrownBy(() -> calculator.calculate(a, b)).isInstanceOf(IllegalArgumentException.class);
    }
}
