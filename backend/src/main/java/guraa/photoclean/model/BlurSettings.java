package guraa.photoclean.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parameters of the blur metrics. They shape the stored blur scores, so they
 * are fixed per application rather than per scan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlurSettings {

    @Builder.Default
    private List<Double> scales = new ArrayList<>(List.of(1.0, 0.5, 0.25));

    @Builder.Default
    private Aggregation aggregation = Aggregation.MEDIAN;

    /**
     * Gaussian pre-blur kernel size; 0 or 1 disables it.
     */
    @Builder.Default
    private int gaussianKernel = 3;

    /**
     * Images with a longer side are downsampled first; 0 disables it.
     */
    @Builder.Default
    private int maxSide = 2000;

    public static BlurSettings defaults() {
        return BlurSettings.builder().build();
    }

    /**
     * Text identifying every parameter that shapes the blur and Tenengrad scores.
     * Stored scores computed under a different layout are not comparable.
     *
     * @return Layout marker, e.g. {@code blur-v1;scales=1.0,0.5,0.25;aggregation=median;kernel=3;max-side=2000}
     */
    public String layout() {
        StringBuilder text = new StringBuilder("blur-v1;scales=");
        for (int i = 0; i < scales.size(); i++) {
            if (i > 0) {
                text.append(',');
            }
            text.append(scales.get(i));
        }
        return text.append(";aggregation=").append(aggregation.name().toLowerCase(Locale.ROOT))
                .append(";kernel=").append(gaussianKernel)
                .append(";max-side=").append(maxSide)
                .toString();
    }

    public void validate() {
        if (scales == null || scales.isEmpty()) {
            throw new ScanConfigurationException("At least one blur scale is required");
        }
        for (Double scale : scales) {
            if (scale == null || !(scale > 0.0) || scale > 1.0) {
                throw new ScanConfigurationException("Blur scales must be within (0, 1]: " + scales);
            }
        }
        if (aggregation == null) {
            throw new ScanConfigurationException("Aggregation is missing");
        }
        if (gaussianKernel < 0) {
            throw new ScanConfigurationException("Gaussian kernel must not be negative: " + gaussianKernel);
        }
        if (maxSide < 0) {
            throw new ScanConfigurationException("Max side must not be negative: " + maxSide);
        }
    }
}
