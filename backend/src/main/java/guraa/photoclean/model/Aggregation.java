package guraa.photoclean.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * How per-scale Laplacian variances are combined into one blur score.
 */
public enum Aggregation {
    MEDIAN,
    MEAN,
    MAX,
    MIN;

    public static Aggregation parse(String text) {
        if (text == null) {
            throw new ScanConfigurationException("Aggregation is missing");
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ScanConfigurationException("Unknown aggregation '" + text + "', expected one of "
                    + Arrays.toString(values()), e);
        }
    }

    /**
     * Combine values. The input array is sorted in place.
     *
     * @param values Non-empty values
     * @return The aggregate
     */
    public double apply(double[] values) {
        Arrays.sort(values);
        switch (this) {
            case MAX:
                return values[values.length - 1];
            case MIN:
                return values[0];
            case MEAN:
                return Arrays.stream(values).average().orElse(0.0);
            case MEDIAN:
            default:
                int mid = values.length / 2;
                return values.length % 2 == 1 ? values[mid] : (values[mid - 1] + values[mid]) / 2.0;
        }
    }
}
