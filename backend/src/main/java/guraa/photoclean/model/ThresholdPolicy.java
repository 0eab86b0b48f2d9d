package guraa.photoclean.model;

import lombok.Value;

import java.util.Locale;

/**
 * How a blur cutoff is chosen from a population of scores.
 * Text form is {@code fixed:<value>}, {@code percentile:<p>} or {@code zscore:<alpha>}.
 */
@Value
public class ThresholdPolicy {

    public enum Mode {
        FIXED,
        PERCENTILE,
        ZSCORE
    }

    Mode mode;
    double parameter;

    public static ThresholdPolicy fixed(double value) {
        return new ThresholdPolicy(Mode.FIXED, value);
    }

    public static ThresholdPolicy percentile(double p) {
        if (p < 0 || p > 100 || Double.isNaN(p)) {
            throw new ScanConfigurationException("Percentile must be within [0, 100]: " + p);
        }
        return new ThresholdPolicy(Mode.PERCENTILE, p);
    }

    public static ThresholdPolicy zscore(double alpha) {
        if (Double.isNaN(alpha) || Double.isInfinite(alpha)) {
            throw new ScanConfigurationException("Z-score factor must be finite: " + alpha);
        }
        return new ThresholdPolicy(Mode.ZSCORE, alpha);
    }

    /**
     * Parse the text form of a policy.
     *
     * @param text Policy text such as {@code percentile:20}
     * @return The policy
     * @throws ScanConfigurationException If the name or parameter is invalid
     */
    public static ThresholdPolicy parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ScanConfigurationException("Threshold policy is missing");
        }
        String[] parts = text.trim().split(":", 2);
        if (parts.length != 2) {
            throw new ScanConfigurationException("Threshold policy must look like <mode>:<value>, got '" + text + "'");
        }

        double value;
        try {
            value = Double.parseDouble(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new ScanConfigurationException("Invalid threshold parameter in '" + text + "'", e);
        }

        switch (parts[0].trim().toLowerCase(Locale.ROOT)) {
            case "fixed":
                return fixed(value);
            case "percentile":
                return percentile(value);
            case "zscore":
                return zscore(value);
            default:
                throw new ScanConfigurationException("Unknown threshold policy '" + parts[0] + "'");
        }
    }

    @Override
    public String toString() {
        return mode.name().toLowerCase(Locale.ROOT) + ":" + parameter;
    }
}
