package guraa.photoclean.service;

import guraa.photoclean.model.ThresholdPolicy;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Derives a blur cutoff from a population of scores. A file is flagged when
 * its score is strictly below the cutoff.
 */
@Component
public class ThresholdSelector {

    /**
     * Select the cutoff for a population.
     *
     * @param scores The scores; not modified
     * @param policy How to derive the cutoff
     * @return The cutoff. Population-based policies return 0 for an empty population,
     *         so nothing is flagged when there is nothing to compare against.
     */
    public double select(double[] scores, ThresholdPolicy policy) {
        switch (policy.getMode()) {
            case FIXED:
                return policy.getParameter();
            case PERCENTILE:
                if (scores.length == 0) {
                    return 0.0;
                }
                double[] sorted = scores.clone();
                Arrays.sort(sorted);
                return percentile(sorted, policy.getParameter());
            case ZSCORE:
                if (scores.length == 0) {
                    return 0.0;
                }
                return mean(scores) - policy.getParameter() * standardDeviation(scores);
            default:
                throw new IllegalArgumentException("Unsupported threshold mode: " + policy.getMode());
        }
    }

    /**
     * Percentile with linear interpolation between closest ranks: the rank of
     * {@code p} is {@code p / 100 * (n - 1)}.
     *
     * @param sorted Ascending, non-empty values
     * @param p Percentile in [0, 100]
     * @return The interpolated value
     */
    public static double percentile(double[] sorted, double p) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = p / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = Math.min(sorted.length - 1, lower + 1);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    static double mean(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation.
     */
    static double standardDeviation(double[] values) {
        double mean = mean(values);
        double sum = 0.0;
        for (double value : values) {
            double d = value - mean;
            sum += d * d;
        }
        return Math.sqrt(sum / values.length);
    }
}
