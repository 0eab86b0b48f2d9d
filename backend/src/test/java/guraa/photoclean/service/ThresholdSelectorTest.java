package guraa.photoclean.service;

import guraa.photoclean.model.ThresholdPolicy;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ThresholdSelectorTest {

    private static final double[] POPULATION = {900, 50, 400, 80, 95};

    private final ThresholdSelector selector = new ThresholdSelector();

    @Test
    void percentileInterpolatesBetweenRanks() {
        double cutoff = selector.select(POPULATION, ThresholdPolicy.percentile(20));

        // rank 0.8 between 50 and 80
        assertThat(cutoff).isCloseTo(74.0, within(1e-9));
        assertThat(flagged(cutoff)).isEqualTo(1);
    }

    @Test
    void percentileBoundsAreMinAndMax() {
        assertThat(selector.select(POPULATION, ThresholdPolicy.percentile(0))).isEqualTo(50.0);
        assertThat(selector.select(POPULATION, ThresholdPolicy.percentile(100))).isEqualTo(900.0);
    }

    @Test
    void percentileIsMonotonic() {
        double previous = Double.NEGATIVE_INFINITY;
        for (int p = 0; p <= 100; p += 5) {
            double cutoff = selector.select(POPULATION, ThresholdPolicy.percentile(p));
            assertThat(cutoff).isGreaterThanOrEqualTo(previous);
            previous = cutoff;
        }
    }

    @Test
    void zscoreUsesPopulationStandardDeviation() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        // mean 5, population std 2
        assertThat(selector.select(values, ThresholdPolicy.zscore(1.0))).isCloseTo(3.0, within(1e-9));
        assertThat(selector.select(values, ThresholdPolicy.zscore(0.0))).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void fixedIgnoresPopulation() {
        assertThat(selector.select(POPULATION, ThresholdPolicy.fixed(123.5))).isEqualTo(123.5);
        assertThat(selector.select(new double[0], ThresholdPolicy.fixed(123.5))).isEqualTo(123.5);
    }

    @Test
    void emptyPopulationFlagsNothing() {
        assertThat(selector.select(new double[0], ThresholdPolicy.percentile(50))).isZero();
        assertThat(selector.select(new double[0], ThresholdPolicy.zscore(1.5))).isZero();
    }

    @Test
    void inputIsNotModified() {
        double[] values = POPULATION.clone();

        selector.select(values, ThresholdPolicy.percentile(50));

        assertThat(values).containsExactly(POPULATION);
    }

    private static long flagged(double cutoff) {
        return Arrays.stream(POPULATION).filter(v -> v < cutoff).count();
    }
}
