package guraa.photoclean.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of the blur score population of one scan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlurStatistics {

    private int count;
    private double mean;
    private double min;
    private double median;
    private double p95;
    private double max;

    /**
     * Lowest scoring (blurriest) files, ascending.
     */
    @Builder.Default
    private List<ScoredPath> lowest = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScoredPath {
        private String path;
        private double score;
    }
}
