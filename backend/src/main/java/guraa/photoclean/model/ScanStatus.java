package guraa.photoclean.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of a submitted scan for status queries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanStatus {

    private String scanId;
    private String root;
    private ScanState state;
    private ScanPhase phase;
    private int current;
    private int total;
    private Instant submittedAt;
    private Instant finishedAt;

    /**
     * Failure message, only set when the state is FAILED.
     */
    private String error;

    // Filled in once the scan has finished
    private Integer filesFound;
    private Integer blurRows;
    private Integer duplicateRows;
    private Integer groups;
    private Double blurCutoff;
    private Double tenengradCutoff;
    private BlurStatistics statistics;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
