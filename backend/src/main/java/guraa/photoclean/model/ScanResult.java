package guraa.photoclean.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one scan: the row set plus figures describing how it was reached.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResult {

    @Builder.Default
    private List<ScanRow> rows = new ArrayList<>();

    @Builder.Default
    private List<DuplicateGroup> groups = new ArrayList<>();

    private boolean cancelled;

    private int filesFound;
    private int filesExtracted;
    private int cacheHits;
    private int decodeFailures;

    /**
     * Cutoff applied to the multi-scale Laplacian score. Zero when the
     * population was empty, meaning no discrimination was possible.
     */
    private double blurCutoff;

    /**
     * Cutoff applied to the Tenengrad score, or null when the gate was off.
     */
    private Double tenengradCutoff;

    private BlurStatistics statistics;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public long countRows(RowKind kind) {
        return rows.stream().filter(row -> row.getKind() == kind).count();
    }
}
