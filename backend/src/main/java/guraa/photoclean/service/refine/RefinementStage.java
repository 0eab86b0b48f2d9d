package guraa.photoclean.service.refine;

import guraa.photoclean.model.CancellationToken;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.SimilarityPair;

import java.util.List;

/**
 * One filter of the candidate refinement chain. A stage only ever removes
 * pairs; it never adds one or changes a distance.
 */
public interface RefinementStage {

    String getName();

    boolean isEnabled(ScanOptions options);

    /**
     * Filter candidate pairs.
     *
     * @param pairs Input pairs ordered by distance then path
     * @param options Scan options holding the stage parameters
     * @param token Cancellation token; a cancelled stage returns what it has verified so far
     * @return A subset of the input in the same order
     */
    List<SimilarityPair> apply(List<SimilarityPair> pairs, ScanOptions options, CancellationToken token);
}
