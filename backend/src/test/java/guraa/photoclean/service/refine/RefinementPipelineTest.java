package guraa.photoclean.service.refine;

import guraa.photoclean.model.CancellationToken;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.SimilarityPair;
import guraa.photoclean.visual.HsvHistogramComparator;
import guraa.photoclean.visual.SSIMCalculator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RefinementPipelineTest {

    private final List<SimilarityPair> pairs = List.of(
            SimilarityPair.of("/p/a.jpg", "/p/b.jpg", 1),
            SimilarityPair.of("/p/c.jpg", "/p/d.jpg", 5));

    @Test
    void allStagesDisabledIsPassThrough() {
        RefinementPipeline pipeline = new RefinementPipeline(List.of(
                new MutualTopKStage(),
                new SsimVerificationStage(new SSIMCalculator()),
                new HsvHistogramStage(new HsvHistogramComparator())));
        ScanOptions options = ScanOptions.builder().mutualTopK(0).ssimEnabled(false).hsvEnabled(false).build();

        assertThat(pipeline.refine(pairs, options, CancellationToken.none())).isEqualTo(pairs);
    }

    @Test
    void stagesRunInOrderOnPreviousOutput() {
        RefinementStage first = mock(RefinementStage.class);
        RefinementStage second = mock(RefinementStage.class);
        when(first.getName()).thenReturn("first");
        when(second.getName()).thenReturn("second");
        when(first.isEnabled(any())).thenReturn(true);
        when(second.isEnabled(any())).thenReturn(true);
        List<SimilarityPair> afterFirst = List.of(pairs.get(0));
        when(first.apply(any(), any(), any())).thenReturn(afterFirst);
        when(second.apply(any(), any(), any())).thenReturn(List.of());
        ScanOptions options = ScanOptions.builder().build();
        CancellationToken token = CancellationToken.none();

        List<SimilarityPair> result = new RefinementPipeline(List.of(first, second)).refine(pairs, options, token);

        assertThat(result).isEmpty();
        verify(first).apply(pairs, options, token);
        verify(second).apply(afterFirst, options, token);
    }

    @Test
    void cancelledPipelineSkipsRemainingStages() {
        RefinementStage stage = mock(RefinementStage.class);
        when(stage.isEnabled(any())).thenReturn(true);
        CancellationToken token = new CancellationToken();
        token.cancel();

        new RefinementPipeline(List.of(stage)).refine(pairs, ScanOptions.builder().build(), token);

        verify(stage, never()).apply(any(), any(), any());
    }
}
