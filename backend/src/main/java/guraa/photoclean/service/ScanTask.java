package guraa.photoclean.service;

import guraa.photoclean.model.CancellationToken;
import guraa.photoclean.model.RowKind;
import guraa.photoclean.model.ScanOptions;
import guraa.photoclean.model.ScanPhase;
import guraa.photoclean.model.ScanProgressListener;
import guraa.photoclean.model.ScanResult;
import guraa.photoclean.model.ScanState;
import guraa.photoclean.model.ScanStatus;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;

/**
 * A submitted scan and its live progress. Progress fields are written by the
 * scan and worker threads and read by status queries.
 */
@Getter
public class ScanTask implements ScanProgressListener {

    private final String id;
    private final ScanOptions options;
    private final CancellationToken token = new CancellationToken();
    private final Instant submittedAt;

    private volatile ScanState state = ScanState.QUEUED;
    private volatile ScanPhase phase;
    private volatile int current;
    private volatile int total;
    private volatile ScanResult result;
    private volatile String error;
    private volatile Instant finishedAt;

    public ScanTask(String id, ScanOptions options, Instant submittedAt) {
        this.id = id;
        this.options = options;
        this.submittedAt = submittedAt;
    }

    @Override
    public void onProgress(ScanPhase phase, int current, int total) {
        this.phase = phase;
        this.current = current;
        this.total = total;
    }

    void markRunning() {
        state = ScanState.RUNNING;
    }

    void complete(ScanResult result, Instant now) {
        this.result = result;
        this.finishedAt = now;
        this.state = result.isCancelled() ? ScanState.CANCELLED : ScanState.COMPLETED;
    }

    void fail(String error, Instant now) {
        this.error = error;
        this.finishedAt = now;
        this.state = ScanState.FAILED;
    }

    /**
     * Request cancellation. A queued task is finished right away; a running
     * one stops at its next checkpoint.
     */
    void cancel(Instant now) {
        token.cancel();
        if (state == ScanState.QUEUED) {
            finishedAt = now;
            state = ScanState.CANCELLED;
        }
    }

    public ScanStatus toStatus() {
        ScanStatus.ScanStatusBuilder status = ScanStatus.builder()
                .scanId(id)
                .root(options.getRoot().toString())
                .state(state)
                .phase(phase)
                .current(current)
                .total(total)
                .submittedAt(submittedAt)
                .finishedAt(finishedAt)
                .error(error);

        ScanResult finished = result;
        if (finished != null) {
            status.filesFound(finished.getFilesFound())
                    .blurRows((int) finished.countRows(RowKind.BLUR))
                    .duplicateRows((int) finished.countRows(RowKind.DUPLICATE))
                    .groups(finished.getGroups().size())
                    .blurCutoff(finished.getBlurCutoff())
                    .tenengradCutoff(finished.getTenengradCutoff())
                    .statistics(finished.getStatistics())
                    .warnings(new ArrayList<>(finished.getWarnings()));
        }
        return status.build();
    }
}
