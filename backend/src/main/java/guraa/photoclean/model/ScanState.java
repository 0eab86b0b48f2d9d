package guraa.photoclean.model;

/**
 * Lifecycle of a submitted scan.
 */
public enum ScanState {
    QUEUED,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
