package guraa.photoclean.model;

/**
 * Fire-and-forget progress callback. May be invoked from worker threads in
 * any order; implementations must not block.
 */
@FunctionalInterface
public interface ScanProgressListener {

    ScanProgressListener NONE = (phase, current, total) -> { };

    void onProgress(ScanPhase phase, int current, int total);
}
