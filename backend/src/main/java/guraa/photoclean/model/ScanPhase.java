package guraa.photoclean.model;

/**
 * Named phases of a scan, in execution order.
 */
public enum ScanPhase {
    ENUMERATE,
    EXTRACT,
    THRESHOLD,
    BUCKET,
    REFINE,
    GROUP,
    DONE
}
