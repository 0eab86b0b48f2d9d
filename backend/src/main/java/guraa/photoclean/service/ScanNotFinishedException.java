package guraa.photoclean.service;

/**
 * Thrown when results of a scan are requested before it has finished.
 */
public class ScanNotFinishedException extends RuntimeException {

    public ScanNotFinishedException(String scanId) {
        super("Scan has not finished yet: " + scanId);
    }
}
