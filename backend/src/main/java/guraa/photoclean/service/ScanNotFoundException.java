package guraa.photoclean.service;

/**
 * Thrown when a scan id is unknown or its task has been evicted.
 */
public class ScanNotFoundException extends RuntimeException {

    public ScanNotFoundException(String scanId) {
        super("Scan not found: " + scanId);
    }
}
