package guraa.photoclean.model;

/**
 * Invalid scan configuration. Raised before any file is touched.
 */
public class ScanConfigurationException extends RuntimeException {

    public ScanConfigurationException(String message) {
        super(message);
    }

    public ScanConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
