package guraa.photoclean.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Which hash populations feed near-duplicate search.
 */
public enum SimilarityMode {
    PHASH,
    DHASH,
    HYBRID;

    public static SimilarityMode parse(String text) {
        if (text == null) {
            throw new ScanConfigurationException("Similarity mode is missing");
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ScanConfigurationException("Unknown similarity mode '" + text + "', expected one of "
                    + Arrays.toString(values()), e);
        }
    }

    public boolean usesPhash() {
        return this != DHASH;
    }

    public boolean usesDhash() {
        return this != PHASH;
    }
}
