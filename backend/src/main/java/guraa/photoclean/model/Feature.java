package guraa.photoclean.model;

/**
 * Per-image features the extractor can compute.
 */
public enum Feature {
    BLUR,
    TENENGRAD,
    PHASH,
    DHASH
}
