package guraa.photoclean.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cached feature values for one file.
 * A record whose blur score is null has never been extracted successfully.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FileRecord {

    /**
     * Absolute path, the primary key.
     */
    private String path;

    /**
     * Modification time (epoch seconds) of the content the features were computed from.
     */
    private long modifiedTime;

    /**
     * Size in bytes of the content the features were computed from.
     */
    private long sizeBytes;

    /**
     * Multi-scale Laplacian variance.
     */
    private Double blurScore;

    /**
     * Tenengrad focus measure.
     */
    private Double tenengrad;

    /**
     * 64-bit DCT perceptual hash.
     */
    private Long phash;

    /**
     * 64-bit difference hash.
     */
    private Long dhash;

    /**
     * Session stamp (epoch seconds) of the last scan that observed the file.
     */
    private long lastSeen;

    /**
     * Check whether this record was computed from the current content of a file.
     *
     * @param file The enumerated file
     * @return true if the stored signature matches
     */
    public boolean isFreshFor(ImageFile file) {
        return file.getPath().equals(path) && file.hasSignature(modifiedTime, sizeBytes);
    }

    /**
     * Check whether a feature is stored.
     *
     * @param feature The feature
     * @return true if the value is present
     */
    public boolean has(Feature feature) {
        switch (feature) {
            case BLUR:
                return blurScore != null;
            case TENENGRAD:
                return tenengrad != null;
            case PHASH:
                return phash != null;
            case DHASH:
                return dhash != null;
            default:
                return false;
        }
    }

    /**
     * Create a record carrying freshly extracted features for a file.
     *
     * @param file The file the features were extracted from
     * @param features The extracted features
     * @return A new record; last-seen is assigned by the cache
     */
    public static FileRecord of(ImageFile file, ImageFeatures features) {
        return FileRecord.builder()
                .path(file.getPath())
                .modifiedTime(file.getModifiedTime())
                .sizeBytes(file.getSizeBytes())
                .blurScore(features.getBlurScore())
                .tenengrad(features.getTenengrad())
                .phash(features.getPhash())
                .dhash(features.getDhash())
                .build();
    }
}
