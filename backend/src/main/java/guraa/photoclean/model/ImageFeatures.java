package guraa.photoclean.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Features extracted from one image. Any value may be null when it was not
 * requested or the image could not be decoded.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ImageFeatures {

    private Double blurScore;
    private Double tenengrad;
    private Long phash;
    private Long dhash;

    /**
     * Features of an image that could not be decoded.
     *
     * @return An instance with every value absent
     */
    public static ImageFeatures empty() {
        return new ImageFeatures();
    }

    /**
     * Build features from a cached record.
     *
     * @param record The cached record
     * @return Features holding the cached values
     */
    public static ImageFeatures fromRecord(FileRecord record) {
        return ImageFeatures.builder()
                .blurScore(record.getBlurScore())
                .tenengrad(record.getTenengrad())
                .phash(record.getPhash())
                .dhash(record.getDhash())
                .build();
    }

    public boolean isEmpty() {
        return blurScore == null && tenengrad == null && phash == null && dhash == null;
    }

    /**
     * Overlay the non-null values of another instance on top of this one.
     *
     * @param other Newer values
     * @return A merged copy
     */
    public ImageFeatures merge(ImageFeatures other) {
        if (other == null) {
            return this;
        }
        return ImageFeatures.builder()
                .blurScore(other.blurScore != null ? other.blurScore : blurScore)
                .tenengrad(other.tenengrad != null ? other.tenengrad : tenengrad)
                .phash(other.phash != null ? other.phash : phash)
                .dhash(other.dhash != null ? other.dhash : dhash)
                .build();
    }
}
