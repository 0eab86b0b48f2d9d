package guraa.photoclean.model;

import lombok.Value;

import java.util.Comparator;

/**
 * Attributes deciding which member of a duplicate group survives.
 */
@Value
public class ImageRank {

    /**
     * Higher priority first: sharper, then more pixels, then larger file,
     * then more recently modified. Path ascending breaks remaining ties so the
     * order is total.
     */
    public static final Comparator<ImageRank> PRIORITY = Comparator
            .comparingDouble(ImageRank::getBlurScore).reversed()
            .thenComparing(Comparator.comparingLong(ImageRank::getPixelCount).reversed())
            .thenComparing(Comparator.comparingLong(ImageRank::getSizeBytes).reversed())
            .thenComparing(Comparator.comparingLong(ImageRank::getModifiedTime).reversed())
            .thenComparing(ImageRank::getPath);

    String path;
    double blurScore;
    long pixelCount;
    long sizeBytes;
    long modifiedTime;
}
