package guraa.photoclean.model;

import lombok.Value;

/**
 * An enumerated image file together with the (modified time, size) signature
 * used to decide whether cached features still describe its content.
 */
@Value
public class ImageFile {

    /**
     * Absolute, normalized path. Unique key throughout a scan.
     */
    String path;

    /**
     * Last modification time in epoch seconds.
     */
    long modifiedTime;

    /**
     * File size in bytes.
     */
    long sizeBytes;

    /**
     * Check whether a stored signature matches this file.
     *
     * @param storedModifiedTime The stored modification time
     * @param storedSize The stored size
     * @return true if both values are identical
     */
    public boolean hasSignature(long storedModifiedTime, long storedSize) {
        return modifiedTime == storedModifiedTime && sizeBytes == storedSize;
    }
}
