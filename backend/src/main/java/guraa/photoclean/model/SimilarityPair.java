package guraa.photoclean.model;

import lombok.Value;

import java.util.Comparator;

/**
 * Unordered pair of similar images. The two paths are stored in lexicographic
 * order so that equal pairs compare equal regardless of discovery order.
 * Smaller distance means more similar, whether it is a raw Hamming distance
 * (0-64) or a hybrid pseudo-distance (0-100).
 */
@Value
public class SimilarityPair {

    /**
     * Orders by distance, then by the two paths, giving a total deterministic order.
     */
    public static final Comparator<SimilarityPair> BY_DISTANCE = Comparator
            .comparingInt(SimilarityPair::getDistance)
            .thenComparing(SimilarityPair::getFirst)
            .thenComparing(SimilarityPair::getSecond);

    String first;
    String second;
    int distance;

    private SimilarityPair(String first, String second, int distance) {
        this.first = first;
        this.second = second;
        this.distance = distance;
    }

    /**
     * Create a pair, normalizing path order.
     *
     * @param a One path
     * @param b The other path
     * @param distance Similarity distance
     * @return The pair
     */
    public static SimilarityPair of(String a, String b, int distance) {
        if (a.equals(b)) {
            throw new IllegalArgumentException("A pair needs two distinct paths: " + a);
        }
        return a.compareTo(b) < 0 ? new SimilarityPair(a, b, distance) : new SimilarityPair(b, a, distance);
    }

    /**
     * Get the member opposite to the given one.
     *
     * @param path One member of this pair
     * @return The other member
     */
    public String other(String path) {
        if (first.equals(path)) {
            return second;
        }
        if (second.equals(path)) {
            return first;
        }
        throw new IllegalArgumentException(path + " is not part of " + this);
    }

    /**
     * Key identifying the unordered path pair, independent of distance.
     */
    public String key() {
        return first + '\u0000' + second;
    }
}
