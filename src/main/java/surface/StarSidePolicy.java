package surface;

/**
 * How the two strongest maxima of a column are checked against the star row
 * before they are accepted as the lower/upper surface crossings.
 */
public enum StarSidePolicy {
    /**
     * If both maxima lie on the same side of the star, the one on the wrong side is replaced by
     * the strongest maximum on the other side; the column is dropped when there is none.
     */
    PER_SIDE_REPLACEMENT,

    /**
     * The upper crossing must lie above the star (replaced by the strongest maximum above it,
     * the strongest overall then being the lower one), and the midpoint of the pair must not lie
     * below the star. Rejects more columns.
     */
    STRICT_STRIP
}
