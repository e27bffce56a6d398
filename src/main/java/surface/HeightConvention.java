package surface;

/**
 * Sign convention for the height above the midplane.
 */
public enum HeightConvention {
    /**
     * Height from the midline relative to the star; all heights are negated when nearly all
     * of them come out negative, i.e. the detected layer is the lower surface.
     */
    AUTO_FLIP,

    /** Height from the midline relative to the star, far side minus midline, never flipped */
    FAR_MINUS_MIDLINE
}
