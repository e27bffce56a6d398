package cube;

/**
 * A spectral line data cube: a stack of 2-D channel images indexed by Doppler velocity,
 * together with the metadata the surface extraction needs.
 */
public interface SpectralCube {

    /** Number of velocity channels */
    int getChannelCount();

    /** Number of rows (cross-axis pixels) in every channel */
    int getRows();

    /** Number of columns (along-axis pixels) in every channel */
    int getColumns();

    /**
     * Returns the intensities of one channel as {@code [row][column]}.
     * Implementations return a copy the caller may modify.
     */
    double[][] getChannel(int channel);

    /** Doppler velocity of a channel in km/s */
    double getVelocity(int channel);

    /** Angular size of one pixel in arcsec */
    double getPixelScale();

    /** Beam major axis in arcsec */
    double getBmaj();

    /**
     * Converts an intensity in Jy/beam to a brightness temperature in K.
     */
    double jyBeamToTb(double intensity);
}
