package cube;

import java.util.logging.Logger;

/**
 * In-memory spectral cube. Holds the channel images, the velocity axis and the beam,
 * and converts Jy/beam to brightness temperature with the full Planck law.
 */
public class ChannelCube implements SpectralCube {

    private static final Logger logger = Logger.getLogger(ChannelCube.class.getName());

    private static final double PLANCK = 6.62607015e-34;       // J s
    private static final double BOLTZMANN = 1.380649e-23;      // J/K
    private static final double SPEED_OF_LIGHT = 2.99792458e8; // m/s
    private static final double JANSKY = 1e-26;                // W m^-2 Hz^-1
    private static final double ARCSEC = Math.PI / (180.0 * 3600.0);

    private final double[][][] channels;
    private final double[] velocities;
    private final double pixelScale;
    private final double bmaj;
    private final double bmin;
    private final double restFrequency;

    /**
     * @param channels Intensities as {@code [channel][row][column]}, in Jy/beam
     * @param velocities Velocity of each channel in km/s
     * @param pixelScale Pixel size in arcsec
     * @param bmaj Beam major axis in arcsec
     * @param bmin Beam minor axis in arcsec
     * @param restFrequency Rest frequency of the line in Hz
     * @throws IllegalArgumentException if the channels are empty or ragged, or a scale is not positive
     */
    public ChannelCube(double[][][] channels, double[] velocities, double pixelScale,
                       double bmaj, double bmin, double restFrequency) {
        if (channels == null || channels.length == 0) {
            throw new IllegalArgumentException("Cube must contain at least one channel");
        }
        if (velocities == null || velocities.length != channels.length) {
            throw new IllegalArgumentException("Expected one velocity per channel");
        }
        if (!(pixelScale > 0) || !(bmaj > 0) || !(bmin > 0)) {
            throw new IllegalArgumentException("Pixel scale and beam must be positive");
        }
        if (!(restFrequency > 0)) {
            throw new IllegalArgumentException("Rest frequency must be positive, got " + restFrequency);
        }

        int rows = channels[0].length;
        int cols = rows > 0 ? channels[0][0].length : 0;
        if (rows == 0 || cols == 0) {
            throw new IllegalArgumentException("Channels must not be empty");
        }

        this.channels = new double[channels.length][][];
        for (int iv = 0; iv < channels.length; iv++) {
            if (channels[iv].length != rows) {
                throw new IllegalArgumentException("Channel " + iv + " has " + channels[iv].length
                        + " rows, expected " + rows);
            }
            this.channels[iv] = new double[rows][];
            for (int j = 0; j < rows; j++) {
                if (channels[iv][j].length != cols) {
                    throw new IllegalArgumentException("Channel " + iv + " row " + j + " has "
                            + channels[iv][j].length + " columns, expected " + cols);
                }
                this.channels[iv][j] = channels[iv][j].clone();
            }
        }

        this.velocities = velocities.clone();
        this.pixelScale = pixelScale;
        this.bmaj = bmaj;
        this.bmin = bmin;
        this.restFrequency = restFrequency;

        logger.fine(String.format("Cube: %d channels of %dx%d pixels, pixel scale %.4f\", beam %.3f\"x%.3f\"",
                channels.length, rows, cols, pixelScale, bmaj, bmin));
    }

    @Override
    public int getChannelCount() {
        return channels.length;
    }

    @Override
    public int getRows() {
        return channels[0].length;
    }

    @Override
    public int getColumns() {
        return channels[0][0].length;
    }

    @Override
    public double[][] getChannel(int channel) {
        double[][] src = channels[channel];
        double[][] copy = new double[src.length][];
        for (int j = 0; j < src.length; j++) {
            copy[j] = src[j].clone();
        }
        return copy;
    }

    @Override
    public double getVelocity(int channel) {
        return velocities[channel];
    }

    @Override
    public double getPixelScale() {
        return pixelScale;
    }

    @Override
    public double getBmaj() {
        return bmaj;
    }

    public double getBmin() {
        return bmin;
    }

    public double getRestFrequency() {
        return restFrequency;
    }

    /**
     * Beam solid angle of a Gaussian beam in steradian
     */
    public double beamArea() {
        return Math.PI * bmaj * bmin / (4.0 * Math.log(2.0)) * ARCSEC * ARCSEC;
    }

    /**
     * Planck brightness temperature of an intensity in Jy/beam.
     * Negative intensities give the negated temperature of their absolute value.
     */
    @Override
    public double jyBeamToTb(double intensity) {
        if (intensity == 0 || Double.isNaN(intensity)) {
            return intensity;
        }

        double nu = restFrequency;
        double specificIntensity = Math.abs(intensity) * JANSKY / beamArea();  // W m^-2 Hz^-1 sr^-1
        double tb = PLANCK * nu / BOLTZMANN
                / Math.log1p(2.0 * PLANCK * nu * nu * nu / (SPEED_OF_LIGHT * SPEED_OF_LIGHT * specificIntensity));

        return Math.copySign(tb, intensity);
    }
}
