package surface;

import cube.ChannelImages;
import cube.ChannelRotator;
import cube.SpectralCube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * SurfaceDetector locates the emitting layer of a disk in every channel of a line cube.
 * Each channel is rotated so the disk major axis runs along the columns, then every column
 * is searched for the two vertical intensity maxima where the line of sight crosses the
 * near and far sides of the flared surface. Positions are refined to sub-pixel accuracy and
 * columns whose two crossings do not straddle a line fitted through their midpoints are
 * rejected.
 */
public class SurfaceDetector {

    private static final Logger logger = Logger.getLogger(SurfaceDetector.class.getName());

    // Detection parameters
    private double sigma = 5;              // threshold in units of the noise level
    private int noiseChannel = 1;          // channel used to measure the noise level
    private StarSidePolicy starSidePolicy = StarSidePolicy.PER_SIDE_REPLACEMENT;
    private TemperatureConversion temperatureConversion = TemperatureConversion.IN_DEPROJECTOR;
    private boolean keepRotatedChannels = false;

    private ChannelRotator rotator;

    /**
     * Surface points found in one channel. Arrays have length {@code n}, index k describes
     * column {@code x[k]}; near is the crossing with the smaller row index.
     * Array getters return copies.
     */
    public static class ChannelResult {
        public final int channel;
        public final double velocity;
        public final int n;
        public final boolean intensitiesInKelvin;
        final int[] x;
        final double[] yNear;
        final double[] yFar;
        final double[] intensityNear;
        final double[] intensityFar;

        public ChannelResult(int channel, double velocity, int[] x, double[] yNear, double[] yFar,
                             double[] intensityNear, double[] intensityFar, boolean intensitiesInKelvin) {
            if (yNear.length != x.length || yFar.length != x.length
                || intensityNear.length != x.length || intensityFar.length != x.length) {
                throw new IllegalArgumentException("Surface point arrays must have equal length");
            }
            this.channel = channel;
            this.velocity = velocity;
            this.n = x.length;
            this.x = x.clone();
            this.yNear = yNear.clone();
            this.yFar = yFar.clone();
            this.intensityNear = intensityNear.clone();
            this.intensityFar = intensityFar.clone();
            this.intensitiesInKelvin = intensitiesInKelvin;
        }

        static ChannelResult empty(int channel, double velocity, boolean intensitiesInKelvin) {
            return new ChannelResult(channel, velocity, new int[0], new double[0], new double[0],
                    new double[0], new double[0], intensitiesInKelvin);
        }

        /** Along-axis column of each point */
        public int[] getX() {
            return x.clone();
        }

        /** Refined row of the near crossing */
        public double[] getYNear() {
            return yNear.clone();
        }

        /** Refined row of the far crossing */
        public double[] getYFar() {
            return yFar.clone();
        }

        /** Refined intensity of the near crossing, in K if {@code intensitiesInKelvin} */
        public double[] getIntensityNear() {
            return intensityNear.clone();
        }

        public double[] getIntensityFar() {
            return intensityFar.clone();
        }
    }

    /**
     * Result of a detection run over a whole cube
     */
    public static class DetectionResult {
        public final List<ChannelResult> channels;
        public final double noise;
        public final double threshold;
        public final double minSeparation;
        public final List<double[][]> rotatedChannels;  // empty unless requested

        public DetectionResult(List<ChannelResult> channels, double noise, double threshold,
                               double minSeparation, List<double[][]> rotatedChannels) {
            this.channels = Collections.unmodifiableList(new ArrayList<>(channels));
            this.noise = noise;
            this.threshold = threshold;
            this.minSeparation = minSeparation;
            this.rotatedChannels = Collections.unmodifiableList(new ArrayList<>(rotatedChannels));
        }

        /** Number of surface points per channel */
        public int[] counts() {
            int[] counts = new int[channels.size()];
            for (int iv = 0; iv < counts.length; iv++) {
                counts[iv] = channels.get(iv).n;
            }
            return counts;
        }

        public int totalPoints() {
            int total = 0;
            for (ChannelResult channel : channels) {
                total += channel.n;
            }
            return total;
        }
    }

    /**
     * Detects the surface in every channel.
     *
     * @param cube The line cube
     * @param positionAngle Position angle in degrees; channels are rotated by {@code PA - 90}. Null skips rotation.
     * @param yStar Row of the star in the rotated images, null if unknown (more columns are rejected)
     * @return Per-channel surface points
     */
    public DetectionResult detect(SpectralCube cube, Double positionAngle, Double yStar) {
        int nv = cube.getChannelCount();
        if (nv == 0) {
            throw new IllegalArgumentException("Cube has no channels");
        }

        int reference = Math.min(noiseChannel, nv - 1);
        double noise = noiseLevel(cube.getChannel(reference));
        double threshold = sigma * noise;
        double minSeparation = cube.getBmaj() / cube.getPixelScale();
        boolean inKelvin = temperatureConversion == TemperatureConversion.IN_DETECTOR;

        logger.info(String.format("Surface detection: %d channels, noise=%.4g (channel %d), threshold=%.4g (%.1f sigma), min separation=%.2f px",
                nv, noise, reference, threshold, sigma, minSeparation));

        if (positionAngle != null && rotator == null) {
            rotator = new ChannelRotator();
        }

        List<ChannelResult> results = new ArrayList<>();
        List<double[][]> rotated = new ArrayList<>();

        for (int iv = 0; iv < nv; iv++) {
            double[][] im = cube.getChannel(iv);
            replaceNonFinite(im);
            if (positionAngle != null) {
                im = rotator.rotate(im, positionAngle - 90.0);
            }
            if (keepRotatedChannels) {
                rotated.add(im);
            }

            ChannelResult result = detectChannel(im, iv, cube, threshold, minSeparation, yStar, inKelvin);
            results.add(result);
            logger.fine(String.format("Channel %d/%d (v=%.3f km/s): %d surface points",
                    iv, nv - 1, result.velocity, result.n));
        }

        DetectionResult detection = new DetectionResult(results, noise, threshold, minSeparation, rotated);
        logger.info(String.format("Surface detection: %d points in %d channels (of %d)",
                detection.totalPoints(), countNonEmpty(results), nv));
        return detection;
    }

    /**
     * Detects the surface in one (already rotated) channel image.
     */
    ChannelResult detectChannel(double[][] im, int iv, SpectralCube cube, double threshold,
                                double minSeparation, Double yStar, boolean inKelvin) {
        int ny = im.length;
        int nx = im[0].length;
        double velocity = cube.getVelocity(iv);

        boolean[] inSurface = new boolean[nx];
        double[][] yExact = new double[nx][2];
        double[][] peakValue = new double[nx][2];
        double[] profile = new double[ny];

        for (int i = 0; i < nx; i++) {
            for (int j = 0; j < ny; j++) {
                profile[j] = im[j][i];
            }

            List<Integer> maxima = PeakSearch.findPeaks(profile, threshold, minSeparation);

            // two maxima are needed, one per side of the disk
            if (maxima.size() < 2) continue;

            int[] pair = selectPair(maxima, yStar);
            if (pair == null) continue;

            inSurface[i] = true;
            for (int k = 0; k < 2; k++) {
                double[] refined = refinePeak(profile, pair[k]);
                yExact[i][k] = refined[0];
                peakValue[i][k] = inKelvin ? cube.jyBeamToTb(refined[1]) : refined[1];
            }
        }

        boolean[] kept = rejectOutliers(inSurface, yExact);

        int n = 0;
        for (boolean k : kept) {
            if (k) n++;
        }
        if (n == 0) {
            return ChannelResult.empty(iv, velocity, inKelvin);
        }

        int[] x = new int[n];
        double[] yNear = new double[n];
        double[] yFar = new double[n];
        double[] tNear = new double[n];
        double[] tFar = new double[n];
        int k = 0;
        for (int i = 0; i < nx; i++) {
            if (!kept[i]) continue;
            x[k] = i;
            yNear[k] = yExact[i][0];
            yFar[k] = yExact[i][1];
            tNear[k] = peakValue[i][0];
            tFar[k] = peakValue[i][1];
            k++;
        }
        return new ChannelResult(iv, velocity, x, yNear, yFar, tNear, tFar, inKelvin);
    }

    /**
     * Picks the lower and upper surface crossing from the maxima of one column.
     *
     * @param maxima Row indices sorted by decreasing intensity, at least two
     * @param yStar Row of the star or null
     * @return {lower, upper} row indices, or null when the column must be dropped
     */
    int[] selectPair(List<Integer> maxima, Double yStar) {
        int first = maxima.get(0);
        int second = maxima.get(1);

        if (yStar == null) {
            return new int[]{Math.min(first, second), Math.max(first, second)};
        }
        double star = yStar;

        if (starSidePolicy == StarSidePolicy.STRICT_STRIP) {
            int lower = Math.min(first, second);
            int upper = Math.max(first, second);
            if (upper < star) {
                // the far side cannot appear below the star
                Integer above = strongestBeyond(maxima, star, true);
                if (above == null) return null;
                upper = above;
                lower = first;
            }
            if (0.5 * (lower + upper) < star) return null;
            return new int[]{lower, upper};
        }

        if (first < star && second < star) {
            Integer above = strongestBeyond(maxima, star, true);
            if (above == null) return null;
            return new int[]{first, above};
        } else if (first > star && second > star) {
            Integer below = strongestBeyond(maxima, star, false);
            if (below == null) return null;
            return new int[]{below, second};
        }
        return new int[]{Math.min(first, second), Math.max(first, second)};
    }

    private static Integer strongestBeyond(List<Integer> maxima, double star, boolean above) {
        for (int j : maxima) {
            if (above ? j > star : j < star) {
                return j;
            }
        }
        return null;
    }

    /**
     * Refines the position and value of a maximum with a parabola through the three
     * pixels around it. Falls back to the integer pixel when the parabola is flat,
     * the maximum sits on the border, or the vertex lands more than a pixel away.
     *
     * @return {position, value}
     */
    static double[] refinePeak(double[] profile, int j) {
        double fMax = profile[j];
        if (j <= 0 || j >= profile.length - 1) {
            return new double[]{j, fMax};
        }
        double fMinus = profile[j - 1];
        double fPlus = profile[j + 1];

        // polynomial coefficients
        double a0 = 13.0 * fMax / 12.0 - (fPlus + fMinus) / 24.0;
        double a1 = 0.5 * (fPlus - fMinus);
        double a2 = 0.5 * (fPlus + fMinus - 2 * fMax);

        if (a2 == 0) {
            return new double[]{j, fMax};
        }

        double offset = -0.5 * a1 / a2;
        double value = a0 - 0.25 * a1 * a1 / a2;
        if (!Double.isFinite(offset) || !Double.isFinite(value) || Math.abs(offset) > 1) {
            return new double[]{j, fMax};
        }
        return new double[]{j + offset, value};
    }

    /**
     * Keeps the columns whose lower crossing lies below, and upper crossing above, a line
     * fitted through the midpoints. The line is fitted twice, the second time without the
     * columns rejected by the first.
     */
    boolean[] rejectOutliers(boolean[] inSurface, double[][] yExact) {
        int nx = inSurface.length;
        boolean[] none = new boolean[nx];

        LinearFit fit = new LinearFit();
        for (int i = 0; i < nx; i++) {
            if (inSurface[i]) fit.addPoint(i, 0.5 * (yExact[i][0] + yExact[i][1]));
        }
        if (fit.getCount() < 3) {
            return none;
        }

        boolean[] straddling = straddling(inSurface, yExact, fit);

        fit.clear();
        for (int i = 0; i < nx; i++) {
            if (straddling[i]) fit.addPoint(i, 0.5 * (yExact[i][0] + yExact[i][1]));
        }
        if (fit.getCount() < 3) {
            return none;
        }

        return straddling(inSurface, yExact, fit);
    }

    private static boolean[] straddling(boolean[] inSurface, double[][] yExact, LinearFit fit) {
        boolean[] kept = new boolean[inSurface.length];
        for (int i = 0; i < inSurface.length; i++) {
            double line = fit.getFitValue(i);
            kept[i] = inSurface[i] && yExact[i][0] < line && yExact[i][1] > line;
        }
        return kept;
    }

    /**
     * Standard deviation of the finite pixels of an image
     */
    public static double noiseLevel(double[][] image) {
        return ChannelImages.standardDeviation(image);
    }

    private static void replaceNonFinite(double[][] im) {
        for (double[] row : im) {
            for (int i = 0; i < row.length; i++) {
                if (!Double.isFinite(row[i])) row[i] = 0;
            }
        }
    }

    private static int countNonEmpty(List<ChannelResult> results) {
        int count = 0;
        for (ChannelResult r : results) {
            if (r.n > 0) count++;
        }
        return count;
    }

    // Getter and setter methods for parameters

    public void setSigma(double sigma) {
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("Sigma must be positive, got " + sigma);
        }
        this.sigma = sigma;
    }

    public double getSigma() {
        return sigma;
    }

    public void setNoiseChannel(int channel) {
        this.noiseChannel = Math.max(0, channel);
    }

    public int getNoiseChannel() {
        return noiseChannel;
    }

    public void setStarSidePolicy(StarSidePolicy policy) {
        this.starSidePolicy = policy;
    }

    public StarSidePolicy getStarSidePolicy() {
        return starSidePolicy;
    }

    public void setTemperatureConversion(TemperatureConversion conversion) {
        this.temperatureConversion = conversion;
    }

    public TemperatureConversion getTemperatureConversion() {
        return temperatureConversion;
    }

    public void setKeepRotatedChannels(boolean keep) {
        this.keepRotatedChannels = keep;
    }

    public void setRotator(ChannelRotator rotator) {
        this.rotator = rotator;
    }
}
