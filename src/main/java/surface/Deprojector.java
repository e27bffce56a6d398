package surface;

import cube.SpectralCube;

import java.util.logging.Logger;

/**
 * Deprojector turns the surface points found by {@link SurfaceDetector} into radius,
 * height, rotation velocity and brightness temperature in the disk frame, and removes the
 * points that are geometrically inconsistent.
 */
public class Deprojector {

    private static final Logger logger = Logger.getLogger(Deprojector.class.getName());

    /** Fraction of negative heights above which the detected layer is taken as the lower surface */
    private static final double FLIP_FRACTION = 0.995;

    private HeightConvention heightConvention = HeightConvention.AUTO_FLIP;
    private double systemicWindow = 0.4;       // km/s
    private double maxRadius = Double.NaN;     // same units as r, NaN for no cut
    private boolean rejectNegativeVelocity = true;

    /**
     * Number of points removed by each mask, in the order the masks are applied
     */
    public static class Diagnostics {
        public final int totalPoints;
        public final int removedByGeometry;
        public final int removedBySystemicWindow;
        public final int removedByNegativeVelocity;
        public final int remainingPoints;
        public final boolean heightFlipped;
        public final boolean velocityFlipped;

        public Diagnostics(int totalPoints, int removedByGeometry, int removedBySystemicWindow,
                           int removedByNegativeVelocity, int remainingPoints,
                           boolean heightFlipped, boolean velocityFlipped) {
            this.totalPoints = totalPoints;
            this.removedByGeometry = removedByGeometry;
            this.removedBySystemicWindow = removedBySystemicWindow;
            this.removedByNegativeVelocity = removedByNegativeVelocity;
            this.remainingPoints = remainingPoints;
            this.heightFlipped = heightFlipped;
            this.velocityFlipped = velocityFlipped;
        }

        @Override
        public String toString() {
            return String.format("total=%d geometry=-%d systemic=-%d negative v=-%d remaining=%d%s%s",
                    totalPoints, removedByGeometry, removedBySystemicWindow, removedByNegativeVelocity,
                    remainingPoints, heightFlipped ? " (h flipped)" : "", velocityFlipped ? " (v flipped)" : "");
        }
    }

    /**
     * Valid deprojected points. All arrays are parallel; {@code valid} instead runs over
     * every detected point, channel by channel, and is true for the points kept.
     * Array getters return copies.
     */
    public static class DeprojectionResult {
        public final Diagnostics diagnostics;
        private final double[] r;
        private final double[] h;
        private final double[] v;
        private final double[] tb;
        private final int[] channel;
        private final double[] xDisk;   // x - x_star, pixels
        private final double[] yDisk;   // deprojected cross-axis offset, pixels
        private final boolean[] valid;

        DeprojectionResult(double[] r, double[] h, double[] v, double[] tb, int[] channel,
                                  double[] xDisk, double[] yDisk, boolean[] valid, Diagnostics diagnostics) {
            this.r = r;
            this.h = h;
            this.v = v;
            this.tb = tb;
            this.channel = channel;
            this.xDisk = xDisk;
            this.yDisk = yDisk;
            this.valid = valid;
            this.diagnostics = diagnostics;
        }

        public int size() {
            return r.length;
        }

        /** Radius, arcsec or au */
        public double[] getR() {
            return r.clone();
        }

        /** Height above the midplane, same units as r */
        public double[] getH() {
            return h.clone();
        }

        /** Rotation velocity, km/s */
        public double[] getV() {
            return v.clone();
        }

        /** Brightness temperature, K */
        public double[] getTb() {
            return tb.clone();
        }

        /** Channel index of each point */
        public int[] getChannel() {
            return channel.clone();
        }

        public double[] getXDisk() {
            return xDisk.clone();
        }

        public double[] getYDisk() {
            return yDisk.clone();
        }

        /** One flag per detected point, true if the point was kept */
        public boolean[] getValid() {
            return valid.clone();
        }
    }

    /**
     * Deprojects the surface points of all channels.
     *
     * @param detection Output of the surface detection
     * @param cube Cube the points were detected in (pixel scale and temperature conversion)
     * @param geometry Inclination, star position, systemic velocity and optional distance
     * @return The valid points and the per-mask diagnostics
     * @throws IllegalArgumentException if a geometry parameter is missing or invalid
     */
    public DeprojectionResult deproject(SurfaceDetector.DetectionResult detection, SpectralCube cube,
                                        DiskGeometry geometry) {
        geometry.validateForDeprojection();

        double incRad = Math.toRadians(geometry.inclination);
        double sinInc = Math.sin(incRad);
        double cosInc = Math.cos(incRad);
        double xStar = geometry.xStar;
        double yStar = geometry.yStar;
        double vSyst = geometry.systemicVelocity;
        double scale = cube.getPixelScale() * (geometry.distance != null ? geometry.distance : 1.0);

        int total = detection.totalPoints();
        double[] r = new double[total];
        double[] h = new double[total];
        double[] v = new double[total];
        double[] xDisk = new double[total];
        double[] yDisk = new double[total];
        double[] intensity = new double[total];
        int[] channelOf = new int[total];
        boolean[] nearSystemic = new boolean[total];
        boolean[] inKelvin = new boolean[total];

        int p = 0;
        int negativeHeights = 0;
        for (SurfaceDetector.ChannelResult channel : detection.channels) {
            boolean systemic = Math.abs(channel.velocity - vSyst) < systemicWindow;
            for (int k = 0; k < channel.n; k++) {
                double yc = 0.5 * (channel.yNear[k] + channel.yFar[k]);
                double dy = heightConvention == HeightConvention.AUTO_FLIP
                        ? 0.5 * (channel.yFar[k] - channel.yNear[k])
                        : channel.yFar[k] - yc;
                double dx = channel.x[k] - xStar;

                xDisk[p] = dx;
                yDisk[p] = dy / cosInc;
                h[p] = (yc - yStar) / sinInc;
                r[p] = Math.hypot(dx, yDisk[p]);

                double denominator = dx * sinInc;
                v[p] = denominator == 0 ? Double.NaN : (channel.velocity - vSyst) * r[p] / denominator;

                intensity[p] = 0.5 * (channel.intensityNear[k] + channel.intensityFar[k]);
                inKelvin[p] = channel.intensitiesInKelvin;
                channelOf[p] = channel.channel;
                nearSystemic[p] = systemic;
                if (h[p] < 0) negativeHeights++;
                p++;
            }
        }

        boolean heightFlipped = false;
        if (heightConvention == HeightConvention.AUTO_FLIP && total > 0
            && negativeHeights > FLIP_FRACTION * total) {
            heightFlipped = true;
            for (int i = 0; i < total; i++) {
                h[i] = -h[i];
            }
        }

        for (int i = 0; i < total; i++) {
            r[i] *= scale;
            h[i] *= scale;
        }

        // geometry mask, then channels close to the systemic velocity
        boolean[] valid = new boolean[total];
        int removedByGeometry = 0;
        int removedBySystemic = 0;
        for (int i = 0; i < total; i++) {
            boolean bad = !(h[i] >= 0) || !Double.isFinite(v[i]) || !Double.isFinite(r[i])
                          || (!Double.isNaN(maxRadius) && r[i] > maxRadius);
            if (bad) {
                removedByGeometry++;
            } else if (nearSystemic[i]) {
                removedBySystemic++;
            } else {
                valid[i] = true;
            }
        }

        // the disk is assumed to rotate in the positive sense
        double sumV = 0;
        int count = 0;
        for (int i = 0; i < total; i++) {
            if (valid[i]) {
                sumV += v[i];
                count++;
            }
        }
        boolean velocityFlipped = count > 0 && sumV / count < 0;
        if (velocityFlipped) {
            for (int i = 0; i < total; i++) {
                v[i] = -v[i];
            }
        }

        int removedByNegative = 0;
        if (rejectNegativeVelocity) {
            for (int i = 0; i < total; i++) {
                if (valid[i] && v[i] < 0) {
                    valid[i] = false;
                    removedByNegative++;
                }
            }
        }

        int remaining = count - removedByNegative;
        double[] rOut = new double[remaining];
        double[] hOut = new double[remaining];
        double[] vOut = new double[remaining];
        double[] tbOut = new double[remaining];
        int[] channelOut = new int[remaining];
        double[] xOut = new double[remaining];
        double[] yOut = new double[remaining];
        int k = 0;
        for (int i = 0; i < total; i++) {
            if (!valid[i]) continue;
            rOut[k] = r[i];
            hOut[k] = h[i];
            vOut[k] = v[i];
            tbOut[k] = inKelvin[i] ? intensity[i] : cube.jyBeamToTb(intensity[i]);
            channelOut[k] = channelOf[i];
            xOut[k] = xDisk[i];
            yOut[k] = yDisk[i];
            k++;
        }

        Diagnostics diagnostics = new Diagnostics(total, removedByGeometry, removedBySystemic,
                removedByNegative, remaining, heightFlipped, velocityFlipped);
        logger.info("Deprojection: " + diagnostics);
        if (total > 0 && remaining == 0) {
            logger.warning("Deprojection: no valid points left, check inclination, star position and systemic velocity");
        }

        return new DeprojectionResult(rOut, hOut, vOut, tbOut, channelOut, xOut, yOut, valid, diagnostics);
    }

    // Getter and setter methods for parameters

    public void setHeightConvention(HeightConvention convention) {
        this.heightConvention = convention;
    }

    public HeightConvention getHeightConvention() {
        return heightConvention;
    }

    /**
     * Channels closer than this to the systemic velocity (km/s) are ignored
     */
    public void setSystemicWindow(double window) {
        this.systemicWindow = Math.max(0, window);
    }

    public double getSystemicWindow() {
        return systemicWindow;
    }

    /**
     * Points with a larger radius are ignored; NaN disables the cut.
     * Units are arcsec, or au when a distance is given.
     */
    public void setMaxRadius(double maxRadius) {
        this.maxRadius = maxRadius;
    }

    public double getMaxRadius() {
        return maxRadius;
    }

    public void setRejectNegativeVelocity(boolean reject) {
        this.rejectNegativeVelocity = reject;
    }

    public boolean isRejectNegativeVelocity() {
        return rejectNegativeVelocity;
    }
}
