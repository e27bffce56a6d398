package surface;

/**
 * Geometry of the disk on the sky, fixed for a whole run.
 * Pixel coordinates refer to the channel images after rotation by {@code PA - 90}.
 */
public class DiskGeometry {

    public final Double inclination;    // degrees
    public final Double positionAngle;  // degrees, null to skip rotation
    public final Double xStar;          // column of the star, pixels
    public final Double yStar;          // row of the star, pixels
    public final Double systemicVelocity;  // km/s
    public final Double distance;       // pc, null to keep arcsec

    private DiskGeometry(Builder builder) {
        this.inclination = builder.inclination;
        this.positionAngle = builder.positionAngle;
        this.xStar = builder.xStar;
        this.yStar = builder.yStar;
        this.systemicVelocity = builder.systemicVelocity;
        this.distance = builder.distance;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks that everything the deprojection needs is present and usable.
     *
     * @throws IllegalArgumentException naming the first missing or invalid parameter
     */
    public void validateForDeprojection() {
        if (inclination == null) {
            throw new IllegalArgumentException("Inclination is required for deprojection");
        }
        // face-on and edge-on leave sin(i) or cos(i) zero
        if (!Double.isFinite(inclination) || inclination % 90 == 0) {
            throw new IllegalArgumentException("Inclination must not be a multiple of 90 degrees, got " + inclination);
        }
        if (xStar == null || yStar == null) {
            throw new IllegalArgumentException("Star position is required for deprojection");
        }
        if (systemicVelocity == null) {
            throw new IllegalArgumentException("Systemic velocity is required for deprojection");
        }
        if (distance != null && !(distance > 0)) {
            throw new IllegalArgumentException("Distance must be positive, got " + distance);
        }
    }

    @Override
    public String toString() {
        return String.format("inc=%s PA=%s star=(%s, %s) vsyst=%s d=%s",
                inclination, positionAngle, xStar, yStar, systemicVelocity, distance);
    }

    public static class Builder {
        private Double inclination;
        private Double positionAngle;
        private Double xStar;
        private Double yStar;
        private Double systemicVelocity;
        private Double distance;

        public Builder inclination(double degrees) {
            this.inclination = degrees;
            return this;
        }

        public Builder positionAngle(Double degrees) {
            this.positionAngle = degrees;
            return this;
        }

        public Builder star(double x, double y) {
            this.xStar = x;
            this.yStar = y;
            return this;
        }

        public Builder starRow(Double y) {
            this.yStar = y;
            return this;
        }

        public Builder systemicVelocity(double kms) {
            this.systemicVelocity = kms;
            return this;
        }

        public Builder distance(Double parsec) {
            this.distance = parsec;
            return this;
        }

        public DiskGeometry build() {
            return new DiskGeometry(this);
        }
    }
}
