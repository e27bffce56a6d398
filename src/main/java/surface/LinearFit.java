package surface;

/**
 * Least-squares fit of a straight line {@code y = offset + slope * x}.
 * Points are accumulated as sums, so the fit can be rebuilt cheaply after pruning.
 */
public class LinearFit {
    /** number of data points */
    private int counter = 0;
    /** sum of all x values */
    private double sumX = 0;
    /** sum of all y values */
    private double sumY = 0;
    /** sum of all x*y products */
    private double sumXY = 0;
    /** sum of all squares of x */
    private double sumX2 = 0;

    private double offset = Double.NaN;
    private double slope = Double.NaN;
    private boolean calculated = false;

    /** Removes all points */
    public void clear() {
        counter = 0;
        sumX = 0;
        sumY = 0;
        sumXY = 0;
        sumX2 = 0;
        offset = Double.NaN;
        slope = Double.NaN;
        calculated = false;
    }

    /** Adds a point unless x or y is NaN */
    public void addPoint(double x, double y) {
        if (Double.isNaN(x) || Double.isNaN(y)) return;
        counter++;
        sumX += x;
        sumY += y;
        sumXY += x * y;
        sumX2 += x * x;
        calculated = false;
    }

    public int getCount() {
        return counter;
    }

    /** Offset of the line, NaN with fewer than two distinct x values */
    public double getOffset() {
        calculate();
        return offset;
    }

    /** Slope of the line, NaN with fewer than two distinct x values */
    public double getSlope() {
        calculate();
        return slope;
    }

    /** Value of the fitted line at x */
    public double getFitValue(double x) {
        calculate();
        return offset + slope * x;
    }

    private void calculate() {
        if (calculated) return;
        calculated = true;
        if (counter < 2) {
            offset = Double.NaN;
            slope = Double.NaN;
            return;
        }
        double meanX = sumX / counter;
        double meanY = sumY / counter;
        double varX = sumX2 / counter - meanX * meanX;
        if (!(varX > 0)) {
            offset = Double.NaN;
            slope = Double.NaN;
            return;
        }
        slope = (sumXY / counter - meanX * meanY) / varX;
        offset = meanY - slope * meanX;
    }
}
