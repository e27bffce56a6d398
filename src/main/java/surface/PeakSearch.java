package surface;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds local maxima in a 1-D intensity profile.
 */
public final class PeakSearch {

    private PeakSearch() {
    }

    /**
     * Returns the indices of the local maxima of a profile, sorted by decreasing value.
     * A maximum is an index where the profile stops rising and starts falling; the profile
     * is treated as flat beyond both ends.
     *
     * @param profile Values to search
     * @param threshold Minimum value a maximum must exceed, ignored if NaN
     * @param minSeparation Maxima within this many pixels of a stronger one are dropped.
     *                      Values of 1 or less keep every maximum.
     * @return Indices of the maxima, strongest first
     */
    public static List<Integer> findPeaks(double[] profile, double threshold, double minSeparation) {
        List<Integer> peaks = new ArrayList<>();
        int n = profile.length;

        for (int i = 0; i < n; i++) {
            double rising = i > 0 ? profile[i] - profile[i - 1] : 0;
            double falling = i < n - 1 ? profile[i + 1] - profile[i] : 0;
            if (rising >= 0 && falling < 0
                && (Double.isNaN(threshold) || profile[i] > threshold)) {
                peaks.add(i);
            }
        }

        // stable sort, so equal maxima keep their row order
        peaks.sort((a, b) -> Double.compare(profile[b], profile[a]));

        if (minSeparation <= 1 || peaks.size() < 2) {
            return peaks;
        }

        boolean[] removed = new boolean[peaks.size()];
        for (int i = 0; i < peaks.size(); i++) {
            if (removed[i]) continue;
            int kept = peaks.get(i);
            for (int k = i + 1; k < peaks.size(); k++) {
                if (Math.abs(peaks.get(k) - kept) <= minSeparation) {
                    removed[k] = true;
                }
            }
        }

        List<Integer> separated = new ArrayList<>();
        for (int i = 0; i < peaks.size(); i++) {
            if (!removed[i]) {
                separated.add(peaks.get(i));
            }
        }
        return separated;
    }

    /**
     * Same as {@link #findPeaks(double[], double, double)} without a threshold.
     */
    public static List<Integer> findPeaks(double[] profile, double minSeparation) {
        return findPeaks(profile, Double.NaN, minSeparation);
    }
}
