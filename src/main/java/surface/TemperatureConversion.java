package surface;

/**
 * Where refined peak intensities are converted from Jy/beam to brightness temperature.
 */
public enum TemperatureConversion {
    /** Each refined near/far intensity is converted during detection, then averaged */
    IN_DETECTOR,
    /** The raw near/far intensities are averaged per point, then converted once */
    IN_DEPROJECTOR
}
