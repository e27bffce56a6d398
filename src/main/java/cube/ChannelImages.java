package cube;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.Scalar;

import java.util.logging.Logger;

/**
 * Conversions between channel arrays and OpenCV matrices, and image statistics on channels.
 */
public final class ChannelImages {

    private static final Logger logger = Logger.getLogger(ChannelImages.class.getName());

    private static boolean nativeLoaded = false;

    private ChannelImages() {
    }

    /** Loads the OpenCV native library once */
    public static synchronized void loadNative() {
        if (!nativeLoaded) {
            OpenCV.loadLocally();
            nativeLoaded = true;
            logger.fine("OpenCV " + Core.VERSION + " loaded");
        }
    }

    /**
     * Copies an image given as {@code [row][column]} into a single-channel {@code CV_64F} matrix.
     */
    public static Mat toMat(double[][] image) {
        loadNative();
        int rows = image.length;
        int cols = image[0].length;

        Mat mat = new Mat(rows, cols, CvType.CV_64FC1);
        double[] buffer = new double[rows * cols];
        for (int j = 0; j < rows; j++) {
            System.arraycopy(image[j], 0, buffer, j * cols, cols);
        }
        mat.put(0, 0, buffer);
        return mat;
    }

    /**
     * Copies a single-channel {@code CV_64F} matrix into a new {@code [row][column]} array.
     */
    public static double[][] toArray(Mat mat) {
        int rows = mat.rows();
        int cols = mat.cols();
        double[] buffer = new double[rows * cols];
        mat.get(0, 0, buffer);

        double[][] image = new double[rows][cols];
        for (int j = 0; j < rows; j++) {
            System.arraycopy(buffer, j * cols, image[j], 0, cols);
        }
        return image;
    }

    /**
     * Standard deviation of the finite pixels of an image, 0 if there are none.
     */
    public static double standardDeviation(double[][] image) {
        Mat src = toMat(image);

        // NaN never compares equal to itself, infinities fall outside the range
        Mat notNaN = new Mat();
        Core.compare(src, src, notNaN, Core.CMP_EQ);
        Mat inRange = new Mat();
        Core.inRange(src, new Scalar(-Double.MAX_VALUE), new Scalar(Double.MAX_VALUE), inRange);
        Mat mask = new Mat();
        Core.bitwise_and(notNaN, inRange, mask);

        double stddev = 0;
        if (Core.countNonZero(mask) == 0) {
            logger.warning("Standard deviation: no finite pixels in image");
        } else {
            MatOfDouble mean = new MatOfDouble();
            MatOfDouble deviation = new MatOfDouble();
            Core.meanStdDev(src, mean, deviation, mask);
            stddev = deviation.get(0, 0)[0];
            mean.release();
            deviation.release();
        }

        src.release();
        notNaN.release();
        inRange.release();
        mask.release();

        return stddev;
    }
}
