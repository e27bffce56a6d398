package cube;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Rotates channel images about their centre with OpenCV, keeping the original size.
 * Pixels exposed by the rotation are set to zero.
 */
public class ChannelRotator {

    private int interpolation = Imgproc.INTER_LINEAR;

    public ChannelRotator() {
        ChannelImages.loadNative();
    }

    /**
     * Rotates an image counter-clockwise (as displayed with row 0 on top) by the given angle.
     *
     * @param image Intensities as {@code [row][column]}
     * @param angleDegrees Rotation angle in degrees
     * @return A new array of the same shape
     */
    public double[][] rotate(double[][] image, double angleDegrees) {
        int rows = image.length;
        int cols = image[0].length;

        Mat src = ChannelImages.toMat(image);

        Point center = new Point((cols - 1) / 2.0, (rows - 1) / 2.0);
        Mat rotation = Imgproc.getRotationMatrix2D(center, angleDegrees, 1.0);

        Mat dst = new Mat();
        Imgproc.warpAffine(src, dst, rotation, new Size(cols, rows), interpolation,
                Core.BORDER_CONSTANT, new Scalar(0));

        double[][] rotated = ChannelImages.toArray(dst);

        src.release();
        rotation.release();
        dst.release();

        return rotated;
    }

    /**
     * Selects the OpenCV interpolation flag, e.g. {@code Imgproc.INTER_CUBIC}
     */
    public void setInterpolation(int interpolation) {
        this.interpolation = interpolation;
    }

    public int getInterpolation() {
        return interpolation;
    }
}
