package net.upcscan.util.image;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Pixel transforms used to build decode candidates.
 *
 * <p>Every method allocates and returns a new {@link Mat}; the source is never
 * written. Angles are in degrees, positive meaning clockwise rotation of the
 * image content.</p>
 */
public final class ImageOps {

    /** Border fill for small-angle rotations (paper white). */
    public static final double WHITE = 255.0;

    /** Kernel for the directional blur along image rows. */
    static final Size HORIZONTAL_BLUR_KERNEL = new Size(5, 1);

    /** Kernel for the light smoothing pass before automatic thresholding. */
    static final Size SMOOTHING_KERNEL = new Size(3, 3);

    static {
        OpenCvLoader.ensureLoaded();
    }

    private ImageOps() {
    }

    /**
     * Converts a 1, 3 (BGR) or 4 (BGRA) channel image to single-channel gray.
     */
    public static Mat toGray(Mat src) {
        Mat gray = new Mat();
        switch (src.channels()) {
            case 1 -> src.copyTo(gray);
            case 3 -> Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGR2GRAY);
            case 4 -> Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGRA2GRAY);
            default -> throw new IllegalArgumentException("Unsupported channel count: " + src.channels());
        }
        return gray;
    }

    /**
     * Exact rotation by a multiple of 90 degrees. No interpolation takes place.
     */
    public static Mat rotateCardinal(Mat src, int degrees) {
        Mat dst = new Mat();
        switch (Math.floorMod(degrees, 360)) {
            case 0 -> src.copyTo(dst);
            case 90 -> Core.rotate(src, dst, Core.ROTATE_90_CLOCKWISE);
            case 180 -> Core.rotate(src, dst, Core.ROTATE_180);
            case 270 -> Core.rotate(src, dst, Core.ROTATE_90_COUNTERCLOCKWISE);
            default -> throw new IllegalArgumentException("Not a cardinal angle: " + degrees);
        }
        return dst;
    }

    /**
     * Bilinear rotation about the centre, keeping the frame size and filling
     * uncovered pixels with a constant value.
     */
    public static Mat rotateFilled(Mat src, double degrees, double fill) {
        return warpRotate(src, degrees, Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, new Scalar(fill));
    }

    /**
     * Bicubic rotation about the centre with border pixels replicated, so the frame
     * edge does not introduce spurious bar-like transitions.
     */
    public static Mat rotateReplicated(Mat src, double degrees) {
        return warpRotate(src, degrees, Imgproc.INTER_CUBIC, Core.BORDER_REPLICATE, new Scalar(0));
    }

    private static Mat warpRotate(Mat src, double degrees, int interpolation, int borderMode, Scalar borderValue) {
        Point center = new Point(src.cols() / 2.0, src.rows() / 2.0);
        // getRotationMatrix2D treats positive angles as counter-clockwise
        Mat matrix = Imgproc.getRotationMatrix2D(center, -degrees, 1.0);
        Mat dst = new Mat();
        try {
            Imgproc.warpAffine(src, dst, matrix, src.size(), interpolation, borderMode, borderValue);
        } finally {
            matrix.release();
        }
        return dst;
    }

    /** Global binarization at a fixed level: pixels above the level become white. */
    public static Mat threshold(Mat gray, double level) {
        Mat dst = new Mat();
        Imgproc.threshold(gray, dst, level, 255, Imgproc.THRESH_BINARY);
        return dst;
    }

    /** Global binarization at the histogram split chosen by Otsu's method. */
    public static Mat otsu(Mat gray) {
        Mat dst = new Mat();
        Imgproc.threshold(gray, dst, 0, 255, Imgproc.THRESH_BINARY | Imgproc.THRESH_OTSU);
        return dst;
    }

    /** Light 3x3 Gaussian pass that suppresses resampling artifacts. */
    public static Mat smooth(Mat gray) {
        Mat dst = new Mat();
        Imgproc.GaussianBlur(gray, dst, SMOOTHING_KERNEL, 0);
        return dst;
    }

    /** Box blur along rows only, mirroring horizontal hand motion. */
    public static Mat horizontalBlur(Mat gray) {
        Mat dst = new Mat();
        Imgproc.blur(gray, dst, HORIZONTAL_BLUR_KERNEL);
        return dst;
    }

    /** Bitwise inversion (polarity flip). */
    public static Mat invert(Mat src) {
        Mat dst = new Mat();
        Core.bitwise_not(src, dst);
        return dst;
    }

    /** Uniform rescale by {@code factor} with the given OpenCV interpolation flag. */
    public static Mat scale(Mat src, double factor, int interpolation) {
        Mat dst = new Mat();
        Imgproc.resize(src, dst, new Size(), factor, factor, interpolation);
        return dst;
    }

    /** Whether the image has pixels to decode. */
    public static boolean isUsable(Mat mat) {
        return mat != null && !mat.empty() && mat.cols() > 0 && mat.rows() > 0;
    }

    /**
     * Copies a single-channel 8-bit image into a row-major luminance array.
     */
    public static byte[] toLuminance(Mat gray) {
        if (gray.type() != CvType.CV_8UC1) {
            throw new IllegalArgumentException("Expected CV_8UC1 image, got " + CvType.typeToString(gray.type()));
        }
        Mat continuous = gray.isContinuous() ? gray : gray.clone();
        try {
            byte[] data = new byte[(int) continuous.total()];
            continuous.get(0, 0, data);
            return data;
        } finally {
            if (continuous != gray) {
                continuous.release();
            }
        }
    }
}
