package net.upcscan.service.scan;

import net.upcscan.model.scan.QualityMetrics;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

/**
 * Scores a grayscale image for sharpness, contrast and edge density.
 *
 * <p>The result only gates the expensive tiers; the cheap tiers always run.</p>
 */
@Component
public class QualityAssessor {

    static final double CANNY_LOW = 50;
    static final double CANNY_HIGH = 150;

    /**
     * Computes quality metrics for the image. Pure; the input is not modified.
     *
     * @param gray single-channel 8-bit image
     * @return sharpness (Laplacian variance), contrast (intensity standard deviation),
     *         edge density (Canny edge pixels over total pixels) and the scannable verdict
     */
    public QualityMetrics assess(Mat gray) {
        long total = gray.total();
        if (total == 0) {
            return QualityMetrics.of(0, 0, 0);
        }

        Mat laplacian = new Mat();
        Mat edges = new Mat();
        try {
            Imgproc.Laplacian(gray, laplacian, CvType.CV_64F);
            double sharpness = Math.pow(standardDeviation(laplacian), 2);
            double contrast = standardDeviation(gray);

            Imgproc.Canny(gray, edges, CANNY_LOW, CANNY_HIGH);
            double edgeDensity = (double) Core.countNonZero(edges) / total;

            return QualityMetrics.of(sharpness, contrast, edgeDensity);
        } finally {
            laplacian.release();
            edges.release();
        }
    }

    private static double standardDeviation(Mat mat) {
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble stddev = new MatOfDouble();
        try {
            Core.meanStdDev(mat, mean, stddev);
            return stddev.toArray()[0];
        } finally {
            mean.release();
            stddev.release();
        }
    }
}
