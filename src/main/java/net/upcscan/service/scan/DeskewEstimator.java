package net.upcscan.service.scan;

import lombok.extern.slf4j.Slf4j;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Optional;

/**
 * Estimates the residual skew of the bars from Hough line orientations.
 *
 * <p>The estimate is the clockwise tilt of the bars in degrees; callers correct it
 * by rotating the full-resolution image by the negated angle.</p>
 */
@Slf4j
@Component
public class DeskewEstimator {

    static final double DOWNSAMPLE_FACTOR = 0.5;
    static final double CANNY_LOW = 50;
    static final double CANNY_HIGH = 150;
    static final int HOUGH_VOTE_THRESHOLD = 90;
    static final double NEAR_VERTICAL_LIMIT = 30.0;
    static final double MIN_CORRECTION = 0.5;
    /** Smallest edge map side worth running Hough on. */
    static final int MIN_DOWNSAMPLED_SIDE = 8;

    /**
     * @param gray single-channel 8-bit image
     * @return the median near-vertical line angle, or empty when the image is too small,
     *         no lines were found, none were near-vertical, or the skew is below
     *         {@value #MIN_CORRECTION} degrees
     */
    public Optional<Double> estimate(Mat gray) {
        if (Math.round(gray.cols() * DOWNSAMPLE_FACTOR) < MIN_DOWNSAMPLED_SIDE
                || Math.round(gray.rows() * DOWNSAMPLE_FACTOR) < MIN_DOWNSAMPLED_SIDE) {
            log.debug("Deskew: {}x{} image too small to estimate", gray.cols(), gray.rows());
            return Optional.empty();
        }
        Mat small = new Mat();
        Mat edges = new Mat();
        Mat lines = new Mat();
        try {
            Imgproc.resize(gray, small, new Size(), DOWNSAMPLE_FACTOR, DOWNSAMPLE_FACTOR, Imgproc.INTER_AREA);
            Imgproc.Canny(small, edges, CANNY_LOW, CANNY_HIGH);
            Imgproc.HoughLines(edges, lines, 1, Math.PI / 180, HOUGH_VOTE_THRESHOLD);
            if (lines.empty()) {
                log.debug("Deskew: no lines found");
                return Optional.empty();
            }

            double[] angles = nearVerticalAngles(lines);
            if (angles.length == 0) {
                log.debug("Deskew: {} lines, none near vertical", lines.rows());
                return Optional.empty();
            }

            double median = median(angles);
            log.debug("Deskew: {} near-vertical of {} lines, median {}", angles.length, lines.rows(), median);
            if (Math.abs(median) < MIN_CORRECTION) {
                return Optional.empty();
            }
            return Optional.of(median);
        } catch (CvException e) {
            log.warn("Deskew: estimate failed on {}x{} image: {}", gray.cols(), gray.rows(), e.getMessage());
            return Optional.empty();
        } finally {
            small.release();
            edges.release();
            lines.release();
        }
    }

    /**
     * Keeps lines within {@value #NEAR_VERTICAL_LIMIT} degrees of vertical. Hough
     * reports the normal angle in [0, 180); angles past 150 are folded to negatives.
     */
    private static double[] nearVerticalAngles(Mat lines) {
        double[] kept = new double[lines.rows()];
        int count = 0;
        for (int i = 0; i < lines.rows(); i++) {
            double theta = Math.toDegrees(lines.get(i, 0)[1]);
            if (theta < NEAR_VERTICAL_LIMIT) {
                kept[count++] = theta;
            } else if (theta > 180.0 - NEAR_VERTICAL_LIMIT) {
                kept[count++] = theta - 180.0;
            }
        }
        return Arrays.copyOf(kept, count);
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
