package net.upcscan.model.scan;

import org.opencv.core.Mat;

/**
 * A transformed image produced for one decode attempt.
 *
 * <p>The candidate owns its pixel buffer and releases it on {@link #close()}; it is
 * never shared across attempts.</p>
 */
public final class Candidate implements AutoCloseable {

    private final Tier tier;
    private final String transform;
    private final Mat image;

    public Candidate(Tier tier, String transform, Mat image) {
        this.tier = tier;
        this.transform = transform;
        this.image = image;
    }

    public Tier tier() {
        return tier;
    }

    /** Short transform description, e.g. {@code rot90} or {@code rot0-otsu-inv}. */
    public String transform() {
        return transform;
    }

    public Mat image() {
        return image;
    }

    @Override
    public void close() {
        image.release();
    }

    @Override
    public String toString() {
        return tier + "/" + transform + " (" + image.cols() + "x" + image.rows() + ")";
    }
}
