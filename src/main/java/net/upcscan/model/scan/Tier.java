package net.upcscan.model.scan;

/**
 * Recovery tiers in the order the orchestrator visits them, cheapest first.
 */
public enum Tier {

    /** Cardinal rotations of the raw grayscale, no binarization. */
    FAST(false),
    /** Cardinal rotations of the contrast-enhanced grayscale. */
    ENHANCED(false),
    /** Fixed global thresholds at 0 degrees. */
    FIXED_THRESHOLD(false),
    /** Small-angle rotations; only reached when the image is judged scannable. */
    ANGLE_CORRECTION(true),
    /** Upscale-and-clean plus deskew on a reduced rotation set. */
    DEEP(true);

    private final boolean gated;

    Tier(boolean gated) {
        this.gated = gated;
    }

    /** Whether this tier runs only when {@link QualityMetrics#scannable()} holds. */
    public boolean isGated() {
        return gated;
    }
}
