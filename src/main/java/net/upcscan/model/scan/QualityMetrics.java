package net.upcscan.model.scan;

/**
 * Image quality scores computed once per scan from the original grayscale.
 *
 * @param sharpness variance of the Laplacian response
 * @param contrast standard deviation of pixel intensities
 * @param edgeDensity fraction of pixels marked as edges
 * @param scannable whether all three scores clear their cut-offs
 */
public record QualityMetrics(double sharpness, double contrast, double edgeDensity, boolean scannable) {

    static final double MIN_SHARPNESS = 50.0;
    static final double MIN_CONTRAST = 20.0;
    static final double MIN_EDGE_DENSITY = 0.01;

    /**
     * Builds metrics with {@code scannable} derived from the fixed cut-offs.
     */
    public static QualityMetrics of(double sharpness, double contrast, double edgeDensity) {
        boolean scannable = sharpness > MIN_SHARPNESS
                && contrast > MIN_CONTRAST
                && edgeDensity > MIN_EDGE_DENSITY;
        return new QualityMetrics(sharpness, contrast, edgeDensity, scannable);
    }
}
