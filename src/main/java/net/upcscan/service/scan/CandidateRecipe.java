package net.upcscan.service.scan;

import net.upcscan.exception.InvalidCandidateException;
import net.upcscan.model.scan.Candidate;
import net.upcscan.model.scan.Tier;
import net.upcscan.util.image.ImageOps;
import org.opencv.core.CvException;
import org.opencv.core.Mat;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Deferred description of one candidate: rendering happens only when the
 * orchestrator reaches it, so a short-circuit skips the remaining transforms.
 *
 * @param tier tier the candidate belongs to
 * @param transform short transform name used in logs and debug file names
 * @param renderer produces a freshly allocated image, or empty when the transform does not apply
 */
public record CandidateRecipe(Tier tier, String transform, Supplier<Optional<Mat>> renderer) {

    /** Recipe that always yields an image. */
    public static CandidateRecipe of(Tier tier, String transform, Supplier<Mat> renderer) {
        return new CandidateRecipe(tier, transform, () -> Optional.of(renderer.get()));
    }

    /** Recipe whose transform may not apply to the current input. */
    public static CandidateRecipe optional(Tier tier, String transform, Supplier<Optional<Mat>> renderer) {
        return new CandidateRecipe(tier, transform, renderer);
    }

    /**
     * Renders the candidate image.
     *
     * @return the candidate, owning its image, or empty when the transform does not apply
     * @throws InvalidCandidateException when the transform fails or yields a degenerate image
     */
    public Optional<Candidate> render() {
        Optional<Mat> image;
        try {
            image = renderer.get();
        } catch (CvException e) {
            throw new InvalidCandidateException(transform, e.getMessage());
        }
        if (image.isEmpty()) {
            return Optional.empty();
        }
        Mat mat = image.get();
        if (!ImageOps.isUsable(mat)) {
            mat.release();
            throw new InvalidCandidateException(transform, "empty image");
        }
        return Optional.of(new Candidate(tier, transform, mat));
    }
}
