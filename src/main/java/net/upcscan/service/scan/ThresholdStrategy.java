package net.upcscan.service.scan;

import net.upcscan.model.scan.Tier;
import net.upcscan.util.image.ImageOps;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Binarization candidates, in priority order.
 *
 * <ol>
 *   <li>fixed global thresholds</li>
 *   <li>automatic (Otsu) threshold, smoothed first when the source was upscaled</li>
 *   <li>horizontal blur followed by the automatic threshold</li>
 *   <li>inversions of the automatic candidates, since decoder polarity is not guaranteed</li>
 * </ol>
 *
 * <p>The unbinarized image itself is the cheaper identity candidate and is produced
 * by the rotation sweeps of the earlier tiers.</p>
 */
@Component
public class ThresholdStrategy {

    static final List<Integer> CHEAP_LEVELS = List.of(140, 160);
    static final List<Integer> DEEP_LEVELS = List.of(140, 160, 180, 120);

    /** Images narrower than this are upscaled before cleaning. */
    static final int UPSCALE_WIDTH_LIMIT = 400;
    static final double UPSCALE_FACTOR = 3.0;

    /**
     * Fixed thresholds used by the cheap tiers.
     *
     * @param source borrowed grayscale; never released here
     */
    public List<CandidateRecipe> fixedThresholds(Tier tier, String prefix, Supplier<Mat> source) {
        return levels(tier, prefix, source, CHEAP_LEVELS);
    }

    /**
     * The deep tier's upscale-and-clean routine: triple-size linear upscale for
     * narrow images, then the full threshold ladder.
     *
     * @param source borrowed grayscale; never released here
     * @param scope owner of the upscaled and smoothed intermediates
     */
    public List<CandidateRecipe> upscaleAndClean(Tier tier, String prefix, Supplier<Mat> source, MatScope scope) {
        Supplier<Boolean> narrow = MatScope.lazy(() -> source.get().cols() < UPSCALE_WIDTH_LIMIT);
        Supplier<Mat> upscaled = scope.share(() -> ImageOps.scale(source.get(), UPSCALE_FACTOR, Imgproc.INTER_LINEAR));
        Supplier<Mat> prepared = () -> narrow.get() ? upscaled.get() : source.get();
        // smoothing only pays off against interpolation artifacts
        Supplier<Mat> upscaledSmoothed = scope.share(() -> ImageOps.smooth(upscaled.get()));
        Supplier<Mat> smoothed = () -> narrow.get() ? upscaledSmoothed.get() : source.get();
        Supplier<Mat> blurred = scope.share(() -> ImageOps.horizontalBlur(prepared.get()));

        String stem = prefix + "-clean";
        List<CandidateRecipe> recipes = new ArrayList<>(levels(tier, stem, prepared, DEEP_LEVELS));
        recipes.add(CandidateRecipe.of(tier, stem + "-otsu", () -> ImageOps.otsu(smoothed.get())));
        recipes.add(CandidateRecipe.of(tier, stem + "-hblur-otsu", () -> ImageOps.otsu(blurred.get())));
        recipes.add(CandidateRecipe.of(tier, stem + "-otsu-inv", () -> inverted(smoothed.get(), ImageOps::otsu)));
        recipes.add(CandidateRecipe.of(tier, stem + "-hblur-otsu-inv", () -> inverted(blurred.get(), ImageOps::otsu)));
        return recipes;
    }

    private static List<CandidateRecipe> levels(Tier tier, String prefix, Supplier<Mat> source, List<Integer> levels) {
        List<CandidateRecipe> recipes = new ArrayList<>(levels.size());
        for (int level : levels) {
            recipes.add(CandidateRecipe.of(tier, prefix + "-t" + level, () -> ImageOps.threshold(source.get(), level)));
        }
        return recipes;
    }

    private static Mat inverted(Mat source, UnaryOperator<Mat> binarize) {
        Mat binary = binarize.apply(source);
        try {
            return ImageOps.invert(binary);
        } finally {
            binary.release();
        }
    }
}
