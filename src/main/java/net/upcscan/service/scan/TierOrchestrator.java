package net.upcscan.service.scan;

import net.upcscan.config.ScannerProperties;
import net.upcscan.exception.InvalidCandidateException;
import net.upcscan.model.scan.Candidate;
import net.upcscan.model.scan.DecodeHit;
import net.upcscan.model.scan.QualityMetrics;
import net.upcscan.model.scan.ScanInputs;
import net.upcscan.model.scan.ScanResult;
import net.upcscan.model.scan.Symbology;
import net.upcscan.model.scan.Tier;
import net.upcscan.support.deadline.ScanDeadline;
import net.upcscan.support.debug.DebugSink;
import net.upcscan.support.decoder.SymbolDecoder;
import net.upcscan.util.image.ImageOps;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Drives a scan through tiers of increasing cost until a main symbol is decoded.
 *
 * <p>Tier order: FAST, ENHANCED, FIXED_THRESHOLD, then the gated tiers
 * ANGLE_CORRECTION and DEEP, which only run when the original image is judged
 * scannable. Each tier is a list of candidate recipes tried in order; the first
 * decode call that yields a main symbol ends the scan.</p>
 *
 * <p>Stateless between scans. Independent scans may run concurrently on separate
 * threads; the inputs are only read.</p>
 */
@Service
public class TierOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(TierOrchestrator.class);

    /**
     * One tier of the pipeline: its identity and the recipes it contributes.
     */
    record TierStep(Tier tier, BiFunction<ScanInputs, MatScope, List<CandidateRecipe>> planner) {

        List<CandidateRecipe> plan(ScanInputs inputs, MatScope scope) {
            return planner.apply(inputs, scope);
        }
    }

    private final QualityAssessor qualityAssessor;
    private final OrientationEnumerator orientationEnumerator;
    private final ThresholdStrategy thresholdStrategy;
    private final DeskewEstimator deskewEstimator;
    private final ResultAggregator resultAggregator;
    private final SymbolDecoder symbolDecoder;
    private final Optional<DebugSink> debugSink;
    private final ScannerProperties scannerProperties;
    private final List<TierStep> steps;

    public TierOrchestrator(QualityAssessor qualityAssessor,
                            OrientationEnumerator orientationEnumerator,
                            ThresholdStrategy thresholdStrategy,
                            DeskewEstimator deskewEstimator,
                            ResultAggregator resultAggregator,
                            SymbolDecoder symbolDecoder,
                            Optional<DebugSink> debugSink,
                            ScannerProperties scannerProperties) {
        this.qualityAssessor = qualityAssessor;
        this.orientationEnumerator = orientationEnumerator;
        this.thresholdStrategy = thresholdStrategy;
        this.deskewEstimator = deskewEstimator;
        this.resultAggregator = resultAggregator;
        this.symbolDecoder = symbolDecoder;
        this.debugSink = debugSink;
        this.scannerProperties = scannerProperties;
        this.steps = List.of(
                new TierStep(Tier.FAST, (inputs, scope) -> cardinalSweep(Tier.FAST, inputs::original)),
                new TierStep(Tier.ENHANCED, (inputs, scope) -> cardinalSweep(Tier.ENHANCED, inputs::enhanced)),
                new TierStep(Tier.FIXED_THRESHOLD, (inputs, scope) ->
                        thresholdStrategy.fixedThresholds(Tier.FIXED_THRESHOLD, "rot0", inputs::original)),
                new TierStep(Tier.ANGLE_CORRECTION, (inputs, scope) -> smallAngleSweep(inputs::original)),
                new TierStep(Tier.DEEP, this::deepPlan));
    }

    /**
     * Scans with the configured deadline, if any.
     *
     * @param original plain grayscale of the source image
     * @param enhanced contrast-enhanced grayscale of the same image
     * @return the decoded codes, or a "not found" result
     */
    public ScanResult scan(Mat original, Mat enhanced) {
        ScanDeadline deadline = scannerProperties.getDeadline() == null
                ? ScanDeadline.none()
                : ScanDeadline.after(scannerProperties.getDeadline());
        return scan(original, enhanced, deadline);
    }

    /**
     * Scans within an explicit deadline. An expired deadline ends the scan with a
     * "not found" result.
     *
     * @throws IllegalArgumentException when either image is missing, empty or not CV_8UC1
     */
    public ScanResult scan(Mat original, Mat enhanced, ScanDeadline deadline) {
        if (!ImageOps.isUsable(original) || !ImageOps.isUsable(enhanced)) {
            throw new IllegalArgumentException("Both original and enhanced images are required");
        }
        if (original.type() != CvType.CV_8UC1 || enhanced.type() != CvType.CV_8UC1) {
            throw new IllegalArgumentException("Expected single-channel 8-bit images, got "
                    + CvType.typeToString(original.type()) + " and " + CvType.typeToString(enhanced.type()));
        }
        ScanInputs inputs = new ScanInputs(original, enhanced);
        String scanId = UUID.randomUUID().toString().substring(0, 8);

        QualityMetrics quality = qualityAssessor.assess(original);
        logger.debug("Scan {}: {}x{} sharpness={} contrast={} edgeDensity={} scannable={}",
                scanId, original.cols(), original.rows(),
                String.format("%.1f", quality.sharpness()), String.format("%.1f", quality.contrast()),
                String.format("%.4f", quality.edgeDensity()), quality.scannable());

        ResultAggregator.Aggregate aggregate = ResultAggregator.Aggregate.EMPTY;
        int attempts = 0;
        int sequence = 0;

        for (TierStep step : steps) {
            if (deadline.isExpired()) {
                return expired(scanId, step.tier(), attempts);
            }
            if (step.tier().isGated() && !quality.scannable()) {
                logger.info("Scan {}: image judged unscannable (sharpness={}, contrast={}, edgeDensity={}); skipping {} and later tiers after {} attempts.",
                        scanId, String.format("%.1f", quality.sharpness()), String.format("%.1f", quality.contrast()),
                        String.format("%.4f", quality.edgeDensity()), step.tier(), attempts);
                return ScanResult.notFound(attempts);
            }

            logger.debug("Scan {}: entering tier {}", scanId, step.tier());
            try (MatScope scope = new MatScope()) {
                for (CandidateRecipe recipe : step.plan(inputs, scope)) {
                    if (deadline.isExpired()) {
                        return expired(scanId, step.tier(), attempts);
                    }
                    Optional<Candidate> rendered = render(scanId, recipe);
                    if (rendered.isEmpty()) {
                        continue;
                    }
                    try (Candidate candidate = rendered.get()) {
                        publish(scanId, ++sequence, candidate);
                        List<DecodeHit> hits = symbolDecoder.decode(candidate.image(), Symbology.RETAIL);
                        attempts++;
                        aggregate = resultAggregator.merge(aggregate, resultAggregator.classify(hits));
                        if (aggregate.hasMain()) {
                            logger.info("Scan {}: decoded {}{} at {} via {} after {} attempts.",
                                    scanId, aggregate.main(),
                                    aggregate.extension() != null ? " +" + aggregate.extension() : "",
                                    step.tier(), candidate.transform(), attempts);
                            return resultAggregator.toResult(aggregate, step.tier(), attempts);
                        }
                    }
                }
            }
        }

        logger.info("Scan {}: no barcode found after {} attempts across all tiers.", scanId, attempts);
        return ScanResult.notFound(attempts);
    }

    private Optional<Candidate> render(String scanId, CandidateRecipe recipe) {
        try {
            return recipe.render();
        } catch (InvalidCandidateException e) {
            logger.warn("Scan {}: skipping candidate {}/{}: {}", scanId, recipe.tier(), recipe.transform(), e.getMessage());
            return Optional.empty();
        }
    }

    private void publish(String scanId, int sequence, Candidate candidate) {
        if (debugSink.isEmpty()) {
            return;
        }
        try {
            debugSink.get().accept(scanId, sequence, candidate);
        } catch (RuntimeException e) {
            logger.warn("Scan {}: debug sink failed for {}: {}", scanId, candidate, e.getMessage());
        }
    }

    private ScanResult expired(String scanId, Tier tier, int attempts) {
        logger.warn("Scan {}: deadline expired in tier {} after {} attempts; giving up.", scanId, tier, attempts);
        return ScanResult.notFound(attempts);
    }

    private List<CandidateRecipe> cardinalSweep(Tier tier, Supplier<Mat> source) {
        List<CandidateRecipe> recipes = new ArrayList<>();
        for (int degrees : orientationEnumerator.cardinal()) {
            recipes.add(CandidateRecipe.of(tier, "rot" + degrees,
                    () -> ImageOps.rotateCardinal(source.get(), degrees)));
        }
        return recipes;
    }

    private List<CandidateRecipe> smallAngleSweep(Supplier<Mat> source) {
        List<CandidateRecipe> recipes = new ArrayList<>();
        for (double degrees : orientationEnumerator.smallAngles()) {
            recipes.add(CandidateRecipe.of(Tier.ANGLE_CORRECTION, "rot" + (int) degrees,
                    () -> ImageOps.rotateFilled(source.get(), degrees, ImageOps.WHITE)));
        }
        return recipes;
    }

    /**
     * Per deep rotation: the upscale-and-clean ladder, then the deskewed image and
     * its inversion when a correctable skew is detected.
     */
    private List<CandidateRecipe> deepPlan(ScanInputs inputs, MatScope scope) {
        List<CandidateRecipe> recipes = new ArrayList<>();
        for (int degrees : orientationEnumerator.deepCardinal()) {
            String prefix = "rot" + degrees;
            Supplier<Mat> rotated = scope.share(() -> ImageOps.rotateCardinal(inputs.original(), degrees));
            recipes.addAll(thresholdStrategy.upscaleAndClean(Tier.DEEP, prefix, rotated, scope));

            Supplier<Optional<Double>> skew = MatScope.lazy(() -> deskewEstimator.estimate(rotated.get()));
            Supplier<Mat> deskewed = scope.share(() ->
                    ImageOps.rotateReplicated(rotated.get(), -skew.get().orElseThrow()));
            recipes.add(CandidateRecipe.optional(Tier.DEEP, prefix + "-deskew",
                    () -> skew.get().map(angle -> deskewed.get().clone())));
            recipes.add(CandidateRecipe.optional(Tier.DEEP, prefix + "-deskew-inv",
                    () -> skew.get().map(angle -> ImageOps.invert(deskewed.get()))));
        }
        return recipes;
    }
}
