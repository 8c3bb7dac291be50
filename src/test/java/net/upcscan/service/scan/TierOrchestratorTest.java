package net.upcscan.service.scan;

import net.upcscan.config.ScannerProperties;
import net.upcscan.model.scan.DecodeHit;
import net.upcscan.model.scan.ScanInputs;
import net.upcscan.model.scan.ScanResult;
import net.upcscan.model.scan.Symbology;
import net.upcscan.model.scan.Tier;
import net.upcscan.service.image.ImagePreprocessor;
import net.upcscan.support.deadline.ScanDeadline;
import net.upcscan.support.debug.DebugSink;
import net.upcscan.support.decoder.SymbolDecoder;
import net.upcscan.support.decoder.ZxingSymbolDecoder;
import net.upcscan.testutil.SyntheticBarcodes;
import net.upcscan.util.image.ImageOps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TierOrchestratorTest {

    private final ImagePreprocessor preprocessor = new ImagePreprocessor();
    private DeskewEstimator deskewEstimator;

    @BeforeEach
    void setUp() {
        deskewEstimator = mock(DeskewEstimator.class);
        when(deskewEstimator.estimate(any(Mat.class))).thenReturn(Optional.empty());
    }

    @Test
    void should_DecodeAtFastTier_When_BarcodeIsUpright() {
        Mat image = SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150);

        ScanResult result = scan(orchestrator(new ZxingSymbolDecoder()), image);

        assertThat(result.main()).isEqualTo(SyntheticBarcodes.EAN13);
        assertThat(result.extension()).isNull();
        assertThat(result.decodedAt()).isEqualTo(Tier.FAST);
        assertThat(result.attempts()).isEqualTo(1);
    }

    @ParameterizedTest
    @ValueSource(ints = {90, 180, 270})
    void should_DecodeAtFastTier_When_BarcodeIsRotatedByQuarterTurns(int degrees) {
        Mat image = ImageOps.rotateCardinal(SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150), degrees);

        ScanResult result = scan(orchestrator(new ZxingSymbolDecoder()), image);

        assertThat(result.main()).isEqualTo(SyntheticBarcodes.EAN13);
        assertThat(result.decodedAt()).isEqualTo(Tier.FAST);
        assertThat(result.attempts()).isBetween(1, 4);
    }

    @Test
    void should_ReportExtension_When_AddOnIsPrinted() {
        Mat image = SyntheticBarcodes.barcodeWithAddOn(SyntheticBarcodes.UPCA, SyntheticBarcodes.EAN5, 3, 150);

        ScanResult result = scan(orchestrator(new ZxingSymbolDecoder()), image);

        assertThat(result.main()).isEqualTo(SyntheticBarcodes.UPCA);
        assertThat(result.extension()).isEqualTo(SyntheticBarcodes.EAN5);
        assertThat(result.decodedAt()).isEqualTo(Tier.FAST);
    }

    @Test
    void should_LeaveExtensionEmpty_When_OnlyMainSymbolIsPrinted() {
        Mat image = SyntheticBarcodes.barcode(SyntheticBarcodes.UPCA, 3, 150);

        ScanResult result = scan(orchestrator(new ZxingSymbolDecoder()), image);

        assertThat(result.main()).isEqualTo(SyntheticBarcodes.UPCA);
        assertThat(result.extensionCode()).isEmpty();
    }

    @Test
    void should_StopAfterCheapTiers_When_ImageIsUnscannable() {
        ZxingSymbolDecoder decoder = spy(new ZxingSymbolDecoder());
        Mat image = SyntheticBarcodes.blurredPhoto(SyntheticBarcodes.EAN13);

        ScanResult result = scan(orchestrator(decoder), image);

        assertThat(result.isFound()).isFalse();
        assertThat(result.decodedAt()).isNull();
        assertThat(result.attempts()).isEqualTo(10);
        verify(decoder, times(10)).decode(any(Mat.class), anySet());
        verify(deskewEstimator, never()).estimate(any(Mat.class));
    }

    @Test
    void should_RunEveryTier_When_ScannableImageNeverDecodes() {
        CountingDecoder decoder = new CountingDecoder(image -> false);
        Mat image = SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150);

        ScanResult result = scan(orchestrator(decoder), image);

        // 4 FAST + 4 ENHANCED + 2 FIXED_THRESHOLD + 4 ANGLE_CORRECTION + 2 x 8 DEEP
        assertThat(result.isFound()).isFalse();
        assertThat(result.attempts()).isEqualTo(30);
        assertThat(decoder.calls()).isEqualTo(30);
    }

    @Test
    void should_DecodeDeskewedCandidateAtDeepTier_When_SkewIsDetected() {
        Mat skewed = SyntheticBarcodes.skewed(SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150, 60), 7.0);
        when(deskewEstimator.estimate(any(Mat.class))).thenReturn(Optional.of(7.0));
        Mat expected = ImageOps.rotateReplicated(skewed, -7.0);
        CountingDecoder decoder = new CountingDecoder(image -> sameImage(image, expected));

        ScanResult result = scan(orchestrator(decoder), skewed);

        // 4 + 4 + 2 + 4 before DEEP, then the 8-step clean ladder for rot0
        assertThat(result.main()).isEqualTo(SyntheticBarcodes.EAN13);
        assertThat(result.decodedAt()).isEqualTo(Tier.DEEP);
        assertThat(result.attempts()).isEqualTo(23);
    }

    @Test
    void should_SweepEnhancedImage_When_EnhancedTierRuns() {
        Mat original = SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150);
        Mat enhanced = ImageOps.invert(original);
        Mat expected = ImageOps.rotateCardinal(enhanced, 90);
        CountingDecoder decoder = new CountingDecoder(image -> sameImage(image, expected));

        ScanResult result = orchestrator(decoder).scan(original, enhanced);

        // 4 FAST on the original, then ENHANCED rot0 and rot90
        assertThat(result.decodedAt()).isEqualTo(Tier.ENHANCED);
        assertThat(result.attempts()).isEqualTo(6);
    }

    @Test
    void should_RotateOriginalWithWhiteFill_When_AngleCorrectionRuns() {
        Mat original = SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150);
        Mat enhanced = ImageOps.invert(original);
        Mat expected = ImageOps.rotateFilled(original, -3.0, ImageOps.WHITE);
        CountingDecoder decoder = new CountingDecoder(image -> sameImage(image, expected));

        ScanResult result = orchestrator(decoder).scan(original, enhanced);

        // 4 FAST + 4 ENHANCED + 2 FIXED_THRESHOLD, then -5 and -3 degrees
        assertThat(result.main()).isEqualTo(SyntheticBarcodes.EAN13);
        assertThat(result.decodedAt()).isEqualTo(Tier.ANGLE_CORRECTION);
        assertThat(result.attempts()).isEqualTo(12);
    }

    @Test
    void should_EstimateSkewOncePerDeepRotation() {
        DeskewEstimator estimator = spy(new DeskewEstimator());
        TierOrchestrator orchestrator = new TierOrchestrator(new QualityAssessor(), new OrientationEnumerator(),
                new ThresholdStrategy(), estimator, new ResultAggregator(), new CountingDecoder(image -> false),
                Optional.empty(), new ScannerProperties());

        scan(orchestrator, SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150));

        verify(estimator, times(2)).estimate(any(Mat.class));
    }

    @Test
    void should_RejectImagesThatAreNotSingleChannel8Bit() {
        TierOrchestrator orchestrator = orchestrator(new CountingDecoder(image -> true));
        Mat gray = SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150);
        Mat colour = SyntheticBarcodes.toBgr(gray);
        Mat wide = new Mat();
        gray.convertTo(wide, CvType.CV_16UC1);

        assertThatThrownBy(() -> orchestrator.scan(colour, gray))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CV_8UC3");
        assertThatThrownBy(() -> orchestrator.scan(gray, wide))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_SkipInvalidCandidateAndContinue() {
        ThresholdStrategy withBrokenCandidate = new ThresholdStrategy() {
            @Override
            public List<CandidateRecipe> fixedThresholds(Tier tier, String prefix, Supplier<Mat> source) {
                List<CandidateRecipe> recipes = new ArrayList<>();
                recipes.add(CandidateRecipe.of(tier, prefix + "-broken", Mat::new));
                recipes.addAll(super.fixedThresholds(tier, prefix, source));
                return recipes;
            }
        };
        CountingDecoder decoder = new CountingDecoder(image -> false);
        TierOrchestrator orchestrator = new TierOrchestrator(new QualityAssessor(), new OrientationEnumerator(),
                withBrokenCandidate, deskewEstimator, new ResultAggregator(), decoder,
                Optional.empty(), new ScannerProperties());

        ScanResult result = scan(orchestrator, SyntheticBarcodes.blurredPhoto(SyntheticBarcodes.EAN13));

        assertThat(result.isFound()).isFalse();
        assertThat(result.attempts()).isEqualTo(10);
    }

    @Test
    void should_ReturnNotFoundWithoutDecoding_When_DeadlineAlreadyExpired() {
        MutableClock clock = new MutableClock();
        ScanDeadline deadline = ScanDeadline.after(Duration.ofSeconds(1), clock);
        clock.advance(Duration.ofSeconds(2));
        CountingDecoder decoder = new CountingDecoder(image -> true);
        Mat image = SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150);

        ScanResult result;
        try (ScanInputs inputs = preprocessor.prepare(image)) {
            result = orchestrator(decoder).scan(inputs.original(), inputs.enhanced(), deadline);
        }

        assertThat(result).isEqualTo(ScanResult.notFound(0));
        assertThat(decoder.calls()).isZero();
    }

    @Test
    void should_StopMidTier_When_DeadlineExpiresDuringScan() {
        MutableClock clock = new MutableClock();
        ScanDeadline deadline = ScanDeadline.after(Duration.ofSeconds(1), clock);
        CountingDecoder decoder = new CountingDecoder(image -> {
            clock.advance(Duration.ofSeconds(5));
            return false;
        });
        Mat image = SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150);

        ScanResult result;
        try (ScanInputs inputs = preprocessor.prepare(image)) {
            result = orchestrator(decoder).scan(inputs.original(), inputs.enhanced(), deadline);
        }

        assertThat(result.isFound()).isFalse();
        assertThat(result.attempts()).isEqualTo(1);
    }

    @Test
    void should_ReturnSameResult_When_ScanningSameImageTwice() {
        TierOrchestrator orchestrator = orchestrator(new ZxingSymbolDecoder());
        Mat image = SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150);

        assertThat(scan(orchestrator, image)).isEqualTo(scan(orchestrator, image));
    }

    @Test
    void should_LeaveInputsUntouched() {
        Mat image = SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150);
        try (ScanInputs inputs = preprocessor.prepare(image)) {
            Mat originalCopy = inputs.original().clone();
            Mat enhancedCopy = inputs.enhanced().clone();

            orchestrator(new CountingDecoder(candidate -> false)).scan(inputs.original(), inputs.enhanced());

            assertThat(Core.norm(inputs.original(), originalCopy, Core.NORM_INF)).isZero();
            assertThat(Core.norm(inputs.enhanced(), enhancedCopy, Core.NORM_INF)).isZero();
        }
    }

    @Test
    void should_RejectMissingImages() {
        TierOrchestrator orchestrator = orchestrator(new ZxingSymbolDecoder());
        Mat image = SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150);

        assertThatThrownBy(() -> orchestrator.scan(image, new Mat()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> orchestrator.scan(null, image))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_PublishEveryCandidateInOrder_When_DebugSinkPresent() {
        List<String> published = new ArrayList<>();
        DebugSink sink = (scanId, sequence, candidate) ->
                published.add(sequence + ":" + candidate.tier() + "/" + candidate.transform());
        TierOrchestrator orchestrator = new TierOrchestrator(new QualityAssessor(), new OrientationEnumerator(),
                new ThresholdStrategy(), deskewEstimator, new ResultAggregator(),
                new CountingDecoder(image -> false), Optional.of(sink), new ScannerProperties());

        scan(orchestrator, SyntheticBarcodes.blurredPhoto(SyntheticBarcodes.EAN13));

        assertThat(published).containsExactly(
                "1:FAST/rot0", "2:FAST/rot90", "3:FAST/rot180", "4:FAST/rot270",
                "5:ENHANCED/rot0", "6:ENHANCED/rot90", "7:ENHANCED/rot180", "8:ENHANCED/rot270",
                "9:FIXED_THRESHOLD/rot0-t140", "10:FIXED_THRESHOLD/rot0-t160");
    }

    @Test
    void should_IgnoreDebugSinkFailures() {
        DebugSink failing = (scanId, sequence, candidate) -> {
            throw new IllegalStateException("disk full");
        };
        TierOrchestrator orchestrator = new TierOrchestrator(new QualityAssessor(), new OrientationEnumerator(),
                new ThresholdStrategy(), deskewEstimator, new ResultAggregator(),
                new ZxingSymbolDecoder(), Optional.of(failing), new ScannerProperties());
        Mat image = SyntheticBarcodes.barcode(SyntheticBarcodes.EAN13, 3, 150);

        ScanResult result = scan(orchestrator, image);

        assertThat(result).isEqualTo(scan(orchestrator(new ZxingSymbolDecoder()), image));
    }

    private TierOrchestrator orchestrator(SymbolDecoder decoder) {
        return new TierOrchestrator(new QualityAssessor(), new OrientationEnumerator(), new ThresholdStrategy(),
                deskewEstimator, new ResultAggregator(), decoder, Optional.empty(), new ScannerProperties());
    }

    private ScanResult scan(TierOrchestrator orchestrator, Mat image) {
        try (ScanInputs inputs = preprocessor.prepare(image)) {
            return orchestrator.scan(inputs.original(), inputs.enhanced());
        }
    }

    private static boolean sameImage(Mat candidate, Mat expected) {
        return candidate.size().equals(expected.size())
                && candidate.type() == expected.type()
                && Core.norm(candidate, expected, Core.NORM_INF) == 0;
    }

    /** Decoder that reports an EAN-13 hit whenever the predicate accepts the candidate. */
    private static final class CountingDecoder implements SymbolDecoder {

        private final Predicate<Mat> matches;
        private final AtomicInteger calls = new AtomicInteger();

        CountingDecoder(Predicate<Mat> matches) {
            this.matches = matches;
        }

        @Override
        public List<DecodeHit> decode(Mat image, Set<Symbology> allowed) {
            calls.incrementAndGet();
            return matches.test(image)
                    ? List.of(new DecodeHit(Symbology.EAN13, SyntheticBarcodes.EAN13))
                    : List.of();
        }

        int calls() {
            return calls.get();
        }
    }

    private static final class MutableClock extends Clock {

        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
