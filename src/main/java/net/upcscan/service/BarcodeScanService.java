package net.upcscan.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.upcscan.exception.ImageDecodeException;
import net.upcscan.model.scan.ScanInputs;
import net.upcscan.model.scan.ScanResult;
import net.upcscan.service.image.ImageDecoder;
import net.upcscan.service.image.ImagePreprocessor;
import net.upcscan.service.scan.TierOrchestrator;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Byte-level entry point: decodes an uploaded photo, prepares its grayscale views
 * and runs the tiered recovery pipeline.
 *
 * <p>Owns the native buffers of each scan and records scan metrics.</p>
 */
@Service
public class BarcodeScanService {

    private static final Logger logger = LoggerFactory.getLogger(BarcodeScanService.class);

    private final ImageDecoder imageDecoder;
    private final ImagePreprocessor imagePreprocessor;
    private final TierOrchestrator tierOrchestrator;
    private final MeterRegistry meterRegistry;

    private final Counter scanRequests;
    private final Counter scansNotFound;
    private final Timer scanDuration;

    public BarcodeScanService(ImageDecoder imageDecoder,
                              ImagePreprocessor imagePreprocessor,
                              TierOrchestrator tierOrchestrator,
                              MeterRegistry meterRegistry) {
        this.imageDecoder = imageDecoder;
        this.imagePreprocessor = imagePreprocessor;
        this.tierOrchestrator = tierOrchestrator;
        this.meterRegistry = meterRegistry;

        this.scanRequests = meterRegistry.counter("barcode.scan.requests");
        this.scansNotFound = meterRegistry.counter("barcode.scan.not_found");
        this.scanDuration = meterRegistry.timer("barcode.scan.duration");
    }

    /**
     * Scans an encoded product photo for a UPC/EAN code and optional EAN-5 add-on.
     *
     * @param imageBytes encoded image (JPEG, PNG, ...)
     * @return decoded codes, or a "not found" result
     * @throws ImageDecodeException when the bytes are not a readable image
     */
    public ScanResult scan(byte[] imageBytes) {
        scanRequests.increment();
        Mat decoded = imageDecoder.decode(imageBytes);
        long started = System.nanoTime();
        try (ScanInputs inputs = imagePreprocessor.prepare(decoded)) {
            ScanResult result = tierOrchestrator.scan(inputs.original(), inputs.enhanced());
            record(result);
            return result;
        } finally {
            decoded.release();
            long elapsedNanos = System.nanoTime() - started;
            scanDuration.record(elapsedNanos, TimeUnit.NANOSECONDS);
            logger.debug("Scan of {} bytes finished in {} ms", imageBytes.length, elapsedNanos / 1_000_000);
        }
    }

    private void record(ScanResult result) {
        if (result.isFound()) {
            meterRegistry.counter("barcode.scan.found", "tier", result.decodedAt().name()).increment();
        } else {
            scansNotFound.increment();
        }
    }
}
