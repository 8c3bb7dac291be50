package net.upcscan.service.scan;

import jakarta.annotation.Nullable;
import net.upcscan.model.scan.DecodeHit;
import net.upcscan.model.scan.ScanResult;
import net.upcscan.model.scan.Symbology;
import net.upcscan.model.scan.Tier;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Sorts decoder hits into the main product code and the EAN-5 extension.
 *
 * <p>No checksum re-verification happens here; the decoder is trusted.</p>
 */
@Component
public class ResultAggregator {

    /**
     * Main and extension payloads gathered so far in a scan.
     */
    public record Aggregate(@Nullable String main, @Nullable String extension) {

        public static final Aggregate EMPTY = new Aggregate(null, null);

        public boolean hasMain() {
            return main != null;
        }
    }

    /**
     * Classifies the hits of one decoder invocation. The first primary hit wins when
     * several are reported; likewise for EAN-5.
     */
    public Aggregate classify(List<DecodeHit> hits) {
        String main = null;
        String extension = null;
        for (DecodeHit hit : hits) {
            if (hit.symbology().isPrimary()) {
                if (main == null) {
                    main = hit.payload();
                }
            } else if (hit.symbology() == Symbology.EAN5 && extension == null) {
                extension = hit.payload();
            }
        }
        return new Aggregate(main, extension);
    }

    /**
     * Folds a newer aggregate into the running one. An extension, once seen, is kept.
     */
    public Aggregate merge(Aggregate running, Aggregate latest) {
        String main = latest.main() != null ? latest.main() : running.main();
        String extension = running.extension() != null ? running.extension() : latest.extension();
        return new Aggregate(main, extension);
    }

    /**
     * Packages the aggregate as the scan outcome; without a main code the result is
     * "not found" and any stray extension is dropped.
     */
    public ScanResult toResult(Aggregate aggregate, @Nullable Tier tier, int attempts) {
        if (!aggregate.hasMain() || tier == null) {
            return ScanResult.notFound(attempts);
        }
        return ScanResult.found(aggregate.main(), aggregate.extension(), tier, attempts);
    }
}
