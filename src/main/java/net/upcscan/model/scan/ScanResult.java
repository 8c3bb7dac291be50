package net.upcscan.model.scan;

import jakarta.annotation.Nullable;

import java.util.Optional;

/**
 * Outcome of one scan.
 *
 * <p>{@code main} and {@code extension} are set independently; a result without a
 * {@code main} is the "not found" terminal state and carries no extension either.</p>
 *
 * @param main the UPC-A/UPC-E/EAN-13 payload, or null when nothing was recognised
 * @param extension the EAN-5 add-on payload, or null
 * @param decodedAt the tier whose candidate produced {@code main}, or null
 * @param attempts number of decoder invocations spent on the scan
 */
public record ScanResult(@Nullable String main,
                         @Nullable String extension,
                         @Nullable Tier decodedAt,
                         int attempts) {

    public static ScanResult found(String main, @Nullable String extension, Tier decodedAt, int attempts) {
        return new ScanResult(main, extension, decodedAt, attempts);
    }

    public static ScanResult notFound(int attempts) {
        return new ScanResult(null, null, null, attempts);
    }

    public boolean isFound() {
        return main != null;
    }

    public Optional<String> mainCode() {
        return Optional.ofNullable(main);
    }

    public Optional<String> extensionCode() {
        return Optional.ofNullable(extension);
    }
}
