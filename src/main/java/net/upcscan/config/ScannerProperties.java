package net.upcscan.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Strongly typed configuration for the barcode recovery pipeline.
 *
 * <p>Pipeline constants (thresholds, angles, quality cut-offs) are fixed in code;
 * only operational knobs are bound here.</p>
 */
@Component
@ConfigurationProperties(prefix = "upcscan.scanner")
public class ScannerProperties {

    /**
     * Whether candidate images are written to {@link #debugDirectory}.
     */
    private boolean debugEnabled = false;

    /**
     * Directory receiving debug candidate images.
     */
    private String debugDirectory = "debug-images";

    /**
     * Wall-clock budget per scan; unset means unbounded.
     */
    private Duration deadline;

    @PostConstruct
    void validate() {
        Assert.isTrue(!debugEnabled || StringUtils.hasText(debugDirectory),
                "upcscan.scanner.debug-directory must be set when debug images are enabled");
        Assert.isTrue(deadline == null || (!deadline.isNegative() && !deadline.isZero()),
                "upcscan.scanner.deadline must be positive when set");
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public void setDebugEnabled(boolean debugEnabled) {
        this.debugEnabled = debugEnabled;
    }

    public String getDebugDirectory() {
        return debugDirectory;
    }

    public void setDebugDirectory(String debugDirectory) {
        this.debugDirectory = debugDirectory;
    }

    public Duration getDeadline() {
        return deadline;
    }

    public void setDeadline(Duration deadline) {
        this.deadline = deadline;
    }
}
