/**
 * Wiring for the scanner's native and external collaborators
 *
 * Features:
 * - Loads the OpenCV native library before any image bean is used
 * - Provides the ZXing-backed symbol decoder
 * - Registers the filesystem debug sink only when debug images are enabled
 * - Meter registry comes from the actuator auto-configuration
 */
package net.upcscan.config;

import net.upcscan.support.debug.DebugSink;
import net.upcscan.support.debug.FileSystemDebugSink;
import net.upcscan.support.decoder.SymbolDecoder;
import net.upcscan.support.decoder.ZxingSymbolDecoder;
import net.upcscan.util.image.OpenCvLoader;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class ScannerConfig {

    public ScannerConfig() {
        OpenCvLoader.ensureLoaded();
    }

    @Bean
    public SymbolDecoder symbolDecoder() {
        return new ZxingSymbolDecoder();
    }

    /**
     * Debug sink writing candidate images to disk
     *
     * @implNote Absent unless upcscan.scanner.debug-enabled=true; the orchestrator
     * receives it as an Optional
     */
    @Bean
    @ConditionalOnProperty(prefix = "upcscan.scanner", name = "debug-enabled", havingValue = "true")
    public DebugSink debugSink(ScannerProperties scannerProperties) {
        return new FileSystemDebugSink(Path.of(scannerProperties.getDebugDirectory()));
    }
}
