package net.upcscan.support.debug;

import net.upcscan.model.scan.Candidate;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes candidate images as PNG files for offline inspection.
 *
 * <p>File names follow {@code <scanId>-<seq>-<tier>-<transform>.png}.</p>
 */
public class FileSystemDebugSink implements DebugSink {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemDebugSink.class);

    private final Path directory;

    /**
     * @param directory target directory, created if missing
     * @throws UncheckedIOException when the directory cannot be created
     */
    public FileSystemDebugSink(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create debug image directory " + this.directory, e);
        }
        logger.info("Debug candidate images will be written to {}", this.directory);
    }

    @Override
    public void accept(String scanId, int sequence, Candidate candidate) {
        Path target = directory.resolve(fileName(scanId, sequence, candidate));
        boolean written = Imgcodecs.imwrite(target.toString(), candidate.image());
        if (!written) {
            logger.warn("Failed to write debug image {} for {}", target, candidate);
        }
    }

    static String fileName(String scanId, int sequence, Candidate candidate) {
        return String.format(Locale.ROOT, "%s-%03d-%s-%s.png",
                scanId, sequence, candidate.tier().name().toLowerCase(Locale.ROOT), candidate.transform());
    }

    public Path getDirectory() {
        return directory;
    }
}
