package net.upcscan.model.scan;

import org.opencv.core.Mat;

/**
 * The two grayscale views of one source image that drive a scan.
 *
 * <p>Closing releases both buffers; only the producer of the inputs should close them.</p>
 *
 * @param original plain grayscale conversion
 * @param enhanced contrast-equalized grayscale of the same image
 */
public record ScanInputs(Mat original, Mat enhanced) implements AutoCloseable {

    @Override
    public void close() {
        original.release();
        enhanced.release();
    }
}
