package net.upcscan.exception;

/**
 * Input bytes could not be decoded into an image.
 * RETRYABLE: No (same bytes will fail again)
 *
 * <p>Raised before the recovery pipeline runs; the scan never starts.</p>
 */
public class ImageDecodeException extends RuntimeException {

    /** Creates a decode failure with a human-readable detail. */
    public ImageDecodeException(String message) {
        super(message);
    }

    /** Creates a decode failure wrapping the codec error. */
    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
