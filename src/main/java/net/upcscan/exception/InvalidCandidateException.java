package net.upcscan.exception;

/**
 * A transform produced a degenerate image (empty buffer, zero width or height).
 *
 * <p>Fatal for the single candidate only: the orchestrator skips it and moves on
 * to the next candidate of the tier.</p>
 */
public class InvalidCandidateException extends RuntimeException {

    private final String transform;

    public InvalidCandidateException(String transform, String detail) {
        super("Transform '" + transform + "' produced an unusable image: " + detail);
        this.transform = transform;
    }

    /** Name of the transform that failed. */
    public String getTransform() {
        return transform;
    }
}
