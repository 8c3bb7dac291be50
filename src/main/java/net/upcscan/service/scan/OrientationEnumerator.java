package net.upcscan.service.scan;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rotation candidates, in evaluation order.
 */
@Component
public class OrientationEnumerator {

    private static final List<Integer> CARDINAL = List.of(0, 90, 180, 270);
    private static final List<Integer> DEEP_CARDINAL = List.of(0, 90);
    private static final List<Double> SMALL_ANGLES = List.of(-5.0, -3.0, 3.0, 5.0);

    /** Exact quarter turns, upright first since most captures are near-upright. */
    public List<Integer> cardinal() {
        return CARDINAL;
    }

    /** Cost-capped subset of {@link #cardinal()} used by the deep tier. */
    public List<Integer> deepCardinal() {
        return DEEP_CARDINAL;
    }

    /** Small corrections applied with interpolated rotation and a white border. */
    public List<Double> smallAngles() {
        return SMALL_ANGLES;
    }
}
