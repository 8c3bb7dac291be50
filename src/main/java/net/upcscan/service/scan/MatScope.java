package net.upcscan.service.scan;

import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Owns intermediate images shared by several recipes of one tier and releases
 * them when the tier ends. Not thread-safe; one scope serves one scan thread.
 */
public final class MatScope implements AutoCloseable {

    private final List<Mat> owned = new ArrayList<>();

    /**
     * Memoises an intermediate image. The factory runs at most once, on first use;
     * callers must not release the returned image.
     */
    public Supplier<Mat> share(Supplier<Mat> factory) {
        return lazy(() -> {
            Mat mat = factory.get();
            owned.add(mat);
            return mat;
        });
    }

    /** Memoises any value computed at most once, on first use. */
    public static <T> Supplier<T> lazy(Supplier<T> factory) {
        return new Supplier<>() {
            private boolean computed;
            private T value;

            @Override
            public T get() {
                if (!computed) {
                    value = factory.get();
                    computed = true;
                }
                return value;
            }
        };
    }

    int size() {
        return owned.size();
    }

    @Override
    public void close() {
        owned.forEach(Mat::release);
        owned.clear();
    }
}
