package net.upcscan.support.deadline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Upper bound on the wall-clock time one scan may spend.
 *
 * <p>The orchestrator polls {@link #isExpired()} between tiers and before every
 * candidate; an expired scan ends with a "not found" result.</p>
 */
public final class ScanDeadline {

    private static final ScanDeadline NONE = new ScanDeadline(null, null);

    private final Clock clock;
    private final Instant expiresAt;

    private ScanDeadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    /** A deadline that never expires. */
    public static ScanDeadline none() {
        return NONE;
    }

    /** A deadline {@code budget} from now on the system UTC clock. */
    public static ScanDeadline after(Duration budget) {
        return after(budget, Clock.systemUTC());
    }

    /**
     * A deadline {@code budget} from now on the given clock.
     *
     * @throws IllegalArgumentException when the budget is null, zero or negative
     */
    public static ScanDeadline after(Duration budget, Clock clock) {
        if (budget == null || budget.isZero() || budget.isNegative()) {
            throw new IllegalArgumentException("Scan budget must be positive, got " + budget);
        }
        return new ScanDeadline(clock, clock.instant().plus(budget));
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    public boolean isBounded() {
        return expiresAt != null;
    }

    @Override
    public String toString() {
        return expiresAt == null ? "ScanDeadline[none]" : "ScanDeadline[" + expiresAt + "]";
    }
}
