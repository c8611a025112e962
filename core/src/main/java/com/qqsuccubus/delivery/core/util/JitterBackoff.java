package com.qqsuccubus.delivery.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Capped exponential backoff with optional jitter, used for retransmission timers.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 */
public final class JitterBackoff {
    // 2^30 * base already exceeds any sane cap
    private static final int MAX_EXPONENT = 30;

    private JitterBackoff() {
    }

    /**
     * Computes the delay before the next attempt.
     *
     * @param attempt   Attempts already made (0-based)
     * @param base      Delay for attempt 0
     * @param max       Cap applied before jitter
     * @param jitterMax Upper bound of the random component, {@link Duration#ZERO} for none
     * @return Delay to wait
     */
    public static Duration next(int attempt, Duration base, Duration max, Duration jitterMax) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        long baseMs = base.toMillis();
        long capMs = max.toMillis();
        int exponent = Math.min(attempt, MAX_EXPONENT);

        long expMs;
        if (baseMs > 0 && baseMs > (capMs >> exponent)) {
            expMs = capMs;
        } else {
            expMs = Math.min(baseMs << exponent, capMs);
        }

        long jitterMs = jitterMax.isZero() || jitterMax.isNegative()
                ? 0
                : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);
        return Duration.ofMillis(expMs + jitterMs);
    }

    /**
     * Total time spent waiting across {@code attempts} consecutive timers, without jitter.
     * Used to size windows that must outlive a full retry cycle.
     */
    public static Duration horizon(int attempts, Duration base, Duration max) {
        Duration total = Duration.ZERO;
        for (int i = 0; i < attempts; i++) {
            total = total.plus(next(i, base, max, Duration.ZERO));
        }
        return total;
    }
}
