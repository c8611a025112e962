package com.qqsuccubus.delivery.core.config;

import com.qqsuccubus.delivery.core.util.JitterBackoff;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tuning for the event bus. Defaults cover a WebSocket fan-out of agent events.
 */
@Value
@Builder(toBuilder = true)
public class BusConfig {

    // Retransmission
    @Builder.Default
    Duration initialBackoff = Duration.ofSeconds(1);
    @Builder.Default
    Duration maxBackoff = Duration.ofSeconds(30);
    @Builder.Default
    Duration retryJitter = Duration.ZERO;
    @Builder.Default
    int maxRetries = 5;

    // Session lifecycle
    @Builder.Default
    Duration sessionIdleTimeout = Duration.ofMinutes(5);
    @Builder.Default
    int maxPendingPerSession = 1000;

    // Receive side
    @Builder.Default
    int dedupCapacity = 1000;
    @Builder.Default
    Duration dedupWindow = Duration.ofMinutes(10);
    @Builder.Default
    int reorderBufferMax = 1000;
    @Builder.Default
    Duration gapTimeout = Duration.ofMinutes(7);
    // Receive-only sessions (no send side on this bus) are forgotten after this much silence
    @Builder.Default
    Duration inboundIdleTimeout = Duration.ofMinutes(30);

    public static BusConfig defaults() {
        return BusConfig.builder().build();
    }

    /**
     * Worst-case time between the first transmission of an event and its abandonment.
     */
    public Duration retryHorizon() {
        return JitterBackoff.horizon(maxRetries + 1, initialBackoff, maxBackoff);
    }

    /**
     * Longest time a sender running this configuration can keep one event pending: every
     * attempt may be followed by a full backoff and a disconnect just short of expiry.
     */
    public Duration settleHorizon() {
        Duration perAttempt = maxBackoff.plus(retryJitter).plus(sessionIdleTimeout);
        return perAttempt.multipliedBy(maxRetries + 2L);
    }

    /**
     * True when a gap is only skipped after a peer with the same settings stopped retrying
     * even across a disconnect.
     */
    public boolean gapOutlivesRetries() {
        return gapTimeout.compareTo(sessionIdleTimeout.plus(retryHorizon())) > 0;
    }

    /**
     * @throws IllegalArgumentException if a bound is unusable
     */
    public BusConfig validate() {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be > 0");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (dedupCapacity < 1 || reorderBufferMax < 1 || maxPendingPerSession < 1) {
            throw new IllegalArgumentException("dedupCapacity, reorderBufferMax and maxPendingPerSession must be > 0");
        }
        if (!isPositive(gapTimeout) || !isPositive(inboundIdleTimeout)) {
            throw new IllegalArgumentException("gapTimeout and inboundIdleTimeout must be > 0");
        }
        return this;
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }
}
