package com.qqsuccubus.delivery.core.metrics;

/**
 * Micrometer metric names of the delivery subsystem.
 * <p>
 * <b>Naming convention:</b> {@code rtc.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Events published by the application.
     * <p>
     * Tags: node_id, type (event type)
     * </p>
     */
    public static final String PUBLISHED_TOTAL = "rtc.delivery.published.total";

    /**
     * Counter: Events acknowledged by the peer.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String ACKNOWLEDGED_TOTAL = "rtc.delivery.acknowledged.total";

    /**
     * Counter: Events abandoned without acknowledgment.
     * <p>
     * Tags: node_id, reason (retries_exhausted/backlog_overflow/session_expired/...)
     * </p>
     */
    public static final String ABANDONED_TOTAL = "rtc.delivery.abandoned.total";

    /**
     * Counter: Timer-driven retransmissions.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String RETRANSMISSIONS_TOTAL = "rtc.delivery.retransmissions.total";

    /**
     * Counter: Envelopes replayed after a reconnect.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String REPLAYED_TOTAL = "rtc.delivery.replayed.total";

    public static final String RECONNECTS_TOTAL = "rtc.delivery.reconnects.total";

    /**
     * Counter: Inbound duplicates suppressed.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String DUPLICATES_TOTAL = "rtc.delivery.duplicates.total";

    /**
     * Counter: Inbound gaps given up after the gap timeout.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String GAPS_SKIPPED_TOTAL = "rtc.delivery.gaps.skipped.total";

    /**
     * Counter: Exceptions thrown by subscribed handlers.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String HANDLER_ERRORS_TOTAL = "rtc.delivery.handler.errors.total";

    /**
     * Counter: Sends refused by a connection.
     * <p>
     * Tags: node_id, reason (backpressure/closed)
     * </p>
     */
    public static final String SEND_FAILURES_TOTAL = "rtc.delivery.send.failures.total";

    /**
     * Gauge: Sessions currently held by the bus, connected or not.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String SESSIONS_ACTIVE = "rtc.delivery.sessions.active";

    /**
     * Counter: Sessions destroyed after their idle timeout.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String SESSIONS_EXPIRED_TOTAL = "rtc.delivery.sessions.expired.total";

    /**
     * Timer: Time from publish to cumulative acknowledgment (p50, p95, p99).
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String ACK_LATENCY = "rtc.delivery.ack.latency";
}
