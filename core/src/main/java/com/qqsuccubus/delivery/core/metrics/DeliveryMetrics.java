package com.qqsuccubus.delivery.core.metrics;

import com.qqsuccubus.delivery.core.error.DeliveryFailedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Micrometer instrumentation of the event bus.
 */
public class DeliveryMetrics {

    private final MeterRegistry registry;
    private final String nodeId;

    // Counters
    private final Counter acknowledged;
    private final Counter retransmissions;
    private final Counter replayed;
    private final Counter reconnects;
    private final Counter duplicates;
    private final Counter gapsSkipped;
    private final Counter handlerErrors;
    private final Counter sendBackpressure;
    private final Counter sendClosed;
    private final Counter sessionsExpired;

    // Timers
    private final Timer ackLatency;

    public DeliveryMetrics(MeterRegistry registry, String nodeId) {
        this.registry = registry;
        this.nodeId = nodeId;

        acknowledged = counter(MetricsNames.ACKNOWLEDGED_TOTAL, "Events acknowledged by the peer");
        retransmissions = counter(MetricsNames.RETRANSMISSIONS_TOTAL, "Timer-driven retransmissions");
        replayed = counter(MetricsNames.REPLAYED_TOTAL, "Envelopes replayed after reconnect");
        reconnects = counter(MetricsNames.RECONNECTS_TOTAL, "Sessions resumed on a new connection");
        duplicates = counter(MetricsNames.DUPLICATES_TOTAL, "Inbound duplicates suppressed");
        gapsSkipped = counter(MetricsNames.GAPS_SKIPPED_TOTAL, "Inbound sequence gaps skipped after timeout");
        handlerErrors = counter(MetricsNames.HANDLER_ERRORS_TOTAL, "Exceptions thrown by event handlers");
        sessionsExpired = counter(MetricsNames.SESSIONS_EXPIRED_TOTAL, "Sessions destroyed after idle timeout");

        sendBackpressure = Counter.builder(MetricsNames.SEND_FAILURES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "backpressure")
            .description("Sends refused because the outbound buffer was full")
            .register(registry);

        sendClosed = Counter.builder(MetricsNames.SEND_FAILURES_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, "closed")
            .description("Sends failed on a closed connection")
            .register(registry);

        ackLatency = Timer.builder(MetricsNames.ACK_LATENCY)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Time from publish to acknowledgment")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500),
                Duration.ofSeconds(1),
                Duration.ofSeconds(5),
                Duration.ofSeconds(30)
            )
            .register(registry);
    }

    /**
     * Metrics kept in a private in-memory registry, for buses created without one.
     */
    public static DeliveryMetrics inMemory(String nodeId) {
        return new DeliveryMetrics(new SimpleMeterRegistry(), nodeId);
    }

    /**
     * Registers the active sessions gauge. The supplier is sampled on scrape.
     */
    public void bindActiveSessions(Supplier<Number> activeSessions) {
        Gauge.builder(MetricsNames.SESSIONS_ACTIVE, activeSessions)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Sessions held by the bus")
            .register(registry);
    }

    public void recordPublished(String type) {
        // One counter per event type; Micrometer returns the existing meter on re-registration
        Counter.builder(MetricsNames.PUBLISHED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.TYPE, type)
            .description("Events published by the application")
            .register(registry)
            .increment();
    }

    public void recordAcknowledged(int count) {
        acknowledged.increment(count);
    }

    public void recordAckLatency(Duration latency) {
        if (!latency.isNegative()) {
            ackLatency.record(latency);
        }
    }

    public void recordAbandoned(DeliveryFailedException.Reason reason) {
        Counter.builder(MetricsNames.ABANDONED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.REASON, reason.name().toLowerCase(Locale.ROOT))
            .description("Events abandoned without acknowledgment")
            .register(registry)
            .increment();
    }

    public void recordRetransmission() {
        retransmissions.increment();
    }

    public void recordReplayed(int count) {
        replayed.increment(count);
    }

    public void recordReconnect() {
        reconnects.increment();
    }

    public void recordDuplicate() {
        duplicates.increment();
    }

    public void recordGapSkipped() {
        gapsSkipped.increment();
    }

    public void recordHandlerError() {
        handlerErrors.increment();
    }

    public void recordSendBackpressure() {
        sendBackpressure.increment();
    }

    public void recordSendClosed() {
        sendClosed.increment();
    }

    public void recordSessionExpired() {
        sessionsExpired.increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description(description)
            .register(registry);
    }
}
