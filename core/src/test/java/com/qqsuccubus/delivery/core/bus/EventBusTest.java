package com.qqsuccubus.delivery.core.bus;

import com.qqsuccubus.delivery.core.config.BusConfig;
import com.qqsuccubus.delivery.core.error.DeliveryException;
import com.qqsuccubus.delivery.core.error.DeliveryFailedException;
import com.qqsuccubus.delivery.core.error.SessionExpiredException;
import com.qqsuccubus.delivery.core.metrics.DeliveryMetrics;
import com.qqsuccubus.delivery.core.metrics.MetricsNames;
import com.qqsuccubus.delivery.core.metrics.MetricsTags;
import com.qqsuccubus.delivery.core.msg.EventEnvelope;
import com.qqsuccubus.delivery.core.msg.EventTypes;
import com.qqsuccubus.delivery.core.msg.WireMessages;
import com.qqsuccubus.delivery.core.subscribe.EventFilter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusTest {

    private static final String SESSION = "S";

    private VirtualTimeScheduler scheduler;
    private DeliveryMetrics metrics;
    private EventBus bus;
    private List<DeliveryException> errors;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        bus = newBus(BusConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        bus.shutdown();
        scheduler.dispose();
    }

    private EventBus newBus(BusConfig config) {
        metrics = DeliveryMetrics.inMemory("test-node");
        EventBus created = new EventBus(config, scheduler, metrics);
        errors = Collections.synchronizedList(new ArrayList<>());
        created.errors().subscribe(errors::add);
        return created;
    }

    private void replaceBus(BusConfig config) {
        bus.shutdown();
        bus = newBus(config);
    }

    private List<DeliveryFailedException> failures(DeliveryFailedException.Reason reason) {
        synchronized (errors) {
            return errors.stream()
                    .filter(DeliveryFailedException.class::isInstance)
                    .map(DeliveryFailedException.class::cast)
                    .filter(e -> e.getReason() == reason)
                    .collect(Collectors.toList());
        }
    }

    private static EventEnvelope inbound(String sessionId, long sequence) {
        return EventEnvelope.builder()
                .eventId("evt-" + sessionId + "-" + sequence)
                .sequence(sequence)
                .sessionId(sessionId)
                .type(EventTypes.AGENT_THINKING)
                .build();
    }

    @Test
    @DisplayName("Published events get consecutive sequences and go straight to the connection")
    void testPublish_TransmitsInOrder() {
        // Given
        RecordingConnection connection = new RecordingConnection("c1");
        bus.openSession(SESSION, connection);

        // When
        EventEnvelope first = bus.publish(SESSION, EventTypes.AGENT_STARTED, Map.of("agent_name", "planner"));
        EventEnvelope second = bus.publish(SESSION, EventTypes.AGENT_THINKING, Map.of("thought", "..."));

        // Then
        assertEquals(1, first.getSequence());
        assertEquals(2, second.getSequence());
        assertEquals(SESSION, first.getSessionId());
        assertEquals("planner", first.getData().get("agent_name").asText());
        assertEquals(List.of(1L, 2L), connection.sentSequences());
        assertEquals(2, bus.sessionStats(SESSION).orElseThrow().getPending());

        MeterRegistry registry = metrics.getRegistry();
        assertEquals(1.0, registry.get(MetricsNames.PUBLISHED_TOTAL)
                .tag(MetricsTags.TYPE, EventTypes.AGENT_STARTED).counter().count());
    }

    @Test
    @DisplayName("Session ids are generated when none is requested and never reused")
    void testOpenSession_GeneratesIdAndRejectsDuplicate() {
        String generated = bus.openSession(null, new RecordingConnection("c1"));
        assertNotNull(generated);
        assertFalse(generated.isBlank());
        assertEquals(SessionState.CONNECTED, bus.sessionState(generated).orElseThrow());

        bus.openSession(SESSION, new RecordingConnection("c2"));
        assertThrows(IllegalStateException.class, () -> bus.openSession(SESSION, new RecordingConnection("c3")));
        assertEquals(2, bus.activeSessionIds().size());
    }

    @Test
    @DisplayName("Publishing to an unknown session fails with SessionExpiredException")
    void testPublish_UnknownSession() {
        assertThrows(SessionExpiredException.class, () -> bus.publish("nope", EventTypes.AGENT_STARTED, null));
    }

    @Test
    @DisplayName("Cumulative acks settle every sequence up to the given one and are idempotent")
    void testAcknowledge_CumulativeAndIdempotent() {
        // Given
        bus.openSession(SESSION, new RecordingConnection("c1"));
        for (int i = 0; i < 4; i++) {
            bus.publish(SESSION, EventTypes.AGENT_THINKING, Map.of("i", i));
        }

        // When / Then
        assertEquals(3, bus.acknowledge(SESSION, 3));
        assertEquals(0, bus.acknowledge(SESSION, 3));
        assertEquals(0, bus.acknowledge(SESSION, 2));

        SessionStats stats = bus.sessionStats(SESSION).orElseThrow();
        assertEquals(3, stats.getLastAckedSequence());
        assertEquals(1, stats.getPending());
        assertEquals(3, stats.getAcknowledged());
        assertEquals(3, metrics.getRegistry().get(MetricsNames.ACK_LATENCY).timer().count());
    }

    @Test
    @DisplayName("An ack beyond the last issued sequence is clamped")
    void testAcknowledge_BeyondIssuedIsClamped() {
        bus.openSession(SESSION, new RecordingConnection("c1"));
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);

        assertEquals(2, bus.acknowledge(SESSION, 10));

        // Sequence 3 is still unacknowledged once issued
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);
        assertEquals(2, bus.sessionStats(SESSION).orElseThrow().getLastAckedSequence());
        assertEquals(1, bus.sessionStats(SESSION).orElseThrow().getPending());
        assertEquals(1, bus.acknowledge(SESSION, 3));
    }

    @Test
    @DisplayName("Sequences an ack lists as missing stay pending until an ack stops listing them")
    void testAcknowledge_MissingStayPending() {
        bus.openSession(SESSION, new RecordingConnection("c1"));
        for (int i = 0; i < 5; i++) {
            bus.publish(SESSION, EventTypes.AGENT_THINKING, null);
        }

        assertEquals(4, bus.acknowledge(SESSION, WireMessages.Ack.of(SESSION, 5, List.of(4L))));
        assertEquals(1, bus.sessionStats(SESSION).orElseThrow().getPending());
        assertEquals(0, bus.acknowledge(SESSION, 5));

        assertEquals(1, bus.acknowledge(SESSION, WireMessages.Ack.of(SESSION, 5)));
        assertEquals(0, bus.sessionStats(SESSION).orElseThrow().getPending());
        assertTrue(errors.isEmpty());
    }

    @Test
    @DisplayName("Unacknowledged events are resent with exponential backoff and abandoned after max retries")
    void testRetry_BackoffThenRetriesExhausted() {
        // Given
        replaceBus(BusConfig.builder()
                .initialBackoff(Duration.ofSeconds(1))
                .maxRetries(2)
                .build());
        RecordingConnection connection = new RecordingConnection("c1");
        bus.openSession(SESSION, connection);
        bus.publish(SESSION, EventTypes.TOOL_EXECUTING, Map.of("tool_name", "search"));

        // When / Then
        scheduler.advanceTimeBy(Duration.ofMillis(999));
        assertEquals(1, connection.sent().size());

        scheduler.advanceTimeBy(Duration.ofMillis(1));
        assertEquals(2, connection.sent().size());
        assertEquals(1, connection.sent().get(1).getRetryCount());

        scheduler.advanceTimeBy(Duration.ofSeconds(2));
        assertEquals(3, connection.sent().size());
        assertEquals(2, connection.sent().get(2).getRetryCount());
        assertTrue(failures(DeliveryFailedException.Reason.RETRIES_EXHAUSTED).isEmpty());

        scheduler.advanceTimeBy(Duration.ofSeconds(4));
        assertEquals(3, connection.sent().size());
        List<DeliveryFailedException> exhausted = failures(DeliveryFailedException.Reason.RETRIES_EXHAUSTED);
        assertEquals(1, exhausted.size());
        assertEquals(1, exhausted.get(0).getEnvelope().getSequence());
        assertEquals(SESSION, exhausted.get(0).getSessionId());

        DeliveryStats stats = bus.stats();
        assertEquals(0, stats.getPending());
        assertEquals(1, stats.getAbandoned());
        assertEquals(2, stats.getRetransmissions());
        assertEquals(1.0, metrics.getRegistry().get(MetricsNames.ABANDONED_TOTAL)
                .tag(MetricsTags.REASON, "retries_exhausted").counter().count());
    }

    @Test
    @DisplayName("Every transmission of an event carries the same event id")
    void testRetry_KeepsEventId() {
        RecordingConnection connection = new RecordingConnection("c1");
        bus.openSession(SESSION, connection);
        EventEnvelope published = bus.publish(SESSION, EventTypes.AGENT_THINKING, null);

        scheduler.advanceTimeBy(Duration.ofSeconds(3));

        assertEquals(3, connection.sent().size());
        connection.sent().forEach(e -> {
            assertEquals(published.getEventId(), e.getEventId());
            assertEquals(1, e.getSequence());
        });
    }

    @Test
    @DisplayName("An acknowledged event is never retransmitted")
    void testRetry_StopsAfterAck() {
        RecordingConnection connection = new RecordingConnection("c1");
        bus.openSession(SESSION, connection);
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);

        bus.acknowledge(SESSION, 1);
        scheduler.advanceTimeBy(Duration.ofMinutes(2));

        assertEquals(1, connection.sent().size());
        assertTrue(errors.isEmpty());
    }

    @Test
    @DisplayName("Retry timers are frozen while disconnected and resume at the same level after reconnect")
    void testDisconnect_FreezesRetries() {
        // Given
        RecordingConnection first = new RecordingConnection("c1");
        bus.openSession(SESSION, first);
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);

        // When
        assertTrue(bus.disconnect(SESSION));
        scheduler.advanceTimeBy(Duration.ofMinutes(2));

        // Then
        assertEquals(1, first.sent().size());
        assertTrue(first.isClosed());
        assertEquals(SessionState.DISCONNECTED, bus.sessionState(SESSION).orElseThrow());
        assertTrue(failures(DeliveryFailedException.Reason.RETRIES_EXHAUSTED).isEmpty());

        RecordingConnection second = new RecordingConnection("c2");
        ReconnectionBuffer.ReplayResult result = bus.reconnect(SESSION, second, OptionalLong.of(0));
        assertEquals(1, result.replayed());
        assertTrue(result.completed());
        assertEquals(1, second.sent().get(0).getRetryCount());

        scheduler.advanceTimeBy(Duration.ofMillis(1999));
        assertEquals(1, second.sent().size());
        scheduler.advanceTimeBy(Duration.ofMillis(1));
        assertEquals(2, second.sent().size());
        assertEquals(2, second.sent().get(1).getRetryCount());
    }

    @Test
    @DisplayName("A link that drops before every ack uses up the retries and abandons the event")
    void testReconnect_FlappingLinkExhaustsRetries() {
        // Given
        replaceBus(BusConfig.builder().maxRetries(2).build());
        bus.openSession(SESSION, new RecordingConnection("c0"));
        bus.publish(SESSION, EventTypes.TOOL_EXECUTING, null);

        // When
        List<Integer> replayedRetryCounts = new ArrayList<>();
        for (int i = 1; i <= 2; i++) {
            bus.disconnect(SESSION);
            RecordingConnection connection = new RecordingConnection("c" + i);
            bus.reconnect(SESSION, connection, OptionalLong.of(0));
            replayedRetryCounts.add(connection.sent().get(0).getRetryCount());
        }
        bus.disconnect(SESSION);
        RecordingConnection last = new RecordingConnection("c3");
        ReconnectionBuffer.ReplayResult result = bus.reconnect(SESSION, last, OptionalLong.of(0));

        // Then
        assertEquals(List.of(1, 2), replayedRetryCounts);
        assertTrue(last.sent().isEmpty());
        assertEquals(1, result.exhausted().size());
        assertEquals(0, result.replayed());
        assertTrue(result.completed());
        assertEquals(1, failures(DeliveryFailedException.Reason.RETRIES_EXHAUSTED).size());
        assertEquals(1, bus.stats().getAbandoned());
        assertEquals(0, bus.stats().getPending());
        assertEquals(1, bus.sessionStats(SESSION).orElseThrow().getAbandoned());
    }

    @Test
    @DisplayName("An event never written to a connection is replayed as a first attempt")
    void testReconnect_UnsentEventIsFirstAttempt() {
        replaceBus(BusConfig.builder().maxRetries(0).build());
        bus.openSession(SESSION, new RecordingConnection("c1"));
        bus.disconnect(SESSION);
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);

        RecordingConnection second = new RecordingConnection("c2");
        ReconnectionBuffer.ReplayResult result = bus.reconnect(SESSION, second, OptionalLong.empty());

        assertEquals(1, result.replayed());
        assertTrue(result.exhausted().isEmpty());
        assertEquals(0, second.sent().get(0).getRetryCount());
    }

    @Test
    @DisplayName("Events published while disconnected are held and replayed on reconnect")
    void testPublish_WhileDisconnectedIsReplayed() {
        bus.openSession(SESSION, new RecordingConnection("c1"));
        bus.disconnect(SESSION);

        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);
        bus.publish(SESSION, EventTypes.AGENT_COMPLETED, null);

        RecordingConnection second = new RecordingConnection("c2");
        bus.reconnect(SESSION, second, OptionalLong.empty());

        assertEquals(List.of(1L, 2L), second.sentSequences());
        assertEquals(SessionState.CONNECTED, bus.sessionState(SESSION).orElseThrow());
        assertEquals(1, bus.sessionStats(SESSION).orElseThrow().getReconnects());
    }

    @Test
    @DisplayName("A late disconnect notification for a replaced connection is ignored")
    void testDisconnect_StaleConnectionIgnored() {
        RecordingConnection first = new RecordingConnection("c1");
        RecordingConnection second = new RecordingConnection("c2");
        bus.openSession(SESSION, first);

        bus.reconnect(SESSION, second, OptionalLong.empty());

        assertTrue(first.isClosed());
        assertFalse(bus.disconnect(SESSION, first));
        assertEquals(SessionState.CONNECTED, bus.sessionState(SESSION).orElseThrow());
        assertTrue(bus.disconnect(SESSION, second));
        assertFalse(bus.disconnect(SESSION, second));
    }

    @Test
    @DisplayName("A dead connection disconnects the session without failing the publisher")
    void testPublish_TransportFailureDisconnects() {
        // Given
        RecordingConnection connection = new RecordingConnection("c1");
        bus.openSession(SESSION, connection);
        connection.kill();

        // When
        EventEnvelope envelope = bus.publish(SESSION, EventTypes.AGENT_THINKING, null);

        // Then
        assertEquals(1, envelope.getSequence());
        assertEquals(SessionState.DISCONNECTED, bus.sessionState(SESSION).orElseThrow());
        assertTrue(connection.isClosed());
        assertEquals(1, bus.stats().getSendFailures());
        assertEquals(1, bus.sessionStats(SESSION).orElseThrow().getPending());

        RecordingConnection replacement = new RecordingConnection("c2");
        bus.reconnect(SESSION, replacement, OptionalLong.of(0));
        assertEquals(List.of(1L), replacement.sentSequences());
    }

    @Test
    @DisplayName("A full outbound buffer leaves the event to its retry timer")
    void testPublish_BackpressureFallsBackToRetry() {
        RecordingConnection connection = new RecordingConnection("c1");
        bus.openSession(SESSION, connection);
        connection.refuse(true);

        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);
        assertTrue(connection.sent().isEmpty());
        assertEquals(SessionState.CONNECTED, bus.sessionState(SESSION).orElseThrow());
        assertEquals(1.0, metrics.getRegistry().get(MetricsNames.SEND_FAILURES_TOTAL)
                .tag(MetricsTags.REASON, "backpressure").counter().count());

        connection.refuse(false);
        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(List.of(1L), connection.sentSequences());
    }

    @Test
    @DisplayName("A session left disconnected past the idle timeout expires and abandons its events")
    void testExpiry_AbandonsPendingAndRejectsReconnect() {
        // Given
        replaceBus(BusConfig.builder().sessionIdleTimeout(Duration.ofMinutes(1)).build());
        bus.openSession(SESSION, new RecordingConnection("c1"));
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);
        bus.disconnect(SESSION);

        // When
        scheduler.advanceTimeBy(Duration.ofSeconds(59));
        assertTrue(bus.sessionState(SESSION).isPresent());
        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        // Then
        assertTrue(bus.sessionState(SESSION).isEmpty());
        assertEquals(2, failures(DeliveryFailedException.Reason.SESSION_EXPIRED).size());
        SessionExpiredException expired = errors.stream()
                .filter(SessionExpiredException.class::isInstance)
                .map(SessionExpiredException.class::cast)
                .findFirst()
                .orElseThrow();
        assertEquals(SESSION, expired.getSessionId());
        assertEquals(2, expired.getAbandonedEvents());
        assertEquals(1, bus.stats().getExpiredSessions());

        assertThrows(SessionExpiredException.class,
                () -> bus.reconnect(SESSION, new RecordingConnection("c2"), OptionalLong.of(0)));
        assertThrows(SessionExpiredException.class,
                () -> bus.publish(SESSION, EventTypes.AGENT_THINKING, null));
    }

    @Test
    @DisplayName("Reconnecting within the idle timeout cancels expiry")
    void testExpiry_CancelledByReconnect() {
        replaceBus(BusConfig.builder().sessionIdleTimeout(Duration.ofMinutes(1)).build());
        bus.openSession(SESSION, new RecordingConnection("c1"));
        bus.disconnect(SESSION);

        scheduler.advanceTimeBy(Duration.ofSeconds(30));
        bus.reconnect(SESSION, new RecordingConnection("c2"), OptionalLong.empty());
        scheduler.advanceTimeBy(Duration.ofMinutes(5));

        assertEquals(SessionState.CONNECTED, bus.sessionState(SESSION).orElseThrow());
        assertTrue(errors.isEmpty());
    }

    @Test
    @DisplayName("Backlog overflow evicts the oldest non-critical event")
    void testBacklog_EvictsOldestNonCritical() {
        // Given
        replaceBus(BusConfig.builder().maxPendingPerSession(3).build());
        bus.openSession(SESSION, new RecordingConnection("c1"));
        bus.publish(SESSION, EventTypes.AGENT_STARTED, null);
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);

        // When
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);
        bus.publish(SESSION, EventTypes.TOOL_EXECUTING, null);

        // Then
        List<DeliveryFailedException> evicted = failures(DeliveryFailedException.Reason.BACKLOG_OVERFLOW);
        assertEquals(List.of(2L, 3L), evicted.stream().map(e -> e.getEnvelope().getSequence()).toList());
        assertEquals(3, bus.sessionStats(SESSION).orElseThrow().getPending());
    }

    @Test
    @DisplayName("Critical events are kept even when the backlog is over its bound")
    void testBacklog_NeverEvictsCritical() {
        replaceBus(BusConfig.builder().maxPendingPerSession(2).build());
        bus.openSession(SESSION, new RecordingConnection("c1"));

        bus.publish(SESSION, EventTypes.AGENT_STARTED, null);
        bus.publish(SESSION, EventTypes.TOOL_EXECUTING, null);
        bus.publish(SESSION, EventTypes.TOOL_COMPLETED, null);

        assertTrue(failures(DeliveryFailedException.Reason.BACKLOG_OVERFLOW).isEmpty());
        assertEquals(3, bus.sessionStats(SESSION).orElseThrow().getPending());
    }

    @Test
    @DisplayName("Reconnect scenario: drop after 3, resume from 2, replay 3..5, then 6")
    void testReconnect_ReplaysUnackedWithoutDuplicates() {
        // Given
        EventBus receiver = new EventBus(BusConfig.defaults(), scheduler, DeliveryMetrics.inMemory("peer"));
        List<EventEnvelope> handled = Collections.synchronizedList(new ArrayList<>());
        receiver.subscribe(handled::add, EventFilter.all());

        RecordingConnection first = new RecordingConnection("c1");
        bus.openSession(SESSION, first);
        for (int i = 1; i <= 5; i++) {
            bus.publish(SESSION, EventTypes.AGENT_THINKING, Map.of("step", i));
        }
        List<EventEnvelope> wire = first.sent();

        // Events 1 and 2 arrive and are acked, 3 arrives but its ack is lost with the socket
        WireMessages.Ack ack = null;
        for (int i = 0; i < 2; i++) {
            ack = receiver.onReceive(SESSION, wire.get(i));
        }
        bus.acknowledge(SESSION, ack.getUpToSequence());
        receiver.onReceive(SESSION, wire.get(2));
        bus.disconnect(SESSION, first);

        // When
        RecordingConnection second = new RecordingConnection("c2");
        ReconnectionBuffer.ReplayResult result = bus.reconnect(SESSION, second, OptionalLong.of(2));
        bus.publish(SESSION, EventTypes.AGENT_COMPLETED, Map.of("step", 6));

        // Then
        assertEquals(3, result.replayed());
        assertEquals(List.of(3L, 4L, 5L, 6L), second.sentSequences());

        for (EventEnvelope envelope : second.sent()) {
            ack = receiver.onReceive(SESSION, envelope);
        }
        bus.acknowledge(SESSION, ack.getUpToSequence());

        assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L),
                handled.stream().map(EventEnvelope::getSequence).toList());
        SessionStats sender = bus.sessionStats(SESSION).orElseThrow();
        assertEquals(6, sender.getLastAckedSequence());
        assertEquals(6, sender.getAcknowledged());
        assertEquals(0, sender.getPending());
        assertEquals(1, receiver.sessionStats(SESSION).orElseThrow().getDuplicatesDetected());

        receiver.shutdown();
    }

    @Test
    @DisplayName("Reconnecting over a live connection closes the old one and replays everything pending")
    void testReconnect_ReplacesLiveConnection() {
        RecordingConnection first = new RecordingConnection("c1");
        bus.openSession(SESSION, first);
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);

        RecordingConnection second = new RecordingConnection("c2");
        bus.reconnect(SESSION, second, OptionalLong.empty());

        assertTrue(first.isClosed());
        assertEquals(List.of(1L, 2L), second.sentSequences());
        assertEquals(1, bus.stats().getReconnects());
        assertEquals(2, bus.stats().getReplayed());
    }

    @Test
    @DisplayName("Incoming duplicates reach the handler once")
    void testOnReceive_DuplicatesSuppressed() {
        // Given
        List<EventEnvelope> handled = new ArrayList<>();
        bus.subscribe(handled::add, EventFilter.all());
        EventEnvelope envelope = inbound(SESSION, 1);

        // When
        for (int k = 0; k < 5; k++) {
            bus.onReceive(SESSION, envelope.withRetryCount(k));
        }

        // Then
        assertEquals(1, handled.size());
        assertEquals(4, bus.stats().getDuplicatesDetected());
        assertEquals(4, bus.sessionStats(SESSION).orElseThrow().getDuplicatesDetected());
        assertEquals(4.0, metrics.getRegistry().get(MetricsNames.DUPLICATES_TOTAL).counter().count());
    }

    @Test
    @DisplayName("Out-of-order arrivals are handed to handlers in sequence order")
    void testOnReceive_ReordersAndAcksCumulatively() {
        List<Long> handled = new ArrayList<>();
        bus.subscribe(e -> handled.add(e.getSequence()), EventFilter.all());

        assertEquals(0, bus.onReceive(SESSION, inbound(SESSION, 2)).getUpToSequence());
        assertEquals(0, bus.onReceive(SESSION, inbound(SESSION, 3)).getUpToSequence());
        assertTrue(handled.isEmpty());

        WireMessages.Ack ack = bus.onReceive(SESSION, inbound(SESSION, 1));

        assertEquals(3, ack.getUpToSequence());
        assertEquals(SESSION, ack.getSessionId());
        assertEquals(List.of(1L, 2L, 3L), handled);
    }

    @Test
    @DisplayName("Receive state of a silent receive-only session is evicted and resumes after its watermark")
    void testOnReceive_IdleReceiveOnlyStateEvicted() {
        // Given
        List<Long> handled = new ArrayList<>();
        bus.subscribe(e -> handled.add(e.getSequence()), EventFilter.all());
        bus.openSession(SESSION, new RecordingConnection("c1"));
        bus.onReceive(SESSION, inbound(SESSION, 1));
        bus.onReceive("peer", inbound("peer", 1));
        bus.onReceive("peer", inbound("peer", 2));
        bus.onReceive("gappy", inbound("gappy", 2));

        // When
        scheduler.advanceTimeBy(Duration.ofMinutes(29));
        assertTrue(bus.sessionStats("peer").isPresent());
        scheduler.advanceTimeBy(Duration.ofMinutes(2));

        // Then
        assertTrue(bus.sessionStats("peer").isEmpty());
        assertEquals(1, bus.sessionStats(SESSION).orElseThrow().getDeliveredUpTo());
        SessionStats gappy = bus.sessionStats("gappy").orElseThrow();
        assertEquals(2, gappy.getDeliveredUpTo());
        assertEquals(1, gappy.getMissing());

        WireMessages.Ack ack = bus.onReceive("peer", inbound("peer", 3));
        assertEquals(3, ack.getUpToSequence());
        assertTrue(ack.getMissing().isEmpty());
        assertEquals(List.of(1L, 1L, 2L, 2L, 3L), handled);
    }

    @Test
    @DisplayName("An envelope for another session is rejected")
    void testOnReceive_SessionMismatch() {
        assertThrows(IllegalArgumentException.class, () -> bus.onReceive(SESSION, inbound("other", 1)));
    }

    @Test
    @DisplayName("A failing handler neither blocks other handlers nor the ack")
    void testDispatch_HandlerFailureIsolated() {
        // Given
        List<EventEnvelope> handled = new ArrayList<>();
        bus.subscribe(e -> {
            throw new IllegalStateException("boom");
        }, EventFilter.all());
        bus.subscribe(e -> {
            throw new Exception("checked boom");
        }, EventFilter.all());
        bus.subscribe(handled::add, EventFilter.all());

        // When
        WireMessages.Ack ack = bus.onReceive(SESSION, inbound(SESSION, 1));

        // Then
        assertEquals(1, ack.getUpToSequence());
        assertEquals(1, handled.size());
        assertEquals(2, bus.stats().getHandlerErrors());
    }

    @Test
    @DisplayName("Filters select events and unsubscribed handlers stop receiving")
    void testSubscribe_FilterAndUnsubscribe() {
        List<String> thinking = new ArrayList<>();
        List<String> everything = new ArrayList<>();
        bus.subscribe(e -> thinking.add(e.getType()), EventFilter.types(EventTypes.AGENT_THINKING));
        String allId = bus.subscribe(e -> everything.add(e.getType()), null);

        bus.onReceive(SESSION, inbound(SESSION, 1));
        bus.onReceive(SESSION, inbound(SESSION, 2).toBuilder().type(EventTypes.AGENT_COMPLETED).build());
        assertTrue(bus.unsubscribe(allId));
        assertFalse(bus.unsubscribe(allId));
        bus.onReceive(SESSION, inbound(SESSION, 3));

        assertEquals(List.of(EventTypes.AGENT_THINKING, EventTypes.AGENT_THINKING), thinking);
        assertEquals(List.of(EventTypes.AGENT_THINKING, EventTypes.AGENT_COMPLETED), everything);
        assertEquals(1, bus.stats().getSubscriptions());
    }

    @Test
    @DisplayName("Cancelling an event abandons it once and ignores a later ack")
    void testAbandon_CancelsPendingEvent() {
        RecordingConnection connection = new RecordingConnection("c1");
        bus.openSession(SESSION, connection);
        EventEnvelope envelope = bus.publish(SESSION, EventTypes.AGENT_THINKING, null);

        assertTrue(bus.abandon(SESSION, envelope.getEventId()));
        assertFalse(bus.abandon(SESSION, envelope.getEventId()));
        assertEquals(0, bus.acknowledge(SESSION, 1));

        scheduler.advanceTimeBy(Duration.ofMinutes(1));
        assertEquals(1, connection.sent().size());
        assertEquals(1, failures(DeliveryFailedException.Reason.CANCELLED).size());
        assertEquals(1, bus.stats().getAbandoned());
        assertEquals(0, bus.stats().getAcknowledged());
    }

    @Test
    @DisplayName("Closing a session abandons its pending events and closes the connection")
    void testCloseSession_AbandonsPending() {
        RecordingConnection connection = new RecordingConnection("c1");
        bus.openSession(SESSION, connection);
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);

        assertEquals(2, bus.closeSession(SESSION));

        assertTrue(connection.isClosed());
        assertTrue(bus.sessionState(SESSION).isEmpty());
        assertEquals(2, failures(DeliveryFailedException.Reason.SESSION_CLOSED).size());
        assertEquals(0, bus.closeSession(SESSION));
    }

    @Test
    @DisplayName("Shutdown abandons pending events and completes the error stream")
    void testShutdown_CompletesErrors() {
        bus.openSession(SESSION, new RecordingConnection("c1"));
        bus.publish(SESSION, EventTypes.AGENT_THINKING, null);

        StepVerifier.create(bus.errors())
                .then(bus::shutdown)
                .expectNextMatches(e -> e instanceof DeliveryFailedException
                        && ((DeliveryFailedException) e).getReason() == DeliveryFailedException.Reason.SHUTDOWN)
                .verifyComplete();

        assertTrue(bus.isShutdown());
        assertThrows(IllegalStateException.class, () -> bus.openSession("late", new RecordingConnection("c2")));
    }

    @Test
    @DisplayName("Acked plus abandoned always equals published once nothing is pending")
    void testStats_Accounting() {
        replaceBus(BusConfig.builder().initialBackoff(Duration.ofMillis(100)).maxRetries(1).build());
        bus.openSession(SESSION, new RecordingConnection("c1"));
        for (int i = 0; i < 10; i++) {
            bus.publish(SESSION, EventTypes.AGENT_THINKING, null);
        }

        bus.acknowledge(SESSION, 6);
        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        DeliveryStats stats = bus.stats();
        assertEquals(10, stats.getPublished());
        assertEquals(0, stats.getPending());
        assertEquals(6, stats.getAcknowledged());
        assertEquals(4, stats.getAbandoned());
        assertEquals(1, stats.getActiveSessions());
        assertEquals(1, stats.getConnectedSessions());
    }
}
