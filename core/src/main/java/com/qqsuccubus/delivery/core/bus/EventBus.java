package com.qqsuccubus.delivery.core.bus;

import com.qqsuccubus.delivery.core.config.BusConfig;
import com.qqsuccubus.delivery.core.dedup.DuplicateFilter;
import com.qqsuccubus.delivery.core.delivery.DeliveryTracker;
import com.qqsuccubus.delivery.core.error.DeliveryException;
import com.qqsuccubus.delivery.core.error.DeliveryFailedException;
import com.qqsuccubus.delivery.core.error.SessionExpiredException;
import com.qqsuccubus.delivery.core.error.TransportException;
import com.qqsuccubus.delivery.core.metrics.DeliveryMetrics;
import com.qqsuccubus.delivery.core.msg.EventEnvelope;
import com.qqsuccubus.delivery.core.msg.EventTypes;
import com.qqsuccubus.delivery.core.msg.WireMessages;
import com.qqsuccubus.delivery.core.receive.InboundSequencer;
import com.qqsuccubus.delivery.core.sequence.SequenceAssigner;
import com.qqsuccubus.delivery.core.subscribe.EventFilter;
import com.qqsuccubus.delivery.core.subscribe.EventHandler;
import com.qqsuccubus.delivery.core.subscribe.Subscription;
import com.qqsuccubus.delivery.core.subscribe.SubscriptionRegistry;
import com.qqsuccubus.delivery.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Session-oriented event bus with at-least-once, ordered delivery.
 * <p>
 * <b>Locking:</b> send-side state of a session is guarded by the {@link Session} monitor and
 * receive-side state by its {@link InboundSequencer} monitor. A thread holding a sequencer may
 * take a session monitor, never the other way round. Failures are collected under the lock
 * and emitted on {@link #errors()} after it is released.
 * </p>
 * <p>
 * <b>Timers:</b> retry, idle-expiry and gap timers run on the configured {@link Scheduler}.
 * Retry timers are frozen while a session is disconnected. A periodic sweep forgets the
 * receive state of sessions this bus only receives on once they fall silent.
 * </p>
 */
public class EventBus implements IEventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);
    private static final Duration INBOUND_SWEEP_INTERVAL = Duration.ofMinutes(1);
    private static final int EVICTED_WATERMARKS_MAX = 10_000;

    private final BusConfig config;
    private final Scheduler scheduler;
    private final DeliveryMetrics metrics;
    private final SequenceAssigner sequences = new SequenceAssigner();
    private final ReconnectionBuffer reconnectionBuffer;
    private final SubscriptionRegistry subscriptions = new SubscriptionRegistry();

    // sessionId -> send-side state
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    // sessionId -> receive-side state
    private final Map<String, InboundSequencer> inbound = new ConcurrentHashMap<>();
    // sessionId -> release watermark of evicted receive state, eldest dropped first
    private final Map<String, Long> evictedWatermarks = Collections.synchronizedMap(
            new LinkedHashMap<String, Long>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Long> eldest) {
                    return size() > EVICTED_WATERMARKS_MAX;
                }
            });

    private final Sinks.Many<DeliveryException> errorSink =
            Sinks.many().multicast().onBackpressureBuffer(1024, false);

    // Totals for stats()
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong acknowledged = new AtomicLong();
    private final AtomicLong abandoned = new AtomicLong();
    private final AtomicLong retransmissions = new AtomicLong();
    private final AtomicLong replayed = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong gapsSkipped = new AtomicLong();
    private final AtomicLong handlerErrors = new AtomicLong();
    private final AtomicLong sendFailures = new AtomicLong();
    private final AtomicLong sessionsExpired = new AtomicLong();

    private final Disposable inboundSweeper;
    private volatile boolean shutdown;

    public EventBus(BusConfig config, DeliveryMetrics metrics) {
        this(config, Schedulers.parallel(), metrics);
    }

    public EventBus(BusConfig config, Scheduler scheduler, DeliveryMetrics metrics) {
        this.config = config.validate();
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.reconnectionBuffer = new ReconnectionBuffer(sequences, this::transmit);
        metrics.bindActiveSessions(sessions::size);
        if (!this.config.gapOutlivesRetries()) {
            log.warn("gapTimeout {} does not outlive sessionIdleTimeout {} plus the retry horizon {}: "
                            + "gaps may be skipped while the sender still retries",
                    config.getGapTimeout(), config.getSessionIdleTimeout(), config.retryHorizon());
        }
        this.inboundSweeper = scheduler.schedulePeriodically(this::evictIdleInbound,
                INBOUND_SWEEP_INTERVAL.toMillis(), INBOUND_SWEEP_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public String openSession(String requestedId, ConnectionHandle connection) {
        Objects.requireNonNull(connection, "connection");
        checkRunning();

        String sessionId = requestedId == null || requestedId.isBlank()
                ? UUID.randomUUID().toString()
                : requestedId;
        Session session = new Session(sessionId,
                new DeliveryTracker(sessionId, config, scheduler, this::onRetryDue), now());

        if (sessions.putIfAbsent(sessionId, session) != null) {
            throw new IllegalStateException("Session already exists: " + sessionId);
        }
        sequences.register(sessionId);

        synchronized (session) {
            session.attach(connection);
            session.transitionTo(SessionState.CONNECTED);
        }
        log.info("Session {} opened on connection {}", sessionId, connection.id());
        return sessionId;
    }

    @Override
    public EventEnvelope publish(String sessionId, String type, Object data) {
        Objects.requireNonNull(type, "type");
        Session session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionExpiredException(sessionId, 0);
        }

        List<DeliveryFailedException> failures = new ArrayList<>();
        EventEnvelope envelope;
        synchronized (session) {
            if (session.getState() == SessionState.EXPIRED) {
                throw new SessionExpiredException(sessionId, 0);
            }
            DeliveryTracker tracker = session.getTracker();

            envelope = EventEnvelope.builder()
                    .eventId(UUID.randomUUID().toString())
                    .sequence(sequences.next(sessionId))
                    .sessionId(sessionId)
                    .type(type)
                    .data(JsonUtils.toTree(data))
                    .createdAt(now())
                    .build();
            tracker.track(envelope);
            session.countPublished();
            published.incrementAndGet();
            metrics.recordPublished(type);

            enforceBacklog(session, failures);

            long sequence = envelope.getSequence();
            if (session.isConnected() && tracker.get(sequence).isPresent()) {
                transmit(session, envelope);
                // A dead connection detaches the session and freezes its timers
                if (session.isConnected()) {
                    tracker.arm(sequence);
                }
            }
        }

        failures.forEach(this::emit);
        if (log.isDebugEnabled()) {
            log.debug("Published {} seq={} on session {}", type, envelope.getSequence(), sessionId);
        }
        return envelope;
    }

    @Override
    public int acknowledge(String sessionId, long upToSequence) {
        return acknowledge(sessionId, upToSequence, null);
    }

    @Override
    public int acknowledge(String sessionId, WireMessages.Ack ack) {
        return acknowledge(sessionId, ack.getUpToSequence(), ack.getMissing());
    }

    /**
     * @param missing sequences the peer still waits for, null to keep the last reported ones
     */
    private int acknowledge(String sessionId, long upToSequence, List<Long> missing) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            log.debug("Ack for unknown session {} ignored", sessionId);
            return 0;
        }

        List<EventEnvelope> settled;
        synchronized (session) {
            if (session.getState() == SessionState.EXPIRED) {
                return 0;
            }
            long issued = sequences.current(sessionId);
            long effective = upToSequence;
            if (upToSequence > issued) {
                log.warn("Session {} acked seq {} beyond last issued {}, clamping", sessionId, upToSequence, issued);
                effective = issued;
            }
            settled = missing == null
                    ? session.getTracker().acknowledge(effective)
                    : session.getTracker().acknowledge(effective, missing);
            session.countAcknowledged(settled.size());
        }

        recordAcknowledged(settled);
        return settled.size();
    }

    @Override
    public WireMessages.Ack onReceive(String sessionId, EventEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        if (!sessionId.equals(envelope.getSessionId())) {
            throw new IllegalArgumentException("Envelope for session " + envelope.getSessionId()
                    + " received on session " + sessionId);
        }

        while (true) {
            InboundSequencer sequencer = inbound.computeIfAbsent(sessionId, this::newSequencer);
            synchronized (sequencer) {
                if (sequencer.isRetired()) {
                    // Evicted or closed after lookup
                    inbound.remove(sessionId, sequencer);
                    continue;
                }
                InboundSequencer.Offer offer = sequencer.offer(envelope);
                if (offer.outcome() == InboundSequencer.Outcome.DUPLICATE) {
                    duplicates.incrementAndGet();
                    metrics.recordDuplicate();
                }
                offer.ready().forEach(this::dispatch);
                return sequencer.ack();
            }
        }
    }

    @Override
    public String subscribe(EventHandler handler, EventFilter filter) {
        String id = subscriptions.register(handler, filter);
        log.debug("Subscription {} registered", id);
        return id;
    }

    @Override
    public boolean unsubscribe(String subscriptionId) {
        return subscriptions.unregister(subscriptionId);
    }

    @Override
    public boolean disconnect(String sessionId) {
        return disconnect(sessionId, null);
    }

    @Override
    public boolean disconnect(String sessionId, ConnectionHandle connection) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        synchronized (session) {
            return markDisconnected(session, connection);
        }
    }

    @Override
    public ReconnectionBuffer.ReplayResult reconnect(String sessionId, ConnectionHandle connection,
                                                     OptionalLong peerLastAcked) {
        Objects.requireNonNull(connection, "connection");
        checkRunning();
        Session session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionExpiredException(sessionId, 0);
        }

        ReconnectionBuffer.ReplayResult result;
        synchronized (session) {
            if (session.getState() == SessionState.EXPIRED) {
                throw new SessionExpiredException(sessionId, 0);
            }
            session.cancelExpiry();
            session.transitionTo(SessionState.RECONNECTING);

            ConnectionHandle previous = session.getConnection();
            if (previous != null && previous != connection) {
                // New socket arrived before the old one was noticed dead
                session.detach(now());
                session.getTracker().freeze();
                closeQuietly(sessionId, previous);
            }

            result = reconnectionBuffer.onReconnect(session, connection, peerLastAcked);

            session.countAcknowledged(result.acknowledged().size());
            session.countAbandoned(result.exhausted().size());
            session.countReplayed(result.replayed());
            if (session.getConnection() == connection) {
                session.transitionTo(SessionState.CONNECTED);
                session.countReconnect();
            }
        }

        recordAcknowledged(result.acknowledged());
        result.exhausted().forEach(e -> reportAbandoned(e, DeliveryFailedException.Reason.RETRIES_EXHAUSTED));
        replayed.addAndGet(result.replayed());
        reconnects.incrementAndGet();
        metrics.recordReplayed(result.replayed());
        metrics.recordReconnect();
        return result;
    }

    @Override
    public boolean abandon(String sessionId, String eventId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        Optional<EventEnvelope> cancelled;
        synchronized (session) {
            cancelled = session.getTracker().abandon(eventId);
            cancelled.ifPresent(e -> session.countAbandoned(1));
        }
        cancelled.ifPresent(e -> {
            log.info("Event {} (seq={}) of session {} cancelled", eventId, e.getSequence(), sessionId);
            reportAbandoned(e, DeliveryFailedException.Reason.CANCELLED);
        });
        return cancelled.isPresent();
    }

    @Override
    public int closeSession(String sessionId) {
        int dropped = destroy(sessionId, DeliveryFailedException.Reason.SESSION_CLOSED);
        if (dropped >= 0) {
            log.info("Session {} closed, {} pending events abandoned", sessionId, dropped);
        }
        return Math.max(dropped, 0);
    }

    @Override
    public Flux<DeliveryException> errors() {
        return errorSink.asFlux();
    }

    @Override
    public DeliveryStats stats() {
        long pending = 0;
        int connected = 0;
        for (Session session : sessions.values()) {
            synchronized (session) {
                pending += session.getTracker().pendingCount();
                if (session.isConnected()) {
                    connected++;
                }
            }
        }
        return DeliveryStats.builder()
                .published(published.get())
                .acknowledged(acknowledged.get())
                .abandoned(abandoned.get())
                .pending(pending)
                .retransmissions(retransmissions.get())
                .replayed(replayed.get())
                .reconnects(reconnects.get())
                .duplicatesDetected(duplicates.get())
                .gapsSkipped(gapsSkipped.get())
                .handlerErrors(handlerErrors.get())
                .sendFailures(sendFailures.get())
                .activeSessions(sessions.size())
                .connectedSessions(connected)
                .expiredSessions(sessionsExpired.get())
                .subscriptions(subscriptions.size())
                .build();
    }

    @Override
    public Optional<SessionStats> sessionStats(String sessionId) {
        Session session = sessions.get(sessionId);
        InboundSequencer sequencer = inbound.get(sessionId);
        if (session == null && sequencer == null) {
            return Optional.empty();
        }

        SessionStats.SessionStatsBuilder builder = SessionStats.builder()
                .sessionId(sessionId)
                .lastIssuedSequence(sequences.current(sessionId));
        if (sequencer != null) {
            builder.deliveredUpTo(sequencer.deliveredUpTo())
                    .held(sequencer.heldCount())
                    .missing(sequencer.missingCount())
                    .duplicatesDetected(sequencer.getDuplicatesDetected());
        }
        if (session != null) {
            synchronized (session) {
                builder.state(session.getState())
                        .connected(session.isConnected())
                        .lastAckedSequence(session.getTracker().lastAckedSequence())
                        .pending(session.getTracker().pendingCount())
                        .published(session.getPublished())
                        .acknowledged(session.getAcknowledged())
                        .abandoned(session.getAbandoned())
                        .retransmissions(session.getRetransmissions())
                        .replayed(session.getReplayed())
                        .reconnects(session.getReconnects());
            }
        }
        return Optional.of(builder.build());
    }

    @Override
    public Optional<SessionState> sessionState(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        synchronized (session) {
            return Optional.of(session.getState());
        }
    }

    @Override
    public Set<String> activeSessionIds() {
        return Set.copyOf(sessions.keySet());
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        inboundSweeper.dispose();
        log.info("Shutting down event bus with {} sessions", sessions.size());
        for (String sessionId : List.copyOf(sessions.keySet())) {
            destroy(sessionId, DeliveryFailedException.Reason.SHUTDOWN);
        }
        inbound.values().forEach(InboundSequencer::close);
        inbound.clear();
        evictedWatermarks.clear();
        subscriptions.clear();
        synchronized (errorSink) {
            errorSink.tryEmitComplete();
        }
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public BusConfig getConfig() {
        return config;
    }

    // ---- retransmission ----

    private void onRetryDue(String sessionId, long sequence, long token) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        try {
            EventEnvelope exhausted = null;
            synchronized (session) {
                DeliveryTracker tracker = session.getTracker();
                if (!tracker.claimTimer(sequence, token) || !session.isConnected()) {
                    return;
                }
                EventEnvelope current = tracker.get(sequence).orElseThrow();
                if (tracker.retriesExhausted(current)) {
                    exhausted = tracker.abandon(sequence).orElseThrow();
                    session.countAbandoned(1);
                } else {
                    EventEnvelope next = tracker.recordRetransmission(sequence).orElseThrow();
                    session.countRetransmission();
                    retransmissions.incrementAndGet();
                    metrics.recordRetransmission();
                    log.debug("Retransmitting seq={} of session {} (attempt {})",
                            sequence, sessionId, next.getRetryCount());
                    transmit(session, next);
                    if (session.isConnected()) {
                        tracker.arm(sequence);
                    }
                }
            }
            if (exhausted != null) {
                reportAbandoned(exhausted, DeliveryFailedException.Reason.RETRIES_EXHAUSTED);
            }
        } catch (RuntimeException e) {
            log.error("Retry of seq={} on session {} failed", sequence, sessionId, e);
        }
    }

    /**
     * Writes to the session's connection. A closed connection disconnects the session.
     * Caller holds the session monitor.
     */
    private boolean transmit(Session session, EventEnvelope envelope) {
        ConnectionHandle connection = session.getConnection();
        if (connection == null) {
            return false;
        }
        try {
            if (connection.send(envelope)) {
                session.getTracker().recordSent(envelope.getSequence());
                return true;
            }
            sendFailures.incrementAndGet();
            metrics.recordSendBackpressure();
            log.debug("Outbound buffer full on session {}, seq={} left to its retry timer",
                    session.getSessionId(), envelope.getSequence());
            return false;
        } catch (TransportException e) {
            sendFailures.incrementAndGet();
            metrics.recordSendClosed();
            log.warn("Connection {} of session {} failed: {}", connection.id(), session.getSessionId(), e.getMessage());
            markDisconnected(session, connection);
            return false;
        }
    }

    private void enforceBacklog(Session session, List<DeliveryFailedException> failures) {
        DeliveryTracker tracker = session.getTracker();
        while (tracker.pendingCount() > config.getMaxPendingPerSession()) {
            Optional<EventEnvelope> victim = tracker.oldestEvictable(e -> EventTypes.isCritical(e.getType()));
            if (victim.isEmpty()) {
                log.warn("Session {} holds {} pending critical events, nothing evictable",
                        session.getSessionId(), tracker.pendingCount());
                return;
            }
            EventEnvelope evicted = tracker.abandon(victim.get().getSequence()).orElseThrow();
            session.countAbandoned(1);
            failures.add(abandonment(evicted, DeliveryFailedException.Reason.BACKLOG_OVERFLOW));
        }
    }

    // ---- session lifecycle ----

    /**
     * Caller holds the session monitor.
     *
     * @param expected connection that failed, or null to disconnect whatever is attached
     */
    private boolean markDisconnected(Session session, ConnectionHandle expected) {
        if (expected != null && session.getConnection() != expected) {
            return false;
        }
        SessionState state = session.getState();
        if (state != SessionState.CONNECTED && state != SessionState.RECONNECTING) {
            return false;
        }
        ConnectionHandle previous = session.detach(now());
        session.transitionTo(SessionState.DISCONNECTED);
        session.getTracker().freeze();
        if (previous != null) {
            closeQuietly(session.getSessionId(), previous);
        }

        String sessionId = session.getSessionId();
        Duration idle = config.getSessionIdleTimeout();
        session.scheduleExpiry(scheduler.schedule(() -> onExpiryDue(sessionId),
                idle.toMillis(), TimeUnit.MILLISECONDS));
        log.info("Session {} disconnected, {} pending events held for {}",
                sessionId, session.getTracker().pendingCount(), idle);
        return true;
    }

    private void onExpiryDue(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        List<EventEnvelope> dropped;
        synchronized (session) {
            if (session.getState() != SessionState.DISCONNECTED || session.getDisconnectedAt() == null) {
                return;
            }
            Duration idle = Duration.between(session.getDisconnectedAt(), now());
            if (idle.compareTo(config.getSessionIdleTimeout()) < 0) {
                // Fired for an earlier disconnect
                return;
            }
            dropped = teardown(session);
        }
        closeInbound(sessionId);

        sessionsExpired.incrementAndGet();
        metrics.recordSessionExpired();
        log.info("Session {} expired after {} without reconnect, {} pending events abandoned",
                sessionId, config.getSessionIdleTimeout(), dropped.size());
        dropped.forEach(e -> reportAbandoned(e, DeliveryFailedException.Reason.SESSION_EXPIRED));
        emit(new SessionExpiredException(sessionId, dropped.size()));
    }

    /**
     * @return abandoned count, -1 if the session did not exist
     */
    private int destroy(String sessionId, DeliveryFailedException.Reason reason) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            closeInbound(sessionId);
            return -1;
        }
        List<EventEnvelope> dropped;
        ConnectionHandle connection;
        synchronized (session) {
            if (session.getState() == SessionState.EXPIRED) {
                return -1;
            }
            connection = session.detach(now());
            dropped = teardown(session);
        }
        if (connection != null) {
            closeQuietly(sessionId, connection);
        }
        closeInbound(sessionId);
        dropped.forEach(e -> reportAbandoned(e, reason));
        return dropped.size();
    }

    /**
     * Caller holds the session monitor.
     */
    private List<EventEnvelope> teardown(Session session) {
        session.cancelExpiry();
        session.transitionTo(SessionState.EXPIRED);
        List<EventEnvelope> dropped = session.getTracker().abandonAll();
        session.countAbandoned(dropped.size());
        sessions.remove(session.getSessionId(), session);
        sequences.release(session.getSessionId());
        return dropped;
    }

    private void closeInbound(String sessionId) {
        evictedWatermarks.remove(sessionId);
        InboundSequencer sequencer = inbound.remove(sessionId);
        if (sequencer != null) {
            sequencer.close();
        }
    }

    private void closeQuietly(String sessionId, ConnectionHandle connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.debug("Closing connection {} of session {} failed: {}", connection.id(), sessionId, e.getMessage());
        }
    }

    // ---- receive side ----

    private InboundSequencer newSequencer(String sessionId) {
        DuplicateFilter filter = new DuplicateFilter(sessionId, config.getDedupCapacity(),
                config.getDedupWindow(), () -> scheduler.now(TimeUnit.MILLISECONDS));
        InboundSequencer sequencer = new InboundSequencer(sessionId, filter, config.getReorderBufferMax(),
                config.getGapTimeout(), config.settleHorizon(), scheduler, this::onGapReleased);
        Long watermark = evictedWatermarks.remove(sessionId);
        if (watermark != null) {
            sequencer.resumeAfter(watermark);
        }
        return sequencer;
    }

    /**
     * Forgets receive state of sessions without a send side here once nothing arrived for
     * {@code inboundIdleTimeout} and nothing is held or missing. Only the release watermark is
     * kept, for a bounded number of sessions, so a session that speaks again resumes after it
     * instead of waiting out a gap back to sequence 1. Bus sessions drop their state on teardown.
     */
    private void evictIdleInbound() {
        Duration idleFor = config.getInboundIdleTimeout();
        int evicted = 0;
        for (Map.Entry<String, InboundSequencer> entry : inbound.entrySet()) {
            if (sessions.containsKey(entry.getKey())) {
                continue;
            }
            InboundSequencer sequencer = entry.getValue();
            synchronized (sequencer) {
                // Watermark is recorded before onReceive can observe the retirement
                if (sequencer.isRetired() || !sequencer.retireIfIdle(idleFor)) {
                    continue;
                }
                evictedWatermarks.put(entry.getKey(), sequencer.deliveredUpTo());
            }
            inbound.remove(entry.getKey(), sequencer);
            evicted++;
        }
        if (evicted > 0) {
            log.info("Evicted receive state of {} idle sessions", evicted);
        }
    }

    /**
     * Called with the sequencer monitor held.
     */
    private void onGapReleased(String sessionId, List<EventEnvelope> ready, WireMessages.Ack ack) {
        gapsSkipped.incrementAndGet();
        metrics.recordGapSkipped();
        ready.forEach(this::dispatch);

        Session session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        synchronized (session) {
            ConnectionHandle connection = session.getConnection();
            if (connection == null) {
                return;
            }
            try {
                connection.sendAck(ack);
            } catch (TransportException e) {
                markDisconnected(session, connection);
            }
        }
    }

    private void dispatch(EventEnvelope envelope) {
        for (Subscription subscription : subscriptions.snapshot()) {
            try {
                if (subscription.filter().matches(envelope)) {
                    subscription.handler().handle(envelope);
                }
            } catch (Exception e) {
                handlerErrors.incrementAndGet();
                metrics.recordHandlerError();
                log.warn("Handler {} failed on {} seq={} of session {}", subscription.id(),
                        envelope.getType(), envelope.getSequence(), envelope.getSessionId(), e);
            }
        }
    }

    // ---- reporting ----

    private void recordAcknowledged(List<EventEnvelope> settled) {
        if (settled.isEmpty()) {
            return;
        }
        acknowledged.addAndGet(settled.size());
        metrics.recordAcknowledged(settled.size());
        Instant now = now();
        settled.forEach(e -> metrics.recordAckLatency(Duration.between(e.getCreatedAt(), now)));
    }

    private DeliveryFailedException abandonment(EventEnvelope envelope, DeliveryFailedException.Reason reason) {
        abandoned.incrementAndGet();
        metrics.recordAbandoned(reason);
        return new DeliveryFailedException(envelope, reason);
    }

    private void reportAbandoned(EventEnvelope envelope, DeliveryFailedException.Reason reason) {
        emit(abandonment(envelope, reason));
    }

    private void emit(DeliveryException error) {
        log.warn(error.getMessage());
        synchronized (errorSink) {
            Sinks.EmitResult result = errorSink.tryEmitNext(error);
            if (result.isFailure()) {
                log.warn("Error event for session {} not delivered: {}", error.getSessionId(), result);
            }
        }
    }

    private Instant now() {
        return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
    }

    private void checkRunning() {
        if (shutdown) {
            throw new IllegalStateException("Event bus is shut down");
        }
    }
}
