package com.qqsuccubus.delivery.core.delivery;

import com.qqsuccubus.delivery.core.config.BusConfig;
import com.qqsuccubus.delivery.core.msg.EventEnvelope;
import com.qqsuccubus.delivery.core.util.JitterBackoff;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Pending envelopes of one session and their retransmission timers.
 * <p>
 * <b>Timer lifecycle:</b> an envelope is tracked unarmed; the owner arms it right after a
 * transmission. A due timer does not retransmit by itself: it calls the {@link RetryListener},
 * which decides under the session lock whether to resend or abandon.
 * </p>
 * <p>
 * Not thread-safe. The owning session serializes every call, including retry callbacks.
 * </p>
 */
public class DeliveryTracker {

    /**
     * Invoked on the scheduler when a retry timer fires. {@code token} identifies the timer
     * instance so that callbacks racing with cancellation can be recognized via
     * {@link #claimTimer(long, long)}.
     */
    @FunctionalInterface
    public interface RetryListener {
        void onRetryDue(String sessionId, long sequence, long token);
    }

    private record RetryTimer(long token, Disposable task) {
    }

    private final String sessionId;
    private final BusConfig config;
    private final Scheduler scheduler;
    private final RetryListener listener;

    private final TreeMap<Long, EventEnvelope> pending = new TreeMap<>();
    private final Map<Long, RetryTimer> timers = new HashMap<>();
    // Pending sequences written to a connection at least once
    private final Set<Long> sent = new HashSet<>();
    // Sequences the peer reported as missing in its latest ack
    private Set<Long> peerMissing = Set.of();
    private long lastAckedSequence;
    private long nextToken;

    public DeliveryTracker(String sessionId, BusConfig config, Scheduler scheduler, RetryListener listener) {
        this.sessionId = sessionId;
        this.config = config;
        this.scheduler = scheduler;
        this.listener = listener;
    }

    /**
     * Registers a PENDING envelope. Its timer stays unarmed until {@link #arm(long)}.
     *
     * @throws IllegalArgumentException if the envelope is not pending, belongs to another
     *                                  session or reuses a tracked sequence
     */
    public void track(EventEnvelope envelope) {
        if (envelope.getAckState().isTerminal()) {
            throw new IllegalArgumentException("Cannot track envelope in state " + envelope.getAckState());
        }
        if (!sessionId.equals(envelope.getSessionId())) {
            throw new IllegalArgumentException("Envelope of session " + envelope.getSessionId()
                    + " tracked by session " + sessionId);
        }
        if (pending.containsKey(envelope.getSequence())) {
            throw new IllegalArgumentException("Sequence " + envelope.getSequence() + " already tracked");
        }
        pending.put(envelope.getSequence(), envelope);
    }

    /**
     * (Re)arms the retry timer of a pending envelope with a delay derived from its retry count.
     *
     * @return false if the sequence is not pending
     */
    public boolean arm(long sequence) {
        EventEnvelope envelope = pending.get(sequence);
        if (envelope == null) {
            return false;
        }
        cancelTimer(sequence);

        long token = ++nextToken;
        Duration delay = backoffFor(envelope.getRetryCount());
        Disposable task = scheduler.schedule(
                () -> listener.onRetryDue(sessionId, sequence, token),
                delay.toMillis(), TimeUnit.MILLISECONDS);
        timers.put(sequence, new RetryTimer(token, task));
        return true;
    }

    public void armAll() {
        for (Long sequence : new ArrayList<>(pending.keySet())) {
            arm(sequence);
        }
    }

    /**
     * Cancels every timer. Retry counts are left untouched so the envelopes resume at the
     * same backoff level once re-armed.
     */
    public void freeze() {
        timers.values().forEach(t -> t.task().dispose());
        timers.clear();
    }

    /**
     * Consumes the timer identified by {@code token}.
     *
     * @return false for a stale callback (timer replaced, cancelled or envelope gone)
     */
    public boolean claimTimer(long sequence, long token) {
        RetryTimer timer = timers.get(sequence);
        if (timer == null || timer.token() != token) {
            return false;
        }
        timers.remove(sequence);
        return pending.containsKey(sequence);
    }

    /**
     * Cumulative acknowledgment without a missing list. Sequences the peer last reported as
     * missing stay pending.
     *
     * @return envelopes that moved to ACKNOWLEDGED, ascending; empty for a repeated ack
     */
    public List<EventEnvelope> acknowledge(long upToSequence) {
        return settle(upToSequence, peerMissing);
    }

    /**
     * Cumulative acknowledgment of everything up to {@code upToSequence} except the
     * sequences the peer skipped and still waits for.
     *
     * @return envelopes that moved to ACKNOWLEDGED, ascending; empty for a repeated ack
     */
    public List<EventEnvelope> acknowledge(long upToSequence, Collection<Long> missing) {
        peerMissing = missing.isEmpty() ? Set.of() : Set.copyOf(missing);
        return settle(upToSequence, peerMissing);
    }

    private List<EventEnvelope> settle(long upToSequence, Set<Long> excluded) {
        lastAckedSequence = Math.max(lastAckedSequence, upToSequence);

        List<EventEnvelope> acked = new ArrayList<>();
        Iterator<Map.Entry<Long, EventEnvelope>> it = pending.headMap(upToSequence, true).entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Long, EventEnvelope> entry = it.next();
            if (excluded.contains(entry.getKey())) {
                continue;
            }
            cancelTimer(entry.getKey());
            sent.remove(entry.getKey());
            acked.add(entry.getValue().acknowledged());
            it.remove();
        }
        return acked;
    }

    /**
     * Notes that a pending envelope reached a connection, so sending it again is a retry.
     */
    public void recordSent(long sequence) {
        if (pending.containsKey(sequence)) {
            sent.add(sequence);
        }
    }

    public boolean wasSent(long sequence) {
        return sent.contains(sequence);
    }

    /**
     * Bumps the retry count of a pending envelope before it is sent again.
     *
     * @return the copy to transmit
     */
    public Optional<EventEnvelope> recordRetransmission(long sequence) {
        EventEnvelope current = pending.get(sequence);
        if (current == null) {
            return Optional.empty();
        }
        EventEnvelope next = current.nextAttempt();
        pending.put(sequence, next);
        return Optional.of(next);
    }

    public Optional<EventEnvelope> abandon(long sequence) {
        EventEnvelope removed = pending.remove(sequence);
        if (removed == null) {
            return Optional.empty();
        }
        cancelTimer(sequence);
        sent.remove(sequence);
        return Optional.of(removed.abandoned());
    }

    /**
     * Advisory cancellation by event id. Unknown or already settled ids are ignored.
     */
    public Optional<EventEnvelope> abandon(String eventId) {
        for (EventEnvelope envelope : pending.values()) {
            if (envelope.getEventId().equals(eventId)) {
                return abandon(envelope.getSequence());
            }
        }
        return Optional.empty();
    }

    public List<EventEnvelope> abandonAll() {
        freeze();
        List<EventEnvelope> abandoned = new ArrayList<>(pending.size());
        pending.values().forEach(e -> abandoned.add(e.abandoned()));
        pending.clear();
        sent.clear();
        return abandoned;
    }

    /**
     * Oldest pending envelope whose type is not critical, the eviction candidate when the
     * backlog is full.
     */
    public Optional<EventEnvelope> oldestEvictable(Predicate<EventEnvelope> critical) {
        return pending.values().stream().filter(critical.negate()).findFirst();
    }

    public Optional<EventEnvelope> get(long sequence) {
        return Optional.ofNullable(pending.get(sequence));
    }

    /**
     * Pending envelopes with a sequence strictly greater than {@code sequence}, ascending.
     */
    public List<EventEnvelope> pendingAfter(long sequence) {
        return new ArrayList<>(pending.tailMap(sequence, false).values());
    }

    public Collection<EventEnvelope> pending() {
        return List.copyOf(pending.values());
    }

    public int pendingCount() {
        return pending.size();
    }

    public long lastAckedSequence() {
        return lastAckedSequence;
    }

    public boolean isArmed(long sequence) {
        return timers.containsKey(sequence);
    }

    public int armedCount() {
        return timers.size();
    }

    public Duration backoffFor(int retryCount) {
        return JitterBackoff.next(retryCount, config.getInitialBackoff(), config.getMaxBackoff(),
                config.getRetryJitter());
    }

    public boolean retriesExhausted(EventEnvelope envelope) {
        return envelope.getRetryCount() >= config.getMaxRetries();
    }

    private void cancelTimer(long sequence) {
        RetryTimer timer = timers.remove(sequence);
        if (timer != null) {
            timer.task().dispose();
        }
    }
}
