package com.qqsuccubus.delivery.core.receive;

import com.qqsuccubus.delivery.core.dedup.DuplicateFilter;
import com.qqsuccubus.delivery.core.msg.EventEnvelope;
import com.qqsuccubus.delivery.core.msg.WireMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Receive side of one session: duplicate suppression followed by in-order release.
 * <p>
 * Envelopes are released strictly by sequence starting at 1. An envelope ahead of the next
 * expected sequence is held until the gap closes. If a gap stays open longer than
 * {@code gapTimeout} the held envelopes are released past it, but the skipped sequences are
 * remembered as missing: acks keep listing them so the sender does not settle them, and a
 * skipped envelope that shows up later is still delivered.
 * </p>
 * <p>
 * Missing sequences are forgotten once delivered, after {@code missingRetention}, or beyond
 * {@code reorderBufferMax} entries (oldest first).
 * </p>
 * <p>
 * All methods synchronize on this instance; releases (including gap skips) invoke the
 * {@link Releaser} while holding the lock, which keeps handler dispatch in sequence order.
 * </p>
 */
public class InboundSequencer {
    private static final Logger log = LoggerFactory.getLogger(InboundSequencer.class);

    public enum Outcome {
        /**
         * Released, possibly together with held successors.
         */
        DELIVERED,
        /**
         * Ahead of the next expected sequence; kept until the gap closes.
         */
        HELD,
        /**
         * A skipped sequence that arrived after its gap was given up; released out of order.
         */
        RECOVERED,
        /**
         * Event id already seen.
         */
        DUPLICATE,
        /**
         * Sequence already released or held under another id.
         */
        STALE,
        /**
         * Reorder buffer full; dropped so the sender retransmits later.
         */
        OVERFLOW
    }

    public record Offer(Outcome outcome, List<EventEnvelope> ready) {
    }

    /**
     * Receives envelopes released by a gap skip together with the ack to send upstream.
     */
    @FunctionalInterface
    public interface Releaser {
        void release(String sessionId, List<EventEnvelope> ready, WireMessages.Ack ack);
    }

    private final String sessionId;
    private final DuplicateFilter filter;
    private final int reorderBufferMax;
    private final Duration gapTimeout;
    private final Duration missingRetention;
    private final Scheduler scheduler;
    private final Releaser releaser;

    private final TreeMap<Long, EventEnvelope> held = new TreeMap<>();
    // skipped sequence -> skip time (scheduler millis)
    private final TreeMap<Long, Long> missing = new TreeMap<>();
    private long deliveredUpTo;
    private long lastActivityAt;
    private boolean retired;
    private Disposable gapTimer;
    private long gapGeneration;

    private long staleDropped;
    private long overflowDropped;
    private long gapsSkipped;
    private long recovered;

    public InboundSequencer(String sessionId, DuplicateFilter filter, int reorderBufferMax,
                            Duration gapTimeout, Duration missingRetention,
                            Scheduler scheduler, Releaser releaser) {
        this.sessionId = sessionId;
        this.filter = filter;
        this.reorderBufferMax = reorderBufferMax;
        this.gapTimeout = gapTimeout;
        this.missingRetention = missingRetention;
        this.scheduler = scheduler;
        this.releaser = releaser;
        this.lastActivityAt = now();
    }

    public synchronized Offer offer(EventEnvelope envelope) {
        lastActivityAt = now();
        if (!filter.accept(envelope)) {
            return new Offer(Outcome.DUPLICATE, List.of());
        }

        long sequence = envelope.getSequence();
        pruneMissing();
        if (missing.remove(sequence) != null) {
            recovered++;
            log.info("Skipped seq={} arrived late on session {}, delivering out of order ({} still missing)",
                    sequence, sessionId, missing.size());
            return new Offer(Outcome.RECOVERED, List.of(envelope));
        }

        if (sequence <= deliveredUpTo || held.containsKey(sequence)) {
            staleDropped++;
            log.debug("Stale envelope on session {}: seq={}, deliveredUpTo={}, eventId={}",
                    sessionId, sequence, deliveredUpTo, envelope.getEventId());
            return new Offer(Outcome.STALE, List.of());
        }

        if (sequence == deliveredUpTo + 1) {
            List<EventEnvelope> ready = new ArrayList<>();
            ready.add(envelope);
            deliveredUpTo = sequence;
            drainContiguous(ready);
            rescheduleGapTimer();
            return new Offer(Outcome.DELIVERED, ready);
        }

        if (held.size() >= reorderBufferMax) {
            // Accepting it later must still be possible
            filter.forget(envelope.getEventId());
            overflowDropped++;
            log.warn("Reorder buffer full on session {} ({} held), dropping seq={}",
                    sessionId, held.size(), sequence);
            return new Offer(Outcome.OVERFLOW, List.of());
        }

        held.put(sequence, envelope);
        if (gapTimer == null) {
            rescheduleGapTimer();
        }
        return new Offer(Outcome.HELD, List.of());
    }

    /**
     * Gives up waiting for the missing sequences before the lowest held envelope and releases
     * what becomes contiguous. The skipped sequences stay owed in every following ack.
     *
     * @return envelopes released, empty when nothing was held
     */
    public synchronized List<EventEnvelope> skipGap() {
        if (held.isEmpty()) {
            return List.of();
        }
        long from = deliveredUpTo + 1;
        long to = held.firstKey() - 1;
        log.warn("Skipping gap on session {}: sequences {}..{} never arrived within {}, still acked as missing",
                sessionId, from, to, gapTimeout);
        gapsSkipped++;
        recordMissing(from, to);
        deliveredUpTo = to;

        List<EventEnvelope> ready = new ArrayList<>();
        drainContiguous(ready);
        rescheduleGapTimer();
        releaser.release(sessionId, ready, ack());
        return ready;
    }

    /**
     * Continues a stream whose earlier state was dropped: everything up to {@code sequence}
     * counts as released. Ignored once anything was offered.
     */
    public synchronized void resumeAfter(long sequence) {
        if (deliveredUpTo == 0 && held.isEmpty() && missing.isEmpty()) {
            deliveredUpTo = sequence;
        }
    }

    /**
     * Acknowledgment for the current state: the release watermark minus what is still missing.
     */
    public synchronized WireMessages.Ack ack() {
        pruneMissing();
        return WireMessages.Ack.of(sessionId, deliveredUpTo, new ArrayList<>(missing.keySet()));
    }

    public synchronized long deliveredUpTo() {
        return deliveredUpTo;
    }

    public synchronized int heldCount() {
        return held.size();
    }

    public synchronized int missingCount() {
        return missing.size();
    }

    /**
     * True when nothing is held or owed and no envelope arrived for {@code idleFor}.
     */
    public synchronized boolean isIdle(Duration idleFor) {
        pruneMissing();
        return held.isEmpty() && missing.isEmpty() && now() - lastActivityAt >= idleFor.toMillis();
    }

    /**
     * Retires this sequencer if it {@link #isIdle(Duration) is idle}. A retired sequencer must
     * not be offered anything; its owner replaces it.
     */
    public synchronized boolean retireIfIdle(Duration idleFor) {
        if (!retired && isIdle(idleFor)) {
            close();
        }
        return retired;
    }

    public synchronized boolean isRetired() {
        return retired;
    }

    public synchronized long getStaleDropped() {
        return staleDropped;
    }

    public synchronized long getOverflowDropped() {
        return overflowDropped;
    }

    public synchronized long getGapsSkipped() {
        return gapsSkipped;
    }

    public synchronized long getRecovered() {
        return recovered;
    }

    public long getDuplicatesDetected() {
        return filter.getDuplicatesDetected();
    }

    public synchronized void close() {
        retired = true;
        cancelGapTimer();
        held.clear();
        missing.clear();
    }

    private void drainContiguous(List<EventEnvelope> ready) {
        EventEnvelope next;
        while ((next = held.remove(deliveredUpTo + 1)) != null) {
            ready.add(next);
            deliveredUpTo = next.getSequence();
        }
    }

    private void recordMissing(long from, long to) {
        long first = Math.max(from, to - reorderBufferMax + 1);
        if (first > from) {
            log.warn("Gap on session {} spans {} sequences, only the last {} are kept as missing",
                    sessionId, to - from + 1, reorderBufferMax);
        }
        long skippedAt = now();
        for (long sequence = first; sequence <= to; sequence++) {
            missing.put(sequence, skippedAt);
        }
        while (missing.size() > reorderBufferMax) {
            long dropped = missing.pollFirstEntry().getKey();
            log.warn("Too many missing sequences on session {}, no longer owed: seq={}", sessionId, dropped);
        }
    }

    private void pruneMissing() {
        if (missing.isEmpty()) {
            return;
        }
        long cutoff = now() - missingRetention.toMillis();
        int before = missing.size();
        missing.values().removeIf(skippedAt -> skippedAt <= cutoff);
        if (missing.size() < before) {
            log.info("Session {} stopped waiting for {} skipped sequences after {}",
                    sessionId, before - missing.size(), missingRetention);
        }
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    private void rescheduleGapTimer() {
        cancelGapTimer();
        if (held.isEmpty()) {
            return;
        }
        long generation = ++gapGeneration;
        gapTimer = scheduler.schedule(() -> onGapTimeout(generation),
                gapTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelGapTimer() {
        if (gapTimer != null) {
            gapTimer.dispose();
            gapTimer = null;
        }
    }

    private synchronized void onGapTimeout(long generation) {
        if (generation != gapGeneration) {
            return;
        }
        gapTimer = null;
        skipGap();
    }
}
