package com.qqsuccubus.delivery.core.dedup;

import com.qqsuccubus.delivery.core.msg.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Bounded memory of event ids recently seen on one session.
 * <p>
 * An id is forgotten once {@code capacity} newer ids arrived or once it is older than
 * {@code window}, whichever comes first. Identity is the event id alone: a retransmission with a
 * higher retry count, or even a different payload, is still a duplicate.
 * </p>
 */
public class DuplicateFilter {
    private static final Logger log = LoggerFactory.getLogger(DuplicateFilter.class);

    private final String sessionId;
    private final int capacity;
    private final long windowMillis;
    private final LongSupplier clockMillis;

    // eventId -> first seen (epoch millis), insertion ordered so the eldest is at the head
    private final LinkedHashMap<String, Long> seen = new LinkedHashMap<>();
    private long duplicatesDetected;

    public DuplicateFilter(String sessionId, int capacity, Duration window, LongSupplier clockMillis) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.sessionId = sessionId;
        this.capacity = capacity;
        this.windowMillis = window.toMillis();
        this.clockMillis = clockMillis;
    }

    /**
     * Records the envelope's id.
     *
     * @return {@code true} for a first sighting, {@code false} for a duplicate
     */
    public synchronized boolean accept(EventEnvelope envelope) {
        long now = clockMillis.getAsLong();
        evictExpired(now);

        String eventId = envelope.getEventId();
        if (seen.containsKey(eventId)) {
            duplicatesDetected++;
            log.debug("Duplicate suppressed on session {}: eventId={}, seq={}, retry={}",
                    sessionId, eventId, envelope.getSequence(), envelope.getRetryCount());
            return false;
        }

        seen.put(eventId, now);
        if (seen.size() > capacity) {
            Iterator<String> eldest = seen.keySet().iterator();
            eldest.next();
            eldest.remove();
        }
        return true;
    }

    /**
     * Drops an id so the next copy of it is accepted again, used when an accepted envelope
     * could not be kept and must be retransmitted by the peer.
     */
    public synchronized void forget(String eventId) {
        seen.remove(eventId);
    }

    public synchronized boolean contains(String eventId) {
        evictExpired(clockMillis.getAsLong());
        return seen.containsKey(eventId);
    }

    public synchronized int size() {
        return seen.size();
    }

    public synchronized long getDuplicatesDetected() {
        return duplicatesDetected;
    }

    private void evictExpired(long now) {
        long cutoff = now - windowMillis;
        Iterator<Map.Entry<String, Long>> it = seen.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue() > cutoff) {
                break;
            }
            it.remove();
        }
    }
}
