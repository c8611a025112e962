package com.qqsuccubus.delivery.core.sequence;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues gapless, strictly increasing sequence numbers per session, starting at 1.
 * <p>
 * Thread-safe: concurrent callers for the same session never receive the same value.
 * </p>
 */
public class SequenceAssigner {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    /**
     * Returns the next sequence for the session, registering it on first use.
     *
     * @throws IllegalStateException if the sequence space of the session is exhausted
     */
    public long next(String sessionId) {
        AtomicLong counter = counters.computeIfAbsent(sessionId, id -> new AtomicLong());
        return counter.updateAndGet(current -> {
            if (current == Long.MAX_VALUE) {
                throw new IllegalStateException("Sequence space exhausted for session " + sessionId);
            }
            return current + 1;
        });
    }

    /**
     * Last issued sequence, or 0 when none was issued yet.
     */
    public long current(String sessionId) {
        AtomicLong counter = counters.get(sessionId);
        return counter == null ? 0 : counter.get();
    }

    public void register(String sessionId) {
        counters.putIfAbsent(sessionId, new AtomicLong());
    }

    public void release(String sessionId) {
        counters.remove(sessionId);
    }

    /**
     * Starts a session at an arbitrary point. Only meant for restoring state and tests.
     */
    void seed(String sessionId, long lastIssued) {
        counters.put(sessionId, new AtomicLong(lastIssued));
    }
}
