package com.qqsuccubus.delivery.core.bus;

import com.qqsuccubus.delivery.core.delivery.DeliveryTracker;
import lombok.Getter;
import reactor.core.Disposable;

import java.time.Instant;

/**
 * Send-side state of one logical session.
 * <p>
 * Owned by {@link EventBus}; every read and write happens while holding the session's
 * monitor ({@code synchronized (session)}).
 * </p>
 */
@Getter
public class Session {
    private final String sessionId;
    private final DeliveryTracker tracker;
    private final Instant createdAt;
    private SessionState state = SessionState.CONNECTING;
    private ConnectionHandle connection;
    private Instant disconnectedAt;
    private Disposable expiryTimer;

    // Lifetime counters
    private long published;
    private long acknowledged;
    private long abandoned;
    private long retransmissions;
    private long replayed;
    private int reconnects;

    Session(String sessionId, DeliveryTracker tracker, Instant createdAt) {
        this.sessionId = sessionId;
        this.tracker = tracker;
        this.createdAt = createdAt;
    }

    /**
     * @throws IllegalStateException for a transition the lifecycle does not allow
     */
    void transitionTo(SessionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Session " + sessionId + ": illegal transition "
                    + state + " -> " + next);
        }
        state = next;
    }

    void attach(ConnectionHandle connection) {
        this.connection = connection;
        this.disconnectedAt = null;
    }

    ConnectionHandle detach(Instant at) {
        ConnectionHandle previous = connection;
        connection = null;
        disconnectedAt = at;
        return previous;
    }

    void scheduleExpiry(Disposable timer) {
        cancelExpiry();
        expiryTimer = timer;
    }

    void cancelExpiry() {
        if (expiryTimer != null) {
            expiryTimer.dispose();
            expiryTimer = null;
        }
    }

    public boolean isConnected() {
        return state == SessionState.CONNECTED && connection != null;
    }

    void countPublished() {
        published++;
    }

    void countAcknowledged(int count) {
        acknowledged += count;
    }

    void countAbandoned(int count) {
        abandoned += count;
    }

    void countRetransmission() {
        retransmissions++;
    }

    void countReplayed(int count) {
        replayed += count;
    }

    void countReconnect() {
        reconnects++;
    }
}
