package com.qqsuccubus.delivery.core.bus;

/**
 * Lifecycle of a logical session.
 * <pre>
 * CONNECTING -> CONNECTED -> DISCONNECTED -> RECONNECTING -> CONNECTED
 *                    |             |               |
 *                    +------> RECONNECTING         +-> DISCONNECTED
 * any non-terminal state -> EXPIRED
 * </pre>
 */
public enum SessionState {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    RECONNECTING,
    EXPIRED;

    public boolean canTransitionTo(SessionState next) {
        return switch (this) {
            case CONNECTING -> next == CONNECTED || next == EXPIRED;
            case CONNECTED -> next == DISCONNECTED || next == RECONNECTING || next == EXPIRED;
            case DISCONNECTED -> next == RECONNECTING || next == EXPIRED;
            case RECONNECTING -> next == CONNECTED || next == DISCONNECTED || next == EXPIRED;
            case EXPIRED -> false;
        };
    }
}
