package com.qqsuccubus.delivery.core.msg;

/**
 * Delivery state of an envelope. Only {@code PENDING} may change; the other two are terminal.
 */
public enum AckState {
    PENDING,
    ACKNOWLEDGED,
    ABANDONED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Validates a transition and returns the target state.
     *
     * @throws IllegalStateException if leaving a terminal state or going back to PENDING
     */
    public AckState transitionTo(AckState next) {
        if (this != PENDING || next == PENDING) {
            throw new IllegalStateException("Illegal ack state transition " + this + " -> " + next);
        }
        return next;
    }
}
