package com.qqsuccubus.delivery.core.error;

import com.qqsuccubus.delivery.core.msg.EventEnvelope;
import lombok.Getter;

/**
 * An envelope was abandoned without being acknowledged.
 * <p>
 * The application decides whether to publish the content again as a new event.
 * </p>
 */
@Getter
public class DeliveryFailedException extends DeliveryException {

    public enum Reason {
        RETRIES_EXHAUSTED,
        BACKLOG_OVERFLOW,
        SESSION_EXPIRED,
        SESSION_CLOSED,
        CANCELLED,
        SHUTDOWN
    }

    private final transient EventEnvelope envelope;
    private final Reason reason;

    public DeliveryFailedException(EventEnvelope envelope, Reason reason) {
        super(envelope.getSessionId(), String.format("Delivery of %s (seq=%d, id=%s) failed after %d retries: %s",
                envelope.getType(), envelope.getSequence(), envelope.getEventId(), envelope.getRetryCount(), reason));
        this.envelope = envelope;
        this.reason = reason;
    }
}
