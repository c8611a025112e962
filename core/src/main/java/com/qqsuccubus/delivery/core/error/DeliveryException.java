package com.qqsuccubus.delivery.core.error;

import lombok.Getter;

/**
 * Root of the delivery failure hierarchy. All subclasses are unchecked.
 */
@Getter
public class DeliveryException extends RuntimeException {
    private final String sessionId;

    public DeliveryException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public DeliveryException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }
}
