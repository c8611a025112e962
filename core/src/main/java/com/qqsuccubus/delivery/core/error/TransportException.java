package com.qqsuccubus.delivery.core.error;

/**
 * The underlying connection can no longer carry frames.
 * <p>
 * Raised by connection handles and handled inside the bus, which disconnects the session
 * and waits for a reconnect. Publishers never see it.
 * </p>
 */
public class TransportException extends DeliveryException {

    public TransportException(String sessionId, String message) {
        super(sessionId, message);
    }

    public TransportException(String sessionId, String message, Throwable cause) {
        super(sessionId, message, cause);
    }
}
