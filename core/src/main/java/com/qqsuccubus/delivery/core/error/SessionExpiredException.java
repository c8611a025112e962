package com.qqsuccubus.delivery.core.error;

import lombok.Getter;

/**
 * The session is unknown or was destroyed after its idle timeout.
 * <p>
 * No replay is possible; the client has to start a new session.
 * </p>
 */
@Getter
public class SessionExpiredException extends DeliveryException {
    private final int abandonedEvents;

    public SessionExpiredException(String sessionId, int abandonedEvents) {
        super(sessionId, "Session " + sessionId + " expired or unknown"
                + (abandonedEvents > 0 ? " (" + abandonedEvents + " pending events abandoned)" : ""));
        this.abandonedEvents = abandonedEvents;
    }
}
