package com.qqsuccubus.delivery.core.subscribe;

import com.qqsuccubus.delivery.core.msg.EventEnvelope;

/**
 * Application callback for events released in order by the receive side.
 * Exceptions are logged and counted; they never affect other handlers or delivery.
 */
@FunctionalInterface
public interface EventHandler {
    void handle(EventEnvelope envelope) throws Exception;
}
