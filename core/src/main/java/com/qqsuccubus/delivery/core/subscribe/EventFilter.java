package com.qqsuccubus.delivery.core.subscribe;

import com.qqsuccubus.delivery.core.msg.EventEnvelope;

import java.util.Set;

/**
 * Selects the envelopes a subscription receives.
 */
@FunctionalInterface
public interface EventFilter {

    boolean matches(EventEnvelope envelope);

    static EventFilter all() {
        return envelope -> true;
    }

    static EventFilter types(String... types) {
        Set<String> accepted = Set.of(types);
        return envelope -> accepted.contains(envelope.getType());
    }

    static EventFilter session(String sessionId) {
        return envelope -> sessionId.equals(envelope.getSessionId());
    }

    default EventFilter and(EventFilter other) {
        return envelope -> matches(envelope) && other.matches(envelope);
    }
}
