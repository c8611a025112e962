package com.qqsuccubus.delivery.core.bus;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time totals of a bus since start.
 * <p>
 * Every published event ends up acknowledged, abandoned or still pending:
 * {@code published == acknowledged + abandoned + pending}.
 * </p>
 */
@Value
@Builder
public class DeliveryStats {
    long published;
    long acknowledged;
    long abandoned;
    long pending;
    long retransmissions;
    long replayed;
    long reconnects;
    long duplicatesDetected;
    long gapsSkipped;
    long handlerErrors;
    long sendFailures;
    int activeSessions;
    int connectedSessions;
    long expiredSessions;
    int subscriptions;
}
