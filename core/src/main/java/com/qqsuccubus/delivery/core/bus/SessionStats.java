package com.qqsuccubus.delivery.core.bus;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SessionStats {
    String sessionId;
    SessionState state;
    boolean connected;
    long lastIssuedSequence;
    long lastAckedSequence;
    int pending;
    long published;
    long acknowledged;
    long abandoned;
    long retransmissions;
    long replayed;
    int reconnects;
    // Receive side, zero when nothing was received on the session
    long deliveredUpTo;
    int held;
    int missing;
    long duplicatesDetected;
}
