package com.qqsuccubus.delivery.core.bus;

import com.qqsuccubus.delivery.core.error.TransportException;
import com.qqsuccubus.delivery.core.msg.EventEnvelope;
import com.qqsuccubus.delivery.core.msg.WireMessages;

/**
 * One physical connection currently carrying a session.
 * <p>
 * Implementations must not block: a full outbound buffer is reported by returning
 * {@code false}, and the envelope is retransmitted later by its retry timer.
 * </p>
 */
public interface ConnectionHandle {

    /**
     * Stable id of this physical connection, used in logs and to ignore late close
     * notifications of a replaced connection.
     */
    String id();

    /**
     * @return true if the frame was queued for writing, false under backpressure
     * @throws TransportException if the connection is closed
     */
    boolean send(EventEnvelope envelope);

    /**
     * @return true if the frame was queued for writing, false under backpressure
     * @throws TransportException if the connection is closed
     */
    boolean sendAck(WireMessages.Ack ack);

    /**
     * Closes the connection. Idempotent.
     */
    void close();
}
