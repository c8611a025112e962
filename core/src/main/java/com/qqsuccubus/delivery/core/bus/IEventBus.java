package com.qqsuccubus.delivery.core.bus;

import com.qqsuccubus.delivery.core.error.DeliveryException;
import com.qqsuccubus.delivery.core.error.SessionExpiredException;
import com.qqsuccubus.delivery.core.msg.EventEnvelope;
import com.qqsuccubus.delivery.core.msg.WireMessages;
import com.qqsuccubus.delivery.core.subscribe.EventFilter;
import com.qqsuccubus.delivery.core.subscribe.EventHandler;
import reactor.core.publisher.Flux;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Reliable, ordered event delivery over replaceable connections.
 * <p>
 * Send side: {@link #publish}, {@link #acknowledge}, retransmission and replay. Receive side:
 * {@link #onReceive} deduplicates, reorders and dispatches to subscribed handlers.
 * Terminal failures are reported on {@link #errors()}.
 * </p>
 */
public interface IEventBus {

    /**
     * Creates a session bound to a live connection.
     *
     * @param sessionId  Requested id, or null to generate one
     * @param connection Connection carrying the session
     * @return the session id
     * @throws IllegalStateException if the session already exists or the bus is shut down
     */
    String openSession(String sessionId, ConnectionHandle connection);

    /**
     * Assigns the next sequence, tracks the envelope and sends it if the session is connected.
     * While disconnected the envelope waits for the replay.
     *
     * @param data Payload, converted to a JSON tree
     * @return the tracked envelope
     * @throws SessionExpiredException if the session is unknown or expired
     */
    EventEnvelope publish(String sessionId, String type, Object data);

    /**
     * Cumulative acknowledgment from the peer.
     *
     * @return number of envelopes settled by this call, 0 for a repeated ack
     */
    int acknowledge(String sessionId, long upToSequence);

    /**
     * Acknowledgment frame from the peer. Sequences it lists as missing stay pending even below
     * its watermark.
     *
     * @return number of envelopes settled by this call
     */
    int acknowledge(String sessionId, WireMessages.Ack ack);

    /**
     * Handles an envelope sent by the peer: duplicate suppression, reordering, then dispatch.
     *
     * @return the ack to send back, listing sequences still missing
     */
    WireMessages.Ack onReceive(String sessionId, EventEnvelope envelope);

    String subscribe(EventHandler handler, EventFilter filter);

    boolean unsubscribe(String subscriptionId);

    /**
     * Marks the session disconnected, freezes retry timers and starts the idle expiry.
     *
     * @return false if the session is unknown or not connected
     */
    boolean disconnect(String sessionId);

    /**
     * Like {@link #disconnect(String)}, ignored unless {@code connection} still carries the session.
     */
    boolean disconnect(String sessionId, ConnectionHandle connection);

    /**
     * Resumes a session on a new connection and replays what the peer has not acknowledged.
     *
     * @param peerLastAcked Highest sequence the peer processed, empty if unknown
     * @throws SessionExpiredException if the session is unknown or expired
     */
    ReconnectionBuffer.ReplayResult reconnect(String sessionId, ConnectionHandle connection, OptionalLong peerLastAcked);

    /**
     * Advisory cancellation of one pending event.
     *
     * @return true if the event was pending and is now abandoned
     */
    boolean abandon(String sessionId, String eventId);

    /**
     * Destroys the session; pending events are abandoned and reported.
     *
     * @return number of abandoned events
     */
    int closeSession(String sessionId);

    Flux<DeliveryException> errors();

    DeliveryStats stats();

    Optional<SessionStats> sessionStats(String sessionId);

    Optional<SessionState> sessionState(String sessionId);

    Set<String> activeSessionIds();

    /**
     * Abandons everything, closes connections and completes {@link #errors()}. Idempotent.
     */
    void shutdown();
}
