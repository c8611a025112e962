package com.qqsuccubus.delivery.core.bus;

import com.qqsuccubus.delivery.core.delivery.DeliveryTracker;
import com.qqsuccubus.delivery.core.msg.EventEnvelope;
import com.qqsuccubus.delivery.core.sequence.SequenceAssigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Brings a resumed session up to date on its new connection.
 * <p>
 * <b>Replay rule:</b> every pending envelope above the peer's last acknowledged sequence is
 * sent again, ascending, before the session accepts new traffic. Without a peer position the
 * whole pending queue is replayed; duplicates are cheaper than holes.
 * </p>
 * <p>
 * <b>Attempts:</b> replaying an envelope that already reached a connection counts as a
 * retry. One whose retries are used up is abandoned instead of replayed, so a link that
 * keeps dropping cannot cycle an event forever.
 * </p>
 * <p>
 * Must be called while holding the session monitor.
 * </p>
 */
public class ReconnectionBuffer {
    private static final Logger log = LoggerFactory.getLogger(ReconnectionBuffer.class);

    /**
     * Writes one envelope to the session's current connection.
     *
     * @return false if the envelope could not be written now
     */
    @FunctionalInterface
    public interface Transmitter {
        boolean transmit(Session session, EventEnvelope envelope);
    }

    /**
     * @param acknowledged envelopes settled by the peer's position
     * @param exhausted    envelopes abandoned because their retries were used up
     * @param replayed     envelopes written to the new connection
     * @param remaining    envelopes left to the retry timers because the connection refused them
     */
    public record ReplayResult(List<EventEnvelope> acknowledged, List<EventEnvelope> exhausted,
                               int replayed, int remaining) {
        public boolean completed() {
            return remaining == 0;
        }
    }

    private final SequenceAssigner sequences;
    private final Transmitter transmitter;

    public ReconnectionBuffer(SequenceAssigner sequences, Transmitter transmitter) {
        this.sequences = sequences;
        this.transmitter = transmitter;
    }

    public ReplayResult onReconnect(Session session, ConnectionHandle connection, OptionalLong peerLastAcked) {
        String sessionId = session.getSessionId();
        DeliveryTracker tracker = session.getTracker();

        List<EventEnvelope> acknowledged = List.of();
        if (peerLastAcked.isPresent()) {
            long claimed = peerLastAcked.getAsLong();
            long issued = sequences.current(sessionId);
            if (claimed > issued) {
                log.warn("Session {} reconnected claiming seq {} but only {} was issued, clamping",
                        sessionId, claimed, issued);
            }
            acknowledged = tracker.acknowledge(Math.min(claimed, issued));
        }

        List<EventEnvelope> replay = tracker.pendingAfter(0);
        session.attach(connection);

        List<EventEnvelope> exhausted = new ArrayList<>();
        int replayed = 0;
        for (EventEnvelope envelope : replay) {
            long sequence = envelope.getSequence();
            EventEnvelope outgoing = envelope;
            if (tracker.wasSent(sequence)) {
                if (tracker.retriesExhausted(envelope)) {
                    exhausted.add(tracker.abandon(sequence).orElseThrow());
                    continue;
                }
                outgoing = tracker.recordRetransmission(sequence).orElseThrow();
            }
            if (!transmitter.transmit(session, outgoing)) {
                break;
            }
            replayed++;
        }

        // The transmitter detaches the session when the new connection dies mid-replay
        if (session.getConnection() == connection) {
            tracker.armAll();
        }

        log.info("Session {} resumed on connection {}: acked={}, replayed={}/{}, exhausted={}",
                sessionId, connection.id(), acknowledged.size(), replayed, replay.size(), exhausted.size());
        int remaining = replay.size() - replayed - exhausted.size();
        return new ReplayResult(acknowledged, exhausted, replayed, remaining);
    }
}
