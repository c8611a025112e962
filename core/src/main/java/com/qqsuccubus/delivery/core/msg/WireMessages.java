package com.qqsuccubus.delivery.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Control frames exchanged next to {@link EventEnvelope} frames on a WebSocket.
 */
public final class WireMessages {
    private WireMessages() {
    }

    /**
     * Cumulative acknowledgment: every sequence up to and including {@code upToSequence}
     * was processed by the receiver, except the ones listed in {@code missing}.
     * <p>
     * {@code missing} holds sequences the receiver gave up waiting for and released past.
     * They are still owed: the sender keeps them pending, and a late arrival is delivered.
     * </p>
     */
    @Value
    @JsonPropertyOrder({"type", "session_id", "up_to_sequence", "missing"})
    public static class Ack {
        @JsonProperty("type")
        String type;

        @JsonProperty("session_id")
        String sessionId;

        @JsonProperty("up_to_sequence")
        long upToSequence;

        @JsonProperty("missing")
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        List<Long> missing;

        @JsonCreator
        public Ack(
                @JsonProperty("type") String type,
                @JsonProperty("session_id") String sessionId,
                @JsonProperty("up_to_sequence") long upToSequence,
                @JsonProperty("missing") List<Long> missing
        ) {
            this.type = type == null ? EventTypes.ACK : type;
            this.sessionId = sessionId;
            this.upToSequence = upToSequence;
            this.missing = missing == null ? List.of() : List.copyOf(missing);
        }

        public static Ack of(String sessionId, long upToSequence) {
            return new Ack(EventTypes.ACK, sessionId, upToSequence, List.of());
        }

        public static Ack of(String sessionId, long upToSequence, List<Long> missing) {
            return new Ack(EventTypes.ACK, sessionId, upToSequence, missing);
        }

        /**
         * Highest sequence below which nothing is missing, the position to resume from.
         */
        public long resumePosition() {
            return missing.isEmpty() ? upToSequence : Math.min(upToSequence, missing.get(0) - 1);
        }
    }

    /**
     * First frame on every connection.
     * <p>
     * {@code resumed} is false for a fresh session; {@code replayCount} is the number of
     * envelopes that follow this frame as replay before live traffic.
     * </p>
     */
    @Value
    @Builder(toBuilder = true)
    @JsonPropertyOrder({"type", "session_id", "node_id", "resumed", "last_acked_sequence",
            "replay_count", "resume_token"})
    public static class Welcome {
        @JsonProperty("type")
        String type;

        @JsonProperty("session_id")
        String sessionId;

        @JsonProperty("node_id")
        String nodeId;

        @JsonProperty("resumed")
        boolean resumed;

        @JsonProperty("last_acked_sequence")
        long lastAckedSequence;

        @JsonProperty("replay_count")
        int replayCount;

        @JsonProperty("resume_token")
        String resumeToken;

        @JsonCreator
        public Welcome(
                @JsonProperty("type") String type,
                @JsonProperty("session_id") String sessionId,
                @JsonProperty("node_id") String nodeId,
                @JsonProperty("resumed") boolean resumed,
                @JsonProperty("last_acked_sequence") long lastAckedSequence,
                @JsonProperty("replay_count") int replayCount,
                @JsonProperty("resume_token") String resumeToken
        ) {
            this.type = type == null ? EventTypes.WELCOME : type;
            this.sessionId = sessionId;
            this.nodeId = nodeId;
            this.resumed = resumed;
            this.lastAckedSequence = lastAckedSequence;
            this.replayCount = replayCount;
            this.resumeToken = resumeToken;
        }
    }

    /**
     * Sent before closing a connection whose session can no longer be resumed.
     * The client must start a new session.
     */
    @Value
    @JsonPropertyOrder({"type", "session_id", "reason"})
    public static class SessionExpiredNotice {
        @JsonProperty("type")
        String type;

        @JsonProperty("session_id")
        String sessionId;

        @JsonProperty("reason")
        String reason;

        @JsonCreator
        public SessionExpiredNotice(
                @JsonProperty("type") String type,
                @JsonProperty("session_id") String sessionId,
                @JsonProperty("reason") String reason
        ) {
            this.type = type == null ? EventTypes.SESSION_EXPIRED : type;
            this.sessionId = sessionId;
            this.reason = reason;
        }

        public static SessionExpiredNotice of(String sessionId, String reason) {
            return new SessionExpiredNotice(EventTypes.SESSION_EXPIRED, sessionId, reason);
        }
    }
}
