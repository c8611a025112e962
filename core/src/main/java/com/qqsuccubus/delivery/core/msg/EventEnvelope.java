package com.qqsuccubus.delivery.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Unit of tracked delivery for one application event.
 * <p>
 * <b>Ordering:</b> {@code sequence} is strictly increasing per {@code sessionId}, starting at 1.
 * </p>
 * <p>
 * <b>Identity:</b> {@code eventId} is assigned once and reused by every retransmission and
 * replay, so receivers deduplicate on it regardless of {@code retryCount}.
 * </p>
 * <p>
 * {@code ackState} and {@code retryCount} are sender-local bookkeeping and never go on the wire.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"type", "event_id", "sequence", "session_id", "data", "timestamp"})
public class EventEnvelope {

    @JsonProperty("event_id")
    String eventId;

    @JsonProperty("sequence")
    long sequence;

    @JsonProperty("session_id")
    String sessionId;

    /**
     * Application event kind, e.g. {@code agent_started}. Opaque to the bus.
     */
    @JsonProperty("type")
    String type;

    @JsonProperty("data")
    JsonNode data;

    @JsonProperty("timestamp")
    Instant createdAt;

    @JsonIgnore
    @Builder.Default
    AckState ackState = AckState.PENDING;

    @JsonIgnore
    @With
    int retryCount;

    @JsonCreator
    public static EventEnvelope fromWire(
            @JsonProperty("event_id") String eventId,
            @JsonProperty("sequence") long sequence,
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("type") String type,
            @JsonProperty("data") JsonNode data,
            @JsonProperty("timestamp") Instant createdAt
    ) {
        return EventEnvelope.builder()
                .eventId(eventId)
                .sequence(sequence)
                .sessionId(sessionId)
                .type(type)
                .data(data)
                .createdAt(createdAt)
                .build();
    }

    public EventEnvelope acknowledged() {
        return toBuilder().ackState(ackState.transitionTo(AckState.ACKNOWLEDGED)).build();
    }

    public EventEnvelope abandoned() {
        return toBuilder().ackState(ackState.transitionTo(AckState.ABANDONED)).build();
    }

    /**
     * Copy used for a retransmission: same identity and sequence, one more attempt.
     */
    public EventEnvelope nextAttempt() {
        return withRetryCount(retryCount + 1);
    }
}
