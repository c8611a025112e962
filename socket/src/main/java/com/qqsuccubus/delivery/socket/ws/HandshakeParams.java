package com.qqsuccubus.delivery.socket.ws;

import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.Value;

import java.util.Collection;
import java.util.OptionalLong;
import java.util.stream.Stream;

/**
 * Query parameters of {@code /ws/connect}.
 * <p>
 * {@code sessionId} and {@code lastAckedSequence} resume a known session; {@code resumeToken}
 * resumes the session it was signed for. Without either a fresh session is created.
 * </p>
 */
@Value
public class HandshakeParams {
    public static final String SESSION_ID = "sessionId";
    public static final String LAST_ACKED_SEQUENCE = "lastAckedSequence";
    public static final String RESUME_TOKEN = "resumeToken";

    String sessionId;
    OptionalLong lastAckedSequence;
    String resumeToken;

    /**
     * @throws IllegalArgumentException if {@code lastAckedSequence} is not a non-negative number
     */
    public static HandshakeParams parse(String uri) {
        QueryStringDecoder decoder = new QueryStringDecoder(uri);

        String sessionId = first(decoder, SESSION_ID);
        String resumeToken = first(decoder, RESUME_TOKEN);
        String lastAcked = first(decoder, LAST_ACKED_SEQUENCE);

        OptionalLong lastAckedSequence = OptionalLong.empty();
        if (lastAcked != null) {
            long value;
            try {
                value = Long.parseLong(lastAcked);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("lastAckedSequence is not a number: " + lastAcked, e);
            }
            if (value < 0) {
                throw new IllegalArgumentException("lastAckedSequence must be >= 0: " + value);
            }
            lastAckedSequence = OptionalLong.of(value);
        }
        return new HandshakeParams(sessionId, lastAckedSequence, resumeToken);
    }

    public boolean hasSessionId() {
        return sessionId != null;
    }

    public boolean hasResumeToken() {
        return resumeToken != null;
    }

    private static String first(QueryStringDecoder decoder, String name) {
        return Stream.ofNullable(decoder.parameters().get(name))
                .flatMap(Collection::stream)
                .filter(value -> !value.isBlank())
                .findFirst()
                .orElse(null);
    }
}
