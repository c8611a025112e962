package com.qqsuccubus.delivery.socket.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.delivery.core.bus.IEventBus;
import com.qqsuccubus.delivery.core.bus.ReconnectionBuffer;
import com.qqsuccubus.delivery.core.bus.SessionStats;
import com.qqsuccubus.delivery.core.error.SessionExpiredException;
import com.qqsuccubus.delivery.core.msg.EventEnvelope;
import com.qqsuccubus.delivery.core.msg.EventTypes;
import com.qqsuccubus.delivery.core.msg.WireMessages;
import com.qqsuccubus.delivery.core.resume.ResumeToken;
import com.qqsuccubus.delivery.core.util.JsonUtils;
import com.qqsuccubus.delivery.socket.config.SocketConfig;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.time.Clock;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * WebSocket handler binding one socket to a logical session of the event bus.
 * <p>
 * Protocol (server → client):
 * <ul>
 *   <li>welcome: {session_id, node_id, resumed, last_acked_sequence, replay_count, resume_token}</li>
 *   <li>event: EventEnvelope (replay first, then live traffic)</li>
 *   <li>ack: cumulative ack for events the client sent</li>
 *   <li>session_expired: {session_id, reason}, followed by close</li>
 * </ul>
 * </p>
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>ack: {session_id, up_to_sequence}</li>
 *   <li>ping: {}</li>
 *   <li>event: EventEnvelope (upstream)</li>
 * </ul>
 * </p>
 */
public class WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    private final SocketConfig config;
    private final IEventBus bus;
    private final Clock clock;

    public WebSocketHandler(SocketConfig config, IEventBus bus, Clock clock) {
        this.config = config;
        this.bus = bus;
        this.clock = clock;
    }

    /**
     * Outcome of the handshake: which session to bind and how.
     */
    record Binding(String sessionId, boolean resume, String rejection) {
        static Binding open(String sessionId) {
            return new Binding(sessionId, false, null);
        }

        static Binding resume(String sessionId) {
            return new Binding(sessionId, true, null);
        }

        static Binding reject(String sessionId, String reason) {
            return new Binding(sessionId, false, reason);
        }

        boolean rejected() {
            return rejection != null;
        }
    }

    /**
     * Handles the WebSocket lifecycle with pre-extracted handshake parameters.
     *
     * @return Publisher completing when the socket closes
     */
    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, HandshakeParams params) {
        Binding binding = bind(params);
        if (binding.sessionId() != null) {
            MDC.put("sessionId", binding.sessionId());
        }

        if (binding.rejected()) {
            return rejectSession(outbound, binding.sessionId(), binding.rejection());
        }

        WebSocketConnection connection = new WebSocketConnection(binding.sessionId(), config.getPerConnBufferSize(),
                () -> outbound.sendClose().subscribe(null, err -> log.debug("Close frame not sent: {}", err.getMessage())));

        return Mono.fromCallable(() -> attach(binding, connection, params.getLastAckedSequence()))
                .flatMap(welcome -> {
                    handleConnectionStateUpdates(inbound, outbound, binding.sessionId(), connection);
                    log.debug("Session {} bound to connection {} (resumed={}, replay={})", binding.sessionId(),
                            connection.id(), welcome.isResumed(), welcome.getReplayCount());

                    return Mono.when(
                            outbound.sendString(Flux.concat(
                                    Mono.just(JsonUtils.writeValueAsString(welcome)),
                                    connection.frames()
                            )),
                            handleInboundMessages(inbound, binding.sessionId(), connection)
                    );
                })
                .onErrorResume(SessionExpiredException.class, err -> {
                    log.info("Session {} cannot be resumed: {}", binding.sessionId(), err.getMessage());
                    return rejectSession(outbound, binding.sessionId(), "expired");
                })
                .onErrorResume(err -> {
                    log.error("WebSocket error for session {}", binding.sessionId(), err);
                    connection.close();
                    return outbound.sendClose();
                });
    }

    Binding bind(HandshakeParams params) {
        if (params.hasResumeToken()) {
            Optional<String> verified = ResumeToken.verify(params.getResumeToken(), config.getResumeSecret(),
                    config.getResumeTtl(), clock.instant());
            if (verified.isEmpty()) {
                log.warn("Rejected resume token for session {}", params.getSessionId());
                return Binding.reject(params.getSessionId(), "invalid_resume_token");
            }
            return Binding.resume(verified.get());
        }

        if (params.hasSessionId()) {
            String sessionId = params.getSessionId();
            if (bus.sessionState(sessionId).isPresent()) {
                return Binding.resume(sessionId);
            }
            // A client that already consumed events expects continuity; never reset it silently
            if (params.getLastAckedSequence().isPresent()) {
                return Binding.reject(sessionId, "expired");
            }
            return Binding.open(sessionId);
        }

        return Binding.open(UUID.randomUUID().toString());
    }

    private WireMessages.Welcome attach(Binding binding, WebSocketConnection connection, OptionalLong lastAcked) {
        String sessionId = binding.sessionId();
        boolean resumed = false;
        int replayCount = 0;

        if (binding.resume()) {
            ReconnectionBuffer.ReplayResult result = bus.reconnect(sessionId, connection, lastAcked);
            resumed = true;
            replayCount = result.replayed();
        } else {
            bus.openSession(sessionId, connection);
        }

        long lastAckedSequence = bus.sessionStats(sessionId)
                .map(SessionStats::getLastAckedSequence)
                .orElse(0L);

        return WireMessages.Welcome.builder()
                .type(EventTypes.WELCOME)
                .sessionId(sessionId)
                .nodeId(config.getNodeId())
                .resumed(resumed)
                .lastAckedSequence(lastAckedSequence)
                .replayCount(replayCount)
                .resumeToken(ResumeToken.generate(sessionId, clock.instant(), config.getResumeSecret()))
                .build();
    }

    private Mono<Void> rejectSession(WebsocketOutbound outbound, String sessionId, String reason) {
        String notice = JsonUtils.writeValueAsString(WireMessages.SessionExpiredNotice.of(sessionId, reason));
        return outbound.sendString(Mono.just(notice))
                .then()
                .then(outbound.sendClose())
                .onErrorResume(err -> {
                    log.debug("Rejection of session {} not delivered: {}", sessionId, err.getMessage());
                    return Mono.empty();
                });
    }

    private void handleConnectionStateUpdates(WebsocketInbound inbound, WebsocketOutbound outbound,
                                              String sessionId, WebSocketConnection connection) {
        inbound.withConnection(conn -> {
            long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
            long pingTimeoutInMillis = config.getPingInterval() * 1000L;

            conn.onWriteIdle(pingTimeoutInMillis, () -> conn.outbound().sendObject(
                            Mono.just(new PingWebSocketFrame())
                    ).then().subscribe(null, err -> log.debug("Ping failed for session {}", sessionId)))
                    .onReadIdle(idleTimeoutInMillis, () -> {
                        log.info("Session {} idle for {} ms, closing connection {}", sessionId,
                                idleTimeoutInMillis, connection.id());
                        connection.close();
                    })
                    .onDispose(() -> {
                        log.debug("WebSocket connection {} disposed for session {}", connection.id(), sessionId);
                        connection.close();
                        bus.disconnect(sessionId, connection);
                    });
        });
    }

    private Mono<Void> handleInboundMessages(WebsocketInbound inbound, String sessionId, WebSocketConnection connection) {
        return inbound.aggregateFrames()
                .receive()
                .asString()
                .onBackpressureBuffer(config.getPerConnBufferSize())
                .concatMap(msg -> Mono.fromRunnable(() -> handleInboundMessage(sessionId, connection, msg))
                        .onErrorResume(err -> {
                            log.warn("Error processing frame from session {}: {}", sessionId, err.getMessage());
                            return Mono.empty();
                        })
                )
                .doOnError(err -> {
                    // AbortedException is expected on close
                    if (!(err instanceof AbortedException)) {
                        log.error("Fatal error in inbound stream for session {}", sessionId, err);
                    }
                })
                .onErrorResume(err -> Mono.empty())
                .then();
    }

    void handleInboundMessage(String sessionId, WebSocketConnection connection, String frame) {
        JsonNode node = JsonUtils.readTree(frame);
        String type = node.path("type").asText(null);
        if (type == null) {
            log.warn("Frame without type from session {}: {}", sessionId, frame);
            return;
        }

        switch (type) {
            case EventTypes.ACK -> {
                WireMessages.Ack ack = JsonUtils.treeToValue(node, WireMessages.Ack.class);
                if (ack.getSessionId() != null && !sessionId.equals(ack.getSessionId())) {
                    log.warn("Ack for session {} received on session {}, ignored", ack.getSessionId(), sessionId);
                    return;
                }
                bus.acknowledge(sessionId, ack);
            }
            case EventTypes.PING -> {
                // Keepalive
            }
            case EventTypes.WELCOME, EventTypes.SESSION_EXPIRED ->
                    log.warn("Unexpected '{}' frame from session {}", type, sessionId);
            default -> {
                EventEnvelope envelope = JsonUtils.treeToValue(node, EventEnvelope.class);
                if (envelope.getEventId() == null || envelope.getSequence() < 1) {
                    log.warn("Incomplete event frame from session {}: {}", sessionId, frame);
                    return;
                }
                if (envelope.getSessionId() == null) {
                    envelope = envelope.toBuilder().sessionId(sessionId).build();
                }
                WireMessages.Ack ack = bus.onReceive(sessionId, envelope);
                connection.sendAck(ack);
            }
        }
    }
}
