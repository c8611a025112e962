package com.qqsuccubus.delivery.socket.ws;

import com.qqsuccubus.delivery.socket.drain.DrainService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

/**
 * Validates the handshake before upgrading to a WebSocket.
 * <p>
 * Query parameters are parsed from the HTTP request so a malformed handshake is answered
 * with a plain 400 instead of an upgraded socket that closes right away.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final WebSocketHandler wsHandler;
    private final DrainService drainService;

    public WebSocketUpgradeHandler(WebSocketHandler wsHandler, DrainService drainService) {
        this.wsHandler = wsHandler;
        this.drainService = drainService;
    }

    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        // Reject new connections if node is draining
        if (drainService.isDraining()) {
            log.warn("Rejecting new WebSocket connection - node is draining");
            return res.status(503)
                .sendString(Mono.just("Service unavailable - node is draining"))
                .then();
        }

        HandshakeParams params;
        try {
            params = HandshakeParams.parse(req.uri());
        } catch (IllegalArgumentException e) {
            log.warn("Rejecting WebSocket handshake {}: {}", req.uri(), e.getMessage());
            return res.status(400)
                .sendString(Mono.just(e.getMessage()))
                .then();
        }

        return res.sendWebsocket((inbound, outbound) -> wsHandler.handle(inbound, outbound, params));
    }
}
