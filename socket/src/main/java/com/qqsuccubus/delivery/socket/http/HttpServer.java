package com.qqsuccubus.delivery.socket.http;

import com.qqsuccubus.delivery.core.bus.IEventBus;
import com.qqsuccubus.delivery.core.util.JsonUtils;
import com.qqsuccubus.delivery.socket.config.SocketConfig;
import com.qqsuccubus.delivery.socket.drain.DrainService;
import com.qqsuccubus.delivery.socket.metrics.PrometheusMetricsExporter;
import com.qqsuccubus.delivery.socket.ws.WebSocketHandler;
import com.qqsuccubus.delivery.socket.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics, delivery stats, drain endpoint and WebSocket upgrades.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final SocketConfig config;
    private final IEventBus bus;
    private final PrometheusMetricsExporter metricsExporter;
    private final DrainService drainService;
    private final Clock clock;
    private DisposableServer server;

    public HttpServer(SocketConfig config, IEventBus bus, PrometheusMetricsExporter metricsExporter,
                      DrainService drainService, Clock clock) {
        this.config = config;
        this.bus = bus;
        this.metricsExporter = metricsExporter;
        this.drainService = drainService;
        this.clock = clock;
    }

    /**
     * Binds the server; {@code HTTP_PORT=0} picks a free port, see {@link #port()}.
     */
    public DisposableServer start() {
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(
            new WebSocketHandler(config, bus, clock), drainService
        );

        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Liveness - fails while draining
                .get("/healthz", (req, res) -> {
                    if (drainService.isDraining()) {
                        return res.status(503).sendString(Mono.just("Draining"));
                    }
                    return res.status(200).sendString(Mono.just("OK"));
                })
                .get("/readyz", (req, res) -> {
                    if (drainService.isDraining()) {
                        return res.status(503).sendString(Mono.just("Not Ready - Draining"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .post("/drain", (req, res) -> {
                    log.warn("Drain endpoint called - starting graceful connection draining");
                    return drainService.startDrain()
                        .then(res.status(202).sendString(Mono.just(String.format(
                            "Drain started - %d connections to drain",
                            drainService.getRemainingConnections()
                        ))).then());
                })
                .get("/drain/status", (req, res) -> {
                    String status = String.format(
                        "{ \"draining\": %b, \"complete\": %b, \"remaining\": %d }",
                        drainService.isDraining(),
                        drainService.isDrainComplete(),
                        drainService.getRemainingConnections()
                    );
                    return res.status(200)
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just(status));
                })
                .get("/stats", (req, res) -> res.status(200)
                    .header("Content-Type", "application/json")
                    .sendString(Mono.fromCallable(() -> JsonUtils.writeValueAsString(bus.stats()))))
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.fromCallable(metricsExporter::scrape))
                )
                .get("/ws/connect", upgradeHandler::handle)
            )
            .bind()
            .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public int port() {
        return server.port();
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
