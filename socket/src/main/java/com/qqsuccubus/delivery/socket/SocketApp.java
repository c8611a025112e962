package com.qqsuccubus.delivery.socket;

import com.qqsuccubus.delivery.core.bus.EventBus;
import com.qqsuccubus.delivery.core.metrics.DeliveryMetrics;
import com.qqsuccubus.delivery.socket.config.SocketConfig;
import com.qqsuccubus.delivery.socket.drain.DrainService;
import com.qqsuccubus.delivery.socket.http.HttpServer;
import com.qqsuccubus.delivery.socket.metrics.PrometheusMetricsExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;

/**
 * Main entry point for a delivery node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at /ws/connect (query: sessionId, lastAckedSequence or resumeToken)</li>
 *   <li>Host the event bus: sequencing, acks, retransmission, replay on reconnect</li>
 *   <li>Expose /healthz, /readyz, /metrics and /stats</li>
 *   <li>Drain connections gracefully on /drain and on shutdown</li>
 * </ul>
 * </p>
 */
public class SocketApp {
    private static final Logger log = LoggerFactory.getLogger(SocketApp.class);

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting delivery node: {}", config.getNodeId());
        log.info("  Retry: initial={}ms, max={}ms, retries={}",
            config.getInitialBackoffMs(), config.getMaxBackoffMs(), config.getMaxRetries());
        log.info("  Session idle timeout: {}s", config.getSessionIdleTimeoutSec());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getNodeId());
        DeliveryMetrics metrics = new DeliveryMetrics(metricsExporter.getRegistry(), config.getNodeId());
        EventBus bus = new EventBus(config.toBusConfig(), metrics);
        bus.errors().subscribe(
            err -> log.debug("Delivery error on session {}: {}", err.getSessionId(), err.getMessage()),
            err -> log.error("Error stream failed", err)
        );

        DrainService drainService = new DrainService(bus);
        HttpServer httpServer = new HttpServer(config, bus, metricsExporter, drainService, Clock.systemUTC());
        httpServer.start();

        log.info("Delivery node {} is ready", config.getNodeId());

        handleShutdown(config, bus, drainService, httpServer);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(SocketConfig config,
                                       EventBus bus,
                                       DrainService drainService,
                                       HttpServer httpServer) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");

            drainService.stop();
            httpServer.stop();
            bus.shutdown();

            log.info("Shutdown complete: {}", bus.stats());
        }));
    }
}
