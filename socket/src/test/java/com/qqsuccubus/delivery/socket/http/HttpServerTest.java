package com.qqsuccubus.delivery.socket.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.delivery.core.bus.EventBus;
import com.qqsuccubus.delivery.core.bus.SessionState;
import com.qqsuccubus.delivery.core.bus.SessionStats;
import com.qqsuccubus.delivery.core.metrics.DeliveryMetrics;
import com.qqsuccubus.delivery.core.msg.EventTypes;
import com.qqsuccubus.delivery.core.util.JsonUtils;
import com.qqsuccubus.delivery.socket.config.SocketConfig;
import com.qqsuccubus.delivery.socket.drain.DrainService;
import com.qqsuccubus.delivery.socket.metrics.PrometheusMetricsExporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the node on a free port and talks to it over real HTTP and WebSocket connections.
 */
class HttpServerTest {
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private EventBus bus;
    private DrainService drainService;
    private HttpServer server;
    private HttpClient client;

    @BeforeEach
    void setUp() {
        SocketConfig config = SocketConfig.from(key -> null).toBuilder()
                .nodeId("test-node")
                .httpPort(0)
                .build();
        PrometheusMetricsExporter exporter = new PrometheusMetricsExporter(config.getNodeId());
        bus = new EventBus(config.toBusConfig(), new DeliveryMetrics(exporter.getRegistry(), config.getNodeId()));
        drainService = new DrainService(bus);
        server = new HttpServer(config, bus, exporter, drainService, Clock.systemUTC());
        server.start();
        client = HttpClient.create().port(server.port());
    }

    @AfterEach
    void tearDown() {
        drainService.stop();
        server.stop();
        bus.shutdown();
    }

    private String get(String uri) {
        return client.get().uri(uri).responseContent().aggregate().asString().block(TIMEOUT);
    }

    @Test
    @DisplayName("Health, readiness and stats endpoints answer")
    void testEndpoints() {
        assertEquals("OK", get("/healthz"));
        assertEquals("Ready", get("/readyz"));

        JsonNode stats = JsonUtils.readTree(get("/stats"));
        assertEquals(0, stats.get("published").asLong());
        assertTrue(get("/metrics").contains("rtc_delivery"));
    }

    @Test
    @DisplayName("A malformed handshake is refused before the upgrade")
    void testHandshake_BadRequest() {
        int status = client.get()
                .uri("/ws/connect?lastAckedSequence=abc")
                .response()
                .map(res -> res.status().code())
                .block(TIMEOUT);

        assertEquals(400, status);
    }

    @Test
    @DisplayName("A client gets a welcome frame first, then live events")
    void testWebSocket_WelcomeThenEvents() {
        // When
        List<String> frames = client.websocket()
                .uri("/ws/connect?sessionId=ws-1")
                .handle((in, out) -> in.receive().asString()
                        .doOnNext(frame -> {
                            if (frame.contains("\"welcome\"")) {
                                bus.publish("ws-1", EventTypes.AGENT_STARTED, Map.of("agent_name", "a"));
                            }
                        })
                        .take(2))
                .collectList()
                .block(TIMEOUT);

        // Then
        assertNotNull(frames);
        JsonNode welcome = JsonUtils.readTree(frames.get(0));
        assertEquals("welcome", welcome.get("type").asText());
        assertEquals("ws-1", welcome.get("session_id").asText());
        assertEquals("test-node", welcome.get("node_id").asText());
        assertTrue(welcome.get("resume_token").asText().length() > 0);

        JsonNode event = JsonUtils.readTree(frames.get(1));
        assertEquals(EventTypes.AGENT_STARTED, event.get("type").asText());
        assertEquals(1, event.get("sequence").asLong());
    }

    @Test
    @DisplayName("Events published while a client is away are replayed when it resumes")
    void testWebSocket_ResumeReplaysPending() {
        // Given
        firstFrame("/ws/connect?sessionId=ws-2");
        awaitState("ws-2", SessionState.DISCONNECTED);
        bus.publish("ws-2", EventTypes.AGENT_THINKING, Map.of("thought", "while away"));

        // When
        List<String> frames = client.websocket()
                .uri("/ws/connect?sessionId=ws-2&lastAckedSequence=0")
                .handle((in, out) -> in.receive().asString().take(2))
                .collectList()
                .block(TIMEOUT);

        // Then
        JsonNode welcome = JsonUtils.readTree(frames.get(0));
        assertTrue(welcome.get("resumed").asBoolean());
        assertEquals(1, welcome.get("replay_count").asInt());
        assertEquals("while away", JsonUtils.readTree(frames.get(1)).get("data").get("thought").asText());
    }

    @Test
    @DisplayName("Resuming a session the node no longer knows is answered with session_expired")
    void testWebSocket_ExpiredSession() {
        String frame = firstFrame("/ws/connect?sessionId=unknown&lastAckedSequence=5");

        JsonNode notice = JsonUtils.readTree(frame);
        assertEquals("session_expired", notice.get("type").asText());
        assertEquals("unknown", notice.get("session_id").asText());
    }

    @Test
    @DisplayName("Acks sent by the client settle the delivered events")
    void testWebSocket_ClientAck() {
        client.websocket()
                .uri("/ws/connect?sessionId=ws-3")
                .handle((in, out) -> {
                    Flux<String> acks = in.receive().asString()
                            .doOnNext(frame -> {
                                if (frame.contains("\"welcome\"")) {
                                    bus.publish("ws-3", EventTypes.AGENT_STARTED, null);
                                }
                            })
                            .filter(frame -> frame.contains("\"event_id\""))
                            .take(1)
                            .map(frame -> "{\"type\":\"ack\",\"session_id\":\"ws-3\",\"up_to_sequence\":1}");
                    return out.sendString(acks).then()
                            .then(Mono.delay(Duration.ofMillis(200)))
                            .then();
                })
                .blockLast(TIMEOUT);

        await(() -> bus.sessionStats("ws-3").map(SessionStats::getLastAckedSequence).orElse(0L) == 1L,
                "Ack never reached the bus");
        assertEquals(0, bus.sessionStats("ws-3").orElseThrow().getPending());
    }

    private String firstFrame(String uri) {
        return client.websocket()
                .uri(uri)
                .handle((in, out) -> in.receive().asString().take(1))
                .blockFirst(TIMEOUT);
    }

    private void awaitState(String sessionId, SessionState expected) {
        await(() -> bus.sessionState(sessionId).filter(expected::equals).isPresent(),
                "Session " + sessionId + " never reached " + expected);
    }

    private static void await(BooleanSupplier condition, String failure) {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError(failure);
            }
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(10));
        }
    }
}
