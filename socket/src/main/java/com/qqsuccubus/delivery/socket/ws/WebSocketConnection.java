package com.qqsuccubus.delivery.socket.ws;

import com.qqsuccubus.delivery.core.bus.ConnectionHandle;
import com.qqsuccubus.delivery.core.error.TransportException;
import com.qqsuccubus.delivery.core.msg.EventEnvelope;
import com.qqsuccubus.delivery.core.msg.WireMessages;
import com.qqsuccubus.delivery.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;

/**
 * Outbound side of one WebSocket, buffered in a bounded sink drained by the socket writer.
 * <p>
 * A full buffer makes {@link #send} return {@code false} instead of blocking; the bus leaves
 * the envelope to its retry timer. Once the socket is gone every send throws
 * {@link TransportException}.
 * </p>
 */
public class WebSocketConnection implements ConnectionHandle {
    private static final Logger log = LoggerFactory.getLogger(WebSocketConnection.class);

    private final String id = UUID.randomUUID().toString();
    private final String sessionId;
    private final Sinks.Many<String> sink;
    private final Runnable closer;
    private boolean closed;

    /**
     * @param bufferSize Frames queued before sends report backpressure, exactly
     * @param closer     Closes the underlying socket
     */
    public WebSocketConnection(String sessionId, int bufferSize, Runnable closer) {
        this.sessionId = sessionId;
        this.sink = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(bufferSize));
        this.closer = closer;
    }

    @Override
    public String id() {
        return id;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Frames to write, in send order. Single subscriber.
     */
    public Flux<String> frames() {
        return sink.asFlux();
    }

    @Override
    public boolean send(EventEnvelope envelope) {
        return emit(JsonUtils.writeValueAsString(envelope));
    }

    @Override
    public boolean sendAck(WireMessages.Ack ack) {
        return emit(JsonUtils.writeValueAsString(ack));
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            sink.tryEmitComplete();
        }
        log.debug("Closing connection {} of session {}", id, sessionId);
        closer.run();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    private synchronized boolean emit(String frame) {
        if (closed) {
            throw new TransportException(sessionId, "Connection " + id + " is closed");
        }
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        switch (result) {
            case OK:
                return true;
            case FAIL_OVERFLOW:
                return false;
            case FAIL_TERMINATED:
            case FAIL_CANCELLED:
                closed = true;
                throw new TransportException(sessionId, "Connection " + id + " is gone: " + result);
            default:
                log.warn("Frame for session {} not queued: {}", sessionId, result);
                return false;
        }
    }
}
