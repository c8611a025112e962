package com.qqsuccubus.delivery.socket.drain;

import com.qqsuccubus.delivery.core.bus.IEventBus;
import com.qqsuccubus.delivery.core.bus.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gracefully disconnects clients before the node stops.
 * <p>
 * Draining process:
 * 1. /drain is called (e.g. from a preStop hook)
 * 2. The node rejects new WebSocket handshakes
 * 3. Connected sessions are disconnected in batches spread over the drain duration
 * 4. Disconnected sessions keep their pending events until they expire or the node stops
 * </p>
 */
public class DrainService {
    private static final Logger log = LoggerFactory.getLogger(DrainService.class);

    private final IEventBus bus;
    private final Duration drainDuration;
    private final Duration batchInterval;
    private final Scheduler scheduler;

    private final AtomicBoolean isDraining = new AtomicBoolean(false);
    private final AtomicBoolean isDrainComplete = new AtomicBoolean(false);
    private final AtomicInteger remainingConnections = new AtomicInteger(0);

    private Disposable drainTask;

    public DrainService(IEventBus bus) {
        this(bus, Duration.ofMinutes(5), Duration.ofSeconds(2), Schedulers.parallel());
    }

    public DrainService(IEventBus bus, Duration drainDuration, Duration batchInterval, Scheduler scheduler) {
        this.bus = bus;
        this.drainDuration = drainDuration;
        this.batchInterval = batchInterval;
        this.scheduler = scheduler;
    }

    /**
     * Starts draining. Calling it again while a drain runs has no effect.
     *
     * @return Mono completing when the drain is started
     */
    public Mono<Void> startDrain() {
        if (!isDraining.compareAndSet(false, true)) {
            log.warn("Drain already in progress");
            return Mono.empty();
        }

        int totalConnections = connectedSessions().size();
        remainingConnections.set(totalConnections);
        log.warn("DRAIN MODE ACTIVATED - disconnecting {} sessions over {}", totalConnections, drainDuration);

        if (totalConnections == 0) {
            log.info("No connected sessions, drain complete immediately");
            isDrainComplete.set(true);
            return Mono.empty();
        }

        int totalBatches = (int) Math.max(1, drainDuration.toMillis() / batchInterval.toMillis());
        int connectionsPerBatch = Math.max(1, (int) Math.ceil((double) totalConnections / totalBatches));
        log.info("Drain plan: {} batches, ~{} sessions per batch, batch every {}",
            totalBatches, connectionsPerBatch, batchInterval);

        drainTask = Flux.interval(batchInterval, scheduler)
            .take(totalBatches)
            .concatMap(tick -> drainBatch(connectionsPerBatch))
            .then(drainBatch(Integer.MAX_VALUE))
            .doOnSuccess(v -> {
                log.info("Drain process complete - all connections gracefully closed");
                isDrainComplete.set(true);
            })
            .subscribe(null, err -> log.error("Drain failed", err));

        return Mono.empty();
    }

    private Mono<Void> drainBatch(int batchSize) {
        return Mono.fromRunnable(() -> {
            List<String> connected = connectedSessions();
            int toDisconnect = Math.min(batchSize, connected.size());
            log.debug("Draining batch: disconnecting {} of {} sessions", toDisconnect, connected.size());

            for (String sessionId : connected.subList(0, toDisconnect)) {
                try {
                    bus.disconnect(sessionId);
                } catch (RuntimeException e) {
                    log.warn("Failed to disconnect session {}: {}", sessionId, e.getMessage());
                }
            }
            remainingConnections.set(connected.size() - toDisconnect);
        });
    }

    private List<String> connectedSessions() {
        return bus.activeSessionIds().stream()
            .filter(id -> bus.sessionState(id).filter(SessionState.CONNECTED::equals).isPresent())
            .sorted()
            .toList();
    }

    public boolean isDraining() {
        return isDraining.get();
    }

    public boolean isDrainComplete() {
        return isDrainComplete.get();
    }

    public int getRemainingConnections() {
        return remainingConnections.get();
    }

    public void stop() {
        if (drainTask != null) {
            drainTask.dispose();
        }
        log.info("Drain service stopped");
    }
}
