package com.qqsuccubus.delivery.socket.config;

import com.qqsuccubus.delivery.core.config.BusConfig;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Function;

/**
 * Configuration for a socket node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SocketConfig {

    String nodeId;
    int httpPort;
    int perConnBufferSize;
    int pingInterval;
    int idleTimeout;
    String resumeSecret;
    int resumeTtlSec;

    // Delivery engine
    long initialBackoffMs;
    long maxBackoffMs;
    int maxRetries;
    long retryJitterMs;
    int sessionIdleTimeoutSec;
    int dedupCapacity;
    int dedupWindowSec;
    int reorderBufferMax;
    int gapTimeoutSec;
    int inboundIdleTimeoutSec;
    int maxPendingPerSession;

    public static SocketConfig fromEnv() {
        return from(System::getenv);
    }

    /**
     * @param env Variable lookup returning null for unset keys
     * @throws IllegalArgumentException if a numeric variable does not parse
     */
    public static SocketConfig from(Function<String, String> env) {
        return SocketConfig.builder()
                .nodeId(get(env, "NODE_ID", "socket-node-1"))
                .httpPort(getInt(env, "HTTP_PORT", 8080))
                .perConnBufferSize(getInt(env, "PER_CONN_BUFFER_SIZE", 256))
                .pingInterval(getInt(env, "PING_INTERVAL", 10))
                .idleTimeout(getInt(env, "IDLE_TIMEOUT", 20))
                .resumeSecret(get(env, "RESUME_SECRET", "dev-resume-secret"))
                .resumeTtlSec(getInt(env, "RESUME_TTL_SEC", 3600))
                .initialBackoffMs(getLong(env, "INITIAL_BACKOFF_MS", 1000))
                .maxBackoffMs(getLong(env, "MAX_BACKOFF_MS", 30_000))
                .maxRetries(getInt(env, "MAX_RETRIES", 5))
                .retryJitterMs(getLong(env, "RETRY_JITTER_MS", 0))
                .sessionIdleTimeoutSec(getInt(env, "SESSION_IDLE_TIMEOUT_SEC", 300))
                .dedupCapacity(getInt(env, "DEDUP_CAPACITY", 1000))
                .dedupWindowSec(getInt(env, "DEDUP_WINDOW_SEC", 600))
                .reorderBufferMax(getInt(env, "REORDER_BUFFER_MAX", 1000))
                .gapTimeoutSec(getInt(env, "GAP_TIMEOUT_SEC", 420))
                .inboundIdleTimeoutSec(getInt(env, "INBOUND_IDLE_TIMEOUT_SEC", 1800))
                .maxPendingPerSession(getInt(env, "MAX_PENDING_PER_SESSION", 1000))
                .build();
    }

    public BusConfig toBusConfig() {
        return BusConfig.builder()
                .initialBackoff(Duration.ofMillis(initialBackoffMs))
                .maxBackoff(Duration.ofMillis(maxBackoffMs))
                .retryJitter(Duration.ofMillis(retryJitterMs))
                .maxRetries(maxRetries)
                .sessionIdleTimeout(Duration.ofSeconds(sessionIdleTimeoutSec))
                .dedupCapacity(dedupCapacity)
                .dedupWindow(Duration.ofSeconds(dedupWindowSec))
                .reorderBufferMax(reorderBufferMax)
                .gapTimeout(Duration.ofSeconds(gapTimeoutSec))
                .inboundIdleTimeout(Duration.ofSeconds(inboundIdleTimeoutSec))
                .maxPendingPerSession(maxPendingPerSession)
                .build()
                .validate();
    }

    public Duration getResumeTtl() {
        return Duration.ofSeconds(resumeTtlSec);
    }

    private static String get(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    private static int getInt(Function<String, String> env, String key, int defaultValue) {
        return (int) getLong(env, key, defaultValue);
    }

    private static long getLong(Function<String, String> env, String key, long defaultValue) {
        String value = get(env, key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Environment variable " + key + " is not a number: " + value, e);
        }
    }
}
