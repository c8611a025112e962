package com.qqsuccubus.delivery.core.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.delivery.core.bus.IEventBus;
import com.qqsuccubus.delivery.core.msg.EventEnvelope;
import com.qqsuccubus.delivery.core.msg.EventTypes;
import com.qqsuccubus.delivery.core.util.JsonUtils;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Typed publishing of the agent lifecycle events a client renders progress from.
 * <p>
 * A complete run publishes {@code agent_started}, at least one {@code agent_thinking},
 * each tool as {@code tool_executing}/{@code tool_completed}, then {@code agent_completed}.
 * </p>
 */
public class AgentEventPublisher {
    private static final List<String> CRITICAL_ERROR_MARKERS = List.of("authentication", "authorization", "database", "network");
    private static final List<String> HIGH_ERROR_MARKERS = List.of("timeout", "rate_limit", "validation");

    private final IEventBus bus;

    public AgentEventPublisher(IEventBus bus) {
        this.bus = bus;
    }

    public EventEnvelope agentStarted(AgentRun run) {
        return publish(run, EventTypes.AGENT_STARTED, base(run));
    }

    /**
     * @param stepNumber            Step of the reasoning, or null
     * @param estimatedRemaining    Remaining time estimate, or null
     */
    public EventEnvelope agentThinking(AgentRun run, String thought, Integer stepNumber, Duration estimatedRemaining) {
        ObjectNode payload = base(run);
        payload.put("thought", thought);
        if (stepNumber != null) {
            payload.put("step_number", stepNumber);
        }
        if (estimatedRemaining != null) {
            payload.put("estimated_remaining_ms", estimatedRemaining.toMillis());
        }
        payload.put("urgency", urgency(estimatedRemaining));
        return publish(run, EventTypes.AGENT_THINKING, payload);
    }

    public EventEnvelope toolExecuting(AgentRun run, String toolName, String purpose) {
        ObjectNode payload = base(run);
        payload.put("tool_name", toolName);
        if (purpose != null && !purpose.isBlank()) {
            payload.put("tool_purpose", purpose);
        }
        payload.put("execution_phase", "starting");
        return publish(run, EventTypes.TOOL_EXECUTING, payload);
    }

    public EventEnvelope toolCompleted(AgentRun run, String toolName, Object result) {
        ObjectNode payload = base(run);
        payload.put("tool_name", toolName);
        payload.set("result", JsonUtils.toTree(result));
        return publish(run, EventTypes.TOOL_COMPLETED, payload);
    }

    public EventEnvelope agentCompleted(AgentRun run, Object result, Duration duration) {
        ObjectNode payload = base(run);
        payload.put("duration_ms", duration.toMillis());
        payload.set("result", JsonUtils.toTree(result));
        return publish(run, EventTypes.AGENT_COMPLETED, payload);
    }

    public EventEnvelope agentError(AgentRun run, String errorMessage, String errorType, boolean recoverable) {
        ObjectNode payload = base(run);
        payload.put("error_message", errorMessage);
        payload.put("error_type", errorType == null ? "general" : errorType);
        payload.put("severity", severity(errorType, errorMessage));
        payload.put("is_recoverable", recoverable);
        return publish(run, EventTypes.AGENT_ERROR, payload);
    }

    /**
     * Classifies an agent failure for display.
     *
     * @return {@code critical}, {@code high} or {@code medium}
     */
    static String severity(String errorType, String errorMessage) {
        if (errorType == null) {
            return "medium";
        }
        String type = errorType.toLowerCase(Locale.ROOT);
        String message = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
        if (CRITICAL_ERROR_MARKERS.stream().anyMatch(m -> type.contains(m) || message.contains(m))) {
            return "critical";
        }
        if (HIGH_ERROR_MARKERS.stream().anyMatch(m -> type.contains(m) || message.contains(m))) {
            return "high";
        }
        return "medium";
    }

    static String urgency(Duration estimatedRemaining) {
        if (estimatedRemaining != null && estimatedRemaining.toMillis() > 10_000) {
            return "low_priority";
        }
        if (estimatedRemaining != null && estimatedRemaining.toMillis() > 5_000) {
            return "medium_priority";
        }
        return "high_priority";
    }

    private ObjectNode base(AgentRun run) {
        ObjectNode payload = JsonUtils.objectNode();
        payload.put("agent_name", run.getAgentName());
        payload.put("run_id", run.getRunId());
        return payload;
    }

    private EventEnvelope publish(AgentRun run, String type, JsonNode payload) {
        return bus.publish(run.getSessionId(), type, payload);
    }
}
