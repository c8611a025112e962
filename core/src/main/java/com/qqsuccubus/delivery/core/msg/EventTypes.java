package com.qqsuccubus.delivery.core.msg;

import java.util.Set;

/**
 * Event and frame type names.
 * <p>
 * The bus never branches on application types; they are listed here for publishers and
 * for the conformance check that a full agent run emits {@link #REQUIRED}.
 * </p>
 */
public final class EventTypes {
    private EventTypes() {
    }

    public static final String AGENT_STARTED = "agent_started";
    public static final String AGENT_THINKING = "agent_thinking";
    public static final String TOOL_EXECUTING = "tool_executing";
    public static final String TOOL_COMPLETED = "tool_completed";
    public static final String AGENT_COMPLETED = "agent_completed";
    public static final String AGENT_ERROR = "agent_error";

    /**
     * Events every agent run must emit.
     */
    public static final Set<String> REQUIRED = Set.of(
            AGENT_STARTED, AGENT_THINKING, TOOL_EXECUTING, TOOL_COMPLETED, AGENT_COMPLETED
    );

    /**
     * Events never evicted when a session backlog overflows.
     */
    public static final Set<String> CRITICAL = Set.of(
            AGENT_STARTED, TOOL_EXECUTING, TOOL_COMPLETED, AGENT_COMPLETED
    );

    // Control frames
    public static final String ACK = "ack";
    public static final String PING = "ping";
    public static final String WELCOME = "welcome";
    public static final String SESSION_EXPIRED = "session_expired";

    public static boolean isCritical(String type) {
        return type != null && CRITICAL.contains(type);
    }

    public static boolean isControl(String type) {
        return ACK.equals(type) || PING.equals(type) || WELCOME.equals(type) || SESSION_EXPIRED.equals(type);
    }
}
