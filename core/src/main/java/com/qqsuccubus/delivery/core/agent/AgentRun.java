package com.qqsuccubus.delivery.core.agent;

import lombok.Value;

/**
 * Identifies one agent execution streamed to a session.
 */
@Value
public class AgentRun {
    String sessionId;
    String agentName;
    String runId;
}
