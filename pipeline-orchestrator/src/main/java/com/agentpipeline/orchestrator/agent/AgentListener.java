package com.agentpipeline.orchestrator.agent;

import com.agentpipeline.common.model.AgentStatus;
import com.agentpipeline.common.model.LogEntry;

/**
 * Receives live status transitions and log lines of a {@link PipelineAgent}.
 * Implementations must not throw and must return promptly.
 */
public interface AgentListener {

    AgentListener NOOP = new AgentListener() {
        @Override
        public void onStatus(String agentName, AgentStatus status, Double elapsedTime) {}

        @Override
        public void onLog(String agentName, LogEntry entry) {}
    };

    /**
     * @param elapsedTime {@code null} on the {@code PROCESSING} transition, rounded seconds otherwise
     */
    void onStatus(String agentName, AgentStatus status, Double elapsedTime);

    void onLog(String agentName, LogEntry entry);
}
