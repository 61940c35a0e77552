package com.agentpipeline.common.event;

import com.agentpipeline.common.model.AgentStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Agent status transition. {@code elapsedTime} is {@code null} for the
 * {@code PROCESSING} transition and set to the rounded seconds on terminal statuses.
 */
public record AgentStatusEvent(
    @JsonProperty("pipelineId") String pipelineId,
    @JsonProperty("agent") String agent,
    @JsonProperty("status") AgentStatus status,
    @JsonProperty("elapsedTime") Double elapsedTime,
    @JsonProperty("timestamp") Instant timestamp
) implements PipelineEvent {

    public static final String TYPE = "agent_status";

    public static AgentStatusEvent of(String pipelineId, String agent, AgentStatus status, Double elapsedTime) {
        return new AgentStatusEvent(pipelineId, agent, status, elapsedTime, Instant.now());
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
