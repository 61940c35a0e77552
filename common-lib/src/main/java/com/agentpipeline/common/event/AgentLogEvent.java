package com.agentpipeline.common.event;

import com.agentpipeline.common.model.LogLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record AgentLogEvent(
    @JsonProperty("pipelineId") String pipelineId,
    @JsonProperty("agent") String agent,
    @JsonProperty("message") String message,
    @JsonProperty("level") LogLevel level,
    @JsonProperty("timestamp") Instant timestamp
) implements PipelineEvent {

    public static final String TYPE = "agent_log";

    public static AgentLogEvent of(String pipelineId, String agent, String message, LogLevel level) {
        return new AgentLogEvent(pipelineId, agent, message, level, Instant.now());
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
