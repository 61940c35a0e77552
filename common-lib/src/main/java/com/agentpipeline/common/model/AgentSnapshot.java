package com.agentpipeline.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Serialized view of an agent at one point in time, as exposed by state queries
 * and embedded in the final {@link PipelineResult}.
 */
public record AgentSnapshot(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("systemPrompt") String systemPrompt,
    @JsonProperty("status") AgentStatus status,
    @JsonProperty("logs") List<LogEntry> logs,
    @JsonProperty("result") AgentResult result,
    @JsonProperty("elapsedTime") double elapsedTime
) {
    public AgentSnapshot {
        logs = logs == null ? List.of() : List.copyOf(logs);
    }
}
