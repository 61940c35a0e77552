package com.agentpipeline.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record PipelineStartEvent(
    @JsonProperty("pipelineId") String pipelineId,
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("agents") List<String> agents,
    @JsonProperty("timestamp") Instant timestamp
) implements PipelineEvent {

    public static final String TYPE = "pipeline_start";

    public PipelineStartEvent {
        agents = List.copyOf(agents);
    }

    public static PipelineStartEvent of(String pipelineId, String sessionId, List<String> agents) {
        return new PipelineStartEvent(pipelineId, sessionId, agents, Instant.now());
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
