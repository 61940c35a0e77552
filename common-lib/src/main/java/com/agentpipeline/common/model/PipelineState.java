package com.agentpipeline.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Live snapshot of a pipeline returned by state queries, valid while running and after.
 */
public record PipelineState(
    @JsonProperty("pipelineId") String pipelineId,
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("running") boolean running,
    @JsonProperty("completed") boolean completed,
    @JsonProperty("agents") Map<String, AgentSnapshot> agents
) {}
