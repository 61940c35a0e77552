package com.agentpipeline.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Terminal outcome of one pipeline run. Created exactly once, when the final stage settles.
 *
 * @param totalTime       wall-clock seconds, rounded to two decimals
 * @param verdictCategory final category 1–5, {@code null} when no category could be derived
 * @param agents          per-agent serialized state keyed by agent name, in declaration order
 */
public record PipelineResult(
    @JsonProperty("pipelineId") String pipelineId,
    @JsonProperty("sessionId") String sessionId,
    @JsonProperty("totalTime") double totalTime,
    @JsonProperty("verdict") Verdict verdict,
    @JsonProperty("verdictColor") String verdictColor,
    @JsonProperty("verdictCategory") Integer verdictCategory,
    @JsonProperty("totalWarnings") int totalWarnings,
    @JsonProperty("report") String report,
    @JsonProperty("cancelled") boolean cancelled,
    @JsonProperty("agents") Map<String, AgentSnapshot> agents
) {}
