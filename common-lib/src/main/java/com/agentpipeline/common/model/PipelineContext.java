package com.agentpipeline.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view handed to an agent: the shared input plus the results of every agent
 * that settled in an earlier wave. Results of the agent's own wave are never visible.
 */
public record PipelineContext(
    String pipelineId,
    String sessionId,
    PipelineInput input,
    Map<String, AgentResult> agentResults
) {
    public PipelineContext {
        agentResults = agentResults == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(agentResults));
    }

    public Optional<AgentResult> resultOf(String agentName) {
        return Optional.ofNullable(agentResults.get(agentName));
    }
}
