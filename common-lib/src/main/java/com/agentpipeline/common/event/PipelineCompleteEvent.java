package com.agentpipeline.common.event;

import com.agentpipeline.common.model.PipelineResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record PipelineCompleteEvent(
    @JsonProperty("pipelineId") String pipelineId,
    @JsonProperty("result") PipelineResult result,
    @JsonProperty("timestamp") Instant timestamp
) implements PipelineEvent {

    public static final String TYPE = "pipeline_complete";

    public static PipelineCompleteEvent of(PipelineResult result) {
        return new PipelineCompleteEvent(result.pipelineId(), result, Instant.now());
    }

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
