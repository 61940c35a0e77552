package com.agentpipeline.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Progress notification emitted by a running pipeline to its subscribers.
 *
 * <p>Serialized with a {@code type} discriminator:
 * {@value PipelineStartEvent#TYPE}, {@value AgentStatusEvent#TYPE},
 * {@value AgentLogEvent#TYPE} and {@value PipelineCompleteEvent#TYPE}.
 */
public interface PipelineEvent {

    @JsonProperty("type")
    String type();

    @JsonProperty("pipelineId")
    String pipelineId();

    @JsonProperty("timestamp")
    Instant timestamp();
}
