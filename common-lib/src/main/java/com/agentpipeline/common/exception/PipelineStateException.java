package com.agentpipeline.common.exception;

/**
 * Raised on an illegal pipeline lifecycle transition, such as starting a pipeline twice.
 */
public class PipelineStateException extends RuntimeException {
    private final String pipelineId;

    public PipelineStateException(String pipelineId, String message) {
        super("[" + pipelineId + "] " + message);
        this.pipelineId = pipelineId;
    }

    public String getPipelineId() {
        return pipelineId;
    }
}
