package com.agentpipeline.common.exception;

/**
 * Contract breach inside one agent execution. Absorbed by the agent itself into a
 * {@code FAIL} result; it never reaches the orchestrator.
 */
public class AgentException extends RuntimeException {
    private final String agentName;

    public AgentException(String agentName, String message) {
        super(message);
        this.agentName = agentName;
    }

    public static AgentException emptyResult(String agentName) {
        return new AgentException(agentName, "agent body completed without a result");
    }

    public String getAgentName() {
        return agentName;
    }
}
