package com.agentpipeline.common.model;

/**
 * Lifecycle status of a single agent within one pipeline run.
 *
 * <p>{@link #IDLE} is the initial state, {@link #PROCESSING} is transient while the agent
 * body runs, and {@link #SUCCESS}, {@link #WARN}, {@link #FAIL} are terminal for that run.
 */
public enum AgentStatus {
    IDLE,
    PROCESSING,
    SUCCESS,
    WARN,
    FAIL;

    public boolean isTerminal() {
        return this == SUCCESS || this == WARN || this == FAIL;
    }
}
