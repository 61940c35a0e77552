package com.agentpipeline.orchestrator.session;

import com.agentpipeline.common.model.PipelineInput;

import java.util.Optional;

/**
 * Registry of pipeline sessions.
 *
 * <p>Current implementation: {@link InMemoryPipelineSessionStore}, a single-node map with
 * time-based eviction. Sessions are not persisted beyond the life of the process.
 */
public interface PipelineSessionStore {

    PipelineSession create(PipelineInput input);

    /** Returns the session, or empty when unknown or already expired. */
    Optional<PipelineSession> find(String sessionId);

    boolean remove(String sessionId);

    /** Drops every expired session and returns how many were dropped. */
    int evictExpired();

    int size();
}
