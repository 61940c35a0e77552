package com.agentpipeline.orchestrator.session;

import com.agentpipeline.common.model.PipelineInput;
import com.agentpipeline.orchestrator.broadcast.PipelineEventBroadcaster;
import com.agentpipeline.orchestrator.pipeline.PipelineOrchestrator;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One registered input bundle and, once started, the pipeline running over it.
 *
 * <p>The broadcaster exists from creation so clients can subscribe to events before the
 * pipeline starts. Prompt overrides staged before the start are handed to the pipeline
 * when it runs.
 */
public class PipelineSession {

    private final String sessionId;
    private final PipelineInput input;
    private final Instant createdAt;
    private final PipelineEventBroadcaster broadcaster;
    private final Map<String, String> stagedPrompts = new ConcurrentHashMap<>();
    private final AtomicReference<PipelineOrchestrator> orchestrator = new AtomicReference<>();

    private volatile Instant completedAt;

    public PipelineSession(String sessionId, PipelineInput input, Instant createdAt) {
        this.sessionId = sessionId;
        this.input = input;
        this.createdAt = createdAt;
        this.broadcaster = new PipelineEventBroadcaster(sessionId);
    }

    /** Binds the pipeline to this session. Returns {@code false} when one is already bound. */
    public boolean attach(PipelineOrchestrator pipeline) {
        return orchestrator.compareAndSet(null, pipeline);
    }

    public Optional<PipelineOrchestrator> orchestrator() {
        return Optional.ofNullable(orchestrator.get());
    }

    public void markCompleted(Instant at) {
        this.completedAt = at;
    }

    public Optional<Instant> completedAt() {
        return Optional.ofNullable(completedAt);
    }

    /** {@code true} while a pipeline is bound but has not completed. */
    public boolean isRunning() {
        PipelineOrchestrator pipeline = orchestrator.get();
        return pipeline != null && !pipeline.isCompleted();
    }

    public void stagePrompt(String agentName, String prompt) {
        stagedPrompts.put(agentName, prompt);
    }

    public Map<String, String> stagedPrompts() {
        return Map.copyOf(stagedPrompts);
    }

    public String sessionId() {
        return sessionId;
    }

    public PipelineInput input() {
        return input;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public PipelineEventBroadcaster broadcaster() {
        return broadcaster;
    }
}
