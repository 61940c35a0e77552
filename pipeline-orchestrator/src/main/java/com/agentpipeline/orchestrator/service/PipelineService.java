package com.agentpipeline.orchestrator.service;

import com.agentpipeline.common.event.PipelineCompleteEvent;
import com.agentpipeline.common.event.PipelineEvent;
import com.agentpipeline.common.exception.PipelineStateException;
import com.agentpipeline.common.model.PipelineInput;
import com.agentpipeline.common.model.PipelineResult;
import com.agentpipeline.common.model.PipelineState;
import com.agentpipeline.orchestrator.pipeline.PipelineOrchestrator;
import com.agentpipeline.orchestrator.pipeline.PipelineOrchestratorFactory;
import com.agentpipeline.orchestrator.session.PipelineSession;
import com.agentpipeline.orchestrator.session.PipelineSessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Session-level entry point: registers inputs, starts pipelines and answers queries.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final PipelineSessionStore sessionStore;
    private final PipelineOrchestratorFactory orchestratorFactory;
    private final Clock clock;

    public PipelineService(PipelineSessionStore sessionStore,
                           PipelineOrchestratorFactory orchestratorFactory,
                           Clock clock) {
        this.sessionStore = sessionStore;
        this.orchestratorFactory = orchestratorFactory;
        this.clock = clock;
    }

    public PipelineSession createSession(PipelineInput input) {
        return sessionStore.create(input);
    }

    /**
     * Runs the pipeline of a session to completion. The run outlives the returned
     * {@code Mono}: a cancelled subscription cancels the pipeline, which still completes.
     *
     * <p>Errors with {@link SessionNotFoundException} for unknown sessions and with
     * {@link PipelineStateException} when the session's pipeline was already started.
     */
    public Mono<PipelineResult> start(String sessionId, Map<String, String> customPrompts) {
        return Mono.defer(() -> {
            PipelineSession session = requireSession(sessionId);
            PipelineOrchestrator pipeline = orchestratorFactory.create(
                sessionId, session.input(), session.broadcaster());
            if (!session.attach(pipeline)) {
                String running = session.orchestrator().map(PipelineOrchestrator::pipelineId).orElse("unknown");
                return Mono.error(new PipelineStateException(running,
                    "session " + sessionId + " has already been started"));
            }
            Map<String, String> prompts = new HashMap<>(session.stagedPrompts());
            if (customPrompts != null) {
                prompts.putAll(customPrompts);
            }
            log.info("Starting pipeline. sessionId={} pipelineId={} promptOverrides={}",
                sessionId, pipeline.pipelineId(), prompts.keySet());
            pipeline.completion().subscribe(
                result -> session.markCompleted(clock.instant()),
                e -> session.markCompleted(clock.instant()));
            return pipeline.run(prompts);
        });
    }

    public Optional<PipelineResult> result(String sessionId) {
        return requireSession(sessionId).orchestrator().flatMap(PipelineOrchestrator::getResult);
    }

    public Optional<PipelineState> state(String sessionId) {
        return requireSession(sessionId).orchestrator().map(PipelineOrchestrator::getState);
    }

    /**
     * Replaces an agent's instruction text. Before the start the override is staged on the
     * session; afterwards it goes to the running pipeline and applies from the agent's next run.
     *
     * @return {@code false} when the pipeline is running and has no agent of that name
     */
    public boolean overridePrompt(String sessionId, String agentName, String prompt) {
        PipelineSession session = requireSession(sessionId);
        Optional<PipelineOrchestrator> pipeline = session.orchestrator();
        if (pipeline.isPresent()) {
            return pipeline.get().overridePrompt(agentName, prompt);
        }
        session.stagePrompt(agentName, prompt);
        return true;
    }

    /** @return {@code false} when nothing was running or cancellation was already requested */
    public boolean cancel(String sessionId) {
        return requireSession(sessionId).orchestrator()
            .map(PipelineOrchestrator::cancel)
            .orElse(false);
    }

    /**
     * Live events of a session, ending after {@code pipeline_complete}. A session that already
     * completed yields its completion event alone.
     */
    public Flux<PipelineEvent> events(String sessionId) {
        return Flux.defer(() -> {
            PipelineSession session = requireSession(sessionId);
            Mono<PipelineEvent> finished = Mono.fromSupplier(() -> session.orchestrator()
                .flatMap(PipelineOrchestrator::getResult)
                .map(PipelineCompleteEvent::of)
                .orElse(null));
            // live stream is registered before the result is checked
            return session.broadcaster().stream()
                .mergeWith(finished)
                .takeUntil(event -> event instanceof PipelineCompleteEvent);
        });
    }

    private PipelineSession requireSession(String sessionId) {
        return sessionStore.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
