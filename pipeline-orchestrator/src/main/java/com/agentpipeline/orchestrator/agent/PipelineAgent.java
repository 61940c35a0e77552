package com.agentpipeline.orchestrator.agent;

import com.agentpipeline.common.exception.AgentException;
import com.agentpipeline.common.model.AgentResult;
import com.agentpipeline.common.model.AgentSnapshot;
import com.agentpipeline.common.model.AgentStatus;
import com.agentpipeline.common.model.LogEntry;
import com.agentpipeline.common.model.LogLevel;
import com.agentpipeline.common.model.PipelineContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class of every analysis unit run by the pipeline.
 *
 * <p><strong>Execution contract</strong>: {@link #execute(PipelineContext)} resets the agent's
 * logs and timestamps, moves it to {@code PROCESSING}, runs the subclass body
 * {@link #run(PipelineContext)} and adopts the status of the returned result. Any error the
 * body raises, synchronously or as an error signal, and an empty body are absorbed into a
 * {@code FAIL} result. The returned {@code Mono} therefore never errors.
 *
 * <p>An instance belongs to one pipeline run. Status, logs and result are readable from any
 * thread while the agent executes; {@link #snapshot()} gives a consistent serialized view.
 *
 * <p>Instruction text can be replaced with {@link #overridePrompt(String)} at any time; the
 * new text is picked up when the next {@code execute} starts and never mid-run.
 */
public abstract class PipelineAgent {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final String name;
    private final String description;
    private final AtomicReference<String> pendingPrompt = new AtomicReference<>();
    private final List<LogEntry> logs = new CopyOnWriteArrayList<>();
    private final AtomicBoolean settled = new AtomicBoolean(false);

    private volatile String systemPrompt;
    private volatile AgentStatus status = AgentStatus.IDLE;
    private volatile AgentResult result;
    private volatile Instant startTime;
    private volatile Instant endTime;
    private volatile AgentListener listener = AgentListener.NOOP;

    protected PipelineAgent(String name, String description, String systemPrompt) {
        this.name = name;
        this.description = description;
        this.systemPrompt = systemPrompt;
    }

    /**
     * Agent-specific body. Must not mutate the context. May return synchronously through
     * {@code Mono.just} or defer real work; blocking work is allowed, callers run it on a
     * bounded elastic scheduler.
     */
    protected abstract Mono<AgentResult> run(PipelineContext context);

    /** Names of agents whose results must be settled before this agent starts. */
    public Set<String> dependsOn() {
        return Set.of();
    }

    /** {@code true} for the single aggregation stage that always runs last and alone. */
    public boolean isFinalStage() {
        return false;
    }

    public final Mono<AgentResult> execute(PipelineContext context) {
        return Mono.defer(() -> {
            begin();
            return Mono.defer(() -> run(context))
                .switchIfEmpty(Mono.error(() -> AgentException.emptyResult(name)))
                .map(this::complete)
                .onErrorResume(e -> Mono.just(absorbFault(e)));
        });
    }

    /**
     * Settles the current run as {@code FAIL} with the error's message. Used by the contract
     * itself and by the orchestrator for faults raised outside the body, including cancellation.
     * If the run already settled, the existing result is kept and returned.
     */
    public AgentResult absorbFault(Throwable error) {
        AgentResult failure = AgentResult.failure(error);
        if (!settled.compareAndSet(false, true)) {
            return result;
        }
        logger.warn("[{}] execution failed: {}", name, failure.errors().get(0));
        log("Error: " + failure.errors().get(0), LogLevel.ERROR);
        this.result = failure;
        this.endTime = Instant.now();
        transition(AgentStatus.FAIL);
        return failure;
    }

    public void overridePrompt(String prompt) {
        pendingPrompt.set(prompt);
    }

    public void attach(AgentListener listener) {
        this.listener = listener == null ? AgentListener.NOOP : listener;
    }

    /** Seconds between start and end (or now, while running), two decimals, 0.0 if never started. */
    public double elapsedTime() {
        Instant start = startTime;
        if (start == null) {
            return 0.0;
        }
        Instant end = endTime != null ? endTime : Instant.now();
        return Math.round(Duration.between(start, end).toMillis() / 10.0) / 100.0;
    }

    public AgentSnapshot snapshot() {
        return new AgentSnapshot(name, description, systemPrompt, status, List.copyOf(logs),
            result, elapsedTime());
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    /** Instruction text in effect for the current (or last) run. */
    public String systemPrompt() {
        return systemPrompt;
    }

    public AgentStatus status() {
        return status;
    }

    public AgentResult result() {
        return result;
    }

    public List<LogEntry> logs() {
        return List.copyOf(logs);
    }

    protected void log(String message) {
        log(message, LogLevel.INFO);
    }

    protected void log(String message, LogLevel level) {
        LogEntry entry = LogEntry.of(message, level);
        logs.add(entry);
        listener.onLog(name, entry);
    }

    // ── lifecycle ─────────────────────────────────────────────────────────

    private void begin() {
        String override = pendingPrompt.getAndSet(null);
        if (override != null) {
            systemPrompt = override;
        }
        logs.clear();
        result = null;
        endTime = null;
        startTime = Instant.now();
        settled.set(false);
        transition(AgentStatus.PROCESSING);
        log("Starting: " + description);
    }

    private AgentResult complete(AgentResult outcome) {
        if (!settled.compareAndSet(false, true)) {
            return result;
        }
        this.result = outcome;
        log("Completed with status " + outcome.status() + ": " + outcome.summary());
        this.endTime = Instant.now();
        transition(outcome.status());
        return outcome;
    }

    private void transition(AgentStatus next) {
        this.status = next;
        listener.onStatus(name, next, next == AgentStatus.PROCESSING ? null : elapsedTime());
    }
}
