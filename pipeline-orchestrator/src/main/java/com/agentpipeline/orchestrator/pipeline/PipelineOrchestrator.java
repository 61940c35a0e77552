package com.agentpipeline.orchestrator.pipeline;

import com.agentpipeline.common.event.AgentLogEvent;
import com.agentpipeline.common.event.AgentStatusEvent;
import com.agentpipeline.common.event.PipelineCompleteEvent;
import com.agentpipeline.common.event.PipelineStartEvent;
import com.agentpipeline.common.exception.PipelineStateException;
import com.agentpipeline.common.model.AgentResult;
import com.agentpipeline.common.model.AgentSnapshot;
import com.agentpipeline.common.model.AgentStatus;
import com.agentpipeline.common.model.DetailKeys;
import com.agentpipeline.common.model.LogEntry;
import com.agentpipeline.common.model.PipelineContext;
import com.agentpipeline.common.model.PipelineInput;
import com.agentpipeline.common.model.PipelineResult;
import com.agentpipeline.common.model.PipelineState;
import com.agentpipeline.common.model.Verdict;
import com.agentpipeline.common.trace.TraceContextUtil;
import com.agentpipeline.orchestrator.agent.AgentListener;
import com.agentpipeline.orchestrator.agent.PipelineAgent;
import com.agentpipeline.orchestrator.broadcast.PipelineEventBroadcaster;
import com.agentpipeline.orchestrator.logger.PipelineFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one pipeline: dependency waves of agents under a concurrency bound, then the single
 * final stage over everything that settled.
 *
 * <h3>Lifecycle</h3>
 * {@code NOT_STARTED → RUNNING → COMPLETED}. {@link #run(Map)} is accepted once; a second call
 * fails with {@link PipelineStateException}. {@link #getState()} is valid at any time and
 * returns live agent snapshots; {@link #getResult()} is present once completed.
 *
 * <h3>Scheduling</h3>
 * <ul>
 *   <li>Waves run strictly one after another. Every agent of a wave receives the same
 *       snapshot of results settled in earlier waves and never sees its siblings.</li>
 *   <li>At most {@code concurrencyLimit} agents of a wave execute at once; with a limit of 1
 *       the wave runs sequentially.</li>
 *   <li>A failing agent never cancels its siblings. Faults raised outside the agent
 *       contract are converted into a {@code FAIL} result for that agent.</li>
 * </ul>
 *
 * <h3>Cancellation</h3>
 * {@link #cancel()} is cooperative: agents not yet settled settle as {@code FAIL}, settled
 * results are kept, and the run still completes with a {@link PipelineResult}.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    enum Phase { NOT_STARTED, RUNNING, COMPLETED }

    private final String pipelineId;
    private final String sessionId;
    private final PipelineInput input;
    private final List<PipelineAgent> agents;
    private final PipelineAgent finalStage;
    private final ExecutionPlan plan;
    private final int concurrencyLimit;
    private final PipelineEventBroadcaster broadcaster;
    private final PipelineFlowLogger flowLogger;

    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.NOT_STARTED);
    private final Map<String, AgentResult> settled = new ConcurrentHashMap<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Sinks.One<Boolean> cancelSignal = Sinks.one();
    private final Sinks.One<PipelineResult> outcome = Sinks.one();

    private volatile Instant startedAt;
    private volatile PipelineResult result;

    public PipelineOrchestrator(String pipelineId, String sessionId, PipelineInput input,
                                List<PipelineAgent> allAgents, int concurrencyLimit,
                                PipelineEventBroadcaster broadcaster, PipelineFlowLogger flowLogger) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1, got " + concurrencyLimit);
        }
        List<PipelineAgent> stages = new ArrayList<>();
        List<PipelineAgent> finals = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (PipelineAgent agent : allAgents) {
            if (!names.add(agent.name())) {
                throw new IllegalArgumentException("Duplicate agent name: " + agent.name());
            }
            if (agent.isFinalStage()) {
                finals.add(agent);
            } else {
                stages.add(agent);
            }
        }
        if (finals.size() != 1) {
            throw new IllegalArgumentException("Exactly one final stage is required, found " + finals.size());
        }

        this.pipelineId = pipelineId;
        this.sessionId = sessionId;
        this.input = input;
        this.agents = List.copyOf(stages);
        this.finalStage = finals.get(0);
        this.plan = ExecutionPlan.of(this.agents);
        this.concurrencyLimit = concurrencyLimit;
        this.broadcaster = broadcaster;
        this.flowLogger = flowLogger;

        AgentListener listener = new BroadcastingListener();
        allAgents.forEach(agent -> agent.attach(listener));
    }

    /**
     * Executes the pipeline. Prompt overrides are applied to the named agents before the first
     * wave starts; unknown names are logged and ignored. Agent failures never surface here:
     * the returned {@code Mono} errors only when the pipeline was already started.
     *
     * <p>The run is subscribed independently of the caller. Cancelling the returned
     * {@code Mono} (a disconnected client) requests {@link #cancel()}; the run still settles
     * every agent and completes with a result available from {@link #completion()}.
     */
    public Mono<PipelineResult> run(Map<String, String> customPrompts) {
        return Mono.defer(() -> {
            if (!phase.compareAndSet(Phase.NOT_STARTED, Phase.RUNNING)) {
                return Mono.error(new PipelineStateException(pipelineId, "pipeline has already been started"));
            }
            TraceContextUtil.withPipelineId(execute(customPrompts), pipelineId)
                .subscribe(outcome::tryEmitValue, this::machineryFault);
            return outcome.asMono().doOnCancel(this::callerCancelled);
        });
    }

    /** Emits the result once the run completed, whoever started it. */
    public Mono<PipelineResult> completion() {
        return outcome.asMono();
    }

    /**
     * Requests cooperative cancellation. Returns {@code false} when the pipeline already
     * completed or cancellation was requested before.
     */
    public boolean cancel() {
        if (phase.get() == Phase.COMPLETED || !cancelled.compareAndSet(false, true)) {
            return false;
        }
        cancelSignal.tryEmitValue(Boolean.TRUE);
        flowLogger.log(PipelineFlowLogger.PIPELINE_CANCELLED, pipelineId, "phase=" + phase.get());
        return true;
    }

    /**
     * Replaces the instruction text of the named agent from its next execution on.
     *
     * @return {@code false} when no agent of this pipeline has that name
     */
    public boolean overridePrompt(String agentName, String prompt) {
        Optional<PipelineAgent> agent = findAgent(agentName);
        agent.ifPresent(a -> a.overridePrompt(prompt));
        return agent.isPresent();
    }

    public PipelineState getState() {
        Phase current = phase.get();
        return new PipelineState(pipelineId, sessionId, current == Phase.RUNNING,
            current == Phase.COMPLETED, snapshots());
    }

    public Optional<PipelineResult> getResult() {
        return Optional.ofNullable(result);
    }

    public boolean isRunning() {
        return phase.get() == Phase.RUNNING;
    }

    public boolean isCompleted() {
        return phase.get() == Phase.COMPLETED;
    }

    public String pipelineId() {
        return pipelineId;
    }

    public String sessionId() {
        return sessionId;
    }

    /** Agent names in declaration order, the final stage last. */
    public List<String> agentNames() {
        List<String> names = new ArrayList<>();
        agents.forEach(a -> names.add(a.name()));
        names.add(finalStage.name());
        return names;
    }

    // ── waves ─────────────────────────────────────────────────────────────────

    private Mono<PipelineResult> execute(Map<String, String> customPrompts) {
        return Mono.defer(() -> {
            startedAt = Instant.now();
            applyPrompts(customPrompts);
            flowLogger.log(PipelineFlowLogger.PIPELINE_STARTED, pipelineId,
                "sessionId=" + sessionId + " agents=" + (agents.size() + 1)
                    + " waves=" + plan.waveCount() + " concurrencyLimit=" + concurrencyLimit);
            broadcaster.publish(PipelineStartEvent.of(pipelineId, sessionId, agentNames()));

            return Flux.fromIterable(plan.waves())
                .index()
                .concatMap(wave -> runWave(wave.getT1().intValue() + 1, wave.getT2()))
                .then(Mono.defer(this::runFinalStage))
                .map(this::complete)
                .doOnEach(flowLogger.stage(PipelineFlowLogger.RESULT_DELIVERED));
        });
    }

    private void callerCancelled() {
        if (phase.get() == Phase.RUNNING) {
            log.info("[Orchestrator] Caller cancelled, stopping remaining agents. pipelineId={}", pipelineId);
            cancel();
        }
    }

    private void machineryFault(Throwable e) {
        TraceContextUtil.withMdc(pipelineId, () ->
            log.error("[Orchestrator] Pipeline aborted outside agent contract. pipelineId={}", pipelineId, e));
        outcome.tryEmitError(e);
    }

    private Mono<Void> runWave(int number, List<PipelineAgent> wave) {
        return Mono.defer(() -> {
            PipelineContext context = contextSnapshot();
            flowLogger.log(PipelineFlowLogger.WAVE_STARTED, pipelineId,
                "wave=" + number + " agents=" + wave.stream().map(PipelineAgent::name).toList());
            return Flux.fromIterable(wave)
                .flatMap(agent -> executeIsolated(agent, context)
                    .map(r -> Map.entry(agent.name(), r)), concurrencyLimit)
                .collectList()
                .doOnNext(entries -> {
                    entries.forEach(e -> settled.put(e.getKey(), e.getValue()));
                    flowLogger.log(PipelineFlowLogger.WAVE_DRAINED, pipelineId,
                        "wave=" + number + " settled=" + settled.size());
                })
                .then();
        });
    }

    private Mono<AgentResult> runFinalStage() {
        PipelineContext context = contextSnapshot();
        flowLogger.log(PipelineFlowLogger.AGGREGATION_STARTED, pipelineId,
            "stage=" + finalStage.name() + " inputs=" + context.agentResults().size());
        return executeIsolated(finalStage, context);
    }

    private Mono<AgentResult> executeIsolated(PipelineAgent agent, PipelineContext context) {
        return Mono.defer(() -> {
                if (cancelled.get()) {
                    return Mono.just(agent.absorbFault(cancellation()));
                }
                return agent.execute(context)
                    .subscribeOn(Schedulers.boundedElastic())
                    .takeUntilOther(cancelSignal.asMono())
                    .switchIfEmpty(Mono.fromSupplier(() -> agent.absorbFault(cancellation())));
            })
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(pipelineId, () ->
                    log.error("[Orchestrator] Fault outside agent contract. agent={} pipelineId={}",
                        agent.name(), pipelineId, e));
                return Mono.just(agent.absorbFault(e));
            });
    }

    private PipelineContext contextSnapshot() {
        Map<String, AgentResult> ordered = new LinkedHashMap<>();
        for (PipelineAgent agent : agents) {
            AgentResult r = settled.get(agent.name());
            if (r != null) {
                ordered.put(agent.name(), r);
            }
        }
        return new PipelineContext(pipelineId, sessionId, input, ordered);
    }

    // ── completion ────────────────────────────────────────────────────────────

    private PipelineResult complete(AgentResult finalResult) {
        settled.put(finalStage.name(), finalResult);

        Verdict verdict = finalResult.detail(DetailKeys.VERDICT) instanceof Verdict v ? v : Verdict.RETURN;
        int totalWarnings = finalResult.detail(DetailKeys.TOTAL_WARNINGS) instanceof Number n
            ? n.intValue()
            : agents.stream().map(a -> settled.get(a.name()))
                .filter(Objects::nonNull)
                .mapToInt(r -> r.warnings().size())
                .sum();
        String report = finalResult.detail(DetailKeys.HUMAN_REPORT) instanceof String s ? s : finalResult.summary();
        double totalTime = Math.round(Duration.between(startedAt, Instant.now()).toMillis() / 10.0) / 100.0;

        PipelineResult completed = new PipelineResult(pipelineId, sessionId, totalTime, verdict,
            verdict.color(), finalResult.category(), totalWarnings, report, cancelled.get(), snapshots());
        this.result = completed;
        phase.set(Phase.COMPLETED);

        flowLogger.log(PipelineFlowLogger.PIPELINE_COMPLETED, pipelineId,
            "verdict=" + verdict + " category=" + finalResult.category()
                + " totalWarnings=" + totalWarnings + " totalTime=" + totalTime);
        broadcaster.publish(PipelineCompleteEvent.of(completed));
        return completed;
    }

    private Map<String, AgentSnapshot> snapshots() {
        Map<String, AgentSnapshot> snapshots = new LinkedHashMap<>();
        agents.forEach(a -> snapshots.put(a.name(), a.snapshot()));
        snapshots.put(finalStage.name(), finalStage.snapshot());
        return snapshots;
    }

    private void applyPrompts(Map<String, String> customPrompts) {
        if (customPrompts == null) {
            return;
        }
        customPrompts.forEach((agentName, prompt) -> {
            if (!overridePrompt(agentName, prompt)) {
                log.warn("[Orchestrator] Prompt override for unknown agent ignored. agent={} pipelineId={}",
                    agentName, pipelineId);
            }
        });
    }

    private Optional<PipelineAgent> findAgent(String agentName) {
        if (finalStage.name().equals(agentName)) {
            return Optional.of(finalStage);
        }
        return agents.stream().filter(a -> a.name().equals(agentName)).findFirst();
    }

    private static CancellationException cancellation() {
        return new CancellationException("Pipeline cancelled");
    }

    private class BroadcastingListener implements AgentListener {

        @Override
        public void onStatus(String agentName, AgentStatus status, Double elapsedTime) {
            broadcaster.publish(AgentStatusEvent.of(pipelineId, agentName, status, elapsedTime));
        }

        @Override
        public void onLog(String agentName, LogEntry entry) {
            broadcaster.publish(AgentLogEvent.of(pipelineId, agentName, entry.message(), entry.level()));
        }
    }
}
