package com.agentpipeline.orchestrator.strategist;

import com.agentpipeline.common.aggregation.AggregationOutcome;
import com.agentpipeline.common.aggregation.FallbackReport;
import com.agentpipeline.common.aggregation.MatrixEvaluation;
import com.agentpipeline.common.aggregation.VerdictPolicy;
import com.agentpipeline.common.model.AgentResult;
import com.agentpipeline.common.model.AgentStatus;
import com.agentpipeline.common.model.DetailKeys;
import com.agentpipeline.common.model.LogLevel;
import com.agentpipeline.common.model.PipelineContext;
import com.agentpipeline.common.model.Verdict;
import com.agentpipeline.orchestrator.agent.AgentNames;
import com.agentpipeline.orchestrator.agent.PipelineAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final aggregation stage. Reduces every earlier result through the {@link VerdictPolicy}
 * and attaches a narrative report.
 *
 * <p>The verdict is fixed before the narrative is requested. A failing or unavailable
 * {@link NarrativeGenerator} only swaps the report for {@link FallbackReport}.
 *
 * <p>Result status mirrors the verdict: {@code RETURN → FAIL}, {@code SUPERVISED → WARN},
 * {@code ONLINE → SUCCESS}.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Order(Integer.MAX_VALUE)
public class StrategistAgent extends PipelineAgent {

    private static final Logger logger = LoggerFactory.getLogger(StrategistAgent.class);

    private static final String PROMPT = """
        You are summarising the checks of a property photo review for a supervisor. \
        Write plain, professional prose with these sections: summary, photo documentation, \
        condition, age and category, authenticity and location, recommendation. \
        At most three sentences per section. Name problems clearly; say "no findings" \
        when everything passed. Return only the report text, no markdown or JSON.""";

    private final VerdictPolicy policy;
    private final NarrativeGenerator narrativeGenerator;

    public StrategistAgent(VerdictPolicy policy, NarrativeGenerator narrativeGenerator) {
        super(AgentNames.STRATEGIST, "Aggregation and final verdict", PROMPT);
        this.policy = policy;
        this.narrativeGenerator = narrativeGenerator;
    }

    @Override
    public boolean isFinalStage() {
        return true;
    }

    @Override
    protected Mono<AgentResult> run(PipelineContext context) {
        String instructions = systemPrompt();
        return Mono.fromCallable(() -> aggregate(context))
            .flatMap(outcome -> narrative(outcome, instructions)
                .map(report -> toResult(outcome, report)));
    }

    private AggregationOutcome aggregate(PipelineContext context) {
        log("Aggregating results of all checks.");
        Map<String, AgentResult> findings = new LinkedHashMap<>(context.agentResults());
        findings.remove(name());

        findings.forEach((agent, result) -> {
            if (result.isFailed()) {
                log("FAIL: " + agent + " - " + result.summary(), LogLevel.ERROR);
            } else if (!result.warnings().isEmpty()) {
                log("WARN: " + agent + " - " + result.warnings().size() + " warnings", LogLevel.WARN);
            } else {
                log("OK: " + agent);
            }
        });

        AggregationOutcome outcome = policy.evaluate(findings);

        if (outcome.completenessFailed()) {
            log("Blocking: photo documentation is incomplete.", LogLevel.ERROR);
        }
        MatrixEvaluation matrix = outcome.matrixEvaluation();
        if (matrix != null) {
            log("Matrix: age=" + matrix.effectiveAge() + ", score=" + matrix.conditionScore()
                + " → category " + matrix.cell().category() + " (" + matrix.cell().agreement() + ")");
            if (matrix.cell().agreement().warningPenalty() > 0) {
                log("Matrix conflict, one warning added.", LogLevel.WARN);
            }
        }
        if (outcome.criticalOverride()) {
            log("Critical condition finding → category " + outcome.finalCategory(), LogLevel.ERROR);
        }
        log("Verdict: " + outcome.verdict() + " | category: " + outcome.finalCategory());
        return outcome;
    }

    private Mono<String> narrative(AggregationOutcome outcome, String instructions) {
        return Mono.defer(() -> narrativeGenerator.generate(outcome, instructions))
            .doOnSubscribe(s -> log("Generating final report.", LogLevel.THINKING))
            .onErrorResume(e -> {
                logger.warn("[Strategist] Narrative generation failed, using fallback report. verdict={} reason={}",
                    outcome.verdict(), e.getMessage());
                log("Report generation failed: " + e.getMessage(), LogLevel.WARN);
                return Mono.empty();
            })
            .switchIfEmpty(Mono.fromSupplier(() -> FallbackReport.render(outcome)));
    }

    private AgentResult toResult(AggregationOutcome outcome, String report) {
        Verdict verdict = outcome.verdict();
        AgentStatus status = switch (verdict) {
            case RETURN     -> AgentStatus.FAIL;
            case SUPERVISED -> AgentStatus.WARN;
            case ONLINE     -> AgentStatus.SUCCESS;
        };

        Map<String, Object> summaries = new LinkedHashMap<>();
        outcome.findings().forEach((agent, r) -> {
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("status", r.status());
            s.put("summary", r.summary());
            s.put("category", r.category());
            s.put("score", r.score());
            s.put("warnings", r.warnings());
            s.put("errors", r.errors());
            summaries.put(agent, s);
        });

        return AgentResult.builder(status)
            .category(outcome.finalCategory())
            .summary(report)
            .detail(DetailKeys.VERDICT, verdict)
            .detail(DetailKeys.VERDICT_COLOR, verdict.color())
            .detail(DetailKeys.FINAL_CATEGORY, outcome.finalCategory())
            .detail(DetailKeys.TOTAL_WARNINGS, outcome.totalWarnings())
            .detail(DetailKeys.HAS_FAIL, outcome.hasFail())
            .detail(DetailKeys.HUMAN_REPORT, report)
            .detail(DetailKeys.MATRIX_RESULT, outcome.matrixEvaluation())
            .detail(DetailKeys.AGENT_SUMMARIES, summaries)
            .warnings(outcome.warnings())
            .errors(outcome.errors())
            .build();
    }
}
