package com.agentpipeline.orchestrator.agent;

import com.agentpipeline.common.model.AgentResult;
import com.agentpipeline.common.model.AgentStatus;
import com.agentpipeline.common.model.ConditionReport;
import com.agentpipeline.common.model.Defect;
import com.agentpipeline.common.model.DefectSeverity;
import com.agentpipeline.common.model.DetailKeys;
import com.agentpipeline.common.model.LogLevel;
import com.agentpipeline.common.model.PipelineContext;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scores the technical condition of the building from the supplied condition report.
 *
 * <p>A {@code CRITICAL} defect (structural cracks, collapsed roof) raises the
 * {@value DetailKeys#CRITICAL_OVERRIDE} flag and fails the check; {@code SEVERE} defects are
 * warnings. Without a report the score stays empty and the check only warns.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Order(40)
public class InspectorAgent extends PipelineAgent {

    static final double MAX_SCORE = 30.0;

    private static final String PROMPT = """
        Assess the technical condition of the house on a 0 to 30 scale. Structural cracks, \
        a collapsed roof or other structural damage are critical findings.""";

    public InspectorAgent() {
        super(AgentNames.INSPECTOR, "Technical condition scoring", PROMPT);
    }

    @Override
    protected Mono<AgentResult> run(PipelineContext context) {
        return Mono.fromCallable(() -> assess(context.input().conditionReport()));
    }

    private AgentResult assess(ConditionReport report) {
        if (report == null) {
            log("No condition report supplied.", LogLevel.WARN);
            return AgentResult.builder(AgentStatus.WARN)
                .summary("Condition assessment unavailable")
                .warning("Condition assessment unavailable.")
                .build();
        }

        double score = report.score();
        if (Double.isNaN(score) || score < 0 || score > MAX_SCORE) {
            log("Condition score " + score + " outside 0-30.", LogLevel.ERROR);
            return AgentResult.builder(AgentStatus.FAIL)
                .summary("Condition score " + score + " is invalid")
                .error("Condition score must lie between 0 and 30, got " + score)
                .build();
        }

        Map<DefectSeverity, Integer> counts = new EnumMap<>(DefectSeverity.class);
        AgentResult.Builder result = AgentResult.builder(AgentStatus.SUCCESS).score(score);
        boolean critical = false;
        for (Defect defect : report.defects()) {
            DefectSeverity severity = defect.severity() != null ? defect.severity() : DefectSeverity.MINOR;
            counts.merge(severity, 1, Integer::sum);
            if (severity == DefectSeverity.CRITICAL) {
                critical = true;
                result.error("Critical defect: " + defect.description());
                log("Critical defect: " + defect.description(), LogLevel.ERROR);
            } else if (severity == DefectSeverity.SEVERE) {
                result.warning("Severe defect: " + defect.description());
                log("Severe defect: " + defect.description(), LogLevel.WARN);
            }
        }

        Map<String, Integer> defectCounts = new LinkedHashMap<>();
        counts.forEach((severity, count) -> defectCounts.put(severity.name(), count));

        int criticalCount = counts.getOrDefault(DefectSeverity.CRITICAL, 0);
        AgentResult outcome = result
            .summary(String.format("Condition score %.0f/30, %d defects (%d critical)",
                score, report.defects().size(), criticalCount))
            .detail(DetailKeys.CRITICAL_OVERRIDE, critical)
            .detail("defectCounts", defectCounts)
            .detail("maxScore", MAX_SCORE)
            .statusFromFindings()
            .build();
        log("Inspector result: " + outcome.status() + ", score " + score);
        return outcome;
    }
}
