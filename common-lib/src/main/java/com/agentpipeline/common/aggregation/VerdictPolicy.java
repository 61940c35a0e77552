package com.agentpipeline.common.aggregation;

import com.agentpipeline.common.matrix.AgeBand;
import com.agentpipeline.common.matrix.DecisionMatrix;
import com.agentpipeline.common.matrix.MatrixCell;
import com.agentpipeline.common.matrix.ScoreBand;
import com.agentpipeline.common.model.AgentResult;
import com.agentpipeline.common.model.DetailKeys;
import com.agentpipeline.common.model.Verdict;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reduces the settled results of every non-final agent into one {@link Verdict}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Sum the warnings of every result; any {@code FAIL} status sets {@code hasFail}.</li>
 *   <li>A {@code FAIL} of the designated completeness agent is a hard blocker.</li>
 *   <li>When the age agent reports {@value DetailKeys#EFFECTIVE_AGE} and the condition agent
 *       reports a score, look both up in the {@link DecisionMatrix}; a
 *       {@code CONFLICT} cell adds exactly one warning.</li>
 *   <li>Final category is the matrix category, otherwise the age agent's own category.</li>
 *   <li>The condition agent's {@value DetailKeys#CRITICAL_OVERRIDE} flag forces the worst
 *       category and sets {@code hasFail}.</li>
 *   <li>{@code hasFail}, completeness failure or at least {@code returnThreshold} warnings
 *       give {@code RETURN}; at least one warning gives {@code SUPERVISED}; otherwise
 *       {@code ONLINE}.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe. No reactive types. No logging.
 */
public final class VerdictPolicy {

    public static final int DEFAULT_RETURN_THRESHOLD = 3;

    private final DecisionMatrix matrix;
    private final String completenessAgent;
    private final String ageAgent;
    private final String conditionAgent;
    private final int returnThreshold;

    public VerdictPolicy(DecisionMatrix matrix, String completenessAgent, String ageAgent,
                         String conditionAgent, int returnThreshold) {
        if (returnThreshold < 1) {
            throw new IllegalArgumentException("returnThreshold must be at least 1, got " + returnThreshold);
        }
        this.matrix = matrix;
        this.completenessAgent = completenessAgent;
        this.ageAgent = ageAgent;
        this.conditionAgent = conditionAgent;
        this.returnThreshold = returnThreshold;
    }

    /**
     * @param findings results of every agent except the final stage, in declaration order
     * @throws com.agentpipeline.common.exception.InputContractViolationException when the
     *         age or score reported is NaN
     */
    public AggregationOutcome evaluate(Map<String, AgentResult> findings) {
        int totalWarnings = 0;
        boolean hasFail = false;
        List<String> warnings = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (AgentResult result : findings.values()) {
            if (result == null) {
                continue;
            }
            totalWarnings += result.warnings().size();
            warnings.addAll(result.warnings());
            errors.addAll(result.errors());
            if (result.isFailed()) {
                hasFail = true;
            }
        }

        AgentResult completeness = findings.get(completenessAgent);
        boolean completenessFailed = completeness != null && completeness.isFailed();

        AgentResult age = findings.get(ageAgent);
        AgentResult condition = findings.get(conditionAgent);

        Double effectiveAge = age != null && age.detail(DetailKeys.EFFECTIVE_AGE) instanceof Number n
            ? n.doubleValue() : null;
        Double conditionScore = condition != null ? condition.score() : null;

        MatrixEvaluation evaluation = null;
        if (effectiveAge != null && conditionScore != null) {
            AgeBand ageBand = AgeBand.of(effectiveAge);
            ScoreBand scoreBand = ScoreBand.of(conditionScore);
            MatrixCell cell = matrix.lookup(ageBand, scoreBand);
            evaluation = new MatrixEvaluation(effectiveAge, conditionScore, ageBand, scoreBand, cell);
            totalWarnings += cell.agreement().warningPenalty();
        }

        Integer finalCategory = null;
        if (evaluation != null) {
            finalCategory = evaluation.cell().category();
        } else if (age != null && age.category() != null) {
            finalCategory = age.category();
        }

        boolean criticalOverride = condition != null && condition.flag(DetailKeys.CRITICAL_OVERRIDE);
        if (criticalOverride) {
            finalCategory = matrix.worstCategory();
            hasFail = true;
        }

        Verdict verdict;
        if (hasFail || completenessFailed || totalWarnings >= returnThreshold) {
            verdict = Verdict.RETURN;
        } else if (totalWarnings >= 1) {
            verdict = Verdict.SUPERVISED;
        } else {
            verdict = Verdict.ONLINE;
        }

        return new AggregationOutcome(verdict, finalCategory, totalWarnings, hasFail,
            completenessFailed, criticalOverride, evaluation, warnings, errors, findings);
    }

    public String completenessAgent() {
        return completenessAgent;
    }

    public String ageAgent() {
        return ageAgent;
    }

    public String conditionAgent() {
        return conditionAgent;
    }
}
