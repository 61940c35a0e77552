package com.agentpipeline.common.aggregation;

import com.agentpipeline.common.model.AgentResult;
import com.agentpipeline.common.model.Verdict;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic output of {@link VerdictPolicy#evaluate(Map)}.
 *
 * @param finalCategory    category 1–5, {@code null} when neither the matrix nor the age agent
 *                         produced one
 * @param matrixEvaluation {@code null} when age or condition score was unavailable
 * @param findings         the evaluated results in their original order
 */
public record AggregationOutcome(
    Verdict verdict,
    Integer finalCategory,
    int totalWarnings,
    boolean hasFail,
    boolean completenessFailed,
    boolean criticalOverride,
    MatrixEvaluation matrixEvaluation,
    List<String> warnings,
    List<String> errors,
    Map<String, AgentResult> findings
) {
    public AggregationOutcome {
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
        findings = Collections.unmodifiableMap(new LinkedHashMap<>(findings));
    }
}
