package com.agentpipeline.common.aggregation;

import com.agentpipeline.common.model.AgentResult;

import java.util.Map;
import java.util.StringJoiner;

/**
 * Deterministic plain-text report used whenever no narrative generator is available.
 *
 * <pre>
 *   Verdict: SUPERVISED
 *   Assigned category: 3
 *
 *   Guardian: 12 photos, exterior=4, interior=6, rear/side=yes
 *   Historian: Effective age 22 years, category 3
 * </pre>
 *
 * The category line is omitted when no category was derived.
 */
public final class FallbackReport {

    private FallbackReport() {}

    public static String render(AggregationOutcome outcome) {
        StringJoiner lines = new StringJoiner("\n");
        lines.add("Verdict: " + outcome.verdict());
        if (outcome.finalCategory() != null) {
            lines.add("Assigned category: " + outcome.finalCategory());
        }
        lines.add("");
        for (Map.Entry<String, AgentResult> entry : outcome.findings().entrySet()) {
            AgentResult result = entry.getValue();
            String summary = result == null || result.summary().isBlank() ? "-" : result.summary();
            lines.add(entry.getKey() + ": " + summary);
        }
        return lines.toString();
    }
}
