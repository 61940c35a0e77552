package com.agentpipeline.common.aggregation;

import com.agentpipeline.common.exception.InputContractViolationException;
import com.agentpipeline.common.matrix.Agreement;
import com.agentpipeline.common.matrix.DecisionMatrix;
import com.agentpipeline.common.model.AgentResult;
import com.agentpipeline.common.model.AgentStatus;
import com.agentpipeline.common.model.DetailKeys;
import com.agentpipeline.common.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link VerdictPolicy} over the seven-agent lineup.
 */
class VerdictPolicyTest {

    private final VerdictPolicy policy = new VerdictPolicy(
        DecisionMatrix.standard(), "Guardian", "Historian", "Inspector",
        VerdictPolicy.DEFAULT_RETURN_THRESHOLD);

    private static AgentResult clean(String summary) {
        return AgentResult.builder(AgentStatus.SUCCESS).summary(summary).build();
    }

    private static AgentResult historian(double effectiveAge, int category) {
        return AgentResult.builder(AgentStatus.SUCCESS)
            .category(category)
            .summary("age " + effectiveAge)
            .detail(DetailKeys.EFFECTIVE_AGE, effectiveAge)
            .build();
    }

    private static AgentResult inspector(double score) {
        return AgentResult.builder(AgentStatus.SUCCESS).score(score).summary("score " + score).build();
    }

    private static AgentResult singleWarning(String warning) {
        return AgentResult.builder(AgentStatus.WARN).summary(warning).warning(warning).build();
    }

    /** Seven clean results; age 10 and score 24 fall on a MATCH cell of category 2. */
    private static Map<String, AgentResult> cleanLineup() {
        Map<String, AgentResult> results = new LinkedHashMap<>();
        results.put("Guardian", clean("complete"));
        results.put("Forensic", clean("authentic"));
        results.put("Historian", historian(10, 2));
        results.put("Inspector", inspector(24));
        results.put("DocumentComparator", clean("consistent"));
        results.put("CadastralAnalyst", clean("registered"));
        results.put("GeoValidator", clean("on site"));
        return results;
    }

    @Nested
    @DisplayName("scenarios")
    class Scenarios {

        @Test
        @DisplayName("A: all clean → ONLINE with zero warnings")
        void allClean() {
            AggregationOutcome outcome = policy.evaluate(cleanLineup());

            assertEquals(Verdict.ONLINE, outcome.verdict());
            assertEquals(0, outcome.totalWarnings());
            assertEquals(2, outcome.finalCategory());
            assertFalse(outcome.hasFail());
            assertEquals(Agreement.MATCH, outcome.matrixEvaluation().cell().agreement());
        }

        @Test
        @DisplayName("B: a single warning → SUPERVISED")
        void singleWarningSupervised() {
            Map<String, AgentResult> results = cleanLineup();
            results.put("GeoValidator", singleWarning("photo 4 km away"));

            AggregationOutcome outcome = policy.evaluate(results);

            assertEquals(Verdict.SUPERVISED, outcome.verdict());
            assertEquals(1, outcome.totalWarnings());
            assertEquals(java.util.List.of("photo 4 km away"), outcome.warnings());
        }

        @Test
        @DisplayName("C: completeness FAIL → RETURN even with zero warnings")
        void completenessBlocks() {
            Map<String, AgentResult> results = cleanLineup();
            results.put("Guardian", AgentResult.builder(AgentStatus.FAIL)
                .summary("6 photos").error("At least 9 photos required").build());

            AggregationOutcome outcome = policy.evaluate(results);

            assertEquals(Verdict.RETURN, outcome.verdict());
            assertEquals(0, outcome.totalWarnings());
            assertTrue(outcome.completenessFailed());
            assertEquals(java.util.List.of("At least 9 photos required"), outcome.errors());
        }

        @Test
        @DisplayName("D: critical override → worst category and RETURN despite a MATCH cell")
        void criticalOverride() {
            Map<String, AgentResult> results = cleanLineup();
            results.put("Inspector", AgentResult.builder(AgentStatus.SUCCESS)
                .score(24.0)
                .detail(DetailKeys.CRITICAL_OVERRIDE, true)
                .build());

            AggregationOutcome outcome = policy.evaluate(results);

            assertEquals(Agreement.MATCH, outcome.matrixEvaluation().cell().agreement());
            assertEquals(5, outcome.finalCategory());
            assertTrue(outcome.hasFail());
            assertTrue(outcome.criticalOverride());
            assertEquals(Verdict.RETURN, outcome.verdict());
        }

        @Test
        @DisplayName("E: three single warnings → RETURN")
        void threeWarnings() {
            Map<String, AgentResult> results = cleanLineup();
            results.put("Forensic", singleWarning("EXIF stripped"));
            results.put("DocumentComparator", singleWarning("area mismatch"));
            results.put("GeoValidator", singleWarning("photo 800 m away"));

            AggregationOutcome outcome = policy.evaluate(results);

            assertEquals(3, outcome.totalWarnings());
            assertFalse(outcome.hasFail());
            assertEquals(Verdict.RETURN, outcome.verdict());
        }
    }

    @Nested
    @DisplayName("matrix handling")
    class MatrixHandling {

        @Test
        @DisplayName("CONFLICT adds exactly one warning")
        void conflictAddsOneWarning() {
            Map<String, AgentResult> results = cleanLineup();
            results.put("Historian", historian(2, 1));
            results.put("Inspector", inspector(4));

            AggregationOutcome outcome = policy.evaluate(results);

            assertEquals(Agreement.CONFLICT, outcome.matrixEvaluation().cell().agreement());
            assertEquals(1, outcome.totalWarnings());
            assertEquals(5, outcome.finalCategory());
            assertEquals(Verdict.SUPERVISED, outcome.verdict());
        }

        @Test
        @DisplayName("CAUTION adds nothing")
        void cautionAddsNothing() {
            Map<String, AgentResult> results = cleanLineup();
            results.put("Historian", historian(3, 1));
            results.put("Inspector", inspector(23));

            AggregationOutcome outcome = policy.evaluate(results);

            assertEquals(Agreement.CAUTION, outcome.matrixEvaluation().cell().agreement());
            assertEquals(0, outcome.totalWarnings());
            assertEquals(Verdict.ONLINE, outcome.verdict());
        }

        @Test
        @DisplayName("missing score → age agent's own category, no matrix evaluation")
        void missingScoreFallsBackToAgeCategory() {
            Map<String, AgentResult> results = cleanLineup();
            results.put("Historian", historian(40, 4));
            results.put("Inspector", clean("no report"));

            AggregationOutcome outcome = policy.evaluate(results);

            assertNull(outcome.matrixEvaluation());
            assertEquals(4, outcome.finalCategory());
        }

        @Test
        @DisplayName("no age and no score → no category")
        void noCategory() {
            Map<String, AgentResult> results = cleanLineup();
            results.remove("Historian");
            results.remove("Inspector");

            assertNull(policy.evaluate(results).finalCategory());
        }

        @Test
        @DisplayName("NaN score fails fast")
        void nanScore() {
            Map<String, AgentResult> results = cleanLineup();
            results.put("Inspector", inspector(Double.NaN));

            assertThrows(InputContractViolationException.class, () -> policy.evaluate(results));
        }
    }

    @Test
    @DisplayName("any non-completeness FAIL → RETURN")
    void anyFailReturns() {
        Map<String, AgentResult> results = cleanLineup();
        results.put("CadastralAnalyst", AgentResult.failure("registry unreachable"));

        AggregationOutcome outcome = policy.evaluate(results);

        assertTrue(outcome.hasFail());
        assertFalse(outcome.completenessFailed());
        assertEquals(Verdict.RETURN, outcome.verdict());
    }

    @Test
    @DisplayName("threshold below one is rejected")
    void invalidThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new VerdictPolicy(
            DecisionMatrix.standard(), "Guardian", "Historian", "Inspector", 0));
    }
}
