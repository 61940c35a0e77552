package com.agentpipeline.orchestrator.agent;

import com.agentpipeline.common.model.AgentResult;
import com.agentpipeline.common.model.AgentStatus;
import com.agentpipeline.common.model.ConditionReport;
import com.agentpipeline.common.model.Defect;
import com.agentpipeline.common.model.DefectSeverity;
import com.agentpipeline.common.model.DetailKeys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.agentpipeline.orchestrator.agent.AgentFixtures.condition;
import static com.agentpipeline.orchestrator.agent.AgentFixtures.context;
import static org.junit.jupiter.api.Assertions.*;

class InspectorAgentTest {

    private AgentResult inspect(ConditionReport report) {
        return new InspectorAgent().execute(context(condition(report))).block();
    }

    @Test
    @DisplayName("clean report → SUCCESS with the score")
    void clean() {
        AgentResult result = inspect(new ConditionReport(25, List.of(
            new Defect("worn paint", DefectSeverity.MINOR))));

        assertEquals(AgentStatus.SUCCESS, result.status());
        assertEquals(25.0, result.score());
        assertFalse(result.flag(DetailKeys.CRITICAL_OVERRIDE));
    }

    @Test
    @DisplayName("critical defect → FAIL with critical override")
    void critical() {
        AgentResult result = inspect(new ConditionReport(24, List.of(
            new Defect("diagonal crack above door", DefectSeverity.CRITICAL))));

        assertEquals(AgentStatus.FAIL, result.status());
        assertTrue(result.flag(DetailKeys.CRITICAL_OVERRIDE));
        assertEquals(24.0, result.score());
        assertEquals(List.of("Critical defect: diagonal crack above door"), result.errors());
    }

    @Test
    @DisplayName("severe defect → WARN with one warning per defect")
    void severe() {
        AgentResult result = inspect(new ConditionReport(18, List.of(
            new Defect("damp wall", DefectSeverity.SEVERE),
            new Defect("mould", DefectSeverity.SEVERE))));

        assertEquals(AgentStatus.WARN, result.status());
        assertEquals(2, result.warnings().size());
    }

    @Test
    @DisplayName("no report → WARN without a score")
    void noReport() {
        AgentResult result = inspect(null);

        assertEquals(AgentStatus.WARN, result.status());
        assertNull(result.score());
    }

    @Test
    @DisplayName("score outside 0-30 → FAIL")
    void outOfRange() {
        AgentResult result = inspect(new ConditionReport(31, List.of()));

        assertEquals(AgentStatus.FAIL, result.status());
        assertNull(result.score());
    }
}
