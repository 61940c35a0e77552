package com.agentpipeline.orchestrator.pipeline;

import com.agentpipeline.orchestrator.agent.PipelineAgent;
import com.agentpipeline.orchestrator.agent.StubAgent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionPlanTest {

    private static List<String> names(List<PipelineAgent> wave) {
        return wave.stream().map(PipelineAgent::name).toList();
    }

    @Test
    @DisplayName("no dependencies → one wave in declaration order")
    void singleWave() {
        ExecutionPlan plan = ExecutionPlan.of(List.of(
            StubAgent.clean("C"), StubAgent.clean("A"), StubAgent.clean("B")));

        assertEquals(1, plan.waveCount());
        assertEquals(List.of("C", "A", "B"), names(plan.waves().get(0)));
    }

    @Test
    @DisplayName("agent lands in the wave after its latest dependency")
    void layered() {
        ExecutionPlan plan = ExecutionPlan.of(List.of(
            StubAgent.clean("A"),
            StubAgent.clean("B", "A"),
            StubAgent.clean("C"),
            StubAgent.clean("D", "B", "C")));

        assertEquals(3, plan.waveCount());
        assertEquals(List.of("A", "C"), names(plan.waves().get(0)));
        assertEquals(List.of("B"), names(plan.waves().get(1)));
        assertEquals(List.of("D"), names(plan.waves().get(2)));
    }

    @Test
    @DisplayName("empty agent list → no waves")
    void empty() {
        assertEquals(0, ExecutionPlan.of(List.of()).waveCount());
    }

    @Test
    @DisplayName("unknown dependency is rejected")
    void unknownDependency() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> ExecutionPlan.of(List.of(StubAgent.clean("A", "Ghost"))));
        assertTrue(ex.getMessage().contains("Ghost"));
    }

    @Test
    @DisplayName("duplicate agent name is rejected")
    void duplicate() {
        assertThrows(IllegalArgumentException.class,
            () -> ExecutionPlan.of(List.of(StubAgent.clean("A"), StubAgent.clean("A"))));
    }

    @Test
    @DisplayName("dependency cycle is rejected")
    void cycle() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> ExecutionPlan.of(List.of(
                StubAgent.clean("A"),
                StubAgent.clean("B", "C"),
                StubAgent.clean("C", "B"))));
        assertTrue(ex.getMessage().contains("cycle"));
    }
}
