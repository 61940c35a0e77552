package com.agentpipeline.orchestrator.pipeline;

import com.agentpipeline.orchestrator.agent.PipelineAgent;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered list of dependency waves derived from {@link PipelineAgent#dependsOn()}.
 *
 * <p>An agent without dependencies belongs to the first wave; any other agent belongs to the
 * wave after the latest wave of its dependencies. Within a wave, declaration order is kept.
 * Unknown dependency names, duplicate agent names and cycles are rejected on construction.
 */
public final class ExecutionPlan {

    private final List<List<PipelineAgent>> waves;

    private ExecutionPlan(List<List<PipelineAgent>> waves) {
        this.waves = waves;
    }

    public static ExecutionPlan of(List<PipelineAgent> agents) {
        Map<String, PipelineAgent> byName = new HashMap<>();
        for (PipelineAgent agent : agents) {
            if (byName.put(agent.name(), agent) != null) {
                throw new IllegalArgumentException("Duplicate agent name: " + agent.name());
            }
        }
        for (PipelineAgent agent : agents) {
            for (String dependency : agent.dependsOn()) {
                if (!byName.containsKey(dependency)) {
                    throw new IllegalArgumentException(
                        "Agent " + agent.name() + " depends on unknown agent " + dependency);
                }
            }
        }

        Set<String> placed = new HashSet<>();
        List<List<PipelineAgent>> waves = new ArrayList<>();
        while (placed.size() < agents.size()) {
            List<PipelineAgent> wave = new ArrayList<>();
            for (PipelineAgent agent : agents) {
                if (!placed.contains(agent.name()) && placed.containsAll(agent.dependsOn())) {
                    wave.add(agent);
                }
            }
            if (wave.isEmpty()) {
                List<String> remaining = agents.stream()
                    .map(PipelineAgent::name)
                    .filter(n -> !placed.contains(n))
                    .toList();
                throw new IllegalArgumentException("Dependency cycle among agents " + remaining);
            }
            wave.forEach(a -> placed.add(a.name()));
            waves.add(List.copyOf(wave));
        }
        return new ExecutionPlan(List.copyOf(waves));
    }

    public List<List<PipelineAgent>> waves() {
        return waves;
    }

    public int waveCount() {
        return waves.size();
    }
}
