package com.agentpipeline.orchestrator.pipeline;

import com.agentpipeline.common.model.PipelineInput;
import com.agentpipeline.orchestrator.agent.PipelineAgent;
import com.agentpipeline.orchestrator.broadcast.PipelineEventBroadcaster;
import com.agentpipeline.orchestrator.logger.PipelineFlowLogger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Builds a {@link PipelineOrchestrator} with freshly created agent instances.
 *
 * <p>Agents are prototype-scoped beans, so every call yields a new set whose state belongs to
 * that run only. Declaration order follows {@link org.springframework.core.annotation.Order}.
 */
@Component
public class PipelineOrchestratorFactory {

    private final ObjectProvider<PipelineAgent> agentProvider;
    private final PipelineFlowLogger flowLogger;
    private final int concurrencyLimit;

    public PipelineOrchestratorFactory(ObjectProvider<PipelineAgent> agentProvider,
                                       PipelineFlowLogger flowLogger,
                                       @Value("${pipeline.concurrency-limit:2}") int concurrencyLimit) {
        this.agentProvider = agentProvider;
        this.flowLogger = flowLogger;
        this.concurrencyLimit = concurrencyLimit;
    }

    public PipelineOrchestrator create(String sessionId, PipelineInput input,
                                       PipelineEventBroadcaster broadcaster) {
        List<PipelineAgent> agents = agentProvider.orderedStream().toList();
        String pipelineId = UUID.randomUUID().toString().substring(0, 8);
        return new PipelineOrchestrator(pipelineId, sessionId, input, agents, concurrencyLimit,
            broadcaster, flowLogger);
    }
}
