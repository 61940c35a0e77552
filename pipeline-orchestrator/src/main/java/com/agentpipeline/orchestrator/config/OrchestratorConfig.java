package com.agentpipeline.orchestrator.config;

import com.agentpipeline.common.aggregation.VerdictPolicy;
import com.agentpipeline.common.matrix.DecisionMatrix;
import com.agentpipeline.orchestrator.session.InMemoryPipelineSessionStore;
import com.agentpipeline.orchestrator.session.PipelineSessionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class OrchestratorConfig {

    @Value("${pipeline.completeness-agent:Guardian}")
    private String completenessAgent;

    @Value("${pipeline.age-agent:Historian}")
    private String ageAgent;

    @Value("${pipeline.condition-agent:Inspector}")
    private String conditionAgent;

    @Value("${pipeline.return-warning-threshold:3}")
    private int returnWarningThreshold;

    @Value("${pipeline.session-ttl:30m}")
    private Duration sessionTtl;

    @Value("${pipeline.pending-session-ttl:2h}")
    private Duration pendingSessionTtl;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DecisionMatrix decisionMatrix() {
        return DecisionMatrix.standard();
    }

    @Bean
    public VerdictPolicy verdictPolicy(DecisionMatrix decisionMatrix) {
        return new VerdictPolicy(decisionMatrix, completenessAgent, ageAgent, conditionAgent,
            returnWarningThreshold);
    }

    @Bean
    public PipelineSessionStore pipelineSessionStore(Clock clock) {
        return new InMemoryPipelineSessionStore(clock, sessionTtl, pendingSessionTtl);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
