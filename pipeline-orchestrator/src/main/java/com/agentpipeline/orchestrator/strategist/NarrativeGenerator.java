package com.agentpipeline.orchestrator.strategist;

import com.agentpipeline.common.aggregation.AggregationOutcome;
import reactor.core.publisher.Mono;

/**
 * Turns an aggregation outcome into human-readable report text.
 *
 * <p>Implementations MUST be non-blocking. An empty {@code Mono} means "not available" and an
 * error means the generation failed; in both cases the caller renders the deterministic
 * fallback report. The narrative never influences the verdict.
 */
public interface NarrativeGenerator {

    /**
     * @param outcome      the already-decided aggregation outcome
     * @param instructions current instruction text of the final stage, may be {@code null}
     */
    Mono<String> generate(AggregationOutcome outcome, String instructions);
}
