package com.agentpipeline.orchestrator.logger;

import com.agentpipeline.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the lifecycle of a pipeline run.
 *
 * <p>Logs each stage without introducing any business logic or modifying pipeline behavior.
 * All methods are pure side-effects.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #PIPELINE_STARTED}: orchestrator accepted the run</li>
 *   <li>{@link #WAVE_STARTED}: a dependency wave began executing</li>
 *   <li>{@link #WAVE_DRAINED}: every agent of the wave settled</li>
 *   <li>{@link #AGGREGATION_STARTED}: final stage started over all settled results</li>
 *   <li>{@link #PIPELINE_COMPLETED}: terminal result created and broadcast</li>
 *   <li>{@link #RESULT_DELIVERED}: result handed to the caller of the run</li>
 * </ol>
 * {@link #PIPELINE_CANCELLED} may appear at any point after start.
 *
 * <p>Usage with {@code doOnEach} (reads the pipeline id from Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(PipelineFlowLogger.RESULT_DELIVERED))
 * </pre>
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String PIPELINE_STARTED    = "PIPELINE_STARTED";
    public static final String WAVE_STARTED        = "WAVE_STARTED";
    public static final String WAVE_DRAINED        = "WAVE_DRAINED";
    public static final String AGGREGATION_STARTED = "AGGREGATION_STARTED";
    public static final String PIPELINE_COMPLETED  = "PIPELINE_COMPLETED";
    public static final String RESULT_DELIVERED    = "RESULT_DELIVERED";
    public static final String PIPELINE_CANCELLED  = "PIPELINE_CANCELLED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} signals only,
     * reading the pipeline id from the Reactor Context embedded in the {@link Signal}.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String pipelineId = TraceContextUtil.getPipelineId(signal.getContextView());
            TraceContextUtil.withMdc(pipelineId, () ->
                log.info("[PipelineFlow] stage={} pipelineId={}", stageName, pipelineId)
            );
        };
    }

    /**
     * Logs a stage when the pipeline id is already at hand, with a free-form detail suffix.
     */
    public void log(String stageName, String pipelineId, String detail) {
        TraceContextUtil.withMdc(pipelineId, () ->
            log.info("[PipelineFlow] stage={} pipelineId={} {}", stageName, pipelineId, detail)
        );
    }
}
