package com.agentpipeline.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Reactive propagation of the pipeline id used to correlate log lines of one run.
 *
 * <p>Reactor Context is the single source of truth for the id inside reactive chains.
 * MDC is only written as a temporary bridge during a log statement, never as a
 * persistent ThreadLocal store.
 *
 * <p>Usage pattern in reactive chains:
 * <pre>
 *     return TraceContextUtil.withPipelineId(run, pipelineId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String PIPELINE_ID_KEY = "pipelineId";

    private TraceContextUtil() {}

    /**
     * Stores {@code pipelineId} in the Reactor Context so every operator upstream of
     * {@code contextWrite} can read it via {@link #getPipelineId(ContextView)}.
     */
    public static <T> Mono<T> withPipelineId(Mono<T> mono, String pipelineId) {
        return mono.contextWrite(ctx -> ctx.put(PIPELINE_ID_KEY, pipelineId));
    }

    /**
     * Returns the pipeline id from the Reactor {@link ContextView}, or {@code "unknown"}.
     */
    public static String getPipelineId(ContextView ctx) {
        return ctx.getOrDefault(PIPELINE_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code pipelineId} into MDC for the duration of {@code logAction} only.
     */
    public static void withMdc(String pipelineId, Runnable logAction) {
        MDC.put(PIPELINE_ID_KEY, pipelineId);
        try {
            logAction.run();
        } finally {
            MDC.remove(PIPELINE_ID_KEY);
        }
    }
}
