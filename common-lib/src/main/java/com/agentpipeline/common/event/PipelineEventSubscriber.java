package com.agentpipeline.common.event;

/**
 * Receiver of {@link PipelineEvent}s.
 *
 * <p>Implementations MUST return promptly and must not block the emitting thread.
 * An implementation that throws is treated as disconnected and removed from the bus.
 */
@FunctionalInterface
public interface PipelineEventSubscriber {

    void onEvent(PipelineEvent event);
}
