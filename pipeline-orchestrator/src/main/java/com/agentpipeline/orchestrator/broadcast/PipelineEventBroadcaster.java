package com.agentpipeline.orchestrator.broadcast;

import com.agentpipeline.common.event.PipelineEvent;
import com.agentpipeline.common.event.PipelineEventSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Best-effort fan-out of {@link PipelineEvent}s to every current subscriber of one session.
 *
 * <p><strong>Delivery contract</strong>: live only, no replay. A subscriber sees the events
 * emitted while it is registered, in emission order, one at a time. A subscriber that throws
 * is removed and the failure is logged; it never reaches the publisher. Subscribing and
 * unsubscribing are safe while an event is being delivered.
 */
public class PipelineEventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(PipelineEventBroadcaster.class);

    private final String sessionId;
    private final List<PipelineEventSubscriber> subscribers = new CopyOnWriteArrayList<>();
    private final Object deliveryLock = new Object();

    public PipelineEventBroadcaster(String sessionId) {
        this.sessionId = sessionId;
    }

    public void subscribe(PipelineEventSubscriber subscriber) {
        subscribers.add(subscriber);
        log.debug("[Broadcast] Subscriber added. sessionId={} subscribers={}", sessionId, subscribers.size());
    }

    public boolean unsubscribe(PipelineEventSubscriber subscriber) {
        return subscribers.remove(subscriber);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public void publish(PipelineEvent event) {
        synchronized (deliveryLock) {
            for (PipelineEventSubscriber subscriber : subscribers) {
                try {
                    subscriber.onEvent(event);
                } catch (RuntimeException e) {
                    subscribers.remove(subscriber);
                    log.warn("[Broadcast] Subscriber failed and was removed. sessionId={} eventType={} reason={}",
                        sessionId, event.type(), e.getMessage());
                }
            }
        }
    }

    /**
     * Live event stream for one client. The subscription is registered on subscribe and
     * removed when the client cancels or the stream terminates.
     */
    public Flux<PipelineEvent> stream() {
        return Flux.defer(() -> {
            Sinks.Many<PipelineEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
            PipelineEventSubscriber subscriber = event -> {
                Sinks.EmitResult result = sink.tryEmitNext(event);
                if (result.isFailure()) {
                    throw new IllegalStateException("stream closed (" + result + ")");
                }
            };
            subscribe(subscriber);
            return sink.asFlux().doFinally(signal -> unsubscribe(subscriber));
        });
    }
}
