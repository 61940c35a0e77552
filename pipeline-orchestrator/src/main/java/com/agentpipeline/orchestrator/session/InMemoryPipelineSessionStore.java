package com.agentpipeline.orchestrator.session;

import com.agentpipeline.common.model.PipelineInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link PipelineSessionStore} with lazy expiry.
 *
 * <p>A completed session lives for {@code completedTtl} after completion; a session that was
 * never completed lives for {@code pendingTtl} after creation. A running session never
 * expires. Expired entries are evicted when looked up and on every {@link #create}.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. No blocking calls.
 */
public class InMemoryPipelineSessionStore implements PipelineSessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPipelineSessionStore.class);

    private final ConcurrentHashMap<String, PipelineSession> store = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration completedTtl;
    private final Duration pendingTtl;

    public InMemoryPipelineSessionStore(Clock clock, Duration completedTtl, Duration pendingTtl) {
        this.clock = clock;
        this.completedTtl = completedTtl;
        this.pendingTtl = pendingTtl;
    }

    @Override
    public PipelineSession create(PipelineInput input) {
        evictExpired();
        String sessionId = UUID.randomUUID().toString();
        PipelineSession session = new PipelineSession(sessionId, input, clock.instant());
        store.put(sessionId, session);
        log.info("SESSION_CREATED sessionId={} images={}", sessionId, input.images().size());
        return session;
    }

    @Override
    public Optional<PipelineSession> find(String sessionId) {
        PipelineSession session = store.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        if (isExpired(session)) {
            store.remove(sessionId, session);
            log.info("SESSION_EVICTED sessionId={}", sessionId);
            return Optional.empty();
        }
        return Optional.of(session);
    }

    @Override
    public boolean remove(String sessionId) {
        return store.remove(sessionId) != null;
    }

    @Override
    public int evictExpired() {
        int before = store.size();
        store.values().removeIf(this::isExpired);
        int evicted = before - store.size();
        if (evicted > 0) {
            log.info("SESSION_EVICTED count={} remaining={}", evicted, store.size());
        }
        return Math.max(evicted, 0);
    }

    @Override
    public int size() {
        return store.size();
    }

    /**
     * Checks whether a session has outlived its TTL.
     */
    public boolean isExpired(PipelineSession session) {
        if (session.isRunning()) {
            return false;
        }
        Instant now = clock.instant();
        return session.completedAt()
            .map(completed -> now.isAfter(completed.plus(completedTtl)))
            .orElseGet(() -> now.isAfter(session.createdAt().plus(pendingTtl)));
    }
}
