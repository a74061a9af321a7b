package com.example.gamesession.service;

import com.example.gamesession.error.SessionNotFoundException;
import com.example.gamesession.model.GameSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single source of truth for live sessions, keyed by session id.
 * The GameSession monitor is the per-session lock; callers re-resolve here after every wait.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionRegistry(Clock clock) {
        this.clock = clock;
    }

    public GameSession create(String sessionId, int slotCount) {
        GameSession fresh = new GameSession(sessionId, slotCount, clock.instant());
        GameSession prev = sessions.putIfAbsent(fresh.getSessionId(), fresh);
        if (prev != null) {
            throw new IllegalStateException("session " + fresh.getSessionId() + " already exists");
        }
        log.info("SESSION CREATE id={} slots={}", fresh.getSessionId(), slotCount);
        return fresh;
    }

    public Optional<GameSession> find(String sessionId) {
        if (sessionId == null) return Optional.empty();
        GameSession s = sessions.get(sessionId);
        return (s == null || s.isClosed()) ? Optional.empty() : Optional.of(s);
    }

    public GameSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public boolean contains(String sessionId) {
        return find(sessionId).isPresent();
    }

    /** Removes exactly this instance (a re-created session under the same id is left alone). */
    public boolean remove(GameSession session) {
        return sessions.remove(session.getSessionId(), session);
    }

    /** Snapshot for sweeps. */
    public List<GameSession> all() {
        return new ArrayList<>(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
