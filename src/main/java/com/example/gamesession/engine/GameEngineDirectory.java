package com.example.gamesession.engine;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Running rule engines by session id. Attached on start, detached on teardown. */
@Component
public class GameEngineDirectory {

    private final Map<String, GameRuleEngine> engines = new ConcurrentHashMap<>();

    public void attach(String sessionId, GameRuleEngine engine) {
        engines.put(sessionId, engine);
    }

    public Optional<GameRuleEngine> engineFor(String sessionId) {
        if (sessionId == null) return Optional.empty();
        return Optional.ofNullable(engines.get(sessionId));
    }

    public void detach(String sessionId) {
        if (sessionId != null) engines.remove(sessionId);
    }

    public int size() {
        return engines.size();
    }
}
