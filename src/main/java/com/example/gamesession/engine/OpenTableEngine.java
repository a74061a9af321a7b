package com.example.gamesession.engine;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fallback engine used when no game rules are plugged in: a single open phase
 * in which any action is accepted. Keeps a running action count for diagnostics.
 */
public class OpenTableEngine implements GameRuleEngine {

    private final String sessionId;
    private final AtomicLong applied = new AtomicLong();

    public OpenTableEngine(String sessionId) {
        this.sessionId = sessionId;
    }

    @Override
    public ActionResult applyAction(String participantId, GameAction action) {
        if (action == null) return ActionResult.rejected(null, "no action");
        applied.incrementAndGet();
        return ActionResult.accepted(action);
    }

    @Override
    public PhaseState currentPhaseState() {
        return new PhaseState("open", null, List.of(GameAction.pass()),
                Map.of("sessionId", sessionId, "actionsApplied", applied.get()));
    }

    public long getAppliedCount() {
        return applied.get();
    }
}
