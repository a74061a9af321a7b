package com.example.gamesession.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Snapshot of the rule engine's current phase, as far as an agent needs it. */
public record PhaseState(String phase, String actingParticipantId, List<GameAction> legalActions,
                         Map<String, Object> attributes) {

    public PhaseState {
        legalActions = (legalActions == null) ? List.of() : List.copyOf(legalActions);
        attributes = (attributes == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
