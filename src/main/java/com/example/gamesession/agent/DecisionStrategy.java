package com.example.gamesession.agent;

import com.example.gamesession.engine.GameAction;
import com.example.gamesession.engine.PhaseState;

/** AI policy plugged into {@link AiDecisionAgent}. May be slow or throw; the agent guards it. */
@FunctionalInterface
public interface DecisionStrategy {

    GameAction decide(String participantId, PhaseState state);
}
