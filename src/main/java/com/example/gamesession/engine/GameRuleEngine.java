package com.example.gamesession.engine;

/**
 * Per-session rule engine. Owns turn/phase logic; the continuity layer only
 * submits actions on behalf of participants and reads the current phase.
 */
public interface GameRuleEngine {

    ActionResult applyAction(String participantId, GameAction action);

    PhaseState currentPhaseState();
}
