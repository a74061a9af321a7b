package com.example.gamesession.agent;

import com.example.gamesession.engine.GameAction;
import com.example.gamesession.engine.PhaseState;

/** Default policy: pass when allowed, otherwise the first legal action the engine offers. */
public class ConservativeDecisionStrategy implements DecisionStrategy {

    @Override
    public GameAction decide(String participantId, PhaseState state) {
        if (state == null || state.legalActions().isEmpty()) return GameAction.pass();
        for (GameAction a : state.legalActions()) {
            if (a.isPass()) return a;
        }
        return state.legalActions().get(0);
    }
}
