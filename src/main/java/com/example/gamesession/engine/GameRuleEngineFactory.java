package com.example.gamesession.engine;

import com.example.gamesession.model.GameSession;

/** Creates the rule engine for a session when it starts. */
@FunctionalInterface
public interface GameRuleEngineFactory {

    GameRuleEngine create(GameSession session);
}
