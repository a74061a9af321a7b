package com.example.gamesession.agent;

import com.example.gamesession.engine.ActionResult;
import com.example.gamesession.engine.PhaseState;

import java.util.concurrent.CompletableFuture;

/** Whoever currently acts for a participant: a relay to the human, or an AI adapter. */
public interface AgentHandle {

    String participantId();

    boolean isAutomated();

    /**
     * Asks the agent to act in the given phase. Never blocks the caller; the future always
     * completes normally.
     */
    CompletableFuture<ActionResult> takeTurn(PhaseState state);
}
