package com.example.gamesession.agent;

import com.example.gamesession.engine.ActionResult;
import com.example.gamesession.engine.GameAction;
import com.example.gamesession.engine.GameRuleEngine;
import com.example.gamesession.engine.PhaseState;
import com.example.gamesession.error.AgentDecisionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Acts for a bot-controlled seat. The strategy runs on the agent pool under a deadline; a failure,
 * timeout, null decision or engine rejection falls back to {@link GameAction#pass()}.
 */
public class AiDecisionAgent implements AgentHandle {

    private static final Logger log = LoggerFactory.getLogger(AiDecisionAgent.class);

    private final String sessionId;
    private final String participantId;
    private final DecisionStrategy strategy;
    private final GameRuleEngine engine;
    private final Executor executor;
    private final Duration timeout;

    public AiDecisionAgent(String sessionId, String participantId, DecisionStrategy strategy,
                           GameRuleEngine engine, Executor executor, Duration timeout) {
        this.sessionId = sessionId;
        this.participantId = participantId;
        this.strategy = strategy;
        this.engine = engine;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public String participantId() {
        return participantId;
    }

    @Override
    public boolean isAutomated() {
        return true;
    }

    @Override
    public CompletableFuture<ActionResult> takeTurn(PhaseState state) {
        CompletableFuture<GameAction> decision;
        try {
            decision = CompletableFuture.supplyAsync(() -> decideOrThrow(state), executor);
        } catch (RuntimeException rejected) {
            // pool saturated or shut down
            decision = CompletableFuture.failedFuture(rejected);
        }
        return decision
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(this::substitute)
                .thenApply(this::submit);
    }

    private GameAction decideOrThrow(PhaseState state) {
        GameAction a = strategy.decide(participantId, state);
        if (a == null) throw new AgentDecisionException("strategy returned no action");
        return a;
    }

    private GameAction substitute(Throwable failure) {
        Throwable cause = (failure instanceof CompletionException && failure.getCause() != null)
                ? failure.getCause() : failure;
        String what = (cause instanceof TimeoutException) ? "timed out after " + timeout : cause.toString();
        log.warn("AgentDecisionFailure session={} participant={}: {}; substituting pass",
                sessionId, participantId, what);
        return GameAction.pass();
    }

    private ActionResult submit(GameAction action) {
        ActionResult result = applySafely(action);
        if (!result.isAccepted() && !action.isPass()) {
            log.warn("AgentDecisionFailure session={} participant={}: engine rejected {} ({}); substituting pass",
                    sessionId, participantId, action.type(), result.detail());
            result = applySafely(GameAction.pass());
        }
        return result;
    }

    private ActionResult applySafely(GameAction action) {
        try {
            ActionResult r = engine.applyAction(participantId, action);
            return (r == null) ? ActionResult.rejected(action, "engine returned no result") : r;
        } catch (RuntimeException e) {
            log.warn("AgentDecisionFailure session={} participant={}: engine threw on {}",
                    sessionId, participantId, action.type(), e);
            return ActionResult.rejected(action, e.toString());
        }
    }
}
