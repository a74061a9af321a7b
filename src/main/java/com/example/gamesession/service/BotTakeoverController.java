package com.example.gamesession.service;

import com.example.gamesession.agent.AgentHandle;
import com.example.gamesession.agent.AiDecisionAgent;
import com.example.gamesession.agent.DecisionStrategy;
import com.example.gamesession.agent.HumanRelayAgent;
import com.example.gamesession.config.SessionProperties;
import com.example.gamesession.engine.ActionResult;
import com.example.gamesession.engine.GameAction;
import com.example.gamesession.engine.GameEngineDirectory;
import com.example.gamesession.engine.GameRuleEngine;
import com.example.gamesession.engine.PhaseState;
import com.example.gamesession.error.SessionNotFoundException;
import com.example.gamesession.model.GameSession;
import com.example.gamesession.model.ParticipantKey;
import com.example.gamesession.model.ParticipantSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/** Supplies the acting agent for a seat based on its current control status. */
@Service
public class BotTakeoverController {

    private static final Logger log = LoggerFactory.getLogger(BotTakeoverController.class);

    private final SessionRegistry sessions;
    private final SessionBroadcaster broadcaster;
    private final GameEngineDirectory engines;
    private final DecisionStrategy strategy;
    private final Executor agentExecutor;
    private final Duration decisionTimeout;

    @Autowired
    public BotTakeoverController(SessionRegistry sessions,
                                 SessionBroadcaster broadcaster,
                                 GameEngineDirectory engines,
                                 DecisionStrategy strategy,
                                 @Qualifier("agentExecutor") Executor agentExecutor,
                                 SessionProperties props) {
        this(sessions, broadcaster, engines, strategy, agentExecutor, props.getAiDecisionTimeout());
    }

    public BotTakeoverController(SessionRegistry sessions,
                                 SessionBroadcaster broadcaster,
                                 GameEngineDirectory engines,
                                 DecisionStrategy strategy,
                                 Executor agentExecutor,
                                 Duration decisionTimeout) {
        this.sessions = sessions;
        this.broadcaster = broadcaster;
        this.engines = engines;
        this.strategy = strategy;
        this.agentExecutor = agentExecutor;
        this.decisionTimeout = decisionTimeout;
    }

    /** Agent for a seat of a running session; the session must have a rule engine attached. */
    public AgentHandle getActingAgent(String sessionId, ParticipantSession participant) {
        ParticipantKey key = participant.key(sessionId);
        if (participant.isHumanActive()) {
            return new HumanRelayAgent(key, broadcaster);
        }
        GameRuleEngine engine = engines.engineFor(sessionId)
                .orElseThrow(() -> new IllegalStateException("session " + sessionId + " has no rule engine (not started?)"));
        return new AiDecisionAgent(sessionId, participant.getParticipantId(), strategy, engine,
                agentExecutor, decisionTimeout);
    }

    public AgentHandle getActingAgent(String sessionId, String participantId) {
        GameSession session = sessions.require(sessionId);
        synchronized (session) {
            ParticipantSession p = session.getParticipant(participantId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId,
                            participantId + " has no seat in session " + sessionId));
            return getActingAgent(sessionId, p);
        }
    }

    /**
     * Rule-engine entry point: the participant is on turn. Resolves the acting agent against the
     * current control status and the engine's current phase.
     */
    public CompletableFuture<ActionResult> requestTurn(String sessionId, String participantId) {
        AgentHandle agent = getActingAgent(sessionId, participantId);
        GameRuleEngine engine = engines.engineFor(sessionId)
                .orElseThrow(() -> new IllegalStateException("session " + sessionId + " has no rule engine"));
        PhaseState state = engine.currentPhaseState();
        log.debug("TURN session={} participant={} agent={}", sessionId, participantId,
                agent.isAutomated() ? "ai" : "human");
        return agent.takeTurn(state);
    }

    /** Action sent by the human client. Only accepted while the human holds the seat. */
    public ActionResult submitHumanAction(String sessionId, String participantId, GameAction action) {
        GameSession session = sessions.require(sessionId);
        synchronized (session) {
            ParticipantSession p = session.getParticipant(participantId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId,
                            participantId + " has no seat in session " + sessionId));
            if (!p.isHumanActive()) {
                log.warn("ACTION REJECT session={} participant={} status={}", sessionId, participantId, p.getControlStatus());
                return ActionResult.rejected(action, "seat is " + p.getControlStatus());
            }
        }
        GameRuleEngine engine = engines.engineFor(sessionId).orElse(null);
        if (engine == null) {
            return ActionResult.rejected(action, "session not started");
        }
        return engine.applyAction(participantId, action);
    }
}
