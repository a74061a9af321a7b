package com.example.gamesession.error;

/** An automated agent could not produce a usable action. Never leaves BotTakeoverController. */
public class AgentDecisionException extends SessionException {

    public AgentDecisionException(String message) {
        super(message);
    }

    public AgentDecisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
