package com.example.gamesession.model;

/**
 * Who currently sources a participant's in-game actions.
 * HUMAN_ACTIVE -> BOT_TAKEOVER on disconnect of a started session, back on reconnect.
 * PERMANENT_BOT never changes.
 */
public enum ControlStatus {
    HUMAN_ACTIVE,
    BOT_TAKEOVER,
    PERMANENT_BOT;

    public boolean isAutomated() {
        return this != HUMAN_ACTIVE;
    }

    /** True for seats that belong to a person, connected or not. */
    public boolean isHumanSeat() {
        return this != PERMANENT_BOT;
    }
}
