package com.example.gamesession.event;

public enum OutboundKind {
    PARTICIPANT_DISCONNECTED("participantDisconnected"),
    PARTICIPANT_RECONNECTED("participantReconnected"),
    LEADER_CHANGED("leaderChanged"),
    SESSION_CLOSED("sessionClosed"),
    QUEUED_MESSAGES("queuedMessages"),
    SESSION_STATE("sessionState"),
    SESSION_NOT_FOUND("sessionNotFound"),
    ACTION_REQUESTED("actionRequested"),
    GAME_EVENT("gameEvent");

    private final String wireName;

    OutboundKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
