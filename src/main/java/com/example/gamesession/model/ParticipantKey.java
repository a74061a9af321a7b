package com.example.gamesession.model;

import java.util.Objects;

/** Stable identity of a seat: session id plus participant id. */
public record ParticipantKey(String sessionId, String participantId) {

    public ParticipantKey {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(participantId, "participantId");
    }

    @Override
    public String toString() {
        return sessionId + "|" + participantId;
    }
}
