package com.example.gamesession.model;

import java.time.Instant;
import java.util.Objects;

/** Live transport binding; owned by ConnectionRegistry. */
public record Connection(String connectionId, String sessionId, String participantId, Instant connectedAt) {

    public Connection {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(participantId, "participantId");
        Objects.requireNonNull(connectedAt, "connectedAt");
    }

    public ParticipantKey key() {
        return new ParticipantKey(sessionId, participantId);
    }
}
