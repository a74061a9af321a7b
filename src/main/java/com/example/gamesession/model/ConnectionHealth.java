package com.example.gamesession.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/** Liveness of one connection: when it last sent a frame and whether that is too long ago. */
public record ConnectionHealth(String connectionId,
                               String participantId,
                               Instant connectedAt,
                               Instant lastActivityAt,
                               long idleSeconds,
                               Status health) {

    public enum Status { HEALTHY, STALE }

    @JsonIgnore
    public boolean isStale() {
        return health == Status.STALE;
    }
}
