package com.example.gamesession.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/** One event missed by a disconnected participant. */
public record QueuedMessage(long sequenceNumber,
                            String event,
                            JsonNode payload,
                            Priority priority,
                            Instant enqueuedAt) {

    @JsonIgnore
    public boolean isCritical() {
        return priority == Priority.CRITICAL;
    }
}
