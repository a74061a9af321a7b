package com.example.gamesession.error;

import com.example.gamesession.model.ControlStatus;

/**
 * A presence event that does not match the participant's control status,
 * e.g. a reconnect without a preceding disconnect.
 */
public class InvalidStateTransitionException extends SessionException {

    private final ControlStatus current;

    public InvalidStateTransitionException(String message, ControlStatus current) {
        super(message);
        this.current = current;
    }

    public ControlStatus getCurrent() {
        return current;
    }
}
