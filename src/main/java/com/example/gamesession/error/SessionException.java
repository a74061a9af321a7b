package com.example.gamesession.error;

/** Base of all session continuity failures. Unchecked; callers decide what is fatal. */
public class SessionException extends RuntimeException {

    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
