package com.example.gamesession.error;

/** The session (or the participant's seat in it) no longer exists. */
public class SessionNotFoundException extends SessionException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        this(sessionId, "Session not found: " + sessionId);
    }

    public SessionNotFoundException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
