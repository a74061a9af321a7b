package com.example.gamesession.error;

public class ConnectionNotFoundException extends SessionException {

    private final String connectionId;

    public ConnectionNotFoundException(String connectionId) {
        super("Connection not found: " + connectionId);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
