package com.example.gamesession.event;

import java.util.Optional;

/** Inbound message kinds; CONNECT and DISCONNECT come from the transport, the rest from client frames. */
public enum InboundKind {
    CONNECT("connect", false),
    DISCONNECT("disconnect", false),
    CLIENT_READY("clientReady", true),
    LEAVE_SESSION("leaveSession", true),
    SUBMIT_ACTION("submitAction", true);

    private final String wireName;
    private final boolean clientFrame;

    InboundKind(String wireName, boolean clientFrame) {
        this.wireName = wireName;
        this.clientFrame = clientFrame;
    }

    public String wireName() {
        return wireName;
    }

    /** Resolves a client frame {@code type}; transport-only kinds are never accepted from the wire. */
    public static Optional<InboundKind> fromClientFrame(String type) {
        if (type == null) return Optional.empty();
        for (InboundKind k : values()) {
            if (k.clientFrame && k.wireName.equals(type)) return Optional.of(k);
        }
        return Optional.empty();
    }
}
