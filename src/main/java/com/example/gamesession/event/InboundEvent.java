package com.example.gamesession.event;

import com.example.gamesession.engine.GameAction;
import com.example.gamesession.transport.TransportHandle;

import java.util.Objects;

/** Closed set of events consumed from the transport layer. */
public sealed interface InboundEvent
        permits InboundEvent.Connect,
                InboundEvent.Disconnect,
                InboundEvent.ClientReady,
                InboundEvent.LeaveSession,
                InboundEvent.SubmitAction {

    InboundKind kind();

    record Connect(String sessionId, String participantId, String displayName, TransportHandle handle)
            implements InboundEvent {
        public Connect {
            Objects.requireNonNull(sessionId, "sessionId");
            Objects.requireNonNull(participantId, "participantId");
            Objects.requireNonNull(handle, "handle");
        }
        @Override public InboundKind kind() { return InboundKind.CONNECT; }
    }

    record Disconnect(String connectionId) implements InboundEvent {
        @Override public InboundKind kind() { return InboundKind.DISCONNECT; }
    }

    /** Explicit re-announcement after reconnect. */
    record ClientReady(String sessionId, String participantId) implements InboundEvent {
        @Override public InboundKind kind() { return InboundKind.CLIENT_READY; }
    }

    record LeaveSession(String sessionId, String participantId) implements InboundEvent {
        @Override public InboundKind kind() { return InboundKind.LEAVE_SESSION; }
    }

    record SubmitAction(String sessionId, String participantId, GameAction action) implements InboundEvent {
        @Override public InboundKind kind() { return InboundKind.SUBMIT_ACTION; }
    }
}
