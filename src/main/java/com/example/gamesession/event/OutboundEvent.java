package com.example.gamesession.event;

import com.example.gamesession.engine.PhaseState;
import com.example.gamesession.model.Priority;
import com.example.gamesession.model.QueuedMessage;
import com.example.gamesession.model.SessionView;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Every frame the server pushes to clients. Serialized with a {@code type} discriminator
 * equal to {@link OutboundKind#wireName()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = OutboundEvent.ParticipantDisconnected.class, name = "participantDisconnected"),
        @JsonSubTypes.Type(value = OutboundEvent.ParticipantReconnected.class, name = "participantReconnected"),
        @JsonSubTypes.Type(value = OutboundEvent.LeaderChanged.class, name = "leaderChanged"),
        @JsonSubTypes.Type(value = OutboundEvent.SessionClosed.class, name = "sessionClosed"),
        @JsonSubTypes.Type(value = OutboundEvent.QueuedMessages.class, name = "queuedMessages"),
        @JsonSubTypes.Type(value = OutboundEvent.SessionState.class, name = "sessionState"),
        @JsonSubTypes.Type(value = OutboundEvent.SessionNotFound.class, name = "sessionNotFound"),
        @JsonSubTypes.Type(value = OutboundEvent.ActionRequested.class, name = "actionRequested"),
        @JsonSubTypes.Type(value = OutboundEvent.GameEvent.class, name = "gameEvent")
})
public sealed interface OutboundEvent
        permits OutboundEvent.ParticipantDisconnected,
                OutboundEvent.ParticipantReconnected,
                OutboundEvent.LeaderChanged,
                OutboundEvent.SessionClosed,
                OutboundEvent.QueuedMessages,
                OutboundEvent.SessionState,
                OutboundEvent.SessionNotFound,
                OutboundEvent.ActionRequested,
                OutboundEvent.GameEvent {

    OutboundKind kind();

    default Priority priority() {
        return Priority.NORMAL;
    }

    /** Whether a participant who misses this frame should get it replayed. */
    default boolean replayable() {
        return true;
    }

    record ParticipantDisconnected(String participantId, String name, boolean aiActivated, boolean canReconnect)
            implements OutboundEvent {
        @Override public OutboundKind kind() { return OutboundKind.PARTICIPANT_DISCONNECTED; }
    }

    record ParticipantReconnected(String participantId, String name, boolean resumedControl)
            implements OutboundEvent {
        @Override public OutboundKind kind() { return OutboundKind.PARTICIPANT_RECONNECTED; }
    }

    record LeaderChanged(String oldLeader, String newLeader) implements OutboundEvent {
        @Override public OutboundKind kind() { return OutboundKind.LEADER_CHANGED; }
        @Override public Priority priority() { return Priority.CRITICAL; }
    }

    record SessionClosed(String sessionId, String reason) implements OutboundEvent {
        @Override public OutboundKind kind() { return OutboundKind.SESSION_CLOSED; }
        @Override public boolean replayable() { return false; }
    }

    record QueuedMessages(List<QueuedMessage> messages) implements OutboundEvent {
        public QueuedMessages {
            messages = List.copyOf(messages);
        }
        @Override public OutboundKind kind() { return OutboundKind.QUEUED_MESSAGES; }
        @Override public boolean replayable() { return false; }
    }

    record SessionState(SessionView session) implements OutboundEvent {
        @Override public OutboundKind kind() { return OutboundKind.SESSION_STATE; }
    }

    record SessionNotFound(String sessionId, String redirect) implements OutboundEvent {
        @Override public OutboundKind kind() { return OutboundKind.SESSION_NOT_FOUND; }
        @Override public boolean replayable() { return false; }
    }

    record ActionRequested(PhaseState state) implements OutboundEvent {
        @Override public OutboundKind kind() { return OutboundKind.ACTION_REQUESTED; }
        @Override public Priority priority() { return Priority.CRITICAL; }
    }

    /** Live event produced by the rule engine. */
    record GameEvent(String event, JsonNode payload, Priority priority) implements OutboundEvent {
        public GameEvent {
            if (priority == null) priority = Priority.NORMAL;
        }
        @Override public OutboundKind kind() { return OutboundKind.GAME_EVENT; }
    }
}
