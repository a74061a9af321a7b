package com.example.gamesession.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Seat-level participant state. Survives reconnects; independent of any Connection.
 * Mutated only while holding the owning GameSession's monitor.
 */
public class ParticipantSession {

    private final String participantId;
    private final int slot;
    private String displayName;
    private ControlStatus controlStatus;
    private Instant disconnectedAt;      // set while BOT_TAKEOVER
    private boolean sessionLeader = false;

    public ParticipantSession(String participantId, String displayName, int slot, ControlStatus initialStatus) {
        this.participantId = Objects.requireNonNull(participantId, "participantId");
        this.displayName = (displayName == null || displayName.isBlank()) ? participantId : displayName.trim();
        this.slot = slot;
        this.controlStatus = Objects.requireNonNull(initialStatus, "initialStatus");
        if (initialStatus == ControlStatus.BOT_TAKEOVER) {
            throw new IllegalArgumentException("a participant starts as HUMAN_ACTIVE or PERMANENT_BOT");
        }
    }

    // identity
    public String getParticipantId() { return participantId; }
    public int getSlot() { return slot; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) {
        if (displayName != null && !displayName.isBlank()) this.displayName = displayName.trim();
    }

    // control
    public ControlStatus getControlStatus() { return controlStatus; }
    public boolean isHumanActive() { return controlStatus == ControlStatus.HUMAN_ACTIVE; }
    public boolean isBotTakeover() { return controlStatus == ControlStatus.BOT_TAKEOVER; }
    public boolean isPermanentBot() { return controlStatus == ControlStatus.PERMANENT_BOT; }

    public Instant getDisconnectedAt() { return disconnectedAt; }

    /** HUMAN_ACTIVE -> BOT_TAKEOVER. */
    public void markDisconnected(Instant at) {
        if (controlStatus != ControlStatus.HUMAN_ACTIVE) {
            throw new IllegalStateException(participantId + " is " + controlStatus + ", cannot hand over to bot");
        }
        controlStatus = ControlStatus.BOT_TAKEOVER;
        disconnectedAt = Objects.requireNonNull(at, "at");
    }

    /** BOT_TAKEOVER -> HUMAN_ACTIVE. */
    public void markReconnected() {
        if (controlStatus != ControlStatus.BOT_TAKEOVER) {
            throw new IllegalStateException(participantId + " is " + controlStatus + ", nothing to resume");
        }
        controlStatus = ControlStatus.HUMAN_ACTIVE;
        disconnectedAt = null;
    }

    // leadership (kept in step by GameSession#setLeader)
    public boolean isSessionLeader() { return sessionLeader; }
    void setSessionLeader(boolean sessionLeader) { this.sessionLeader = sessionLeader; }

    public ParticipantKey key(String sessionId) {
        return new ParticipantKey(sessionId, participantId);
    }

    @Override
    public String toString() {
        return "ParticipantSession{" +
                "participantId='" + participantId + '\'' +
                ", displayName='" + displayName + '\'' +
                ", slot=" + slot +
                ", controlStatus=" + controlStatus +
                ", disconnectedAt=" + disconnectedAt +
                ", sessionLeader=" + sessionLeader +
                '}';
    }
}
