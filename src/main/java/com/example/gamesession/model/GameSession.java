package com.example.gamesession.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Session model: fixed slots, leader, started flag and the all-humans-absent cleanup marker.
 * Services synchronize on GameSession instances, so this class itself does not add extra locking.
 */
public class GameSession {

    // ---------------------------------------------------------------------
    // Core identity
    // ---------------------------------------------------------------------

    private final String sessionId;

    /** Slot array; index is the seat order used by leader migration. */
    private final ParticipantSession[] slots;

    private final Instant createdAt;

    // ---------------------------------------------------------------------
    // Lifecycle state
    // ---------------------------------------------------------------------

    private String leaderParticipantId;
    private boolean started = false;

    /** Set once the session has been torn down; holders of a stale reference must treat it as gone. */
    private boolean closed = false;

    private Instant lastAllHumanAbsentAt;
    private boolean cleanupScheduled = false;

    public GameSession(String sessionId, int slotCount, Instant createdAt) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (slotCount < 1) {
            throw new IllegalArgumentException("slotCount must be >= 1, was " + slotCount);
        }
        this.sessionId = sessionId.trim();
        this.slots = new ParticipantSession[slotCount];
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    // ---------------------------------------------------------------------
    // Basic accessors
    // ---------------------------------------------------------------------

    public String getSessionId() { return sessionId; }
    public int getSlotCount() { return slots.length; }
    public Instant getCreatedAt() { return createdAt; }

    public boolean isStarted() { return started; }
    public void markStarted() { this.started = true; }

    public boolean isClosed() { return closed; }
    public void markClosed() { this.closed = true; }

    // ---------------------------------------------------------------------
    // Participants
    // ---------------------------------------------------------------------

    /** Participants in slot order (empty slots skipped). */
    public List<ParticipantSession> getParticipants() {
        List<ParticipantSession> out = new ArrayList<>();
        for (ParticipantSession p : slots) {
            if (p != null) out.add(p);
        }
        return out;
    }

    public Optional<ParticipantSession> getParticipant(String participantId) {
        if (participantId == null) return Optional.empty();
        for (ParticipantSession p : slots) {
            if (p != null && p.getParticipantId().equals(participantId)) return Optional.of(p);
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        for (ParticipantSession p : slots) {
            if (p != null) return false;
        }
        return true;
    }

    public boolean hasFreeSlot() {
        for (ParticipantSession p : slots) {
            if (p == null) return true;
        }
        return false;
    }

    /** True if at least one participant is currently human-controlled. */
    public boolean hasHumanPresent() {
        for (ParticipantSession p : slots) {
            if (p != null && p.isHumanActive()) return true;
        }
        return false;
    }

    /**
     * Seat a new participant in the first free slot.
     * The first participant of an empty session becomes leader.
     */
    public ParticipantSession addParticipant(String participantId, String displayName, ControlStatus status) {
        if (getParticipant(participantId).isPresent()) {
            throw new IllegalStateException(participantId + " already seated in " + sessionId);
        }
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] == null) {
                ParticipantSession p = new ParticipantSession(participantId, displayName, i, status);
                slots[i] = p;
                if (leaderParticipantId == null) setLeader(participantId);
                return p;
            }
        }
        throw new IllegalStateException("session " + sessionId + " is full (" + slots.length + " slots)");
    }

    /** Frees the participant's slot. Leadership is not reassigned here. */
    public Optional<ParticipantSession> removeParticipant(String participantId) {
        for (int i = 0; i < slots.length; i++) {
            ParticipantSession p = slots[i];
            if (p != null && p.getParticipantId().equals(participantId)) {
                slots[i] = null;
                if (participantId.equals(leaderParticipantId)) {
                    p.setSessionLeader(false);
                    leaderParticipantId = null;
                }
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------------
    // Leadership
    // ---------------------------------------------------------------------

    public String getLeaderParticipantId() { return leaderParticipantId; }

    public Optional<ParticipantSession> getLeader() {
        return getParticipant(leaderParticipantId);
    }

    public boolean isLeader(String participantId) {
        return participantId != null && participantId.equals(leaderParticipantId);
    }

    /** Moves leadership; the target must occupy a slot. */
    public void setLeader(String participantId) {
        ParticipantSession target = getParticipant(participantId)
                .orElseThrow(() -> new IllegalArgumentException(participantId + " has no slot in " + sessionId));
        for (ParticipantSession p : slots) {
            if (p != null) p.setSessionLeader(false);
        }
        target.setSessionLeader(true);
        leaderParticipantId = participantId;
    }

    // ---------------------------------------------------------------------
    // Cleanup marker (both fields always written together)
    // ---------------------------------------------------------------------

    public boolean isCleanupScheduled() { return cleanupScheduled; }
    public Instant getLastAllHumanAbsentAt() { return lastAllHumanAbsentAt; }

    public void scheduleCleanup(Instant absentSince) {
        this.lastAllHumanAbsentAt = Objects.requireNonNull(absentSince, "absentSince");
        this.cleanupScheduled = true;
    }

    public void clearCleanup() {
        this.lastAllHumanAbsentAt = null;
        this.cleanupScheduled = false;
    }

    @Override
    public String toString() {
        return "GameSession{" +
                "sessionId='" + sessionId + '\'' +
                ", slots=" + slots.length +
                ", leader='" + leaderParticipantId + '\'' +
                ", started=" + started +
                ", closed=" + closed +
                ", cleanupScheduled=" + cleanupScheduled +
                '}';
    }
}
