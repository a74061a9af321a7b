package com.example.gamesession.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Read-only snapshot of a session, used for state frames and the REST surface. */
public record SessionView(String sessionId,
                          int slotCount,
                          boolean started,
                          String leaderParticipantId,
                          boolean cleanupScheduled,
                          Instant lastAllHumanAbsentAt,
                          List<ParticipantView> participants) {

    public record ParticipantView(String participantId,
                                  String displayName,
                                  int slot,
                                  ControlStatus controlStatus,
                                  boolean leader,
                                  boolean connected,
                                  Instant disconnectedAt) { }

    /** Caller must hold the session monitor. */
    public static SessionView from(GameSession session, Set<String> connectedParticipantIds) {
        List<ParticipantView> ps = new ArrayList<>();
        for (ParticipantSession p : session.getParticipants()) {
            ps.add(new ParticipantView(
                    p.getParticipantId(),
                    p.getDisplayName(),
                    p.getSlot(),
                    p.getControlStatus(),
                    p.isSessionLeader(),
                    connectedParticipantIds.contains(p.getParticipantId()),
                    p.getDisconnectedAt()));
        }
        return new SessionView(
                session.getSessionId(),
                session.getSlotCount(),
                session.isStarted(),
                session.getLeaderParticipantId(),
                session.isCleanupScheduled(),
                session.getLastAllHumanAbsentAt(),
                List.copyOf(ps));
    }
}
