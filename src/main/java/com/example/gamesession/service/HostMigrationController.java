package com.example.gamesession.service;

import com.example.gamesession.event.OutboundEvent;
import com.example.gamesession.model.GameSession;
import com.example.gamesession.model.ParticipantSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reassigns session leadership when the leader becomes unreachable.
 * Priority: first HUMAN_ACTIVE participant in slot order, then first participant in slot order.
 * An empty session is torn down on the spot.
 */
@Service
public class HostMigrationController {

    private static final Logger log = LoggerFactory.getLogger(HostMigrationController.class);

    public static final String REASON_EMPTY = "no participants remain";

    private final SessionRegistry sessions;
    private final SessionBroadcaster broadcaster;
    private final SessionReaper reaper;

    public HostMigrationController(SessionRegistry sessions, SessionBroadcaster broadcaster, SessionReaper reaper) {
        this.sessions = sessions;
        this.broadcaster = broadcaster;
        this.reaper = reaper;
    }

    /** Resolves the session and migrates. Returns the new leader id if leadership moved. */
    public Optional<String> triggerMigration(String sessionId) {
        return migrate(sessions.require(sessionId));
    }

    /**
     * Migrates leadership of {@code session}. Safe to call while already holding its monitor.
     * Returns the new leader id if leadership moved.
     */
    public Optional<String> migrate(GameSession session) {
        String oldLeader;
        String newLeader;
        synchronized (session) {
            if (session.isClosed()) return Optional.empty();
            if (session.isEmpty()) {
                log.info("HOST MIGRATION session={}: no participants left, tearing down", session.getSessionId());
                reaper.teardown(session, REASON_EMPTY);
                return Optional.empty();
            }

            oldLeader = session.getLeaderParticipantId();
            ParticipantSession candidate = selectCandidate(session.getParticipants());
            newLeader = candidate.getParticipantId();
            if (Objects.equals(oldLeader, newLeader)) {
                log.debug("HOST MIGRATION session={}: {} stays leader", session.getSessionId(), oldLeader);
                return Optional.empty();
            }
            session.setLeader(newLeader);
        }

        log.info("HOST MIGRATION session={}: {} -> {}", session.getSessionId(), oldLeader, newLeader);
        broadcaster.broadcast(session, new OutboundEvent.LeaderChanged(oldLeader, newLeader));
        return Optional.of(newLeader);
    }

    /** True if the leader seat is missing or not currently human-controlled while a human is present. */
    public boolean leaderNeedsHuman(GameSession session) {
        synchronized (session) {
            if (!session.hasHumanPresent()) return false;
            return session.getLeader().map(p -> !p.isHumanActive()).orElse(true);
        }
    }

    static ParticipantSession selectCandidate(List<ParticipantSession> inSlotOrder) {
        for (ParticipantSession p : inSlotOrder) {
            if (p.isHumanActive()) return p;
        }
        return inSlotOrder.get(0);
    }
}
