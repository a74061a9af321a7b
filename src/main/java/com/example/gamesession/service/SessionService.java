package com.example.gamesession.service;

import com.example.gamesession.engine.GameEngineDirectory;
import com.example.gamesession.engine.GameRuleEngineFactory;
import com.example.gamesession.error.InvalidStateTransitionException;
import com.example.gamesession.error.SessionNotFoundException;
import com.example.gamesession.event.OutboundEvent;
import com.example.gamesession.model.ConnectionHealth;
import com.example.gamesession.model.ControlStatus;
import com.example.gamesession.model.GameSession;
import com.example.gamesession.model.ParticipantSession;
import com.example.gamesession.model.SessionView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Session lifecycle: create, seat participants, start. Presence is PresenceMonitor's job. */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionRegistry sessions;
    private final ConnectionRegistry connections;
    private final MessageReplayQueue replay;
    private final SessionBroadcaster broadcaster;
    private final SessionReaper reaper;
    private final HostMigrationController hostMigration;
    private final GameEngineDirectory engines;
    private final GameRuleEngineFactory engineFactory;
    private final Clock clock;

    public SessionService(SessionRegistry sessions,
                          ConnectionRegistry connections,
                          MessageReplayQueue replay,
                          SessionBroadcaster broadcaster,
                          SessionReaper reaper,
                          HostMigrationController hostMigration,
                          GameEngineDirectory engines,
                          GameRuleEngineFactory engineFactory,
                          Clock clock) {
        this.sessions = sessions;
        this.connections = connections;
        this.replay = replay;
        this.broadcaster = broadcaster;
        this.reaper = reaper;
        this.hostMigration = hostMigration;
        this.engines = engines;
        this.engineFactory = engineFactory;
        this.clock = clock;
    }

    // ========================================================================
    //  CREATE / JOIN
    // ========================================================================

    public GameSession createSession(String sessionId, int slotCount) {
        return sessions.create(sessionId, slotCount);
    }

    /** Seats a human (idempotent for an already seated participant) and broadcasts the new roster. */
    public ParticipantSession join(String sessionId, String participantId, String displayName) {
        GameSession session = sessions.require(sessionId);
        ParticipantSession p;
        synchronized (session) {
            p = seatHuman(session, participantId, displayName);
        }
        broadcaster.broadcastState(session);
        return p;
    }

    /**
     * Seats a human while the caller holds the session monitor; no broadcast.
     * Any pending cleanup is cancelled.
     */
    ParticipantSession seatHuman(GameSession session, String participantId, String displayName) {
        if (session.isClosed()) throw new SessionNotFoundException(session.getSessionId());
        Optional<ParticipantSession> existing = session.getParticipant(participantId);
        if (existing.isPresent()) {
            ParticipantSession p = existing.get();
            if (p.isPermanentBot()) {
                throw new InvalidStateTransitionException(participantId + " is a bot seat", p.getControlStatus());
            }
            p.setDisplayName(displayName);
            return p;
        }

        if (session.isStarted()) {
            throw new IllegalStateException("session " + session.getSessionId() + " already started, seats are fixed");
        }
        ParticipantSession p = session.addParticipant(participantId, displayName, ControlStatus.HUMAN_ACTIVE);
        replay.open(p.key(session.getSessionId()));
        reaper.cancelCleanup(session);
        if (hostMigration.leaderNeedsHuman(session)) hostMigration.migrate(session);
        log.info("JOIN session={} participant={} name={} slot={} leader={}",
                session.getSessionId(), participantId, p.getDisplayName(), p.getSlot(), p.isSessionLeader());
        return p;
    }

    public ParticipantSession addBot(String sessionId, String participantId, String displayName) {
        GameSession session = sessions.require(sessionId);
        ParticipantSession p;
        synchronized (session) {
            if (session.isClosed()) throw new SessionNotFoundException(sessionId);
            if (session.isStarted()) {
                throw new IllegalStateException("session " + sessionId + " already started, seats are fixed");
            }
            p = session.addParticipant(participantId, displayName, ControlStatus.PERMANENT_BOT);
            log.info("BOT ADD session={} participant={} slot={}", sessionId, participantId, p.getSlot());
        }
        broadcaster.broadcastState(session);
        return p;
    }

    // ========================================================================
    //  START
    // ========================================================================

    /**
     * Starts the game. Human seats without a live connection at this point (seated over REST and
     * never connected) are handed to the bot right away, exactly as if they had disconnected.
     */
    public GameSession startSession(String sessionId) {
        GameSession session = sessions.require(sessionId);
        synchronized (session) {
            if (session.isClosed()) throw new SessionNotFoundException(sessionId);
            if (session.isStarted()) {
                throw new IllegalStateException("session " + sessionId + " already started");
            }
            if (session.isEmpty()) {
                throw new IllegalStateException("session " + sessionId + " has no participants");
            }
            session.markStarted();
            engines.attach(sessionId, engineFactory.create(session));

            List<ParticipantSession> absent = handOverAbsentHumans(session);
            boolean leaderAbsent = absent.stream().anyMatch(ParticipantSession::isSessionLeader);
            if (leaderAbsent) hostMigration.migrate(session);
            if (!session.hasHumanPresent()) reaper.scheduleCleanup(session);
            log.info("SESSION START id={} participants={} absentAtStart={}",
                    sessionId, session.getParticipants().size(), absent.size());
        }
        broadcaster.broadcastState(session);
        return session;
    }

    /** Caller holds the session monitor. */
    private List<ParticipantSession> handOverAbsentHumans(GameSession session) {
        String sessionId = session.getSessionId();
        Instant now = clock.instant();
        List<ParticipantSession> absent = new ArrayList<>();
        for (ParticipantSession p : session.getParticipants()) {
            if (!p.isHumanActive() || connections.isConnected(p.key(sessionId))) continue;
            p.markDisconnected(now);
            absent.add(p);
            log.info("BOT TAKEOVER session={} participant={} (not connected at start)", sessionId, p.getParticipantId());
            broadcaster.broadcast(session,
                    new OutboundEvent.ParticipantDisconnected(p.getParticipantId(), p.getDisplayName(), true, true),
                    p.getParticipantId());
        }
        return absent;
    }

    // ========================================================================
    //  READ
    // ========================================================================

    public Optional<SessionView> snapshot(String sessionId) {
        return sessions.find(sessionId).map(broadcaster::viewOf);
    }

    public SessionView requireSnapshot(String sessionId) {
        return broadcaster.viewOf(sessions.require(sessionId));
    }

    public List<MessageReplayQueue.QueueStats> queueStats(String sessionId) {
        sessions.require(sessionId);
        return replay.stats(sessionId);
    }

    public List<ConnectionHealth> connectionHealth(String sessionId) {
        sessions.require(sessionId);
        return connections.health(sessionId);
    }
}
