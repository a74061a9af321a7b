package com.example.gamesession.service;

import com.example.gamesession.error.ConnectionNotFoundException;
import com.example.gamesession.error.InvalidStateTransitionException;
import com.example.gamesession.error.SessionNotFoundException;
import com.example.gamesession.event.OutboundEvent;
import com.example.gamesession.model.Connection;
import com.example.gamesession.model.GameSession;
import com.example.gamesession.model.ParticipantKey;
import com.example.gamesession.model.ParticipantSession;
import com.example.gamesession.model.QueuedMessage;
import com.example.gamesession.transport.TransportHandle;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Classifies connect / disconnect / leave events against session state and drives the
 * control-status machine (HUMAN_ACTIVE <-> BOT_TAKEOVER; PERMANENT_BOT is never touched).
 *
 * <p>Before start a departure is final: the slot is freed, or the whole session is torn down
 * when the leader leaves. After start a departure hands the seat to the bot and the human may
 * come back at any time while the session lives.
 */
@Service
public class PresenceMonitor {

    private static final Logger log = LoggerFactory.getLogger(PresenceMonitor.class);

    public static final String REASON_LEADER_LEFT = "leader left before start";

    /** Close code for a connection displaced by a newer one of the same participant. */
    public static final int CLOSE_REPLACED = 4002;
    /** Close code after an explicit leave. */
    public static final int CLOSE_LEFT = 4003;
    /** Close code for a connection that stayed silent past the idle timeout. */
    public static final int CLOSE_IDLE = 4008;

    private final SessionRegistry sessions;
    private final ConnectionRegistry connections;
    private final MessageReplayQueue replay;
    private final SessionBroadcaster broadcaster;
    private final SessionService sessionService;
    private final HostMigrationController hostMigration;
    private final SessionReaper reaper;
    private final Clock clock;

    public PresenceMonitor(SessionRegistry sessions,
                           ConnectionRegistry connections,
                           MessageReplayQueue replay,
                           SessionBroadcaster broadcaster,
                           SessionService sessionService,
                           HostMigrationController hostMigration,
                           SessionReaper reaper,
                           Clock clock) {
        this.sessions = sessions;
        this.connections = connections;
        this.replay = replay;
        this.broadcaster = broadcaster;
        this.sessionService = sessionService;
        this.hostMigration = hostMigration;
        this.reaper = reaper;
        this.clock = clock;
    }

    /** Hooks idle-connection expiry into every reaper sweep. */
    @PostConstruct
    public void registerIdleSweep() {
        reaper.beforeSweep(this::expireIdleConnections);
    }

    // ========================================================================
    //  CONNECT / RECONNECT
    // ========================================================================

    /**
     * Transport handshake. Joins an open (not started) session if needed, resumes a seat in
     * BOT_TAKEOVER, or re-attaches an already active human.
     *
     * @return the connection id
     * @throws SessionNotFoundException if the session is gone, or it started without this participant
     */
    public String onConnect(String sessionId, String participantId, String displayName, TransportHandle handle) {
        GameSession session = sessions.require(sessionId);
        String connectionId;
        synchronized (session) {
            if (session.isClosed()) throw new SessionNotFoundException(sessionId);
            Optional<ParticipantSession> seat = session.getParticipant(participantId);

            if (seat.isEmpty()) {
                if (session.isStarted()) {
                    throw new SessionNotFoundException(sessionId,
                            participantId + " has no seat in started session " + sessionId);
                }
                ParticipantSession p = sessionService.seatHuman(session, participantId, displayName);
                connectionId = attach(session, p, handle);
                log.info("CONNECT session={} participant={} conn={} (joined)", sessionId, participantId, connectionId);
            } else if (seat.get().isBotTakeover()) {
                return onReconnect(sessionId, participantId, handle);
            } else {
                connectionId = reattach(session, seat.get(), handle);
            }
        }
        broadcaster.broadcastState(session);
        return connectionId;
    }

    /**
     * Resumes a seat held by the bot: restores HUMAN_ACTIVE, cancels pending cleanup and delivers
     * the replay queue before any live frame reaches the new handle.
     *
     * @throws SessionNotFoundException if the session or the seat no longer exists
     */
    public String onReconnect(String sessionId, String participantId, TransportHandle newHandle) {
        GameSession session = sessions.require(sessionId);
        String connectionId;
        ParticipantSession p;
        synchronized (session) {
            if (session.isClosed()) throw new SessionNotFoundException(sessionId);
            p = session.getParticipant(participantId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId,
                            participantId + " is not part of session " + sessionId));

            if (!p.isBotTakeover()) {
                connectionId = reattach(session, p, newHandle);
            } else {
                p.markReconnected();
                reaper.cancelCleanup(session);
                connectionId = attach(session, p, newHandle);
                log.info("RECONNECT session={} participant={} conn={}", sessionId, participantId, connectionId);

                broadcaster.broadcast(session,
                        new OutboundEvent.ParticipantReconnected(participantId, p.getDisplayName(), true));
                if (hostMigration.leaderNeedsHuman(session)) hostMigration.migrate(session);
            }
        }
        return connectionId;
    }

    /** A HUMAN_ACTIVE (or bot) seat connecting again without a disconnect record. */
    private String reattach(GameSession session, ParticipantSession p, TransportHandle handle) {
        if (p.isPermanentBot()) {
            throw new InvalidStateTransitionException(
                    p.getParticipantId() + " is a bot seat and cannot be connected", p.getControlStatus());
        }
        ParticipantKey key = p.key(session.getSessionId());
        if (connections.isConnected(key)) {
            log.warn("InvalidStateTransition session={} participant={}: connect while {} with a live connection; "
                    + "treating as fresh join", session.getSessionId(), p.getParticipantId(), p.getControlStatus());
        }
        String connectionId = attach(session, p, handle);
        log.info("CONNECT session={} participant={} conn={}", session.getSessionId(), p.getParticipantId(), connectionId);
        return connectionId;
    }

    /**
     * Binds the handle to the seat. Flush, delivery of {@code queuedMessages} and registration run
     * under the participant's replay lock, so no live frame can slip in between.
     */
    private String attach(GameSession session, ParticipantSession p, TransportHandle handle) {
        ParticipantKey key = p.key(session.getSessionId());
        replay.open(key);
        ConnectionRegistry.Registration reg = replay.atomically(key, () -> {
            List<QueuedMessage> pending = replay.flush(key);
            if (!pending.isEmpty()
                    && !broadcaster.sendDirect(handle, new OutboundEvent.QueuedMessages(pending))) {
                replay.restore(key, pending);
            }
            return connections.register(session.getSessionId(), p.getParticipantId(), handle);
        });
        if (reg.replaced() != null) {
            log.info("CONN REPLACED session={} participant={} old={} new={}",
                    session.getSessionId(), p.getParticipantId(), reg.replaced().id(), reg.connectionId());
            reg.replaced().close(CLOSE_REPLACED, "Replaced by newer connection");
        }
        return reg.connectionId();
    }

    // ========================================================================
    //  DISCONNECT / LEAVE
    // ========================================================================

    /**
     * Transport closed.
     *
     * @throws ConnectionNotFoundException if the connection is unknown (already replaced or removed)
     */
    public void onDisconnect(String connectionId) {
        Connection conn = connections.lookup(connectionId);
        GameSession session = sessions.find(conn.sessionId()).orElse(null);
        if (session == null) {
            connections.unregister(connectionId);
            log.debug("DISCONNECT conn={} for vanished session={}", connectionId, conn.sessionId());
            return;
        }
        synchronized (session) {
            if (connections.unregister(connectionId).isEmpty()) {
                // replaced by a newer connection while we waited for the lock
                throw new ConnectionNotFoundException(connectionId);
            }
            if (session.isClosed()) return;
            ParticipantSession p = session.getParticipant(conn.participantId()).orElse(null);
            if (p == null) return;
            log.info("DISCONNECT session={} participant={} conn={} started={}",
                    session.getSessionId(), p.getParticipantId(), connectionId, session.isStarted());
            depart(session, p);
        }
    }

    /** Explicit voluntary departure; same outcome as a disconnect of the participant's connection. */
    public void onLeave(String sessionId, String participantId) {
        GameSession session = sessions.require(sessionId);
        TransportHandle toClose = null;
        synchronized (session) {
            if (session.isClosed()) throw new SessionNotFoundException(sessionId);
            ParticipantSession p = session.getParticipant(participantId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId,
                            participantId + " is not part of session " + sessionId));

            Optional<Connection> conn = connections.findByParticipant(p.key(sessionId));
            if (conn.isPresent()) {
                toClose = connections.handleFor(conn.get().connectionId()).orElse(null);
                connections.unregister(conn.get().connectionId());
            }
            log.info("LEAVE session={} participant={} started={}", sessionId, participantId, session.isStarted());
            depart(session, p);
        }
        if (toClose != null) toClose.close(CLOSE_LEFT, "Left session");
    }

    /** Caller holds the session monitor and has already dropped the participant's connection. */
    private void depart(GameSession session, ParticipantSession p) {
        String sessionId = session.getSessionId();
        String participantId = p.getParticipantId();

        if (!session.isStarted()) {
            if (session.isLeader(participantId)) {
                reaper.teardown(session, REASON_LEADER_LEFT);
                return;
            }
            session.removeParticipant(participantId);
            replay.discard(p.key(sessionId));
            log.info("SLOT FREED session={} participant={} slot={}", sessionId, participantId, p.getSlot());
            broadcaster.broadcastState(session);
            return;
        }

        if (!p.isHumanActive()) {
            log.debug("DEPART session={} participant={} already {}", sessionId, participantId, p.getControlStatus());
            return;
        }
        p.markDisconnected(clock.instant());
        log.info("BOT TAKEOVER session={} participant={}", sessionId, participantId);
        broadcaster.broadcast(session,
                new OutboundEvent.ParticipantDisconnected(participantId, p.getDisplayName(), true, true),
                participantId);

        if (session.isLeader(participantId)) hostMigration.migrate(session);
        if (!session.hasHumanPresent()) reaper.scheduleCleanup(session);
    }

    // ========================================================================
    //  LIVENESS
    // ========================================================================

    /** Any inbound frame, heartbeat included. Unknown connections are ignored. */
    public void onActivity(String connectionId) {
        if (!connections.touch(connectionId)) {
            log.debug("ACTIVITY for unknown conn={}", connectionId);
        }
    }

    /**
     * Treats every connection silent past the idle timeout as disconnected (a half-open socket
     * never reports its close), then closes its transport.
     *
     * @return number of connections expired
     */
    public int expireIdleConnections() {
        int expired = 0;
        for (Connection c : connections.idleConnections()) {
            TransportHandle handle = connections.handleFor(c.connectionId()).orElse(null);
            log.warn("IDLE TIMEOUT session={} participant={} conn={} lastActivity={}", c.sessionId(),
                    c.participantId(), c.connectionId(), connections.lastActivity(c.connectionId()).orElse(null));
            try {
                onDisconnect(c.connectionId());
                expired++;
            } catch (ConnectionNotFoundException e) {
                log.debug("IDLE TIMEOUT conn={} already gone", c.connectionId());
                continue;
            }
            if (handle == null) continue;
            try {
                handle.close(CLOSE_IDLE, "Idle timeout");
            } catch (RuntimeException e) {
                log.warn("IDLE TIMEOUT close failed conn={}: {}", c.connectionId(), e.toString());
            }
        }
        return expired;
    }

    // ========================================================================
    //  CLIENT READY
    // ========================================================================

    /** Explicit re-announcement by a client after (re)connect: answer with a fresh snapshot. */
    public void onClientReady(String sessionId, String participantId) {
        GameSession session = sessions.require(sessionId);
        synchronized (session) {
            if (session.isClosed()) throw new SessionNotFoundException(sessionId);
            if (session.getParticipant(participantId).isEmpty()) {
                throw new SessionNotFoundException(sessionId, participantId + " is not part of session " + sessionId);
            }
        }
        broadcaster.sendTo(new ParticipantKey(sessionId, participantId),
                new OutboundEvent.SessionState(broadcaster.viewOf(session)));
    }
}
