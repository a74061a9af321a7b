package com.example.gamesession.service;

import com.example.gamesession.event.EventCodec;
import com.example.gamesession.event.OutboundEvent;
import com.example.gamesession.event.SessionBroadcastEvent;
import com.example.gamesession.model.Connection;
import com.example.gamesession.model.GameSession;
import com.example.gamesession.model.ParticipantKey;
import com.example.gamesession.model.ParticipantSession;
import com.example.gamesession.model.Priority;
import com.example.gamesession.model.SessionView;
import com.example.gamesession.transport.TransportHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Outbound side: pushes frames to live connections and parks them in the replay queue for
 * participants who are away. Delivery to one participant always runs under that participant's
 * replay lock so it cannot interleave with a reconnect flush.
 */
@Service
public class SessionBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(SessionBroadcaster.class);

    /** Close code sent with sessionClosed. */
    public static final int CLOSE_SESSION_CLOSED = 4000;

    private final SessionRegistry sessions;
    private final ConnectionRegistry connections;
    private final MessageReplayQueue replay;
    private final EventCodec codec;
    private final ApplicationEventPublisher publisher;

    public SessionBroadcaster(SessionRegistry sessions,
                              ConnectionRegistry connections,
                              MessageReplayQueue replay,
                              EventCodec codec,
                              ApplicationEventPublisher publisher) {
        this.sessions = sessions;
        this.connections = connections;
        this.replay = replay;
        this.codec = codec;
        this.publisher = publisher;
    }

    // ========================================================================
    //  SESSION-WIDE
    // ========================================================================

    public void broadcast(GameSession session, OutboundEvent event) {
        broadcast(session, event, null);
    }

    /** Sends to every human seat of the session except {@code excludeParticipantId}. */
    public void broadcast(GameSession session, OutboundEvent event, String excludeParticipantId) {
        List<ParticipantKey> targets = new ArrayList<>();
        synchronized (session) {
            for (ParticipantSession p : session.getParticipants()) {
                if (p.isPermanentBot()) continue;
                if (Objects.equals(p.getParticipantId(), excludeParticipantId)) continue;
                targets.add(p.key(session.getSessionId()));
            }
        }
        String json = codec.encode(event);
        int live = 0;
        for (ParticipantKey key : targets) {
            if (deliver(key, event, json)) live++;
        }
        log.debug("BROADCAST session={} type={} live={} queued/skipped={}",
                session.getSessionId(), event.kind().wireName(), live, targets.size() - live);
        publisher.publishEvent(new SessionBroadcastEvent(session.getSessionId(), event));
    }

    /** Current snapshot to every human seat. */
    public void broadcastState(GameSession session) {
        broadcast(session, new OutboundEvent.SessionState(viewOf(session)));
    }

    /** Entry point for the rule engine's live events. */
    public void publishGameEvent(String sessionId, String event, Object payload, Priority priority) {
        GameSession session = sessions.require(sessionId);
        broadcast(session, new OutboundEvent.GameEvent(event, codec.toTree(payload), priority));
    }

    // ========================================================================
    //  SINGLE PARTICIPANT
    // ========================================================================

    /** Live if connected, otherwise queued. Returns true if it went out live. */
    public boolean sendTo(ParticipantKey key, OutboundEvent event) {
        return deliver(key, event, codec.encode(event));
    }

    /** Bypasses identity and queueing (used for frames to handles that are about to close). */
    public boolean sendDirect(TransportHandle handle, OutboundEvent event) {
        if (handle == null || !handle.isOpen()) return false;
        try {
            handle.send(codec.encode(event));
            return true;
        } catch (IOException e) {
            log.warn("WS direct send failed (handle={}, type={}): {}", handle.id(), event.kind().wireName(), e.toString());
            return false;
        }
    }

    /**
     * Final frame of a session: sent straight to the given handles (nothing is queued for a
     * session that no longer exists), then each handle is closed.
     */
    public void announceClosed(String sessionId, List<TransportHandle> handles, String reason) {
        OutboundEvent.SessionClosed closed = new OutboundEvent.SessionClosed(sessionId, reason);
        for (TransportHandle h : handles) {
            sendDirect(h, closed);
            try {
                h.close(CLOSE_SESSION_CLOSED, "Session closed");
            } catch (RuntimeException e) {
                log.warn("WS close failed (handle={}): {}", h.id(), e.toString());
            }
        }
        publisher.publishEvent(new SessionBroadcastEvent(sessionId, closed));
    }

    public SessionView viewOf(GameSession session) {
        Set<String> connected = new HashSet<>();
        for (Connection c : connections.listConnections(session.getSessionId())) {
            connected.add(c.participantId());
        }
        synchronized (session) {
            return SessionView.from(session, connected);
        }
    }

    private boolean deliver(ParticipantKey key, OutboundEvent event, String json) {
        return replay.atomically(key, () -> {
            Optional<TransportHandle> handle = connections.handleForParticipant(key);
            if (handle.isPresent() && handle.get().isOpen()) {
                try {
                    handle.get().send(json);
                    return true;
                } catch (IOException e) {
                    log.warn("WS send failed ({} type={}), falling back to replay queue: {}",
                            key, event.kind().wireName(), e.toString());
                }
            }
            if (event.replayable()) {
                replay.enqueue(key, event.kind().wireName(), codec.toTree(event), event.priority());
            }
            return false;
        });
    }
}
