package com.example.gamesession.service;

import com.example.gamesession.config.SessionProperties;
import com.example.gamesession.error.ConnectionNotFoundException;
import com.example.gamesession.model.Connection;
import com.example.gamesession.model.ConnectionHealth;
import com.example.gamesession.model.ParticipantKey;
import com.example.gamesession.transport.TransportHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authoritative transport handle -> (session, participant) mapping.
 * At most one live connection per participant; the connection id is the handle id.
 *
 * <p>Also tracks the last inbound activity per connection. Silent longer than {@code staleAfter}
 * is reported as stale; silent for {@code idleTimeout} makes the connection a candidate for
 * {@link #idleConnections()} (a zero timeout disables that).
 */
@Component
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final SessionRegistry sessions;
    private final Clock clock;
    private final Duration staleAfter;
    private final Duration idleTimeout;

    private final Map<String, Entry> byConnectionId = new ConcurrentHashMap<>();
    private final Map<ParticipantKey, String> byParticipant = new ConcurrentHashMap<>();

    @Autowired
    public ConnectionRegistry(SessionRegistry sessions, Clock clock, SessionProperties props) {
        this(sessions, clock, props.getConnectionStaleAfter(), props.getConnectionIdleTimeout());
    }

    public ConnectionRegistry(SessionRegistry sessions, Clock clock) {
        this(sessions, clock, Duration.ofSeconds(30), Duration.ZERO);
    }

    public ConnectionRegistry(SessionRegistry sessions, Clock clock, Duration staleAfter, Duration idleTimeout) {
        this.sessions = sessions;
        this.clock = clock;
        this.staleAfter = staleAfter;
        this.idleTimeout = idleTimeout;
    }

    /**
     * Binds a handle to a seat. A previous connection of the same participant is dropped from the
     * registry and returned through {@link Registration#replaced()} so the caller can close it.
     *
     * @throws com.example.gamesession.error.SessionNotFoundException if the session is unknown
     */
    public Registration register(String sessionId, String participantId, TransportHandle handle) {
        Objects.requireNonNull(handle, "handle");
        sessions.require(sessionId);

        Connection conn = new Connection(handle.id(), sessionId, participantId, clock.instant());
        ParticipantKey key = conn.key();

        Entry replaced = null;
        synchronized (this) {
            String prevId = byParticipant.put(key, conn.connectionId());
            if (prevId != null && !prevId.equals(conn.connectionId())) {
                replaced = byConnectionId.remove(prevId);
            }
            byConnectionId.put(conn.connectionId(), new Entry(conn, handle, conn.connectedAt()));
        }
        log.debug("CONN REGISTER id={} session={} participant={}", conn.connectionId(), sessionId, participantId);
        return new Registration(conn, replaced == null ? null : replaced.handle());
    }

    public Optional<Connection> unregister(String connectionId) {
        if (connectionId == null) return Optional.empty();
        Entry e;
        synchronized (this) {
            e = byConnectionId.remove(connectionId);
            if (e != null) byParticipant.remove(e.connection().key(), connectionId);
        }
        if (e != null) {
            log.debug("CONN UNREGISTER id={} session={} participant={}",
                    connectionId, e.connection().sessionId(), e.connection().participantId());
        }
        return Optional.ofNullable(e).map(Entry::connection);
    }

    public Connection lookup(String connectionId) {
        Entry e = (connectionId == null) ? null : byConnectionId.get(connectionId);
        if (e == null) throw new ConnectionNotFoundException(connectionId);
        return e.connection();
    }

    public Optional<TransportHandle> handleFor(String connectionId) {
        Entry e = (connectionId == null) ? null : byConnectionId.get(connectionId);
        return Optional.ofNullable(e).map(Entry::handle);
    }

    public Optional<Connection> findByParticipant(ParticipantKey key) {
        String id = byParticipant.get(key);
        if (id == null) return Optional.empty();
        Entry e = byConnectionId.get(id);
        return Optional.ofNullable(e).map(Entry::connection);
    }

    public Optional<TransportHandle> handleForParticipant(ParticipantKey key) {
        return findByParticipant(key).flatMap(c -> handleFor(c.connectionId()));
    }

    public boolean isConnected(ParticipantKey key) {
        return findByParticipant(key).isPresent();
    }

    // ---------------------------------------------------------------------
    // Liveness
    // ---------------------------------------------------------------------

    /** Records inbound activity. Returns false for an unknown connection. */
    public boolean touch(String connectionId) {
        Entry e = (connectionId == null) ? null : byConnectionId.get(connectionId);
        if (e == null) return false;
        e.lastActivity = clock.instant();
        return true;
    }

    public Optional<Instant> lastActivity(String connectionId) {
        Entry e = (connectionId == null) ? null : byConnectionId.get(connectionId);
        return Optional.ofNullable(e).map(x -> x.lastActivity);
    }

    /** Per-connection liveness of one session, oldest connection first. */
    public List<ConnectionHealth> health(String sessionId) {
        Instant now = clock.instant();
        List<ConnectionHealth> out = new ArrayList<>();
        for (Entry e : entriesOf(sessionId)) {
            out.add(healthOf(e, now));
        }
        return out;
    }

    public int staleCount() {
        Instant now = clock.instant();
        int stale = 0;
        for (Entry e : byConnectionId.values()) {
            if (healthOf(e, now).isStale()) stale++;
        }
        return stale;
    }

    /** Connections silent for at least {@code idleTimeout}; always empty when the timeout is zero. */
    public List<Connection> idleConnections() {
        if (idleTimeout.isZero() || idleTimeout.isNegative()) return List.of();
        Instant cutoff = clock.instant().minus(idleTimeout);
        List<Connection> out = new ArrayList<>();
        for (Entry e : byConnectionId.values()) {
            if (!e.lastActivity.isAfter(cutoff)) out.add(e.connection());
        }
        return out;
    }

    private ConnectionHealth healthOf(Entry e, Instant now) {
        Duration idle = Duration.between(e.lastActivity, now);
        ConnectionHealth.Status status = idle.compareTo(staleAfter) > 0
                ? ConnectionHealth.Status.STALE
                : ConnectionHealth.Status.HEALTHY;
        Connection c = e.connection();
        return new ConnectionHealth(c.connectionId(), c.participantId(), c.connectedAt(), e.lastActivity,
                idle.getSeconds(), status);
    }

    // ---------------------------------------------------------------------
    // Per session
    // ---------------------------------------------------------------------

    /** Connections of one session. */
    public List<Connection> listConnections(String sessionId) {
        List<Connection> out = new ArrayList<>();
        for (Entry e : entriesOf(sessionId)) out.add(e.connection());
        return out;
    }

    private List<Entry> entriesOf(String sessionId) {
        List<Entry> out = new ArrayList<>();
        for (Entry e : byConnectionId.values()) {
            if (e.connection().sessionId().equals(sessionId)) out.add(e);
        }
        out.sort((a, b) -> a.connection().connectedAt().compareTo(b.connection().connectedAt()));
        return out;
    }

    /** Drops every connection of a session and returns their handles for closing. */
    public List<TransportHandle> unregisterSession(String sessionId) {
        List<TransportHandle> handles = new ArrayList<>();
        for (Connection c : listConnections(sessionId)) {
            TransportHandle h = handleFor(c.connectionId()).orElse(null);
            if (unregister(c.connectionId()).isPresent() && h != null) handles.add(h);
        }
        return handles;
    }

    public int size() {
        return byConnectionId.size();
    }

    /** Result of {@link #register}: the new connection and the handle it displaced, if any. */
    public record Registration(Connection connection, TransportHandle replaced) {
        public String connectionId() {
            return connection.connectionId();
        }
    }

    private static final class Entry {
        private final Connection connection;
        private final TransportHandle handle;
        private volatile Instant lastActivity;

        private Entry(Connection connection, TransportHandle handle, Instant lastActivity) {
            this.connection = connection;
            this.handle = handle;
            this.lastActivity = lastActivity;
        }

        Connection connection() { return connection; }
        TransportHandle handle() { return handle; }
    }
}
