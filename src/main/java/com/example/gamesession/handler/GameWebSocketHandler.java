package com.example.gamesession.handler;

import com.example.gamesession.error.ConnectionNotFoundException;
import com.example.gamesession.error.InvalidStateTransitionException;
import com.example.gamesession.error.SessionException;
import com.example.gamesession.error.SessionNotFoundException;
import com.example.gamesession.event.EventCodec;
import com.example.gamesession.event.InboundDispatcher;
import com.example.gamesession.event.InboundEvent;
import com.example.gamesession.event.OutboundEvent;
import com.example.gamesession.transport.WebSocketTransportHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket handler for /sessionSocket.
 * - Connects by sessionId + participantId (+ display name) from the query string
 * - Socket close becomes a disconnect; the seat goes to the bot once the session runs
 * - Heartbeat: replies "pong" to client pings; every frame counts as activity
 * - Client frames: clientReady, leaveSession, submitAction (JSON)
 * - Unknown or closed session: sessionNotFound frame, then close 4004
 */
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(GameWebSocketHandler.class);

    public static final int CLOSE_SESSION_NOT_FOUND = 4004;
    public static final int CLOSE_INVALID_STATE = 4009;
    public static final String REDIRECT = "/";

    private final InboundDispatcher dispatcher;
    private final EventCodec codec;

    /** Per WebSocket session -> (sessionId, participantId) */
    private final Map<String, Conn> bySocket = new ConcurrentHashMap<>();

    public GameWebSocketHandler(InboundDispatcher dispatcher, EventCodec codec) {
        this.dispatcher = dispatcher;
        this.codec = codec;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession socket) throws Exception {
        Map<String, String> q = parseQuery(socket.getUri());
        final String sessionId     = q.getOrDefault("sessionId", "").trim();
        final String participantId = q.getOrDefault("participantId", "p-" + socket.getId()).trim();
        final String name          = q.getOrDefault("name", participantId).trim();

        log.info("WS OPEN session={} participant={} name={} sid={}", sessionId, participantId, name, socket.getId());

        WebSocketTransportHandle handle = new WebSocketTransportHandle(socket);
        // index first: frames may arrive while connect is still replaying
        bySocket.put(socket.getId(), new Conn(sessionId, participantId));
        try {
            dispatcher.dispatch(new InboundEvent.Connect(sessionId, participantId, name, handle));
        } catch (SessionNotFoundException e) {
            bySocket.remove(socket.getId());
            log.info("WS REJECT session={} participant={}: {}", sessionId, participantId, e.getMessage());
            sendNotFoundAndClose(handle, sessionId);
        } catch (InvalidStateTransitionException e) {
            bySocket.remove(socket.getId());
            log.warn("WS REJECT session={} participant={}: {} (status={})",
                    sessionId, participantId, e.getMessage(), e.getCurrent());
            handle.close(CLOSE_INVALID_STATE, "Invalid state");
        } catch (RuntimeException t) {
            bySocket.remove(socket.getId());
            log.error("WS afterConnectionEstablished failed (sid={}, uri={})", socket.getId(), safeUri(socket), t);
            handle.close(CloseStatus.SERVER_ERROR.getCode(), "Server error");
            throw t;
        }
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession socket, @NonNull TextMessage message) {
        Conn c = bySocket.get(socket.getId());
        if (c == null) {
            log.warn("WS message from unknown socket sid={} payload={}", socket.getId(), message.getPayload());
            return;
        }
        final String payload = message.getPayload();
        WebSocketTransportHandle handle = new WebSocketTransportHandle(socket);
        dispatcher.activity(socket.getId());

        // Heartbeat
        if ("ping".equals(payload)) {
            try { handle.send("pong"); }
            catch (IOException e) { log.warn("WS pong send failed (session={}, participant={}): {}", c.sessionId, c.participantId, e.toString()); }
            return;
        }

        InboundEvent event;
        try {
            event = codec.decodeClientFrame(payload, c.sessionId, c.participantId);
        } catch (IllegalArgumentException e) {
            log.debug("Ignored message (session={}, participant={}): {}", c.sessionId, c.participantId, e.getMessage());
            return;
        }

        try {
            dispatcher.dispatch(event);
        } catch (SessionNotFoundException e) {
            bySocket.remove(socket.getId());
            sendNotFoundAndClose(handle, c.sessionId);
        } catch (SessionException e) {
            log.warn("WS {} rejected (session={}, participant={}): {}",
                    event.kind().wireName(), c.sessionId, c.participantId, e.getMessage());
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession socket, @NonNull Throwable exception) {
        log.error("WS ERROR sid={} uri={} : transport error", socket.getId(), safeUri(socket), exception);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession socket, @NonNull CloseStatus status) {
        Conn c = bySocket.remove(socket.getId());
        if (c == null) {
            log.info("WS CLOSE sid={} code={} reason={}", socket.getId(), status.getCode(), status.getReason());
            return;
        }
        log.info("WS CLOSE session={} participant={} code={} reason={}",
                c.sessionId, c.participantId, status.getCode(), status.getReason());
        try {
            dispatcher.dispatch(new InboundEvent.Disconnect(socket.getId()));
        } catch (ConnectionNotFoundException e) {
            // replaced, left or torn down already
            log.debug("WS CLOSE sid={} had no registered connection", socket.getId());
        } catch (RuntimeException t) {
            log.error("WS afterConnectionClosed handling failed (session={}, participant={})",
                    c.sessionId, c.participantId, t);
        }
    }

    int trackedSockets() {
        return bySocket.size();
    }

    /* ---------------- helpers ---------------- */

    private void sendNotFoundAndClose(WebSocketTransportHandle handle, String sessionId) {
        try {
            handle.send(codec.encode(new OutboundEvent.SessionNotFound(sessionId, REDIRECT)));
        } catch (IOException e) {
            log.debug("WS sessionNotFound send failed sid={}: {}", handle.id(), e.toString());
        }
        handle.close(CLOSE_SESSION_NOT_FOUND, "Session not found");
    }

    private static Map<String, String> parseQuery(URI uri) {
        Map<String, String> map = new ConcurrentHashMap<>();
        if (uri == null || uri.getRawQuery() == null) return map;
        for (String kv : uri.getRawQuery().split("&")) {
            int i = kv.indexOf('=');
            if (i > 0) {
                String k = URLDecoder.decode(kv.substring(0, i), StandardCharsets.UTF_8);
                String v = URLDecoder.decode(kv.substring(i + 1), StandardCharsets.UTF_8);
                map.put(k, v);
            }
        }
        return map;
    }

    private String safeUri(WebSocketSession socket) {
        try { return String.valueOf(socket.getUri()); } catch (RuntimeException e) { return "n/a"; }
    }

    private record Conn(String sessionId, String participantId) { }
}
