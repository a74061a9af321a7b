package com.example.gamesession.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/** {@link TransportHandle} over a Spring {@link WebSocketSession}. Sends are serialized per socket. */
public class WebSocketTransportHandle implements TransportHandle {

    private static final Logger log = LoggerFactory.getLogger(WebSocketTransportHandle.class);

    private final WebSocketSession session;

    public WebSocketTransportHandle(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String text) throws IOException {
        // WebSocketSession does not allow concurrent sends
        synchronized (session) {
            if (!session.isOpen()) throw new IOException("socket " + session.getId() + " is closed");
            session.sendMessage(new TextMessage(text));
        }
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) return;
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.debug("WS close failed sid={} code={}: {}", session.getId(), code, e.toString());
        }
    }

    public WebSocketSession getSession() {
        return session;
    }
}
