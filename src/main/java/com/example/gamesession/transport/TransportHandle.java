package com.example.gamesession.transport;

import java.io.IOException;

/** Transport-neutral view of one client connection. */
public interface TransportHandle {

    /** Unique id; doubles as the connection id in ConnectionRegistry. */
    String id();

    boolean isOpen();

    /** Blocking send; returns once the transport accepted the frame. */
    void send(String text) throws IOException;

    void close(int code, String reason);
}
