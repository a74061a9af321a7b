package com.example.gamesession.event;

/** Spring application event mirroring every session-wide broadcast. */
public record SessionBroadcastEvent(String sessionId, OutboundEvent event) { }
