package com.example.gamesession.service;

import com.example.gamesession.error.ConnectionNotFoundException;
import com.example.gamesession.error.InvalidStateTransitionException;
import com.example.gamesession.error.SessionNotFoundException;
import com.example.gamesession.event.OutboundEvent;
import com.example.gamesession.model.ControlStatus;
import com.example.gamesession.model.GameSession;
import com.example.gamesession.model.ParticipantKey;
import com.example.gamesession.model.ParticipantSession;
import com.example.gamesession.model.Priority;
import com.example.gamesession.support.RecordingHandle;
import com.example.gamesession.support.SessionFixture;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PresenceMonitorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);
    private static final List<String> FOUR = List.of("a", "b", "c", "d");

    private final SessionFixture f = new SessionFixture(100, TIMEOUT);
    private final Map<String, RecordingHandle> handles = new HashMap<>();
    private int handleSeq = 0;

    private RecordingHandle connect(String sessionId, String pid) {
        RecordingHandle h = new RecordingHandle("conn-" + (++handleSeq));
        f.presence.onConnect(sessionId, pid, pid.toUpperCase(), h);
        handles.put(pid, h);
        return h;
    }

    private void disconnect(String pid) {
        RecordingHandle h = handles.get(pid);
        h.drop();
        f.presence.onDisconnect(h.id());
    }

    private GameSession startedSession(List<String> humans) {
        GameSession s = f.sessionService.createSession("s1", 4);
        for (String pid : humans) connect("s1", pid);
        f.sessionService.startSession("s1");
        handles.values().forEach(RecordingHandle::clear);
        return s;
    }

    private static ParticipantSession seat(GameSession s, String pid) {
        return s.getParticipant(pid).orElseThrow();
    }

    // ---------------------------------------------------------------------
    // Scenarios
    // ---------------------------------------------------------------------

    @Test
    @DisplayName("A: non-leader disconnect hands the seat to the bot, no cleanup while humans remain")
    void scenarioA_nonLeaderDisconnect() {
        GameSession s = startedSession(FOUR);

        disconnect("b");

        assertEquals(ControlStatus.BOT_TAKEOVER, seat(s, "b").getControlStatus());
        assertNotNull(seat(s, "b").getDisconnectedAt());
        assertFalse(s.isCleanupScheduled());
        for (String other : List.of("a", "c", "d")) {
            List<JsonNode> frames = handles.get(other).ofType("participantDisconnected");
            assertEquals(1, frames.size(), other + " must be told");
            assertEquals("b", frames.get(0).path("participantId").asText());
            assertTrue(frames.get(0).path("aiActivated").asBoolean());
            assertTrue(frames.get(0).path("canReconnect").asBoolean());
        }
        assertTrue(handles.get("b").frames().isEmpty());
        assertTrue(s.isLeader("a"));
    }

    @Test
    @DisplayName("B: everyone gone, session closes after the cleanup timeout")
    void scenarioB_allDisconnect_sessionReaped() {
        GameSession s = startedSession(FOUR);
        for (String pid : FOUR) disconnect(pid);

        assertTrue(s.isCleanupScheduled());
        assertEquals(f.clock.instant(), s.getLastAllHumanAbsentAt());

        f.clock.advance(TIMEOUT.minusMillis(1));
        assertEquals(0, f.reaper.sweep());
        assertTrue(f.sessions.contains("s1"));

        f.clock.advance(Duration.ofMillis(1));
        assertEquals(1, f.reaper.sweep());

        assertFalse(f.sessions.contains("s1"));
        List<OutboundEvent> closed = f.publishedOf("s1", OutboundEvent.SessionClosed.class);
        assertEquals(List.of(new OutboundEvent.SessionClosed("s1", SessionReaper.REASON_ABANDONED)), closed);
        assertThrows(SessionNotFoundException.class,
                () -> f.presence.onReconnect("s1", "a", new RecordingHandle("late")));
    }

    @Test
    @DisplayName("C: leader leaves, next human in slot order leads")
    void scenarioC_leaderDisconnect_migratesToNextHuman() {
        GameSession s = f.sessionService.createSession("s1", 4);
        connect("s1", "a");
        f.sessionService.addBot("s1", "bot", "Bot");
        connect("s1", "c");
        connect("s1", "d");
        f.sessionService.startSession("s1");
        handles.values().forEach(RecordingHandle::clear);

        disconnect("a");

        assertTrue(s.isLeader("c"));
        JsonNode change = handles.get("d").ofType("leaderChanged").get(0);
        assertEquals("a", change.path("oldLeader").asText());
        assertEquals("c", change.path("newLeader").asText());
        assertEquals(List.of("participantDisconnected", "leaderChanged"), handles.get("c").types());
    }

    @Test
    @DisplayName("D: reconnect within the timeout replays the backlog first, in order")
    void scenarioD_reconnectReplaysQueueAndCancelsCleanup() {
        GameSession s = startedSession(List.of("a", "b"));
        disconnect("b");
        disconnect("a");
        assertTrue(s.isCleanupScheduled());

        f.broadcaster.publishGameEvent("s1", "bid", Map.of("amount", 10), Priority.CRITICAL);
        f.broadcaster.publishGameEvent("s1", "tick", Map.of("n", 1), Priority.NORMAL);
        f.broadcaster.publishGameEvent("s1", "tick", Map.of("n", 2), Priority.NORMAL);

        f.clock.advance(TIMEOUT.minusSeconds(1));
        RecordingHandle back = new RecordingHandle("b-again");
        f.presence.onReconnect("s1", "b", back);

        assertEquals("queuedMessages", back.types().get(0), "backlog arrives before anything live");
        JsonNode messages = back.json().get(0).path("messages");
        assertEquals(4, messages.size(), "a's disconnect notice plus the three game events");
        assertEquals("participantDisconnected", messages.get(0).path("event").asText());
        assertEquals("bid", messages.get(1).path("payload").path("event").asText());
        assertEquals("CRITICAL", messages.get(1).path("priority").asText());
        assertEquals(1, messages.get(2).path("payload").path("payload").path("n").asInt());
        assertEquals(2, messages.get(3).path("payload").path("payload").path("n").asInt());
        for (int i = 1; i < messages.size(); i++) {
            assertTrue(messages.get(i - 1).path("sequenceNumber").asLong() < messages.get(i).path("sequenceNumber").asLong());
        }

        assertFalse(s.isCleanupScheduled());
        assertNull(s.getLastAllHumanAbsentAt());
        assertEquals(ControlStatus.HUMAN_ACTIVE, seat(s, "b").getControlStatus());
        assertTrue(back.types().contains("participantReconnected"));
        assertTrue(s.isLeader("b"), "leadership moves back to a human");
        assertEquals(0, f.replay.size(seat(s, "b").key("s1")));
    }

    @Test
    @DisplayName("E: pre-start non-leader disconnect frees the slot at once")
    void scenarioE_preStartNonLeaderDisconnect() {
        GameSession s = f.sessionService.createSession("s1", 4);
        connect("s1", "a");
        connect("s1", "b");
        connect("s1", "c");
        handles.values().forEach(RecordingHandle::clear);

        disconnect("b");

        assertTrue(s.getParticipant("b").isEmpty());
        assertFalse(s.isCleanupScheduled());
        assertFalse(f.replay.isOpen(new ParticipantKey("s1", "b")));
        JsonNode state = handles.get("a").ofType("sessionState").get(0).path("session");
        assertEquals(2, state.path("participants").size());
        assertEquals(1, handles.get("c").ofType("sessionState").size());
        assertTrue(handles.get("a").ofType("participantDisconnected").isEmpty());
    }

    @Test
    @DisplayName("F: pre-start leader disconnect tears the session down at once")
    void scenarioF_preStartLeaderDisconnect() {
        GameSession s = f.sessionService.createSession("s1", 4);
        connect("s1", "a");
        connect("s1", "b");
        connect("s1", "c");

        disconnect("a");

        assertTrue(s.isClosed());
        assertFalse(f.sessions.contains("s1"));
        for (String pid : List.of("b", "c")) {
            RecordingHandle h = handles.get(pid);
            assertEquals(PresenceMonitor.REASON_LEADER_LEFT, h.ofType("sessionClosed").get(0).path("reason").asText());
            assertEquals(4000, h.closeCode());
        }
        assertEquals(0, f.connections.size());
    }

    // ---------------------------------------------------------------------
    // Edge cases
    // ---------------------------------------------------------------------

    @Test
    void connectToUnknownSession_throwsSessionNotFound() {
        assertThrows(SessionNotFoundException.class,
                () -> f.presence.onConnect("nope", "a", "A", new RecordingHandle("x")));
    }

    @Test
    void strangerCannotJoinAStartedSession() {
        startedSession(List.of("a"));
        assertThrows(SessionNotFoundException.class,
                () -> f.presence.onConnect("s1", "stranger", "S", new RecordingHandle("x")));
    }

    @Test
    void botSeatCannotBeConnected() {
        f.sessionService.createSession("s1", 2);
        f.sessionService.addBot("s1", "bot", "Bot");
        assertThrows(InvalidStateTransitionException.class,
                () -> f.presence.onConnect("s1", "bot", "Bot", new RecordingHandle("x")));
    }

    @Test
    void secondConnectOfActiveHuman_replacesTheOldConnection() {
        GameSession s = startedSession(List.of("a", "b"));
        RecordingHandle old = handles.get("a");
        RecordingHandle fresh = new RecordingHandle("a-2");

        f.presence.onConnect("s1", "a", "A", fresh);

        assertEquals(PresenceMonitor.CLOSE_REPLACED, old.closeCode());
        assertThrows(ConnectionNotFoundException.class, () -> f.presence.onDisconnect(old.id()));
        assertEquals(ControlStatus.HUMAN_ACTIVE, seat(s, "a").getControlStatus(), "late close of the old socket is harmless");
        assertTrue(f.connections.isConnected(new ParticipantKey("s1", "a")));
    }

    @Test
    void reconnectWithoutDisconnect_isTreatedAsFreshAttach() {
        GameSession s = startedSession(List.of("a", "b"));

        String connId = f.presence.onReconnect("s1", "b", new RecordingHandle("b-2"));

        assertEquals("b-2", connId);
        assertEquals(ControlStatus.HUMAN_ACTIVE, seat(s, "b").getControlStatus());
        assertTrue(handles.get("a").ofType("participantReconnected").isEmpty());
    }

    @Test
    void failedReplayDelivery_putsTheBacklogBack() {
        GameSession s = startedSession(List.of("a", "b"));
        disconnect("b");
        f.broadcaster.publishGameEvent("s1", "tick", Map.of(), Priority.NORMAL);
        ParticipantKey key = seat(s, "b").key("s1");
        assertEquals(1, f.replay.size(key));

        RecordingHandle flaky = new RecordingHandle("b-2");
        flaky.failSends(true);
        f.presence.onReconnect("s1", "b", flaky);

        assertTrue(f.replay.size(key) >= 1, "undelivered backlog must not be lost");
        assertEquals("tick", f.replay.flush(key).get(0).payload().path("event").asText());
    }

    @Test
    void leaveAfterStart_behavesLikeDisconnect_andClosesTheSocket() {
        GameSession s = startedSession(List.of("a", "b"));

        f.presence.onLeave("s1", "b");

        assertEquals(ControlStatus.BOT_TAKEOVER, seat(s, "b").getControlStatus());
        assertEquals(PresenceMonitor.CLOSE_LEFT, handles.get("b").closeCode());
        assertEquals(1, handles.get("a").ofType("participantDisconnected").size());
        assertThrows(ConnectionNotFoundException.class, () -> f.presence.onDisconnect(handles.get("b").id()));
    }

    @Test
    void clientReady_resendsSnapshot() {
        startedSession(List.of("a", "b"));

        f.presence.onClientReady("s1", "b");

        List<JsonNode> states = handles.get("b").ofType("sessionState");
        assertEquals(1, states.size());
        assertTrue(states.get(0).path("session").path("started").asBoolean());
    }

    @Test
    void loneLeaderLeavingBeforeStart_closesSessionWithoutTimer() {
        GameSession s = f.sessionService.createSession("s1", 2);
        connect("s1", "a");
        disconnect("a");

        assertTrue(s.isClosed());
        assertFalse(s.isCleanupScheduled());
    }

    @Test
    @DisplayName("Property: a human seat is BOT_TAKEOVER exactly while it has no live connection")
    void botTakeoverIffDisconnected_underRandomPresenceChurn() {
        GameSession s = startedSession(FOUR);
        Random rnd = new Random(42);

        for (int step = 0; step < 500; step++) {
            String pid = FOUR.get(rnd.nextInt(FOUR.size()));
            ParticipantKey key = new ParticipantKey("s1", pid);
            if (f.connections.isConnected(key)) {
                disconnect(pid);
            } else {
                connect("s1", pid);
            }
            f.clock.advance(Duration.ofMillis(100));

            boolean anyHuman = false;
            for (String p : FOUR) {
                boolean connected = f.connections.isConnected(new ParticipantKey("s1", p));
                ControlStatus status = seat(s, p).getControlStatus();
                assertEquals(connected, status == ControlStatus.HUMAN_ACTIVE, "step " + step + " seat " + p);
                anyHuman |= connected;
            }
            assertEquals(!anyHuman, s.isCleanupScheduled(), "cleanup marker at step " + step);
            assertTrue(s.getLeader().isPresent());
            if (anyHuman) assertTrue(s.getLeader().get().isHumanActive(), "a human leads whenever one is present");
        }
    }
}
