package com.example.gamesession.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GameSessionTest {

    private static final Instant T0 = Instant.parse("2024-01-01T12:00:00Z");

    @Test
    void firstParticipantBecomesLeader_andSlotsFillInOrder() {
        GameSession s = new GameSession("s1", 3, T0);
        ParticipantSession a = s.addParticipant("a", "Alice", ControlStatus.HUMAN_ACTIVE);
        ParticipantSession b = s.addParticipant("b", "Bob", ControlStatus.HUMAN_ACTIVE);

        assertEquals(0, a.getSlot());
        assertEquals(1, b.getSlot());
        assertEquals("a", s.getLeaderParticipantId());
        assertTrue(a.isSessionLeader());
        assertFalse(b.isSessionLeader());
    }

    @Test
    void freedSlotIsReusedBeforeLaterSlots() {
        GameSession s = new GameSession("s1", 3, T0);
        s.addParticipant("a", "A", ControlStatus.HUMAN_ACTIVE);
        s.addParticipant("b", "B", ControlStatus.HUMAN_ACTIVE);
        s.addParticipant("c", "C", ControlStatus.HUMAN_ACTIVE);
        assertFalse(s.hasFreeSlot());

        s.removeParticipant("b");
        ParticipantSession d = s.addParticipant("d", "D", ControlStatus.HUMAN_ACTIVE);

        assertEquals(1, d.getSlot());
        List<ParticipantSession> order = s.getParticipants();
        assertEquals(List.of("a", "d", "c"), order.stream().map(ParticipantSession::getParticipantId).toList());
    }

    @Test
    void fullSessionAndDuplicateIdAreRejected() {
        GameSession s = new GameSession("s1", 1, T0);
        s.addParticipant("a", "A", ControlStatus.HUMAN_ACTIVE);

        assertThrows(IllegalStateException.class, () -> s.addParticipant("a", "A again", ControlStatus.HUMAN_ACTIVE));
        assertThrows(IllegalStateException.class, () -> s.addParticipant("b", "B", ControlStatus.HUMAN_ACTIVE));
    }

    @Test
    void setLeader_keepsExactlyOneLeaderFlag() {
        GameSession s = new GameSession("s1", 3, T0);
        s.addParticipant("a", "A", ControlStatus.HUMAN_ACTIVE);
        s.addParticipant("b", "B", ControlStatus.HUMAN_ACTIVE);

        s.setLeader("b");

        long leaders = s.getParticipants().stream().filter(ParticipantSession::isSessionLeader).count();
        assertEquals(1, leaders);
        assertTrue(s.isLeader("b"));
        assertEquals("b", s.getLeader().orElseThrow().getParticipantId());
        assertThrows(IllegalArgumentException.class, () -> s.setLeader("ghost"));
    }

    @Test
    void removingTheLeaderClearsLeadership() {
        GameSession s = new GameSession("s1", 2, T0);
        s.addParticipant("a", "A", ControlStatus.HUMAN_ACTIVE);
        s.addParticipant("b", "B", ControlStatus.HUMAN_ACTIVE);

        ParticipantSession removed = s.removeParticipant("a").orElseThrow();

        assertFalse(removed.isSessionLeader());
        assertNull(s.getLeaderParticipantId());
        assertTrue(s.getLeader().isEmpty());
        assertTrue(s.removeParticipant("a").isEmpty());
    }

    @Test
    void hasHumanPresent_ignoresBotsAndTakenOverSeats() {
        GameSession s = new GameSession("s1", 3, T0);
        s.addParticipant("bot", "Bot", ControlStatus.PERMANENT_BOT);
        ParticipantSession a = s.addParticipant("a", "A", ControlStatus.HUMAN_ACTIVE);
        assertTrue(s.hasHumanPresent());

        a.markDisconnected(T0);
        assertFalse(s.hasHumanPresent());
    }

    @Test
    void cleanupMarkerFieldsMoveTogether() {
        GameSession s = new GameSession("s1", 2, T0);
        assertFalse(s.isCleanupScheduled());
        assertNull(s.getLastAllHumanAbsentAt());

        s.scheduleCleanup(T0);
        assertTrue(s.isCleanupScheduled());
        assertEquals(T0, s.getLastAllHumanAbsentAt());

        s.clearCleanup();
        assertFalse(s.isCleanupScheduled());
        assertNull(s.getLastAllHumanAbsentAt());
    }

    @Test
    void invalidConstructionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GameSession(" ", 2, T0));
        assertThrows(IllegalArgumentException.class, () -> new GameSession("s", 0, T0));
    }
}
