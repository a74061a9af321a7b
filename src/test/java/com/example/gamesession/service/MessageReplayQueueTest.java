package com.example.gamesession.service;

import com.example.gamesession.model.ParticipantKey;
import com.example.gamesession.model.Priority;
import com.example.gamesession.model.QueuedMessage;
import com.example.gamesession.support.MutableClock;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MessageReplayQueueTest {

    private static final ParticipantKey KEY = new ParticipantKey("s1", "a");

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
    }

    private static void push(MessageReplayQueue q, String event, Priority priority) {
        q.enqueue(KEY, event, JsonNodeFactory.instance.objectNode().put("e", event), priority);
    }

    private static List<String> events(List<QueuedMessage> msgs) {
        List<String> out = new ArrayList<>();
        for (QueuedMessage m : msgs) out.add(m.event());
        return out;
    }

    @Test
    void flushReturnsEnqueueOrder_withIncreasingSequenceNumbers_andEmptiesQueue() {
        MessageReplayQueue q = new MessageReplayQueue(10, clock);
        q.open(KEY);
        push(q, "e1", Priority.NORMAL);
        push(q, "e2", Priority.CRITICAL);
        push(q, "e3", Priority.NORMAL);

        List<QueuedMessage> out = q.flush(KEY);

        assertEquals(List.of("e1", "e2", "e3"), events(out));
        assertEquals(1, out.get(0).sequenceNumber());
        assertTrue(out.get(0).sequenceNumber() < out.get(1).sequenceNumber());
        assertTrue(out.get(1).sequenceNumber() < out.get(2).sequenceNumber());
        assertTrue(q.flush(KEY).isEmpty(), "second flush must be empty");
    }

    @Test
    void enqueueWithoutOpenQueue_isSkipped() {
        MessageReplayQueue q = new MessageReplayQueue(10, clock);
        MessageReplayQueue.EnqueueResult r = q.enqueue(KEY, "e1", null, Priority.NORMAL);

        assertFalse(r.queued());
        assertEquals(0, q.size(KEY));
        assertTrue(q.flush(KEY).isEmpty());
    }

    @Test
    void overflowAtCapPlusOne_evictsOldestNormal_andKeepsCritical() {
        int cap = 5;
        MessageReplayQueue q = new MessageReplayQueue(cap, clock);
        q.open(KEY);
        push(q, "crit-1", Priority.CRITICAL);
        push(q, "n-1", Priority.NORMAL);
        push(q, "n-2", Priority.NORMAL);
        push(q, "crit-2", Priority.CRITICAL);
        push(q, "n-3", Priority.NORMAL);
        assertEquals(cap, q.size(KEY));

        MessageReplayQueue.EnqueueResult r = q.enqueue(KEY, "n-4", null, Priority.NORMAL);

        assertTrue(r.queued());
        assertEquals(1, r.evicted(), "overflow is reported, not thrown");
        assertEquals(cap, q.size(KEY));
        assertEquals(List.of("crit-1", "n-2", "crit-2", "n-3", "n-4"), events(q.flush(KEY)));
    }

    @Test
    void onlyCriticalLeft_oldestCriticalIsEvicted() {
        MessageReplayQueue q = new MessageReplayQueue(2, clock);
        q.open(KEY);
        push(q, "c1", Priority.CRITICAL);
        push(q, "c2", Priority.CRITICAL);
        push(q, "c3", Priority.CRITICAL);

        assertEquals(List.of("c2", "c3"), events(q.flush(KEY)));
    }

    @Test
    void restorePutsUndeliveredBackInFront_andSequenceIsNeverReused() {
        MessageReplayQueue q = new MessageReplayQueue(10, clock);
        q.open(KEY);
        push(q, "e1", Priority.NORMAL);
        push(q, "e2", Priority.NORMAL);
        List<QueuedMessage> drained = q.flush(KEY);
        push(q, "e3", Priority.NORMAL);

        q.restore(KEY, drained);
        List<QueuedMessage> out = q.flush(KEY);

        assertEquals(List.of("e1", "e2", "e3"), events(out));
        assertEquals(3, out.get(2).sequenceNumber());
    }

    @Test
    void discardDropsQueueAndLaterEnqueuesAreSkipped() {
        MessageReplayQueue q = new MessageReplayQueue(10, clock);
        q.open(KEY);
        push(q, "e1", Priority.NORMAL);

        q.discard(KEY);

        assertFalse(q.isOpen(KEY));
        assertFalse(q.enqueue(KEY, "e2", null, Priority.NORMAL).queued());
    }

    @Test
    void discardSessionOnlyTouchesThatSession() {
        MessageReplayQueue q = new MessageReplayQueue(10, clock);
        ParticipantKey other = new ParticipantKey("s2", "a");
        q.open(KEY);
        q.open(other);

        q.discardSession("s1");

        assertFalse(q.isOpen(KEY));
        assertTrue(q.isOpen(other));
    }

    @Test
    void statsReportSizeCriticalAndEvictions() {
        MessageReplayQueue q = new MessageReplayQueue(2, clock);
        q.open(KEY);
        push(q, "c1", Priority.CRITICAL);
        push(q, "n1", Priority.NORMAL);
        push(q, "n2", Priority.NORMAL);

        List<MessageReplayQueue.QueueStats> stats = q.stats("s1");

        assertEquals(1, stats.size());
        MessageReplayQueue.QueueStats s = stats.get(0);
        assertEquals("a", s.participantId());
        assertEquals(2, s.size());
        assertEquals(1, s.critical());
        assertEquals(1, s.evictedTotal());
        assertNotNull(s.oldestEnqueuedAt());
    }

    @Test
    void invalidCapIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MessageReplayQueue(0, clock));
    }

    @Test
    void concurrentEnqueueAndFlush_loseNothingAndKeepOrder() throws Exception {
        MessageReplayQueue q = new MessageReplayQueue(100_000, clock);
        q.open(KEY);
        int perWriter = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch start = new CountDownLatch(1);
        List<QueuedMessage> flushed = new ArrayList<>();
        try {
            for (int w = 0; w < 2; w++) {
                final int writer = w;
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) push(q, "w" + writer + "-" + i, Priority.NORMAL);
                    return null;
                });
            }
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    List<QueuedMessage> part = q.flush(KEY);
                    synchronized (flushed) { flushed.addAll(part); }
                }
                return null;
            });
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        flushed.addAll(q.flush(KEY));

        assertEquals(2 * perWriter, flushed.size());
        for (int i = 1; i < flushed.size(); i++) {
            assertTrue(flushed.get(i - 1).sequenceNumber() < flushed.get(i).sequenceNumber(),
                    "sequence must be strictly increasing across flushes");
        }
    }

    @Test
    void pruneOlderThan_dropsOldEntriesOfAnyPriority_keepingOrderAndSequence() {
        MessageReplayQueue q = new MessageReplayQueue(10, clock);
        q.open(KEY);
        push(q, "old-critical", Priority.CRITICAL);
        push(q, "old-normal", Priority.NORMAL);
        clock.advance(Duration.ofMinutes(20));
        push(q, "mid", Priority.NORMAL);
        clock.advance(Duration.ofMinutes(15));
        push(q, "new", Priority.CRITICAL);

        assertEquals(2, q.pruneOlderThan(Duration.ofMinutes(30)));

        List<QueuedMessage> left = q.flush(KEY);
        assertEquals(List.of("mid", "new"), events(left));
        assertEquals(3, left.get(0).sequenceNumber());
        assertEquals(4, left.get(1).sequenceNumber());
        assertEquals(2, q.stats("s1").get(0).expiredTotal());
    }

    @Test
    void pruneExpired_isNoOpWithoutMaxAge() {
        MessageReplayQueue keepAll = new MessageReplayQueue(10, clock);
        keepAll.open(KEY);
        push(keepAll, "e1", Priority.NORMAL);
        clock.advance(Duration.ofDays(1));
        assertEquals(0, keepAll.pruneExpired());
        assertEquals(1, keepAll.size(KEY));

        MessageReplayQueue aged = new MessageReplayQueue(10, Duration.ofMinutes(30), clock);
        aged.open(KEY);
        push(aged, "e1", Priority.NORMAL);
        clock.advance(Duration.ofMinutes(31));
        assertEquals(1, aged.pruneExpired());
        assertEquals(0, aged.size(KEY));
    }
}
