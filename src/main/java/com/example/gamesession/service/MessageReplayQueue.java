package com.example.gamesession.service;

import com.example.gamesession.config.SessionProperties;
import com.example.gamesession.model.ParticipantKey;
import com.example.gamesession.model.Priority;
import com.example.gamesession.model.QueuedMessage;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-participant bounded replay queues for events missed while disconnected.
 *
 * <p>Each queue has its own monitor. {@link #enqueue} and {@link #flush} for the same participant
 * are mutually exclusive, and {@link #atomically} lets a caller extend that critical section
 * (e.g. "flush, send, then register the new connection") so a concurrent event lands entirely
 * before or entirely after the flush boundary.
 *
 * <p>Eviction when the cap is exceeded: oldest NORMAL entry first; if only CRITICAL entries remain,
 * the oldest CRITICAL entry. Independently, {@link #pruneExpired()} drops entries older than
 * {@code maxAge} regardless of priority.
 */
@Component
public class MessageReplayQueue {

    private static final Logger log = LoggerFactory.getLogger(MessageReplayQueue.class);

    private final Map<ParticipantKey, ParticipantQueue> queues = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxQueueSize;
    private final Duration maxAge;

    @Autowired
    public MessageReplayQueue(SessionProperties props, Clock clock) {
        this(props.getMaxQueueSize(), props.getReplayMaxAge(), clock);
    }

    public MessageReplayQueue(int maxQueueSize, Clock clock) {
        this(maxQueueSize, Duration.ZERO, clock);
    }

    public MessageReplayQueue(int maxQueueSize, Duration maxAge, Clock clock) {
        if (maxQueueSize < 1) throw new IllegalArgumentException("maxQueueSize must be >= 1");
        this.maxQueueSize = maxQueueSize;
        this.maxAge = maxAge == null || maxAge.isNegative() ? Duration.ZERO : maxAge;
        this.clock = clock;
    }

    // ---------------------------------------------------------------------
    // Queue lifecycle (bound to the participant's seat)
    // ---------------------------------------------------------------------

    public void open(ParticipantKey key) {
        queues.computeIfAbsent(key, k -> new ParticipantQueue());
    }

    public boolean isOpen(ParticipantKey key) {
        return queues.containsKey(key);
    }

    public void discard(ParticipantKey key) {
        ParticipantQueue q = queues.remove(key);
        if (q != null) {
            synchronized (q) {
                if (!q.entries.isEmpty()) {
                    log.debug("REPLAY DISCARD {} ({} undelivered)", key, q.entries.size());
                }
                q.entries.clear();
            }
        }
    }

    public void discardSession(String sessionId) {
        for (ParticipantKey key : new ArrayList<>(queues.keySet())) {
            if (key.sessionId().equals(sessionId)) discard(key);
        }
    }

    // ---------------------------------------------------------------------
    // Enqueue / flush
    // ---------------------------------------------------------------------

    /**
     * Appends with a fresh sequence number and applies the eviction policy.
     * A participant without an open queue (seat gone) is skipped.
     */
    public EnqueueResult enqueue(ParticipantKey key, String event, JsonNode payload, Priority priority) {
        ParticipantQueue q = queues.get(key);
        if (q == null) {
            log.debug("REPLAY SKIP {} event={} (no queue)", key, event);
            return EnqueueResult.skipped();
        }
        synchronized (q) {
            QueuedMessage msg = new QueuedMessage(q.nextSequence++, event, payload,
                    priority == null ? Priority.NORMAL : priority, clock.instant());
            q.entries.addLast(msg);

            List<QueuedMessage> evicted = new ArrayList<>();
            while (q.entries.size() > maxQueueSize) {
                evicted.add(evictOne(q.entries));
            }
            if (!evicted.isEmpty()) {
                q.evictedTotal += evicted.size();
                log.warn("QueueOverflow {}: evicted {} message(s) (seq {}), cap={}, total evicted={}",
                        key, evicted.size(), sequenceNumbers(evicted), maxQueueSize, q.evictedTotal);
            }
            return new EnqueueResult(true, msg.sequenceNumber(), evicted.size());
        }
    }

    /** Drains the queue in sequence order. */
    public List<QueuedMessage> flush(ParticipantKey key) {
        ParticipantQueue q = queues.get(key);
        if (q == null) return List.of();
        synchronized (q) {
            List<QueuedMessage> out = new ArrayList<>(q.entries);
            q.entries.clear();
            if (!out.isEmpty()) {
                log.info("REPLAY FLUSH {}: {} message(s), seq {}..{}", key, out.size(),
                        out.get(0).sequenceNumber(), out.get(out.size() - 1).sequenceNumber());
            }
            return out;
        }
    }

    /**
     * Puts back messages from a flush that could not be delivered, ahead of anything queued since.
     * Cap and eviction still apply.
     */
    public void restore(ParticipantKey key, List<QueuedMessage> undelivered) {
        if (undelivered == null || undelivered.isEmpty()) return;
        ParticipantQueue q = queues.get(key);
        if (q == null) return;
        synchronized (q) {
            Deque<QueuedMessage> merged = new ArrayDeque<>(undelivered.size() + q.entries.size());
            merged.addAll(undelivered);
            merged.addAll(q.entries);
            q.entries.clear();
            q.entries.addAll(merged);
            int evicted = 0;
            while (q.entries.size() > maxQueueSize) {
                evictOne(q.entries);
                evicted++;
            }
            q.evictedTotal += evicted;
            log.warn("REPLAY RESTORE {}: {} undelivered message(s) put back, {} evicted", key, undelivered.size(), evicted);
        }
    }

    /**
     * Runs {@code action} while holding the participant's queue monitor.
     * Nesting is allowed (the monitor is reentrant); the action must not take a session lock.
     */
    public <T> T atomically(ParticipantKey key, Supplier<T> action) {
        ParticipantQueue q = queues.get(key);
        if (q == null) return action.get();
        synchronized (q) {
            return action.get();
        }
    }

    // ---------------------------------------------------------------------
    // Age pruning
    // ---------------------------------------------------------------------

    /** Applies the configured {@code maxAge}; a zero age keeps everything. */
    public int pruneExpired() {
        if (maxAge.isZero()) return 0;
        return pruneOlderThan(maxAge);
    }

    /**
     * Drops every entry enqueued more than {@code age} ago, CRITICAL ones included.
     * Remaining entries keep their order and sequence numbers.
     *
     * @return number of entries removed across all queues
     */
    public int pruneOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        int total = 0;
        for (Map.Entry<ParticipantKey, ParticipantQueue> e : queues.entrySet()) {
            ParticipantQueue q = e.getValue();
            int removed = 0;
            synchronized (q) {
                Iterator<QueuedMessage> it = q.entries.iterator();
                while (it.hasNext()) {
                    if (it.next().enqueuedAt().isBefore(cutoff)) {
                        it.remove();
                        removed++;
                    }
                }
                q.expiredTotal += removed;
            }
            if (removed > 0) {
                log.info("REPLAY PRUNE {}: {} message(s) older than {}", e.getKey(), removed, age);
                total += removed;
            }
        }
        return total;
    }

    // ---------------------------------------------------------------------
    // Inspection
    // ---------------------------------------------------------------------

    public int size(ParticipantKey key) {
        ParticipantQueue q = queues.get(key);
        if (q == null) return 0;
        synchronized (q) {
            return q.entries.size();
        }
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    /** Per-participant stats for one session. */
    public List<QueueStats> stats(String sessionId) {
        List<QueueStats> out = new ArrayList<>();
        for (Map.Entry<ParticipantKey, ParticipantQueue> e : queues.entrySet()) {
            if (!e.getKey().sessionId().equals(sessionId)) continue;
            ParticipantQueue q = e.getValue();
            synchronized (q) {
                int critical = 0;
                for (QueuedMessage m : q.entries) if (m.isCritical()) critical++;
                QueuedMessage oldest = q.entries.peekFirst();
                out.add(new QueueStats(e.getKey().participantId(), q.entries.size(), critical, q.evictedTotal,
                        q.expiredTotal, oldest == null ? null : oldest.enqueuedAt().toString()));
            }
        }
        out.sort((a, b) -> a.participantId().compareTo(b.participantId()));
        return out;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static QueuedMessage evictOne(Deque<QueuedMessage> entries) {
        Iterator<QueuedMessage> it = entries.iterator();
        while (it.hasNext()) {
            QueuedMessage m = it.next();
            if (m.priority() == Priority.NORMAL) {
                it.remove();
                return m;
            }
        }
        return entries.removeFirst();
    }

    private static List<Long> sequenceNumbers(List<QueuedMessage> msgs) {
        List<Long> out = new ArrayList<>(msgs.size());
        for (QueuedMessage m : msgs) out.add(m.sequenceNumber());
        return out;
    }

    /** Mutable per-participant state; guarded by its own monitor. */
    private static final class ParticipantQueue {
        private final Deque<QueuedMessage> entries = new ArrayDeque<>();
        private long nextSequence = 1;
        private long evictedTotal = 0;
        private long expiredTotal = 0;
    }

    /** Outcome of one enqueue; {@code evicted > 0} is the non-fatal QueueOverflow report. */
    public record EnqueueResult(boolean queued, long sequenceNumber, int evicted) {
        static EnqueueResult skipped() {
            return new EnqueueResult(false, -1, 0);
        }
    }

    public record QueueStats(String participantId, int size, int critical, long evictedTotal, long expiredTotal,
                             String oldestEnqueuedAt) { }
}
