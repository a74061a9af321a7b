package com.example.gamesession.service;

import com.example.gamesession.config.SessionProperties;
import com.example.gamesession.engine.GameEngineDirectory;
import com.example.gamesession.model.GameSession;
import com.example.gamesession.transport.TransportHandle;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Garbage-collects started sessions that have had no human presence for {@code cleanupTimeout}.
 * Owns its timer thread: {@link #start()} on context start, {@link #stop()} on shutdown.
 *
 * <p>Each sweep first runs the registered pre-sweep steps (idle connection expiry), then prunes
 * expired replay entries, then reaps due sessions.
 */
@Component
public class SessionReaper {

    private static final Logger log = LoggerFactory.getLogger(SessionReaper.class);

    public static final String REASON_ABANDONED = "abandoned";

    private final SessionRegistry sessions;
    private final ConnectionRegistry connections;
    private final MessageReplayQueue replay;
    private final SessionBroadcaster broadcaster;
    private final GameEngineDirectory engines;
    private final Clock clock;
    private final Duration cleanupTimeout;
    private final Duration sweepInterval;

    private final List<Runnable> preSweepSteps = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;

    @Autowired
    public SessionReaper(SessionRegistry sessions,
                         ConnectionRegistry connections,
                         MessageReplayQueue replay,
                         SessionBroadcaster broadcaster,
                         GameEngineDirectory engines,
                         Clock clock,
                         SessionProperties props) {
        this(sessions, connections, replay, broadcaster, engines, clock,
                props.getCleanupTimeout(), props.getReaperInterval());
    }

    public SessionReaper(SessionRegistry sessions,
                         ConnectionRegistry connections,
                         MessageReplayQueue replay,
                         SessionBroadcaster broadcaster,
                         GameEngineDirectory engines,
                         Clock clock,
                         Duration cleanupTimeout,
                         Duration sweepInterval) {
        this.sessions = sessions;
        this.connections = connections;
        this.replay = replay;
        this.broadcaster = broadcaster;
        this.engines = engines;
        this.clock = clock;
        this.cleanupTimeout = cleanupTimeout.isNegative() ? Duration.ZERO : cleanupTimeout;
        this.sweepInterval = sweepInterval;
    }

    // ========================================================================
    //  LIFECYCLE
    // ========================================================================

    @PostConstruct
    public synchronized void start() {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-reaper");
            t.setDaemon(true);
            return t;
        });
        long periodMs = Math.max(1L, sweepInterval.toMillis());
        sweepTask = scheduler.scheduleAtFixedRate(this::sweepSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("SessionReaper started (interval={}, cleanupTimeout={})", sweepInterval, cleanupTimeout);
    }

    @PreDestroy
    public synchronized void stop() {
        if (scheduler == null) return;
        if (sweepTask != null) sweepTask.cancel(false);
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("SessionReaper did not terminate within 2s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            scheduler = null;
            sweepTask = null;
        }
        log.info("SessionReaper stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    // ========================================================================
    //  CLEANUP MARKER
    // ========================================================================

    /** Called when the last human of a started session went absent. Keeps an earlier timestamp. */
    public void scheduleCleanup(GameSession session) {
        synchronized (session) {
            if (session.isCleanupScheduled()) return;
            Instant now = clock.instant();
            session.scheduleCleanup(now);
            log.info("CLEANUP SCHEDULED session={} at={} timeout={}", session.getSessionId(), now, cleanupTimeout);
        }
    }

    /** Called on any human reconnect or join. No-op if nothing is scheduled. */
    public void cancelCleanup(GameSession session) {
        synchronized (session) {
            if (!session.isCleanupScheduled()) return;
            session.clearCleanup();
            log.info("CLEANUP CANCELLED session={}", session.getSessionId());
        }
    }

    public boolean shouldCleanup(GameSession session) {
        synchronized (session) {
            if (!session.isCleanupScheduled() || session.getLastAllHumanAbsentAt() == null) return false;
            Duration absent = Duration.between(session.getLastAllHumanAbsentAt(), clock.instant());
            return absent.compareTo(cleanupTimeout) >= 0;
        }
    }

    // ========================================================================
    //  SWEEP / TEARDOWN
    // ========================================================================

    /**
     * One pass over all sessions. The decision is re-validated under the session lock right before
     * deletion; a failure in one session is logged and the pass continues.
     *
     * @return number of sessions reaped
     */
    public int sweep() {
        for (Runnable step : preSweepSteps) {
            try {
                step.run();
            } catch (RuntimeException e) {
                log.error("REAPER pre-sweep step failed, continuing sweep", e);
            }
        }
        try {
            replay.pruneExpired();
        } catch (RuntimeException e) {
            log.error("REAPER replay pruning failed, continuing sweep", e);
        }

        int reaped = 0;
        for (GameSession session : sessions.all()) {
            try {
                if (reapIfDue(session)) reaped++;
            } catch (RuntimeException e) {
                log.error("REAPER failed for session={}, continuing sweep", session.getSessionId(), e);
            }
        }
        if (reaped > 0) log.info("REAPER sweep reaped {} session(s), {} remaining", reaped, sessions.size());
        return reaped;
    }

    /** Registers work that runs at the start of every sweep, before sessions are checked. */
    public void beforeSweep(Runnable step) {
        preSweepSteps.add(step);
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (Throwable t) {
            // keep the fixed-rate task alive
            log.error("REAPER sweep aborted", t);
        }
    }

    private boolean reapIfDue(GameSession session) {
        if (!shouldCleanup(session)) return false;
        synchronized (session) {
            if (session.isClosed() || !shouldCleanup(session)) return false;
            teardown(session, REASON_ABANDONED);
            return true;
        }
    }

    /**
     * Destroys the session: sends {@code sessionClosed} to whoever is still connected, closes those
     * connections, drops queues and the rule engine, and removes it from the registry. Every step
     * runs even if an earlier one failed; the first failure is rethrown at the end.
     */
    public void teardown(GameSession session, String reason) {
        synchronized (session) {
            if (session.isClosed()) return;
            session.markClosed();

            String id = session.getSessionId();
            List<TransportHandle> handles = new ArrayList<>();
            RuntimeException failure = release(null, () -> {
                handles.addAll(connections.unregisterSession(id));
                broadcaster.announceClosed(id, handles, reason);
            });
            failure = release(failure, () -> replay.discardSession(id));
            failure = release(failure, () -> engines.detach(id));
            failure = release(failure, () -> sessions.remove(session));
            if (failure != null) {
                log.warn("SESSION CLOSED id={} reason={} with errors: {}", id, reason, failure.toString());
                throw failure;
            }
            log.info("SESSION CLOSED id={} reason={} connectionsClosed={}", id, reason, handles.size());
        }
    }

    private static RuntimeException release(RuntimeException failure, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            if (failure == null) return e;
            failure.addSuppressed(e);
        }
        return failure;
    }

    public Duration getCleanupTimeout() {
        return cleanupTimeout;
    }
}
