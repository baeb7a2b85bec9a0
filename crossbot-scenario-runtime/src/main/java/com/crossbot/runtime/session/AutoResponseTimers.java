package com.crossbot.runtime.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Delayed automatic messages for sessions waiting for a human operator.
 * <p>
 * Timers are accepted only while {@code awaitingHuman} holds for the session. Any user or operator
 * activity, and leaving the awaiting state, cancels every pending timer of the session. A timer that
 * fires checks the state again and does nothing once the session has left it.
 */
public final class AutoResponseTimers implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AutoResponseTimers.class);

    private final ScheduledExecutorService scheduler;
    private final Predicate<String> awaitingHuman;
    private final Map<String, List<PendingTimer>> timers = new ConcurrentHashMap<>();

    public AutoResponseTimers(int threads, Predicate<String> awaitingHuman) {
        this.awaitingHuman = Objects.requireNonNull(awaitingHuman, "awaitingHuman");
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "crossbot-auto-response-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedules {@code task} for the session.
     *
     * @return false when the session is not awaiting a human (nothing is scheduled)
     */
    public boolean schedule(String sessionId, Duration delay, Runnable task) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(task, "task");
        if (!awaitingHuman.test(sessionId)) {
            log.debug("AutoResponseTimers | rejected, session not awaiting human | sessionId={}", sessionId);
            return false;
        }
        PendingTimer timer = new PendingTimer();
        List<PendingTimer> list = timers.compute(sessionId, (k, existing) -> {
            List<PendingTimer> l = existing != null ? existing : new CopyOnWriteArrayList<>();
            l.add(timer);
            return l;
        });
        timer.future = scheduler.schedule(() -> fire(sessionId, task, timer), delay.toMillis(), TimeUnit.MILLISECONDS);
        if (log.isDebugEnabled()) {
            log.debug("AutoResponseTimers | scheduled | sessionId={} | delayMs={} | pending={}",
                    sessionId, delay.toMillis(), list.size());
        }
        return true;
    }

    /** New activity in the session: pending timers are cancelled. */
    public int onActivity(String sessionId) {
        return cancel(sessionId);
    }

    /** The session left the awaiting-human state: pending timers are cancelled. */
    public int onLeftAwaitingHuman(String sessionId) {
        return cancel(sessionId);
    }

    /** Cancels every pending timer of the session and returns how many were cancelled. */
    public int cancel(String sessionId) {
        List<PendingTimer> list = timers.remove(sessionId);
        if (list == null) return 0;
        int cancelled = 0;
        for (PendingTimer t : list) {
            if (t.cancel()) cancelled++;
        }
        if (cancelled > 0 && log.isDebugEnabled()) {
            log.debug("AutoResponseTimers | cancelled | sessionId={} | count={}", sessionId, cancelled);
        }
        return cancelled;
    }

    public int pending(String sessionId) {
        List<PendingTimer> list = timers.get(sessionId);
        if (list == null) return 0;
        return (int) list.stream().filter(PendingTimer::isPending).count();
    }

    /** Sessions that currently hold at least one timer. */
    int trackedSessions() {
        return timers.size();
    }

    private void fire(String sessionId, Runnable task, PendingTimer timer) {
        timers.computeIfPresent(sessionId, (k, list) -> {
            list.remove(timer);
            return list.isEmpty() ? null : list;
        });
        if (timer.cancelled) return;
        if (!awaitingHuman.test(sessionId)) {
            log.debug("AutoResponseTimers | skipped, session left awaiting state | sessionId={}", sessionId);
            return;
        }
        try {
            task.run();
        } catch (RuntimeException e) {
            log.warn("AutoResponseTimers | task failed | sessionId={} | error={}", sessionId, e.toString(), e);
        }
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        timers.clear();
    }

    /** The future is set after scheduling, so a timer may fire or be cancelled before it is known. */
    private static final class PendingTimer {
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        boolean cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            return f == null || f.cancel(false);
        }

        boolean isPending() {
            ScheduledFuture<?> f = future;
            return !cancelled && (f == null || !f.isDone());
        }
    }
}
