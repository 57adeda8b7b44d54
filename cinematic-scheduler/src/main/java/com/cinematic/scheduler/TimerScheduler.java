package com.cinematic.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Time-based scheduler for delayed stage actions.
 *
 * Responsibilities:
 * - Fire backoff retries once their delay elapses
 * - Keep at most one pending timer per stage
 * - Drop every timer of a project when it is cancelled or deleted
 *
 * Timers live in memory only. After a restart, recovery re-derives pending
 * retries from the persisted stage state.
 */
public class TimerScheduler {

    private static final Logger log = LoggerFactory.getLogger(TimerScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final Map<UUID, Map<String, ScheduledFuture<?>>> timers = new ConcurrentHashMap<>();
    private volatile boolean running = false;

    public TimerScheduler() {
        this(1);
    }

    public TimerScheduler(int threads) {
        AtomicInteger counter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(threads, r -> {
            Thread t = new Thread(r, "stage-timer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Timer scheduler already running");
            return;
        }
        running = true;
        log.info("Timer scheduler started");
    }

    /**
     * Stop the scheduler. Pending timers are discarded.
     */
    public void stop() {
        running = false;
        timers.clear();
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Timer threads did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Timer scheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run an action for a stage after a delay. Replaces any timer already pending for that stage.
     *
     * @param projectId The owning project
     * @param stageId The stage waiting for this timer
     * @param delay The delay before firing
     * @param action What to run when the timer fires
     */
    public void scheduleDelay(UUID projectId, String stageId, Duration delay, Runnable action) {
        if (!running) {
            throw new IllegalStateException("Timer scheduler is not running");
        }
        while (true) {
            Map<String, ScheduledFuture<?>> projectTimers = timers.computeIfAbsent(projectId, k -> new ConcurrentHashMap<>());
            synchronized (projectTimers) {
                // Emptied and dropped by a timer that fired meanwhile
                if (timers.get(projectId) != projectTimers) {
                    continue;
                }
                ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
                Runnable fire = () -> {
                    synchronized (projectTimers) {
                        projectTimers.remove(stageId, self[0]);
                        dropIfEmpty(projectId, projectTimers);
                    }
                    try {
                        action.run();
                    } catch (Exception e) {
                        log.error("Timer for stage {} of project {} failed", stageId, projectId, e);
                    }
                };
                self[0] = scheduler.schedule(fire, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
                ScheduledFuture<?> previous = projectTimers.put(stageId, self[0]);
                if (previous != null) {
                    previous.cancel(false);
                }
                break;
            }
        }
        log.debug("Scheduled timer for stage {} of project {} in {}ms", stageId, projectId, delay.toMillis());
    }

    /**
     * Cancel the pending timer of one stage.
     *
     * @return true if a timer was cancelled
     */
    public boolean cancelTimer(UUID projectId, String stageId) {
        Map<String, ScheduledFuture<?>> projectTimers = timers.get(projectId);
        if (projectTimers == null) {
            return false;
        }
        ScheduledFuture<?> future;
        synchronized (projectTimers) {
            future = projectTimers.remove(stageId);
            dropIfEmpty(projectId, projectTimers);
        }
        return future != null && future.cancel(false);
    }

    /**
     * Cancel every pending timer of a project.
     *
     * @return number of timers cancelled
     */
    public int cancelProjectTimers(UUID projectId) {
        Map<String, ScheduledFuture<?>> projectTimers = timers.remove(projectId);
        if (projectTimers == null) {
            return 0;
        }
        int cancelled = 0;
        for (ScheduledFuture<?> future : projectTimers.values()) {
            if (future.cancel(false)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} pending timers for project {}", cancelled, projectId);
        }
        return cancelled;
    }

    /**
     * Number of timers not yet fired.
     */
    public int pendingCount() {
        return timers.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Number of projects with at least one pending timer.
     */
    public int projectCount() {
        return timers.size();
    }

    // Caller holds the lock of projectTimers
    private void dropIfEmpty(UUID projectId, Map<String, ScheduledFuture<?>> projectTimers) {
        if (projectTimers.isEmpty()) {
            timers.remove(projectId, projectTimers);
        }
    }
}
