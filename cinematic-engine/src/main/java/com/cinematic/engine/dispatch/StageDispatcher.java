package com.cinematic.engine.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * FIFO dispatch for one resource class.
 *
 * A single dispatcher thread takes READY tickets from all projects in arrival
 * order, waits for the dispatch gate and a free slot, then hands the ticket to
 * a worker thread. The slot is released when the handler returns, so the
 * number of stages running at once never exceeds the pool capacity.
 */
public class StageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StageDispatcher.class);

    /**
     * Executes tickets taken from the queue.
     */
    public interface TicketHandler {

        /**
         * Whether the ticket no longer refers to a READY stage (cancelled, or superseded).
         */
        boolean isStale(StageTicket ticket);

        /**
         * Run the stage. Called on a worker thread while holding a slot, which is
         * released when this returns; a handler whose adapter call outlived its
         * timeout returns only once that call has ended.
         */
        void handle(StageTicket ticket);
    }

    private final ResourcePool pool;
    private final DispatchGate gate;
    private final TicketHandler handler;
    private final LinkedBlockingQueue<StageTicket> queue = new LinkedBlockingQueue<>();
    private final ExecutorService workers;
    private final Thread dispatcherThread;
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean running = false;

    public StageDispatcher(ResourcePool pool, DispatchGate gate, TicketHandler handler) {
        this.pool = pool;
        this.gate = gate;
        this.handler = handler;

        String prefix = pool.resourceClass().name().toLowerCase();
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(pool.capacity(), r -> {
            Thread t = new Thread(r, prefix + "-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.dispatcherThread = new Thread(this::dispatchLoop, prefix + "-dispatcher");
        this.dispatcherThread.setDaemon(true);
    }

    public void start() {
        if (running) {
            log.warn("{} dispatcher already running", pool.resourceClass());
            return;
        }
        running = true;
        dispatcherThread.start();
        log.info("{} dispatcher started with {} slots", pool.resourceClass(), pool.capacity());
    }

    /**
     * Stop taking tickets and wait for in-flight stages.
     *
     * @return true if every in-flight stage finished within the timeout
     */
    public boolean stop(Duration timeout) {
        running = false;
        dispatcherThread.interrupt();
        workers.shutdown();
        try {
            boolean drained = workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!drained) {
                log.warn("{} dispatcher stopped with {} stages still running",
                    pool.resourceClass(), inFlight.get());
                workers.shutdownNow();
            }
            return drained;
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void enqueue(StageTicket ticket) {
        queue.offer(ticket);
        log.debug("Enqueued {} of project {} on {} queue (depth {})",
            ticket.stageId(), ticket.projectId(), pool.resourceClass(), queue.size());
    }

    /**
     * Drop queued tickets of a project.
     *
     * @return number of tickets removed
     */
    public int removeProject(UUID projectId) {
        int before = queue.size();
        queue.removeIf(t -> t.projectId().equals(projectId));
        return before - queue.size();
    }

    public int queueDepth() {
        return queue.size();
    }

    public int inFlight() {
        return inFlight.get();
    }

    public ResourcePool pool() {
        return pool;
    }

    // ========== Internal Methods ==========

    private void dispatchLoop() {
        while (running) {
            try {
                StageTicket ticket = queue.take();
                if (handler.isStale(ticket)) {
                    log.debug("Skipping stale ticket {} of project {}", ticket.stageId(), ticket.projectId());
                    continue;
                }
                gate.awaitOpen();
                pool.acquire();
                if (!running || handler.isStale(ticket)) {
                    pool.release();
                    continue;
                }
                submit(ticket);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("{} dispatcher loop exited", pool.resourceClass());
    }

    private void submit(StageTicket ticket) {
        inFlight.incrementAndGet();
        try {
            workers.execute(() -> {
                try {
                    handler.handle(ticket);
                } catch (Exception e) {
                    log.error("Unhandled error running {} of project {}", ticket.stageId(), ticket.projectId(), e);
                } finally {
                    inFlight.decrementAndGet();
                    pool.release();
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.decrementAndGet();
            pool.release();
            log.warn("Worker pool rejected {} of project {}; dispatcher is stopping",
                ticket.stageId(), ticket.projectId());
        }
    }
}
