package com.correlationsentinel.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of lanes, each a single-threaded {@link ThreadPoolExecutor} over
 * a bounded FIFO queue.
 *
 * <p>
 * Work routed to the same lane runs sequentially in submission order. A full
 * lane blocks the submitter; nothing is ever dropped.
 * </p>
 *
 * @since 1.0.0
 */
final class WorkerPool {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerPool.class);

    private final Lane[] lanes;
    private final AtomicInteger inFlight = new AtomicInteger();

    WorkerPool(int laneCount, int laneCapacity, String threadPrefix) {
        if (laneCount < 1) {
            throw new IllegalArgumentException("laneCount must be >= 1, got: " + laneCount);
        }
        if (laneCapacity < 1) {
            throw new IllegalArgumentException("laneCapacity must be >= 1, got: " + laneCapacity);
        }
        this.lanes = new Lane[laneCount];
        for (int i = 0; i < laneCount; i++) {
            lanes[i] = new Lane(threadPrefix + "-" + i, laneCapacity);
        }
    }

    void start() {
        for (Lane lane : lanes) {
            lane.executor.prestartAllCoreThreads();
        }
        LOG.info("Started {} worker lane(s)", lanes.length);
    }

    /**
     * Enqueue a task on a lane, waiting while the lane is full.
     *
     * @param laneIndex target lane, see {@link #laneFor(int)}
     * @param task      the work item
     * @throws InterruptedException if interrupted while waiting for space
     */
    void submit(int laneIndex, Runnable task) throws InterruptedException {
        Lane lane = lanes[laneIndex];
        lane.permits.acquire();
        inFlight.incrementAndGet();
        try {
            lane.executor.execute(() -> lane.run(task));
        } catch (RuntimeException e) {
            inFlight.decrementAndGet();
            lane.permits.release();
            throw e;
        }
    }

    /**
     * @param hash routing hash
     * @return the lane owning that hash
     */
    int laneFor(int hash) {
        return Math.floorMod(hash, lanes.length);
    }

    int size() {
        return lanes.length;
    }

    /**
     * @return tasks submitted and not yet finished
     */
    int pending() {
        return inFlight.get();
    }

    /**
     * Let every lane finish its queued work, then stop the threads. Lanes
     * still busy at the deadline are interrupted.
     *
     * @param timeout overall wait
     * @return {@code true} if all lanes stopped in time
     */
    boolean shutdown(Duration timeout) {
        for (Lane lane : lanes) {
            lane.executor.shutdown();
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean drained = true;
        for (Lane lane : lanes) {
            try {
                long remaining = Math.max(deadline - System.nanoTime(), 1);
                if (!lane.executor.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    LOG.warn("Worker lane {} did not drain within {}, {} task(s) abandoned",
                            lane.name, timeout, lane.executor.shutdownNow().size());
                    drained = false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while draining worker lane {}", lane.name);
                lane.executor.shutdownNow();
                drained = false;
            }
        }
        return drained;
    }

    private final class Lane {
        private final String name;
        private final Semaphore permits;
        private final ThreadPoolExecutor executor;

        Lane(String name, int capacity) {
            this.name = name;
            // queued plus running never exceeds the permits, so the queue never rejects
            this.permits = new Semaphore(capacity);
            this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                    new ArrayBlockingQueue<>(capacity),
                    r -> {
                        Thread t = new Thread(r, name);
                        t.setDaemon(true);
                        return t;
                    });
        }

        void run(Runnable task) {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Unhandled failure in worker lane {}", name, e);
            } finally {
                inFlight.decrementAndGet();
                permits.release();
            }
        }
    }
}
