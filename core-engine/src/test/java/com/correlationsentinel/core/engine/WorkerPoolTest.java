package com.correlationsentinel.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WorkerPool}.
 */
class WorkerPoolTest {

    @Test
    @DisplayName("Tasks on one lane should run in submission order and drain on shutdown")
    void shouldKeepLaneOrder() throws InterruptedException {
        WorkerPool pool = new WorkerPool(3, 4, "test-worker");
        List<Integer> seen = new CopyOnWriteArrayList<>();
        pool.start();

        int lane = pool.laneFor(42);
        for (int i = 0; i < 100; i++) {
            int n = i;
            pool.submit(lane, () -> seen.add(n));
        }

        assertThat(pool.shutdown(Duration.ofSeconds(5))).isTrue();
        assertThat(seen).hasSize(100).isSorted();
        assertThat(pool.pending()).isZero();
    }

    @Test
    @DisplayName("A failing task should not stop its lane")
    void shouldSurviveFailingTask() throws InterruptedException {
        WorkerPool pool = new WorkerPool(1, 4, "test-worker");
        List<String> seen = new CopyOnWriteArrayList<>();
        pool.start();

        pool.submit(0, () -> {
            throw new IllegalStateException("boom");
        });
        pool.submit(0, () -> seen.add("after"));

        assertThat(pool.shutdown(Duration.ofSeconds(5))).isTrue();
        assertThat(seen).containsExactly("after");
    }

    @Test
    @DisplayName("Lane selection should be stable and within range, also for negative hashes")
    void shouldMapHashesToLanes() {
        WorkerPool pool = new WorkerPool(4, 1, "test-worker");

        assertThat(pool.laneFor(-7)).isBetween(0, 3);
        assertThat(pool.laneFor(13)).isEqualTo(pool.laneFor(13));
        assertThat(pool.size()).isEqualTo(4);
        assertThatThrownBy(() -> new WorkerPool(0, 1, "x")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A full lane should block the submitter until a slot frees up")
    void shouldBlockWhenLaneIsFull() throws Exception {
        WorkerPool pool = new WorkerPool(1, 1, "test-worker");
        CountDownLatch release = new CountDownLatch(1);
        List<String> seen = new CopyOnWriteArrayList<>();
        pool.start();

        pool.submit(0, () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            seen.add("first");
        });
        CompletableFuture<Void> second = CompletableFuture.runAsync(() -> {
            try {
                pool.submit(0, () -> seen.add("second"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        Thread.sleep(200);
        assertThat(second).isNotDone();
        assertThat(pool.pending()).isEqualTo(1);

        release.countDown();
        second.get(5, TimeUnit.SECONDS);
        assertThat(pool.shutdown(Duration.ofSeconds(5))).isTrue();
        assertThat(seen).containsExactly("first", "second");
    }

    @Test
    @DisplayName("Submitting after shutdown should be rejected")
    void shouldRejectAfterShutdown() throws InterruptedException {
        WorkerPool pool = new WorkerPool(1, 2, "test-worker");
        pool.start();
        assertThat(pool.shutdown(Duration.ofSeconds(5))).isTrue();

        assertThatThrownBy(() -> pool.submit(0, () -> { }))
                .isInstanceOf(RejectedExecutionException.class);
        assertThat(pool.pending()).isZero();
    }
}
