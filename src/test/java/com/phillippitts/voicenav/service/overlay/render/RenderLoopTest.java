package com.phillippitts.voicenav.service.overlay.render;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RenderLoopTest {

    @Test
    void runsTasksInSubmissionOrderOnOneThread() throws Exception {
        List<Integer> order = new CopyOnWriteArrayList<>();
        List<String> threads = new CopyOnWriteArrayList<>();
        try (RenderLoop loop = new RenderLoop("test-render")) {
            for (int i = 0; i < 50; i++) {
                int n = i;
                loop.submit(() -> {
                    order.add(n);
                    threads.add(Thread.currentThread().getName());
                });
            }
            loop.submit(() -> { }).get(2, TimeUnit.SECONDS);
        }

        assertThat(order).hasSize(50).isSorted();
        assertThat(threads).containsOnly("test-render");
    }

    @Test
    void failingTaskDoesNotStopTheLoop() throws Exception {
        List<String> ran = new CopyOnWriteArrayList<>();
        try (RenderLoop loop = new RenderLoop("test-render")) {
            loop.submit(() -> {
                throw new IllegalStateException("draw failed");
            }).get(2, TimeUnit.SECONDS);
            loop.submit(() -> ran.add("after")).get(2, TimeUnit.SECONDS);

            assertThat(loop.isAlive()).isTrue();
        }

        assertThat(ran).containsExactly("after");
    }

    @Test
    void submitAfterCloseCompletesWithoutRunning() {
        List<String> ran = new CopyOnWriteArrayList<>();
        RenderLoop loop = new RenderLoop("test-render");
        loop.close();

        assertThat(loop.isAlive()).isFalse();
        assertThat(loop.submit(() -> ran.add("x"))).isDone();
        assertThat(ran).isEmpty();
        assertThat(loop.getName()).isEqualTo("test-render");
    }

    @Test
    void runLastWaitsForQueuedTasks() {
        List<String> ran = new CopyOnWriteArrayList<>();
        try (RenderLoop loop = new RenderLoop("test-render")) {
            loop.submit(() -> ran.add("first"));
            loop.runLast(() -> ran.add("last@" + Thread.currentThread().getName()));

            assertThat(ran).containsExactly("first", "last@test-render");
        }
    }

    @Test
    void runLastRunsOnCallerOnceClosed() {
        List<String> ran = new CopyOnWriteArrayList<>();
        RenderLoop loop = new RenderLoop("test-render");
        loop.close();

        loop.runLast(() -> ran.add(Thread.currentThread().getName()));

        assertThat(ran).containsExactly(Thread.currentThread().getName());
    }
}
