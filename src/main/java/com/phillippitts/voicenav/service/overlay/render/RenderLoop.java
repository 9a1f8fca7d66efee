package com.phillippitts.voicenav.service.overlay.render;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-consumer work queue backing one overlay's drawing.
 *
 * <p>Tasks run in submission order on one dedicated daemon thread. {@link #submit} never
 * blocks; pending tasks are neither coalesced nor cancelled. A task that throws is logged on
 * the render thread and the loop keeps going.
 */
public class RenderLoop implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(RenderLoop.class);

    private final String name;
    private final ExecutorService executor;

    public RenderLoop(String name) {
        this.name = name;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queues a task.
     *
     * @return future completing after the task ran (normally, even if the task failed);
     *         already complete when the loop is closed
     */
    public CompletableFuture<Void> submit(Runnable task) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    LOG.error("Render task failed on {}: {}", name, e.toString(), e);
                } finally {
                    done.complete(null);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.debug("Render loop {} closed; dropping task", name);
            done.complete(null);
        }
        return done;
    }

    /**
     * Runs a task after everything already queued and waits for it, at most one second.
     * If the loop is already closed the task runs on the calling thread instead.
     */
    public void runLast(Runnable task) {
        AtomicBoolean ran = new AtomicBoolean();
        CompletableFuture<Void> done = submit(() -> {
            ran.set(true);
            task.run();
        });
        try {
            done.get(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Render loop {} did not drain in time: {}", name, e.toString());
            return;
        }
        if (!ran.get()) {
            task.run();
        }
    }

    public boolean isAlive() {
        return !executor.isShutdown();
    }

    public String getName() {
        return name;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
