package com.phillippitts.voicenav.service.overlay;

import com.phillippitts.voicenav.service.overlay.render.OverlayFrame;
import com.phillippitts.voicenav.service.overlay.render.OverlaySurface;
import com.phillippitts.voicenav.service.overlay.render.RenderLoop;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Base for overlays whose logical state changes synchronously and whose drawing runs on a
 * private {@link RenderLoop}.
 *
 * <p>Every state change bumps a generation counter and clears this overlay's entries in the
 * coordinator's element table. The render task draws the state current when it runs and
 * publishes its positions only if no newer change happened meanwhile, so the shared table
 * never holds positions from a superseded state.
 *
 * <p>{@link #close()} clears and disposes the surface once the queued redraws have run; later
 * changes still update the logical state but no longer draw.
 */
public abstract class AbstractRenderedOverlay implements Overlay, AutoCloseable {

    private final Lock lock = new ReentrantLock();
    private final OverlayCoordinator coordinator;
    private final RenderLoop renderLoop;
    private final OverlaySurface surface;

    private long generation;
    private boolean visible;
    private boolean closed;
    private volatile CompletableFuture<Void> lastRender = CompletableFuture.completedFuture(null);

    protected AbstractRenderedOverlay(OverlayCoordinator coordinator, RenderLoop renderLoop, OverlaySurface surface) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");
        this.renderLoop = Objects.requireNonNull(renderLoop, "renderLoop must not be null");
        this.surface = Objects.requireNonNull(surface, "surface must not be null");
    }

    /** Applies the show options to the logical state. Called under the state lock. */
    protected abstract void applyShow(Map<String, Object> options);

    /** Resets the logical state. Called under the state lock. */
    protected abstract void applyHide();

    /** Frame for the current logical state. Called under the state lock, only while visible. */
    protected abstract OverlayFrame currentFrame();

    @Override
    public final void show(Map<String, Object> options) {
        change(() -> {
            applyShow(options == null ? Map.of() : options);
            visible = true;
            return true;
        });
    }

    @Override
    public final void hide() {
        change(() -> {
            applyHide();
            visible = false;
            return true;
        });
    }

    @Override
    public boolean isVisible() {
        return read(() -> visible);
    }

    /**
     * Runs a state change under the lock and queues a redraw if it reports success.
     *
     * @return the change's result
     */
    protected final boolean change(BooleanSupplier mutation) {
        lock.lock();
        try {
            if (!mutation.getAsBoolean()) {
                return false;
            }
            generation++;
            coordinator.clearElementPositions(kind());
        } finally {
            lock.unlock();
        }
        lastRender = renderLoop.submit(this::renderLatest);
        return true;
    }

    protected final <T> T read(Supplier<T> reader) {
        lock.lock();
        try {
            return reader.get();
        } finally {
            lock.unlock();
        }
    }

    /** Completes once the most recently queued redraw has run. */
    public CompletableFuture<Void> whenRendered() {
        return lastRender;
    }

    /** Clears and disposes the surface after pending redraws. Idempotent. */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            visible = false;
            generation++;
            coordinator.clearElementPositions(kind());
        } finally {
            lock.unlock();
        }
        renderLoop.runLast(() -> {
            surface.clear();
            surface.dispose();
        });
    }

    public RenderLoop getRenderLoop() {
        return renderLoop;
    }

    private void renderLatest() {
        long renderedGeneration;
        OverlayFrame frame;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            renderedGeneration = generation;
            frame = visible ? currentFrame() : null;
        } finally {
            lock.unlock();
        }
        if (frame == null) {
            surface.clear();
            return;
        }
        surface.draw(frame);
        lock.lock();
        try {
            if (renderedGeneration == generation) {
                coordinator.replaceElementPositions(kind(), frame.positions());
            }
        } finally {
            lock.unlock();
        }
    }
}
