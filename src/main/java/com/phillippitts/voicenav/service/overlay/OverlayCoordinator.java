package com.phillippitts.voicenav.service.overlay;

import com.phillippitts.voicenav.domain.ScreenPoint;
import com.phillippitts.voicenav.service.events.EventBus;
import com.phillippitts.voicenav.service.events.EventType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the set of registered overlays and guarantees that at most one of them is visible.
 *
 * <p>Showing an overlay while another is visible hides the other first, running its
 * {@code hide}/{@code onHide} hooks and publishing {@link EventType#OVERLAY_HIDDEN} before the
 * new overlay is shown.
 *
 * <p>The coordinator also keeps the shared element-number table. Render threads write it
 * through {@link #replaceElementPositions}; writes from an overlay that is no longer the
 * active one are discarded. The dispatch thread reads an atomic snapshot, falling back to the
 * active overlay's own logical state when the table has no entry yet.
 *
 * <p><b>Thread Safety:</b> show/hide transitions are serialized by a {@link ReentrantLock};
 * the element table and metadata are lock-free.
 */
public class OverlayCoordinator {

    private static final Logger LOG = LogManager.getLogger(OverlayCoordinator.class);

    private final Map<OverlayKind, Overlay> overlays = new EnumMap<>(OverlayKind.class);
    private final Lock lock = new ReentrantLock();
    private final EventBus eventBus;

    private volatile OverlayKind current;
    private final AtomicReference<PositionTable> positions = new AtomicReference<>(PositionTable.empty(null));
    private final Map<String, Object> metadata = new ConcurrentHashMap<>();

    public OverlayCoordinator(EventBus eventBus) {
        this.eventBus = eventBus; // may be null when events are not wanted
    }

    public void register(Overlay overlay) {
        Objects.requireNonNull(overlay, "overlay must not be null");
        lock.lock();
        try {
            Overlay previous = overlays.put(overlay.kind(), overlay);
            if (previous != null && previous != overlay) {
                LOG.info("Replaced overlay registration for {}", overlay.kind());
            }
        } finally {
            lock.unlock();
        }
    }

    /** Removes a registration, hiding the overlay first if it is the visible one. */
    public boolean unregister(OverlayKind kind) {
        lock.lock();
        try {
            if (kind == current) {
                hideLocked(kind);
            }
            return overlays.remove(kind) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Shows an overlay, hiding the visible one if it differs.
     *
     * @return false if the kind is unregistered, its pre-show validation vetoes, or showing failed
     */
    public boolean show(OverlayKind kind, Map<String, Object> options) {
        Map<String, Object> opts = options == null ? Map.of() : options;
        lock.lock();
        try {
            Overlay overlay = overlays.get(kind);
            if (overlay == null) {
                LOG.warn("Cannot show {} overlay: not registered", kind);
                return false;
            }
            try {
                if (!overlay.validateBeforeShow()) {
                    LOG.info("Show of {} overlay skipped by validation", kind);
                    return false;
                }
                if (current != null && current != kind) {
                    hideLocked(current);
                }
                positions.set(PositionTable.empty(kind));
                metadata.clear();
                overlay.show(opts);
                current = kind;
                overlay.onShow();
            } catch (RuntimeException e) {
                LOG.error("Failed to show {} overlay: {}", kind, e.toString(), e);
                if (current == kind) {
                    clearState();
                }
                return false;
            }
            LOG.debug("Overlay {} shown", kind);
            publish(EventType.OVERLAY_SHOWN, kind, opts);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean hide(OverlayKind kind) {
        lock.lock();
        try {
            if (kind == null || kind != current) {
                return false;
            }
            return hideLocked(kind);
        } finally {
            lock.unlock();
        }
    }

    public boolean hideCurrent() {
        lock.lock();
        try {
            return current != null && hideLocked(current);
        } finally {
            lock.unlock();
        }
    }

    /** Hides the overlay if it is visible, otherwise shows it. */
    public boolean toggle(OverlayKind kind, Map<String, Object> options) {
        lock.lock();
        try {
            return kind == current ? hide(kind) : show(kind, options);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forwards a refine request to the visible overlay.
     *
     * @return false when no refinable overlay is visible or the cell is invalid
     */
    public boolean refine(int cell) {
        lock.lock();
        try {
            OverlayKind kind = current;
            Overlay overlay = kind == null ? null : overlays.get(kind);
            if (!(overlay instanceof RefinableOverlay refinable)) {
                return false;
            }
            if (!refinable.refine(cell)) {
                return false;
            }
            metadata.put("refined_cell", cell);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isVisible(OverlayKind kind) {
        return kind != null && kind == current;
    }

    public boolean isAnyVisible() {
        return current != null;
    }

    public Optional<OverlayKind> getCurrentKind() {
        return Optional.ofNullable(current);
    }

    public Optional<Overlay> getOverlay(OverlayKind kind) {
        lock.lock();
        try {
            return Optional.ofNullable(overlays.get(kind));
        } finally {
            lock.unlock();
        }
    }

    /** Kinds with a registered overlay. */
    public Map<OverlayKind, Boolean> registrations() {
        lock.lock();
        try {
            Map<OverlayKind, Boolean> out = new EnumMap<>(OverlayKind.class);
            overlays.keySet().forEach(k -> out.put(k, k == current));
            return out;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Looks up a numbered element: the shared table first, then the visible overlay's own state.
     */
    public Optional<ScreenPoint> getElementPosition(int number) {
        OverlayKind kind = current;
        if (kind == null) {
            return Optional.empty();
        }
        PositionTable table = positions.get();
        if (table.owner() == kind) {
            ScreenPoint p = table.points().get(number);
            if (p != null) {
                return Optional.of(p);
            }
        }
        Overlay overlay = overlays.get(kind);
        return overlay == null ? Optional.empty() : overlay.elementPosition(number);
    }

    public boolean hasElement(int number) {
        return getElementPosition(number).isPresent();
    }

    /** Snapshot of the shared table; empty when nothing is visible. */
    public Map<Integer, ScreenPoint> elementPositions() {
        PositionTable table = positions.get();
        return table.owner() != null && table.owner() == current ? table.points() : Map.of();
    }

    /**
     * Replaces the table with the owner's positions.
     *
     * @return false if the owner is not the visible overlay and the write was discarded
     */
    public boolean replaceElementPositions(OverlayKind owner, Map<Integer, ScreenPoint> points) {
        Map<Integer, ScreenPoint> copy = Map.copyOf(points);
        PositionTable result = positions.updateAndGet(t ->
                t.owner() == owner ? new PositionTable(owner, copy) : t);
        return result.owner() == owner && result.points() == copy;
    }

    /** Merges the owner's positions into the table. */
    public boolean updateElementPositions(OverlayKind owner, Map<Integer, ScreenPoint> points) {
        PositionTable result = positions.updateAndGet(t -> {
            if (t.owner() != owner) {
                return t;
            }
            Map<Integer, ScreenPoint> merged = new HashMap<>(t.points());
            merged.putAll(points);
            return new PositionTable(owner, Map.copyOf(merged));
        });
        return result.owner() == owner;
    }

    public boolean setElementPosition(OverlayKind owner, int number, ScreenPoint point) {
        return updateElementPositions(owner, Map.of(number, point));
    }

    /** Empties the table if the owner still holds it. */
    public void clearElementPositions(OverlayKind owner) {
        positions.updateAndGet(t -> t.owner() == owner ? PositionTable.empty(owner) : t);
    }

    public void setMetadata(String key, Object value) {
        if (value == null) {
            metadata.remove(key);
        } else {
            metadata.put(key, value);
        }
    }

    public Optional<Object> getMetadata(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    /** Hides whatever is visible and resets all shared state. */
    public void clearAll() {
        lock.lock();
        try {
            if (current != null) {
                hideLocked(current);
            }
            clearState();
        } finally {
            lock.unlock();
        }
    }

    private boolean hideLocked(OverlayKind kind) {
        Overlay overlay = overlays.get(kind);
        try {
            if (overlay != null) {
                overlay.hide();
                overlay.onHide();
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to hide {} overlay: {}", kind, e.toString(), e);
            clearState();
            return false;
        }
        clearState();
        LOG.debug("Overlay {} hidden", kind);
        publish(EventType.OVERLAY_HIDDEN, kind, Map.of());
        return true;
    }

    private void clearState() {
        current = null;
        positions.set(PositionTable.empty(null));
        metadata.clear();
    }

    private void publish(EventType type, OverlayKind kind, Map<String, Object> options) {
        if (eventBus == null) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("overlay", kind.label());
        if (!options.isEmpty()) {
            data.put("options", Map.copyOf(options));
        }
        eventBus.publish(type, data);
    }

    private record PositionTable(OverlayKind owner, Map<Integer, ScreenPoint> points) {
        static PositionTable empty(OverlayKind owner) {
            return new PositionTable(owner, Map.of());
        }
    }
}
