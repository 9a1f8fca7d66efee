package com.phillippitts.voicenav.service.overlay.grid;

import com.phillippitts.voicenav.domain.ScreenBounds;
import com.phillippitts.voicenav.domain.ScreenPoint;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable grid address space.
 *
 * <p>States:
 * <pre>
 * UNSHOWN
 * FULL(bounds = screen, size)          via show
 * REFINED(bounds = cell, 3, parentCell) via refine, from FULL or REFINED
 * </pre>
 * Cells are numbered 1..size² row-major from the top-left. A refine subdivides the chosen
 * cell of the current bounds into a 3x3 grid, so repeated refines zoom further in.
 * Transitions return new instances; invalid requests leave the state unchanged.
 */
public final class GridState {

    public enum Phase { UNSHOWN, FULL, REFINED }

    public static final int REFINED_SIZE = 3;

    private static final GridState UNSHOWN = new GridState(Phase.UNSHOWN, null, 0, 0, 0, 1, 0);

    private final Phase phase;
    private final ScreenBounds screen;
    private final int size;
    // current bounds are column/row (col, row) of a denom x denom division of the screen
    private final long col;
    private final long row;
    private final long denom;
    private final int refinedCell;

    private GridState(Phase phase, ScreenBounds screen, int size, long col, long row, long denom, int refinedCell) {
        this.phase = phase;
        this.screen = screen;
        this.size = size;
        this.col = col;
        this.row = row;
        this.denom = denom;
        this.refinedCell = refinedCell;
    }

    public static GridState unshown() {
        return UNSHOWN;
    }

    /** Any state to FULL covering the screen with a {@code size x size} grid. */
    public GridState show(ScreenBounds screen, int size) {
        Objects.requireNonNull(screen, "screen must not be null");
        if (size < 1) {
            throw new IllegalArgumentException("grid size must be positive: " + size);
        }
        return new GridState(Phase.FULL, screen, size, 0, 0, 1, 0);
    }

    /**
     * Zooms into a cell of the current grid.
     *
     * @return the REFINED state, or empty if nothing is shown, the cell is outside 1..size², or
     *         the cell is narrower or shorter than one pixel
     */
    public Optional<GridState> refine(int cell) {
        if (!isValidCell(cell)) {
            return Optional.empty();
        }
        long childDenom = denom * size;
        if (screen.width() / childDenom < 1 || screen.height() / childDenom < 1) {
            return Optional.empty();
        }
        int r = (cell - 1) / size;
        int c = (cell - 1) % size;
        return Optional.of(new GridState(Phase.REFINED, screen, REFINED_SIZE,
                col * size + c, row * size + r, childDenom, cell));
    }

    public GridState hide() {
        return UNSHOWN;
    }

    /** Bounds of a cell of the current grid. */
    public Optional<ScreenBounds> cellBounds(int cell) {
        if (!isValidCell(cell)) {
            return Optional.empty();
        }
        long d = denom * size;
        long c = col * size + (cell - 1) % size;
        long r = row * size + (cell - 1) / size;
        return Optional.of(new ScreenBounds(screen.x() + screen.width() * c / d, screen.y() + screen.height() * r / d,
                screen.width() / d, screen.height() / d));
    }

    /**
     * Center of a cell, rounded half up to whole pixels. Computed from the screen rather than
     * from the current bounds, so the center cell of a refined grid lands on exactly the same
     * pixel as the parent cell it came from.
     */
    public Optional<ScreenPoint> elementPosition(int cell) {
        if (!isValidCell(cell)) {
            return Optional.empty();
        }
        long d = denom * size;
        long c = col * size + (cell - 1) % size;
        long r = row * size + (cell - 1) / size;
        return Optional.of(new ScreenPoint(center(screen.x(), screen.width(), c, d),
                center(screen.y(), screen.height(), r, d)));
    }

    /** Center of every cell; empty when UNSHOWN. */
    public Map<Integer, ScreenPoint> positions() {
        Map<Integer, ScreenPoint> out = new LinkedHashMap<>();
        for (int n = 1; n <= cellCount(); n++) {
            int cell = n;
            elementPosition(n).ifPresent(p -> out.put(cell, p));
        }
        return out;
    }

    private boolean isValidCell(int cell) {
        return phase != Phase.UNSHOWN && cell >= 1 && cell <= cellCount();
    }

    // origin + extent * (2 * index + 1) / (2 * parts), exact for whole-pixel screens
    private static int center(double origin, double extent, long index, long parts) {
        if (origin != Math.rint(origin) || extent != Math.rint(extent)) {
            return (int) Math.round(origin + extent * (2 * index + 1) / (2.0 * parts));
        }
        long numerator = (long) extent * (2 * index + 1);
        long denominator = 2 * parts;
        return (int) ((long) origin + Math.floorDiv(2 * numerator + denominator, 2 * denominator));
    }

    public int cellCount() {
        return size * size;
    }

    public Phase getPhase() {
        return phase;
    }

    public boolean isShown() {
        return phase != Phase.UNSHOWN;
    }

    public boolean isRefined() {
        return phase == Phase.REFINED;
    }

    /** Area the current grid covers: the screen when FULL, the zoomed cell when REFINED. */
    public Optional<ScreenBounds> getBounds() {
        if (phase == Phase.UNSHOWN) {
            return Optional.empty();
        }
        return Optional.of(new ScreenBounds(screen.x() + screen.width() * col / denom,
                screen.y() + screen.height() * row / denom, screen.width() / denom, screen.height() / denom));
    }

    public int getSize() {
        return size;
    }

    /** Cell of the parent grid this state zoomed into; empty unless REFINED. */
    public OptionalInt getRefinedCell() {
        return phase == Phase.REFINED ? OptionalInt.of(refinedCell) : OptionalInt.empty();
    }

    @Override
    public String toString() {
        return switch (phase) {
            case UNSHOWN -> "GridState[UNSHOWN]";
            case FULL -> "GridState[FULL " + size + "x" + size + " " + screen + "]";
            case REFINED -> "GridState[REFINED cell=" + refinedCell + " " + getBounds().orElseThrow() + "]";
        };
    }
}
