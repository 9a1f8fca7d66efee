package com.phillippitts.voicenav.service.overlay;

/** An overlay that can zoom into one of its numbered cells. */
public interface RefinableOverlay extends Overlay {

    /**
     * Zooms into the given cell. Validation happens synchronously against the current state;
     * the redraw is queued.
     *
     * @return false if the overlay is not showing or the cell is out of range
     */
    boolean refine(int cell);
}
