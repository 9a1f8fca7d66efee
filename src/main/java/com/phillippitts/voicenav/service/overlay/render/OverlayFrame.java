package com.phillippitts.voicenav.service.overlay.render;

import com.phillippitts.voicenav.domain.ScreenBounds;
import com.phillippitts.voicenav.domain.ScreenPoint;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a surface needs to draw one overlay state: the covered area, numbered cells and
 * free text lines.
 */
public record OverlayFrame(String title, ScreenBounds area, List<Label> labels, List<String> lines) {

    public OverlayFrame {
        labels = labels == null ? List.of() : List.copyOf(labels);
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    /**
     * A numbered rectangle. Without a caption the number is drawn at the center; with one, the
     * number leads the caption along the left edge.
     */
    public record Label(int number, ScreenBounds cell, String caption) {
        public Label(int number, ScreenBounds cell) {
            this(number, cell, null);
        }

        public ScreenPoint center() {
            return cell.center();
        }
    }

    /** Number to center-point table for the labels in this frame. */
    public Map<Integer, ScreenPoint> positions() {
        Map<Integer, ScreenPoint> out = new LinkedHashMap<>();
        for (Label l : labels) {
            out.put(l.number(), l.center());
        }
        return out;
    }
}
