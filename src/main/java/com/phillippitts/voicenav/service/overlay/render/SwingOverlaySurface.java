package com.phillippitts.voicenav.service.overlay.render;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.swing.JComponent;
import javax.swing.JWindow;
import javax.swing.SwingUtilities;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.lang.reflect.InvocationTargetException;

/**
 * Translucent, always-on-top, non-focusable window that draws an {@link OverlayFrame}.
 *
 * <p>Drawing is handed to the Swing event thread and awaited, so the render loop does not
 * report a frame as done before it is on screen.
 */
public class SwingOverlaySurface implements OverlaySurface {
    private static final Logger LOG = LogManager.getLogger(SwingOverlaySurface.class);

    private static final Color CELL_LINE = new Color(255, 80, 80, 200);
    private static final Color LABEL_BG = new Color(0, 0, 0, 170);
    private static final Color TEXT = Color.WHITE;
    private static final Color PANEL_BG = new Color(20, 20, 20, 220);

    private final String name;
    private JWindow window;
    private FramePanel panel;

    public SwingOverlaySurface(String name) {
        this.name = name;
    }

    @Override
    public void draw(OverlayFrame frame) {
        onEdt(() -> {
            ensureWindow();
            window.setBounds((int) frame.area().x(), (int) frame.area().y(),
                    (int) Math.ceil(frame.area().width()), (int) Math.ceil(frame.area().height()));
            panel.frame = frame;
            window.setVisible(true);
            panel.repaint();
        });
    }

    @Override
    public void clear() {
        onEdt(() -> {
            if (window != null) {
                window.setVisible(false);
                panel.frame = null;
            }
        });
    }

    @Override
    public void dispose() {
        onEdt(() -> {
            if (window != null) {
                window.dispose();
                window = null;
            }
        });
    }

    private void ensureWindow() {
        if (window != null) {
            return;
        }
        window = new JWindow();
        window.setName(name);
        window.setAlwaysOnTop(true);
        window.setFocusableWindowState(false);
        window.setBackground(new Color(0, 0, 0, 0));
        panel = new FramePanel();
        window.setContentPane(panel);
    }

    private void onEdt(Runnable r) {
        if (SwingUtilities.isEventDispatchThread()) {
            r.run();
            return;
        }
        try {
            SwingUtilities.invokeAndWait(r);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (InvocationTargetException e) {
            LOG.warn("Overlay surface {} failed: {}", name, e.getCause() == null ? e.toString() : e.getCause().toString());
        }
    }

    private static final class FramePanel extends JComponent {
        private volatile OverlayFrame frame;

        FramePanel() {
            setOpaque(false);
        }

        @Override
        protected void paintComponent(Graphics g) {
            OverlayFrame f = frame;
            if (f == null) {
                return;
            }
            Graphics2D g2 = (Graphics2D) g.create();
            try {
                g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
                if (f.labels().isEmpty()) {
                    paintLines(g2, f);
                } else {
                    paintLabels(g2, f);
                }
            } finally {
                g2.dispose();
            }
        }

        private void paintLabels(Graphics2D g2, OverlayFrame f) {
            double ox = f.area().x();
            double oy = f.area().y();
            g2.setStroke(new BasicStroke(1.5f));
            g2.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 14));
            FontMetrics fm = g2.getFontMetrics();
            for (OverlayFrame.Label l : f.labels()) {
                int x = (int) Math.round(l.cell().x() - ox);
                int y = (int) Math.round(l.cell().y() - oy);
                int w = (int) Math.round(l.cell().width());
                int h = (int) Math.round(l.cell().height());
                g2.setColor(CELL_LINE);
                g2.drawRect(x, y, w, h);
                String text = Integer.toString(l.number());
                int tw = fm.stringWidth(text) + 8;
                int th = fm.getHeight();
                int cx = l.caption() == null ? x + w / 2 - tw / 2 : x + 6;
                int cy = y + h / 2 - th / 2;
                g2.setColor(LABEL_BG);
                g2.fillRoundRect(cx, cy, tw, th, 6, 6);
                g2.setColor(TEXT);
                g2.drawString(text, cx + 4, cy + fm.getAscent());
                if (l.caption() != null) {
                    g2.drawString(l.caption(), cx + tw + 10, cy + fm.getAscent());
                }
            }
        }

        private void paintLines(Graphics2D g2, OverlayFrame f) {
            g2.setColor(PANEL_BG);
            g2.fillRoundRect(0, 0, getWidth(), getHeight(), 12, 12);
            g2.setColor(TEXT);
            g2.setFont(new Font(Font.MONOSPACED, Font.PLAIN, 13));
            FontMetrics fm = g2.getFontMetrics();
            int y = 16 + fm.getAscent();
            for (String line : f.lines()) {
                if (y > getHeight()) {
                    break;
                }
                g2.drawString(line, 16, y);
                y += fm.getHeight();
            }
        }
    }
}
