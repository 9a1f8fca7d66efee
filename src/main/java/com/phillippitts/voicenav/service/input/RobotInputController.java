package com.phillippitts.voicenav.service.input;

import com.phillippitts.voicenav.domain.ScreenPoint;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.MouseInfo;
import java.awt.PointerInfo;
import java.awt.Robot;
import java.awt.event.KeyEvent;

/**
 * Keyboard and mouse injection via {@link java.awt.Robot}. Requires Accessibility permission
 * on macOS. When no Robot can be created (headless, no permission) every action is a logged
 * no-op and {@link #isAvailable()} reports false.
 *
 * For hermetic tests, the RobotFacade can be replaced.
 */
public class RobotInputController implements KeyboardActions, MouseActions {
    private static final Logger LOG = LogManager.getLogger(RobotInputController.class);

    interface RobotFacade {
        void keyPress(int keyCode);
        void keyRelease(int keyCode);
        void mouseMove(int x, int y);
        void mousePress(int buttons);
        void mouseRelease(int buttons);
        void mouseWheel(int notches);
        void delay(int ms);
        ScreenPoint pointer();
    }

    static final class AwtRobotFacade implements RobotFacade {
        private final Robot robot;

        AwtRobotFacade() throws AWTException {
            this.robot = new Robot();
        }

        @Override
        public void keyPress(int keyCode) {
            robot.keyPress(keyCode);
        }

        @Override
        public void keyRelease(int keyCode) {
            robot.keyRelease(keyCode);
        }

        @Override
        public void mouseMove(int x, int y) {
            robot.mouseMove(x, y);
        }

        @Override
        public void mousePress(int buttons) {
            robot.mousePress(buttons);
        }

        @Override
        public void mouseRelease(int buttons) {
            robot.mouseRelease(buttons);
        }

        @Override
        public void mouseWheel(int notches) {
            robot.mouseWheel(notches);
        }

        @Override
        public void delay(int ms) {
            robot.delay(ms);
        }

        @Override
        public ScreenPoint pointer() {
            PointerInfo info = MouseInfo.getPointerInfo();
            return info == null ? new ScreenPoint(0, 0)
                    : new ScreenPoint(info.getLocation().x, info.getLocation().y);
        }
    }

    private final RobotFacade robot;

    public RobotInputController() {
        this(createRobotFacade());
    }

    // Package-private for tests
    RobotInputController(RobotFacade facade) {
        this.robot = facade; // null when unavailable
    }

    private static RobotFacade createRobotFacade() {
        if (GraphicsEnvironment.isHeadless()) {
            LOG.info("Headless environment; input injection disabled");
            return null;
        }
        try {
            return new AwtRobotFacade();
        } catch (AWTException | SecurityException e) {
            LOG.warn("java.awt.Robot unavailable; input injection disabled: {}", e.toString());
            return null;
        }
    }

    public boolean isAvailable() {
        return robot != null;
    }

    @Override
    public void press(int keyCode) {
        if (ready("key press")) {
            robot.keyPress(keyCode);
        }
    }

    @Override
    public void release(int keyCode) {
        if (ready("key release")) {
            robot.keyRelease(keyCode);
        }
    }

    @Override
    public ScreenPoint position() {
        return robot == null ? new ScreenPoint(0, 0) : robot.pointer();
    }

    @Override
    public void moveTo(int x, int y) {
        if (ready("mouse move")) {
            robot.mouseMove(x, y);
        }
    }

    @Override
    public void click(MouseButton button, int count) {
        if (!ready("click")) {
            return;
        }
        for (int i = 0; i < count; i++) {
            robot.mousePress(button.mask());
            robot.mouseRelease(button.mask());
        }
    }

    @Override
    public void press(MouseButton button) {
        if (ready("mouse press")) {
            robot.mousePress(button.mask());
        }
    }

    @Override
    public void release(MouseButton button) {
        if (ready("mouse release")) {
            robot.mouseRelease(button.mask());
        }
    }

    @Override
    public void scroll(int dx, int dy) {
        if (!ready("scroll")) {
            return;
        }
        if (dy != 0) {
            robot.mouseWheel(dy);
        }
        if (dx != 0) {
            // Shift turns the vertical wheel into horizontal scrolling on all desktop platforms
            robot.keyPress(KeyEvent.VK_SHIFT);
            try {
                robot.mouseWheel(dx);
            } finally {
                robot.keyRelease(KeyEvent.VK_SHIFT);
            }
        }
    }

    @Override
    public void pause(int millis) {
        if (robot != null && millis > 0) {
            robot.delay(millis);
        }
    }

    private boolean ready(String action) {
        if (robot == null) {
            LOG.debug("Skipping {}: Robot unavailable", action);
            return false;
        }
        return true;
    }
}
