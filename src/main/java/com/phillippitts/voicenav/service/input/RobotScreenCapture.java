package com.phillippitts.voicenav.service.input;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.Toolkit;
import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * {@link ScreenCapture} via {@link Robot#createScreenCapture}. Needs Screen Recording
 * permission on macOS; without it the image shows only the desktop background.
 */
public class RobotScreenCapture implements ScreenCapture {

    private Robot robot;

    @Override
    public synchronized BufferedImage capture() throws IOException {
        if (GraphicsEnvironment.isHeadless()) {
            throw new IOException("no display available");
        }
        try {
            if (robot == null) {
                robot = new Robot();
            }
        } catch (AWTException | SecurityException e) {
            throw new IOException("screen capture unavailable: " + e.getMessage(), e);
        }
        return robot.createScreenCapture(new Rectangle(Toolkit.getDefaultToolkit().getScreenSize()));
    }
}
