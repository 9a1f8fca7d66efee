package com.phillippitts.voicenav.service.input;

import java.awt.image.BufferedImage;
import java.io.IOException;

/** Grabs the pixels of the whole screen. */
public interface ScreenCapture {

    /** @throws IOException when no display can be read (headless, missing permission) */
    BufferedImage capture() throws IOException;
}
