package com.phillippitts.voicenav.service.input;

import java.io.IOException;
import java.nio.file.Path;

/** Opens files or programs on behalf of custom commands. */
public interface ProcessLauncher {

    void launch(Path file) throws IOException;
}
