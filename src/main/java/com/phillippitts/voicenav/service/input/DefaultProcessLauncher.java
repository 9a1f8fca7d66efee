package com.phillippitts.voicenav.service.input;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.Desktop;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Opens a file with the desktop's default handler, or runs it directly when it is executable
 * and no desktop integration is available.
 */
public class DefaultProcessLauncher implements ProcessLauncher {
    private static final Logger LOG = LogManager.getLogger(DefaultProcessLauncher.class);

    @Override
    public void launch(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("File not found: " + file);
        }
        if (Desktop.isDesktopSupported() && Desktop.getDesktop().isSupported(Desktop.Action.OPEN)) {
            Desktop.getDesktop().open(file.toFile());
            LOG.info("Opened {}", file.getFileName());
            return;
        }
        new ProcessBuilder(command(file)).inheritIO().start();
        LOG.info("Started {}", file.getFileName());
    }

    private static List<String> command(Path file) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return List.of("cmd", "/c", "start", "", file.toString());
        }
        if (os.contains("mac")) {
            return List.of("open", file.toString());
        }
        return Files.isExecutable(file) ? List.of(file.toString()) : List.of("xdg-open", file.toString());
    }
}
