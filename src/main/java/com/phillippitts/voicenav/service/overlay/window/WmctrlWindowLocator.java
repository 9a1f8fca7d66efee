package com.phillippitts.voicenav.service.overlay.window;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link WindowLocator} for X11 desktops, driving the {@code wmctrl} tool: {@code wmctrl -l}
 * to list and {@code wmctrl -i -a <id>} to activate.
 */
public class WmctrlWindowLocator implements WindowLocator {
    private static final Logger LOG = LogManager.getLogger(WmctrlWindowLocator.class);

    static final long TIMEOUT_SECONDS = 2;

    private final String executable;

    public WmctrlWindowLocator() {
        this("wmctrl");
    }

    public WmctrlWindowLocator(String executable) {
        this.executable = executable;
    }

    @Override
    public List<WindowInfo> listWindows(int maxWindows) {
        try {
            return parse(run(List.of(executable, "-l")), maxWindows);
        } catch (IOException e) {
            LOG.warn("Could not list windows with {}: {}", executable, e.getMessage());
            return List.of();
        }
    }

    @Override
    public void activate(WindowInfo window) throws IOException {
        run(List.of(executable, "-i", "-a", window.id()));
        LOG.info("Activated window {} '{}'", window.id(), window.title());
    }

    /** Parses {@code wmctrl -l} output: id, desktop, host, then the title. */
    static List<WindowInfo> parse(String output, int maxWindows) {
        List<WindowInfo> windows = new ArrayList<>();
        for (String line : output.split("\\R")) {
            if (windows.size() >= maxWindows) {
                break;
            }
            String[] parts = line.trim().split("\\s+", 4);
            if (parts.length == 4 && !parts[3].isBlank()) {
                windows.add(new WindowInfo(parts[0], parts[3]));
            }
        }
        return List.copyOf(windows);
    }

    private static String run(List<String> command) throws IOException {
        Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
        try {
            if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException(command.get(0) + " timed out");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException(command.get(0) + " interrupted", e);
        }
        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        if (process.exitValue() != 0) {
            throw new IOException(command.get(0) + " exited with " + process.exitValue());
        }
        return output;
    }
}
