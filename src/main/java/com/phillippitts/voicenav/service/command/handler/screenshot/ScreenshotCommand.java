package com.phillippitts.voicenav.service.command.handler.screenshot;

import com.phillippitts.voicenav.exception.CommandExecutionException;
import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.input.ScreenCapture;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * "screenshot", "take screenshot", "green shot": saves the screen as
 * {@code screenshot_yyyyMMdd_HHmmss.png} in the screenshots directory, creating it if needed.
 */
public final class ScreenshotCommand extends AbstractCommand {

    private static final Logger LOG = LogManager.getLogger(ScreenshotCommand.class);

    static final String FILE_PREFIX = "screenshot_";
    static final String FILE_SUFFIX = ".png";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    // "green shot" is a common mishearing
    private static final List<String> TRIGGERS = List.of(
            "screenshot", "take screenshot", "screen shot", "green shot", "take green shot", "greenshot");

    private final Path directory;
    private final Clock clock;

    public ScreenshotCommand(Path directory) {
        this(directory, Clock.systemDefaultZone());
    }

    // Package-private for tests
    ScreenshotCommand(Path directory, Clock clock) {
        super(CommandPriority.MEDIUM, "Take a screenshot and save it to " + directory,
                List.of("screenshot", "take screenshot", "green shot"));
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.clock = clock;
    }

    /** {@code ~/Pictures/Screenshots}. */
    public static Path defaultDirectory() {
        return Path.of(System.getProperty("user.home"), "Pictures", "Screenshots");
    }

    @Override
    public boolean matches(String text) {
        return TRIGGERS.contains(clean(text));
    }

    @Override
    public boolean validate(CommandContext context, String text) {
        return context.getScreenCapture().isPresent();
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        ScreenCapture capture = context.getScreenCapture().orElseThrow(() -> failure("no screen capture available"));
        Path file = directory.resolve(FILE_PREFIX + TIMESTAMP.format(LocalDateTime.now(clock)) + FILE_SUFFIX);
        try {
            BufferedImage image = capture.capture();
            Files.createDirectories(directory);
            if (!ImageIO.write(image, "png", file.toFile())) {
                throw failure("no PNG writer available");
            }
        } catch (IOException e) {
            throw new CommandExecutionException(name(), "could not save screenshot " + file.getFileName(), e);
        }
        LOG.info("Screenshot saved: {}", file);
        return Optional.empty();
    }
}
