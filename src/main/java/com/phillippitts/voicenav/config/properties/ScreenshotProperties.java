package com.phillippitts.voicenav.config.properties;

import com.phillippitts.voicenav.service.command.handler.screenshot.ScreenshotCommand;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.nio.file.Path;

/**
 * Where "screenshot" saves images and "reference screenshot" looks for them. Defaults to
 * {@code ~/Pictures/Screenshots}.
 */
@ConfigurationProperties(prefix = "screenshots")
public class ScreenshotProperties {

    private final Path directory;

    @ConstructorBinding
    public ScreenshotProperties(String directory) {
        this.directory = directory == null || directory.isBlank()
                ? ScreenshotCommand.defaultDirectory()
                : Path.of(directory.trim());
    }

    public Path getDirectory() {
        return directory;
    }
}
