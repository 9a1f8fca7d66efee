package com.phillippitts.voicenav.service.command.handler.screenshot;

import com.phillippitts.voicenav.exception.CommandExecutionException;
import com.phillippitts.voicenav.service.command.Command;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandRegistry;
import com.phillippitts.voicenav.service.command.ProcessResult;
import com.phillippitts.voicenav.service.command.handler.BuiltInCommands;
import com.phillippitts.voicenav.service.parser.CommandParser;
import com.phillippitts.voicenav.testutil.RecordingEventBus;
import com.phillippitts.voicenav.testutil.RecordingInput;
import com.phillippitts.voicenav.testutil.TestContexts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceScreenshotCommandTest {

    @TempDir
    Path dir;

    private ReferenceScreenshotCommand command;
    private CommandContext ctx;
    private Path oldest;
    private Path middle;
    private Path newest;

    @BeforeEach
    void setUp() throws IOException {
        command = new ReferenceScreenshotCommand(new CommandParser(), dir);
        ctx = TestContexts.of(new RecordingInput());
        // names out of order so only modification time decides
        newest = save("screenshot_20260101_080000.png", "2026-10-17T10:00:00Z");
        oldest = save("screenshot_20260301_080000.png", "2026-10-17T08:00:00Z");
        middle = save("screenshot_20260201_080000.png", "2026-10-17T09:00:00Z");
        save("notes.png", "2026-10-17T11:00:00Z");
        save("screenshot_20260401_080000.jpg", "2026-10-17T11:00:00Z");
    }

    @Test
    void parsesSingleAndMultiplePhrases() {
        assertThat(command.parse("reference screenshot")).contains(new ReferenceScreenshotCommand.Request(false, 1));
        assertThat(command.parse("reference screenshot two")).contains(new ReferenceScreenshotCommand.Request(false, 2));
        assertThat(command.parse("screenshot 3")).contains(new ReferenceScreenshotCommand.Request(false, 3));
        assertThat(command.parse("screenshot last 3")).contains(new ReferenceScreenshotCommand.Request(true, 3));
        assertThat(command.parse("Green shot last five.")).contains(new ReferenceScreenshotCommand.Request(true, 5));
    }

    @Test
    void leavesBareScreenshotAndIncompletePhrasesAlone() {
        assertThat(command.parse("screenshot")).isEmpty();
        assertThat(command.parse("take screenshot")).isEmpty();
        assertThat(command.parse("screenshot last")).isEmpty();
        assertThat(command.parse("screenshot of the page")).isEmpty();
    }

    @Test
    void referencesNewestByDefault() {
        assertThat(command.execute(ctx, "reference screenshot")).contains(newest.toAbsolutePath().toString());
    }

    @Test
    void referencesNthMostRecent() {
        assertThat(command.execute(ctx, "reference screenshot 2")).contains(middle.toAbsolutePath().toString());
        assertThat(command.execute(ctx, "screenshot 3")).contains(oldest.toAbsolutePath().toString());
    }

    @Test
    void lastNJoinsPathsNewestFirst() {
        assertThat(command.execute(ctx, "screenshot last 2"))
                .contains(newest.toAbsolutePath() + "\n" + middle.toAbsolutePath());
    }

    @Test
    void lastNReturnsWhatIsAvailable() {
        assertThat(command.execute(ctx, "screenshot last 5").orElseThrow().split("\n")).hasSize(3);
    }

    @Test
    void indexBeyondAvailableFails() {
        assertThatThrownBy(() -> command.execute(ctx, "screenshot 4"))
                .isInstanceOf(CommandExecutionException.class)
                .hasMessageContaining("screenshot 4 not found (3 available)");
    }

    @Test
    void emptyOrMissingDirectoryFails() throws IOException {
        Path empty = Files.createDirectory(dir.resolve("empty"));

        assertThatThrownBy(() -> new ReferenceScreenshotCommand(new CommandParser(), empty).execute(ctx, "reference screenshot"))
                .isInstanceOf(CommandExecutionException.class)
                .hasMessageContaining("no screenshots");
        assertThatThrownBy(() -> new ReferenceScreenshotCommand(new CommandParser(), dir.resolve("missing"))
                .execute(ctx, "reference screenshot"))
                .isInstanceOf(CommandExecutionException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void registryRoutesScreenshotPhrasesToTheRightCommand() {
        CommandRegistry registry = new CommandRegistry(new RecordingEventBus());
        registry.registerAll(BuiltInCommands.create(new CommandParser(), 9, dir));

        assertThat(registry.findMatching("screenshot").map(Command::name)).contains("ScreenshotCommand");
        assertThat(registry.findMatching("screenshot 2").map(Command::name)).contains("ReferenceScreenshotCommand");

        ProcessResult result = registry.process("screenshot last 1", ctx);
        assertThat(result.literalText()).contains(newest.toAbsolutePath().toString());
    }

    private Path save(String name, String modified) throws IOException {
        Path file = Files.write(dir.resolve(name), new byte[] {1});
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse(modified)));
        return file;
    }
}
