package com.phillippitts.voicenav.service.command.handler.window;

import com.phillippitts.voicenav.exception.CommandExecutionException;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandRegistry;
import com.phillippitts.voicenav.service.command.handler.BuiltInCommands;
import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;
import com.phillippitts.voicenav.service.overlay.OverlayKind;
import com.phillippitts.voicenav.service.overlay.ScreenGeometry;
import com.phillippitts.voicenav.service.overlay.render.LoggingOverlaySurface;
import com.phillippitts.voicenav.service.overlay.render.RenderLoop;
import com.phillippitts.voicenav.service.overlay.window.WindowInfo;
import com.phillippitts.voicenav.service.overlay.window.WindowListOverlay;
import com.phillippitts.voicenav.service.parser.CommandParser;
import com.phillippitts.voicenav.testutil.FakeWindowLocator;
import com.phillippitts.voicenav.testutil.RecordingEventBus;
import com.phillippitts.voicenav.testutil.RecordingInput;
import com.phillippitts.voicenav.testutil.TestContexts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.event.KeyEvent;
import java.io.IOException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SwitchToWindowCommandTest {

    private RecordingInput input;
    private OverlayCoordinator overlays;
    private RenderLoop loop;
    private FakeWindowLocator locator;
    private CommandRegistry registry;
    private CommandContext ctx;

    @BeforeEach
    void setUp() {
        RecordingEventBus bus = new RecordingEventBus();
        input = new RecordingInput();
        overlays = new OverlayCoordinator(bus);
        loop = new RenderLoop("window-test");
        locator = new FakeWindowLocator("Terminal", "Editor", "Browser");
        overlays.register(new WindowListOverlay(overlays, loop, new LoggingOverlaySurface("window"),
                Optional.of(locator), ScreenGeometry.fixed(1920, 1080), 20));
        registry = new CommandRegistry(bus);
        registry.registerAll(BuiltInCommands.create(new CommandParser(), 9));
        ctx = TestContexts.builder(input).overlays(overlays).eventBus(bus).build();
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void switchesToNumberedWindowAndHidesList() {
        run("windows");
        assertThat(overlays.isVisible(OverlayKind.WINDOW)).isTrue();

        run("switch window 2");

        assertThat(locator.activated).extracting(WindowInfo::title).containsExactly("Editor");
        assertThat(overlays.isAnyVisible()).isFalse();
        assertThat(input.actions).isEmpty();
    }

    @Test
    void separatorWordBeforeWindowIsNotANumber() {
        run("windows");

        run("switch to window three");

        assertThat(locator.activated).extracting(WindowInfo::title).containsExactly("Browser");
    }

    @Test
    void bareWindowNumberSwitches() {
        run("windows");

        run("window 1");

        assertThat(locator.activated).extracting(WindowInfo::title).containsExactly("Terminal");
    }

    @Test
    void notExecutedWithoutVisibleList() {
        assertThat(registry.process("switch window 2", ctx).executed()).isFalse();
        assertThat(locator.activated).isEmpty();
    }

    @Test
    void unknownNumberFails() {
        run("windows");

        assertThatThrownBy(() -> registry.process("switch window 9", ctx))
                .isInstanceOf(CommandExecutionException.class)
                .hasMessageContaining("window 9 not found");
        assertThat(overlays.isVisible(OverlayKind.WINDOW)).isTrue();
    }

    @Test
    void activationFailureIsReported() {
        locator.failWith(new IOException("wmctrl exited with 1"));
        run("windows");

        assertThatThrownBy(() -> registry.process("switch window 1", ctx))
                .isInstanceOf(CommandExecutionException.class)
                .hasMessageContaining("could not activate window 1")
                .hasRootCauseInstanceOf(IOException.class);
    }

    @Test
    void switchWindowWithoutNumberStillCyclesWindows() {
        run("switch window");

        assertThat(input.actions).contains("press " + KeyEvent.VK_TAB);
        assertThat(locator.activated).isEmpty();
    }

    private void run(String utterance) {
        assertThat(registry.process(utterance, ctx).executed()).as(utterance).isTrue();
    }
}
