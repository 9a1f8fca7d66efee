package com.phillippitts.voicenav.service.command.handler;

import com.phillippitts.voicenav.exception.CommandExecutionException;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandRegistry;
import com.phillippitts.voicenav.service.command.ProcessResult;
import com.phillippitts.voicenav.service.events.EventType;
import com.phillippitts.voicenav.service.input.ShortcutKeys;
import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;
import com.phillippitts.voicenav.service.overlay.OverlayKind;
import com.phillippitts.voicenav.service.overlay.ScreenGeometry;
import com.phillippitts.voicenav.service.overlay.grid.GridOverlay;
import com.phillippitts.voicenav.service.overlay.render.LoggingOverlaySurface;
import com.phillippitts.voicenav.service.overlay.render.RenderLoop;
import com.phillippitts.voicenav.service.parser.CommandParser;
import com.phillippitts.voicenav.testutil.RecordingEventBus;
import com.phillippitts.voicenav.testutil.RecordingInput;
import com.phillippitts.voicenav.testutil.TestContexts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.event.KeyEvent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Dispatches utterances through a registry holding the default command set, with a real grid
 * overlay on a 1920x1080 screen (9x9 cells of 213.33x120 px).
 */
class BuiltInCommandsTest {

    private RecordingEventBus bus;
    private RecordingInput input;
    private OverlayCoordinator overlays;
    private RenderLoop loop;
    private CommandRegistry registry;
    private CommandContext ctx;

    @BeforeEach
    void setUp() {
        bus = new RecordingEventBus();
        input = new RecordingInput();
        overlays = new OverlayCoordinator(bus);
        loop = new RenderLoop("grid-test");
        overlays.register(new GridOverlay(overlays, loop, new LoggingOverlaySurface("grid"),
                ScreenGeometry.fixed(1920, 1080), 9));
        registry = new CommandRegistry(bus);
        registry.registerAll(BuiltInCommands.create(new CommandParser(), 9));
        ctx = TestContexts.builder(input).overlays(overlays).eventBus(bus).build();
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void gridThenClickNumberClicksCellCenter() {
        run("grid");
        assertThat(overlays.isVisible(OverlayKind.GRID)).isTrue();

        run("click 5");

        assertThat(input.actions).containsExactly("move 960,60", "click LEFT x1");
    }

    @Test
    void spokenNumbersAddressCells() {
        run("grid");

        run("click twenty two");

        assertThat(input.actions).containsExactly("move 747,300", "click LEFT x1");
    }

    @Test
    void bareNumberMovesWithoutClicking() {
        run("grid");

        run("nine");

        assertThat(input.actions).containsExactly("move 1813,60");
    }

    @Test
    void numberedCommandsNeedVisibleOverlay() {
        ProcessResult result = registry.process("click 5", ctx);

        assertThat(result.executed()).isFalse();
        assertThat(input.actions).isEmpty();
        assertThat(bus.ofType(EventType.COMMAND_FAILED)).singleElement()
                .satisfies(e -> assertThat(e.get("reason")).isEqualTo("validation_failed"));
    }

    @Test
    void missingCellFailsExecution() {
        run("grid");

        assertThatThrownBy(() -> registry.process("click 99", ctx))
                .isInstanceOf(CommandExecutionException.class)
                .hasMessageContaining("element 99 not found");
    }

    @Test
    void dragPressesAtFirstCellAndReleasesAtSecond() {
        run("grid");

        run("twenty two thirty");

        assertThat(input.withoutPauses())
                .containsExactly("move 747,300", "down LEFT", "move 533,420", "up LEFT");
        assertThat(input.actions).contains("pause 100", "pause 150");
    }

    @Test
    void separatorWordIsNotReadAsANumber() {
        run("grid");

        run("twenty to thirty");
        run("five to nine");

        assertThat(input.withoutPauses()).containsExactly(
                "move 320,300", "down LEFT", "move 533,420", "up LEFT",
                "move 960,60", "down LEFT", "move 1813,60", "up LEFT");
    }

    @Test
    void hyphenatedDigitsDrag() {
        run("grid");

        run("5-9");

        assertThat(input.withoutPauses()).containsExactly("move 960,60", "down LEFT", "move 1813,60", "up LEFT");
    }

    @Test
    void refineZoomsIntoCell() {
        run("grid");

        run("refine 41");
        run("click 5");

        // cell 41 of the 9x9 grid is centered at (960, 540); the refined center cell shares it
        assertThat(input.actions).containsExactly("move 960,540", "click LEFT x1");
    }

    @Test
    void refineWithoutGridIsNotExecuted() {
        assertThat(registry.process("refine 5", ctx).executed()).isFalse();
    }

    @Test
    void closeHidesOverlayButCloseWindowPressesAltF4() {
        run("grid");

        run("close");
        assertThat(overlays.isAnyVisible()).isFalse();
        assertThat(input.actions).isEmpty();

        run("close window");
        assertThat(input.actions).containsExactly(
                "press " + KeyEvent.VK_ALT, "press " + KeyEvent.VK_F4,
                "release " + KeyEvent.VK_F4, "release " + KeyEvent.VK_ALT);
    }

    @Test
    void plainClickUsesCurrentPointer() {
        run("click");
        run("right click");
        run("double click");

        assertThat(input.actions).containsExactly("click LEFT x1", "click RIGHT x1", "click LEFT x2");
    }

    @Test
    void deleteWordOutranksDelete() {
        run("delete word");
        assertThat(input.actions).containsExactly(
                "press " + KeyEvent.VK_CONTROL, "press " + KeyEvent.VK_BACK_SPACE,
                "release " + KeyEvent.VK_BACK_SPACE, "release " + KeyEvent.VK_CONTROL);
        input.clear();

        run("delete");
        assertThat(input.actions).containsExactly(
                "press " + KeyEvent.VK_BACK_SPACE, "release " + KeyEvent.VK_BACK_SPACE);
    }

    @Test
    void copyUsesPlatformModifier() {
        run("Copy.");

        int mod = ShortcutKeys.primaryModifier();
        assertThat(input.actions).containsExactly(
                "press " + mod, "press " + KeyEvent.VK_C, "release " + KeyEvent.VK_C, "release " + mod);
    }

    @Test
    void typePrefixReturnsLiteralText() {
        assertThat(registry.process("type hello world", ctx).literal()).isEqualTo("hello world");
        assertThat(registry.process("type comma", ctx).literal()).isEqualTo(",");
        assertThat(registry.process("slash", ctx).literal()).isEqualTo("/");
        assertThat(input.actions).isEmpty();
    }

    @Test
    void arrowsPagesAndDocumentJumps() {
        run("left");
        run("page down");
        run("go to top");

        assertThat(input.actions).containsExactly(
                "press " + KeyEvent.VK_LEFT, "release " + KeyEvent.VK_LEFT,
                "press " + KeyEvent.VK_PAGE_DOWN, "release " + KeyEvent.VK_PAGE_DOWN,
                "press " + KeyEvent.VK_CONTROL, "press " + KeyEvent.VK_HOME,
                "release " + KeyEvent.VK_HOME, "release " + KeyEvent.VK_CONTROL);
    }

    @Test
    void moveLeftSnapsWindow() {
        run("move left");

        int mod = ShortcutKeys.windowModifier();
        assertThat(input.actions).containsExactly(
                "press " + mod, "press " + KeyEvent.VK_LEFT, "release " + KeyEvent.VK_LEFT, "release " + mod,
                "press " + KeyEvent.VK_ESCAPE, "release " + KeyEvent.VK_ESCAPE);
    }

    @Test
    void switchWindowPreviousAddsShift() {
        run("switch window previous");

        assertThat(input.actions).startsWith(
                "press " + KeyEvent.VK_ALT, "press " + KeyEvent.VK_SHIFT, "press " + KeyEvent.VK_TAB);
    }

    @Test
    void deleteLineSelectsAndDeletes() {
        run("delete line");

        assertThat(input.actions).containsExactly(
                "press " + KeyEvent.VK_HOME, "release " + KeyEvent.VK_HOME,
                "press " + KeyEvent.VK_SHIFT, "press " + KeyEvent.VK_END,
                "release " + KeyEvent.VK_END, "release " + KeyEvent.VK_SHIFT,
                "press " + KeyEvent.VK_DELETE, "release " + KeyEvent.VK_DELETE);
    }

    @Test
    void helpFailsWhenHelpOverlayIsNotRegistered() {
        assertThatThrownBy(() -> registry.process("help", ctx))
                .isInstanceOf(CommandExecutionException.class)
                .hasMessageContaining("help overlay could not be shown");
    }

    @Test
    void unknownSpeechIsNotExecuted() {
        ProcessResult result = registry.process("hello there", ctx);

        assertThat(result.executed()).isFalse();
        assertThat(bus.published).isEmpty();
    }

    @Test
    void helpTextListsEveryBuiltIn() {
        String help = registry.getHelpText();

        assertThat(help).startsWith("Available Commands:")
                .contains("Click on numbered overlay element")
                .contains("Snap window to the left half of the screen");
    }

    private void run(String utterance) {
        assertThat(registry.process(utterance, ctx).executed()).as(utterance).isTrue();
    }
}
