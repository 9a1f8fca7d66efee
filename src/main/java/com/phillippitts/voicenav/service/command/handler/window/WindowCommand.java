package com.phillippitts.voicenav.service.command.handler.window;

import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.input.KeyboardActions;
import com.phillippitts.voicenav.service.input.ShortcutKeys;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.event.KeyEvent;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Window management through the desktop's keyboard shortcuts: snapping, minimizing,
 * maximizing, closing and switching windows.
 */
public final class WindowCommand extends AbstractCommand {

    private static final Logger LOG = LogManager.getLogger(WindowCommand.class);

    private final String name;
    private final Predicate<String> matcher;
    private final BiConsumer<KeyboardActions, String> action;

    WindowCommand(String name, String description, List<String> examples,
                  Predicate<String> matcher, BiConsumer<KeyboardActions, String> action) {
        super(CommandPriority.MEDIUM, description, examples);
        this.name = name;
        this.matcher = matcher;
        this.action = action;
    }

    public static WindowCommand snapLeft() {
        return snap("SnapLeftCommand", "left", KeyEvent.VK_LEFT);
    }

    public static WindowCommand snapRight() {
        return snap("SnapRightCommand", "right", KeyEvent.VK_RIGHT);
    }

    private static WindowCommand snap(String name, String side, int arrow) {
        List<String> phrases = List.of("move window " + side, "move " + side, "snap " + side);
        return new WindowCommand(name, "Snap window to the " + side + " half of the screen", phrases,
                t -> phrases.stream().anyMatch(t::contains),
                (kb, t) -> {
                    kb.combination(ShortcutKeys.windowModifier(), arrow);
                    // dismiss the snap-assist picker
                    kb.tap(KeyEvent.VK_ESCAPE);
                });
    }

    public static WindowCommand minimize() {
        return new WindowCommand("MinimizeWindowCommand", "Minimize current window",
                List.of("minimize", "minimize window"),
                t -> t.contains("minimize") || t.contains("minimise"),
                (kb, t) -> kb.combination(ShortcutKeys.windowModifier(), KeyEvent.VK_DOWN));
    }

    public static WindowCommand maximize() {
        return new WindowCommand("MaximizeWindowCommand", "Maximize current window",
                List.of("maximize", "maximize window"),
                t -> t.contains("maximize") || t.contains("maximise"),
                (kb, t) -> kb.combination(ShortcutKeys.windowModifier(), KeyEvent.VK_UP));
    }

    /** "close window" only; bare "close" hides the overlay. */
    public static WindowCommand close() {
        return new WindowCommand("CloseWindowCommand", "Close current window (Alt+F4)",
                List.of("close window"),
                t -> t.contains("close window"),
                (kb, t) -> kb.combination(KeyEvent.VK_ALT, KeyEvent.VK_F4));
    }

    public static WindowCommand switchWindow() {
        return new WindowCommand("SwitchWindowCommand", "Switch between windows (Alt+Tab)",
                List.of("switch", "switch window", "switch window previous"),
                t -> "switch".equals(t) || t.contains("switch window"),
                (kb, t) -> {
                    if (t.contains("previous") || t.contains("back")) {
                        kb.combination(KeyEvent.VK_ALT, KeyEvent.VK_SHIFT, KeyEvent.VK_TAB);
                    } else {
                        kb.combination(KeyEvent.VK_ALT, KeyEvent.VK_TAB);
                    }
                });
    }

    @Override
    public boolean matches(String text) {
        return matcher.test(clean(text));
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        action.accept(context.getKeyboard(), clean(text));
        LOG.debug("Window action {}", name);
        return Optional.empty();
    }

    @Override
    public String name() {
        return name;
    }
}
