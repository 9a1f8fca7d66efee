package com.phillippitts.voicenav.service.command.handler.window;

import com.phillippitts.voicenav.exception.CommandExecutionException;
import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;
import com.phillippitts.voicenav.service.overlay.OverlayKind;
import com.phillippitts.voicenav.service.overlay.window.WindowInfo;
import com.phillippitts.voicenav.service.overlay.window.WindowListOverlay;
import com.phillippitts.voicenav.service.parser.CommandParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "switch window 3", "switch to window three", "window 3": activates an entry of the visible
 * window list and hides the list. Valid only while the window list is shown.
 */
public final class SwitchToWindowCommand extends AbstractCommand {

    private static final Logger LOG = LogManager.getLogger(SwitchToWindowCommand.class);

    // only the words after "window" are searched, so "to" is not read as a 2
    private static final Pattern PHRASE = Pattern.compile("^(?:switch\\s+(?:to\\s+)?)?window\\s+(.+)$");

    private final CommandParser parser;

    public SwitchToWindowCommand(CommandParser parser) {
        super(CommandPriority.HIGH, "Switch to a window from the numbered window list",
                List.of("switch window 3", "switch to window three", "window 2"));
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    @Override
    public boolean matches(String text) {
        return number(text).isPresent();
    }

    @Override
    public boolean validate(CommandContext context, String text) {
        return context.getOverlays().map(o -> o.isVisible(OverlayKind.WINDOW)).orElse(false);
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        int number = number(text).orElseThrow(() -> failure("no window number in '" + text + "'"));
        OverlayCoordinator overlays = context.getOverlays().orElseThrow(() -> failure("no overlays"));
        WindowListOverlay list = overlays.getOverlay(OverlayKind.WINDOW)
                .filter(WindowListOverlay.class::isInstance)
                .map(WindowListOverlay.class::cast)
                .orElseThrow(() -> failure("window list not registered"));
        WindowInfo target = list.window(number).orElseThrow(() -> failure("window " + number + " not found"));

        overlays.hide(OverlayKind.WINDOW);
        try {
            list.activate(target);
        } catch (IOException e) {
            throw new CommandExecutionException(name(), "could not activate window " + number, e);
        }
        LOG.info("Switched to window {}", number);
        return Optional.empty();
    }

    private Optional<Integer> number(String text) {
        Matcher m = PHRASE.matcher(clean(text));
        if (!m.matches()) {
            return Optional.empty();
        }
        List<Integer> numbers = parser.extractNumbers(m.group(1));
        return numbers.size() == 1 ? Optional.of(numbers.get(0)) : Optional.empty();
    }
}
