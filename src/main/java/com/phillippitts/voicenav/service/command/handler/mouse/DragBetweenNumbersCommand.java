package com.phillippitts.voicenav.service.command.handler.mouse;

import com.phillippitts.voicenav.domain.ScreenPoint;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.input.MouseActions;
import com.phillippitts.voicenav.service.input.MouseButton;
import com.phillippitts.voicenav.service.parser.CommandParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * "5 to 9", "twenty to thirty", "twenty two thirty", "5-9": presses at the first element, drags
 * to the second and releases.
 *
 * <p>When a separator ("to", "too", "through", "-") splits the text into two sides holding one
 * number each, those are the endpoints, so the separator is never read as a 2. Otherwise the
 * whole text must yield exactly two numbers.
 */
public final class DragBetweenNumbersCommand extends AbstractNumberedCommand {

    private static final Logger LOG = LogManager.getLogger(DragBetweenNumbersCommand.class);

    static final int SETTLE_MS = 100;
    static final int PRESS_MS = 150;
    static final int RELEASE_MS = 150;

    private static final Pattern SEPARATOR = Pattern.compile("\\s+(?:to|too|through)\\s+|\\s*-\\s*");

    public DragBetweenNumbersCommand(CommandParser parser) {
        super(parser, CommandPriority.HIGH, "Click and drag from one grid cell to another",
                List.of("5 to 9", "twenty to thirty", "45 to 52"));
    }

    @Override
    public boolean matches(String text) {
        // hyphens are significant here, so only case and edges are normalized
        String t = text.toLowerCase(Locale.ROOT).trim();
        boolean separated = SEPARATOR.matcher(t).find() || t.contains(" two ");
        return separated && endpoints(t).size() == 2;
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        List<Integer> numbers = endpoints(text.toLowerCase(Locale.ROOT).trim());
        if (numbers.size() != 2) {
            throw failure("expected two element numbers in '" + text + "'");
        }
        ScreenPoint from = position(context, numbers.get(0));
        ScreenPoint to = position(context, numbers.get(1));

        MouseActions mouse = context.getMouse();
        mouse.moveTo(from);
        mouse.pause(SETTLE_MS);
        mouse.press(MouseButton.LEFT);
        mouse.pause(PRESS_MS);
        mouse.moveTo(to);
        mouse.pause(RELEASE_MS);
        mouse.release(MouseButton.LEFT);
        LOG.info("Dragged from element {} to {}", numbers.get(0), numbers.get(1));
        return Optional.empty();
    }

    // Package-private for tests
    List<Integer> endpoints(String text) {
        String[] sides = SEPARATOR.split(text, 2);
        if (sides.length == 2) {
            List<Integer> from = parser.extractNumbers(sides[0]);
            List<Integer> to = parser.extractNumbers(sides[1]);
            if (from.size() == 1 && to.size() == 1) {
                return List.of(from.get(0), to.get(0));
            }
        }
        return parser.extractNumbers(text);
    }
}
