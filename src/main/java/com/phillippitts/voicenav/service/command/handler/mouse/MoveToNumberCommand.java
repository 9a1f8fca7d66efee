package com.phillippitts.voicenav.service.command.handler.mouse;

import com.phillippitts.voicenav.domain.ScreenPoint;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.parser.CommandParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * A bare number ("5", "twelve") moves the pointer to that element without clicking.
 * Utterances starting with another command's verb are left to that command.
 */
public final class MoveToNumberCommand extends AbstractNumberedCommand {

    private static final Logger LOG = LogManager.getLogger(MoveToNumberCommand.class);

    static final List<String> EXCLUDED_PREFIXES =
            List.of("click", "refine", "type", "switch", "scroll", "move", "page");

    public MoveToNumberCommand(CommandParser parser) {
        super(parser, CommandPriority.NORMAL, "Move mouse to numbered grid cell (without clicking)",
                List.of("5", "twelve", "45"));
    }

    @Override
    public boolean matches(String text) {
        String t = clean(text);
        if (EXCLUDED_PREFIXES.stream().anyMatch(t::startsWith)) {
            return false;
        }
        return parser.containsNumbers(t);
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        List<Integer> numbers = parser.extractNumbers(text);
        if (numbers.isEmpty()) {
            throw failure("no element number in '" + text + "'");
        }
        int number = numbers.get(0);
        ScreenPoint p = position(context, number);
        context.getMouse().moveTo(p);
        LOG.info("Moved pointer to element {} at ({}, {})", number, p.x(), p.y());
        return Optional.empty();
    }
}
