package com.phillippitts.voicenav.service.command.handler.mouse;

import com.phillippitts.voicenav.domain.ScreenPoint;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.input.MouseButton;
import com.phillippitts.voicenav.service.parser.CommandParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/** "click 5": moves to a numbered overlay element and left-clicks it. */
public final class ClickNumberCommand extends AbstractNumberedCommand {

    private static final Logger LOG = LogManager.getLogger(ClickNumberCommand.class);

    public ClickNumberCommand(CommandParser parser) {
        super(parser, CommandPriority.HIGH, "Click on numbered overlay element",
                List.of("click 5", "click number 12", "click two"));
    }

    @Override
    public boolean matches(String text) {
        String t = clean(text);
        return t.startsWith("click") && parser.containsNumbers(t);
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
        context.getMouse().click(MouseButton.LEFT, 1);
        LOG.info("Clicked element {} at ({}, {})", number, p.x(), p.y());
        return Optional.empty();
    }
}
