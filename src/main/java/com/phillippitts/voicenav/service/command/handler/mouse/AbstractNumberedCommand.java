package com.phillippitts.voicenav.service.command.handler.mouse;

import com.phillippitts.voicenav.domain.ScreenPoint;
import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;
import com.phillippitts.voicenav.service.parser.CommandParser;

import java.util.List;
import java.util.Objects;

/**
 * Base for commands that address numbered overlay elements. They are valid only while an
 * overlay is visible.
 */
abstract class AbstractNumberedCommand extends AbstractCommand {

    protected final CommandParser parser;

    AbstractNumberedCommand(CommandParser parser, int priority, String description, List<String> examples) {
        super(priority, description, examples);
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    @Override
    public boolean validate(CommandContext context, String text) {
        return context.getOverlays().map(OverlayCoordinator::isAnyVisible).orElse(false);
    }

    /** Position of a numbered element, or a failure naming the missing number. */
    protected ScreenPoint position(CommandContext context, int number) {
        return context.getOverlays()
                .flatMap(o -> o.getElementPosition(number))
                .orElseThrow(() -> failure("element " + number + " not found"));
    }
}
