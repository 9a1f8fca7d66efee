package com.phillippitts.voicenav.service.command.handler.mouse;

import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.overlay.OverlayKind;
import com.phillippitts.voicenav.service.parser.CommandParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/** "refine 45": zooms the visible grid into a 3x3 subdivision of the named cell. */
public final class RefineGridCommand extends AbstractNumberedCommand {

    private static final Logger LOG = LogManager.getLogger(RefineGridCommand.class);

    public RefineGridCommand(CommandParser parser) {
        super(parser, CommandPriority.HIGH, "Zoom into grid cell with 3x3 subdivision",
                List.of("refine 5", "refine grid 45", "refine twelve"));
    }

    @Override
    public boolean matches(String text) {
        String t = clean(text);
        return t.startsWith("refine") && parser.containsNumbers(t);
    }

    @Override
    public boolean validate(CommandContext context, String text) {
        return context.getOverlays().map(o -> o.isVisible(OverlayKind.GRID)).orElse(false);
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        List<Integer> numbers = parser.extractNumbers(text);
        if (numbers.isEmpty()) {
            throw failure("no cell number in '" + text + "'");
        }
        int cell = numbers.get(0);
        boolean refined = context.getOverlays().map(o -> o.refine(cell)).orElse(false);
        if (!refined) {
            throw failure("cell " + cell + " is not on the grid");
        }
        LOG.info("Refined grid into cell {}", cell);
        return Optional.empty();
    }
}
