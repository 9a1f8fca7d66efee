package com.phillippitts.voicenav.service.command.handler.mouse;

import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * "scroll up/down/left/right". Repeating the same direction doubles the distance
 * (3, 6, 12, ... notches, multiplier capped at 16); any other direction starts over.
 */
public final class ScrollCommand extends AbstractCommand {

    private static final Logger LOG = LogManager.getLogger(ScrollCommand.class);

    static final int BASE_SCROLL = 3;
    static final int MAX_MULTIPLIER = 16;
    private static final List<String> DIRECTIONS = List.of("up", "down", "left", "right");

    private final RepeatScaler scaler = new RepeatScaler(MAX_MULTIPLIER);

    public ScrollCommand() {
        super(CommandPriority.NORMAL, "Scroll in specified direction (with exponential scaling when repeated)",
                List.of("scroll up", "scroll down", "scroll left", "scroll right"));
    }

    @Override
    public boolean matches(String text) {
        String t = clean(text);
        return t.startsWith("scroll") && direction(t).isPresent();
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        Optional<String> direction = direction(clean(text));
        if (direction.isEmpty()) {
            return Optional.empty();
        }
        int amount = BASE_SCROLL * scaler.next(direction.get());
        switch (direction.get()) {
            case "up" -> context.getMouse().scroll(0, -amount);
            case "down" -> context.getMouse().scroll(0, amount);
            case "left" -> context.getMouse().scroll(-amount, 0);
            default -> context.getMouse().scroll(amount, 0);
        }
        LOG.debug("Scrolled {} by {}", direction.get(), amount);
        return Optional.empty();
    }

    // first listed direction contained in the text, as substring
    private static Optional<String> direction(String cleaned) {
        return DIRECTIONS.stream().filter(cleaned::contains).findFirst();
    }
}
