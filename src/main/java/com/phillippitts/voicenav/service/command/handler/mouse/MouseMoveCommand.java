package com.phillippitts.voicenav.service.command.handler.mouse;

import com.phillippitts.voicenav.domain.ScreenPoint;
import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * "move up" / "move down": nudges the pointer vertically by 50px, doubling on repeats up to
 * 800px, clamped to the screen. Left and right belong to the window commands.
 */
public final class MouseMoveCommand extends AbstractCommand {

    private static final Logger LOG = LogManager.getLogger(MouseMoveCommand.class);

    static final int BASE_STEP = 50;
    static final int MAX_STEP = 800;

    private final RepeatScaler scaler = new RepeatScaler(MAX_STEP / BASE_STEP);

    public MouseMoveCommand() {
        super(CommandPriority.NORMAL, "Move mouse cursor up/down (with exponential scaling when repeated)",
                List.of("move up", "move down"));
    }

    @Override
    public boolean matches(String text) {
        String t = clean(text);
        return t.startsWith("move") && (t.contains("up") || t.contains("down"));
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        String t = clean(text);
        boolean up = t.contains("up");
        if (!up && !t.contains("down")) {
            return Optional.empty();
        }
        int step = BASE_STEP * scaler.next(up ? "up" : "down");
        ScreenPoint at = context.getMouse().position();
        int y = up
                ? Math.max(0, at.y() - step)
                : Math.min(context.getScreenHeight() - 1, at.y() + step);
        context.getMouse().moveTo(at.x(), y);
        LOG.debug("Moved pointer {} by {} to ({}, {})", up ? "up" : "down", step, at.x(), y);
        return Optional.empty();
    }
}
