package com.phillippitts.voicenav.service.command.handler.mouse;

import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.input.MouseButton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/** Clicks at the current pointer position on an exact trigger phrase. */
public final class MouseClickCommand extends AbstractCommand {

    private static final Logger LOG = LogManager.getLogger(MouseClickCommand.class);

    private final String name;
    private final List<String> triggers;
    private final MouseButton button;
    private final int count;

    public MouseClickCommand(String name, List<String> triggers, MouseButton button, int count,
                             int priority, String description) {
        super(priority, description, triggers);
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        this.name = name;
        this.triggers = List.copyOf(triggers);
        this.button = button;
        this.count = count;
    }

    public static MouseClickCommand click() {
        return new MouseClickCommand("ClickCommand", List.of("click"), MouseButton.LEFT, 1,
                CommandPriority.NORMAL, "Left click at current mouse position");
    }

    public static MouseClickCommand rightClick() {
        return new MouseClickCommand("RightClickCommand", List.of("right click"), MouseButton.RIGHT, 1,
                CommandPriority.MEDIUM, "Right click at current mouse position");
    }

    public static MouseClickCommand doubleClick() {
        return new MouseClickCommand("DoubleClickCommand", List.of("double click"), MouseButton.LEFT, 2,
                CommandPriority.MEDIUM, "Double click at current mouse position");
    }

    public static MouseClickCommand middleClick() {
        return new MouseClickCommand("MiddleClickCommand", List.of("middle click", "wheel click"),
                MouseButton.MIDDLE, 1, CommandPriority.MEDIUM, "Middle click at current mouse position");
    }

    @Override
    public boolean matches(String text) {
        return triggers.contains(clean(text));
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        context.getMouse().click(button, count);
        LOG.debug("{} click x{}", button, count);
        return Optional.empty();
    }

    @Override
    public String name() {
        return name;
    }
}
