package com.phillippitts.voicenav.service.command.handler.navigation;

import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;

import java.awt.event.KeyEvent;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Single-word arrow keys: "left", "right", "up", "down". */
public final class ArrowKeyCommand extends AbstractCommand {

    static final int PRIORITY = 150;

    private static final Map<String, Integer> KEYS = Map.of(
            "left", KeyEvent.VK_LEFT,
            "right", KeyEvent.VK_RIGHT,
            "up", KeyEvent.VK_UP,
            "down", KeyEvent.VK_DOWN);

    public ArrowKeyCommand() {
        super(PRIORITY, "Press arrow keys", List.of("left", "right", "up", "down"));
    }

    @Override
    public boolean matches(String text) {
        return KEYS.containsKey(clean(text));
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        Integer key = KEYS.get(clean(text));
        if (key != null) {
            context.getKeyboard().tap(key);
        }
        return Optional.empty();
    }
}
