package com.phillippitts.voicenav.service.command.handler.keyboard;

import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.input.KeyboardActions;

import java.awt.event.KeyEvent;
import java.util.List;
import java.util.Optional;

/** Selects the current line (Home, Shift+End) and deletes it. */
public final class DeleteLineCommand extends AbstractCommand {

    public DeleteLineCommand() {
        super(CommandPriority.HIGH, "Delete current line", List.of("delete line"));
    }

    @Override
    public boolean matches(String text) {
        return "delete line".equals(clean(text));
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        KeyboardActions kb = context.getKeyboard();
        kb.tap(KeyEvent.VK_HOME);
        kb.combination(KeyEvent.VK_SHIFT, KeyEvent.VK_END);
        kb.tap(KeyEvent.VK_DELETE);
        return Optional.empty();
    }
}
