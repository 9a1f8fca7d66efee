package com.phillippitts.voicenav.service.command.handler.navigation;

import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;

import java.awt.event.KeyEvent;
import java.util.List;
import java.util.Optional;

/** "page up" / "page down" anywhere in the utterance. */
public final class PageNavigationCommand extends AbstractCommand {

    public PageNavigationCommand() {
        super(CommandPriority.MEDIUM, "Navigate by page", List.of("page up", "page down"));
    }

    @Override
    public boolean matches(String text) {
        String t = clean(text);
        return t.contains("page up") || t.contains("page down");
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        int key = clean(text).contains("page up") ? KeyEvent.VK_PAGE_UP : KeyEvent.VK_PAGE_DOWN;
        context.getKeyboard().tap(key);
        return Optional.empty();
    }
}
