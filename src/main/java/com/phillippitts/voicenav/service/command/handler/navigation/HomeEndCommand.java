package com.phillippitts.voicenav.service.command.handler.navigation;

import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.input.KeyboardActions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.event.KeyEvent;
import java.util.List;
import java.util.Optional;

/**
 * Jumps to the start or end of the document ("go to top", "go to end") or of the line
 * ("line start", "line end").
 */
public final class HomeEndCommand extends AbstractCommand {

    private static final Logger LOG = LogManager.getLogger(HomeEndCommand.class);

    private static final List<String> DOCUMENT_START = List.of("go to start", "go to top", "go to beginning");
    private static final List<String> DOCUMENT_END = List.of("go to end", "go to bottom");

    public HomeEndCommand() {
        super(CommandPriority.MEDIUM, "Jump to start or end of line or document",
                List.of("go to start", "go to end", "line start", "line end"));
    }

    @Override
    public boolean matches(String text) {
        String t = clean(text);
        return "line start".equals(t) || "line end".equals(t)
                || DOCUMENT_START.stream().anyMatch(t::contains)
                || DOCUMENT_END.stream().anyMatch(t::contains);
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        String t = clean(text);
        KeyboardActions kb = context.getKeyboard();
        String action;
        if ("line start".equals(t)) {
            kb.tap(KeyEvent.VK_HOME);
            action = "line_start";
        } else if ("line end".equals(t)) {
            kb.tap(KeyEvent.VK_END);
            action = "line_end";
        } else if (DOCUMENT_START.stream().anyMatch(t::contains)) {
            kb.combination(KeyEvent.VK_CONTROL, KeyEvent.VK_HOME);
            action = "document_start";
        } else if (DOCUMENT_END.stream().anyMatch(t::contains)) {
            kb.combination(KeyEvent.VK_CONTROL, KeyEvent.VK_END);
            action = "document_end";
        } else {
            return Optional.empty();
        }
        LOG.debug("Home/End action {}", action);
        return Optional.empty();
    }
}
