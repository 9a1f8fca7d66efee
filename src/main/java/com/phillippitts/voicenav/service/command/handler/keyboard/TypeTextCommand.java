package com.phillippitts.voicenav.service.command.handler.keyboard;

import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;

import java.util.List;
import java.util.Optional;

/**
 * "type &lt;text&gt;": returns the text after the prefix so it is typed literally instead of
 * being interpreted as a command.
 */
public final class TypeTextCommand extends AbstractCommand {

    static final String PREFIX = "type ";

    public TypeTextCommand() {
        super(CommandPriority.HIGH, "Type text with 'type' prefix stripped",
                List.of("type hello world", "type investigate why"));
    }

    @Override
    public boolean matches(String text) {
        return clean(text).startsWith(PREFIX);
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        String rest = clean(text).substring(PREFIX.length()).trim();
        return rest.isEmpty() ? Optional.empty() : Optional.of(rest);
    }
}
