package com.phillippitts.voicenav.service.command.handler.custom;

import com.phillippitts.voicenav.exception.CommandExecutionException;
import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A user-defined command bound to one exact trigger phrase. Custom commands rank above the
 * built-in handlers so a user can override a built-in phrase.
 *
 * <p>Instances are built by {@link CustomCommandLoader}, which validates the definition.
 */
public final class CustomCommand extends AbstractCommand {

    private static final Logger LOG = LogManager.getLogger(CustomCommand.class);

    static final int DESCRIPTION_TEXT_LIMIT = 30;

    private final String trigger;
    private final CustomActionType type;
    private final String text;
    private final Path path;
    private final List<String> keyNames;
    private final int[] keyCodes;

    CustomCommand(String trigger, CustomActionType type, String text, Path path,
                  List<String> keyNames, int[] keyCodes) {
        super(CommandPriority.HIGH, describe(type, text, path, keyNames), List.of(normalize(trigger)));
        this.trigger = normalize(trigger);
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.text = text;
        this.path = path;
        this.keyNames = keyNames == null ? List.of() : List.copyOf(keyNames);
        this.keyCodes = keyCodes == null ? new int[0] : keyCodes.clone();
    }

    public String getTrigger() {
        return trigger;
    }

    public CustomActionType getType() {
        return type;
    }

    @Override
    public boolean matches(String text) {
        return trigger.equals(clean(text));
    }

    /**
     * Runs the action. A {@code TYPE_TEXT} action returns its text so the pipeline types it.
     */
    @Override
    public Optional<String> execute(CommandContext context, String spoken) {
        switch (type) {
            case TYPE_TEXT -> {
                return Optional.of(text);
            }
            case COPY_TO_CLIPBOARD -> {
                context.getClipboard().writeText(text);
                LOG.info("Custom command '{}' copied {} chars to clipboard", trigger, text.length());
            }
            case EXECUTE_FILE -> launch(context);
            case KEY_COMBINATION -> context.getKeyboard().combination(keyCodes);
            default -> throw failure("unsupported action " + type);
        }
        return Optional.empty();
    }

    @Override
    public String name() {
        return "CustomCommand[" + trigger + "]";
    }

    private void launch(CommandContext context) {
        if (!Files.exists(path)) {
            throw failure("file not found: " + path);
        }
        try {
            context.getLauncher().launch(path);
            LOG.info("Custom command '{}' launched {}", trigger, path.getFileName());
        } catch (IOException e) {
            throw new CommandExecutionException(
                    name(), "could not launch " + path + ": " + e.getMessage(), e);
        }
    }

    static String normalize(String trigger) {
        return trigger == null ? "" : trigger.trim().toLowerCase(Locale.ROOT);
    }

    // at most DESCRIPTION_TEXT_LIMIT chars including the ellipsis
    private static String shorten(String text) {
        if (text == null || text.length() <= DESCRIPTION_TEXT_LIMIT) {
            return text == null ? "" : text;
        }
        return LogSanitizer.abbreviate(text, DESCRIPTION_TEXT_LIMIT - 3);
    }

    private static String describe(CustomActionType type, String text, Path path, List<String> keys) {
        return switch (type) {
            case TYPE_TEXT -> "Type: " + shorten(text);
            case COPY_TO_CLIPBOARD -> "Copy: " + shorten(text);
            case EXECUTE_FILE -> "Run: " + (path == null || path.getFileName() == null ? "" : path.getFileName());
            case KEY_COMBINATION -> "Press: " + String.join("+", keys == null ? List.of() : keys);
        };
    }
}
