package com.phillippitts.voicenav.service.command.handler.custom;

import com.phillippitts.voicenav.config.properties.CustomCommandsProperties;
import com.phillippitts.voicenav.config.properties.CustomCommandsProperties.Action;
import com.phillippitts.voicenav.config.properties.CustomCommandsProperties.Definition;
import com.phillippitts.voicenav.exception.InvalidCommandConfigurationException;
import com.phillippitts.voicenav.service.hotkey.KeyNameMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Builds {@link CustomCommand}s from configuration. Each entry is validated on its own; an
 * invalid entry is logged and skipped so the remaining commands still load.
 */
public class CustomCommandLoader {

    private static final Logger LOG = LogManager.getLogger(CustomCommandLoader.class);

    private final EnvironmentExpander expander;

    public CustomCommandLoader() {
        this(EnvironmentExpander.system());
    }

    // Package-private for tests
    CustomCommandLoader(EnvironmentExpander expander) {
        this.expander = expander;
    }

    public List<CustomCommand> load(CustomCommandsProperties properties) {
        if (!properties.isEnabled()) {
            LOG.info("Custom commands disabled");
            return List.of();
        }
        List<CustomCommand> loaded = new ArrayList<>();
        for (Definition definition : properties.getCommands()) {
            try {
                loaded.add(build(definition));
            } catch (InvalidCommandConfigurationException e) {
                LOG.warn("Skipping custom command: {}", e.getMessage());
            }
        }
        LOG.info("Loaded {} of {} custom commands", loaded.size(), properties.getCommands().size());
        return List.copyOf(loaded);
    }

    /**
     * @throws InvalidCommandConfigurationException if the trigger is blank, the action type is
     *         unknown, or the type's required field is missing or malformed
     */
    public CustomCommand build(Definition definition) {
        String trigger = definition == null ? null : definition.trigger();
        if (trigger == null || trigger.isBlank()) {
            throw new InvalidCommandConfigurationException(String.valueOf(trigger), "trigger must not be blank");
        }
        Action action = definition.action();
        if (action == null) {
            throw new InvalidCommandConfigurationException(trigger, "action is missing");
        }
        CustomActionType type = CustomActionType.fromConfig(action.type())
                .orElseThrow(() -> new InvalidCommandConfigurationException(trigger,
                        "unknown action type '" + action.type() + "'"));

        return switch (type) {
            case TYPE_TEXT, COPY_TO_CLIPBOARD -> {
                if (action.text() == null || action.text().isEmpty()) {
                    throw new InvalidCommandConfigurationException(trigger, "text is required for " + action.type());
                }
                yield new CustomCommand(trigger, type, action.text(), null, List.of(), null);
            }
            case EXECUTE_FILE -> new CustomCommand(trigger, type, null, resolvePath(trigger, action.path()),
                    List.of(), null);
            case KEY_COMBINATION -> new CustomCommand(trigger, type, null, null, action.keys(),
                    keyCodes(trigger, action.keys()));
        };
    }

    private Path resolvePath(String trigger, String configured) {
        if (configured == null || configured.isBlank()) {
            throw new InvalidCommandConfigurationException(trigger, "path is required for execute-file");
        }
        String expanded = expander.expand(configured.trim());
        try {
            return Path.of(expanded);
        } catch (InvalidPathException e) {
            throw new InvalidCommandConfigurationException(trigger, "invalid path '" + expanded + "'");
        }
    }

    private static int[] keyCodes(String trigger, List<String> keys) {
        if (keys.isEmpty()) {
            throw new InvalidCommandConfigurationException(trigger, "keys are required for key-combination");
        }
        int[] codes = new int[keys.size()];
        for (int i = 0; i < codes.length; i++) {
            OptionalInt code = KeyNameMapper.toKeyCode(keys.get(i));
            if (code.isEmpty()) {
                throw new InvalidCommandConfigurationException(trigger, "unknown key '" + keys.get(i) + "'");
            }
            codes[i] = code.getAsInt();
        }
        return codes;
    }
}
