package com.phillippitts.voicenav.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * User-defined voice commands.
 *
 * <pre>
 * custom-commands.commands[0].trigger=admin user
 * custom-commands.commands[0].action.type=type-text
 * custom-commands.commands[0].action.text=administrator
 * </pre>
 *
 * Entries are checked when commands are built, not at binding: an invalid entry is skipped
 * rather than failing startup.
 */
@Validated
@ConfigurationProperties(prefix = "custom-commands")
public class CustomCommandsProperties {

    private final boolean enabled;
    private final List<Definition> commands;

    @ConstructorBinding
    public CustomCommandsProperties(Boolean enabled, List<Definition> commands) {
        this.enabled = enabled == null || enabled;
        this.commands = commands == null ? List.of() : List.copyOf(commands);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<Definition> getCommands() {
        return commands;
    }

    /** One trigger phrase and the action it runs. */
    public record Definition(String trigger, Action action) { }

    /**
     * Action parameters. {@code type} is one of {@code type-text}, {@code copy-to-clipboard},
     * {@code execute-file}, {@code key-combination}; only the fields of that type are read.
     */
    public record Action(String type, String text, String path, List<String> keys) {
        public Action {
            keys = keys == null ? List.of() : List.copyOf(keys);
        }
    }
}
