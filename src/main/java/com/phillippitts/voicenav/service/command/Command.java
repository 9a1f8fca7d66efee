package com.phillippitts.voicenav.service.command;

import com.phillippitts.voicenav.exception.CommandExecutionException;

import java.util.List;
import java.util.Optional;

/**
 * A voice command: a matcher over transcribed text plus the action to run when it matches.
 *
 * <p>Commands are tried by {@link CommandRegistry} in descending {@link #priority()} order and
 * the first match wins. {@link #matches} must be free of side effects.
 */
public interface Command {

    boolean matches(String text);

    /**
     * Performs the action.
     *
     * @return literal text to type into the focused application, or empty
     * @throws CommandExecutionException if the action could not be completed
     */
    Optional<String> execute(CommandContext context, String text);

    int priority();

    /** One-line description for help listings. */
    String description();

    default List<String> examples() {
        return List.of();
    }

    default boolean isEnabled() {
        return true;
    }

    /**
     * Checks runtime preconditions (e.g. an overlay is visible) after matching and before
     * execution. Returning false reports a validation failure without executing.
     */
    default boolean validate(CommandContext context, String text) {
        return true;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
