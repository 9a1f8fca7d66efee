package com.phillippitts.voicenav.service.command;

import java.util.Optional;

/**
 * Outcome of {@link CommandRegistry#process}: whether a command executed and the literal text
 * it asked to have typed, if any.
 */
public record ProcessResult(boolean executed, String literal) {

    private static final ProcessResult NOT_EXECUTED = new ProcessResult(false, null);

    public static ProcessResult notExecuted() {
        return NOT_EXECUTED;
    }

    public static ProcessResult executed(Optional<String> literal) {
        return new ProcessResult(true, literal.orElse(null));
    }

    public Optional<String> literalText() {
        return Optional.ofNullable(literal);
    }
}
