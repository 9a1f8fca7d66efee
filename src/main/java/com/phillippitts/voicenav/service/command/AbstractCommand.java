package com.phillippitts.voicenav.service.command;

import com.phillippitts.voicenav.exception.CommandExecutionException;
import com.phillippitts.voicenav.service.parser.CommandParser;

import java.util.List;

/**
 * Base class holding the static metadata of a command and small helpers shared by the
 * built-in handlers.
 */
public abstract class AbstractCommand implements Command {

    private final int priority;
    private final String description;
    private final List<String> examples;

    protected AbstractCommand(int priority, String description, List<String> examples) {
        this.priority = priority;
        this.description = description;
        this.examples = List.copyOf(examples);
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public List<String> examples() {
        return examples;
    }

    /** Lowercased text without punctuation, as compared against trigger phrases. */
    protected static String clean(String text) {
        return CommandParser.stripPunctuation(text);
    }

    protected CommandExecutionException failure(String reason) {
        return new CommandExecutionException(name(), reason);
    }

    @Override
    public String toString() {
        return name() + "[priority=" + priority + "]";
    }
}
