package com.phillippitts.voicenav.service.command;

import com.phillippitts.voicenav.exception.CommandExecutionException;
import com.phillippitts.voicenav.service.events.EventBus;
import com.phillippitts.voicenav.service.events.EventType;
import com.phillippitts.voicenav.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Priority-ordered set of commands, and the dispatcher that runs the first one matching an
 * utterance.
 *
 * <p>The command list is kept sorted by descending priority; commands with equal priority keep
 * their registration order. Readers always see a consistent sorted snapshot.
 *
 * <p>Dispatch publishes, in order: {@link EventType#COMMAND_DETECTED} once a command matched,
 * then exactly one of {@link EventType#COMMAND_EXECUTED} or {@link EventType#COMMAND_FAILED}.
 * Failure reasons are {@code validation_failed}, {@code validation_error},
 * {@code execution_error} and {@code unexpected_error}.
 */
public class CommandRegistry {

    private static final Logger LOG = LogManager.getLogger(CommandRegistry.class);

    private static final Comparator<Command> BY_PRIORITY_DESC =
            Comparator.comparingInt(Command::priority).reversed();

    private final EventBus eventBus;
    private final Object writeLock = new Object();
    private volatile List<Command> commands = List.of();

    public CommandRegistry(EventBus eventBus) {
        this.eventBus = eventBus; // may be null
    }

    public void register(Command command) {
        Objects.requireNonNull(command, "command must not be null");
        synchronized (writeLock) {
            List<Command> next = new ArrayList<>(commands);
            next.add(command);
            // List.sort is stable: equal priorities keep registration order
            next.sort(BY_PRIORITY_DESC);
            commands = List.copyOf(next);
        }
        LOG.debug("Registered {} (priority {})", command.name(), command.priority());
    }

    public void registerAll(List<? extends Command> toRegister) {
        toRegister.forEach(this::register);
    }

    /** Removes the given instance. */
    public boolean unregister(Command command) {
        synchronized (writeLock) {
            List<Command> next = new ArrayList<>(commands);
            boolean removed = next.removeIf(c -> c == command);
            if (removed) {
                commands = List.copyOf(next);
            }
            return removed;
        }
    }

    public void clear() {
        synchronized (writeLock) {
            commands = List.of();
        }
    }

    /** Commands in dispatch order. */
    public List<Command> getCommands() {
        return getCommands(false);
    }

    public List<Command> getCommands(boolean enabledOnly) {
        List<Command> snapshot = commands;
        if (!enabledOnly) {
            return snapshot;
        }
        return snapshot.stream().filter(Command::isEnabled).collect(Collectors.toUnmodifiableList());
    }

    public int getCommandCount() {
        return commands.size();
    }

    public int getCommandCount(boolean enabledOnly) {
        return getCommands(enabledOnly).size();
    }

    public Optional<Command> findMatching(String text) {
        return findMatching(text, true);
    }

    /**
     * First command in priority order whose matcher accepts the text. A matcher that throws is
     * logged and treated as not matching.
     */
    public Optional<Command> findMatching(String text, boolean enabledOnly) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Command c : commands) {
            if (enabledOnly && !c.isEnabled()) {
                continue;
            }
            try {
                if (c.matches(text)) {
                    return Optional.of(c);
                }
            } catch (RuntimeException e) {
                LOG.warn("Matcher of {} failed: {}", c.name(), e.toString());
            }
        }
        return Optional.empty();
    }

    public ProcessResult process(String text, CommandContext context) {
        return process(text, context, true);
    }

    /**
     * Finds and runs the command for an utterance.
     *
     * @return {@link ProcessResult#notExecuted()} when nothing matched or validation failed
     * @throws CommandExecutionException when the matched command failed; unexpected runtime
     *         exceptions are wrapped with the command's name
     */
    public ProcessResult process(String text, CommandContext context, boolean enabledOnly) {
        Optional<Command> match = findMatching(text, enabledOnly);
        if (match.isEmpty()) {
            LOG.debug("No command matched '{}'", LogSanitizer.truncate(text, 60));
            return ProcessResult.notExecuted();
        }
        Command command = match.get();
        publish(EventType.COMMAND_DETECTED, command, text, "priority", command.priority());

        try {
            if (!command.validate(context, text)) {
                LOG.info("Command {} failed validation", command.name());
                publish(EventType.COMMAND_FAILED, command, text, "reason", "validation_failed");
                return ProcessResult.notExecuted();
            }
        } catch (RuntimeException e) {
            LOG.warn("Validation of {} threw: {}", command.name(), e.toString());
            Map<String, Object> data = payload(command, text);
            data.put("reason", "validation_error");
            data.put("error", e.toString());
            publish(EventType.COMMAND_FAILED, data);
            return ProcessResult.notExecuted();
        }

        Optional<String> result;
        try {
            result = Objects.requireNonNullElse(command.execute(context, text), Optional.empty());
        } catch (CommandExecutionException e) {
            Map<String, Object> data = payload(command, text);
            data.put("reason", "execution_error");
            data.put("error", e.getMessage());
            publish(EventType.COMMAND_FAILED, data);
            throw e;
        } catch (RuntimeException e) {
            Map<String, Object> data = payload(command, text);
            data.put("reason", "unexpected_error");
            data.put("error", e.toString());
            publish(EventType.COMMAND_FAILED, data);
            throw new CommandExecutionException(command.name(), String.valueOf(e.getMessage()), e);
        }

        LOG.info("Executed {}", command.name());
        publish(EventType.COMMAND_EXECUTED, command, text, "result", result.orElse(null));
        return ProcessResult.executed(result);
    }

    /**
     * Human-readable listing of the registered commands in dispatch order.
     */
    public String getHelpText() {
        return getHelpText(true);
    }

    public String getHelpText(boolean enabledOnly) {
        List<Command> list = getCommands(enabledOnly);
        if (list.isEmpty()) {
            return "No commands registered.";
        }
        List<String> lines = new ArrayList<>();
        lines.add("Available Commands:");
        lines.add("");
        for (Command c : list) {
            lines.add("• " + c.description());
            if (!c.examples().isEmpty()) {
                lines.add("  Examples: " + c.examples().stream()
                        .map(e -> "\"" + e + "\"")
                        .collect(Collectors.joining(", ")));
            }
            lines.add("  Priority: " + c.priority());
            lines.add("");
        }
        return String.join("\n", lines);
    }

    private Map<String, Object> payload(Command command, String text) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("command", command.name());
        data.put("text", text);
        return data;
    }

    private void publish(EventType type, Command command, String text, String key, Object value) {
        Map<String, Object> data = payload(command, text);
        data.put(key, value);
        publish(type, data);
    }

    private void publish(EventType type, Map<String, Object> data) {
        if (eventBus != null) {
            eventBus.publish(type, data);
        }
    }
}
