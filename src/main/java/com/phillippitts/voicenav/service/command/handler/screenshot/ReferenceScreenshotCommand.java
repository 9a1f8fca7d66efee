package com.phillippitts.voicenav.service.command.handler.screenshot;

import com.phillippitts.voicenav.exception.CommandExecutionException;
import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.parser.CommandParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Types the absolute path of saved screenshots, newest first.
 * <ul>
 *   <li>"reference screenshot", "screenshot 2": the Nth most recent (1 is the latest)</li>
 *   <li>"screenshot last 3": the N most recent, one per line</li>
 * </ul>
 * A bare "screenshot" is left to {@link ScreenshotCommand}.
 */
public final class ReferenceScreenshotCommand extends AbstractCommand {

    private static final Logger LOG = LogManager.getLogger(ReferenceScreenshotCommand.class);

    private static final Pattern PHRASE = Pattern.compile(
            "^(?:(reference|paste|latest)\\s+)?(?:screenshot|screen\\s*shot|green\\s*shot)"
                    + "(?:\\s+(?:path|file))?(?:\\s+(last))?(?:\\s+(.+))?$");

    private final CommandParser parser;
    private final Path directory;

    public ReferenceScreenshotCommand(CommandParser parser, Path directory) {
        super(CommandPriority.MEDIUM, "Type screenshot path(s): 'screenshot 2' or 'screenshot last 3'",
                List.of("reference screenshot", "reference screenshot 2", "screenshot last 3", "green shot last 5"));
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    /** One parsed phrase: a single index, or a count of most recent screenshots. */
    record Request(boolean multiple, int number) { }

    @Override
    public boolean matches(String text) {
        return parse(text).isPresent();
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        Request request = parse(text).orElseThrow(() -> failure("unrecognized phrase '" + text + "'"));
        List<Path> screenshots = newestFirst();
        if (screenshots.isEmpty()) {
            throw failure("no screenshots in " + directory);
        }
        if (request.multiple()) {
            return Optional.of(lastN(screenshots, request.number()));
        }
        int index = request.number();
        if (index < 1 || index > screenshots.size()) {
            throw failure("screenshot " + index + " not found (" + screenshots.size() + " available)");
        }
        Path selected = screenshots.get(index - 1);
        LOG.info("Referencing screenshot #{}: {}", index, selected.getFileName());
        return Optional.of(selected.toAbsolutePath().toString());
    }

    // Package-private for tests
    Optional<Request> parse(String text) {
        Matcher m = PHRASE.matcher(clean(text));
        if (!m.matches()) {
            return Optional.empty();
        }
        boolean prefixed = m.group(1) != null;
        boolean multiple = m.group(2) != null;
        String rest = m.group(3);
        if (rest == null) {
            // "screenshot" alone takes a new one; "screenshot last" needs a count
            return prefixed && !multiple ? Optional.of(new Request(false, 1)) : Optional.empty();
        }
        List<Integer> numbers = parser.extractNumbers(rest);
        if (numbers.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(new Request(multiple, numbers.get(0)));
    }

    private String lastN(List<Path> screenshots, int count) {
        if (count < 1) {
            throw failure("screenshot count must be positive");
        }
        int available = Math.min(count, screenshots.size());
        if (available < count) {
            LOG.warn("Requested {} screenshots but only {} available", count, available);
        }
        LOG.info("Referencing last {} screenshots", available);
        return screenshots.subList(0, available).stream()
                .map(p -> p.toAbsolutePath().toString())
                .collect(Collectors.joining("\n"));
    }

    private List<Path> newestFirst() {
        if (!Files.isDirectory(directory)) {
            throw failure("screenshots directory " + directory + " does not exist");
        }
        List<Saved> saved = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path p : files.filter(ReferenceScreenshotCommand::isScreenshot).toList()) {
                saved.add(new Saved(p, Files.getLastModifiedTime(p)));
            }
        } catch (IOException e) {
            throw new CommandExecutionException(name(), "could not list " + directory, e);
        }
        // names embed the capture time, so they break ties between equal modification times
        saved.sort(Comparator.comparing(Saved::modified)
                .thenComparing(s -> s.path().getFileName().toString())
                .reversed());
        return saved.stream().map(Saved::path).toList();
    }

    private static boolean isScreenshot(Path p) {
        String name = p.getFileName().toString();
        return name.startsWith(ScreenshotCommand.FILE_PREFIX) && name.endsWith(ScreenshotCommand.FILE_SUFFIX)
                && Files.isRegularFile(p);
    }

    private record Saved(Path path, FileTime modified) { }
}
