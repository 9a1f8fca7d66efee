package com.phillippitts.voicenav.service.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Text utilities for spoken commands: normalization, number extraction with homophone
 * support, fuzzy comparison and stop-word filtering.
 *
 * <p>Malformed input never raises; it degrades to empty results.
 *
 * <p>Thread-safe: instances are immutable.
 */
public class CommandParser {

    public static final Set<String> DEFAULT_IGNORED_WORDS = Set.of("thank", "you", "thanks", "please");
    public static final double DEFAULT_FUZZY_THRESHOLD = 0.8;

    private static final int MAX_DIGITS = 9;
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NOT_WORD = Pattern.compile("[^\\p{L}\\p{N}_\\s\\-']");
    private static final Pattern STRIPPED = Pattern.compile("[.!?,;:\"(){}\\[\\]<>/@#$%^&*+=~`|\\\\“”‘’]");
    private static final Pattern TOKEN_EDGES = Pattern.compile("[.,!?;:]");

    private final NumberMappings numbers;
    private final Set<String> ignoredWords;
    private final double fuzzyThreshold;

    public CommandParser() {
        this(NumberMappings.builtIn(), DEFAULT_IGNORED_WORDS, DEFAULT_FUZZY_THRESHOLD);
    }

    public CommandParser(NumberMappings numbers, Set<String> ignoredWords, double fuzzyThreshold) {
        this.numbers = Objects.requireNonNull(numbers, "numbers must not be null");
        this.ignoredWords = ignoredWords == null ? DEFAULT_IGNORED_WORDS
                : ignoredWords.stream().map(w -> w.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
        this.fuzzyThreshold = fuzzyThreshold;
    }

    /**
     * Removes command-irrelevant punctuation, lowercases and trims. Hyphens and apostrophes
     * are kept. Used by commands before comparing against their trigger phrases.
     */
    public static String stripPunctuation(String text) {
        if (text == null) {
            return "";
        }
        return STRIPPED.matcher(text).replaceAll("").toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Lowercases, removes punctuation other than hyphen and apostrophe, collapses runs of
     * whitespace and trims. Idempotent.
     */
    public String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String cleaned = NOT_WORD.matcher(lower).replaceAll("");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    /**
     * Extracts the numbers mentioned in the text. Digit runs win: when any are present only
     * they are returned. Otherwise each whitespace token is looked up in the number
     * dictionary, and a tens word followed by a units word ("sixty nine") merges into one value.
     *
     * @return numbers in order of appearance; empty when none are found
     */
    public List<Integer> extractNumbers(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Integer> digits = new ArrayList<>();
        Matcher m = DIGITS.matcher(text);
        while (m.find()) {
            // runs too long for an int are not addressable
            if (m.group().length() <= MAX_DIGITS) {
                digits.add(Integer.parseInt(m.group()));
            }
        }
        if (!digits.isEmpty()) {
            return List.copyOf(digits);
        }

        String[] words = tokens(text);
        List<Integer> result = new ArrayList<>();
        int i = 0;
        while (i < words.length) {
            Optional<Integer> value = numbers.valueOf(words[i]);
            if (value.isEmpty()) {
                i++;
                continue;
            }
            int v = value.get();
            if (isTens(v) && i + 1 < words.length) {
                Optional<Integer> next = numbers.valueOf(words[i + 1]);
                if (next.isPresent() && next.get() >= 1 && next.get() <= 9) {
                    result.add(v + next.get());
                    i += 2;
                    continue;
                }
            }
            result.add(v);
            i++;
        }
        return List.copyOf(result);
    }

    /** True if the text contains a digit or any word of the number dictionary. */
    public boolean containsNumbers(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        if (DIGITS.matcher(text).find()) {
            return true;
        }
        return Arrays.stream(tokens(text)).anyMatch(numbers::contains);
    }

    /** True if the whole trimmed text is a single digit run or a single number word. */
    public boolean isLoneNumber(String text) {
        return parseNumber(text).isPresent();
    }

    /** Parses text that consists of exactly one number. */
    public OptionalInt parseNumber(String text) {
        if (text == null) {
            return OptionalInt.empty();
        }
        String t = stripPunctuation(text);
        if (t.isEmpty()) {
            return OptionalInt.empty();
        }
        if (t.chars().allMatch(Character::isDigit)) {
            return t.length() <= MAX_DIGITS ? OptionalInt.of(Integer.parseInt(t)) : OptionalInt.empty();
        }
        return numbers.valueOf(t).map(OptionalInt::of).orElse(OptionalInt.empty());
    }

    /** Ratcliff/Obershelp similarity in [0, 1]; both inputs are normalized first. */
    public double fuzzyMatch(String a, String b) {
        return fuzzyMatch(a, b, true);
    }

    public double fuzzyMatch(String a, String b, boolean normalize) {
        String x = a == null ? "" : a;
        String y = b == null ? "" : b;
        if (normalize) {
            x = normalizeText(x);
            y = normalizeText(y);
        }
        return SequenceSimilarity.ratio(x, y);
    }

    public boolean isFuzzyMatch(String a, String b) {
        return isFuzzyMatch(a, b, fuzzyThreshold);
    }

    public boolean isFuzzyMatch(String a, String b, double threshold) {
        return fuzzyMatch(a, b) >= threshold;
    }

    /**
     * Drops polite filler words ("please", "thank you"). A token is compared after trailing
     * sentence punctuation is removed; surviving tokens keep their original form.
     */
    public String filterIgnoredWords(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return Arrays.stream(WHITESPACE.split(text.trim()))
                .filter(w -> !ignoredWords.contains(TOKEN_EDGES.matcher(w).replaceAll("").toLowerCase(Locale.ROOT)))
                .collect(Collectors.joining(" "));
    }

    /** Splits normalized text into its first word and the remainder (possibly empty). */
    public CommandAndArgs splitCommandAndArgs(String text) {
        String n = normalizeText(text);
        if (n.isEmpty()) {
            return new CommandAndArgs("", "");
        }
        int space = n.indexOf(' ');
        return space < 0
                ? new CommandAndArgs(n, "")
                : new CommandAndArgs(n.substring(0, space), n.substring(space + 1));
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    private static boolean isTens(int v) {
        return v >= 20 && v < 100 && v % 10 == 0;
    }

    private static String[] tokens(String text) {
        String t = stripPunctuation(text);
        return t.isEmpty() ? new String[0] : WHITESPACE.split(t);
    }

    /** First word of an utterance and everything after it. */
    public record CommandAndArgs(String command, String args) { }
}
