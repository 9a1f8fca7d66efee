package com.phillippitts.voicenav.service.text;

import com.phillippitts.voicenav.config.properties.TextProcessingProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Cleans up dictated text before dispatch.
 *
 * <ul>
 *   <li>Command words ("delete that", "clear line") short-circuit to a {@link CommandAction}.</li>
 *   <li>Spoken punctuation ("period", "new line") becomes the symbol; longer phrases win and
 *       only whole words are replaced, ignoring case.</li>
 *   <li>Custom vocabulary substitutions are applied last.</li>
 * </ul>
 *
 * <p>The last text that was actually typed is remembered so "delete that" knows how many
 * characters to erase.
 */
public class TextProcessor {

    private static final Logger LOG = LogManager.getLogger(TextProcessor.class);

    private static final Pattern SPACE_BEFORE_PUNCT = Pattern.compile("[ \\t]+([.,!?;:])");
    private static final Pattern RUNS_OF_SPACE = Pattern.compile("[ \\t]+");
    private static final Pattern SPACE_BEFORE_NEWLINE = Pattern.compile("[ \\t]+\\n");
    private static final Pattern SPACE_AFTER_NEWLINE = Pattern.compile("\\n[ \\t]+");

    private final boolean punctuationEnabled;
    private final Map<String, String> punctuation;
    private final Pattern punctuationPattern;
    private final List<Map.Entry<Pattern, String>> vocabulary;
    private final Map<String, CommandAction> commandWords;

    private volatile String lastText = "";

    public TextProcessor(TextProcessingProperties props) {
        this.punctuationEnabled = props.isPunctuationCommands();
        this.punctuation = lowerKeys(props.getPunctuationMap());
        this.punctuationPattern = alternation(punctuation.keySet());
        this.vocabulary = props.getCustomVocabulary().entrySet().stream()
                .map(e -> Map.entry(wholeWord(e.getKey()), e.getValue()))
                .collect(Collectors.toUnmodifiableList());
        Map<String, CommandAction> words = new HashMap<>();
        props.getCommandWords().forEach((phrase, action) -> CommandAction.fromConfig(action).ifPresentOrElse(
                a -> words.put(phrase.trim().toLowerCase(Locale.ROOT), a),
                () -> LOG.warn("Ignoring command word '{}': unknown action '{}'", phrase, action)));
        this.commandWords = Map.copyOf(words);
    }

    public ProcessedText process(String text) {
        if (text == null || text.isEmpty()) {
            return ProcessedText.empty();
        }
        CommandAction action = commandWords.get(text.trim().toLowerCase(Locale.ROOT));
        if (action != null) {
            return ProcessedText.ofAction(action);
        }
        String out = text;
        if (punctuationEnabled) {
            out = applyPunctuation(out);
        }
        out = applyVocabulary(out);
        return ProcessedText.ofText(out);
    }

    /** Records text that reached the focused application. */
    public void rememberTyped(String text) {
        lastText = text == null ? "" : text;
    }

    public String getLastText() {
        return lastText;
    }

    public int getLastTextLength() {
        return lastText.length();
    }

    String applyPunctuation(String text) {
        if (punctuationPattern == null) {
            return text;
        }
        Matcher m = punctuationPattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String symbol = punctuation.get(m.group().toLowerCase(Locale.ROOT));
            m.appendReplacement(sb, Matcher.quoteReplacement(symbol != null ? symbol : m.group()));
        }
        m.appendTail(sb);
        String out = SPACE_BEFORE_PUNCT.matcher(sb.toString()).replaceAll("$1");
        out = RUNS_OF_SPACE.matcher(out).replaceAll(" ");
        out = SPACE_BEFORE_NEWLINE.matcher(out).replaceAll("\n");
        out = SPACE_AFTER_NEWLINE.matcher(out).replaceAll("\n");
        return out.strip();
    }

    String applyVocabulary(String text) {
        String out = text;
        for (Map.Entry<Pattern, String> e : vocabulary) {
            out = e.getKey().matcher(out).replaceAll(Matcher.quoteReplacement(e.getValue()));
        }
        return out;
    }

    private static Map<String, String> lowerKeys(Map<String, String> map) {
        Map<String, String> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(k.toLowerCase(Locale.ROOT), v));
        return out;
    }

    // longest phrase first so "new paragraph" wins over "new"
    private static Pattern alternation(Set<String> phrases) {
        if (phrases.isEmpty()) {
            return null;
        }
        String body = phrases.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + body + ")\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static Pattern wholeWord(String phrase) {
        return Pattern.compile("\\b" + Pattern.quote(phrase) + "\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
