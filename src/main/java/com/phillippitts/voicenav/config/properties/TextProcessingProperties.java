package com.phillippitts.voicenav.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dictation clean-up settings: spoken punctuation, vocabulary substitutions and command words.
 * Multi-word keys use bracket notation, e.g. {@code text-processing.punctuation-map[question mark]=?}.
 */
@Validated
@ConfigurationProperties(prefix = "text-processing")
public class TextProcessingProperties {

    static final Map<String, String> DEFAULT_PUNCTUATION;
    static final Map<String, String> DEFAULT_COMMAND_WORDS;

    static {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("period", ".");
        p.put("comma", ",");
        p.put("question mark", "?");
        p.put("exclamation point", "!");
        p.put("new line", "\n");
        p.put("new paragraph", "\n\n");
        DEFAULT_PUNCTUATION = Map.copyOf(p);
        DEFAULT_COMMAND_WORDS = Map.of(
                "delete that", "undo_last",
                "scratch that", "undo_last",
                "clear line", "clear_line");
    }

    private final boolean punctuationCommands;
    private final Map<String, String> punctuationMap;
    private final Map<String, String> customVocabulary;
    private final Map<String, String> commandWords;

    @ConstructorBinding
    public TextProcessingProperties(Boolean punctuationCommands,
                                    Map<String, String> punctuationMap,
                                    Map<String, String> customVocabulary,
                                    Map<String, String> commandWords) {
        this.punctuationCommands = punctuationCommands == null || punctuationCommands;
        this.punctuationMap = punctuationMap == null ? DEFAULT_PUNCTUATION : Map.copyOf(punctuationMap);
        this.customVocabulary = customVocabulary == null ? Map.of() : Map.copyOf(customVocabulary);
        this.commandWords = commandWords == null ? DEFAULT_COMMAND_WORDS : Map.copyOf(commandWords);
    }

    public static TextProcessingProperties defaults() {
        return new TextProcessingProperties(null, null, null, null);
    }

    public boolean isPunctuationCommands() {
        return punctuationCommands;
    }

    public Map<String, String> getPunctuationMap() {
        return punctuationMap;
    }

    public Map<String, String> getCustomVocabulary() {
        return customVocabulary;
    }

    public Map<String, String> getCommandWords() {
        return commandWords;
    }
}
