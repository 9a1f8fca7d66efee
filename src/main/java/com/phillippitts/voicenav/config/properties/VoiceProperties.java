package com.phillippitts.voicenav.config.properties;

import com.phillippitts.voicenav.service.parser.CommandParser;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Interpretation settings for recognized utterances.
 */
@Validated
@ConfigurationProperties(prefix = "voice")
public class VoiceProperties {

    /** When true, text that matches no command is dropped instead of typed. */
    private final boolean commandOnlyMode;

    /** Filler words removed before matching. */
    private final Set<String> ignoredWords;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double fuzzyThreshold;

    /** Optional JSON file overriding the bundled number-word table. */
    private final String numberMappingsPath;

    @ConstructorBinding
    public VoiceProperties(Boolean commandOnlyMode,
                           Set<String> ignoredWords,
                           Double fuzzyThreshold,
                           String numberMappingsPath) {
        this.commandOnlyMode = commandOnlyMode == null || commandOnlyMode;
        this.ignoredWords = ignoredWords == null ? CommandParser.DEFAULT_IGNORED_WORDS : Set.copyOf(ignoredWords);
        this.fuzzyThreshold = fuzzyThreshold == null ? CommandParser.DEFAULT_FUZZY_THRESHOLD : fuzzyThreshold;
        this.numberMappingsPath = numberMappingsPath;
    }

    public boolean isCommandOnlyMode() {
        return commandOnlyMode;
    }

    public Set<String> getIgnoredWords() {
        return ignoredWords;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public Optional<Path> getNumberMappingsPath() {
        return numberMappingsPath == null || numberMappingsPath.isBlank()
                ? Optional.empty()
                : Optional.of(Path.of(numberMappingsPath));
    }
}
