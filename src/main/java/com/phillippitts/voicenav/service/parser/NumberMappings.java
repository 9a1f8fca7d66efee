package com.phillippitts.voicenav.service.parser;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Spoken-word to integer dictionary used by {@link CommandParser}.
 *
 * <p>The table maps lowercase words (including common recognizer homophones such as
 * "won", "to", "for", "ate") to values. It is loaded from JSON of the form
 * {@code {"number_words": {"one": 1, "won": 1}}}; if the source is missing or unreadable
 * the {@link #builtIn() built-in table} is used instead.
 *
 * <p>Thread-safe: instances are immutable.
 */
public final class NumberMappings {

    private static final Logger LOG = LogManager.getLogger(NumberMappings.class);

    /** Classpath location of the bundled dictionary. */
    public static final String DEFAULT_RESOURCE = "number-mappings.json";

    private static final String ROOT_KEY = "number_words";

    private final Map<String, Integer> words;

    private NumberMappings(Map<String, Integer> words) {
        this.words = Map.copyOf(words);
    }

    public static NumberMappings of(Map<String, Integer> words) {
        Map<String, Integer> lower = new LinkedHashMap<>();
        words.forEach((k, v) -> lower.put(k.toLowerCase(Locale.ROOT).trim(), v));
        return new NumberMappings(lower);
    }

    /**
     * Fallback dictionary: homophones for zero through ten, the teens and the tens, plus
     * the articles "a"/"an" as one.
     */
    public static NumberMappings builtIn() {
        Map<String, Integer> m = new LinkedHashMap<>();
        m.put("zero", 0);
        m.put("oh", 0);
        m.put("one", 1);
        m.put("won", 1);
        m.put("two", 2);
        m.put("to", 2);
        m.put("too", 2);
        m.put("three", 3);
        m.put("tree", 3);
        m.put("four", 4);
        m.put("for", 4);
        m.put("fore", 4);
        m.put("five", 5);
        m.put("six", 6);
        m.put("sicks", 6);
        m.put("seven", 7);
        m.put("eight", 8);
        m.put("ate", 8);
        m.put("nine", 9);
        m.put("nein", 9);
        m.put("ten", 10);
        m.put("eleven", 11);
        m.put("twelve", 12);
        m.put("thirteen", 13);
        m.put("fourteen", 14);
        m.put("fifteen", 15);
        m.put("sixteen", 16);
        m.put("seventeen", 17);
        m.put("eighteen", 18);
        m.put("nineteen", 19);
        m.put("twenty", 20);
        m.put("thirty", 30);
        m.put("forty", 40);
        m.put("fifty", 50);
        m.put("sixty", 60);
        m.put("seventy", 70);
        m.put("eighty", 80);
        m.put("ninety", 90);
        m.put("a", 1);
        m.put("an", 1);
        return new NumberMappings(m);
    }

    /**
     * Loads the dictionary from an explicit file when given, otherwise from the bundled
     * classpath resource. Never fails: any problem falls back to {@link #builtIn()}.
     */
    public static NumberMappings load(Optional<Path> file) {
        if (file.isPresent()) {
            Path p = file.get();
            try {
                return parse(Files.readString(p, StandardCharsets.UTF_8));
            } catch (IOException | JSONException e) {
                LOG.warn("Could not read number mappings from {}: {}; using built-in table", p, e.toString());
                return builtIn();
            }
        }
        try (InputStream in = NumberMappings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                LOG.warn("Number mappings resource '{}' not found; using built-in table", DEFAULT_RESOURCE);
                return builtIn();
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException | JSONException e) {
            LOG.warn("Could not read number mappings resource: {}; using built-in table", e.toString());
            return builtIn();
        }
    }

    /**
     * Parses the JSON form. Entries whose value is not an integer are skipped.
     *
     * @throws JSONException if the document is not a JSON object or lacks {@code number_words}
     */
    static NumberMappings parse(String json) {
        JSONObject root = new JSONObject(json);
        JSONObject table = root.getJSONObject(ROOT_KEY);
        Map<String, Integer> m = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            Object v = table.opt(key);
            if (v instanceof Number n) {
                m.put(key.toLowerCase(Locale.ROOT).trim(), n.intValue());
            } else {
                LOG.debug("Skipping non-numeric mapping '{}'", key);
            }
        }
        if (m.isEmpty()) {
            LOG.warn("Number mappings document is empty; using built-in table");
            return builtIn();
        }
        LOG.debug("Loaded {} number words", m.size());
        return new NumberMappings(m);
    }

    public Optional<Integer> valueOf(String word) {
        if (word == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(words.get(word.toLowerCase(Locale.ROOT)));
    }

    public boolean contains(String word) {
        return word != null && words.containsKey(word.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return words.size();
    }
}
