package com.phillippitts.voicenav.service.parser;

import org.json.JSONException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NumberMappingsTest {

    @Test
    void loadsBundledResource() {
        NumberMappings m = NumberMappings.load(Optional.empty());
        assertThat(m.valueOf("sixty")).contains(60);
        assertThat(m.valueOf("Won")).contains(1);
        assertThat(m.contains("hundred")).isFalse();
    }

    @Test
    void loadsExplicitFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("numbers.json");
        Files.writeString(file, "{\"number_words\": {\"Uno\": 1, \"dos\": 2, \"bad\": \"x\"}}", StandardCharsets.UTF_8);

        NumberMappings m = NumberMappings.load(Optional.of(file));

        assertThat(m.size()).isEqualTo(2);
        assertThat(m.valueOf("uno")).contains(1);
        assertThat(m.contains("bad")).isFalse();
    }

    @Test
    void fallsBackToBuiltInWhenFileMissing(@TempDir Path dir) {
        NumberMappings m = NumberMappings.load(Optional.of(dir.resolve("missing.json")));
        assertThat(m.size()).isEqualTo(NumberMappings.builtIn().size());
    }

    @Test
    void fallsBackToBuiltInWhenDocumentHasNoEntries() {
        NumberMappings m = NumberMappings.parse("{\"number_words\": {}}");
        assertThat(m.valueOf("five")).contains(5);
    }

    @Test
    void rejectsDocumentWithoutRootKey() {
        assertThatThrownBy(() -> NumberMappings.parse("{\"numbers\": {}}")).isInstanceOf(JSONException.class);
    }

    @Test
    void nullWordHasNoValue() {
        assertThat(NumberMappings.builtIn().valueOf(null)).isEmpty();
        assertThat(NumberMappings.builtIn().contains(null)).isFalse();
    }
}
