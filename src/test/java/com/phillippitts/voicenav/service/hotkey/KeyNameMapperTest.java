package com.phillippitts.voicenav.service.hotkey;

import org.junit.jupiter.api.Test;

import java.awt.event.KeyEvent;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class KeyNameMapperTest {

    @Test
    void normalizesAliasesAndSpacing() {
        assertThat(KeyNameMapper.normalizeKey("esc")).isEqualTo("ESCAPE");
        assertThat(KeyNameMapper.normalizeKey(" page up ")).isEqualTo("PAGE_UP");
        assertThat(KeyNameMapper.normalizeKey("Return")).isEqualTo("ENTER");
        assertThat(KeyNameMapper.normalizeKey(null)).isEqualTo("UNKNOWN");
    }

    @Test
    void collapsesSidedModifiers() {
        assertThat(KeyNameMapper.normalizeModifier("Left Ctrl")).isEqualTo("CONTROL");
        assertThat(KeyNameMapper.normalizeModifier("RIGHT_CMD")).isEqualTo("META");
        assertThat(KeyNameMapper.normalizeModifiers(List.of("ctrl", "shift", "LEFT_SHIFT")))
                .containsExactlyInAnyOrder("CONTROL", "SHIFT");
    }

    @Test
    void validatesKeysAndModifiers() {
        assertThat(KeyNameMapper.isValidKey("d")).isTrue();
        assertThat(KeyNameMapper.isValidKey("F24")).isTrue();
        assertThat(KeyNameMapper.isValidKey("F25")).isFalse();
        assertThat(KeyNameMapper.isValidModifier("option")).isTrue();
        assertThat(KeyNameMapper.isValidModifier("TAB")).isFalse();
    }

    @Test
    void mapsNamesToKeyCodes() {
        assertThat(KeyNameMapper.toKeyCode("a").getAsInt()).isEqualTo(KeyEvent.VK_A);
        assertThat(KeyNameMapper.toKeyCode("7").getAsInt()).isEqualTo(KeyEvent.VK_7);
        assertThat(KeyNameMapper.toKeyCode("ctrl").getAsInt()).isEqualTo(KeyEvent.VK_CONTROL);
        assertThat(KeyNameMapper.toKeyCode("nonsense")).isEmpty();
    }

    @Test
    void matchesCombinationsIgnoringOrderAndCase() {
        assertThat(KeyNameMapper.matchesCombination(Set.of("META"), "TAB", "meta+tab")).isTrue();
        assertThat(KeyNameMapper.matchesCombination(Set.of("SHIFT", "CONTROL"), "D", "CONTROL+SHIFT+D")).isTrue();
        assertThat(KeyNameMapper.matchesCombination(Set.of("CONTROL"), "D", "CONTROL+SHIFT+D")).isFalse();
        assertThat(KeyNameMapper.matchesCombination(Set.of("META"), "TAB", "")).isFalse();
    }
}
