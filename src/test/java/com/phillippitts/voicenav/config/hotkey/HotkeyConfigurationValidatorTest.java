package com.phillippitts.voicenav.config.hotkey;

import com.phillippitts.voicenav.config.properties.HotkeyProperties;
import com.phillippitts.voicenav.service.hotkey.HotkeyBinding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HotkeyConfigurationValidatorTest {

    @Test
    void keepsValidBindingsAndSkipsInvalidOnes() {
        HotkeyProperties props = new HotkeyProperties(true, List.of(
                new HotkeyProperties.Binding("grid", "G", List.of("CONTROL", "ALT"), "show grid"),
                new HotkeyProperties.Binding("bad-key", "NOT_A_KEY", List.of("CONTROL"), "hide"),
                new HotkeyProperties.Binding("bad-mod", "H", List.of("HYPER"), "hide"),
                new HotkeyProperties.Binding("hide", "ESC", null, "hide")), null);

        List<HotkeyBinding> valid = new HotkeyConfigurationValidator(props).validBindings();

        assertThat(valid).extracting(HotkeyBinding::name).containsExactly("grid", "hide");
        assertThat(valid.get(1).key()).isEqualTo("ESCAPE");
    }

    @Test
    void defaultsReservedCombinations() {
        HotkeyProperties props = new HotkeyProperties(null, null, null);

        assertThat(props.isEnabled()).isTrue();
        assertThat(props.getReserved()).contains("META+TAB", "ALT+F4");
        assertThat(new HotkeyConfigurationValidator(props).validBindings()).isEmpty();
    }
}
