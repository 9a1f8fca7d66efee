package com.phillippitts.voicenav.config.hotkey;

import com.phillippitts.voicenav.config.properties.HotkeyProperties;
import com.phillippitts.voicenav.exception.InvalidCommandConfigurationException;
import com.phillippitts.voicenav.service.hotkey.HotkeyBinding;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates hotkey bindings against the key and modifier allow-lists at startup. Invalid
 * bindings are reported with an actionable message and left out.
 */
class HotkeyConfigurationValidator {

    private static final Logger LOG = LogManager.getLogger(HotkeyConfigurationValidator.class);

    private final HotkeyProperties props;

    HotkeyConfigurationValidator(HotkeyProperties props) {
        this.props = props;
    }

    List<HotkeyBinding> validBindings() {
        List<HotkeyBinding> valid = new ArrayList<>();
        for (HotkeyProperties.Binding b : props.getBindings()) {
            try {
                valid.add(HotkeyBinding.of(b.name(), b.key(), b.modifiers(), b.utterance()));
            } catch (InvalidCommandConfigurationException e) {
                LOG.warn("Skipping hotkey: {}. Keys must be A-Z, 0-9, F1..F24 or a named key "
                        + "(ESCAPE, ENTER, TAB, SPACE, BACKSPACE, HOME, END, arrows).", e.getMessage());
            }
        }
        return List.copyOf(valid);
    }
}
