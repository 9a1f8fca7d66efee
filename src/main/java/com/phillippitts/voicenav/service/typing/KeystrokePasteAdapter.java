package com.phillippitts.voicenav.service.typing;

import com.phillippitts.voicenav.config.properties.TypingProperties;
import com.phillippitts.voicenav.service.input.ClipboardAccess;
import com.phillippitts.voicenav.service.input.KeyboardActions;
import com.phillippitts.voicenav.service.input.MouseActions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Tier 1: places text on the clipboard and sends the paste shortcut through the injected
 * keyboard, chunking long text. Keyboard-layout agnostic. Requires accessibility permission
 * on macOS.
 */
class KeystrokePasteAdapter implements TypingAdapter {
    private static final Logger LOG = LogManager.getLogger(KeystrokePasteAdapter.class);

    private final TypingProperties props;
    private final ClipboardAccess clipboard;
    private final KeyboardActions keyboard;
    private final MouseActions timing;
    private final BooleanSupplier inputAvailable;

    KeystrokePasteAdapter(TypingProperties props, ClipboardAccess clipboard, KeyboardActions keyboard,
                          MouseActions timing, BooleanSupplier inputAvailable) {
        this.props = Objects.requireNonNull(props);
        this.clipboard = Objects.requireNonNull(clipboard);
        this.keyboard = Objects.requireNonNull(keyboard);
        this.timing = Objects.requireNonNull(timing);
        this.inputAvailable = Objects.requireNonNull(inputAvailable);
    }

    @Override
    public boolean canType() {
        return props.isEnableRobot() && inputAvailable.getAsBoolean();
    }

    @Override
    public boolean type(String text) {
        if (!canType()) {
            return false;
        }
        String t = text == null ? "" : text;
        if (t.isEmpty()) {
            return true;
        }
        try {
            if (props.getFocusDelayMs() > 0) {
                timing.pause(props.getFocusDelayMs());
            }
            int chunkSize = props.getChunkSize();
            for (int i = 0; i < t.length(); i += chunkSize) {
                if (i > 0 && props.getInterChunkDelayMs() > 0) {
                    timing.pause(props.getInterChunkDelayMs());
                }
                clipboard.writeText(t.substring(i, Math.min(t.length(), i + chunkSize)));
                PasteShortcut.send(keyboard, props.getPasteShortcut());
            }
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Keystroke paste failed: {}", e.toString());
            return false;
        }
    }

    @Override
    public String name() {
        return "robot";
    }
}
