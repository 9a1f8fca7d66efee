package com.phillippitts.voicenav.service.typing;

import com.phillippitts.voicenav.config.properties.TypingProperties;
import com.phillippitts.voicenav.service.input.ClipboardAccess;
import com.phillippitts.voicenav.service.input.KeyboardActions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/** Tier 2: whole text via the clipboard, restoring the previous contents afterwards. */
class ClipboardTypingAdapter implements TypingAdapter {
    private static final Logger LOG = LogManager.getLogger(ClipboardTypingAdapter.class);

    private final TypingProperties props;
    private final ClipboardAccess clipboard;
    private final KeyboardActions keyboard;

    ClipboardTypingAdapter(TypingProperties props, ClipboardAccess clipboard, KeyboardActions keyboard) {
        this.props = Objects.requireNonNull(props);
        this.clipboard = Objects.requireNonNull(clipboard);
        this.keyboard = Objects.requireNonNull(keyboard);
    }

    @Override
    public boolean canType() {
        return true;
    }

    @Override
    public boolean type(String text) {
        String t = normalize(text == null ? "" : text);
        if (props.isTrimTrailingNewline()) {
            while (t.endsWith("\n") || t.endsWith("\r")) {
                t = t.substring(0, t.length() - 1);
            }
        }
        boolean restore = props.isRestoreClipboard() && !props.isClipboardOnlyFallback();
        Optional<String> prior = restore ? clipboard.readText() : Optional.empty();
        try {
            clipboard.writeText(t);
            if (!props.isClipboardOnlyFallback()) {
                PasteShortcut.send(keyboard, props.getPasteShortcut());
            }
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Clipboard typing failed: {}", e.toString());
            return false;
        } finally {
            prior.ifPresent(this::restore);
        }
    }

    @Override
    public String name() {
        return "clipboard";
    }

    private void restore(String previous) {
        try {
            clipboard.writeText(previous);
        } catch (RuntimeException e) {
            LOG.debug("Could not restore clipboard: {}", e.toString());
        }
    }

    private String normalize(String s) {
        return switch (props.getNormalizeNewlines()) {
            case LF -> s.replace("\r\n", "\n").replace('\r', '\n');
            case CRLF -> s.replace("\r\n", "\n").replace('\r', '\n').replace("\n", "\r\n");
            case NONE -> s;
        };
    }
}
