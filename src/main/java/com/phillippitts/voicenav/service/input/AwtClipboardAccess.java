package com.phillippitts.voicenav.service.input;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.io.IOException;
import java.util.Optional;
import java.util.function.Supplier;

/** {@link ClipboardAccess} backed by the AWT system clipboard. */
public class AwtClipboardAccess implements ClipboardAccess {
    private static final Logger LOG = LogManager.getLogger(AwtClipboardAccess.class);

    private final Supplier<Clipboard> clipboard;

    public AwtClipboardAccess() {
        this(() -> Toolkit.getDefaultToolkit().getSystemClipboard());
    }

    // Package-private for tests
    AwtClipboardAccess(Supplier<Clipboard> clipboard) {
        this.clipboard = clipboard;
    }

    @Override
    public Optional<String> readText() {
        Clipboard cb = clipboard.get();
        try {
            if (cb.isDataFlavorAvailable(DataFlavor.stringFlavor)) {
                return Optional.of(String.valueOf(cb.getData(DataFlavor.stringFlavor)));
            }
        } catch (UnsupportedFlavorException | IOException | IllegalStateException e) {
            LOG.debug("Could not read clipboard: {}", e.toString());
        }
        return Optional.empty();
    }

    @Override
    public void writeText(String text) {
        clipboard.get().setContents(new StringSelection(text == null ? "" : text), null);
    }
}
