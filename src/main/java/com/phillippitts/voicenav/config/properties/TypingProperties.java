package com.phillippitts.voicenav.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties controlling how literal text reaches the focused application.
 *
 * Privacy defaults: clipboard restore enabled; INFO logs never include full text.
 */
@Validated
@ConfigurationProperties(prefix = "typing")
public class TypingProperties {

    public enum NewlineMode { LF, CRLF, NONE }

    @Min(100)
    @Max(2000)
    private final int chunkSize;

    @Min(0)
    @Max(500)
    private final int interChunkDelayMs;

    @Min(0)
    @Max(1000)
    private final int focusDelayMs;

    /** Whether to restore prior clipboard contents after paste. */
    private final boolean restoreClipboard;

    /** If true, do not send the paste shortcut, only place text on the clipboard. */
    private final boolean clipboardOnlyFallback;

    @NotNull
    private final NewlineMode normalizeNewlines;

    private final boolean trimTrailingNewline;

    /** Enable keystroke-driven paste (tier 1). If false, skip to the clipboard tier. */
    private final boolean enableRobot;

    /** Paste shortcut: os-default | META+V | CONTROL+V. */
    private final String pasteShortcut;

    @ConstructorBinding
    public TypingProperties(Integer chunkSize,
                            Integer interChunkDelayMs,
                            Integer focusDelayMs,
                            Boolean restoreClipboard,
                            Boolean clipboardOnlyFallback,
                            NewlineMode normalizeNewlines,
                            Boolean trimTrailingNewline,
                            Boolean enableRobot,
                            String pasteShortcut) {
        this.chunkSize = chunkSize == null ? 800 : chunkSize;
        this.interChunkDelayMs = interChunkDelayMs == null ? 30 : interChunkDelayMs;
        this.focusDelayMs = focusDelayMs == null ? 100 : focusDelayMs;
        this.restoreClipboard = restoreClipboard == null || restoreClipboard;
        this.clipboardOnlyFallback = clipboardOnlyFallback != null && clipboardOnlyFallback;
        this.normalizeNewlines = normalizeNewlines == null ? NewlineMode.LF : normalizeNewlines;
        this.trimTrailingNewline = trimTrailingNewline == null || trimTrailingNewline;
        this.enableRobot = enableRobot == null || enableRobot;
        this.pasteShortcut = (pasteShortcut == null || pasteShortcut.isBlank()) ? "os-default" : pasteShortcut;
    }

    /** All defaults. */
    public static TypingProperties defaults() {
        return new TypingProperties(null, null, null, null, null, null, null, null, null);
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getInterChunkDelayMs() {
        return interChunkDelayMs;
    }

    public int getFocusDelayMs() {
        return focusDelayMs;
    }

    public boolean isRestoreClipboard() {
        return restoreClipboard;
    }

    public boolean isClipboardOnlyFallback() {
        return clipboardOnlyFallback;
    }

    public NewlineMode getNormalizeNewlines() {
        return normalizeNewlines;
    }

    public boolean isTrimTrailingNewline() {
        return trimTrailingNewline;
    }

    public boolean isEnableRobot() {
        return enableRobot;
    }

    public String getPasteShortcut() {
        return pasteShortcut;
    }
}
