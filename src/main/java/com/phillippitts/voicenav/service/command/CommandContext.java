package com.phillippitts.voicenav.service.command;

import com.phillippitts.voicenav.service.events.EventBus;
import com.phillippitts.voicenav.service.input.ClipboardAccess;
import com.phillippitts.voicenav.service.input.KeyboardActions;
import com.phillippitts.voicenav.service.input.MouseActions;
import com.phillippitts.voicenav.service.input.ProcessLauncher;
import com.phillippitts.voicenav.service.input.ScreenCapture;
import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capabilities handed to a command when it executes. Built once per session; commands never
 * own it. The overlay coordinator, event bus and screen capture are optional.
 */
public final class CommandContext {

    private final KeyboardActions keyboard;
    private final MouseActions mouse;
    private final ClipboardAccess clipboard;
    private final ProcessLauncher launcher;
    private final OverlayCoordinator overlays;
    private final EventBus eventBus;
    private final ScreenCapture screenCapture;
    private final int screenWidth;
    private final int screenHeight;
    private final Map<String, Object> data = new ConcurrentHashMap<>();

    private CommandContext(Builder b) {
        this.keyboard = Objects.requireNonNull(b.keyboard, "keyboard must not be null");
        this.mouse = Objects.requireNonNull(b.mouse, "mouse must not be null");
        this.clipboard = Objects.requireNonNull(b.clipboard, "clipboard must not be null");
        this.launcher = Objects.requireNonNull(b.launcher, "launcher must not be null");
        this.overlays = b.overlays;
        this.eventBus = b.eventBus;
        this.screenCapture = b.screenCapture;
        this.screenWidth = b.screenWidth;
        this.screenHeight = b.screenHeight;
    }

    public static Builder builder() {
        return new Builder();
    }

    public KeyboardActions getKeyboard() {
        return keyboard;
    }

    public MouseActions getMouse() {
        return mouse;
    }

    public ClipboardAccess getClipboard() {
        return clipboard;
    }

    public ProcessLauncher getLauncher() {
        return launcher;
    }

    public Optional<OverlayCoordinator> getOverlays() {
        return Optional.ofNullable(overlays);
    }

    public Optional<EventBus> getEventBus() {
        return Optional.ofNullable(eventBus);
    }

    public Optional<ScreenCapture> getScreenCapture() {
        return Optional.ofNullable(screenCapture);
    }

    public int getScreenWidth() {
        return screenWidth;
    }

    public int getScreenHeight() {
        return screenHeight;
    }

    /** Scratch space shared by commands across one session. */
    public Map<String, Object> getData() {
        return data;
    }

    public static final class Builder {
        private KeyboardActions keyboard;
        private MouseActions mouse;
        private ClipboardAccess clipboard;
        private ProcessLauncher launcher;
        private OverlayCoordinator overlays;
        private EventBus eventBus;
        private ScreenCapture screenCapture;
        private int screenWidth = 1920;
        private int screenHeight = 1080;

        private Builder() {
        }

        public Builder keyboard(KeyboardActions keyboard) {
            this.keyboard = keyboard;
            return this;
        }

        public Builder mouse(MouseActions mouse) {
            this.mouse = mouse;
            return this;
        }

        public Builder clipboard(ClipboardAccess clipboard) {
            this.clipboard = clipboard;
            return this;
        }

        public Builder launcher(ProcessLauncher launcher) {
            this.launcher = launcher;
            return this;
        }

        public Builder overlays(OverlayCoordinator overlays) {
            this.overlays = overlays;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder screenCapture(ScreenCapture screenCapture) {
            this.screenCapture = screenCapture;
            return this;
        }

        public Builder screenSize(int width, int height) {
            this.screenWidth = width;
            this.screenHeight = height;
            return this;
        }

        public CommandContext build() {
            return new CommandContext(this);
        }
    }
}
