package com.phillippitts.voicenav.service.command.handler.keyboard;

import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;

import java.awt.event.KeyEvent;
import java.util.List;
import java.util.Optional;

/** Taps a single key when the utterance is exactly one of its trigger words. */
public final class KeyPressCommand extends AbstractCommand {

    private final String name;
    private final List<String> triggers;
    private final int keyCode;

    public KeyPressCommand(String name, List<String> triggers, int keyCode, int priority, String description) {
        super(priority, description, triggers);
        this.name = name;
        this.triggers = List.copyOf(triggers);
        this.keyCode = keyCode;
    }

    public static KeyPressCommand enter() {
        return new KeyPressCommand("EnterCommand", List.of("enter"), KeyEvent.VK_ENTER,
                CommandPriority.NORMAL, "Press Enter key");
    }

    public static KeyPressCommand tab() {
        return new KeyPressCommand("TabCommand", List.of("tab"), KeyEvent.VK_TAB,
                CommandPriority.NORMAL, "Press Tab key");
    }

    public static KeyPressCommand escape() {
        return new KeyPressCommand("EscapeCommand", List.of("escape", "cancel"), KeyEvent.VK_ESCAPE,
                CommandPriority.NORMAL, "Press Escape key");
    }

    public static KeyPressCommand space() {
        return new KeyPressCommand("SpaceCommand", List.of("space"), KeyEvent.VK_SPACE,
                CommandPriority.NORMAL, "Press Space key");
    }

    public static KeyPressCommand backspace() {
        return new KeyPressCommand("BackspaceCommand", List.of("delete", "backspace"), KeyEvent.VK_BACK_SPACE,
                CommandPriority.NORMAL, "Delete one character (Backspace)");
    }

    @Override
    public boolean matches(String text) {
        return triggers.contains(clean(text));
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        context.getKeyboard().tap(keyCode);
        return Optional.empty();
    }

    @Override
    public String name() {
        return name;
    }
}
