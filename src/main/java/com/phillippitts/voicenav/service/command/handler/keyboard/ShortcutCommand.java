package com.phillippitts.voicenav.service.command.handler.keyboard;

import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.input.ShortcutKeys;

import java.awt.event.KeyEvent;
import java.util.List;
import java.util.Optional;

/**
 * Presses a key chord (modifier + key) for an exact trigger phrase: clipboard operations,
 * select all, undo/redo, save and delete-word.
 */
public final class ShortcutCommand extends AbstractCommand {

    private final String name;
    private final List<String> triggers;
    private final int[] chord;

    public ShortcutCommand(String name, List<String> triggers, int priority, String description, int... chord) {
        super(priority, description, triggers);
        if (chord.length == 0) {
            throw new IllegalArgumentException("chord must not be empty");
        }
        this.name = name;
        this.triggers = List.copyOf(triggers);
        this.chord = chord.clone();
    }

    private static ShortcutCommand primary(String name, String trigger, int key, String description) {
        return new ShortcutCommand(name, List.of(trigger), CommandPriority.MEDIUM, description,
                ShortcutKeys.primaryModifier(), key);
    }

    public static ShortcutCommand copy() {
        return primary("CopyCommand", "copy", KeyEvent.VK_C, "Copy selection to clipboard");
    }

    public static ShortcutCommand cut() {
        return primary("CutCommand", "cut", KeyEvent.VK_X, "Cut selection to clipboard");
    }

    public static ShortcutCommand paste() {
        return primary("PasteCommand", "paste", KeyEvent.VK_V, "Paste from clipboard");
    }

    public static ShortcutCommand selectAll() {
        return primary("SelectAllCommand", "select all", KeyEvent.VK_A, "Select all text");
    }

    public static ShortcutCommand undo() {
        return primary("UndoCommand", "undo", KeyEvent.VK_Z, "Undo last action");
    }

    public static ShortcutCommand redo() {
        return primary("RedoCommand", "redo", KeyEvent.VK_Y, "Redo last undone action");
    }

    public static ShortcutCommand save() {
        return primary("SaveCommand", "save", KeyEvent.VK_S, "Save file");
    }

    /** Ctrl+Backspace; ranks above the single-character "delete". */
    public static ShortcutCommand deleteWord() {
        return new ShortcutCommand("DeleteWordCommand", List.of("delete word"), CommandPriority.HIGH,
                "Delete previous word", KeyEvent.VK_CONTROL, KeyEvent.VK_BACK_SPACE);
    }

    @Override
    public boolean matches(String text) {
        return triggers.contains(clean(text));
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        context.getKeyboard().combination(chord);
        return Optional.empty();
    }

    @Override
    public String name() {
        return name;
    }
}
