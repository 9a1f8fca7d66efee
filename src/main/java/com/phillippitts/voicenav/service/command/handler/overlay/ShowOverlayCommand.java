package com.phillippitts.voicenav.service.command.handler.overlay;

import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.overlay.OverlayKind;
import com.phillippitts.voicenav.service.overlay.grid.GridOverlay;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shows one overlay on an exact trigger word: "grid", "numbers", "windows", "help".
 * Requires an overlay coordinator in the context.
 */
public final class ShowOverlayCommand extends AbstractCommand {

    private final String name;
    private final List<String> triggers;
    private final OverlayKind kind;
    private final Map<String, Object> options;

    public ShowOverlayCommand(String name, List<String> triggers, OverlayKind kind,
                              Map<String, Object> options, String description) {
        super(CommandPriority.MEDIUM, description, triggers);
        this.name = name;
        this.triggers = List.copyOf(triggers);
        this.kind = kind;
        this.options = Map.copyOf(options);
    }

    public static ShowOverlayCommand grid(int gridSize) {
        return new ShowOverlayCommand("ShowGridCommand", List.of("grid"), OverlayKind.GRID,
                Map.of(GridOverlay.OPTION_GRID_SIZE, gridSize),
                "Show " + gridSize + "x" + gridSize + " numbered grid overlay");
    }

    public static ShowOverlayCommand elements() {
        return new ShowOverlayCommand("ShowElementsCommand", List.of("numbers"), OverlayKind.ELEMENT,
                Map.of(), "Show numbers on clickable elements");
    }

    public static ShowOverlayCommand windows() {
        return new ShowOverlayCommand("ShowWindowsCommand", List.of("windows"), OverlayKind.WINDOW,
                Map.of(), "Show numbered list of open windows");
    }

    public static ShowOverlayCommand help() {
        return new ShowOverlayCommand("ShowHelpCommand", List.of("help", "commands"), OverlayKind.HELP,
                Map.of(), "Show available commands");
    }

    public OverlayKind getKind() {
        return kind;
    }

    @Override
    public boolean matches(String text) {
        return triggers.contains(clean(text));
    }

    @Override
    public boolean validate(CommandContext context, String text) {
        return context.getOverlays().isPresent();
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        boolean shown = context.getOverlays().map(o -> o.show(kind, options)).orElse(false);
        if (!shown) {
            throw failure(kind.label() + " overlay could not be shown");
        }
        return Optional.empty();
    }

    @Override
    public String name() {
        return name;
    }
}
