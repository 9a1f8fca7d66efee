package com.phillippitts.voicenav.service.command.handler.overlay;

import com.phillippitts.voicenav.service.command.AbstractCommand;
import com.phillippitts.voicenav.service.command.CommandContext;
import com.phillippitts.voicenav.service.command.CommandPriority;
import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;

import java.util.List;
import java.util.Optional;

/** Hides the visible overlay. "height" is a frequent mis-transcription of "hide". */
public final class HideOverlayCommand extends AbstractCommand {

    private static final List<String> TRIGGERS = List.of("hide", "height", "close");

    public HideOverlayCommand() {
        super(CommandPriority.MEDIUM, "Hide the current overlay", TRIGGERS);
    }

    @Override
    public boolean matches(String text) {
        return TRIGGERS.contains(clean(text));
    }

    @Override
    public boolean validate(CommandContext context, String text) {
        return context.getOverlays().isPresent();
    }

    @Override
    public Optional<String> execute(CommandContext context, String text) {
        // nothing visible is not an error
        context.getOverlays().ifPresent(OverlayCoordinator::hideCurrent);
        return Optional.empty();
    }
}
