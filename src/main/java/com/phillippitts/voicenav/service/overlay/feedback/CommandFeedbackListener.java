package com.phillippitts.voicenav.service.overlay.feedback;

import com.phillippitts.voicenav.service.events.EventBus;
import com.phillippitts.voicenav.service.events.EventType;
import com.phillippitts.voicenav.service.events.VoiceEvent;

import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Flashes the name of each executed command ("Right Click", "Scroll") on the feedback
 * overlay. Commands that show their own overlay are skipped.
 */
public class CommandFeedbackListener implements Consumer<VoiceEvent> {

    static final Set<String> SILENT_COMMANDS = Set.of(
            "ShowGridCommand", "ShowElementsCommand", "ShowHelpCommand", "HideOverlayCommand");

    private final FeedbackOverlay feedback;

    public CommandFeedbackListener(FeedbackOverlay feedback) {
        this.feedback = Objects.requireNonNull(feedback, "feedback must not be null");
    }

    public void attach(EventBus bus) {
        bus.subscribe(EventType.COMMAND_EXECUTED, this);
    }

    @Override
    public void accept(VoiceEvent event) {
        String command = event.get("command");
        if (command == null || SILENT_COMMANDS.contains(command)) {
            return;
        }
        feedback.show(displayName(command));
    }

    /** "RightClickCommand" becomes "Right Click". */
    static String displayName(String command) {
        String base = command.replace("Command", "");
        return base.replaceAll("([a-z])([A-Z])", "$1 $2").trim();
    }
}
