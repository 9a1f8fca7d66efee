package com.phillippitts.voicenav.service.overlay.feedback;

import com.phillippitts.voicenav.service.events.EventBus;
import com.phillippitts.voicenav.service.events.EventType;
import com.phillippitts.voicenav.service.overlay.ScreenGeometry;
import com.phillippitts.voicenav.service.overlay.render.LoggingOverlaySurface;
import com.phillippitts.voicenav.service.overlay.render.RenderLoop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class FeedbackOverlayTest {

    private final RenderLoop loop = new RenderLoop("feedback-test");
    private final LoggingOverlaySurface surface = new LoggingOverlaySurface("feedback");
    private final FeedbackOverlay feedback = new FeedbackOverlay(loop, surface, ScreenGeometry.fixed(1920, 1080), 150);

    @AfterEach
    void tearDown() {
        feedback.close();
        loop.close();
    }

    @Test
    void showsMessageThenHidesAfterDuration() {
        feedback.show("Right Click");

        await().atMost(Duration.ofSeconds(2)).until(() -> surface.getLastFrame() != null);
        assertThat(surface.getLastFrame().lines()).containsExactly("Right Click");
        await().atMost(Duration.ofSeconds(2)).until(() -> surface.getLastFrame() == null);
    }

    @Test
    void blankMessagesAreIgnored() throws Exception {
        feedback.show("  ");
        loop.submit(() -> { }).get();

        assertThat(surface.getLastFrame()).isNull();
    }

    @Test
    void longMessagesAreAbbreviated() {
        feedback.show("x".repeat(200));

        await().atMost(Duration.ofSeconds(2)).until(() -> surface.getLastFrame() != null);
        assertThat(surface.getLastFrame().lines().get(0)).hasSize(FeedbackOverlay.MAX_CHARS + 3);
    }

    @Test
    void listenerFlashesExecutedCommandNames() {
        EventBus bus = new EventBus();
        new CommandFeedbackListener(feedback).attach(bus);

        bus.publish(EventType.COMMAND_EXECUTED, Map.of("command", "RightClickCommand"));

        await().atMost(Duration.ofSeconds(2)).until(() -> surface.getLastFrame() != null);
        assertThat(surface.getLastFrame().lines()).containsExactly("Right Click");
    }

    @Test
    void listenerSkipsOverlayCommands() throws Exception {
        EventBus bus = new EventBus();
        new CommandFeedbackListener(feedback).attach(bus);

        bus.publish(EventType.COMMAND_EXECUTED, Map.of("command", "ShowGridCommand"));
        loop.submit(() -> { }).get();

        assertThat(surface.getLastFrame()).isNull();
    }

    @Test
    void displayNameSplitsCamelCase() {
        assertThat(CommandFeedbackListener.displayName("ScrollDownCommand")).isEqualTo("Scroll Down");
        assertThat(CommandFeedbackListener.displayName("CopyCommand")).isEqualTo("Copy");
    }

    @Test
    void closeDisposesSurfaceAndIgnoresLaterMessages() throws Exception {
        feedback.show("Copy");
        feedback.close();

        assertThat(surface.isDisposed()).isTrue();
        feedback.show("Paste");
        loop.submit(() -> { }).get();
        assertThat(surface.getLastFrame()).isNull();
    }
}
