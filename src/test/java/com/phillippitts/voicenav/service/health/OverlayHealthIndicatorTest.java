package com.phillippitts.voicenav.service.health;

import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;
import com.phillippitts.voicenav.service.overlay.render.RenderLoop;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OverlayHealthIndicatorTest {

    @Test
    void upWhileRenderLoopsRun() {
        RenderLoop loop = new RenderLoop("overlay-grid");
        try {
            OverlayHealthIndicator indicator = new OverlayHealthIndicator(new OverlayCoordinator(null), List.of(loop));

            Health health = indicator.health();

            assertThat(health.getStatus()).isEqualTo(Status.UP);
            assertThat(health.getDetails()).containsEntry("visible", "none");
            assertThat(health.getDetails()).containsEntry("elements", 0);
        } finally {
            loop.close();
        }
    }

    @Test
    void downWhenARenderLoopStopped() {
        RenderLoop running = new RenderLoop("overlay-grid");
        RenderLoop stopped = new RenderLoop("overlay-help");
        stopped.close();
        try {
            OverlayHealthIndicator indicator = new OverlayHealthIndicator(new OverlayCoordinator(null),
                    List.of(running, stopped));

            Health health = indicator.health();

            assertThat(health.getStatus()).isEqualTo(Status.DOWN);
            assertThat(health.getDetails()).containsEntry("stopped", List.of("overlay-help"));
        } finally {
            running.close();
        }
    }
}
