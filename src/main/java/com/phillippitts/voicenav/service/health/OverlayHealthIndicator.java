package com.phillippitts.voicenav.service.health;

import com.phillippitts.voicenav.service.overlay.OverlayCoordinator;
import com.phillippitts.voicenav.service.overlay.OverlayKind;
import com.phillippitts.voicenav.service.overlay.render.RenderLoop;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.List;
import java.util.Map;

/**
 * Health indicator for the overlay subsystem.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: every render loop is running</li>
 *   <li>DOWN: a render loop has stopped (its overlay can no longer draw)</li>
 * </ul>
 *
 * <p>Details include the visible overlay and the registered kinds. Exposed via /actuator/health.
 */
public class OverlayHealthIndicator implements HealthIndicator {

    private final OverlayCoordinator coordinator;
    private final List<RenderLoop> renderLoops;

    public OverlayHealthIndicator(OverlayCoordinator coordinator, List<RenderLoop> renderLoops) {
        this.coordinator = coordinator;
        this.renderLoops = List.copyOf(renderLoops);
    }

    @Override
    public Health health() {
        List<String> stopped = renderLoops.stream()
                .filter(l -> !l.isAlive())
                .map(RenderLoop::getName)
                .toList();
        Map<OverlayKind, Boolean> registrations = coordinator.registrations();

        Health.Builder builder = stopped.isEmpty() ? Health.up() : Health.down().withDetail("stopped", stopped);
        return builder
                .withDetail("visible", coordinator.getCurrentKind().map(Enum::name).orElse("none"))
                .withDetail("registered", registrations)
                .withDetail("elements", coordinator.elementPositions().size())
                .build();
    }
}
