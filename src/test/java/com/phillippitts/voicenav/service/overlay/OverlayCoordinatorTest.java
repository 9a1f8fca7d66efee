package com.phillippitts.voicenav.service.overlay;

import com.phillippitts.voicenav.domain.ScreenPoint;
import com.phillippitts.voicenav.service.events.EventType;
import com.phillippitts.voicenav.testutil.RecordingEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class OverlayCoordinatorTest {

    private RecordingEventBus bus;
    private OverlayCoordinator coordinator;
    private List<String> calls;
    private StubOverlay grid;
    private StubOverlay help;

    @BeforeEach
    void setUp() {
        bus = new RecordingEventBus();
        coordinator = new OverlayCoordinator(bus);
        calls = new ArrayList<>();
        grid = new StubOverlay(OverlayKind.GRID, calls);
        help = new StubOverlay(OverlayKind.HELP, calls);
        coordinator.register(grid);
        coordinator.register(help);
    }

    @Test
    void showRunsValidationShowAndOnShowInOrder() {
        assertThat(coordinator.show(OverlayKind.GRID, Map.of())).isTrue();

        assertThat(calls).containsExactly("grid.validate", "grid.show", "grid.onShow");
        assertThat(coordinator.isVisible(OverlayKind.GRID)).isTrue();
        assertThat(coordinator.getCurrentKind()).contains(OverlayKind.GRID);
        assertThat(bus.types()).containsExactly(EventType.OVERLAY_SHOWN);
        assertThat(bus.published.get(0).get("overlay")).isEqualTo("grid");
    }

    @Test
    void showingAnotherOverlayHidesTheVisibleOneFirst() {
        coordinator.show(OverlayKind.GRID, Map.of());
        calls.clear();

        coordinator.show(OverlayKind.HELP, Map.of());

        assertThat(calls).containsExactly("help.validate", "grid.hide", "grid.onHide", "help.show", "help.onShow");
        assertThat(bus.types()).containsExactly(
                EventType.OVERLAY_SHOWN, EventType.OVERLAY_HIDDEN, EventType.OVERLAY_SHOWN);
        assertThat(bus.published.get(1).get("overlay")).isEqualTo("grid");
        assertThat(bus.published.get(2).get("overlay")).isEqualTo("help");
        assertThat(coordinator.isVisible(OverlayKind.GRID)).isFalse();
        assertThat(coordinator.isVisible(OverlayKind.HELP)).isTrue();
    }

    @Test
    void showOptionsArePublished() {
        coordinator.show(OverlayKind.GRID, Map.of("grid_size", 4));

        assertThat(bus.published.get(0).data().get("options")).isEqualTo(Map.of("grid_size", 4));
    }

    @Test
    void vetoedShowKeepsCurrentOverlay() {
        coordinator.show(OverlayKind.HELP, Map.of());
        grid.valid = false;

        assertThat(coordinator.show(OverlayKind.GRID, Map.of())).isFalse();

        assertThat(coordinator.isVisible(OverlayKind.HELP)).isTrue();
        assertThat(bus.types()).containsExactly(EventType.OVERLAY_SHOWN);
    }

    @Test
    void unregisteredKindCannotBeShown() {
        assertThat(coordinator.show(OverlayKind.ELEMENT, Map.of())).isFalse();
        assertThat(coordinator.isAnyVisible()).isFalse();
    }

    @Test
    void failingShowLeavesNothingVisible() {
        grid.failOnShow = true;

        assertThat(coordinator.show(OverlayKind.GRID, Map.of())).isFalse();

        assertThat(coordinator.isAnyVisible()).isFalse();
        assertThat(bus.published).isEmpty();
    }

    @Test
    void hideOnlyAffectsTheVisibleKind() {
        coordinator.show(OverlayKind.GRID, Map.of());

        assertThat(coordinator.hide(OverlayKind.HELP)).isFalse();
        assertThat(coordinator.hide(OverlayKind.GRID)).isTrue();
        assertThat(coordinator.hideCurrent()).isFalse();
        assertThat(bus.types()).containsExactly(EventType.OVERLAY_SHOWN, EventType.OVERLAY_HIDDEN);
    }

    @Test
    void toggleAlternatesBetweenShowAndHide() {
        assertThat(coordinator.toggle(OverlayKind.GRID, Map.of())).isTrue();
        assertThat(coordinator.isVisible(OverlayKind.GRID)).isTrue();

        assertThat(coordinator.toggle(OverlayKind.GRID, Map.of())).isTrue();
        assertThat(coordinator.isAnyVisible()).isFalse();
    }

    @Test
    void writesFromInactiveOwnerAreDiscarded() {
        coordinator.show(OverlayKind.GRID, Map.of());

        assertThat(coordinator.replaceElementPositions(OverlayKind.HELP, Map.of(1, new ScreenPoint(1, 1)))).isFalse();
        assertThat(coordinator.replaceElementPositions(OverlayKind.GRID, Map.of(1, new ScreenPoint(10, 20)))).isTrue();

        assertThat(coordinator.elementPositions()).containsOnlyKeys(1);
        assertThat(coordinator.getElementPosition(1)).contains(new ScreenPoint(10, 20));
    }

    @Test
    void updateMergesIntoTable() {
        coordinator.show(OverlayKind.GRID, Map.of());
        coordinator.replaceElementPositions(OverlayKind.GRID, Map.of(1, new ScreenPoint(1, 1)));

        assertThat(coordinator.setElementPosition(OverlayKind.GRID, 2, new ScreenPoint(2, 2))).isTrue();

        assertThat(coordinator.elementPositions()).containsOnlyKeys(1, 2);
    }

    @Test
    void lookupFallsBackToOverlayStateWhenTableIsEmpty() {
        grid.position = Optional.of(new ScreenPoint(7, 8));
        coordinator.show(OverlayKind.GRID, Map.of());

        assertThat(coordinator.elementPositions()).isEmpty();
        assertThat(coordinator.getElementPosition(3)).contains(new ScreenPoint(7, 8));
        assertThat(coordinator.hasElement(3)).isTrue();
    }

    @Test
    void lookupWithNothingVisibleIsEmpty() {
        grid.position = Optional.of(new ScreenPoint(7, 8));

        assertThat(coordinator.getElementPosition(1)).isEmpty();
    }

    @Test
    void hideClearsTableAndMetadata() {
        coordinator.show(OverlayKind.GRID, Map.of());
        coordinator.replaceElementPositions(OverlayKind.GRID, Map.of(1, new ScreenPoint(1, 1)));
        coordinator.setMetadata("k", "v");

        coordinator.hideCurrent();

        assertThat(coordinator.elementPositions()).isEmpty();
        assertThat(coordinator.getMetadata("k")).isEmpty();
    }

    @Test
    void refineRequiresRefinableVisibleOverlay() {
        coordinator.show(OverlayKind.HELP, Map.of());

        assertThat(coordinator.refine(1)).isFalse();
        assertThat(coordinator.getMetadata("refined_cell")).isEmpty();
    }

    @Test
    void refineForwardsToOverlayAndRecordsCell() {
        RefinableStub refinable = new RefinableStub(calls);
        coordinator.register(refinable);
        coordinator.show(OverlayKind.ELEMENT, Map.of());

        assertThat(coordinator.refine(4)).isTrue();
        assertThat(coordinator.refine(99)).isFalse();

        assertThat(coordinator.getMetadata("refined_cell")).contains(4);
    }

    @Test
    void registrationsReportVisibility() {
        coordinator.show(OverlayKind.HELP, Map.of());

        assertThat(coordinator.registrations())
                .containsEntry(OverlayKind.GRID, false)
                .containsEntry(OverlayKind.HELP, true)
                .doesNotContainKey(OverlayKind.ELEMENT);
    }

    @Test
    void unregisterHidesVisibleOverlay() {
        coordinator.show(OverlayKind.GRID, Map.of());

        assertThat(coordinator.unregister(OverlayKind.GRID)).isTrue();

        assertThat(coordinator.isAnyVisible()).isFalse();
        assertThat(coordinator.getOverlay(OverlayKind.GRID)).isEmpty();
    }

    @Test
    void clearAllHidesAndResets() {
        coordinator.show(OverlayKind.GRID, Map.of());

        coordinator.clearAll();

        assertThat(coordinator.isAnyVisible()).isFalse();
        assertThat(grid.visible).isFalse();
        assertThat(bus.types()).endsWith(EventType.OVERLAY_HIDDEN);
    }

    @Test
    void worksWithoutEventBus() {
        OverlayCoordinator quiet = new OverlayCoordinator(null);
        quiet.register(grid);

        assertThat(quiet.show(OverlayKind.GRID, Map.of())).isTrue();
        assertThat(quiet.hideCurrent()).isTrue();
    }

    static class StubOverlay implements Overlay {
        private final OverlayKind kind;
        private final List<String> calls;
        boolean visible;
        boolean valid = true;
        boolean failOnShow;
        Optional<ScreenPoint> position = Optional.empty();

        StubOverlay(OverlayKind kind, List<String> calls) {
            this.kind = kind;
            this.calls = calls;
        }

        @Override public OverlayKind kind() { return kind; }

        @Override
        public void show(Map<String, Object> options) {
            if (failOnShow) {
                throw new IllegalStateException("boom");
            }
            calls.add(kind.label() + ".show");
            visible = true;
        }

        @Override
        public void hide() {
            calls.add(kind.label() + ".hide");
            visible = false;
        }

        @Override public boolean isVisible() { return visible; }
        @Override public Optional<ScreenPoint> elementPosition(int number) { return position; }

        @Override
        public boolean validateBeforeShow() {
            calls.add(kind.label() + ".validate");
            return valid;
        }

        @Override public void onShow() { calls.add(kind.label() + ".onShow"); }
        @Override public void onHide() { calls.add(kind.label() + ".onHide"); }
    }

    static class RefinableStub extends StubOverlay implements RefinableOverlay {
        RefinableStub(List<String> calls) {
            super(OverlayKind.ELEMENT, calls);
        }

        @Override
        public boolean refine(int cell) {
            return cell >= 1 && cell <= 9;
        }
    }
}
