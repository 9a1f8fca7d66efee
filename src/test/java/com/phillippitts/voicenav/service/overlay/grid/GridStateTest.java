package com.phillippitts.voicenav.service.overlay.grid;

import com.phillippitts.voicenav.domain.ScreenBounds;
import com.phillippitts.voicenav.domain.ScreenPoint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GridStateTest {

    private static final ScreenBounds SCREEN = ScreenBounds.screen(1800, 900);

    @Test
    void unshownHasNoCells() {
        GridState s = GridState.unshown();

        assertThat(s.getPhase()).isEqualTo(GridState.Phase.UNSHOWN);
        assertThat(s.isShown()).isFalse();
        assertThat(s.elementPosition(1)).isEmpty();
        assertThat(s.positions()).isEmpty();
        assertThat(s.refine(1)).isEmpty();
        assertThat(s.getRefinedCell()).isEmpty();
    }

    @Test
    void showNumbersCellsRowMajorFromTopLeft() {
        GridState s = GridState.unshown().show(SCREEN, 3);

        assertThat(s.getPhase()).isEqualTo(GridState.Phase.FULL);
        assertThat(s.cellCount()).isEqualTo(9);
        assertThat(s.cellBounds(1)).contains(new ScreenBounds(0, 0, 600, 300));
        assertThat(s.cellBounds(3)).contains(new ScreenBounds(1200, 0, 600, 300));
        assertThat(s.cellBounds(5)).contains(new ScreenBounds(600, 300, 600, 300));
        assertThat(s.elementPosition(5)).contains(new ScreenPoint(900, 450));
        assertThat(s.elementPosition(9)).contains(new ScreenPoint(1500, 750));
        assertThat(s.positions()).hasSize(9).containsKeys(1, 9);
    }

    @Test
    void outOfRangeCellsAreEmpty() {
        GridState s = GridState.unshown().show(SCREEN, 3);

        assertThat(s.elementPosition(0)).isEmpty();
        assertThat(s.elementPosition(10)).isEmpty();
        assertThat(s.cellBounds(-1)).isEmpty();
    }

    @Test
    void refineZoomsIntoCellWithThreeByThree() {
        GridState full = GridState.unshown().show(SCREEN, 3);

        GridState refined = full.refine(5).orElseThrow();

        assertThat(refined.getPhase()).isEqualTo(GridState.Phase.REFINED);
        assertThat(refined.getSize()).isEqualTo(GridState.REFINED_SIZE);
        assertThat(refined.getRefinedCell()).hasValue(5);
        assertThat(refined.getBounds()).contains(new ScreenBounds(600, 300, 600, 300));
        assertThat(refined.elementPosition(1)).contains(new ScreenPoint(700, 350));
        assertThat(refined.elementPosition(5)).contains(new ScreenPoint(900, 450));
    }

    @Test
    void refinedPositionsStayInsideParentCell() {
        GridState full = GridState.unshown().show(SCREEN, 9);
        ScreenBounds parent = full.cellBounds(41).orElseThrow();

        GridState refined = full.refine(41).orElseThrow();

        for (int n = 1; n <= refined.cellCount(); n++) {
            assertThat(parent.contains(refined.elementPosition(n).orElseThrow())).isTrue();
        }
    }

    @Test
    void refineAgainZoomsFurther() {
        GridState twice = GridState.unshown().show(SCREEN, 3).refine(5).orElseThrow().refine(9).orElseThrow();

        assertThat(twice.getBounds()).contains(new ScreenBounds(1000, 500, 200, 100));
        assertThat(twice.getRefinedCell()).hasValue(9);
    }

    @Test
    void invalidRefineLeavesStateUnchanged() {
        GridState full = GridState.unshown().show(SCREEN, 3);

        assertThat(full.refine(0)).isEmpty();
        assertThat(full.refine(10)).isEmpty();
        assertThat(full.getPhase()).isEqualTo(GridState.Phase.FULL);
    }

    @Test
    void showAfterRefineResetsToFullScreen() {
        GridState refined = GridState.unshown().show(SCREEN, 3).refine(2).orElseThrow();

        GridState again = refined.show(SCREEN, 4);

        assertThat(again.getPhase()).isEqualTo(GridState.Phase.FULL);
        assertThat(again.getRefinedCell()).isEmpty();
        assertThat(again.cellCount()).isEqualTo(16);
    }

    @Test
    void hideReturnsUnshown() {
        GridState s = GridState.unshown().show(SCREEN, 3).hide();

        assertThat(s.isShown()).isFalse();
        assertThat(s.elementPosition(1)).isEmpty();
    }

    @Test
    void refinedCenterMatchesParentCenterOnUnevenScreens() {
        int mismatches = 0;
        for (int width = 20; width <= 400; width += 7) {
            for (int height = 20; height <= 400; height += 11) {
                mismatches += roundTripMismatches(ScreenBounds.screen(width, height));
            }
        }
        mismatches += roundTripMismatches(ScreenBounds.screen(20, 141));
        mismatches += roundTripMismatches(ScreenBounds.screen(1366, 768));

        assertThat(mismatches).isZero();
    }

    @Test
    void parentCenterOnHalfPixelRoundsTheSameWayAfterRefine() {
        GridState full = GridState.unshown().show(ScreenBounds.screen(20, 141), 9);

        ScreenPoint parent = full.elementPosition(64).orElseThrow();

        assertThat(parent).isEqualTo(new ScreenPoint(1, 118));
        assertThat(full.refine(64).orElseThrow().elementPosition(5)).contains(parent);
    }

    @Test
    void nestedRefineKeepsCenterOnOriginalCell() {
        GridState full = GridState.unshown().show(ScreenBounds.screen(1366, 768), 9);
        ScreenPoint parent = full.elementPosition(17).orElseThrow();

        GridState twice = full.refine(17).orElseThrow().refine(5).orElseThrow();

        assertThat(twice.elementPosition(5)).contains(parent);
    }

    @Test
    void refusesToRefineBelowOnePixel() {
        GridState s = GridState.unshown().show(ScreenBounds.screen(30, 30), 3);

        s = s.refine(5).orElseThrow();
        s = s.refine(5).orElseThrow();
        s = s.refine(5).orElseThrow();

        assertThat(s.getBounds().orElseThrow().width()).isLessThan(3.0);
        assertThat(s.refine(5)).isEmpty();
    }

    private static int roundTripMismatches(ScreenBounds screen) {
        GridState full = GridState.unshown().show(screen, 9);
        int mismatches = 0;
        for (int cell = 1; cell <= full.cellCount(); cell++) {
            ScreenPoint parent = full.elementPosition(cell).orElseThrow();
            ScreenPoint child = full.refine(cell).orElseThrow().elementPosition(5).orElseThrow();
            if (!parent.equals(child)) {
                mismatches++;
            }
        }
        return mismatches;
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThatThrownBy(() -> GridState.unshown().show(SCREEN, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
