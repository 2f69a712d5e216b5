package com.sectionviewer.clip;

import com.sectionviewer.math.Axis;
import com.sectionviewer.math.ClipPlane;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PlaneRegistryTest {

    private final PlaneRegistry registry = new PlaneRegistry();

    @Test
    void defaults_threeDisabledCentredPlanes() {
        assertThat(registry.all()).extracting(PlaneDescriptor::getAxis).containsExactly(Axis.X, Axis.Y, Axis.Z);
        for (PlaneDescriptor d : registry.all()) {
            assertThat(d.isEnabled()).isFalse();
            assertThat(d.getOffset()).isEqualTo(0.0);
            assertThat(d.getMin()).isEqualTo(-1.0);
            assertThat(d.getMax()).isEqualTo(1.0);
            assertThat(d.isInverted()).isFalse();
            assertThat(d.getCapMesh().isEmpty()).isTrue();
        }
        assertThat(registry.isEnabled()).isFalse();
        assertThat(registry.getActiveAxis()).isEqualTo(Axis.X);
        assertThat(registry.getFill()).isEqualTo(FillStyle.DEFAULT);
    }

    @Test
    void setOffset_clampsIntoRangeAndMovesPlaneAndAnchor() {
        assertThat(registry.setOffset(Axis.Y, 5)).isTrue();

        PlaneDescriptor d = registry.get(Axis.Y);
        assertThat(d.getOffset()).isEqualTo(1.0);
        assertThat(d.getPlane().distance(0, 1, 0)).isCloseTo(0.0, within(1e-12));
        assertThat(d.getAnchor().getPosition().y()).isEqualTo(1.0);

        assertThat(registry.setOffset(Axis.Y, 7)).isFalse();
        assertThat(registry.setOffset(Axis.Y, -3)).isTrue();
        assertThat(d.getOffset()).isEqualTo(-1.0);
    }

    @Test
    void setOffset_ignoresTinyChangesAndBadInput() {
        registry.setOffset(Axis.X, 0.5);

        assertThat(registry.setOffset(Axis.X, 0.5 + PlaneRegistry.OFFSET_EPSILON / 2)).isFalse();
        assertThat(registry.setOffset(Axis.X, Double.NaN)).isFalse();
        assertThat(registry.setOffset(Axis.X, Double.POSITIVE_INFINITY)).isFalse();
        assertThat(registry.setOffset(null, 0.2)).isFalse();
        assertThat(registry.get(Axis.X).getOffset()).isEqualTo(0.5);
    }

    @Test
    void invertNormal_twiceRestoresPlaneExactly() {
        registry.setOffset(Axis.Z, 0.3);
        ClipPlane before = registry.get(Axis.Z).getPlane();

        registry.invertNormal(Axis.Z);
        PlaneDescriptor d = registry.get(Axis.Z);
        assertThat(d.isInverted()).isTrue();
        assertThat(d.getPlane().nz()).isEqualTo(-1.0);
        assertThat(d.getPlane().distance(0, 0, 0.3)).isCloseTo(0.0, within(1e-12));

        registry.invertNormal(Axis.Z);
        assertThat(d.getPlane()).isEqualTo(before);
        assertThat(registry.invertNormal(null)).isFalse();
    }

    @Test
    void activePlanes_onlyWhenClippingEnabledInAxisOrder() {
        registry.setEnabled(Axis.Z, true);
        registry.setEnabled(Axis.X, true);
        assertThat(registry.activePlanes()).isEmpty();

        registry.setClippingEnabled(true);

        assertThat(registry.activePlanes()).containsExactly(
            registry.get(Axis.X).getPlane(), registry.get(Axis.Z).getPlane());
    }

    @Test
    void setActiveAxis_nullIsIgnored() {
        assertThat(registry.setActiveAxis(Axis.Z)).isTrue();
        assertThat(registry.setActiveAxis(Axis.Z)).isFalse();
        assertThat(registry.setActiveAxis(null)).isFalse();
        assertThat(registry.getActiveAxis()).isEqualTo(Axis.Z);
        assertThat(registry.activeDescriptor().getAxis()).isEqualTo(Axis.Z);
    }

    @Test
    void resetAll_disablesCentresAndRestoresFacing() {
        registry.setEnabled(Axis.Y, true);
        registry.setOffset(Axis.Y, 0.7);
        registry.invertNormal(Axis.Y);

        registry.resetAll();

        PlaneDescriptor d = registry.get(Axis.Y);
        assertThat(d.isEnabled()).isFalse();
        assertThat(d.getOffset()).isEqualTo(0.0);
        assertThat(d.isInverted()).isFalse();
    }

    @Test
    void snapshot_reflectsCurrentState() {
        registry.setClippingEnabled(true);
        registry.setEnabled(Axis.X, true);
        registry.setOffset(Axis.X, -0.25);
        registry.invertNormal(Axis.X);
        registry.setFill(FillStyle.DEFAULT.withRgb(0xff0000).withOpacity(0.5));

        ClippingState state = registry.snapshot();

        assertThat(state.enabled()).isTrue();
        assertThat(state.activeAxis()).isEqualTo(Axis.X);
        assertThat(state.fillColor()).isEqualTo("#ff0000");
        assertThat(state.fillOpacity()).isEqualTo(0.5);
        assertThat(state.plane(Axis.X)).isEqualTo(new ClippingState.PlaneState(true, -0.25, -1, 1, true));
        assertThat(state.plane(Axis.Y).enabled()).isFalse();
        assertThat(state.planes()).hasSize(3);
    }

    @Test
    void descriptor_nullAxisIsRejected() {
        assertThatThrownBy(() -> new PlaneDescriptor(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unsupported clipping axis");
    }
}
