package com.sectionviewer.clip;

import com.sectionviewer.math.Axis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InteractionBridgeTest {

    private record Commit(Axis axis, double offset) {}

    private final PlaneRegistry registry = new PlaneRegistry();
    private final List<Commit> commits = new ArrayList<>();
    private final InteractionBridge bridge = new InteractionBridge(registry, (axis, v) -> commits.add(new Commit(axis, v)));

    @BeforeEach
    void enableX() {
        registry.setClippingEnabled(true);
        registry.setEnabled(Axis.X, true);
    }

    @Test
    void onGizmoChanged_commitsAlongActiveAxis() {
        registry.get(Axis.X).getAnchor().setPosition(0.5, 3, -2);

        assertThat(bridge.onGizmoChanged()).isTrue();
        assertThat(commits).containsExactly(new Commit(Axis.X, 0.5));
    }

    @Test
    void onGizmoChanged_clampsIntoRange() {
        registry.get(Axis.X).getAnchor().setPosition(9, 0, 0);

        bridge.onGizmoChanged();

        assertThat(commits).containsExactly(new Commit(Axis.X, 1.0));
    }

    @Test
    void onGizmoChanged_ignoresSubEpsilonMoves() {
        registry.get(Axis.X).getAnchor().setPosition(InteractionBridge.DRAG_EPSILON / 2, 0, 0);

        assertThat(bridge.onGizmoChanged()).isFalse();
        assertThat(commits).isEmpty();
    }

    @Test
    void onGizmoChanged_ignoresDisabledActivePlane() {
        registry.setEnabled(Axis.X, false);
        registry.get(Axis.X).getAnchor().setPosition(0.5, 0, 0);

        assertThat(bridge.onGizmoChanged()).isFalse();
        assertThat(commits).isEmpty();
    }

    @Test
    void programmaticUpdate_suppressesNotifications() {
        registry.get(Axis.X).getAnchor().setPosition(0.5, 0, 0);

        try (InteractionBridge.Scope ignored = bridge.programmaticUpdate()) {
            assertThat(bridge.isSuppressed()).isTrue();
            assertThat(bridge.onGizmoChanged()).isFalse();
        }

        assertThat(bridge.isSuppressed()).isFalse();
        assertThat(commits).isEmpty();
    }

    @Test
    void programmaticUpdate_nests() {
        InteractionBridge.Scope outer = bridge.programmaticUpdate();
        InteractionBridge.Scope inner = bridge.programmaticUpdate();

        inner.close();
        inner.close();
        assertThat(bridge.isSuppressed()).isTrue();

        outer.close();
        assertThat(bridge.isSuppressed()).isFalse();
    }

    @Test
    void programmaticUpdate_endsWhenBodyThrows() {
        assertThatThrownBy(() -> {
            try (InteractionBridge.Scope ignored = bridge.programmaticUpdate()) {
                throw new IllegalStateException("boom");
            }
        }).isInstanceOf(IllegalStateException.class);

        assertThat(bridge.isSuppressed()).isFalse();
    }
}
