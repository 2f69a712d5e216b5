package com.sectionviewer.render;

import com.sectionviewer.clip.Anchor;
import com.sectionviewer.math.Axis;
import org.joml.Vector3d;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class VirtualGizmoTest {

    private final VirtualGizmo gizmo = new VirtualGizmo();
    private final Anchor anchor = new Anchor("a");

    @Test
    void dragTo_movesAlongConstrainedAxisOnly() {
        List<Boolean> dragging = new ArrayList<>();
        gizmo.addDraggingListener(dragging::add);
        gizmo.attach(anchor);
        gizmo.setAxisConstraint(Axis.Y);
        gizmo.setEnabled(true);

        assertThat(gizmo.dragTo(new Vector3d(1, 2, 3))).isTrue();

        assertThat(anchor.getPosition().x()).isEqualTo(0.0);
        assertThat(anchor.getPosition().y()).isEqualTo(2.0);
        assertThat(anchor.getPosition().z()).isEqualTo(0.0);
        assertThat(dragging).containsExactly(true, false);
    }

    @Test
    void dragTo_refusedWhenDisabledOrDetached() {
        gizmo.attach(anchor);
        assertThat(gizmo.dragTo(new Vector3d(1, 1, 1))).isFalse();

        gizmo.setEnabled(true);
        gizmo.detach();
        assertThat(gizmo.dragTo(new Vector3d(1, 1, 1))).isFalse();
        assertThat(anchor.getPosition().x()).isEqualTo(0.0);
    }

    @Test
    void reportsAnyChangeOfAttachedAnchorUntilDetached() {
        AtomicInteger changes = new AtomicInteger();
        gizmo.addChangeListener(changes::incrementAndGet);
        gizmo.attach(anchor);

        anchor.setPosition(1, 0, 0);
        anchor.setPosition(1, 0, 0);
        assertThat(changes.get()).isEqualTo(1);

        Anchor other = new Anchor("b");
        gizmo.attach(other);
        anchor.setPosition(2, 0, 0);
        assertThat(changes.get()).isEqualTo(1);
        assertThat(gizmo.getAttached()).isSameAs(other);

        gizmo.detach();
        other.setPosition(3, 0, 0);
        assertThat(changes.get()).isEqualTo(1);
    }
}
