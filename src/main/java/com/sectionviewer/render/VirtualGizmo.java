package com.sectionviewer.render;

import com.sectionviewer.clip.Anchor;
import com.sectionviewer.math.Axis;
import org.joml.Vector3dc;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Translate gizmo without a screen. Drags arrive as target positions (from the
 * control channel or tests) and are projected onto the constrained axis.
 * <p>
 * Like an on-screen widget it reports every change of the attached anchor,
 * including moves it did not cause.
 */
public class VirtualGizmo implements Gizmo {

    private Anchor attached;
    private Axis constraint;
    private boolean enabled;
    private boolean visible;
    private final List<Runnable> changeListeners = new ArrayList<>();
    private final List<Consumer<Boolean>> draggingListeners = new ArrayList<>();
    private final Runnable anchorListener = this::fireChange;

    @Override
    public void attach(Anchor anchor) {
        if (anchor == attached) return;
        detach();
        attached = anchor;
        if (anchor != null) {
            anchor.addChangeListener(anchorListener);
        }
    }

    @Override
    public void detach() {
        if (attached != null) {
            attached.removeChangeListener(anchorListener);
            attached = null;
        }
    }

    @Override
    public Anchor getAttached() { return attached; }

    @Override
    public void setAxisConstraint(Axis axis) { this.constraint = axis; }

    public Axis getAxisConstraint() { return constraint; }

    @Override
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    @Override
    public boolean isEnabled() { return enabled; }

    @Override
    public void setVisible(boolean visible) { this.visible = visible; }

    @Override
    public boolean isVisible() { return visible; }

    @Override
    public void addChangeListener(Runnable listener) {
        changeListeners.add(listener);
    }

    @Override
    public void addDraggingListener(Consumer<Boolean> listener) {
        draggingListeners.add(listener);
    }

    /**
     * Drag the attached anchor towards {@code target}. Only the constrained axis
     * component is taken from the target.
     *
     * @return false if the gizmo is disabled or not attached
     */
    public boolean dragTo(Vector3dc target) {
        if (!enabled || attached == null) return false;
        fireDragging(true);
        try {
            Vector3dc p = attached.getPosition();
            double x = p.x(), y = p.y(), z = p.z();
            if (constraint == null || constraint == Axis.X) x = target.x();
            if (constraint == null || constraint == Axis.Y) y = target.y();
            if (constraint == null || constraint == Axis.Z) z = target.z();
            attached.setPosition(x, y, z);
        } finally {
            fireDragging(false);
        }
        return true;
    }

    private void fireChange() {
        for (Runnable l : new ArrayList<>(changeListeners)) {
            l.run();
        }
    }

    private void fireDragging(boolean dragging) {
        for (Consumer<Boolean> l : new ArrayList<>(draggingListeners)) {
            l.accept(dragging);
        }
    }
}
