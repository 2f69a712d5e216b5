package com.sectionviewer.render;

import com.sectionviewer.clip.Anchor;
import com.sectionviewer.math.Axis;

import java.util.function.Consumer;

/**
 * Draggable translate handle. At most one anchor is attached at a time;
 * attaching another detaches the current one.
 */
public interface Gizmo {

    void attach(Anchor anchor);

    void detach();

    /** Currently attached anchor, or null. */
    Anchor getAttached();

    /** Restrict translation to one axis. */
    void setAxisConstraint(Axis axis);

    void setEnabled(boolean enabled);

    boolean isEnabled();

    void setVisible(boolean visible);

    boolean isVisible();

    /** Fired whenever the attached anchor's transform changes. */
    void addChangeListener(Runnable listener);

    /** Fired with true when a drag starts and false when it ends. */
    void addDraggingListener(Consumer<Boolean> listener);
}
