package com.sectionviewer.clip;

import com.sectionviewer.math.Axis;

import java.util.function.ObjDoubleConsumer;

/**
 * Feeds gizmo drags back into the active plane's offset.
 * <p>
 * Programmatic descriptor updates move anchors too, and the gizmo reports those
 * moves like any other. Such updates run inside a {@link #programmaticUpdate()}
 * scope, during which gizmo notifications are ignored.
 */
public final class InteractionBridge {

    /** Drags that move the offset by less than this are ignored. */
    public static final double DRAG_EPSILON = 1e-4;

    private final PlaneRegistry registry;
    private final ObjDoubleConsumer<Axis> commitOffset;
    private int suppressDepth;

    /**
     * @param registry     plane state
     * @param commitOffset the regular offset-mutation path (recompute, renderer sync, events)
     */
    public InteractionBridge(PlaneRegistry registry, ObjDoubleConsumer<Axis> commitOffset) {
        this.registry = registry;
        this.commitOffset = commitOffset;
    }

    /**
     * Open a region in which gizmo notifications are ignored. Regions nest;
     * use with try-with-resources.
     */
    public Scope programmaticUpdate() {
        suppressDepth++;
        return new Scope();
    }

    public boolean isSuppressed() {
        return suppressDepth > 0;
    }

    /**
     * Gizmo change notification. Reads the active anchor's position along its own
     * axis, clamps it into range and commits it if it moved far enough.
     *
     * @return true if an offset was committed
     */
    public boolean onGizmoChanged() {
        if (isSuppressed()) return false;
        PlaneDescriptor d = registry.activeDescriptor();
        if (!d.isEnabled()) return false;

        double dragged = d.getAxis().component(d.getAnchor().getPosition());
        double clamped = PlaneDescriptor.clamp(dragged, d.getMin(), d.getMax());
        if (Math.abs(clamped - d.getOffset()) < DRAG_EPSILON) return false;

        commitOffset.accept(d.getAxis(), clamped);
        return true;
    }

    /** Suppression region handle. Closing twice is harmless. */
    public final class Scope implements AutoCloseable {
        private boolean closed;

        private Scope() {}

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                suppressDepth--;
            }
        }
    }
}
