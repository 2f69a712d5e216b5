package com.sectionviewer.clip;

import com.sectionviewer.math.Axis;
import com.sectionviewer.math.ClipPlane;
import com.sectionviewer.mesh.BoundingBox;
import com.sectionviewer.mesh.CapMesh;
import com.sectionviewer.mesh.MeshSource;
import com.sectionviewer.render.CameraControls;
import com.sectionviewer.render.Gizmo;
import com.sectionviewer.render.RendererSink;
import org.joml.Matrix4d;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cross-section clipping for the loaded model.
 * <p>
 * Entry point for every state change: each mutator updates the
 * {@link PlaneRegistry}, rebuilds the affected caps from scratch, pushes plane
 * equations and caps to the {@link RendererSink}, re-attaches the {@link Gizmo}
 * and emits a {@link ClippingEvent}. Unchanged values are re-synchronized but
 * emit nothing. A null axis is ignored.
 * <p>
 * Single-threaded: call from the update loop only.
 */
public class ClippingEngine {

    private static final Logger LOG = Logger.getLogger(ClippingEngine.class.getName());

    /** Opacity changes smaller than this are ignored. */
    public static final double OPACITY_EPSILON = 1e-3;

    private final PlaneRegistry registry;
    private final BoundsAdapter bounds;
    private final InteractionBridge bridge;
    private final RendererSink renderer;
    private final Gizmo gizmo;
    private final List<ClippingListener> listeners = new ArrayList<>();
    private CameraControls cameraControls;
    private MeshSource model;

    public ClippingEngine(RendererSink renderer, Gizmo gizmo) {
        this(renderer, gizmo, FillStyle.DEFAULT);
    }

    public ClippingEngine(RendererSink renderer, Gizmo gizmo, FillStyle fill) {
        this.renderer = renderer;
        this.gizmo = gizmo;
        this.registry = new PlaneRegistry(fill);
        this.bounds = new BoundsAdapter(registry);
        this.bridge = new InteractionBridge(registry, this::setOffset);

        gizmo.setEnabled(false);
        gizmo.setVisible(false);
        gizmo.addChangeListener(bridge::onGizmoChanged);
        gizmo.addDraggingListener(dragging -> {
            if (cameraControls != null) {
                cameraControls.setEnabled(!dragging);
            }
        });

        try (InteractionBridge.Scope ignored = bridge.programmaticUpdate()) {
            rebuildAll();
        }
        syncClipPlanes();
    }

    public void setCameraControls(CameraControls cameraControls) {
        this.cameraControls = cameraControls;
    }

    // ---- Model ----

    /** Replace the model (null unloads it) and refit plane ranges to its bounds. */
    public void setModel(MeshSource model) {
        this.model = model;
        LOG.info("[ClippingEngine] Model " + (model != null ? "loaded" : "cleared"));
        updateBoundsFromModel();
    }

    public MeshSource getModel() {
        return model;
    }

    /** The model moved or changed shape: refit ranges and rebuild caps. */
    public void modelTransformed() {
        updateBoundsFromModel();
    }

    private void updateBoundsFromModel() {
        updateBoundsFromBox(BoundingBox.of(model));
    }

    /** Fit plane ranges to {@code box} (null resets them to [-1, 1]). */
    public void updateBoundsFromBox(BoundingBox box) {
        try (InteractionBridge.Scope ignored = bridge.programmaticUpdate()) {
            bounds.updateFromBoundingBox(box);
            rebuildAll();
        }
        syncClipPlanes();
        refreshGizmo();
        LOG.info("[ClippingEngine] Bounds updated: " + (box != null ? box : "none")
                 + ", helper size " + registry.getHelperSize());
        emit(ClippingEvent.Type.BOUNDS_CHANGED, null);
    }

    // ---- Engine-wide switches ----

    public boolean isClippingEnabled() {
        return registry.isEnabled();
    }

    /** Master switch. Returns the resulting state. */
    public boolean setClippingEnabled(boolean enabled) {
        boolean changed;
        try (InteractionBridge.Scope ignored = bridge.programmaticUpdate()) {
            changed = registry.setClippingEnabled(enabled);
            rebuildAll();
        }
        syncClipPlanes();
        refreshGizmo();
        if (changed) {
            emit(ClippingEvent.Type.CLIPPING_TOGGLED, null);
        }
        return registry.isEnabled();
    }

    public Axis getActiveAxis() {
        return registry.getActiveAxis();
    }

    /** Choose which plane the gizmo drives. Returns the resulting active axis. */
    public Axis setActiveAxis(Axis axis) {
        boolean changed = registry.setActiveAxis(axis);
        refreshGizmo();
        if (changed) {
            emit(ClippingEvent.Type.ACTIVE_AXIS_CHANGED, registry.getActiveAxis());
        }
        return registry.getActiveAxis();
    }

    public PlaneDescriptor getActiveDescriptor() {
        return registry.activeDescriptor();
    }

    // ---- Per-plane ----

    /** Read access to one plane; null for a null axis. */
    public PlaneDescriptor descriptor(Axis axis) {
        return registry.get(axis);
    }

    /** Enable or disable one plane. Returns the resulting state (false for a null axis). */
    public boolean setPlaneEnabled(Axis axis, boolean enabled) {
        PlaneDescriptor d = registry.get(axis);
        if (d == null) return false;
        boolean changed;
        try (InteractionBridge.Scope ignored = bridge.programmaticUpdate()) {
            changed = registry.setEnabled(axis, enabled);
            rebuild(d);
        }
        syncClipPlanes();
        refreshGizmo();
        if (changed) {
            emit(ClippingEvent.Type.AXIS_ENABLED, axis);
        }
        return d.isEnabled();
    }

    /**
     * Move one plane, clamped into its range. Returns the resulting offset
     * (0 for a null axis).
     */
    public double setOffset(Axis axis, double offset) {
        PlaneDescriptor d = registry.get(axis);
        if (d == null) return 0;
        boolean changed;
        try (InteractionBridge.Scope ignored = bridge.programmaticUpdate()) {
            changed = registry.setOffset(axis, offset);
            if (changed) {
                rebuild(d);
            }
        }
        if (changed) {
            syncClipPlanes();
            emit(ClippingEvent.Type.OFFSET_CHANGED, axis);
        }
        return d.getOffset();
    }

    /** Flip one plane's facing. Returns true if it is now inverted. */
    public boolean invertNormal(Axis axis) {
        PlaneDescriptor d = registry.get(axis);
        if (d == null) return false;
        try (InteractionBridge.Scope ignored = bridge.programmaticUpdate()) {
            registry.invertNormal(axis);
            rebuild(d);
        }
        syncClipPlanes();
        refreshGizmo();
        emit(ClippingEvent.Type.NORMAL_INVERTED, axis);
        return d.isInverted();
    }

    /** Disable all planes, centre them and restore default facing. */
    public void resetAll(boolean silent) {
        try (InteractionBridge.Scope ignored = bridge.programmaticUpdate()) {
            registry.resetAll();
            rebuildAll();
        }
        syncClipPlanes();
        refreshGizmo();
        if (!silent) {
            emit(ClippingEvent.Type.RESET, null);
        }
    }

    // ---- Fill style ----

    public FillStyle getFillStyle() {
        return registry.getFill();
    }

    public boolean setFillEnabled(boolean enabled) {
        if (registry.setFill(registry.getFill().withEnabled(enabled))) {
            pushAll();
            emit(ClippingEvent.Type.FILL_STYLE_CHANGED, null);
        }
        return registry.getFill().enabled();
    }

    /**
     * Set the cap color from text. Unparsable input keeps the current color.
     *
     * @return the resulting color as "#rrggbb"
     */
    public String setFillColor(String color) {
        int rgb;
        try {
            rgb = FillStyle.parseColor(color);
        } catch (IllegalArgumentException e) {
            LOG.fine("[ClippingEngine] Ignoring fill color: " + e.getMessage());
            return registry.getFill().hex();
        }
        if (registry.setFill(registry.getFill().withRgb(rgb))) {
            pushAll();
            emit(ClippingEvent.Type.FILL_STYLE_CHANGED, null);
        }
        return registry.getFill().hex();
    }

    /** Set cap opacity, clamped to [0, 1]. Returns the resulting opacity. */
    public double setFillOpacity(double opacity) {
        FillStyle fill = registry.getFill();
        if (Double.isNaN(opacity)) return fill.opacity();
        double clamped = Math.max(0, Math.min(1, opacity));
        if (Math.abs(clamped - fill.opacity()) < OPACITY_EPSILON) return fill.opacity();
        registry.setFill(fill.withOpacity(clamped));
        pushAll();
        emit(ClippingEvent.Type.FILL_STYLE_CHANGED, null);
        return registry.getFill().opacity();
    }

    // ---- Snapshot & listeners ----

    public ClippingState snapshot() {
        return registry.snapshot();
    }

    /** Clip planes currently handed to the renderer. */
    public List<ClipPlane> activePlanes() {
        return registry.activePlanes();
    }

    public double getHelperSize() {
        return registry.getHelperSize();
    }

    public void addListener(ClippingListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ClippingListener listener) {
        listeners.remove(listener);
    }

    InteractionBridge bridge() {
        return bridge;
    }

    // ---- Internals ----

    private void rebuildAll() {
        for (PlaneDescriptor d : registry.all()) {
            rebuild(d);
        }
    }

    /** Recompute one cap wholesale and push the plane's visuals. */
    private void rebuild(PlaneDescriptor d) {
        d.update();
        d.replaceCap(CapPipeline.recomputeCap(d, registry.isEnabled(), model));
        push(d);
    }

    private void pushAll() {
        for (PlaneDescriptor d : registry.all()) {
            push(d);
        }
    }

    private void push(PlaneDescriptor d) {
        boolean shown = registry.isEnabled() && d.isEnabled();
        CapMesh cap = d.getCapMesh();
        FillStyle fill = registry.getFill();
        Matrix4d transform = d.getAnchor().worldTransform();
        d.getAnchor().setVisible(shown);
        renderer.updatePlaneHelper(d.getAxis(), transform, registry.getHelperSize(), shown);
        renderer.updateCap(d.getAxis(), cap, transform, fill, shown && fill.enabled() && !cap.isEmpty());
    }

    private void syncClipPlanes() {
        List<ClipPlane> planes = registry.activePlanes();
        renderer.updateClipPlanes(planes, !planes.isEmpty());
    }

    /** Attach the gizmo to the active anchor if that plane is live, otherwise park it. */
    private void refreshGizmo() {
        try (InteractionBridge.Scope ignored = bridge.programmaticUpdate()) {
            PlaneDescriptor active = registry.activeDescriptor();
            if (!registry.isEnabled() || !active.isEnabled()) {
                gizmo.detach();
                gizmo.setVisible(false);
                gizmo.setEnabled(false);
                return;
            }
            gizmo.setAxisConstraint(active.getAxis());
            gizmo.attach(active.getAnchor());
            gizmo.setEnabled(true);
            gizmo.setVisible(true);
        }
    }

    private void emit(ClippingEvent.Type type, Axis axis) {
        if (listeners.isEmpty()) return;
        ClippingEvent event = new ClippingEvent(type, axis, registry.snapshot());
        for (ClippingListener l : new ArrayList<>(listeners)) {
            try {
                l.onClippingEvent(event);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "[ClippingEngine] Listener failed on " + type.wireName(), e);
            }
        }
    }
}
