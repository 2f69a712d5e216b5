package com.sectionviewer.clip;

import com.sectionviewer.math.Axis;
import com.sectionviewer.math.ClipPlane;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the three plane descriptors (one per {@link Axis}, stored in a fixed
 * array indexed by ordinal) and the engine-wide settings: master enable,
 * active axis, fill style and helper size.
 * <p>
 * Mutators validate and clamp their input, rebuild the plane equation of the
 * affected descriptor and report whether anything changed. A null axis is a
 * no-op. Recomputing caps and notifying the renderer is the caller's job
 * ({@link ClippingEngine}).
 */
public final class PlaneRegistry {

    /** Offset changes smaller than this are ignored. */
    public static final double OFFSET_EPSILON = 1e-4;

    private final PlaneDescriptor[] descriptors = new PlaneDescriptor[Axis.COUNT];
    private boolean enabled;
    private Axis activeAxis = Axis.X;
    private FillStyle fill;
    private double helperSize = BoundsAdapter.DEFAULT_HELPER_SIZE;

    public PlaneRegistry() {
        this(FillStyle.DEFAULT);
    }

    public PlaneRegistry(FillStyle fill) {
        this.fill = fill != null ? fill : FillStyle.DEFAULT;
        for (Axis axis : Axis.values()) {
            descriptors[axis.ordinal()] = new PlaneDescriptor(axis);
        }
    }

    /** Descriptor for {@code axis}, or null if axis is null. */
    public PlaneDescriptor get(Axis axis) {
        return axis != null ? descriptors[axis.ordinal()] : null;
    }

    /** All descriptors in X, Y, Z order. */
    public List<PlaneDescriptor> all() {
        return List.of(descriptors);
    }

    public PlaneDescriptor activeDescriptor() {
        return descriptors[activeAxis.ordinal()];
    }

    // ---- Engine-wide settings ----

    public boolean isEnabled() { return enabled; }

    boolean setClippingEnabled(boolean enabled) {
        if (this.enabled == enabled) return false;
        this.enabled = enabled;
        return true;
    }

    public Axis getActiveAxis() { return activeAxis; }

    boolean setActiveAxis(Axis axis) {
        if (axis == null || axis == activeAxis) return false;
        activeAxis = axis;
        return true;
    }

    public FillStyle getFill() { return fill; }

    boolean setFill(FillStyle fill) {
        if (fill == null || fill.equals(this.fill)) return false;
        this.fill = fill;
        return true;
    }

    public double getHelperSize() { return helperSize; }

    void setHelperSize(double helperSize) { this.helperSize = helperSize; }

    // ---- Per-axis mutators ----

    /** Enable or disable one plane. The descriptor is re-validated either way. */
    boolean setEnabled(Axis axis, boolean enabled) {
        PlaneDescriptor d = get(axis);
        if (d == null) return false;
        boolean changed = d.isEnabled() != enabled;
        d.setEnabled(enabled);
        d.update();
        return changed;
    }

    /**
     * Move one plane. The value is clamped into the descriptor's range; changes below
     * {@link #OFFSET_EPSILON} and non-finite values are ignored.
     */
    boolean setOffset(Axis axis, double offset) {
        PlaneDescriptor d = get(axis);
        if (d == null || !Double.isFinite(offset)) return false;
        double clamped = PlaneDescriptor.clamp(offset, d.getMin(), d.getMax());
        if (Math.abs(clamped - d.getOffset()) < OFFSET_EPSILON) {
            d.update();
            return false;
        }
        d.setOffset(clamped);
        d.update();
        return true;
    }

    /** Flip the facing of one plane without moving it. */
    boolean invertNormal(Axis axis) {
        PlaneDescriptor d = get(axis);
        if (d == null) return false;
        d.setNormalSign(-d.getNormalSign());
        d.update();
        return true;
    }

    /** Disable every plane, move it back to offset 0 (clamped) and restore the default facing. */
    void resetAll() {
        for (PlaneDescriptor d : descriptors) {
            d.setEnabled(false);
            d.setOffset(0);
            d.setNormalSign(1);
            d.update();
        }
    }

    // ---- Queries ----

    /** Planes the renderer should clip with: the enabled ones, or none when clipping is off. */
    public List<ClipPlane> activePlanes() {
        List<ClipPlane> planes = new ArrayList<>(Axis.COUNT);
        if (!enabled) return planes;
        for (PlaneDescriptor d : descriptors) {
            if (d.isEnabled()) {
                planes.add(d.getPlane());
            }
        }
        return planes;
    }

    public ClippingState snapshot() {
        Map<Axis, ClippingState.PlaneState> planes = new EnumMap<>(Axis.class);
        for (PlaneDescriptor d : descriptors) {
            planes.put(d.getAxis(), new ClippingState.PlaneState(
                d.isEnabled(), d.getOffset(), d.getMin(), d.getMax(), d.isInverted()));
        }
        return new ClippingState(enabled, activeAxis, fill.enabled(), fill.hex(), fill.opacity(), planes);
    }
}
