package com.sectionviewer.clip;

import com.sectionviewer.math.Axis;
import com.sectionviewer.math.ClipPlane;
import com.sectionviewer.mesh.CapMesh;
import org.joml.Vector3d;

/**
 * State of the clipping plane for one axis: geometry, valid offset range,
 * facing, enablement and the current cap. Created once per axis by
 * {@link PlaneRegistry} and mutated in place for the life of the engine.
 * <p>
 * Invariant: {@code min <= offset <= max} after every {@link #update()}.
 */
public final class PlaneDescriptor {

    private final Axis axis;
    private final Anchor anchor;
    private ClipPlane plane;
    private double min = -1;
    private double max = 1;
    private double offset;
    private int normalSign = 1;
    private boolean enabled;
    private CapMesh capMesh = CapMesh.EMPTY;

    PlaneDescriptor(Axis axis) {
        if (axis == null) {
            throw new IllegalArgumentException("Unsupported clipping axis: null");
        }
        this.axis = axis;
        this.anchor = new Anchor("ClippingAnchor_" + axis.name());
        this.plane = ClipPlane.forAxis(axis, normalSign, offset);
        update();
    }

    /**
     * Re-clamp the offset and rebuild the plane equation and anchor pose from the
     * current fields. Does not touch the cap.
     */
    void update() {
        offset = clamp(offset, min, max);
        plane = ClipPlane.forAxis(axis, normalSign, offset);
        anchor.setPose(axis.unit(offset, new Vector3d()), plane);
    }

    static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    public Axis getAxis() { return axis; }
    public Anchor getAnchor() { return anchor; }
    public ClipPlane getPlane() { return plane; }
    public double getMin() { return min; }
    public double getMax() { return max; }
    public double getOffset() { return offset; }
    public int getNormalSign() { return normalSign; }
    public boolean isInverted() { return normalSign < 0; }
    public boolean isEnabled() { return enabled; }
    public CapMesh getCapMesh() { return capMesh; }

    void setRange(double min, double max) {
        this.min = min;
        this.max = max;
    }

    void setOffset(double offset) { this.offset = offset; }
    void setNormalSign(int normalSign) { this.normalSign = normalSign >= 0 ? 1 : -1; }
    void setEnabled(boolean enabled) { this.enabled = enabled; }

    /** Swap in a freshly computed cap; the previous one is dropped. */
    void replaceCap(CapMesh cap) {
        this.capMesh = cap != null ? cap : CapMesh.EMPTY;
    }

    @Override
    public String toString() {
        return "PlaneDescriptor[" + axis.key() + " offset=" + offset + " range=[" + min + ", " + max
                + "] sign=" + normalSign + " enabled=" + enabled + "]";
    }
}
