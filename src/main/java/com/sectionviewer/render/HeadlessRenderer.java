package com.sectionviewer.render;

import com.sectionviewer.clip.FillStyle;
import com.sectionviewer.math.Axis;
import com.sectionviewer.math.ClipPlane;
import com.sectionviewer.mesh.CapMesh;
import org.joml.Matrix4d;
import org.joml.Matrix4dc;

import java.util.List;
import java.util.logging.Logger;

/**
 * Renderer stand-in for running without a window. Keeps the latest state it
 * was given so the control channel can report it.
 */
public class HeadlessRenderer implements RendererSink {

    private static final Logger LOG = Logger.getLogger(HeadlessRenderer.class.getName());

    /** Latest cap state for one axis. */
    public record CapSlot(CapMesh cap, Matrix4dc anchorTransform, FillStyle style, boolean visible) {}

    /** Latest helper state for one axis. */
    public record HelperSlot(Matrix4dc anchorTransform, double size, boolean visible) {}

    private List<ClipPlane> clipPlanes = List.of();
    private boolean clippingEnabled;
    private final CapSlot[] caps = new CapSlot[Axis.COUNT];
    private final HelperSlot[] helpers = new HelperSlot[Axis.COUNT];
    private long updateCount;

    public HeadlessRenderer() {
        for (Axis axis : Axis.values()) {
            caps[axis.ordinal()] = new CapSlot(CapMesh.EMPTY, new Matrix4d(), FillStyle.DEFAULT, false);
            helpers[axis.ordinal()] = new HelperSlot(new Matrix4d(), 0, false);
        }
    }

    @Override
    public void updateClipPlanes(List<ClipPlane> planes, boolean enabled) {
        this.clipPlanes = List.copyOf(planes);
        this.clippingEnabled = enabled;
        updateCount++;
    }

    @Override
    public void updateCap(Axis axis, CapMesh cap, Matrix4dc anchorTransform, FillStyle style, boolean visible) {
        caps[axis.ordinal()] = new CapSlot(cap, new Matrix4d(anchorTransform), style, visible);
        updateCount++;
        if (visible) {
            LOG.fine("[HeadlessRenderer] Cap " + axis.key() + ": " + cap.vertexCount() + " vertices, "
                     + cap.triangleCount() + " triangles");
        }
    }

    @Override
    public void updatePlaneHelper(Axis axis, Matrix4dc anchorTransform, double size, boolean visible) {
        helpers[axis.ordinal()] = new HelperSlot(new Matrix4d(anchorTransform), size, visible);
        updateCount++;
    }

    public List<ClipPlane> getClipPlanes() { return clipPlanes; }
    public boolean isClippingEnabled() { return clippingEnabled; }
    public CapSlot getCap(Axis axis) { return caps[axis.ordinal()]; }
    public HelperSlot getHelper(Axis axis) { return helpers[axis.ordinal()]; }

    /** Total number of updates received (for stats). */
    public long getUpdateCount() { return updateCount; }
}
