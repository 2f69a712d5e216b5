package com.sectionviewer.render;

import com.sectionviewer.clip.FillStyle;
import com.sectionviewer.math.Axis;
import com.sectionviewer.math.ClipPlane;
import com.sectionviewer.mesh.CapMesh;
import org.joml.Matrix4dc;

import java.util.List;

/**
 * Renderer-side consumer of clipping state. Everything handed over is a
 * snapshot: the next update replaces it, so implementations must copy what
 * they want to keep.
 */
public interface RendererSink {

    /**
     * Global clip half-spaces, in X, Y, Z order of the enabled planes.
     *
     * @param enabled false when clipping is off or no plane is enabled
     */
    void updateClipPlanes(List<ClipPlane> planes, boolean enabled);

    /**
     * Cap geometry for one plane, in the anchor's local frame.
     *
     * @param anchorTransform anchor local-to-world transform
     * @param visible         whether the cap should be drawn this frame
     */
    void updateCap(Axis axis, CapMesh cap, Matrix4dc anchorTransform, FillStyle style, boolean visible);

    /** Square outline helper drawn on the plane, {@code size} units wide. */
    void updatePlaneHelper(Axis axis, Matrix4dc anchorTransform, double size, boolean visible);
}
