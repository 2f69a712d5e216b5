package com.sectionviewer.clip;

import com.sectionviewer.math.RingTriangulator;
import com.sectionviewer.mesh.CapMesh;
import it.unimi.dsi.fastutil.floats.FloatArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.joml.Matrix4d;
import org.joml.Matrix4dc;
import org.joml.Vector3d;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;
import java.util.logging.Logger;

/**
 * Turns the closed loops of one plane into a filled cap in the plane anchor's
 * local frame (local +Z along the plane normal).
 * <p>
 * Each loop is projected onto local XY and triangulated on its own, so disjoint loops (a hollow section) become separate triangle
 * islands in one buffer. All cap vertices share the normal (0, 0, normalSign),
 * and every triangle is wound so its geometric normal agrees with it.
 */
public final class CapTriangulator {

    private static final Logger LOG = Logger.getLogger(CapTriangulator.class.getName());

    /** Loops whose projected area is at or below this are skipped. */
    public static final double MIN_LOOP_AREA = 1e-6;

    /** Local-Z lift applied to cap vertices so the cap does not z-fight the cut surface. */
    public static final double CAP_OFFSET = 0.001;

    private CapTriangulator() {}

    public static CapMesh triangulate(List<Loop> loops, Matrix4dc anchorTransform, int normalSign) {
        if (loops == null || loops.isEmpty()) return CapMesh.EMPTY;

        int sign = normalSign >= 0 ? 1 : -1;
        Matrix4d worldToLocal = anchorTransform.invert(new Matrix4d());

        FloatArrayList positions = new FloatArrayList();
        FloatArrayList normals = new FloatArrayList();
        IntArrayList indices = new IntArrayList();
        Vector3d local = new Vector3d();

        for (Loop loop : loops) {
            int n = loop.size();
            double[] xs = new double[n];
            double[] ys = new double[n];
            double[] zs = new double[n];
            for (int i = 0; i < n; i++) {
                worldToLocal.transformPosition(local.set(loop.point(i)));
                xs[i] = local.x;
                ys[i] = local.y;
                zs[i] = local.z;
            }

            Coordinate[] ring = RingTriangulator.closedRing(xs, ys, n);
            if (RingTriangulator.area(ring) <= MIN_LOOP_AREA) continue;

            int[] tris;
            try {
                tris = RingTriangulator.triangulate(ring);
            } catch (IllegalStateException e) {
                LOG.warning("[CapTriangulator] Skipping " + n + "-point loop: " + e.getMessage());
                continue;
            }
            if (tris.length == 0) continue;

            int base = positions.size() / 3;
            for (int i = 0; i < n; i++) {
                positions.add((float) xs[i]);
                positions.add((float) ys[i]);
                positions.add((float) (zs[i] + sign * CAP_OFFSET));
                normals.add(0f);
                normals.add(0f);
                normals.add((float) sign);
            }
            for (int t = 0; t < tris.length; t += 3) {
                indices.add(base + tris[t]);
                if (sign > 0) {
                    indices.add(base + tris[t + 1]);
                    indices.add(base + tris[t + 2]);
                } else {
                    indices.add(base + tris[t + 2]);
                    indices.add(base + tris[t + 1]);
                }
            }
        }

        if (indices.isEmpty()) return CapMesh.EMPTY;
        return new CapMesh(positions.toFloatArray(), normals.toFloatArray(), indices.toIntArray());
    }
}
