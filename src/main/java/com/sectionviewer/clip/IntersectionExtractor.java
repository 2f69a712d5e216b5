package com.sectionviewer.clip;

import com.sectionviewer.math.ClipPlane;
import com.sectionviewer.mesh.MeshInstance;
import com.sectionviewer.mesh.MeshSource;
import org.joml.Vector3d;
import org.joml.Vector3dc;

import java.util.ArrayList;
import java.util.List;

/**
 * Plane/triangle intersection. Each triangle crossing the plane contributes
 * exactly one two-point segment; everything else contributes nothing.
 */
public final class IntersectionExtractor {

    /** Distance below which a vertex counts as lying on the plane. */
    public static final double PLANE_EPSILON = 1e-5;

    /** Distance below which two candidate points are merged. */
    public static final double MERGE_TOLERANCE = 1e-4;

    private static final double MERGE_TOLERANCE_SQ = MERGE_TOLERANCE * MERGE_TOLERANCE;

    private IntersectionExtractor() {}

    /**
     * Intersect one world-space triangle with the plane.
     * <p>
     * On-plane vertices and strict edge crossings are collected, near-duplicates merged,
     * and the first two unique points kept. Near-coplanar triangles can produce three
     * candidates; only the first two survive.
     *
     * @return the segment, or null if the triangle does not cross the plane
     */
    public static Segment intersect(Vector3dc v0, Vector3dc v1, Vector3dc v2, ClipPlane plane) {
        double d0 = plane.distance(v0);
        double d1 = plane.distance(v1);
        double d2 = plane.distance(v2);

        // At most 3 on-plane vertices + 3 edge crossings
        List<Vector3d> hits = new ArrayList<>(6);
        addIfOnPlane(hits, v0, d0);
        addIfOnPlane(hits, v1, d1);
        addIfOnPlane(hits, v2, d2);
        addEdgeCrossing(hits, v0, d0, v1, d1);
        addEdgeCrossing(hits, v1, d1, v2, d2);
        addEdgeCrossing(hits, v2, d2, v0, d0);

        if (hits.size() < 2) return null;

        Vector3d first = null;
        Vector3d second = null;
        for (Vector3d p : hits) {
            if (first == null) {
                first = p;
            } else if (first.distanceSquared(p) >= MERGE_TOLERANCE_SQ) {
                second = p;
                break;
            }
        }
        if (second == null) return null;
        return new Segment(first, second);
    }

    private static void addIfOnPlane(List<Vector3d> hits, Vector3dc v, double d) {
        if (Math.abs(d) <= PLANE_EPSILON) {
            hits.add(new Vector3d(v));
        }
    }

    private static void addEdgeCrossing(List<Vector3d> hits, Vector3dc a, double da, Vector3dc b, double db) {
        if ((da > PLANE_EPSILON && db < -PLANE_EPSILON) || (da < -PLANE_EPSILON && db > PLANE_EPSILON)) {
            double t = da / (da - db);
            hits.add(new Vector3d(a).lerp(b, t));
        }
    }

    /**
     * Intersect every triangle of every visible mesh with the plane, appending
     * the resulting segments to {@code out}.
     *
     * @return number of segments appended
     */
    public static int collect(MeshSource source, ClipPlane plane, List<Segment> out) {
        if (source == null) return 0;
        int before = out.size();
        Vector3d a = new Vector3d();
        Vector3d b = new Vector3d();
        Vector3d c = new Vector3d();
        source.forEachVisibleMesh(mesh -> collect(mesh, plane, out, a, b, c));
        return out.size() - before;
    }

    private static void collect(MeshInstance mesh, ClipPlane plane, List<Segment> out,
                                Vector3d a, Vector3d b, Vector3d c) {
        if (mesh.vertexCount() < 3) return;
        for (int t = 0, n = mesh.triangleCount(); t < n; t++) {
            mesh.worldVertex(mesh.cornerIndex(t, 0), a);
            mesh.worldVertex(mesh.cornerIndex(t, 1), b);
            mesh.worldVertex(mesh.cornerIndex(t, 2), c);
            Segment s = intersect(a, b, c, plane);
            if (s != null) {
                out.add(s);
            }
        }
    }
}
