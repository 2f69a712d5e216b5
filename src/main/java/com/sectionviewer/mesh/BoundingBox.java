package com.sectionviewer.mesh;

import com.sectionviewer.math.Axis;
import org.joml.Vector3d;

/**
 * Axis-aligned bounding box in world space.
 */
public record BoundingBox(double minX, double minY, double minZ,
                          double maxX, double maxY, double maxZ) {

    public double min(Axis axis) {
        return switch (axis) {
            case X -> minX;
            case Y -> minY;
            case Z -> minZ;
        };
    }

    public double max(Axis axis) {
        return switch (axis) {
            case X -> maxX;
            case Y -> maxY;
            case Z -> maxZ;
        };
    }

    public double size(Axis axis) {
        return max(axis) - min(axis);
    }

    /** Largest extent over the three axes. */
    public double maxExtent() {
        return Math.max(size(Axis.X), Math.max(size(Axis.Y), size(Axis.Z)));
    }

    /**
     * Box around every world-space vertex referenced by the visible meshes of
     * {@code source}. Returns null when there is nothing visible.
     */
    public static BoundingBox of(MeshSource source) {
        if (source == null) return null;
        double[] b = {
            Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY,
            Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY
        };
        Vector3d v = new Vector3d();
        source.forEachVisibleMesh(mesh -> {
            for (int i = 0, n = mesh.vertexCount(); i < n; i++) {
                mesh.worldVertex(i, v);
                b[0] = Math.min(b[0], v.x);
                b[1] = Math.min(b[1], v.y);
                b[2] = Math.min(b[2], v.z);
                b[3] = Math.max(b[3], v.x);
                b[4] = Math.max(b[4], v.y);
                b[5] = Math.max(b[5], v.z);
            }
        });
        if (b[0] > b[3]) return null;
        return new BoundingBox(b[0], b[1], b[2], b[3], b[4], b[5]);
    }
}
