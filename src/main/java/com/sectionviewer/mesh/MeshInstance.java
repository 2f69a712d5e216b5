package com.sectionviewer.mesh;

import org.joml.Matrix4d;
import org.joml.Matrix4dc;
import org.joml.Vector3d;

/**
 * One visible mesh as seen by the section pipeline: object-space positions,
 * an optional triangle index buffer and the world transform.
 * <p>
 * Without indices the positions are read as sequential triangles
 * (vertices 0,1,2 then 3,4,5, ...).
 */
public record MeshInstance(float[] positions, int[] indices, Matrix4dc worldTransform) {

    public MeshInstance {
        if (positions == null || positions.length % 3 != 0) {
            throw new IllegalArgumentException("positions must hold xyz triples");
        }
        if (indices != null && indices.length % 3 != 0) {
            throw new IllegalArgumentException("index count must be a multiple of 3, got " + indices.length);
        }
        if (indices != null) {
            int vertexCount = positions.length / 3;
            for (int i = 0; i < indices.length; i++) {
                if (indices[i] < 0 || indices[i] >= vertexCount) {
                    throw new IllegalArgumentException("index " + indices[i] + " at " + i
                        + " out of range for " + vertexCount + " vertices");
                }
            }
        }
        if (worldTransform == null) {
            worldTransform = new Matrix4d();
        }
    }

    /** Mesh placed at the world origin. */
    public MeshInstance(float[] positions, int[] indices) {
        this(positions, indices, new Matrix4d());
    }

    public int vertexCount() {
        return positions.length / 3;
    }

    public boolean isIndexed() {
        return indices != null;
    }

    public int triangleCount() {
        return (indices != null ? indices.length : vertexCount()) / 3;
    }

    /** Vertex index of corner {@code corner} (0..2) of triangle {@code tri}. */
    public int cornerIndex(int tri, int corner) {
        int k = tri * 3 + corner;
        return indices != null ? indices[k] : k;
    }

    /** World-space position of vertex {@code vertex}. */
    public Vector3d worldVertex(int vertex, Vector3d dest) {
        int o = vertex * 3;
        dest.set(positions[o], positions[o + 1], positions[o + 2]);
        return worldTransform.transformPosition(dest);
    }
}
