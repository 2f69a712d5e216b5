package com.sectionviewer.mesh;

import org.lwjgl.BufferUtils;

import java.nio.FloatBuffer;
import java.nio.IntBuffer;

/**
 * Triangulated cap geometry for one clipping plane, in the plane anchor's
 * local frame: positions and normals (3 floats per vertex) plus triangle indices.
 * <p>
 * Immutable. A new instance replaces the previous one on every recompute;
 * nothing patches an existing cap.
 */
public record CapMesh(float[] positions, float[] normals, int[] indices) {

    /** Shared empty cap. */
    public static final CapMesh EMPTY = new CapMesh(new float[0], new float[0], new int[0]);

    /** Check if this cap has no triangles. */
    public boolean isEmpty() {
        return indices == null || indices.length == 0;
    }

    public int vertexCount() {
        return positions.length / 3;
    }

    public int triangleCount() {
        return indices.length / 3;
    }

    /** Positions in a native-order direct buffer, ready for a vertex buffer upload. */
    public FloatBuffer positionBuffer() {
        FloatBuffer buf = BufferUtils.createFloatBuffer(positions.length);
        buf.put(positions).flip();
        return buf;
    }

    public FloatBuffer normalBuffer() {
        FloatBuffer buf = BufferUtils.createFloatBuffer(normals.length);
        buf.put(normals).flip();
        return buf;
    }

    public IntBuffer indexBuffer() {
        IntBuffer buf = BufferUtils.createIntBuffer(indices.length);
        buf.put(indices).flip();
        return buf;
    }
}
