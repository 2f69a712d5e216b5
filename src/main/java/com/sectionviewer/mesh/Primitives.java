package com.sectionviewer.mesh;

import org.joml.Matrix4d;

import java.util.List;
import java.util.Locale;

/**
 * Built-in models for the headless viewer: indexed boxes with outward-facing
 * counter-clockwise triangles.
 */
public final class Primitives {

    /** Triangle corners of a box, 2 triangles per face: -Z, +Z, -X, +X, -Y, +Y. */
    private static final int[] BOX_INDICES = {
        0, 2, 1,  0, 3, 2,
        4, 5, 6,  4, 6, 7,
        0, 4, 7,  0, 7, 3,
        1, 2, 6,  1, 6, 5,
        0, 1, 5,  0, 5, 4,
        3, 7, 6,  3, 6, 2
    };

    private Primitives() {}

    /** Axis-aligned box of the given size centred on the origin (8 vertices, 12 triangles). */
    public static MeshInstance box(double sizeX, double sizeY, double sizeZ) {
        return box(sizeX, sizeY, sizeZ, new Matrix4d());
    }

    public static MeshInstance box(double sizeX, double sizeY, double sizeZ, Matrix4d worldTransform) {
        float hx = (float) (sizeX * 0.5);
        float hy = (float) (sizeY * 0.5);
        float hz = (float) (sizeZ * 0.5);
        float[] positions = {
            -hx, -hy, -hz,
             hx, -hy, -hz,
             hx,  hy, -hz,
            -hx,  hy, -hz,
            -hx, -hy,  hz,
             hx, -hy,  hz,
             hx,  hy,  hz,
            -hx,  hy,  hz
        };
        return new MeshInstance(positions, BOX_INDICES.clone(), worldTransform);
    }

    /** Unit cube centred on the origin. */
    public static MeshInstance unitCube() {
        return box(1, 1, 1);
    }

    /**
     * Named demo model: "cube" (unit cube) or "nested" (a 2-unit cube around a
     * unit cube, so every section has an outer and an inner loop).
     * Returns null for unknown names.
     */
    public static MeshSource named(String name) {
        if (name == null) return null;
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "cube" -> MeshSource.of(unitCube());
            case "nested" -> MeshSource.of(List.of(box(2, 2, 2), unitCube()));
            default -> null;
        };
    }
}
