package com.sectionviewer.clip;

import org.joml.Vector3dc;

import java.util.List;

/**
 * Closed polygon boundary in world space. At least 3 points; the closing
 * point is implied, never repeated at the end.
 */
public record Loop(List<Vector3dc> points) {

    public Loop {
        if (points.size() < 3) {
            throw new IllegalArgumentException("loop needs at least 3 points, got " + points.size());
        }
        points = List.copyOf(points);
    }

    public int size() {
        return points.size();
    }

    public Vector3dc point(int i) {
        return points.get(i);
    }
}
