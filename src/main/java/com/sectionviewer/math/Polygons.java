package com.sectionviewer.math;

import org.joml.Vector3dc;

/**
 * Small geometry helpers for loop building and cap checks.
 */
public final class Polygons {

    private Polygons() {}

    /** Area of a 3D triangle. */
    public static double triangleArea(double ax, double ay, double az,
                                      double bx, double by, double bz,
                                      double cx, double cy, double cz) {
        double ux = bx - ax, uy = by - ay, uz = bz - az;
        double vx = cx - ax, vy = cy - ay, vz = cz - az;
        double x = uy * vz - uz * vy;
        double y = uz * vx - ux * vz;
        double z = ux * vy - uy * vx;
        return 0.5 * Math.sqrt(x * x + y * y + z * z);
    }

    /**
     * Squared distance from {@code p} to the segment {@code a-b}.
     * Degenerates to the point distance when a and b coincide.
     */
    public static double distanceSquaredToSegment(Vector3dc p, Vector3dc a, Vector3dc b) {
        double abx = b.x() - a.x(), aby = b.y() - a.y(), abz = b.z() - a.z();
        double apx = p.x() - a.x(), apy = p.y() - a.y(), apz = p.z() - a.z();
        double len2 = abx * abx + aby * aby + abz * abz;
        double t = len2 > 0 ? (apx * abx + apy * aby + apz * abz) / len2 : 0;
        if (t < 0) t = 0;
        else if (t > 1) t = 1;
        double dx = apx - abx * t, dy = apy - aby * t, dz = apz - abz * t;
        return dx * dx + dy * dy + dz * dz;
    }
}
