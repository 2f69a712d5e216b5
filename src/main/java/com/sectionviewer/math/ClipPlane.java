package com.sectionviewer.math;

import org.joml.Vector3dc;

/**
 * Clip plane in Hessian normal form: {@code n·p + constant = 0}.
 * Points with a negative signed distance are on the clipped side.
 */
public record ClipPlane(double nx, double ny, double nz, double constant) {

    /**
     * Plane perpendicular to {@code axis}, passing through {@code axis * offset},
     * facing {@code +axis} when {@code normalSign} is positive and {@code -axis} otherwise.
     */
    public static ClipPlane forAxis(Axis axis, int normalSign, double offset) {
        double nx = axis.unitX() * normalSign;
        double ny = axis.unitY() * normalSign;
        double nz = axis.unitZ() * normalSign;
        double px = axis.unitX() * offset;
        double py = axis.unitY() * offset;
        double pz = axis.unitZ() * offset;
        return new ClipPlane(nx, ny, nz, -(nx * px + ny * py + nz * pz));
    }

    /** Signed distance from (x, y, z) to the plane. */
    public double distance(double x, double y, double z) {
        return nx * x + ny * y + nz * z + constant;
    }

    public double distance(Vector3dc p) {
        return distance(p.x(), p.y(), p.z());
    }

    /** The four coefficients as {a, b, c, d}, the layout clip-distance uniforms expect. */
    public float[] toVec4(float[] dest) {
        dest[0] = (float) nx;
        dest[1] = (float) ny;
        dest[2] = (float) nz;
        dest[3] = (float) constant;
        return dest;
    }
}
