package com.sectionviewer.math;

import org.joml.Vector3d;
import org.joml.Vector3dc;

import java.util.Locale;

/**
 * The three world axes a clipping plane can be aligned with.
 * Closed set: descriptor storage is indexed by {@link #ordinal()}.
 */
public enum Axis {
    X(1, 0, 0),
    Y(0, 1, 0),
    Z(0, 0, 1);

    /** Number of axes (and therefore of plane descriptors). */
    public static final int COUNT = 3;

    private final double ux, uy, uz;
    private final String key;

    Axis(double ux, double uy, double uz) {
        this.ux = ux;
        this.uy = uy;
        this.uz = uz;
        this.key = name().toLowerCase(Locale.ROOT);
    }

    /** Unit vector along this axis, scaled. */
    public Vector3d unit(double scale, Vector3d dest) {
        return dest.set(ux * scale, uy * scale, uz * scale);
    }

    public double unitX() { return ux; }
    public double unitY() { return uy; }
    public double unitZ() { return uz; }

    /** Component of {@code v} along this axis. */
    public double component(Vector3dc v) {
        return switch (this) {
            case X -> v.x();
            case Y -> v.y();
            case Z -> v.z();
        };
    }

    /** Lower-case key used on the wire ("x", "y", "z"). */
    public String key() {
        return key;
    }

    /**
     * Decode an axis from untrusted input. Case-insensitive, surrounding
     * whitespace ignored. Returns null for anything that is not x, y or z.
     */
    public static Axis parse(String s) {
        if (s == null) return null;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "x" -> X;
            case "y" -> Y;
            case "z" -> Z;
            default -> null;
        };
    }
}
