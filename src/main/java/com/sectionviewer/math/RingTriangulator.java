package com.sectionviewer.math;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.locationtech.jts.algorithm.Area;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.triangulate.polygon.PolygonTriangulator;

/**
 * Triangulates one simple planar ring using the JTS polygon ear clipper.
 * <p>
 * Triangles come back as indices into the input points, always wound
 * counter-clockwise whatever the ring's own orientation. Zero-area triangles
 * are dropped.
 */
public final class RingTriangulator {

    private static final GeometryFactory GEOMETRY = new GeometryFactory();

    private RingTriangulator() {}

    /** Closed JTS ring (first point repeated at the end) over the first {@code n} points. */
    public static Coordinate[] closedRing(double[] xs, double[] ys, int n) {
        Coordinate[] ring = new Coordinate[n + 1];
        for (int i = 0; i < n; i++) {
            ring[i] = new Coordinate(xs[i], ys[i]);
        }
        ring[n] = ring[0].copy();
        return ring;
    }

    /** Unsigned enclosed area of a closed ring. */
    public static double area(Coordinate[] ring) {
        return Area.ofRing(ring);
    }

    /**
     * @param ring closed ring from {@link #closedRing}
     * @return flat triangle index array, 3 entries per triangle, possibly empty
     * @throws IllegalStateException if the ear clipper cannot make progress on a
     *         self-intersecting ring
     */
    public static int[] triangulate(Coordinate[] ring) {
        int n = ring.length - 1;
        if (n < 3) return new int[0];

        Object2IntOpenHashMap<Coordinate> indexOf = new Object2IntOpenHashMap<>(n);
        indexOf.defaultReturnValue(-1);
        for (int i = 0; i < n; i++) {
            indexOf.putIfAbsent(ring[i], i);
        }

        Geometry triangles = PolygonTriangulator.triangulate(GEOMETRY.createPolygon(ring));
        IntArrayList out = new IntArrayList(triangles.getNumGeometries() * 3);
        for (int t = 0; t < triangles.getNumGeometries(); t++) {
            Coordinate[] c = triangles.getGeometryN(t).getCoordinates();
            int a = indexOf.getInt(c[0]);
            int b = indexOf.getInt(c[1]);
            int d = indexOf.getInt(c[2]);
            if (a < 0 || b < 0 || d < 0) continue;

            int orientation = Orientation.index(c[0], c[1], c[2]);
            if (orientation == Orientation.COLLINEAR) continue;
            out.add(a);
            if (orientation == Orientation.COUNTERCLOCKWISE) {
                out.add(b);
                out.add(d);
            } else {
                out.add(d);
                out.add(b);
            }
        }
        return out.toIntArray();
    }
}
