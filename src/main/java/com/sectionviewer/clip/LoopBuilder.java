package com.sectionviewer.clip;

import com.sectionviewer.math.Polygons;
import org.joml.Vector3d;
import org.joml.Vector3dc;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Stitches the unordered segments produced for one plane into closed loops.
 * <p>
 * Greedy chain growth: seed a chain with any remaining segment, then keep
 * attaching segments whose endpoint welds onto the chain's tail or head until
 * a full pass finds nothing. Chains that do not close (open surfaces, seams)
 * are dropped. O(S²) in the number of segments.
 */
public final class LoopBuilder {

    /** Distance under which two endpoints are treated as the same point. */
    public static final double WELD_TOLERANCE = 1e-4;

    private static final double WELD_TOLERANCE_SQ = WELD_TOLERANCE * WELD_TOLERANCE;

    private LoopBuilder() {}

    /**
     * Build every closed loop the segments describe. The input list is not modified.
     */
    public static List<Loop> buildLoops(List<Segment> segments) {
        List<Loop> loops = new ArrayList<>();
        if (segments == null || segments.isEmpty()) return loops;

        List<Segment> pool = new ArrayList<>(segments);
        while (!pool.isEmpty()) {
            Segment seed = pool.remove(pool.size() - 1);
            Deque<Vector3dc> chain = new ArrayDeque<>();
            chain.addLast(new Vector3d(seed.start()));
            chain.addLast(new Vector3d(seed.end()));

            boolean extended = true;
            while (extended) {
                extended = false;
                Vector3dc next = takeConnected(pool, chain.peekLast());
                if (next != null) {
                    chain.addLast(next);
                    extended = true;
                }
                Vector3dc prev = takeConnected(pool, chain.peekFirst());
                if (prev != null) {
                    chain.addFirst(prev);
                    extended = true;
                }
            }

            if (chain.size() < 3 || chain.peekLast().distanceSquared(chain.peekFirst()) > WELD_TOLERANCE_SQ) {
                continue;
            }
            chain.removeLast();

            List<Vector3dc> points = removeCollinear(new ArrayList<>(chain));
            if (points.size() >= 3) {
                loops.add(new Loop(points));
            }
        }
        return loops;
    }

    /**
     * Find a pooled segment with an endpoint on {@code point}, remove it and return
     * its other endpoint. Null if none connects.
     */
    private static Vector3dc takeConnected(List<Segment> pool, Vector3dc point) {
        for (int i = 0; i < pool.size(); i++) {
            Segment s = pool.get(i);
            if (s.start().distanceSquared(point) <= WELD_TOLERANCE_SQ) {
                pool.remove(i);
                return new Vector3d(s.end());
            }
            if (s.end().distanceSquared(point) <= WELD_TOLERANCE_SQ) {
                pool.remove(i);
                return new Vector3d(s.start());
            }
        }
        return null;
    }

    /**
     * Drop vertices that sit on the chord between their neighbours (within the weld
     * tolerance). A triangle crossing the plane through a mesh face diagonal leaves such
     * a vertex mid-edge; it carries no shape and only produces sliver triangles.
     */
    static List<Vector3dc> removeCollinear(List<Vector3dc> points) {
        boolean removed = true;
        while (removed && points.size() >= 3) {
            removed = false;
            int n = points.size();
            for (int i = 0; i < n; i++) {
                Vector3dc prev = points.get((i + n - 1) % n);
                Vector3dc cur = points.get(i);
                Vector3dc next = points.get((i + 1) % n);
                if (Polygons.distanceSquaredToSegment(cur, prev, next) <= WELD_TOLERANCE_SQ) {
                    points.remove(i);
                    removed = true;
                    break;
                }
            }
        }
        return points;
    }
}
