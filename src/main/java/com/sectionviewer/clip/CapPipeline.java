package com.sectionviewer.clip;

import com.sectionviewer.mesh.CapMesh;
import com.sectionviewer.mesh.MeshSource;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Full cap rebuild for one plane: intersect, stitch, triangulate.
 */
public final class CapPipeline {

    private static final Logger LOG = Logger.getLogger(CapPipeline.class.getName());

    private CapPipeline() {}

    /**
     * Compute the cap for {@code descriptor} from scratch. Returns {@link CapMesh#EMPTY}
     * when clipping is off, the plane is disabled, there is no model, or the plane
     * misses the model. Reads the descriptor; changes nothing.
     */
    public static CapMesh recomputeCap(PlaneDescriptor descriptor, boolean clippingEnabled, MeshSource model) {
        if (!clippingEnabled || !descriptor.isEnabled() || model == null) {
            return CapMesh.EMPTY;
        }

        long start = System.nanoTime();
        List<Segment> segments = new ArrayList<>();
        IntersectionExtractor.collect(model, descriptor.getPlane(), segments);
        if (segments.isEmpty()) return CapMesh.EMPTY;

        List<Loop> loops = LoopBuilder.buildLoops(segments);
        if (loops.isEmpty()) return CapMesh.EMPTY;

        CapMesh cap = CapTriangulator.triangulate(loops, descriptor.getAnchor().worldTransform(),
                                                  descriptor.getNormalSign());
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("[CapPipeline] %s: %d segments, %d loops, %d triangles in %.2f ms",
                descriptor.getAxis().key(), segments.size(), loops.size(), cap.triangleCount(),
                (System.nanoTime() - start) / 1_000_000.0));
        }
        return cap;
    }
}
