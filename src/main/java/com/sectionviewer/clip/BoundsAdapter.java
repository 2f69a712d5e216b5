package com.sectionviewer.clip;

import com.sectionviewer.math.Axis;
import com.sectionviewer.mesh.BoundingBox;

/**
 * Fits the plane offset ranges to the model's bounding box.
 */
public final class BoundsAdapter {

    /** Helper size used when there is no model. */
    public static final double DEFAULT_HELPER_SIZE = 2.0;

    public static final double MIN_HELPER_SIZE = 0.5;

    /** Helper outline size relative to the largest box extent. */
    public static final double HELPER_SCALE = 1.75;

    private final PlaneRegistry registry;

    public BoundsAdapter(PlaneRegistry registry) {
        this.registry = registry;
    }

    /**
     * Set every axis range to the box extent on that axis (or [-1, 1] without a box),
     * re-clamp all offsets and recompute the helper size.
     */
    public void updateFromBoundingBox(BoundingBox box) {
        double size = DEFAULT_HELPER_SIZE;
        if (box != null) {
            size = box.maxExtent() * HELPER_SCALE;
        }
        for (PlaneDescriptor d : registry.all()) {
            Axis axis = d.getAxis();
            if (box != null) {
                d.setRange(box.min(axis), box.max(axis));
            } else {
                d.setRange(-1, 1);
            }
            d.update();
        }
        registry.setHelperSize(Math.max(size, MIN_HELPER_SIZE));
    }
}
