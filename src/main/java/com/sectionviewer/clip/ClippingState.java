package com.sectionviewer.clip;

import com.sectionviewer.math.Axis;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Read-only snapshot of the clipping configuration, for UI synchronization.
 */
public record ClippingState(boolean enabled,
                            Axis activeAxis,
                            boolean fillEnabled,
                            String fillColor,
                            double fillOpacity,
                            Map<Axis, PlaneState> planes) {

    /** Per-axis part of the snapshot. */
    public record PlaneState(boolean enabled, double offset, double min, double max, boolean inverted) {
    }

    public ClippingState {
        planes = Collections.unmodifiableMap(new EnumMap<>(planes));
    }

    public PlaneState plane(Axis axis) {
        return planes.get(axis);
    }
}
