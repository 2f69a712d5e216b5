package com.sectionviewer.clip;

import org.joml.Vector3dc;

/**
 * Intersection edge of one triangle with one plane, in world space.
 * Lives only for the duration of a single cap recompute.
 */
public record Segment(Vector3dc start, Vector3dc end) {
}
