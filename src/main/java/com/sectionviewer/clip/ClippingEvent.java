package com.sectionviewer.clip;

import com.sectionviewer.math.Axis;

/**
 * Change notification emitted by {@link ClippingEngine}.
 *
 * @param type  what changed
 * @param axis  the plane concerned, or null for engine-wide changes
 * @param state snapshot taken right after the change
 */
public record ClippingEvent(Type type, Axis axis, ClippingState state) {

    public enum Type {
        CLIPPING_TOGGLED("clipping_toggled"),
        ACTIVE_AXIS_CHANGED("active_axis_changed"),
        AXIS_ENABLED("axis_enabled"),
        OFFSET_CHANGED("offset_changed"),
        NORMAL_INVERTED("normal_inverted"),
        BOUNDS_CHANGED("bounds_changed"),
        FILL_STYLE_CHANGED("fill_style_changed"),
        RESET("reset");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }
}
