package com.sectionviewer.render;

/**
 * Orbit/pan camera controls; switched off while the gizmo is dragged.
 */
public interface CameraControls {
    void setEnabled(boolean enabled);
}
