package com.sectionviewer.control;

import com.sectionviewer.clip.ClippingEngine;
import com.sectionviewer.render.VirtualGizmo;
import org.joml.Vector3d;

import java.util.logging.Logger;

/**
 * Applies control-channel commands to the engine. Runs on the update loop thread.
 */
public final class CommandRouter {

    private static final Logger LOG = Logger.getLogger(CommandRouter.class.getName());

    private CommandRouter() {}

    /**
     * Apply one command.
     *
     * @return true if the sender asked for a state message regardless of changes
     */
    public static boolean apply(CommandQueue.ClipCommand command, ClippingEngine engine, VirtualGizmo gizmo) {
        switch (command.type()) {
            case "set_clipping" -> engine.setClippingEnabled(command.flag());
            case "set_active_axis" -> engine.setActiveAxis(command.axis());
            case "set_plane_enabled" -> engine.setPlaneEnabled(command.axis(), command.flag());
            case "set_offset" -> engine.setOffset(command.axis(), command.value());
            case "invert_plane" -> engine.invertNormal(command.axis());
            case "reset" -> engine.resetAll(false);
            case "set_fill" -> engine.setFillEnabled(command.flag());
            case "set_fill_color" -> engine.setFillColor(command.text());
            case "set_fill_opacity" -> engine.setFillOpacity(command.value());
            case "gizmo_drag" -> {
                if (!gizmo.dragTo(new Vector3d(command.x(), command.y(), command.z()))) {
                    LOG.fine("[CommandRouter] Drag ignored, gizmo inactive (" + command.sourceId() + ")");
                }
            }
            case "get_state" -> {
                return true;
            }
            default -> LOG.warning("[CommandRouter] Unknown command type: " + command.type());
        }
        return false;
    }
}
