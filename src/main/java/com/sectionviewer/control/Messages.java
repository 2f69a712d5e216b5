package com.sectionviewer.control;

import com.sectionviewer.clip.ClippingEvent;
import com.sectionviewer.clip.ClippingState;
import com.sectionviewer.math.Axis;
import com.sectionviewer.mesh.CapMesh;

import java.util.Locale;
import java.util.function.Function;

/**
 * Message schemas for the UI control protocol.
 * <p>
 * All messages are flat JSON objects, built and read by hand.
 * <ul>
 *   <li><b>Server → UI:</b> hello, state, event</li>
 *   <li><b>UI → Server:</b> set_clipping, set_active_axis, set_plane_enabled,
 *       set_offset, invert_plane, reset, set_fill, set_fill_color,
 *       set_fill_opacity, gizmo_drag, get_state</li>
 * </ul>
 * Parsing is the only place axis names arrive as text; anything that does not
 * name x, y or z is rejected here.
 */
public final class Messages {

    private Messages() {}

    // ---- JSON utility helpers ----

    /** Escape a string for JSON. */
    static String jsonStr(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /** Format a number with up to 6 decimals, trailing zeros stripped. */
    static String jsonNum(double v) {
        if (!Double.isFinite(v)) return "null";
        if (v == (long) v) return String.valueOf((long) v);
        return String.format(Locale.ROOT, "%.6f", v).replaceAll("0+$", "").replaceAll("\\.$", "");
    }

    // ---- Server → UI ----

    /** Handshake sent on connect. */
    public static String buildHello() {
        return """
        {"type":"hello","version":"1.0","axes":["x","y","z"],"commands":["set_clipping","set_active_axis","set_plane_enabled","set_offset","invert_plane","reset","set_fill","set_fill_color","set_fill_opacity","gizmo_drag","get_state"]}""";
    }

    /**
     * Full state message.
     *
     * @param caps current cap per axis for vertex/triangle counts, or null to omit them
     */
    public static String buildState(ClippingState state, Function<Axis, CapMesh> caps) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("{\"type\":\"state\"");
        sb.append(",\"enabled\":").append(state.enabled());
        sb.append(",\"activeAxis\":").append(jsonStr(state.activeAxis().key()));
        sb.append(",\"fillEnabled\":").append(state.fillEnabled());
        sb.append(",\"fillColor\":").append(jsonStr(state.fillColor()));
        sb.append(",\"fillOpacity\":").append(jsonNum(state.fillOpacity()));
        sb.append(",\"planes\":{");
        boolean first = true;
        for (Axis axis : Axis.values()) {
            ClippingState.PlaneState p = state.plane(axis);
            if (!first) sb.append(',');
            first = false;
            sb.append(jsonStr(axis.key())).append(":{");
            sb.append("\"enabled\":").append(p.enabled());
            sb.append(",\"offset\":").append(jsonNum(p.offset()));
            sb.append(",\"min\":").append(jsonNum(p.min()));
            sb.append(",\"max\":").append(jsonNum(p.max()));
            sb.append(",\"inverted\":").append(p.inverted());
            if (caps != null) {
                CapMesh cap = caps.apply(axis);
                sb.append(",\"capVertices\":").append(cap.vertexCount());
                sb.append(",\"capTriangles\":").append(cap.triangleCount());
            }
            sb.append('}');
        }
        sb.append("}}");
        return sb.toString();
    }

    /** Change notification; the matching state message follows separately. */
    public static String buildEvent(ClippingEvent event) {
        StringBuilder sb = new StringBuilder(96);
        sb.append("{\"type\":\"event\",\"event\":").append(jsonStr(event.type().wireName()));
        if (event.axis() != null) {
            sb.append(",\"axis\":").append(jsonStr(event.axis().key()));
        }
        sb.append('}');
        return sb.toString();
    }

    // ---- UI → Server ----

    /**
     * Parse an incoming command. Returns null if the message is not a valid
     * command, including any axis-bearing command with an unknown axis and any
     * command missing one of its numbers.
     */
    public static CommandQueue.ClipCommand parseCommand(String json, String sourceId) {
        if (json == null || json.isBlank()) return null;
        json = json.trim();

        String type = extractString(json, "type");
        if (type == null) return null;

        return switch (type) {
            case "set_clipping" -> CommandQueue.ClipCommand.setClipping(
                extractBool(json, "enabled", true), sourceId);
            case "set_active_axis" -> {
                Axis axis = Axis.parse(extractString(json, "axis"));
                yield axis != null ? CommandQueue.ClipCommand.setActiveAxis(axis, sourceId) : null;
            }
            case "set_plane_enabled" -> {
                Axis axis = Axis.parse(extractString(json, "axis"));
                yield axis != null
                    ? CommandQueue.ClipCommand.setPlaneEnabled(axis, extractBool(json, "enabled", true), sourceId)
                    : null;
            }
            case "set_offset" -> {
                Axis axis = Axis.parse(extractString(json, "axis"));
                double offset = extractDouble(json, "offset", Double.NaN);
                yield axis != null && Double.isFinite(offset)
                    ? CommandQueue.ClipCommand.setOffset(axis, offset, sourceId)
                    : null;
            }
            case "invert_plane" -> {
                Axis axis = Axis.parse(extractString(json, "axis"));
                yield axis != null ? CommandQueue.ClipCommand.invertPlane(axis, sourceId) : null;
            }
            case "reset" -> CommandQueue.ClipCommand.reset(sourceId);
            case "set_fill" -> CommandQueue.ClipCommand.setFill(extractBool(json, "enabled", true), sourceId);
            case "set_fill_color" -> {
                String color = extractString(json, "color");
                yield color != null ? CommandQueue.ClipCommand.setFillColor(color, sourceId) : null;
            }
            case "set_fill_opacity" -> {
                double opacity = extractDouble(json, "opacity", Double.NaN);
                yield Double.isFinite(opacity) ? CommandQueue.ClipCommand.setFillOpacity(opacity, sourceId) : null;
            }
            case "gizmo_drag" -> {
                double x = extractDouble(json, "x", Double.NaN);
                double y = extractDouble(json, "y", Double.NaN);
                double z = extractDouble(json, "z", Double.NaN);
                yield Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z)
                    ? CommandQueue.ClipCommand.gizmoDrag(x, y, z, sourceId)
                    : null;
            }
            case "get_state" -> CommandQueue.ClipCommand.getState(sourceId);
            default -> null;
        };
    }

    // ---- Minimal JSON field extractors ----

    /** Index just past the ':' following {@code "key"}, whitespace skipped, or -1. */
    private static int valueStart(String json, String key) {
        String search = "\"" + key + "\"";
        int idx = json.indexOf(search);
        if (idx < 0) return -1;
        idx = json.indexOf(':', idx + search.length());
        if (idx < 0) return -1;
        idx++;
        while (idx < json.length() && Character.isWhitespace(json.charAt(idx))) idx++;
        return idx;
    }

    static String extractString(String json, String key) {
        int idx = valueStart(json, key);
        if (idx < 0 || idx >= json.length() || json.charAt(idx) != '"') return null;
        idx++; // skip opening quote
        int end = json.indexOf('"', idx);
        if (end < 0) return null;
        return json.substring(idx, end);
    }

    static double extractDouble(String json, String key, double def) {
        int idx = valueStart(json, key);
        if (idx < 0) return def;
        int end = idx;
        while (end < json.length()) {
            char c = json.charAt(end);
            if (Character.isDigit(c) || c == '.' || c == '-' || c == '+' || c == 'E' || c == 'e') {
                end++;
            } else {
                break;
            }
        }
        if (end == idx) return def;
        try {
            return Double.parseDouble(json.substring(idx, end));
        } catch (NumberFormatException e) {
            return def;
        }
    }

    static boolean extractBool(String json, String key, boolean def) {
        int idx = valueStart(json, key);
        if (idx < 0) return def;
        if (json.startsWith("true", idx)) return true;
        if (json.startsWith("false", idx)) return false;
        return def;
    }
}
