package com.sectionviewer.control;

import com.sectionviewer.math.Axis;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Hand-off between control-channel threads and the update loop.
 * <p>
 * WebSocket threads enqueue parsed commands; the update loop drains them
 * once per tick, so the engine itself only ever runs on one thread.
 */
public class CommandQueue {

    /**
     * One parsed UI command. Axis-bearing commands always carry a valid axis;
     * unparsable input never becomes a command.
     */
    public record ClipCommand(
        String type,
        Axis axis,        // plane concerned, null for engine-wide commands
        double value,     // offset, opacity
        boolean flag,     // enabled toggles
        String text,      // color
        double x, double y, double z, // gizmo drag target
        String sourceId   // which connection sent this
    ) {
        public static ClipCommand setClipping(boolean enabled, String src) {
            return new ClipCommand("set_clipping", null, 0, enabled, null, 0, 0, 0, src);
        }

        public static ClipCommand setActiveAxis(Axis axis, String src) {
            return new ClipCommand("set_active_axis", axis, 0, false, null, 0, 0, 0, src);
        }

        public static ClipCommand setPlaneEnabled(Axis axis, boolean enabled, String src) {
            return new ClipCommand("set_plane_enabled", axis, 0, enabled, null, 0, 0, 0, src);
        }

        public static ClipCommand setOffset(Axis axis, double offset, String src) {
            return new ClipCommand("set_offset", axis, offset, false, null, 0, 0, 0, src);
        }

        public static ClipCommand invertPlane(Axis axis, String src) {
            return new ClipCommand("invert_plane", axis, 0, false, null, 0, 0, 0, src);
        }

        public static ClipCommand reset(String src) {
            return new ClipCommand("reset", null, 0, false, null, 0, 0, 0, src);
        }

        public static ClipCommand setFill(boolean enabled, String src) {
            return new ClipCommand("set_fill", null, 0, enabled, null, 0, 0, 0, src);
        }

        public static ClipCommand setFillColor(String color, String src) {
            return new ClipCommand("set_fill_color", null, 0, false, color, 0, 0, 0, src);
        }

        public static ClipCommand setFillOpacity(double opacity, String src) {
            return new ClipCommand("set_fill_opacity", null, opacity, false, null, 0, 0, 0, src);
        }

        public static ClipCommand gizmoDrag(double x, double y, double z, String src) {
            return new ClipCommand("gizmo_drag", null, 0, false, null, x, y, z, src);
        }

        public static ClipCommand getState(String src) {
            return new ClipCommand("get_state", null, 0, false, null, 0, 0, 0, src);
        }
    }

    private final ConcurrentLinkedQueue<ClipCommand> queue = new ConcurrentLinkedQueue<>();
    private final AtomicLong totalEnqueued = new AtomicLong(0);
    private final AtomicLong totalProcessed = new AtomicLong(0);

    /** Enqueue a command. Thread-safe. */
    public void enqueue(ClipCommand command) {
        queue.add(command);
        totalEnqueued.incrementAndGet();
    }

    /**
     * Drain all queued commands, passing each to the consumer.
     * Called once per tick from the update thread.
     */
    public void drain(Consumer<ClipCommand> consumer) {
        ClipCommand command;
        while ((command = queue.poll()) != null) {
            consumer.accept(command);
            totalProcessed.incrementAndGet();
        }
    }

    public boolean hasPending() {
        return !queue.isEmpty();
    }

    public long getTotalEnqueued() {
        return totalEnqueued.get();
    }

    public long getTotalProcessed() {
        return totalProcessed.get();
    }

    public void clear() {
        queue.clear();
    }
}
