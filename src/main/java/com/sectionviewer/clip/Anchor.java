package com.sectionviewer.clip;

import com.sectionviewer.math.ClipPlane;
import org.joml.Matrix4d;
import org.joml.Quaterniond;
import org.joml.Quaterniondc;
import org.joml.Vector3d;
import org.joml.Vector3dc;

import java.util.ArrayList;
import java.util.List;

/**
 * Scene node that places one clipping plane: it sits on the plane and its
 * local +Z points along the plane normal. The cap mesh and the plane helper
 * hang off it, and the drag gizmo moves it.
 * <p>
 * Every pose change is reported to the registered listeners, whoever made it.
 */
public class Anchor {

    private final String name;
    private final Vector3d position = new Vector3d();
    private final Quaterniond rotation = new Quaterniond();
    private boolean visible;
    private final List<Runnable> listeners = new ArrayList<>();

    public Anchor(String name) {
        this.name = name;
    }

    public String getName() { return name; }

    public Vector3dc getPosition() { return position; }

    public Quaterniondc getRotation() { return rotation; }

    public boolean isVisible() { return visible; }

    public void setVisible(boolean visible) { this.visible = visible; }

    /** Move the anchor; listeners fire if the position actually changed. */
    public void setPosition(double x, double y, double z) {
        if (position.x == x && position.y == y && position.z == z) return;
        position.set(x, y, z);
        fireChanged();
    }

    /** Place the anchor on {@code plane} at {@code point}, facing along the plane normal. */
    public void setPose(Vector3dc point, ClipPlane plane) {
        Quaterniond target = orientationFor(plane.nx(), plane.ny(), plane.nz(), new Quaterniond());
        boolean moved = position.x != point.x() || position.y != point.y() || position.z != point.z();
        boolean turned = !rotation.equals(target);
        if (!moved && !turned) return;
        position.set(point);
        rotation.set(target);
        fireChanged();
    }

    /** Local-to-world transform. Returns a fresh matrix. */
    public Matrix4d worldTransform() {
        return new Matrix4d().translation(position).rotate(rotation);
    }

    public void addChangeListener(Runnable listener) {
        listeners.add(listener);
    }

    public void removeChangeListener(Runnable listener) {
        listeners.remove(listener);
    }

    private void fireChanged() {
        for (Runnable l : new ArrayList<>(listeners)) {
            l.run();
        }
    }

    /**
     * Rotation taking local +Z onto the unit normal (nx, ny, nz).
     * The antiparallel case turns half a revolution about Y.
     */
    static Quaterniond orientationFor(double nx, double ny, double nz, Quaterniond dest) {
        if (nz < -1.0 + 1e-9) {
            return dest.rotationY(Math.PI);
        }
        return dest.rotationTo(0, 0, 1, nx, ny, nz);
    }

    @Override
    public String toString() {
        return name + position;
    }
}
