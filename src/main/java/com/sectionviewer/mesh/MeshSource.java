package com.sectionviewer.mesh;

import java.util.List;
import java.util.function.Consumer;

/**
 * Read access to the loaded model. Implemented by the scene that owns the
 * meshes; the section pipeline only ever reads from it.
 */
public interface MeshSource {

    /**
     * Visit every mesh that is currently visible, with its current world transform.
     * Hidden meshes must not be reported.
     */
    void forEachVisibleMesh(Consumer<MeshInstance> visitor);

    /** Fixed list of meshes, all visible. */
    static MeshSource of(List<MeshInstance> meshes) {
        List<MeshInstance> copy = List.copyOf(meshes);
        return visitor -> copy.forEach(visitor);
    }

    static MeshSource of(MeshInstance... meshes) {
        return of(List.of(meshes));
    }
}
