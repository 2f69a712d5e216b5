package com.sectionviewer.clip;

import com.sectionviewer.math.Axis;
import com.sectionviewer.mesh.BoundingBox;
import com.sectionviewer.mesh.CapMesh;
import com.sectionviewer.mesh.MeshSource;
import com.sectionviewer.mesh.Primitives;
import com.sectionviewer.render.HeadlessRenderer;
import com.sectionviewer.render.VirtualGizmo;
import org.joml.Vector3d;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.sectionviewer.clip.CapTriangulatorTest.area;
import static com.sectionviewer.clip.CapTriangulatorTest.assertWinding;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ClippingEngineTest {

    private HeadlessRenderer renderer;
    private VirtualGizmo gizmo;
    private ClippingEngine engine;
    private final List<ClippingEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        renderer = new HeadlessRenderer();
        gizmo = new VirtualGizmo();
        engine = new ClippingEngine(renderer, gizmo);
        engine.setModel(MeshSource.of(Primitives.unitCube()));
        engine.addListener(events::add);
    }

    @Test
    void unitCubeCutThroughCentreGivesSquareCap() {
        List<Segment> segments = new ArrayList<>();
        IntersectionExtractor.collect(engine.getModel(), engine.descriptor(Axis.X).getPlane(), segments);
        List<Loop> loops = LoopBuilder.buildLoops(segments);
        assertThat(loops).hasSize(1);
        assertThat(loops.get(0).size()).isEqualTo(4);

        engine.setClippingEnabled(true);
        engine.setPlaneEnabled(Axis.X, true);

        CapMesh cap = engine.descriptor(Axis.X).getCapMesh();
        assertThat(cap.vertexCount()).isEqualTo(4);
        assertThat(cap.triangleCount()).isEqualTo(2);
        assertThat(area(cap)).isCloseTo(1.0, within(1e-6));
        assertWinding(cap, 1);

        HeadlessRenderer.CapSlot slot = renderer.getCap(Axis.X);
        assertThat(slot.cap()).isSameAs(cap);
        assertThat(slot.visible()).isTrue();
        assertThat(renderer.getHelper(Axis.X).visible()).isTrue();
        assertThat(renderer.getHelper(Axis.X).size()).isCloseTo(1.75, within(1e-9));
    }

    @Test
    void invertedPlaneGivesFlippedCap() {
        engine.setClippingEnabled(true);
        engine.setPlaneEnabled(Axis.Y, true);

        assertThat(engine.invertNormal(Axis.Y)).isTrue();

        CapMesh cap = engine.descriptor(Axis.Y).getCapMesh();
        assertThat(cap.triangleCount()).isEqualTo(2);
        assertWinding(cap, -1);
        assertThat(cap.normals()[2]).isEqualTo(-1f);
    }

    @Test
    void capOnlyComputedWhileClippingAndPlaneEnabled() {
        engine.setPlaneEnabled(Axis.X, true);
        assertThat(engine.descriptor(Axis.X).getCapMesh().isEmpty()).isTrue();

        engine.setClippingEnabled(true);
        assertThat(engine.descriptor(Axis.X).getCapMesh().isEmpty()).isFalse();

        engine.setClippingEnabled(false);
        assertThat(engine.descriptor(Axis.X).getCapMesh().isEmpty()).isTrue();
        assertThat(renderer.getCap(Axis.X).visible()).isFalse();
        assertThat(engine.descriptor(Axis.X).getAnchor().isVisible()).isFalse();
    }

    @Test
    void planeMissingTheModelGivesEmptyHiddenCap() {
        engine.updateBoundsFromBox(new BoundingBox(-5, -5, -5, 5, 5, 5));
        engine.setClippingEnabled(true);
        engine.setPlaneEnabled(Axis.Z, true);

        engine.setOffset(Axis.Z, 3);

        assertThat(engine.descriptor(Axis.Z).getOffset()).isEqualTo(3.0);
        assertThat(engine.descriptor(Axis.Z).getCapMesh().isEmpty()).isTrue();
        assertThat(renderer.getCap(Axis.Z).visible()).isFalse();
        assertThat(renderer.getHelper(Axis.Z).visible()).isTrue();
    }

    @Test
    void nestedModelGivesTwoIslands() {
        engine.setModel(Primitives.named("nested"));
        engine.setClippingEnabled(true);
        engine.setPlaneEnabled(Axis.X, true);

        CapMesh cap = engine.descriptor(Axis.X).getCapMesh();
        assertThat(cap.vertexCount()).isEqualTo(8);
        assertThat(cap.triangleCount()).isEqualTo(4);
        assertThat(area(cap)).isCloseTo(5.0, within(1e-6));
    }

    @Test
    void unloadingModelClearsCapsAndResetsRanges() {
        engine.setClippingEnabled(true);
        engine.setPlaneEnabled(Axis.X, true);

        engine.setModel(null);

        PlaneDescriptor x = engine.descriptor(Axis.X);
        assertThat(x.getCapMesh().isEmpty()).isTrue();
        assertThat(x.getMin()).isEqualTo(-1.0);
        assertThat(x.getMax()).isEqualTo(1.0);
        assertThat(engine.getHelperSize()).isEqualTo(BoundsAdapter.DEFAULT_HELPER_SIZE);
    }

    @Test
    void eventsOnlyForActualChanges() {
        engine.setClippingEnabled(true);
        engine.setClippingEnabled(true);
        engine.setPlaneEnabled(Axis.X, true);
        engine.setOffset(Axis.X, 0.2);
        engine.setOffset(Axis.X, 0.20001);
        engine.invertNormal(Axis.X);
        engine.setActiveAxis(Axis.Y);
        engine.setActiveAxis(Axis.Y);
        engine.resetAll(true);
        engine.resetAll(false);

        assertThat(events).extracting(ClippingEvent::type).containsExactly(
            ClippingEvent.Type.CLIPPING_TOGGLED,
            ClippingEvent.Type.AXIS_ENABLED,
            ClippingEvent.Type.OFFSET_CHANGED,
            ClippingEvent.Type.NORMAL_INVERTED,
            ClippingEvent.Type.ACTIVE_AXIS_CHANGED,
            ClippingEvent.Type.RESET);
        assertThat(events.get(2).axis()).isEqualTo(Axis.X);
        assertThat(events.get(2).state().plane(Axis.X).offset()).isCloseTo(0.2, within(1e-12));
    }

    @Test
    void nullAxisIsANoOp() {
        assertThat(engine.setOffset(null, 0.3)).isEqualTo(0.0);
        assertThat(engine.setPlaneEnabled(null, true)).isFalse();
        assertThat(engine.invertNormal(null)).isFalse();
        assertThat(engine.setActiveAxis(null)).isEqualTo(Axis.X);
        assertThat(events).isEmpty();
    }

    @Test
    void rendererReceivesEnabledPlanesInAxisOrder() {
        engine.setClippingEnabled(true);
        engine.setPlaneEnabled(Axis.Z, true);
        engine.setPlaneEnabled(Axis.X, true);

        assertThat(renderer.isClippingEnabled()).isTrue();
        assertThat(renderer.getClipPlanes()).containsExactly(
            engine.descriptor(Axis.X).getPlane(), engine.descriptor(Axis.Z).getPlane());

        engine.setClippingEnabled(false);
        assertThat(renderer.isClippingEnabled()).isFalse();
        assertThat(renderer.getClipPlanes()).isEmpty();
    }

    @Test
    void gizmoFollowsActiveLivePlane() {
        assertThat(gizmo.getAttached()).isNull();

        engine.setClippingEnabled(true);
        engine.setPlaneEnabled(Axis.X, true);
        assertThat(gizmo.getAttached()).isSameAs(engine.descriptor(Axis.X).getAnchor());
        assertThat(gizmo.isEnabled()).isTrue();
        assertThat(gizmo.isVisible()).isTrue();
        assertThat(gizmo.getAxisConstraint()).isEqualTo(Axis.X);

        engine.setActiveAxis(Axis.Y);
        assertThat(gizmo.getAttached()).isNull();
        assertThat(gizmo.isVisible()).isFalse();

        engine.setPlaneEnabled(Axis.Y, true);
        assertThat(gizmo.getAttached()).isSameAs(engine.descriptor(Axis.Y).getAnchor());
        assertThat(gizmo.getAxisConstraint()).isEqualTo(Axis.Y);
    }

    @Test
    void gizmoDragMovesPlaneAndPausesCamera() {
        List<Boolean> camera = new ArrayList<>();
        engine.setCameraControls(camera::add);
        engine.setClippingEnabled(true);
        engine.setPlaneEnabled(Axis.X, true);
        events.clear();

        assertThat(gizmo.dragTo(new Vector3d(0.25, 9, 9))).isTrue();

        PlaneDescriptor x = engine.descriptor(Axis.X);
        assertThat(x.getOffset()).isEqualTo(0.25);
        assertThat(x.getAnchor().getPosition().y()).isEqualTo(0.0);
        assertThat(events).extracting(ClippingEvent::type).containsExactly(ClippingEvent.Type.OFFSET_CHANGED);
        assertThat(camera).containsExactly(false, true);
    }

    @Test
    void gizmoDragBeyondRangeSnapsAnchorBack() {
        engine.setClippingEnabled(true);
        engine.setPlaneEnabled(Axis.X, true);

        gizmo.dragTo(new Vector3d(5, 0, 0));

        PlaneDescriptor x = engine.descriptor(Axis.X);
        assertThat(x.getOffset()).isEqualTo(0.5);
        assertThat(x.getAnchor().getPosition().x()).isEqualTo(0.5);
        assertThat(engine.bridge().isSuppressed()).isFalse();
    }

    @Test
    void fillColorParseFailureKeepsPreviousColor() {
        assertThat(engine.setFillColor("not-a-color")).isEqualTo("#38bdf8");
        assertThat(events).isEmpty();

        assertThat(engine.setFillColor("#f00")).isEqualTo("#ff0000");
        assertThat(events).extracting(ClippingEvent::type).containsExactly(ClippingEvent.Type.FILL_STYLE_CHANGED);
        assertThat(renderer.getCap(Axis.X).style().rgb()).isEqualTo(0xff0000);
    }

    @Test
    void fillStyleChangesDoNotRecomputeGeometry() {
        engine.setClippingEnabled(true);
        engine.setPlaneEnabled(Axis.X, true);
        CapMesh cap = engine.descriptor(Axis.X).getCapMesh();

        engine.setFillEnabled(false);
        assertThat(renderer.getCap(Axis.X).visible()).isFalse();
        assertThat(engine.descriptor(Axis.X).getCapMesh()).isSameAs(cap);

        engine.setFillEnabled(true);
        assertThat(renderer.getCap(Axis.X).visible()).isTrue();

        assertThat(engine.setFillOpacity(2)).isEqualTo(1.0);
        assertThat(engine.setFillOpacity(0.5)).isEqualTo(0.5);
        assertThat(engine.setFillOpacity(0.5005)).isEqualTo(0.5);
        assertThat(renderer.getCap(Axis.X).style().opacity()).isEqualTo(0.5);
        assertThat(engine.descriptor(Axis.X).getCapMesh()).isSameAs(cap);
    }

    @Test
    void listenerFailureDoesNotStopOthers() {
        List<ClippingEvent> second = new ArrayList<>();
        engine.addListener(e -> {
            throw new IllegalStateException("listener broke");
        });
        engine.addListener(second::add);

        engine.setClippingEnabled(true);

        assertThat(second).hasSize(1);
    }
}
