package org.example.gis2bim.conversion.geometry;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GeometryPrimitivesTest {

    private static final double EPS = 1e-9;

    private final GeometryPrimitives primitives = new GeometryPrimitives();

    @Test
    void makeBox_hasSixPlanarFacesAndVolumeOfItsDimensions() {
        Box box = primitives.makeBox(Vector3.of(10, 20, 5), 2.0, 3.0, 4.0);
        BoundaryMesh mesh = box.toBoundaryMesh();

        assertThat(mesh.vertices()).hasSize(8);
        assertThat(mesh.faces()).hasSize(6);
        assertThat(mesh.faces()).allMatch(face -> MeshMetrics.isPlanar(mesh, face, EPS));
        assertThat(MeshMetrics.isClosed(mesh)).isTrue();
        assertThat(MeshMetrics.volume(mesh)).isCloseTo(24.0, within(EPS));
        assertThat(box.placement().origin()).isEqualTo(Vector3.of(10, 20, 5));
    }

    @Test
    void makeBox_footprintIsCenteredAndExtrudesUpward() {
        BoundaryMesh mesh = primitives.makeBox(Vector3.ZERO, 2.0, 4.0, 3.0).toBoundaryMesh();

        MeshMetrics.Bounds bounds = MeshMetrics.bounds(mesh);
        assertThat(bounds.min()).isEqualTo(Vector3.of(-1.0, -2.0, 0.0));
        assertThat(bounds.max()).isEqualTo(Vector3.of(1.0, 2.0, 3.0));
    }

    @Test
    void makeBox_rejectsNonPositiveDimensions() {
        assertThatThrownBy(() -> primitives.makeBox(Vector3.ZERO, 0.0, 1.0, 1.0))
                .isInstanceOf(InvalidGeometryException.class)
                .hasMessageContaining("宽度");
        assertThatThrownBy(() -> primitives.makeBox(Vector3.ZERO, 1.0, -1.0, 1.0))
                .isInstanceOf(InvalidGeometryException.class);
        assertThatThrownBy(() -> primitives.makeBox(Vector3.ZERO, 1.0, 1.0, Double.NaN))
                .isInstanceOf(InvalidGeometryException.class);
        assertThatThrownBy(() -> primitives.makeBox(Vector3.of(Double.NaN, 0, 0), 1.0, 1.0, 1.0))
                .isInstanceOf(InvalidGeometryException.class);
    }

    @Test
    void makeSweptPipe_straightPipeIsClosedPrismAroundCenterline() {
        SweptPipe pipe = primitives.makeSweptPipe(List.of(Vector3.ZERO, Vector3.of(10, 0, 0)), 1.0);
        BoundaryMesh mesh = pipe.toBoundaryMesh();

        int n = GeometryPrimitives.DEFAULT_PIPE_SEGMENTS;
        double sectionArea = n / 2.0 * Math.sin(2.0 * Math.PI / n);
        assertThat(mesh.vertices()).hasSize(2 * n);
        assertThat(mesh.faces()).hasSize(n + 2);
        assertThat(MeshMetrics.isClosed(mesh)).isTrue();
        assertThat(MeshMetrics.volume(mesh)).isCloseTo(sectionArea * 10.0, within(1e-6));
    }

    @Test
    void makeSweptPipe_sharesMiteredRingAtEachJoint() {
        List<Vector3> centerline = List.of(Vector3.of(100, 200, 0), Vector3.of(110, 200, 0), Vector3.of(110, 210, 0));
        SweptPipe pipe = primitives.makeSweptPipe(centerline, 1.0);
        BoundaryMesh mesh = pipe.toBoundaryMesh();

        int n = pipe.segments();
        assertThat(pipe.segmentCount()).isEqualTo(2);
        assertThat(pipe.centerlineLength()).isCloseTo(20.0, within(EPS));
        // 三个顶点三个截面环，拐点环被两段共用
        assertThat(mesh.vertices()).hasSize(3 * n);
        assertThat(mesh.faces()).hasSize(2 * n + 2);
        assertThat(MeshMetrics.isClosed(mesh)).isTrue();
        assertThat(mesh.faces()).allMatch(face -> MeshMetrics.isPlanar(mesh, face, 1e-9));

        Vector3 joint = pipe.centerline().get(1);
        Vector3 bisector = Vector3.of(1, 1, 0).normalized();
        for (int k = n; k < 2 * n; k++) {
            assertThat(bisector.dot(mesh.vertex(k).minus(joint))).isCloseTo(0.0, within(1e-9));
        }

        double sectionArea = n / 2.0 * Math.sin(2.0 * Math.PI / n);
        assertThat(MeshMetrics.volume(mesh)).isCloseTo(sectionArea * 20.0, within(1e-6));
    }

    @Test
    void makeSweptPipe_storesCenterlineRelativeToFirstVertex() {
        SweptPipe pipe = primitives.makeSweptPipe(List.of(Vector3.of(5, 5, 1), Vector3.of(5, 8, 1)), 0.2);

        assertThat(pipe.placement().origin()).isEqualTo(Vector3.of(5, 5, 1));
        assertThat(pipe.centerline()).containsExactly(Vector3.ZERO, Vector3.of(0, 3, 0));
    }

    @Test
    void makeSweptPipe_collapsesConsecutiveDuplicateVertices() {
        SweptPipe pipe = primitives.makeSweptPipe(
                List.of(Vector3.ZERO, Vector3.ZERO, Vector3.of(5, 0, 0), Vector3.of(5, 0, 0)), 0.5);

        assertThat(pipe.centerline()).hasSize(2);
    }

    @Test
    void makeSweptPipe_worksForVerticalCenterline() {
        SweptPipe pipe = primitives.makeSweptPipe(List.of(Vector3.ZERO, Vector3.of(0, 0, 4)), 0.5);

        assertThat(MeshMetrics.isClosed(pipe.toBoundaryMesh())).isTrue();
        assertThat(MeshMetrics.volume(pipe.toBoundaryMesh())).isPositive();
    }

    @Test
    void makeSweptPipe_rejectsTooFewVerticesBadRadiusAndReversal() {
        assertThatThrownBy(() -> primitives.makeSweptPipe(List.of(Vector3.ZERO), 1.0))
                .isInstanceOf(InvalidGeometryException.class);
        assertThatThrownBy(() -> primitives.makeSweptPipe(List.of(Vector3.ZERO, Vector3.ZERO), 1.0))
                .isInstanceOf(InvalidGeometryException.class);
        assertThatThrownBy(() -> primitives.makeSweptPipe(List.of(Vector3.ZERO, Vector3.of(1, 0, 0)), 0.0))
                .isInstanceOf(InvalidGeometryException.class);
        assertThatThrownBy(() -> primitives.makeSweptPipe(
                List.of(Vector3.ZERO, Vector3.of(1, 0, 0), Vector3.of(0.5, 0, 0)), 0.1))
                .isInstanceOf(InvalidGeometryException.class)
                .hasMessageContaining("折返");
    }

    @Test
    void makeExtrudedSolid_volumeIsAreaTimesHeight() {
        ExtrudedSolid solid = primitives.makeExtrudedSolid(square(0, 0, 1), List.of(), 2.0);
        BoundaryMesh mesh = solid.toBoundaryMesh();

        assertThat(MeshMetrics.isClosed(mesh)).isTrue();
        assertThat(mesh.faces()).hasSize(2 + 4);
        assertThat(MeshMetrics.volume(mesh)).isCloseTo(2.0, within(EPS));
    }

    @Test
    void makeExtrudedSolid_subtractsHoles() {
        List<String> warnings = new ArrayList<>();
        ExtrudedSolid solid = primitives.makeExtrudedSolid(square(0, 0, 3), List.of(square(1, 1, 1)), 1.0, warnings);
        BoundaryMesh mesh = solid.toBoundaryMesh();

        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0)).contains("环方向不一致");
        assertThat(solid.innerRings()).hasSize(1);
        assertThat(solid.footprintArea()).isCloseTo(8.0, within(EPS));
        assertThat(mesh.faces().get(0).hasHoles()).isTrue();
        assertThat(MeshMetrics.isClosed(mesh)).isTrue();
        assertThat(MeshMetrics.volume(mesh)).isCloseTo(8.0, within(EPS));
    }

    @Test
    void makeExtrudedSolid_acceptsClockwiseHoleWithoutWarning() {
        List<String> warnings = new ArrayList<>();
        List<Vector3> hole = FootprintRings.reversed(square(1, 1, 1));
        primitives.makeExtrudedSolid(square(0, 0, 3), List.of(hole), 1.0, warnings);

        assertThat(warnings).isEmpty();
    }

    @Test
    void makeExtrudedSolid_reorientsClockwiseOuterRingAndDropsClosingVertex() {
        List<Vector3> closedClockwise = new ArrayList<>(FootprintRings.reversed(square(0, 0, 10)));
        closedClockwise.add(closedClockwise.get(0));

        ExtrudedSolid solid = primitives.makeExtrudedSolid(closedClockwise, null, 6.0);

        assertThat(solid.outerRing()).hasSize(4);
        assertThat(FootprintRings.signedArea(solid.outerRing())).isPositive();
        assertThat(MeshMetrics.volume(solid.toBoundaryMesh())).isCloseTo(600.0, within(1e-6));
    }

    @Test
    void makeExtrudedSolid_dropsDegenerateHoleWithWarning() {
        List<String> warnings = new ArrayList<>();
        List<Vector3> flat = List.of(Vector3.of(1, 1), Vector3.of(2, 1), Vector3.of(3, 1));

        ExtrudedSolid solid = primitives.makeExtrudedSolid(square(0, 0, 5), List.of(flat), 1.0, warnings);

        assertThat(solid.innerRings()).isEmpty();
        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0)).contains("退化");
    }

    @Test
    void makeExtrudedSolid_selfIntersectingRingDegradesWithWarning() {
        List<String> warnings = new ArrayList<>();
        List<Vector3> bowtie = List.of(Vector3.of(0, 0), Vector3.of(2, 2), Vector3.of(2, 0), Vector3.of(0, 2));

        ExtrudedSolid solid = primitives.makeExtrudedSolid(bowtie, List.of(), 1.0, warnings);

        assertThat(solid).isNotNull();
        assertThat(warnings).anyMatch(w -> w.contains("拓扑无效"));
    }

    @Test
    void makeExtrudedSolid_rejectsTooFewVerticesAndBadHeight() {
        assertThatThrownBy(() -> primitives.makeExtrudedSolid(List.of(Vector3.ZERO, Vector3.of(1, 0)), List.of(), 1.0))
                .isInstanceOf(InvalidGeometryException.class);
        assertThatThrownBy(() -> primitives.makeExtrudedSolid(
                List.of(Vector3.ZERO, Vector3.of(1, 0), Vector3.of(2, 0)), List.of(), 1.0))
                .isInstanceOf(InvalidGeometryException.class)
                .hasMessageContaining("共线");
        assertThatThrownBy(() -> primitives.makeExtrudedSolid(square(0, 0, 1), List.of(), 0.0))
                .isInstanceOf(InvalidGeometryException.class);
    }

    @Test
    void makeExtrudedSolid_placesSolidAtFirstOuterVertex() {
        List<Vector3> ring = List.of(Vector3.of(100, 50, 2), Vector3.of(104, 50, 2), Vector3.of(104, 53, 2));

        ExtrudedSolid solid = primitives.makeExtrudedSolid(ring, List.of(), 1.0);

        assertThat(solid.placement().origin()).isEqualTo(Vector3.of(100, 50, 2));
        assertThat(solid.outerRing().get(0)).isEqualTo(Vector3.ZERO);
        assertThat(solid.outerRing()).allMatch(p -> p.z() == 0.0);
    }

    @Test
    void footprintCentroid_usesHoles() {
        assertThat(primitives.footprintCentroid(square(0, 0, 4), List.of())).hasValueSatisfying(c -> {
            assertThat(c.x()).isCloseTo(2.0, within(EPS));
            assertThat(c.y()).isCloseTo(2.0, within(EPS));
        });
        assertThat(primitives.footprintCentroid(square(0, 0, 4), List.of(square(0, 0, 2))))
                .hasValueSatisfying(c -> assertThat(c.x()).isGreaterThan(2.0));
        assertThat(primitives.footprintCentroid(List.of(Vector3.ZERO, Vector3.of(1, 0)), List.of())).isEmpty();
    }

    @Test
    void constructor_rejectsTooFewPipeSegments() {
        assertThatThrownBy(() -> new GeometryPrimitives(2)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new GeometryPrimitives(6).makeSweptPipe(List.of(Vector3.ZERO, Vector3.of(1, 0, 0)), 1.0)
                .toBoundaryMesh().vertices()).hasSize(12);
    }

    private static List<Vector3> square(double x, double y, double size) {
        return List.of(
                Vector3.of(x, y),
                Vector3.of(x + size, y),
                Vector3.of(x + size, y + size),
                Vector3.of(x, y + size)
        );
    }
}
