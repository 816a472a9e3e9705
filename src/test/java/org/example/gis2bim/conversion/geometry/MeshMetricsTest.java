package org.example.gis2bim.conversion.geometry;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MeshMetricsTest {

    @Test
    void isClosed_detectsMissingFace() {
        BoundaryMesh box = new Box(1, 1, 1, Placement.at(Vector3.ZERO)).toBoundaryMesh();
        BoundaryMesh open = new BoundaryMesh(box.vertices(), box.faces().subList(1, box.faces().size()));

        assertThat(MeshMetrics.isClosed(box)).isTrue();
        assertThat(MeshMetrics.isClosed(open)).isFalse();
    }

    @Test
    void isClosed_detectsInconsistentOrientation() {
        BoundaryMesh box = new Box(1, 1, 1, Placement.at(Vector3.ZERO)).toBoundaryMesh();
        List<BoundaryMesh.MeshFace> faces = new ArrayList<>(box.faces());
        faces.set(0, BoundaryMesh.MeshFace.of(0, 1, 2, 3));

        assertThat(MeshMetrics.isClosed(new BoundaryMesh(box.vertices(), faces))).isFalse();
    }

    @Test
    void volume_isNegativeForInwardFacingMesh() {
        BoundaryMesh box = new Box(2, 2, 2, Placement.at(Vector3.ZERO)).toBoundaryMesh();
        List<BoundaryMesh.MeshFace> flipped = box.faces().stream()
                .map(f -> new BoundaryMesh.MeshFace(reverse(f.outerLoop()), List.of()))
                .toList();

        assertThat(MeshMetrics.volume(new BoundaryMesh(box.vertices(), flipped))).isCloseTo(-8.0, within(1e-9));
    }

    @Test
    void isPlanar_rejectsWarpedQuad() {
        BoundaryMesh mesh = new BoundaryMesh(
                List.of(Vector3.of(0, 0, 0), Vector3.of(1, 0, 0), Vector3.of(1, 1, 0.5), Vector3.of(0, 1, 0)),
                List.of(BoundaryMesh.MeshFace.of(0, 1, 2, 3)));

        assertThat(MeshMetrics.isPlanar(mesh, mesh.faces().get(0), 1e-6)).isFalse();
    }

    @Test
    void bounds_coversAllVertices() {
        BoundaryMesh mesh = new Box(2, 4, 3, Placement.at(Vector3.ZERO)).toBoundaryMesh();

        MeshMetrics.Bounds bounds = MeshMetrics.bounds(mesh);

        assertThat(bounds.size()).isEqualTo(Vector3.of(2, 4, 3));
    }

    private static List<Integer> reverse(List<Integer> loop) {
        List<Integer> copy = new ArrayList<>(loop);
        Collections.reverse(copy);
        return copy;
    }
}
