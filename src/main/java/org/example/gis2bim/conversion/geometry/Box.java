package org.example.gis2bim.conversion.geometry;

import java.util.List;

/**
 * 轴对齐长方体：底面中心位于放置原点，向上拉伸 {@code height}。
 */
public record Box(double width, double depth, double height, Placement placement) implements SolidGeometry {

    @Override
    public BoundaryMesh toBoundaryMesh() {
        double hx = width / 2.0;
        double hy = depth / 2.0;
        List<Vector3> vertices = List.of(
                Vector3.of(-hx, -hy, 0.0),
                Vector3.of(hx, -hy, 0.0),
                Vector3.of(hx, hy, 0.0),
                Vector3.of(-hx, hy, 0.0),
                Vector3.of(-hx, -hy, height),
                Vector3.of(hx, -hy, height),
                Vector3.of(hx, hy, height),
                Vector3.of(-hx, hy, height)
        );
        List<BoundaryMesh.MeshFace> faces = List.of(
                BoundaryMesh.MeshFace.of(0, 3, 2, 1), // 底
                BoundaryMesh.MeshFace.of(4, 5, 6, 7), // 顶
                BoundaryMesh.MeshFace.of(0, 1, 5, 4),
                BoundaryMesh.MeshFace.of(1, 2, 6, 5),
                BoundaryMesh.MeshFace.of(2, 3, 7, 6),
                BoundaryMesh.MeshFace.of(3, 0, 4, 7)
        );
        return new BoundaryMesh(vertices, faces);
    }
}
