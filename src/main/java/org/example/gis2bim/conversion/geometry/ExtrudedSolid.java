package org.example.gis2bim.conversion.geometry;

import java.util.ArrayList;
import java.util.List;

/**
 * 平面轮廓（外环减去内环）沿 Z 轴向上拉伸得到的实体。
 * <p>
 * 环已经规范化：不含闭合重复点，外环逆时针、内环顺时针（从上往下看），z 均为 0（局部坐标）。
 *
 * @param outerRing  外环
 * @param innerRings 内环（洞），可为空
 * @param height     拉伸高度
 * @param placement  放置（原点为外环首点，z 为基准标高）
 */
public record ExtrudedSolid(List<Vector3> outerRing, List<List<Vector3>> innerRings, double height, Placement placement)
        implements SolidGeometry {

    public ExtrudedSolid {
        outerRing = List.copyOf(outerRing);
        innerRings = innerRings.stream().map(List::copyOf).toList();
    }

    public double footprintArea() {
        double area = FootprintRings.signedArea(outerRing);
        for (List<Vector3> inner : innerRings) {
            area += FootprintRings.signedArea(inner);
        }
        return area;
    }

    @Override
    public BoundaryMesh toBoundaryMesh() {
        List<Vector3> vertices = new ArrayList<>();
        List<int[]> ringOffsets = new ArrayList<>();

        // 每个环依次写入：底面顶点 [start, start+n)，顶面顶点 [start+n, start+2n)
        List<List<Vector3>> rings = new ArrayList<>(1 + innerRings.size());
        rings.add(outerRing);
        rings.addAll(innerRings);
        for (List<Vector3> ring : rings) {
            int start = vertices.size();
            for (Vector3 p : ring) {
                vertices.add(p.withZ(0.0));
            }
            for (Vector3 p : ring) {
                vertices.add(p.withZ(height));
            }
            ringOffsets.add(new int[]{start, ring.size()});
        }

        List<BoundaryMesh.MeshFace> faces = new ArrayList<>();
        faces.add(capFace(ringOffsets, true));
        faces.add(capFace(ringOffsets, false));

        for (int[] offset : ringOffsets) {
            int start = offset[0];
            int n = offset[1];
            for (int i = 0; i < n; i++) {
                int a = start + i;
                int b = start + (i + 1) % n;
                faces.add(BoundaryMesh.MeshFace.of(a, b, b + n, a + n));
            }
        }
        return new BoundaryMesh(vertices, faces);
    }

    private static BoundaryMesh.MeshFace capFace(List<int[]> ringOffsets, boolean top) {
        List<Integer> outer = loop(ringOffsets.get(0), top);
        List<List<Integer>> inner = new ArrayList<>(ringOffsets.size() - 1);
        for (int i = 1; i < ringOffsets.size(); i++) {
            inner.add(loop(ringOffsets.get(i), top));
        }
        return new BoundaryMesh.MeshFace(outer, inner);
    }

    // 顶面按原方向，底面反向（法向朝下）
    private static List<Integer> loop(int[] offset, boolean top) {
        int start = offset[0];
        int n = offset[1];
        List<Integer> indices = new ArrayList<>(n);
        if (top) {
            for (int i = 0; i < n; i++) {
                indices.add(start + n + i);
            }
        } else {
            for (int i = n - 1; i >= 0; i--) {
                indices.add(start + i);
            }
        }
        return indices;
    }
}
