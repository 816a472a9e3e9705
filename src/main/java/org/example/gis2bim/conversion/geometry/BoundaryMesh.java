package org.example.gis2bim.conversion.geometry;

import java.util.List;

/**
 * 实体的边界表示（B-Rep 多面体）。
 * <p>
 * 约定：
 * <ul>
 *   <li>所有面都是平面多边形，外环从实体外侧看为逆时针（法向朝外）。</li>
 *   <li>带洞的面用 {@link MeshFace#innerLoops()} 表示，内环方向与外环相反。</li>
 *   <li>相邻面共享顶点索引，不复制顶点；因此“闭合”可以用有向边配对来校验（见 {@link MeshMetrics#isClosed}）。</li>
 * </ul>
 *
 * @param vertices 顶点（局部坐标，相对 {@link Placement#origin()}）
 * @param faces    面列表
 */
public record BoundaryMesh(List<Vector3> vertices, List<MeshFace> faces) {

    public BoundaryMesh {
        vertices = List.copyOf(vertices);
        faces = List.copyOf(faces);
    }

    public Vector3 vertex(int index) {
        return vertices.get(index);
    }

    /**
     * 单个平面面片。
     *
     * @param outerLoop  外环顶点索引
     * @param innerLoops 内环（洞）顶点索引，可为空列表
     */
    public record MeshFace(List<Integer> outerLoop, List<List<Integer>> innerLoops) {

        public MeshFace {
            outerLoop = List.copyOf(outerLoop);
            innerLoops = innerLoops.stream().map(List::copyOf).toList();
        }

        public static MeshFace of(Integer... outer) {
            return new MeshFace(List.of(outer), List.of());
        }

        public boolean hasHoles() {
            return !innerLoops.isEmpty();
        }
    }
}
