package org.example.gis2bim.conversion.geometry;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 边界网格的度量与校验：体积、闭合性、面片平面性、包围盒。
 */
public final class MeshMetrics {

    private MeshMetrics() {
    }

    /**
     * 用散度定理计算体积：每个环按扇形三角化，累加与原点构成的有向四面体体积。
     * <p>
     * 对平面面片成立（洞环方向相反，自然扣除）；闭合且法向朝外时结果为正。
     */
    public static double volume(BoundaryMesh mesh) {
        double sixTimes = 0.0;
        for (BoundaryMesh.MeshFace face : mesh.faces()) {
            sixTimes += loopVolume(mesh, face.outerLoop());
            for (List<Integer> inner : face.innerLoops()) {
                sixTimes += loopVolume(mesh, inner);
            }
        }
        return sixTimes / 6.0;
    }

    private static double loopVolume(BoundaryMesh mesh, List<Integer> loop) {
        double sum = 0.0;
        Vector3 a = mesh.vertex(loop.get(0));
        for (int i = 1; i + 1 < loop.size(); i++) {
            Vector3 b = mesh.vertex(loop.get(i));
            Vector3 c = mesh.vertex(loop.get(i + 1));
            sum += a.dot(b.cross(c));
        }
        return sum;
    }

    /**
     * 闭合（水密）校验：每条有向边恰好出现一次，且其反向边也恰好出现一次。
     * <p>
     * 该条件同时保证了无缝隙、无重复面、相邻面方向一致。
     */
    public static boolean isClosed(BoundaryMesh mesh) {
        Map<Long, Integer> directed = new HashMap<>();
        for (BoundaryMesh.MeshFace face : mesh.faces()) {
            if (!addEdges(directed, face.outerLoop())) {
                return false;
            }
            for (List<Integer> inner : face.innerLoops()) {
                if (!addEdges(directed, inner)) {
                    return false;
                }
            }
        }
        for (Long key : directed.keySet()) {
            int from = (int) (key >>> 32);
            int to = (int) (key & 0xFFFFFFFFL);
            if (!directed.containsKey(edgeKey(to, from))) {
                return false;
            }
        }
        return true;
    }

    private static boolean addEdges(Map<Long, Integer> directed, List<Integer> loop) {
        for (int i = 0; i < loop.size(); i++) {
            int from = loop.get(i);
            int to = loop.get((i + 1) % loop.size());
            if (from == to) {
                return false;
            }
            if (directed.merge(edgeKey(from, to), 1, Integer::sum) > 1) {
                return false;
            }
        }
        return true;
    }

    private static long edgeKey(int from, int to) {
        return ((long) from << 32) | (to & 0xFFFFFFFFL);
    }

    /**
     * 判断面片所有顶点（含内环）是否落在同一平面上（Newell 法向 + 距离容差）。
     */
    public static boolean isPlanar(BoundaryMesh mesh, BoundaryMesh.MeshFace face, double tolerance) {
        Vector3 normal = newellNormal(mesh, face.outerLoop());
        if (normal.length() == 0.0) {
            return false;
        }
        normal = normal.normalized();
        Vector3 anchor = mesh.vertex(face.outerLoop().get(0));
        for (int index : face.outerLoop()) {
            if (Math.abs(normal.dot(mesh.vertex(index).minus(anchor))) > tolerance) {
                return false;
            }
        }
        for (List<Integer> inner : face.innerLoops()) {
            for (int index : inner) {
                if (Math.abs(normal.dot(mesh.vertex(index).minus(anchor))) > tolerance) {
                    return false;
                }
            }
        }
        return true;
    }

    static Vector3 newellNormal(BoundaryMesh mesh, List<Integer> loop) {
        double nx = 0.0;
        double ny = 0.0;
        double nz = 0.0;
        for (int i = 0; i < loop.size(); i++) {
            Vector3 a = mesh.vertex(loop.get(i));
            Vector3 b = mesh.vertex(loop.get((i + 1) % loop.size()));
            nx += (a.y() - b.y()) * (a.z() + b.z());
            ny += (a.z() - b.z()) * (a.x() + b.x());
            nz += (a.x() - b.x()) * (a.y() + b.y());
        }
        return Vector3.of(nx, ny, nz);
    }

    /**
     * 轴对齐包围盒（局部坐标）。网格没有顶点时抛 {@link IllegalArgumentException}。
     */
    public static Bounds bounds(BoundaryMesh mesh) {
        if (mesh.vertices().isEmpty()) {
            throw new IllegalArgumentException("网格没有顶点");
        }
        return bounds(mesh.vertices());
    }

    /**
     * 点集的轴对齐包围盒。点集为空时抛 {@link IllegalArgumentException}。
     */
    public static Bounds bounds(Collection<Vector3> points) {
        if (points.isEmpty()) {
            throw new IllegalArgumentException("点集为空");
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double minZ = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        double maxZ = Double.NEGATIVE_INFINITY;
        for (Vector3 p : points) {
            minX = Math.min(minX, p.x());
            minY = Math.min(minY, p.y());
            minZ = Math.min(minZ, p.z());
            maxX = Math.max(maxX, p.x());
            maxY = Math.max(maxY, p.y());
            maxZ = Math.max(maxZ, p.z());
        }
        return new Bounds(Vector3.of(minX, minY, minZ), Vector3.of(maxX, maxY, maxZ));
    }

    public record Bounds(Vector3 min, Vector3 max) {

        public Vector3 size() {
            return max.minus(min);
        }

        public Vector3 center() {
            return min.plus(max).times(0.5);
        }

        /**
         * 点的平面投影是否严格落在包围盒的 XY 范围内（边界上不算）。
         */
        public boolean containsXyStrictly(Vector3 p) {
            return min.x() < p.x() && p.x() < max.x() && min.y() < p.y() && p.y() < max.y();
        }
    }
}
