package org.example.gis2bim.conversion.geometry;

import java.util.ArrayList;
import java.util.List;

/**
 * 沿折线中心线扫掠圆形截面得到的管状实体。
 * <p>
 * 截面用正 {@code segments} 边形近似。相邻两段在拐点处采用斜接（miter）：拐点截面位于两段方向的角平分面上，
 * 并且被前后两段共同使用（同一组顶点），所以拐点处既没有缝隙也没有重叠。
 *
 * @param centerline 中心线顶点（局部坐标，已去除连续重复点，至少 2 个）
 * @param radius     截面半径
 * @param segments   截面多边形边数
 * @param placement  放置（原点为中心线起点）
 */
public record SweptPipe(List<Vector3> centerline, double radius, int segments, Placement placement)
        implements SolidGeometry {

    // 1 + cos(夹角) 小于该值视为中心线原路折返，斜接面不存在
    static final double REVERSAL_TOLERANCE = 1e-9;

    public SweptPipe {
        centerline = List.copyOf(centerline);
    }

    public int segmentCount() {
        return centerline.size() - 1;
    }

    public double centerlineLength() {
        double length = 0.0;
        for (int i = 1; i < centerline.size(); i++) {
            length += centerline.get(i).minus(centerline.get(i - 1)).length();
        }
        return length;
    }

    @Override
    public BoundaryMesh toBoundaryMesh() {
        List<List<Vector3>> rings = buildRings();
        int m = segments;
        List<Vector3> vertices = new ArrayList<>(rings.size() * m);
        for (List<Vector3> ring : rings) {
            vertices.addAll(ring);
        }

        List<BoundaryMesh.MeshFace> faces = new ArrayList<>(segmentCount() * m + 2);

        // 起点端盖：法向为 -d0，截面环反向
        List<Integer> startCap = new ArrayList<>(m);
        for (int k = m - 1; k >= 0; k--) {
            startCap.add(k);
        }
        faces.add(new BoundaryMesh.MeshFace(startCap, List.of()));

        for (int i = 0; i < rings.size() - 1; i++) {
            int base = i * m;
            int next = (i + 1) * m;
            for (int k = 0; k < m; k++) {
                int k1 = (k + 1) % m;
                faces.add(BoundaryMesh.MeshFace.of(base + k, base + k1, next + k1, next + k));
            }
        }

        int last = (rings.size() - 1) * m;
        List<Integer> endCap = new ArrayList<>(m);
        for (int k = 0; k < m; k++) {
            endCap.add(last + k);
        }
        faces.add(new BoundaryMesh.MeshFace(endCap, List.of()));

        return new BoundaryMesh(vertices, faces);
    }

    /**
     * 逐个顶点计算截面环：起点环垂直于首段方向；之后每个环都由上一个环沿上一段方向平移到
     * 当前顶点的切割平面（中间顶点为角平分面，终点为垂直于末段的平面）。
     */
    List<List<Vector3>> buildRings() {
        int n = centerline.size();
        List<Vector3> directions = new ArrayList<>(n - 1);
        for (int i = 0; i < n - 1; i++) {
            directions.add(centerline.get(i + 1).minus(centerline.get(i)).normalized());
        }

        Vector3 d0 = directions.get(0);
        Vector3 reference = Math.abs(d0.dot(Vector3.UNIT_Z)) > 0.9 ? Vector3.UNIT_X : Vector3.UNIT_Z;
        Vector3 u = reference.cross(d0).normalized();
        Vector3 v = d0.cross(u);

        List<List<Vector3>> rings = new ArrayList<>(n);
        List<Vector3> first = new ArrayList<>(segments);
        Vector3 p0 = centerline.get(0);
        for (int k = 0; k < segments; k++) {
            double theta = 2.0 * Math.PI * k / segments;
            first.add(p0.plus(u.times(radius * Math.cos(theta))).plus(v.times(radius * Math.sin(theta))));
        }
        rings.add(first);

        for (int i = 1; i < n; i++) {
            Vector3 incoming = directions.get(i - 1);
            Vector3 planeNormal = (i == n - 1)
                    ? incoming
                    : incoming.plus(directions.get(i)).normalized();
            Vector3 point = centerline.get(i);
            double denominator = planeNormal.dot(incoming);
            List<Vector3> previous = rings.get(i - 1);
            List<Vector3> ring = new ArrayList<>(segments);
            for (Vector3 p : previous) {
                double t = planeNormal.dot(point.minus(p)) / denominator;
                ring.add(p.plus(incoming.times(t)));
            }
            rings.add(ring);
        }
        return rings;
    }

    /**
     * 返回中心线第一次原路折返的顶点序号；没有折返返回 -1。
     */
    static int findReversal(List<Vector3> centerline) {
        for (int i = 1; i < centerline.size() - 1; i++) {
            Vector3 a = centerline.get(i).minus(centerline.get(i - 1)).normalized();
            Vector3 b = centerline.get(i + 1).minus(centerline.get(i)).normalized();
            if (1.0 + a.dot(b) < REVERSAL_TOLERANCE) {
                return i;
            }
        }
        return -1;
    }
}
