package org.example.gis2bim.conversion.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 平面轮廓环的工具方法（只看 x/y）。
 * <p>
 * 拓扑有效性检查与质心计算交给 JTS；本类只负责把内部的 {@link Vector3} 环转换成 JTS 需要的闭合坐标串。
 */
public final class FootprintRings {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private FootprintRings() {
    }

    /**
     * 折叠连续重复点，并去掉末尾的闭合重复点（未闭合的环视为隐式闭合）。
     */
    public static List<Vector3> normalize(List<Vector3> ring, double tolerance) {
        List<Vector3> out = new ArrayList<>(ring.size());
        for (Vector3 p : ring) {
            if (out.isEmpty() || !out.get(out.size() - 1).sameAs(p, tolerance)) {
                out.add(p);
            }
        }
        while (out.size() > 1 && out.get(0).sameAs(out.get(out.size() - 1), tolerance)) {
            out.remove(out.size() - 1);
        }
        return out;
    }

    /**
     * 鞋带公式计算有向面积：逆时针为正，顺时针为负。
     */
    public static double signedArea(List<Vector3> ring) {
        double sum = 0.0;
        int n = ring.size();
        for (int i = 0; i < n; i++) {
            Vector3 a = ring.get(i);
            Vector3 b = ring.get((i + 1) % n);
            sum += a.x() * b.y() - b.x() * a.y();
        }
        return sum / 2.0;
    }

    /**
     * 所有顶点是否共线（含点数不足 3 的情况）。
     */
    public static boolean isCollinear(List<Vector3> ring) {
        if (ring.size() < 3) {
            return true;
        }
        Vector3 a = ring.get(0);
        for (int i = 1; i + 1 < ring.size(); i++) {
            Vector3 ab = ring.get(i).minus(a);
            Vector3 ac = ring.get(i + 1).minus(a);
            if (ab.x() * ac.y() - ab.y() * ac.x() != 0.0) {
                return false;
            }
        }
        return true;
    }

    public static List<Vector3> reversed(List<Vector3> ring) {
        List<Vector3> copy = new ArrayList<>(ring);
        Collections.reverse(copy);
        return copy;
    }

    /**
     * 用 JTS 做拓扑有效性检查（自相交、洞在外环之外、环相交等）。
     *
     * @return 无问题时为空；否则为 JTS 给出的错误描述（含位置）
     */
    public static Optional<String> validationError(List<Vector3> outer, List<List<Vector3>> inners) {
        Polygon polygon = toPolygon(outer, inners);
        TopologyValidationError error = new IsValidOp(polygon).getValidationError();
        if (error == null) {
            return Optional.empty();
        }
        Coordinate at = error.getCoordinate();
        String where = (at == null) ? "" : "（位置 " + at.getX() + ", " + at.getY() + "）";
        return Optional.of(error.getMessage() + where);
    }

    public static Vector3 centroid(List<Vector3> outer, List<List<Vector3>> inners) {
        Point centroid = toPolygon(outer, inners).getCentroid();
        return Vector3.of(centroid.getX(), centroid.getY());
    }

    static Polygon toPolygon(List<Vector3> outer, List<List<Vector3>> inners) {
        LinearRing shell = toLinearRing(outer);
        LinearRing[] holes = new LinearRing[inners.size()];
        for (int i = 0; i < inners.size(); i++) {
            holes[i] = toLinearRing(inners.get(i));
        }
        return GEOMETRY_FACTORY.createPolygon(shell, holes);
    }

    private static LinearRing toLinearRing(List<Vector3> ring) {
        Coordinate[] coordinates = new Coordinate[ring.size() + 1];
        for (int i = 0; i < ring.size(); i++) {
            Vector3 p = ring.get(i);
            coordinates[i] = new Coordinate(p.x(), p.y());
        }
        coordinates[ring.size()] = coordinates[0].copy();
        return GEOMETRY_FACTORY.createLinearRing(coordinates);
    }
}
