package org.example.gis2bim.conversion.geometry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 三种基础实体的构造器：长方体、扫掠管、拉伸多边形。
 * <p>
 * 都是纯函数：只依赖入参，不持有可变状态，可以安全地并行调用。
 * <p>
 * 失败策略：
 * <ul>
 *   <li>尺寸非正、顶点不足、中心线折返等“无法构造”的输入抛 {@link InvalidGeometryException}。</li>
 *   <li>自相交、内外环方向不一致、退化的洞等“能构造但质量可疑”的输入不中断，只往 warnings 里追加说明。</li>
 * </ul>
 */
public class GeometryPrimitives {

    public static final int DEFAULT_PIPE_SEGMENTS = 16;

    // 坐标重合判断容差（与输入坐标同单位，通常为米）
    static final double VERTEX_TOLERANCE = 1e-9;

    private final int pipeSegments;

    public GeometryPrimitives() {
        this(DEFAULT_PIPE_SEGMENTS);
    }

    public GeometryPrimitives(int pipeSegments) {
        if (pipeSegments < 3) {
            throw new IllegalArgumentException("管截面边数至少为 3：" + pipeSegments);
        }
        this.pipeSegments = pipeSegments;
    }

    public int pipeSegments() {
        return pipeSegments;
    }

    public Box makeBox(Vector3 center, double width, double depth, double height) {
        requireFinite(center, "长方体中心");
        requirePositive(width, "长方体宽度");
        requirePositive(depth, "长方体深度");
        requirePositive(height, "长方体高度");
        return new Box(width, depth, height, Placement.at(center));
    }

    public SweptPipe makeSweptPipe(List<Vector3> centerline, double radius) {
        requirePositive(radius, "管半径");
        if (centerline == null || centerline.size() < 2) {
            throw new InvalidGeometryException("管中心线至少需要 2 个顶点：" + (centerline == null ? 0 : centerline.size()));
        }
        List<Vector3> points = new ArrayList<>(centerline.size());
        for (Vector3 p : centerline) {
            requireFinite(p, "管中心线顶点");
            if (points.isEmpty() || !points.get(points.size() - 1).sameAs(p, VERTEX_TOLERANCE)) {
                points.add(p);
            }
        }
        if (points.size() < 2) {
            throw new InvalidGeometryException("管中心线去除重复点后不足 2 个顶点");
        }
        int reversal = SweptPipe.findReversal(points);
        if (reversal >= 0) {
            throw new InvalidGeometryException("管中心线在第 " + reversal + " 个顶点处原路折返，无法斜接");
        }

        Vector3 origin = points.get(0);
        List<Vector3> local = new ArrayList<>(points.size());
        for (Vector3 p : points) {
            local.add(p.minus(origin));
        }
        return new SweptPipe(local, radius, pipeSegments, Placement.at(origin));
    }

    public ExtrudedSolid makeExtrudedSolid(List<Vector3> outerRing, List<List<Vector3>> innerRings, double height) {
        return makeExtrudedSolid(outerRing, innerRings, height, new ArrayList<>());
    }

    /**
     * 拉伸多边形轮廓。
     *
     * @param outerRing  外环（可闭合也可不闭合）
     * @param innerRings 内环（洞），可为 null
     * @param height     拉伸高度
     * @param warnings   质量告警输出（非致命问题追加到这里）
     */
    public ExtrudedSolid makeExtrudedSolid(List<Vector3> outerRing, List<List<Vector3>> innerRings, double height,
                                           List<String> warnings) {
        requirePositive(height, "拉伸高度");
        if (outerRing == null) {
            throw new InvalidGeometryException("多边形缺少外环");
        }
        outerRing.forEach(p -> requireFinite(p, "多边形顶点"));
        List<Vector3> outer = FootprintRings.normalize(outerRing, VERTEX_TOLERANCE);
        if (outer.size() < 3) {
            throw new InvalidGeometryException("多边形外环至少需要 3 个不同顶点：" + outer.size());
        }
        if (FootprintRings.isCollinear(outer)) {
            throw new InvalidGeometryException("多边形外环顶点全部共线，无法构成面");
        }
        // 自相交的环有向面积可能为 0，此时按原顺序当作逆时针处理
        boolean outerCcw = FootprintRings.signedArea(outer) >= 0.0;

        List<List<Vector3>> inners = new ArrayList<>();
        List<List<Vector3>> sourceInners = (innerRings == null) ? List.of() : innerRings;
        for (int i = 0; i < sourceInners.size(); i++) {
            List<Vector3> ring = sourceInners.get(i);
            ring.forEach(p -> requireFinite(p, "多边形内环顶点"));
            List<Vector3> inner = FootprintRings.normalize(ring, VERTEX_TOLERANCE);
            if (inner.size() < 3 || FootprintRings.isCollinear(inner)) {
                warnings.add("第 " + (i + 1) + " 个内环退化（顶点不足或面积为 0），已忽略");
                continue;
            }
            if ((FootprintRings.signedArea(inner) > 0.0) == outerCcw) {
                warnings.add("第 " + (i + 1) + " 个内环与外环绕向相同（环方向不一致），已按洞处理");
            }
            inners.add(inner);
        }

        // JTS 检查自相交等拓扑问题：只告警，不拒绝
        FootprintRings.validationError(outer, inners)
                .ifPresent(error -> warnings.add("多边形拓扑无效，输出可能不是流形：" + error));

        List<Vector3> orientedOuter = outerCcw ? outer : FootprintRings.reversed(outer);
        List<List<Vector3>> orientedInners = new ArrayList<>(inners.size());
        for (List<Vector3> inner : inners) {
            orientedInners.add(FootprintRings.signedArea(inner) < 0.0 ? inner : FootprintRings.reversed(inner));
        }

        Vector3 first = orientedOuter.get(0);
        Vector3 origin = Vector3.of(first.x(), first.y(), first.z());
        return new ExtrudedSolid(
                toLocal(orientedOuter, origin),
                orientedInners.stream().map(r -> toLocal(r, origin)).toList(),
                height,
                Placement.at(origin)
        );
    }

    /**
     * 多边形轮廓质心（用于可选的质心标记），环的处理方式与 {@link #makeExtrudedSolid} 一致。
     */
    public Optional<Vector3> footprintCentroid(List<Vector3> outerRing, List<List<Vector3>> innerRings) {
        List<Vector3> outer = FootprintRings.normalize(outerRing, VERTEX_TOLERANCE);
        if (outer.size() < 3) {
            return Optional.empty();
        }
        List<List<Vector3>> inners = new ArrayList<>();
        for (List<Vector3> ring : (innerRings == null ? List.<List<Vector3>>of() : innerRings)) {
            List<Vector3> inner = FootprintRings.normalize(ring, VERTEX_TOLERANCE);
            if (inner.size() >= 3 && !FootprintRings.isCollinear(inner)) {
                inners.add(inner);
            }
        }
        Vector3 centroid = FootprintRings.centroid(outer, inners);
        if (!centroid.isFinite()) {
            return Optional.empty();
        }
        return Optional.of(centroid.withZ(outer.get(0).z()));
    }

    private static List<Vector3> toLocal(List<Vector3> ring, Vector3 origin) {
        List<Vector3> local = new ArrayList<>(ring.size());
        for (Vector3 p : ring) {
            local.add(Vector3.of(p.x() - origin.x(), p.y() - origin.y(), 0.0));
        }
        return local;
    }

    private static void requirePositive(double value, String what) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new InvalidGeometryException(what + "必须为正数：" + value);
        }
    }

    private static void requireFinite(Vector3 p, String what) {
        if (p == null || !p.isFinite()) {
            throw new InvalidGeometryException(what + "坐标无效：" + p);
        }
    }
}
