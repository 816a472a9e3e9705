package org.example.gis2bim.conversion.transfer;

import org.example.gis2bim.conversion.geometry.InvalidGeometryException;
import org.example.gis2bim.conversion.geometry.MeshMetrics;
import org.example.gis2bim.conversion.geometry.Vector3;
import org.example.gis2bim.conversion.io.StepModel;
import org.example.gis2bim.conversion.io.StepText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 从 IFC 实体图计算构件的世界坐标顶点，得到质心与包围盒。
 * <p>
 * 识别带 ObjectPlacement（IfcLocalPlacement）和 Representation（IfcProductDefinitionShape）的构件，
 * 开洞构件（IfcOpeningElement）除外。优先取标识为 Body 的表达，没有时取第一个。支持的表达项：
 * <ul>
 *   <li>IfcExtrudedAreaSolid（矩形、圆形、任意轮廓，轮廓曲线为 IfcPolyline）</li>
 *   <li>IfcFacetedBrep</li>
 *   <li>IfcSweptDiskSolid（中心线为 IfcPolyline，顶点按半径外扩）</li>
 *   <li>IfcBooleanResult / IfcBooleanClippingResult（取第一个操作数）</li>
 *   <li>IfcMappedItem</li>
 * </ul>
 * 其它表达项使整个构件被跳过并告警。
 */
public class ProductShapeReader {

    private static final Logger log = LoggerFactory.getLogger(ProductShapeReader.class);

    // 放置链、映射嵌套的最大深度，超过视为循环引用
    private static final int MAX_DEPTH = 64;

    /**
     * @param warnings 无法计算几何的构件在此追加说明
     */
    public List<ProductShape> read(StepModel model, List<String> warnings) {
        List<ProductShape> out = new ArrayList<>();
        for (StepModel.Entity entity : model.entities()) {
            if (!isProduct(model, entity)) {
                continue;
            }
            String globalId = entity.stringArg(0);
            try {
                List<Vector3> points = worldPoints(model, entity);
                if (points.isEmpty()) {
                    throw new InvalidGeometryException("几何没有顶点");
                }
                out.add(new ProductShape(entity.id(), globalId, entity.type(), mean(points), MeshMetrics.bounds(points)));
            } catch (InvalidGeometryException e) {
                String message = entity.type() + " #" + entity.id() + " (" + globalId + ") 几何无法计算：" + e.getMessage();
                log.warn(message);
                warnings.add(message);
            }
        }
        log.debug("构件几何已计算：products={}", out.size());
        return out;
    }

    static boolean isProduct(StepModel model, StepModel.Entity entity) {
        if (entity.is("IFCOPENINGELEMENT") || entity.args().size() < 7 || entity.stringArg(0) == null) {
            return false;
        }
        return isType(model, entity.refArg(5), "IFCLOCALPLACEMENT")
                && isType(model, entity.refArg(6), "IFCPRODUCTDEFINITIONSHAPE");
    }

    List<Vector3> worldPoints(StepModel model, StepModel.Entity product) {
        Frame placement = placement(model, product.refArg(5), 0);
        StepModel.Entity shape = require(model, product.refArg(6));
        List<Vector3> out = new ArrayList<>();
        for (Vector3 p : representationPoints(model, chooseRepresentation(model, shape), 0)) {
            Vector3 world = placement.apply(p);
            if (!world.isFinite()) {
                throw new InvalidGeometryException("顶点坐标不是有限数值");
            }
            out.add(world);
        }
        return out;
    }

    // ---------------------------------------------------------------- placement

    private Frame placement(StepModel model, int id, int depth) {
        if (id < 0) {
            return Frame.IDENTITY;
        }
        if (depth > MAX_DEPTH) {
            throw new InvalidGeometryException("放置链过深或存在循环引用：#" + id);
        }
        StepModel.Entity entity = require(model, id);
        if (entity.is("IFCLOCALPLACEMENT")) {
            Frame parent = placement(model, entity.refArg(0), depth + 1);
            return parent.compose(axisPlacement(model, entity.refArg(1)));
        }
        throw new InvalidGeometryException("不支持的放置类型：" + entity.type());
    }

    private Frame axisPlacement(StepModel model, int id) {
        if (id < 0) {
            return Frame.IDENTITY;
        }
        StepModel.Entity entity = require(model, id);
        if (entity.is("IFCAXIS2PLACEMENT3D")) {
            return Frame.of(point(model, entity.refArg(0)),
                    direction(model, entity.refArg(1), Vector3.UNIT_Z),
                    direction(model, entity.refArg(2), Vector3.UNIT_X));
        }
        if (entity.is("IFCAXIS2PLACEMENT2D")) {
            Vector3 ref = direction(model, entity.refArg(1), Vector3.UNIT_X).withZ(0.0);
            return Frame.of(point(model, entity.refArg(0)), Vector3.UNIT_Z, ref);
        }
        throw new InvalidGeometryException("不支持的定位类型：" + entity.type());
    }

    // ---------------------------------------------------------------- representation

    private static StepModel.Entity chooseRepresentation(StepModel model, StepModel.Entity productShape) {
        List<Integer> representations = productShape.refListArg(2);
        if (representations.isEmpty()) {
            throw new InvalidGeometryException("没有形状表达");
        }
        for (int id : representations) {
            StepModel.Entity representation = require(model, id);
            if ("Body".equalsIgnoreCase(representation.stringArg(1))) {
                return representation;
            }
        }
        return require(model, representations.get(0));
    }

    private List<Vector3> representationPoints(StepModel model, StepModel.Entity representation, int depth) {
        List<Vector3> out = new ArrayList<>();
        for (int item : representation.refListArg(3)) {
            out.addAll(itemPoints(model, require(model, item), depth));
        }
        return out;
    }

    private List<Vector3> itemPoints(StepModel model, StepModel.Entity item, int depth) {
        if (depth > MAX_DEPTH) {
            throw new InvalidGeometryException("表达项嵌套过深或存在循环引用：#" + item.id());
        }
        switch (item.type()) {
            case "IFCEXTRUDEDAREASOLID":
                return extrusionPoints(model, item);
            case "IFCFACETEDBREP":
                return brepPoints(model, require(model, item.refArg(0)));
            case "IFCSWEPTDISKSOLID":
                return sweptDiskPoints(model, item);
            case "IFCBOOLEANRESULT":
            case "IFCBOOLEANCLIPPINGRESULT":
                return itemPoints(model, require(model, item.refArg(1)), depth + 1);
            case "IFCMAPPEDITEM":
                return mappedPoints(model, item, depth);
            default:
                throw new InvalidGeometryException("不支持的表达项：" + item.type());
        }
    }

    private List<Vector3> extrusionPoints(StepModel model, StepModel.Entity solid) {
        double depth = StepText.realOf(solid.arg(3));
        if (!Double.isFinite(depth)) {
            throw new InvalidGeometryException("拉伸深度无效：#" + solid.id());
        }
        Frame position = axisPlacement(model, solid.refArg(1));
        Vector3 offset = direction(model, solid.refArg(2), Vector3.UNIT_Z).normalized().times(depth);
        List<Vector3> out = new ArrayList<>();
        for (Vector3 p : profilePoints(model, require(model, solid.refArg(0)))) {
            out.add(position.apply(p));
            out.add(position.apply(p.plus(offset)));
        }
        return out;
    }

    private List<Vector3> profilePoints(StepModel model, StepModel.Entity profile) {
        switch (profile.type()) {
            case "IFCRECTANGLEPROFILEDEF": {
                Frame position = axisPlacement(model, profile.refArg(2));
                double hx = StepText.realOf(profile.arg(3)) / 2.0;
                double hy = StepText.realOf(profile.arg(4)) / 2.0;
                return List.of(position.apply(Vector3.of(-hx, -hy)), position.apply(Vector3.of(hx, -hy)),
                        position.apply(Vector3.of(hx, hy)), position.apply(Vector3.of(-hx, hy)));
            }
            case "IFCCIRCLEPROFILEDEF": {
                Frame position = axisPlacement(model, profile.refArg(2));
                double r = StepText.realOf(profile.arg(3));
                return List.of(position.apply(Vector3.of(-r, 0.0)), position.apply(Vector3.of(r, 0.0)),
                        position.apply(Vector3.of(0.0, -r)), position.apply(Vector3.of(0.0, r)));
            }
            case "IFCARBITRARYCLOSEDPROFILEDEF":
            case "IFCARBITRARYPROFILEDEFWITHVOIDS":
                return ring(polylinePoints(model, require(model, profile.refArg(2))));
            default:
                throw new InvalidGeometryException("不支持的轮廓类型：" + profile.type());
        }
    }

    private List<Vector3> brepPoints(StepModel model, StepModel.Entity shell) {
        Set<Integer> pointIds = new LinkedHashSet<>();
        for (int faceId : shell.refListArg(0)) {
            for (int boundId : require(model, faceId).refListArg(0)) {
                StepModel.Entity loop = require(model, require(model, boundId).refArg(0));
                if (!loop.is("IFCPOLYLOOP")) {
                    throw new InvalidGeometryException("不支持的面边界：" + loop.type());
                }
                pointIds.addAll(loop.refListArg(0));
            }
        }
        List<Vector3> out = new ArrayList<>(pointIds.size());
        for (int id : pointIds) {
            out.add(point(model, id));
        }
        return out;
    }

    private List<Vector3> sweptDiskPoints(StepModel model, StepModel.Entity solid) {
        double r = StepText.realOf(solid.arg(1));
        if (!Double.isFinite(r)) {
            throw new InvalidGeometryException("扫掠半径无效：#" + solid.id());
        }
        List<Vector3> out = new ArrayList<>();
        // 每个中心线顶点沿三个轴各外扩 ±r，均值不变，包围盒覆盖管体
        for (Vector3 p : polylinePoints(model, require(model, solid.refArg(0)))) {
            out.add(p.plus(Vector3.of(r, 0.0, 0.0)));
            out.add(p.plus(Vector3.of(-r, 0.0, 0.0)));
            out.add(p.plus(Vector3.of(0.0, r, 0.0)));
            out.add(p.plus(Vector3.of(0.0, -r, 0.0)));
            out.add(p.plus(Vector3.of(0.0, 0.0, r)));
            out.add(p.plus(Vector3.of(0.0, 0.0, -r)));
        }
        return out;
    }

    private List<Vector3> mappedPoints(StepModel model, StepModel.Entity mapped, int depth) {
        StepModel.Entity map = require(model, mapped.refArg(0));
        Frame origin = axisPlacement(model, map.refArg(0));
        Frame target = transformationOperator(model, mapped.refArg(1));
        Frame frame = target.compose(origin);
        List<Vector3> out = new ArrayList<>();
        for (Vector3 p : representationPoints(model, require(model, map.refArg(1)), depth + 1)) {
            out.add(frame.apply(p));
        }
        return out;
    }

    private Frame transformationOperator(StepModel model, int id) {
        if (id < 0) {
            return Frame.IDENTITY;
        }
        StepModel.Entity operator = require(model, id);
        // IfcCartesianTransformationOperator(Axis1, Axis2, LocalOrigin, Scale[, Axis3])
        Vector3 axis1 = direction(model, operator.refArg(0), Vector3.UNIT_X);
        Vector3 axis3 = direction(model, operator.refArg(4), Vector3.UNIT_Z);
        double scale = StepText.realOf(operator.arg(3));
        Frame frame = Frame.of(point(model, operator.refArg(2)), axis3, axis1);
        return Double.isFinite(scale) ? frame.scaled(scale) : frame;
    }

    private List<Vector3> polylinePoints(StepModel model, StepModel.Entity curve) {
        if (!curve.is("IFCPOLYLINE")) {
            throw new InvalidGeometryException("不支持的曲线类型：" + curve.type());
        }
        List<Vector3> out = new ArrayList<>();
        for (int id : curve.refListArg(0)) {
            out.add(point(model, id));
        }
        return out;
    }

    // 闭合折线的末点与首点重合，只保留一次
    private static List<Vector3> ring(List<Vector3> points) {
        if (points.size() > 1 && points.get(0).sameAs(points.get(points.size() - 1), 1e-9)) {
            return points.subList(0, points.size() - 1);
        }
        return points;
    }

    // ---------------------------------------------------------------- primitives

    private static Vector3 point(StepModel model, int id) {
        if (id < 0) {
            return Vector3.ZERO;
        }
        StepModel.Entity entity = require(model, id);
        if (!entity.is("IFCCARTESIANPOINT")) {
            throw new InvalidGeometryException("期望 IfcCartesianPoint：#" + id + " 是 " + entity.type());
        }
        return coordinates(entity, id);
    }

    private static Vector3 direction(StepModel model, int id, Vector3 fallback) {
        if (id < 0) {
            return fallback;
        }
        StepModel.Entity entity = require(model, id);
        if (!entity.is("IFCDIRECTION")) {
            throw new InvalidGeometryException("期望 IfcDirection：#" + id + " 是 " + entity.type());
        }
        Vector3 v = coordinates(entity, id);
        if (v.length() == 0.0) {
            throw new InvalidGeometryException("方向向量为零：#" + id);
        }
        return v;
    }

    private static Vector3 coordinates(StepModel.Entity entity, int id) {
        double[] c = StepText.realList(entity.arg(0));
        if (c.length < 2 || c.length > 3) {
            throw new InvalidGeometryException("坐标维数无效：#" + id);
        }
        Vector3 v = Vector3.of(c[0], c[1], c.length == 3 ? c[2] : 0.0);
        if (!v.isFinite()) {
            throw new InvalidGeometryException("坐标不是有限数值：#" + id);
        }
        return v;
    }

    private static StepModel.Entity require(StepModel model, int id) {
        return model.get(id).orElseThrow(() -> new InvalidGeometryException("引用的实体不存在：#" + id));
    }

    private static boolean isType(StepModel model, int id, String type) {
        return id >= 0 && model.get(id).map(e -> e.is(type)).orElse(false);
    }

    private static Vector3 mean(List<Vector3> points) {
        Vector3 sum = Vector3.ZERO;
        for (Vector3 p : points) {
            sum = sum.plus(p);
        }
        return sum.times(1.0 / points.size());
    }
}
