package org.example.gis2bim.conversion.feature;

import org.example.gis2bim.conversion.attribute.AttributeMapper;
import org.example.gis2bim.conversion.attribute.AttributeValue;
import org.example.gis2bim.conversion.attribute.PropertySet;
import org.example.gis2bim.conversion.geometry.GeometryPrimitives;
import org.example.gis2bim.conversion.geometry.InvalidGeometryException;
import org.example.gis2bim.conversion.geometry.MeshMetrics;
import org.example.gis2bim.conversion.geometry.SolidGeometry;
import org.example.gis2bim.conversion.geometry.Vector3;
import org.example.gis2bim.conversion.model.HierarchyNode;
import org.example.gis2bim.conversion.model.ModelAssembler;
import org.example.gis2bim.conversion.model.ModelElement;
import org.example.gis2bim.conversion.style.ResolvedStyle;
import org.example.gis2bim.conversion.style.StyleResolver;
import org.example.gis2bim.conversion.style.StyleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 按几何类别把要素转换为模型构件，并登记到装配器中对应的图层分组下。
 * <ul>
 *   <li>点 → 长方体（边长 pointSize，高度取覆盖字段或 pointSize）</li>
 *   <li>线 → 扫掠管（半径取覆盖字段或 pipeRadius）</li>
 *   <li>面 → 拉伸体（高度取覆盖字段或 extrusionHeight）</li>
 * </ul>
 * 覆盖字段只认数值属性；存在时总是优先于默认值。
 * <p>
 * 与一个 {@link ModelAssembler} 绑定，随一次转换创建、随转换结束丢弃。
 */
public class FeatureConverter {

    private static final Logger log = LoggerFactory.getLogger(FeatureConverter.class);

    private final ModelAssembler assembler;
    private final GeometryPrimitives primitives;
    private final StyleResolver styleResolver;
    private final AttributeMapper attributeMapper;

    public FeatureConverter(ModelAssembler assembler, GeometryPrimitives primitives,
                            StyleResolver styleResolver, AttributeMapper attributeMapper) {
        this.assembler = assembler;
        this.primitives = primitives;
        this.styleResolver = styleResolver;
        this.attributeMapper = attributeMapper;
    }

    /**
     * 转换单个要素并登记。
     *
     * 几何质量告警（自相交、退化内环等）记 WARN 日志。
     *
     * @return 主构件（开启质心标记时，标记构件另行登记，不在返回值中）
     * @throws InvalidGeometryException        几何无法构造
     * @throws UnsupportedRecordKindException 几何类别不支持
     */
    public ModelElement dispatch(FeatureRecord record, StyleTable styleTable, ConversionParameters parameters) {
        List<String> quality = new ArrayList<>();
        ModelElement element = convert(record, styleTable, parameters, quality);
        for (String note : quality) {
            warn(record, ConversionWarning.Kind.GEOMETRY_QUALITY, note);
        }
        return element;
    }

    /**
     * 按输入顺序逐个转换；单个要素失败只记告警并跳过，整批总会继续。结束时完成装配。
     */
    public ConversionReport convertAll(Iterable<FeatureRecord> records, StyleTable styleTable, ConversionParameters parameters) {
        int converted = 0;
        int skipped = 0;
        List<ConversionWarning> warnings = new ArrayList<>();
        for (FeatureRecord record : records) {
            List<String> quality = new ArrayList<>();
            try {
                convert(record, styleTable, parameters, quality);
                converted++;
            } catch (InvalidGeometryException e) {
                skipped++;
                warnings.add(warn(record, ConversionWarning.Kind.INVALID_GEOMETRY, e.getMessage()));
                continue;
            } catch (UnsupportedRecordKindException e) {
                skipped++;
                warnings.add(warn(record, ConversionWarning.Kind.UNSUPPORTED_RECORD_KIND, e.getMessage()));
                continue;
            }
            for (String note : quality) {
                warnings.add(warn(record, ConversionWarning.Kind.GEOMETRY_QUALITY, note));
            }
        }
        return new ConversionReport(assembler.finish(), converted, skipped, warnings);
    }

    ModelElement convert(FeatureRecord record, StyleTable styleTable, ConversionParameters parameters, List<String> quality) {
        Map<String, AttributeValue> attributes = record.attributes();
        FeatureGeometry geometry = record.geometry();
        SolidGeometry solid;
        if (geometry instanceof FeatureGeometry.PointGeometry point) {
            double height = numericOverride(attributes, parameters.pointHeightFields()).orElse(parameters.pointSize());
            solid = primitives.makeBox(flatten(point.position(), parameters), parameters.pointSize(), parameters.pointSize(), height);
        } else if (geometry instanceof FeatureGeometry.LineGeometry line) {
            double radius = numericOverride(attributes, parameters.pipeRadiusFields()).orElse(parameters.pipeRadius());
            solid = primitives.makeSweptPipe(flatten(line.vertices(), parameters), radius);
        } else if (geometry instanceof FeatureGeometry.PolygonGeometry polygon) {
            double height = numericOverride(attributes, parameters.extrusionHeightFields()).orElse(parameters.extrusionHeight());
            solid = primitives.makeExtrudedSolid(
                    flatten(polygon.outerRing(), parameters),
                    polygon.innerRings().stream().map(ring -> flatten(ring, parameters)).toList(),
                    height,
                    quality);
        } else {
            FeatureGeometry.UnsupportedGeometry unsupported = (FeatureGeometry.UnsupportedGeometry) geometry;
            String type = unsupported.typeName() == null ? "（无几何）" : unsupported.typeName();
            throw new UnsupportedRecordKindException("不支持的几何类型：" + type);
        }

        // 质心标记的几何先于任何登记构造，构造失败时不会留下半个要素
        SolidGeometry marker = null;
        if (parameters.centroidMarkers() && geometry instanceof FeatureGeometry.PolygonGeometry polygon) {
            marker = centroidMarker(record, polygon, parameters);
        }

        ResolvedStyle style = styleResolver.resolve(attributes, styleTable);
        PropertySet properties = attributeMapper.toPropertySet(attributes);
        HierarchyNode group = assembler.getOrCreateGroup(record.layer());
        ModelElement element = new ModelElement(assembler.nextGlobalId(), record.label(), solid, style, properties,
                group, record.layer(), record.index());
        assembler.addElement(record.layer(), element);
        if (log.isDebugEnabled()) {
            log.debug("要素已转换：{} kind={} rule={} id={} volume={}", record.label(), record.recordKind(),
                    style.matchedRuleId(), element.globalId(), MeshMetrics.volume(solid.toBoundaryMesh()));
        }

        if (marker != null) {
            ModelElement markerElement = new ModelElement(assembler.nextGlobalId(), record.label() + "-centroid", marker, style,
                    properties, group, record.layer(), record.index());
            assembler.addElement(record.layer(), markerElement);
        }
        return element;
    }

    private SolidGeometry centroidMarker(FeatureRecord record, FeatureGeometry.PolygonGeometry polygon, ConversionParameters parameters) {
        List<Vector3> outer = flatten(polygon.outerRing(), parameters);
        List<List<Vector3>> inners = polygon.innerRings().stream().map(ring -> flatten(ring, parameters)).toList();
        Optional<Vector3> centroid = primitives.footprintCentroid(outer, inners);
        if (centroid.isEmpty()) {
            log.warn("无法计算质心，跳过质心标记：{}", record.label());
            return null;
        }
        double size = parameters.centroidMarkerSize();
        return primitives.makeBox(centroid.get(), size, size, size);
    }

    static Optional<Double> numericOverride(Map<String, AttributeValue> attributes, List<String> fields) {
        for (String field : fields) {
            Optional<Double> value = AttributeValue.numericValue(attributes.get(field));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static Vector3 flatten(Vector3 p, ConversionParameters parameters) {
        if (p == null || parameters.useZ()) {
            return p;
        }
        return p.withZ(parameters.baseElevation());
    }

    private static List<Vector3> flatten(List<Vector3> points, ConversionParameters parameters) {
        List<Vector3> out = new ArrayList<>(points.size());
        for (Vector3 p : points) {
            out.add(flatten(p, parameters));
        }
        return out;
    }

    private static ConversionWarning warn(FeatureRecord record, ConversionWarning.Kind kind, String message) {
        log.warn("{} [{}] {}", record.label(), kind, message);
        return new ConversionWarning(record.layer(), record.index(), kind, message);
    }
}
