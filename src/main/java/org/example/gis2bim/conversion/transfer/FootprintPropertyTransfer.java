package org.example.gis2bim.conversion.transfer;

import org.example.gis2bim.conversion.attribute.AttributeValue;
import org.example.gis2bim.conversion.io.StepModel;
import org.example.gis2bim.conversion.io.StepText;
import org.example.gis2bim.conversion.model.IfcGuid;
import org.example.gis2bim.conversion.style.ResolvedStyle;
import org.example.gis2bim.conversion.style.RgbColor;
import org.example.gis2bim.conversion.style.StyleResolver;
import org.example.gis2bim.conversion.style.StyleTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.example.gis2bim.conversion.io.StepText.NULL;
import static org.example.gis2bim.conversion.io.StepText.real;
import static org.example.gis2bim.conversion.io.StepText.ref;
import static org.example.gis2bim.conversion.io.StepText.refs;
import static org.example.gis2bim.conversion.io.StepText.string;

/**
 * 把 2D 足迹 IFC 中构件的属性集迁移到 3D 模型 IFC 中位置重合的构件上，并按迁移后的属性重新着色。
 * <p>
 * 流程：
 * <ol>
 *   <li>计算两边构件的世界坐标质心与包围盒（{@link ProductShapeReader}）。</li>
 *   <li>目标质心落在足迹包围盒内即配对（{@link FootprintMatcher}）。</li>
 *   <li>复制足迹的 IfcPropertySet 中的单值属性到目标；名称以 {@link #IGNORED_PROPERTY_SET_PREFIXES} 开头的属性集不复制。</li>
 *   <li>用目标的全部属性解析样式，命中规则（非默认样式）时给目标第一个形状表达的各表达项设置表面样式。</li>
 * </ol>
 * 目标文件的原有实体不删除；已有样式的表达项改写其 IfcStyledItem，其余追加新实体。
 */
public class FootprintPropertyTransfer {

    private static final Logger log = LoggerFactory.getLogger(FootprintPropertyTransfer.class);

    /**
     * 不迁移的属性集名称前缀：基础数量、数量集、GSA 与标准属性集。
     */
    public static final List<String> IGNORED_PROPERTY_SET_PREFIXES = List.of("BaseQuantities", "Qto_", "GSA_", "Pset_", "Common");

    private final ProductShapeReader shapeReader = new ProductShapeReader();
    private final StyleResolver styleResolver;

    public FootprintPropertyTransfer(StyleResolver styleResolver) {
        this.styleResolver = styleResolver;
    }

    /**
     * 读取两个文件，迁移后把修改过的目标模型写到 output（可以与 targetFile 相同）。
     */
    public TransferReport transfer(Path footprintFile, Path targetFile, Path output, StyleTable styleTable) {
        StepModel footprint = StepModel.read(footprintFile);
        StepModel target = StepModel.read(targetFile);
        TransferReport report = transfer(footprint, target, styleTable);
        target.write(output);
        return report;
    }

    /**
     * 在内存中修改 target。
     */
    public TransferReport transfer(StepModel footprint, StepModel target, StyleTable styleTable) {
        List<String> warnings = new ArrayList<>();
        List<ProductShape> footprints = shapeReader.read(footprint, warnings);
        List<ProductShape> targets = shapeReader.read(target, warnings);
        log.info("构件几何：footprints={}, targets={}", footprints.size(), targets.size());

        List<FootprintMatcher.FootprintMatch> matches = FootprintMatcher.match(footprints, targets);
        Session session = new Session(footprint, target, styleTable, warnings);
        int matched = 0;
        int matchCount = 0;
        List<String> unmatched = new ArrayList<>();
        for (FootprintMatcher.FootprintMatch match : matches) {
            if (match.candidates().isEmpty()) {
                log.debug("足迹没有命中目标：{}", match.footprint().globalId());
                unmatched.add(match.footprint().globalId());
                continue;
            }
            matched++;
            for (FootprintMatcher.Candidate candidate : match.candidates()) {
                matchCount++;
                session.copyPropertySets(match.footprint(), candidate.target());
                session.applyStyle(candidate.target());
            }
        }
        log.info("属性迁移完成：matchedFootprints={}, matches={}, propertySets={}, styled={}, warnings={}",
                matched, matchCount, session.copiedPropertySets, session.styledElements, warnings.size());
        return new TransferReport(footprints.size(), targets.size(), matched, matchCount,
                session.copiedPropertySets, session.styledElements, unmatched, warnings);
    }

    static boolean isIgnoredPropertySet(String name) {
        if (name == null) {
            return false;
        }
        for (String prefix : IGNORED_PROPERTY_SET_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 一次迁移的可变状态：目标文件的索引、样式缓存与计数。
     */
    private final class Session {

        private final StepModel footprint;
        private final StepModel target;
        private final StyleTable styleTable;
        private final List<String> warnings;
        private final IfcPropertyValues footprintValues;
        private final IfcPropertyValues targetValues;
        private final String ownerHistory;
        private final Map<Integer, Map<String, AttributeValue>> targetAttributes = new HashMap<>();
        private final Map<Integer, Integer> styledItemByItem = new HashMap<>();
        private final Map<String, Integer> styleAssignments = new HashMap<>();
        private int copiedPropertySets;
        private int styledElements;

        Session(StepModel footprint, StepModel target, StyleTable styleTable, List<String> warnings) {
            this.footprint = footprint;
            this.target = target;
            this.styleTable = styleTable;
            this.warnings = warnings;
            this.footprintValues = new IfcPropertyValues(footprint);
            this.targetValues = new IfcPropertyValues(target);
            List<StepModel.Entity> histories = target.ofType("IFCOWNERHISTORY");
            if (histories.isEmpty()) {
                warnings.add("目标文件没有 IfcOwnerHistory，新建的属性集不带 OwnerHistory。");
                this.ownerHistory = NULL;
            } else {
                this.ownerHistory = ref(histories.get(0).id());
            }
            for (StepModel.Entity styled : target.ofType("IFCSTYLEDITEM")) {
                int item = styled.refArg(0);
                if (item >= 0) {
                    styledItemByItem.putIfAbsent(item, styled.id());
                }
            }
        }

        void copyPropertySets(ProductShape source, ProductShape destination) {
            Map<String, AttributeValue> attributes = attributesOf(destination);
            for (StepModel.Entity pset : footprintValues.propertySetsOf(source.entityId())) {
                String name = pset.stringArg(2);
                if (isIgnoredPropertySet(name)) {
                    log.debug("跳过属性集：{}", name);
                    continue;
                }
                List<Integer> properties = new ArrayList<>();
                for (int propertyId : pset.refListArg(4)) {
                    StepModel.Entity property = footprint.get(propertyId).orElse(null);
                    if (property == null || !property.is("IFCPROPERTYSINGLEVALUE")) {
                        continue;
                    }
                    // 单位引用指向足迹文件中的实体，不能带过来
                    String unit = StepText.refOf(property.arg(3)) >= 0 ? NULL : property.arg(3);
                    properties.add(target.append("IFCPROPERTYSINGLEVALUE", property.arg(0), property.arg(1), property.arg(2), unit));
                    IfcPropertyValues.putValue(attributes, property);
                }
                if (properties.isEmpty()) {
                    continue;
                }
                String seed = destination.globalId() + "/" + source.globalId() + "/" + pset.id();
                int newSet = target.append("IFCPROPERTYSET", string(IfcGuid.fromName(seed + "/pset")), ownerHistory,
                        pset.arg(2), pset.arg(3), refs(properties));
                target.append("IFCRELDEFINESBYPROPERTIES", string(IfcGuid.fromName(seed + "/defines")), ownerHistory,
                        NULL, NULL, refs(List.of(destination.entityId())), ref(newSet));
                copiedPropertySets++;
            }
        }

        void applyStyle(ProductShape destination) {
            ResolvedStyle style = styleResolver.resolve(attributesOf(destination), styleTable);
            if (style.isDefault()) {
                return;
            }
            StepModel.Entity product = target.get(destination.entityId()).orElseThrow();
            List<Integer> representations = target.get(product.refArg(6))
                    .map(shape -> shape.refListArg(2))
                    .orElse(List.of());
            if (representations.isEmpty()) {
                return;
            }
            StepModel.Entity representation = target.get(representations.get(0)).orElse(null);
            if (representation == null) {
                warnings.add(destination.type() + " #" + destination.entityId() + " 的形状表达不存在，未着色");
                return;
            }
            int assignment = styleAssignment(style);
            for (int item : representation.refListArg(3)) {
                Integer styled = styledItemByItem.get(item);
                if (styled != null) {
                    String name = target.get(styled).map(e -> e.arg(2)).orElse(NULL);
                    target.replace(styled, ref(item), refs(List.of(assignment)), name);
                } else {
                    styledItemByItem.put(item, target.append("IFCSTYLEDITEM", ref(item), refs(List.of(assignment)), NULL));
                }
            }
            styledElements++;
            log.debug("构件已着色：{} rule={}", destination.globalId(), style.matchedRuleId());
        }

        private Map<String, AttributeValue> attributesOf(ProductShape destination) {
            return targetAttributes.computeIfAbsent(destination.entityId(), targetValues::attributesOf);
        }

        private int styleAssignment(ResolvedStyle style) {
            RgbColor color = style.color();
            String key = style.category() + "|" + color.toHex();
            Integer assignment = styleAssignments.get(key);
            if (assignment == null) {
                int colour = target.append("IFCCOLOURRGB", string(style.category()),
                        real(color.red()), real(color.green()), real(color.blue()));
                int rendering = target.append("IFCSURFACESTYLERENDERING", ref(colour), real(color.transparency()),
                        NULL, NULL, NULL, NULL, NULL, NULL, ".NOTDEFINED.");
                int surfaceStyle = target.append("IFCSURFACESTYLE", string(style.category()), ".BOTH.", refs(List.of(rendering)));
                assignment = target.append("IFCPRESENTATIONSTYLEASSIGNMENT", refs(List.of(surfaceStyle)));
                styleAssignments.put(key, assignment);
            }
            return assignment;
        }
    }
}
