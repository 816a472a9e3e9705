package org.example.gis2bim.conversion.transfer;

import org.example.gis2bim.conversion.attribute.AttributeValue;
import org.example.gis2bim.conversion.io.StepModel;
import org.example.gis2bim.conversion.io.StepText;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IFC 属性集的读取：对象 → 属性集的反向索引，以及单值属性的名义值解析。
 */
final class IfcPropertyValues {

    private static final Pattern TYPED_VALUE = Pattern.compile("(?s)^\\s*([A-Za-z0-9_]+)\\s*\\((.*)\\)\\s*$");
    private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");

    private final StepModel model;
    private final Map<Integer, List<Integer>> propertySetsByObject = new HashMap<>();

    IfcPropertyValues(StepModel model) {
        this.model = model;
        // IfcRelDefinesByProperties(GlobalId, OwnerHistory, Name, Description, RelatedObjects, RelatingPropertyDefinition)
        for (StepModel.Entity rel : model.ofType("IFCRELDEFINESBYPROPERTIES")) {
            int definition = rel.refArg(5);
            if (definition < 0) {
                continue;
            }
            for (int object : rel.refListArg(4)) {
                propertySetsByObject.computeIfAbsent(object, k -> new ArrayList<>()).add(definition);
            }
        }
    }

    /**
     * 对象关联的 IfcPropertySet（按关系出现顺序），不含数量集等其它定义。
     */
    List<StepModel.Entity> propertySetsOf(int objectId) {
        List<StepModel.Entity> out = new ArrayList<>();
        for (int id : propertySetsByObject.getOrDefault(objectId, List.of())) {
            model.get(id).filter(e -> e.is("IFCPROPERTYSET")).ifPresent(out::add);
        }
        return out;
    }

    /**
     * 对象全部单值属性：属性名 → 值；同名属性后出现的覆盖先出现的。
     */
    Map<String, AttributeValue> attributesOf(int objectId) {
        Map<String, AttributeValue> out = new LinkedHashMap<>();
        for (StepModel.Entity pset : propertySetsOf(objectId)) {
            for (int propertyId : pset.refListArg(4)) {
                model.get(propertyId)
                        .filter(p -> p.is("IFCPROPERTYSINGLEVALUE"))
                        .ifPresent(p -> putValue(out, p));
            }
        }
        return out;
    }

    static void putValue(Map<String, AttributeValue> out, StepModel.Entity property) {
        String name = property.stringArg(0);
        if (name == null) {
            return;
        }
        toAttributeValue(property.arg(2)).ifPresent(value -> out.put(name, value));
    }

    /**
     * 解析名义值，如 {@code IFCLABEL('A')}、{@code IFCINTEGER(12)}、{@code IFCREAL(2.5)}、{@code IFCBOOLEAN(.T.)}。
     * {@code $}、未知逻辑值 {@code .U.} 或无法识别的写法返回空。
     */
    static Optional<AttributeValue> toAttributeValue(String nominal) {
        if (nominal == null) {
            return Optional.empty();
        }
        Matcher m = TYPED_VALUE.matcher(nominal);
        if (!m.matches()) {
            return Optional.empty();
        }
        String inner = m.group(2).trim();
        if (inner.startsWith("'")) {
            String text = StepText.firstStringLiteral(inner);
            return text == null ? Optional.empty() : Optional.of(AttributeValue.text(text));
        }
        if (".T.".equalsIgnoreCase(inner)) {
            return Optional.of(AttributeValue.bool(true));
        }
        if (".F.".equalsIgnoreCase(inner)) {
            return Optional.of(AttributeValue.bool(false));
        }
        if (INTEGER.matcher(inner).matches()) {
            try {
                return Optional.of(AttributeValue.integer(Long.parseLong(inner)));
            } catch (NumberFormatException e) {
                // 超出 long 范围的整数按实数处理
                return Optional.of(AttributeValue.number(Double.parseDouble(inner)));
            }
        }
        double real = StepText.realOf(inner);
        return Double.isFinite(real) ? Optional.of(AttributeValue.number(real)) : Optional.empty();
    }
}
