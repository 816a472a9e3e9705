package org.example.gis2bim.conversion.attribute;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * JSON 标量与 {@link AttributeValue} 之间的转换（GeoJSON properties、样式条件共用）。
 */
public final class JsonAttributes {

    private JsonAttributes() {
    }

    /**
     * 字符串 / 数值 / 布尔转成对应的属性值；null、对象、数组返回空。
     */
    public static Optional<AttributeValue> fromScalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isTextual()) {
            return Optional.of(AttributeValue.text(node.textValue()));
        }
        if (node.isBoolean()) {
            return Optional.of(AttributeValue.bool(node.booleanValue()));
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return Optional.of(AttributeValue.integer(node.longValue()));
        }
        if (node.isNumber()) {
            return Optional.of(AttributeValue.number(node.doubleValue()));
        }
        return Optional.empty();
    }

    /**
     * 把 JSON 对象的标量成员按声明顺序转换为属性表；null 成员被丢弃，对象/数组成员转成其 JSON 文本。
     */
    public static Map<String, AttributeValue> fromObject(JsonNode object) {
        Map<String, AttributeValue> out = new LinkedHashMap<>();
        if (object == null || !object.isObject()) {
            return out;
        }
        var fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (value == null || value.isNull()) {
                continue;
            }
            Optional<AttributeValue> scalar = fromScalar(value);
            out.put(entry.getKey(), scalar.orElseGet(() -> AttributeValue.text(value.toString())));
        }
        return out;
    }
}
