package org.example.gis2bim.conversion.style;

import org.example.gis2bim.conversion.attribute.AttributeValue;

import java.util.Map;

/**
 * 单个相等条件：字段存在且值按类型相等。
 */
public record StyleCondition(String field, AttributeValue expected) {

    public boolean matches(Map<String, AttributeValue> attributes) {
        AttributeValue actual = attributes.get(field);
        return actual != null && actual.sameValueAs(expected);
    }
}
