package org.example.gis2bim.conversion.attribute;

import java.util.List;
import java.util.Optional;

/**
 * 挂在模型元素上的属性集：有序的“属性名 → 类型化值”。
 *
 * @param name       属性集名称（写出为 IfcPropertySet.Name）
 * @param properties 属性列表，顺序与源属性表一致
 */
public record PropertySet(String name, List<Property> properties) {

    public PropertySet {
        properties = List.copyOf(properties);
    }

    public static PropertySet empty(String name) {
        return new PropertySet(name, List.of());
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }

    public int size() {
        return properties.size();
    }

    public Optional<Property> find(String propertyName) {
        return properties.stream().filter(p -> p.name().equals(propertyName)).findFirst();
    }

    /**
     * @param name       规范化后的属性名（合法标识符，集合内唯一）
     * @param sourceName 源字段名
     * @param value      原始值
     */
    public record Property(String name, String sourceName, AttributeValue value) {
    }
}
