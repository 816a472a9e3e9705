package org.example.gis2bim.conversion.attribute;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把要素的原始属性表转换成属性集。
 * <p>
 * 规则：
 * <ul>
 *   <li>字段名中非字母/数字/下划线的字符替换为 {@code _}；以数字开头时加 {@code _} 前缀；空名变为 {@code _}。</li>
 *   <li>规范化结果已经合法时再次规范化不变（幂等）。</li>
 *   <li>规范化后重名的字段追加 {@code _2}、{@code _3}… 区分，绝不覆盖。</li>
 *   <li>值与类型原样保留；空属性表得到空属性集。</li>
 * </ul>
 * 无状态，可并发使用。
 */
public class AttributeMapper {

    public static final String DEFAULT_PROPERTY_SET_NAME = "GIS_Attributes";

    private final String propertySetName;

    public AttributeMapper() {
        this(DEFAULT_PROPERTY_SET_NAME);
    }

    public AttributeMapper(String propertySetName) {
        this.propertySetName = propertySetName;
    }

    public PropertySet toPropertySet(Map<String, AttributeValue> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return PropertySet.empty(propertySetName);
        }
        Set<String> used = new HashSet<>();
        List<PropertySet.Property> properties = new ArrayList<>(attributes.size());
        for (Map.Entry<String, AttributeValue> entry : attributes.entrySet()) {
            String base = sanitizeName(entry.getKey());
            String name = base;
            int counter = 2;
            while (!used.add(name)) {
                name = base + "_" + counter++;
            }
            properties.add(new PropertySet.Property(name, entry.getKey(), entry.getValue()));
        }
        return new PropertySet(propertySetName, properties);
    }

    public static String sanitizeName(String name) {
        if (name == null || name.isEmpty()) {
            return "_";
        }
        StringBuilder out = new StringBuilder(name.length() + 1);
        int i = 0;
        while (i < name.length()) {
            int cp = name.codePointAt(i);
            if (Character.isLetterOrDigit(cp) || cp == '_') {
                out.appendCodePoint(cp);
            } else {
                out.append('_');
            }
            i += Character.charCount(cp);
        }
        if (Character.isDigit(out.codePointAt(0))) {
            out.insert(0, '_');
        }
        return out.toString();
    }
}
