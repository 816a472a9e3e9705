package org.example.gis2bim.conversion.style;

import org.example.gis2bim.conversion.attribute.AttributeValue;

import java.util.Map;

/**
 * 按样式表为要素属性挑选样式：第一条所有条件都满足的规则胜出，都不满足时用默认样式。
 * <p>
 * 全函数、确定性：同样的属性与样式表永远得到同样结果，且结果不为 null。
 */
public class StyleResolver {

    public ResolvedStyle resolve(Map<String, AttributeValue> attributes, StyleTable styleTable) {
        Map<String, AttributeValue> safe = (attributes == null) ? Map.of() : attributes;
        for (StyleRule rule : styleTable.rules()) {
            if (rule.matches(safe)) {
                return rule.toResolvedStyle();
            }
        }
        return styleTable.defaultStyle();
    }
}
