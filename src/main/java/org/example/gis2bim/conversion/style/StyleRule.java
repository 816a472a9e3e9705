package org.example.gis2bim.conversion.style;

import org.example.gis2bim.conversion.attribute.AttributeValue;

import java.util.List;
import java.util.Map;

/**
 * 样式规则：所有条件同时满足（AND）时生效。没有条件的规则匹配所有要素。
 *
 * @param id               规则标识（表内唯一）
 * @param conditions       条件列表
 * @param color            颜色
 * @param category         分类
 * @param priority         优先级，越小越先匹配
 * @param declarationIndex 在样式表中的声明位置，同优先级时先声明者胜
 */
public record StyleRule(String id, List<StyleCondition> conditions, RgbColor color, String category,
                        int priority, int declarationIndex) {

    public StyleRule {
        conditions = List.copyOf(conditions);
    }

    public boolean matches(Map<String, AttributeValue> attributes) {
        for (StyleCondition condition : conditions) {
            if (!condition.matches(attributes)) {
                return false;
            }
        }
        return true;
    }

    public ResolvedStyle toResolvedStyle() {
        return new ResolvedStyle(color, category, id);
    }
}
