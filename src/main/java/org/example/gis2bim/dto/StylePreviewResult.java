package org.example.gis2bim.dto;

import java.util.List;

/**
 * {@code gis_preview_style} 的返回结果：某组属性会命中哪条样式规则，以及写出时的属性名。
 *
 * @param matchedRuleId 命中的规则 id（未命中时为 {@code default}）
 * @param category      分类
 * @param color         颜色（{@code #RRGGBB} 或 {@code #RRGGBBAA}）
 * @param styleRules    样式表规则数
 * @param propertyNames 规范化后的属性名
 */
public record StylePreviewResult(
        String matchedRuleId,
        String category,
        String color,
        int styleRules,
        List<String> propertyNames
) {
}
