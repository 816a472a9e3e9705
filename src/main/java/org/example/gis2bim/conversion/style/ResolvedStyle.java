package org.example.gis2bim.conversion.style;

/**
 * 一个要素最终使用的样式。
 *
 * @param matchedRuleId 命中的规则 id；未命中任何规则时为 {@link #DEFAULT_RULE_ID}
 */
public record ResolvedStyle(RgbColor color, String category, String matchedRuleId) {

    public static final String DEFAULT_RULE_ID = "default";

    public static ResolvedStyle defaultStyle(RgbColor color, String category) {
        return new ResolvedStyle(color, category, DEFAULT_RULE_ID);
    }

    public boolean isDefault() {
        return DEFAULT_RULE_ID.equals(matchedRuleId);
    }
}
