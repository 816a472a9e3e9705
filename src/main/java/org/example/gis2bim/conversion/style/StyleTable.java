package org.example.gis2bim.conversion.style;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 一次转换使用的样式表：按优先级升序排好的规则（同优先级保持声明顺序）加默认样式。
 * <p>
 * 构造后不可变，整个转换过程中共享。
 */
public final class StyleTable {

    private final List<StyleRule> rules;
    private final ResolvedStyle defaultStyle;

    public StyleTable(List<StyleRule> rules, ResolvedStyle defaultStyle) {
        if (defaultStyle == null) {
            throw new IllegalArgumentException("默认样式不能为空");
        }
        List<StyleRule> sorted = new ArrayList<>(rules);
        // List.sort 是稳定排序；再按声明位置兜底，防止调用方传入乱序列表
        sorted.sort(Comparator.comparingInt(StyleRule::priority).thenComparingInt(StyleRule::declarationIndex));
        this.rules = List.copyOf(sorted);
        this.defaultStyle = defaultStyle;
    }

    public static StyleTable empty(ResolvedStyle defaultStyle) {
        return new StyleTable(List.of(), defaultStyle);
    }

    /**
     * 按匹配顺序排列的规则。
     */
    public List<StyleRule> rules() {
        return rules;
    }

    public ResolvedStyle defaultStyle() {
        return defaultStyle;
    }

    public int size() {
        return rules.size();
    }
}
