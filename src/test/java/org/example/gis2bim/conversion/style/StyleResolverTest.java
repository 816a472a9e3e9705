package org.example.gis2bim.conversion.style;

import org.example.gis2bim.conversion.attribute.AttributeValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StyleResolverTest {

    private static final ResolvedStyle GREY = ResolvedStyle.defaultStyle(RgbColor.of(0.7, 0.7, 0.7), "Unclassified");

    private final StyleResolver resolver = new StyleResolver();

    @Test
    void resolve_firstMatchingRuleWins() {
        StyleRule wood = rule("wood", 0, 0, "Wood", condition("material", AttributeValue.text("wood")));
        StyleRule anyBuilding = rule("any-building", 0, 1, "Building", condition("kind", AttributeValue.text("building")));
        StyleTable table = new StyleTable(List.of(wood, anyBuilding), GREY);

        ResolvedStyle style = resolver.resolve(Map.of(
                "kind", AttributeValue.text("building"),
                "material", AttributeValue.text("wood")), table);

        assertThat(style.matchedRuleId()).isEqualTo("wood");
        assertThat(style.category()).isEqualTo("Wood");
        assertThat(style.isDefault()).isFalse();
    }

    @Test
    void resolve_lowerPriorityValueIsCheckedFirstRegardlessOfDeclarationOrder() {
        StyleRule late = rule("late", 10, 0, "Late");
        StyleRule early = rule("early", 1, 1, "Early");
        StyleTable table = new StyleTable(List.of(late, early), GREY);

        assertThat(table.rules()).extracting(StyleRule::id).containsExactly("early", "late");
        assertThat(resolver.resolve(Map.of(), table).matchedRuleId()).isEqualTo("early");
    }

    @Test
    void resolve_requiresAllConditions() {
        StyleRule rule = rule("both", 0, 0, "Both",
                condition("a", AttributeValue.integer(1)),
                condition("b", AttributeValue.bool(true)));
        StyleTable table = new StyleTable(List.of(rule), GREY);

        assertThat(resolver.resolve(Map.of("a", AttributeValue.integer(1)), table).isDefault()).isTrue();
        assertThat(resolver.resolve(Map.of(
                "a", AttributeValue.integer(1),
                "b", AttributeValue.bool(true)), table).matchedRuleId()).isEqualTo("both");
    }

    @Test
    void resolve_comparesNumbersByValueAndNeverAcrossTypes() {
        StyleRule six = rule("six", 0, 0, "Six", condition("floors", AttributeValue.integer(6)));
        StyleTable table = new StyleTable(List.of(six), GREY);

        assertThat(resolver.resolve(Map.of("floors", AttributeValue.number(6.0)), table).matchedRuleId()).isEqualTo("six");
        assertThat(resolver.resolve(Map.of("floors", AttributeValue.text("6")), table).isDefault()).isTrue();
    }

    @Test
    void resolve_textComparisonIsCaseSensitive() {
        StyleRule rule = rule("wood", 0, 0, "Wood", condition("material", AttributeValue.text("wood")));
        StyleTable table = new StyleTable(List.of(rule), GREY);

        assertThat(resolver.resolve(Map.of("material", AttributeValue.text("Wood")), table)).isEqualTo(GREY);
    }

    @Test
    void resolve_missingFieldDoesNotMatchAndNullAttributesUseDefault() {
        StyleRule rule = rule("wood", 0, 0, "Wood", condition("material", AttributeValue.text("wood")));
        StyleTable table = new StyleTable(List.of(rule), GREY);

        assertThat(resolver.resolve(Map.of("other", AttributeValue.text("wood")), table)).isEqualTo(GREY);
        assertThat(resolver.resolve(null, table)).isEqualTo(GREY);
    }

    @Test
    void resolve_ruleWithoutConditionsMatchesEverything() {
        StyleTable table = new StyleTable(List.of(rule("all", 0, 0, "All")), GREY);

        assertThat(resolver.resolve(Map.of(), table).matchedRuleId()).isEqualTo("all");
    }

    @Test
    void resolve_emptyTableAlwaysReturnsDefault() {
        ResolvedStyle style = resolver.resolve(Map.of("x", AttributeValue.integer(1)), StyleTable.empty(GREY));

        assertThat(style.matchedRuleId()).isEqualTo(ResolvedStyle.DEFAULT_RULE_ID);
        assertThat(style.isDefault()).isTrue();
    }

    private static StyleRule rule(String id, int priority, int index, String category, StyleCondition... conditions) {
        return new StyleRule(id, List.of(conditions), RgbColor.of(1, 0, 0), category, priority, index);
    }

    private static StyleCondition condition(String field, AttributeValue expected) {
        return new StyleCondition(field, expected);
    }
}
