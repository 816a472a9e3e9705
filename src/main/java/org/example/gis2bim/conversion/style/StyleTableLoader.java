package org.example.gis2bim.conversion.style;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.gis2bim.conversion.attribute.AttributeValue;
import org.example.gis2bim.conversion.attribute.JsonAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 从 JSON 加载样式表。
 * <p>
 * 支持两种顶层结构：
 * <pre>
 * { "default": { "color": "#B3B3B3", "category": "Unclassified" },
 *   "rules": [ { "id": "...", "priority": 10, "category": "...",
 *                "conditions": [ { "field": "...", "value": 111 } ], "color": [0.6, 0.37, 0.14] } ] }
 * </pre>
 * 或直接是规则数组。任何格式问题都抛 {@link InvalidStyleRuleException}，不做部分加载。
 */
public class StyleTableLoader {

    private static final Logger log = LoggerFactory.getLogger(StyleTableLoader.class);

    private final ObjectMapper objectMapper;

    public StyleTableLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public StyleTable load(Path file, ResolvedStyle fallbackDefault) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new InvalidStyleRuleException("读取样式文件失败：" + file + "（" + e.getMessage() + "）", e);
        }
        StyleTable table = parse(json, fallbackDefault);
        log.info("样式表已加载：file={}, rules={}, defaultCategory={}", file, table.size(), table.defaultStyle().category());
        return table;
    }

    public StyleTable parse(String json, ResolvedStyle fallbackDefault) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidStyleRuleException("样式表不是合法的 JSON：" + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new InvalidStyleRuleException("样式表为空");
        }

        ResolvedStyle defaultStyle = fallbackDefault;
        JsonNode rulesNode;
        if (root.isArray()) {
            rulesNode = root;
        } else if (root.isObject()) {
            JsonNode defaultNode = root.get("default");
            if (defaultNode != null && !defaultNode.isNull()) {
                defaultStyle = parseDefault(defaultNode, fallbackDefault);
            }
            rulesNode = root.get("rules");
            if (rulesNode == null || rulesNode.isNull()) {
                rulesNode = objectMapper.createArrayNode();
            }
            if (!rulesNode.isArray()) {
                throw new InvalidStyleRuleException("样式表格式错误：rules 必须是数组");
            }
        } else {
            throw new InvalidStyleRuleException("样式表格式错误：顶层必须是对象或数组");
        }

        List<StyleRule> rules = new ArrayList<>(rulesNode.size());
        Set<String> ids = new HashSet<>();
        int index = 0;
        for (JsonNode ruleNode : rulesNode) {
            StyleRule rule = parseRule(ruleNode, index);
            if (!ids.add(rule.id())) {
                throw new InvalidStyleRuleException("样式规则 id 重复：" + rule.id());
            }
            rules.add(rule);
            index++;
        }
        return new StyleTable(rules, defaultStyle);
    }

    private static ResolvedStyle parseDefault(JsonNode node, ResolvedStyle fallback) {
        if (!node.isObject()) {
            throw new InvalidStyleRuleException("样式表格式错误：default 必须是对象");
        }
        RgbColor color = node.hasNonNull("color") ? parseColor(node.get("color"), "default") : fallback.color();
        String category = node.hasNonNull("category") ? requiredText(node, "category", "default") : fallback.category();
        return ResolvedStyle.defaultStyle(color, category);
    }

    private static StyleRule parseRule(JsonNode node, int index) {
        String where = "rules[" + index + "]";
        if (node == null || !node.isObject()) {
            throw new InvalidStyleRuleException("样式规则格式错误：" + where + " 必须是对象");
        }
        String id = node.hasNonNull("id") ? requiredText(node, "id", where) : "rule-" + (index + 1);
        if (ResolvedStyle.DEFAULT_RULE_ID.equals(id)) {
            throw new InvalidStyleRuleException("样式规则 id 不能使用保留值 default：" + where);
        }
        where = where + "(" + id + ")";

        int priority = 0;
        JsonNode priorityNode = node.get("priority");
        if (priorityNode != null && !priorityNode.isNull()) {
            if (!priorityNode.isIntegralNumber() || !priorityNode.canConvertToInt()) {
                throw new InvalidStyleRuleException("样式规则 " + where + " 的 priority 必须是整数：" + priorityNode);
            }
            priority = priorityNode.intValue();
        }

        String category = requiredText(node, "category", where);
        JsonNode colorNode = node.get("color");
        if (colorNode == null || colorNode.isNull()) {
            throw new InvalidStyleRuleException("样式规则 " + where + " 缺少 color");
        }
        RgbColor color = parseColor(colorNode, where);

        List<StyleCondition> conditions = new ArrayList<>();
        JsonNode conditionsNode = node.get("conditions");
        if (conditionsNode != null && !conditionsNode.isNull()) {
            if (!conditionsNode.isArray()) {
                throw new InvalidStyleRuleException("样式规则 " + where + " 的 conditions 必须是数组");
            }
            for (JsonNode conditionNode : conditionsNode) {
                conditions.add(parseCondition(conditionNode, where));
            }
        }
        return new StyleRule(id, conditions, color, category, priority, index);
    }

    private static StyleCondition parseCondition(JsonNode node, String where) {
        if (node == null || !node.isObject()) {
            throw new InvalidStyleRuleException("样式规则 " + where + " 的条件必须是对象");
        }
        String field = requiredText(node, "field", where);
        AttributeValue expected = JsonAttributes.fromScalar(node.get("value"))
                .orElseThrow(() -> new InvalidStyleRuleException(
                        "样式规则 " + where + " 的条件 " + field + " 的 value 必须是字符串、数值或布尔：" + node.get("value")));
        return new StyleCondition(field, expected);
    }

    static RgbColor parseColor(JsonNode node, String where) {
        try {
            if (node.isTextual()) {
                return RgbColor.parseHex(node.textValue());
            }
            if (node.isArray() && (node.size() == 3 || node.size() == 4)) {
                double[] c = new double[4];
                c[3] = 1.0;
                for (int i = 0; i < node.size(); i++) {
                    JsonNode component = node.get(i);
                    if (!component.isNumber()) {
                        throw new IllegalArgumentException("颜色分量必须是数值：" + component);
                    }
                    c[i] = component.doubleValue();
                }
                return new RgbColor(c[0], c[1], c[2], c[3]);
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidStyleRuleException("样式 " + where + " 的颜色不合法：" + e.getMessage(), e);
        }
        throw new InvalidStyleRuleException("样式 " + where + " 的颜色格式不合法（应为 \"#RRGGBB\" 或 3~4 个 [0,1] 数值）：" + node);
    }

    private static String requiredText(JsonNode node, String field, String where) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            throw new InvalidStyleRuleException("样式 " + where + " 缺少字段 " + field);
        }
        if (!v.isTextual() || v.textValue().isBlank()) {
            throw new InvalidStyleRuleException("样式 " + where + " 的字段 " + field + " 必须是非空字符串");
        }
        return v.textValue();
    }
}
