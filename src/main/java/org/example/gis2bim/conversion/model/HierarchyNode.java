package org.example.gis2bim.conversion.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 空间层级节点：项目 → 场地 → 建筑 → 图层分组。
 * <p>
 * 只有 {@link ModelAssembler} 能追加子节点和元素；对外暴露的列表都是只读视图。
 * 按引用比较相等（同一个装配器里 key 可能在不同层级重复）。
 */
public final class HierarchyNode {

    public enum Kind {
        PROJECT,
        SITE,
        BUILDING,
        LAYER
    }

    private final Kind kind;
    private final String key;
    private final String name;
    private final String globalId;
    private final HierarchyNode parent;
    private final List<HierarchyNode> children = new ArrayList<>();
    private final List<ModelElement> elements = new ArrayList<>();

    HierarchyNode(Kind kind, String key, String name, String globalId, HierarchyNode parent) {
        this.kind = kind;
        this.key = key;
        this.name = name;
        this.globalId = globalId;
        this.parent = parent;
    }

    public Kind kind() {
        return kind;
    }

    public String key() {
        return key;
    }

    public String name() {
        return name;
    }

    public String globalId() {
        return globalId;
    }

    /**
     * 父节点；项目节点为 null。
     */
    public HierarchyNode parent() {
        return parent;
    }

    public List<HierarchyNode> children() {
        return Collections.unmodifiableList(children);
    }

    public List<ModelElement> elements() {
        return Collections.unmodifiableList(elements);
    }

    void addChild(HierarchyNode child) {
        children.add(child);
    }

    void addElement(ModelElement element) {
        elements.add(element);
    }

    @Override
    public String toString() {
        return kind + "(" + key + ", elements=" + elements.size() + ")";
    }
}
