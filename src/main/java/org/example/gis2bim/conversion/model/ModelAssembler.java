package org.example.gis2bim.conversion.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 构建模型树：启动时创建 项目 → 场地 → 建筑，之后按图层 key 建分组并登记构件，最后 {@link #finish()} 得到只读的 {@link ModelGraph}。
 * <p>
 * 单线程写入，非线程安全；每次转换使用独立实例。
 * <p>
 * GlobalId 由项目名、运行种子与递增序号生成：同一种子得到相同的 id 序列，
 * 不同种子（不同输入或输出文件）之间的 id 互不相交，便于多个输出文件联合浏览。
 */
public class ModelAssembler {

    private final ProjectInfo projectInfo;
    private final String idSeed;
    private final HierarchyNode project;
    private final HierarchyNode site;
    private final HierarchyNode building;
    private final Map<String, HierarchyNode> groups = new LinkedHashMap<>();
    private long sequence;
    private boolean finished;

    public ModelAssembler(ProjectInfo projectInfo) {
        this(projectInfo, "");
    }

    /**
     * @param idSeed 运行种子，参与每个 GlobalId 的生成；为空时只按项目名与序号生成
     */
    public ModelAssembler(ProjectInfo projectInfo, String idSeed) {
        this.projectInfo = projectInfo;
        this.idSeed = idSeed == null ? "" : idSeed;
        this.project = new HierarchyNode(HierarchyNode.Kind.PROJECT, "project", projectInfo.projectName(), nextId(), null);
        this.site = new HierarchyNode(HierarchyNode.Kind.SITE, "site", projectInfo.siteName(), nextId(), project);
        this.building = new HierarchyNode(HierarchyNode.Kind.BUILDING, "building", projectInfo.buildingName(), nextId(), site);
        project.addChild(site);
        site.addChild(building);
    }

    /**
     * 取得（不存在则创建）图层分组；重复调用返回同一个节点。
     */
    public HierarchyNode getOrCreateGroup(String key) {
        ensureOpen("getOrCreateGroup");
        if (key == null) {
            throw new IllegalArgumentException("分组 key 不能为空");
        }
        HierarchyNode existing = groups.get(key);
        if (existing != null) {
            return existing;
        }
        HierarchyNode group = new HierarchyNode(HierarchyNode.Kind.LAYER, key, key, nextId(), building);
        building.addChild(group);
        groups.put(key, group);
        return group;
    }

    public String nextGlobalId() {
        ensureOpen("nextGlobalId");
        return nextId();
    }

    /**
     * 登记构件。不做去重：同一要素转换出的多个构件都会被保留。
     *
     * @throws IllegalArgumentException 分组不存在，或构件的 parentGroup 不是该分组
     */
    public void addElement(String groupKey, ModelElement element) {
        ensureOpen("addElement");
        HierarchyNode group = groups.get(groupKey);
        if (group == null) {
            throw new IllegalArgumentException("分组不存在：" + groupKey);
        }
        if (element.parentGroup() != group) {
            throw new IllegalArgumentException("构件 " + element.globalId() + " 不属于分组 " + groupKey);
        }
        group.addElement(element);
    }

    public ModelGraph finish() {
        ensureOpen("finish");
        finished = true;
        return new ModelGraph(projectInfo, project, site, building);
    }

    public boolean isFinished() {
        return finished;
    }

    private void ensureOpen(String operation) {
        if (finished) {
            throw new InvalidStateException("模型已完成装配，不能再调用 " + operation);
        }
    }

    private String nextId() {
        return IfcGuid.fromName(projectInfo.projectName() + "/" + idSeed + "/" + sequence++);
    }
}
