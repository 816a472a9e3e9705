package org.example.gis2bim.conversion.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 装配完成的只读模型树。
 */
public final class ModelGraph {

    private final ProjectInfo projectInfo;
    private final HierarchyNode project;
    private final HierarchyNode site;
    private final HierarchyNode building;

    ModelGraph(ProjectInfo projectInfo, HierarchyNode project, HierarchyNode site, HierarchyNode building) {
        this.projectInfo = projectInfo;
        this.project = project;
        this.site = site;
        this.building = building;
    }

    public ProjectInfo projectInfo() {
        return projectInfo;
    }

    public HierarchyNode project() {
        return project;
    }

    public HierarchyNode site() {
        return site;
    }

    public HierarchyNode building() {
        return building;
    }

    /**
     * 图层分组，按首次出现顺序。
     */
    public List<HierarchyNode> layers() {
        return building.children();
    }

    /**
     * 全部构件：按图层顺序，图层内按加入顺序。
     */
    public List<ModelElement> elements() {
        List<ModelElement> all = new ArrayList<>();
        for (HierarchyNode layer : layers()) {
            all.addAll(layer.elements());
        }
        return all;
    }

    public int elementCount() {
        int count = 0;
        for (HierarchyNode layer : layers()) {
            count += layer.elements().size();
        }
        return count;
    }
}
