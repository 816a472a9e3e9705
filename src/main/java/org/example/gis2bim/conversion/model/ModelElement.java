package org.example.gis2bim.conversion.model;

import org.example.gis2bim.conversion.attribute.PropertySet;
import org.example.gis2bim.conversion.geometry.SolidGeometry;
import org.example.gis2bim.conversion.style.ResolvedStyle;

/**
 * 模型中的一个实体构件（写出为 IfcBuildingElementProxy）。
 *
 * @param globalId    22 位 IFC GlobalId
 * @param name        构件名称
 * @param geometry    几何
 * @param style       样式
 * @param properties  属性集
 * @param parentGroup 所属图层分组
 * @param sourceLayer 源图层
 * @param sourceIndex 在源图层中的序号（从 0 开始）
 */
public record ModelElement(
        String globalId,
        String name,
        SolidGeometry geometry,
        ResolvedStyle style,
        PropertySet properties,
        HierarchyNode parentGroup,
        String sourceLayer,
        int sourceIndex
) {

    @Override
    public String toString() {
        return "ModelElement[" + globalId + ", " + name + ", " + sourceLayer + "#" + sourceIndex + "]";
    }
}
