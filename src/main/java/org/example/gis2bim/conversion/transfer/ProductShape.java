package org.example.gis2bim.conversion.transfer;

import org.example.gis2bim.conversion.geometry.MeshMetrics;
import org.example.gis2bim.conversion.geometry.Vector3;

/**
 * IFC 构件的世界坐标几何摘要。
 *
 * @param entityId 构件实体编号
 * @param centroid 顶点均值
 * @param bounds   轴对齐包围盒
 */
public record ProductShape(int entityId, String globalId, String type, Vector3 centroid, MeshMetrics.Bounds bounds) {
}
