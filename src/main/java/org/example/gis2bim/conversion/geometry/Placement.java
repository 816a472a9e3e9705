package org.example.gis2bim.conversion.geometry;

/**
 * 实体的放置（局部坐标系原点，轴向固定为世界 Z 轴向上、X 轴为参考方向）。
 * <p>
 * GIS 坐标通常量级很大（例如 UTM 北向 6,000,000+），几何顶点一律相对原点存储，写出时再由放置平移回去，
 * 避免在形体内部直接使用大坐标导致精度损失。
 */
public record Placement(Vector3 origin) {

    public static Placement at(Vector3 origin) {
        return new Placement(origin);
    }

    public Vector3 toWorld(Vector3 local) {
        return origin.plus(local);
    }
}
