package org.example.gis2bim.conversion.io;

/**
 * IFC 几何表达方式。
 */
public enum Representation {
    /** 参数化形体：拉伸体 / 扫掠圆盘体 */
    SWEPT,
    /** 多面体边界表示（IfcFacetedBrep） */
    BREP
}
