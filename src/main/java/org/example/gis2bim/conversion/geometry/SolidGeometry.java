package org.example.gis2bim.conversion.geometry;

/**
 * 转换生成的三维实体。
 * <p>
 * 三种形态与输入要素一一对应：点 → {@link Box}，线 → {@link SweptPipe}，面 → {@link ExtrudedSolid}。
 * 每种形态都能给出闭合、方向一致的边界表示（{@link #toBoundaryMesh()}），序列化器既可以写参数化形体，
 * 也可以写多面体。
 */
public sealed interface SolidGeometry permits Box, SweptPipe, ExtrudedSolid {

    Placement placement();

    BoundaryMesh toBoundaryMesh();
}
