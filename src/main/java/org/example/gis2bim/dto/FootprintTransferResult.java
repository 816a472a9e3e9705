package org.example.gis2bim.dto;

import java.util.List;

/**
 * {@code gis_copy_footprint_properties} 的返回结果。
 *
 * @param rootId              根目录标识
 * @param outputFile          写出的 IFC 文件（相对根目录，使用 '/' 分隔）
 * @param footprintCount      足迹文件中计算出几何的构件数
 * @param targetCount         目标文件中计算出几何的构件数
 * @param matchedFootprints   命中至少一个目标的足迹数
 * @param matchCount          配对总数
 * @param copiedPropertySets  复制的属性集数
 * @param styledElements      重新着色次数
 * @param styleRules          样式表规则数
 * @param unmatchedFootprints 没有命中目标的足迹 GlobalId，过多时截断
 * @param warnings            告警，过多时截断
 * @param elapsedMillis       耗时
 */
public record FootprintTransferResult(
        String rootId,
        String outputFile,
        int footprintCount,
        int targetCount,
        int matchedFootprints,
        int matchCount,
        int copiedPropertySets,
        int styledElements,
        int styleRules,
        List<String> unmatchedFootprints,
        List<String> warnings,
        long elapsedMillis
) {
}
