package org.example.gis2bim.conversion.transfer;

import java.util.List;

/**
 * 一次属性迁移的结果。
 *
 * @param footprintCount      计算出几何的足迹构件数
 * @param targetCount         计算出几何的目标构件数
 * @param matchedFootprints   至少命中一个目标的足迹数
 * @param matchCount          足迹与目标的配对总数
 * @param copiedPropertySets  新建到目标文件中的属性集数
 * @param styledElements      重新着色的次数（同一目标被多个足迹命中时计多次）
 * @param unmatchedFootprints 没有命中任何目标的足迹 GlobalId
 * @param warnings            几何无法计算等非致命问题
 */
public record TransferReport(
        int footprintCount,
        int targetCount,
        int matchedFootprints,
        int matchCount,
        int copiedPropertySets,
        int styledElements,
        List<String> unmatchedFootprints,
        List<String> warnings
) {

    public TransferReport {
        unmatchedFootprints = List.copyOf(unmatchedFootprints);
        warnings = List.copyOf(warnings);
    }
}
