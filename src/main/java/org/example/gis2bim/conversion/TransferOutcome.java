package org.example.gis2bim.conversion;

import org.example.gis2bim.conversion.transfer.TransferReport;

import java.nio.file.Path;

/**
 * 一次足迹属性迁移的结果。
 *
 * @param outputFile    实际写出的 IFC 文件
 * @param report        迁移报告
 * @param styleRules    样式表规则数
 * @param elapsedMillis 总耗时
 */
public record TransferOutcome(Path outputFile, TransferReport report, int styleRules, long elapsedMillis) {
}
