package org.example.gis2bim.conversion;

import org.example.gis2bim.conversion.feature.ConversionReport;

import java.nio.file.Path;
import java.util.List;

/**
 * 一次目录转换的结果。
 *
 * @param outputFile    实际写出的 IFC 文件
 * @param inputFiles    按处理顺序排列的输入文件
 * @param report        转换报告（模型、数量、告警）
 * @param styleRules    样式表规则数
 * @param elapsedMillis 总耗时
 */
public record ConversionOutcome(Path outputFile, List<Path> inputFiles, ConversionReport report, int styleRules,
                                long elapsedMillis) {

    public ConversionOutcome {
        inputFiles = List.copyOf(inputFiles);
    }
}
