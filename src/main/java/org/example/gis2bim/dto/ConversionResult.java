package org.example.gis2bim.dto;

import java.util.List;

/**
 * {@code gis_convert_folder} 的返回结果。
 *
 * @param rootId         根目录标识
 * @param outputFile     写出的 IFC 文件（相对根目录，使用 '/' 分隔）
 * @param representation 几何表达方式
 * @param inputFiles     处理过的输入文件（按处理顺序）
 * @param layers         图层（即 IfcBuildingStorey）名称
 * @param convertedCount 成功转换的要素数
 * @param skippedCount   被跳过的要素数
 * @param elementCount   模型构件数（含质心标记）
 * @param styleRules     样式表规则数
 * @param warnings       告警（{@code 图层#序号 [类别] 说明}），过多时截断
 * @param elapsedMillis  耗时
 */
public record ConversionResult(
        String rootId,
        String outputFile,
        String representation,
        List<String> inputFiles,
        List<String> layers,
        int convertedCount,
        int skippedCount,
        int elementCount,
        int styleRules,
        List<String> warnings,
        long elapsedMillis
) {
}
