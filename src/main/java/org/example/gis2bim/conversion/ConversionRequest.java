package org.example.gis2bim.conversion;

import org.example.gis2bim.conversion.io.Representation;

import java.nio.file.Path;

/**
 * 一次目录转换的输入。
 *
 * @param inputFolder    GeoJSON 所在目录（只处理第一层文件）
 * @param outputFile     IFC 输出文件
 * @param styleFile      样式表，可为 null
 * @param representation 几何表达方式，null 表示使用配置值
 */
public record ConversionRequest(Path inputFolder, Path outputFile, Path styleFile, Representation representation) {
}
