package org.example.gis2bim.conversion.feature;

import java.util.List;

/**
 * 一次转换的尺寸默认值与覆盖字段。转换期间不可变。
 *
 * @param pointSize             点 → 长方体的边长（及默认高度）
 * @param pipeRadius            线 → 管的默认半径
 * @param extrusionHeight       面 → 拉伸体的默认高度
 * @param pointHeightFields     覆盖长方体高度的属性字段，按顺序取第一个数值
 * @param pipeRadiusFields      覆盖管半径的属性字段
 * @param extrusionHeightFields 覆盖拉伸高度的属性字段
 * @param useZ                  是否保留输入的 z；否则全部压平到 {@code baseElevation}
 * @param baseElevation         压平时使用的标高
 * @param centroidMarkers       是否为每个面额外生成质心标记长方体
 * @param centroidMarkerSize    质心标记的边长
 */
public record ConversionParameters(
        double pointSize,
        double pipeRadius,
        double extrusionHeight,
        List<String> pointHeightFields,
        List<String> pipeRadiusFields,
        List<String> extrusionHeightFields,
        boolean useZ,
        double baseElevation,
        boolean centroidMarkers,
        double centroidMarkerSize
) {

    public static final double DEFAULT_POINT_SIZE = 2.0;
    public static final double DEFAULT_PIPE_RADIUS = 0.1;
    public static final double DEFAULT_EXTRUSION_HEIGHT = 0.1;

    public ConversionParameters {
        pointHeightFields = List.copyOf(pointHeightFields);
        pipeRadiusFields = List.copyOf(pipeRadiusFields);
        extrusionHeightFields = List.copyOf(extrusionHeightFields);
    }

    public static ConversionParameters defaults() {
        return new ConversionParameters(
                DEFAULT_POINT_SIZE,
                DEFAULT_PIPE_RADIUS,
                DEFAULT_EXTRUSION_HEIGHT,
                List.of("height", "elevation"),
                List.of("radius"),
                List.of("buildingHeight", "height"),
                false,
                0.0,
                false,
                DEFAULT_POINT_SIZE
        );
    }

    public ConversionParameters withUseZ(boolean value) {
        return new ConversionParameters(pointSize, pipeRadius, extrusionHeight, pointHeightFields, pipeRadiusFields,
                extrusionHeightFields, value, baseElevation, centroidMarkers, centroidMarkerSize);
    }

    public ConversionParameters withCentroidMarkers(boolean value) {
        return new ConversionParameters(pointSize, pipeRadius, extrusionHeight, pointHeightFields, pipeRadiusFields,
                extrusionHeightFields, useZ, baseElevation, value, centroidMarkerSize);
    }
}
