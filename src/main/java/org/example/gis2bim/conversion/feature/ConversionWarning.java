package org.example.gis2bim.conversion.feature;

/**
 * 转换过程中的非致命问题。
 *
 * @param layer   要素图层
 * @param index   要素序号
 * @param kind    问题类别
 * @param message 说明
 */
public record ConversionWarning(String layer, int index, Kind kind, String message) {

    public enum Kind {
        /** 几何无法构造，要素被跳过 */
        INVALID_GEOMETRY,
        /** 几何类别不支持，要素被跳过 */
        UNSUPPORTED_RECORD_KIND,
        /** 几何已生成，但质量可疑 */
        GEOMETRY_QUALITY
    }

    public boolean skipped() {
        return kind != Kind.GEOMETRY_QUALITY;
    }

    @Override
    public String toString() {
        return layer + "#" + index + " [" + kind + "] " + message;
    }
}
