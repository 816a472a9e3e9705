package org.example.gis2bim.conversion.feature;

/**
 * 输入要素的几何类别。
 */
public enum RecordKind {
    POINT,
    LINE,
    POLYGON,
    UNSUPPORTED
}
