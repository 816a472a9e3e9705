package org.example.gis2bim.conversion.feature;

/**
 * 要素的几何类别无法转换为实体（如 MultiPolygon、缺失几何）。
 */
public class UnsupportedRecordKindException extends IllegalArgumentException {

    public UnsupportedRecordKindException(String message) {
        super(message);
    }
}
