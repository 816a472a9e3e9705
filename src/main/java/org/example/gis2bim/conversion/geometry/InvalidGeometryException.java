package org.example.gis2bim.conversion.geometry;

/**
 * 几何输入无效或退化（尺寸非正、顶点不足、中心线折返等）。
 * <p>
 * 属于“记录级”错误：调用方应跳过该要素并记录告警，而不是中断整个转换。
 */
public class InvalidGeometryException extends IllegalArgumentException {

    public InvalidGeometryException(String message) {
        super(message);
    }
}
