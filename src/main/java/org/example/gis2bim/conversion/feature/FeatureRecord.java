package org.example.gis2bim.conversion.feature;

import org.example.gis2bim.conversion.attribute.AttributeValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一条输入要素：所属图层、在源文件中的序号、几何、属性表（保持源顺序）。
 */
public record FeatureRecord(String layer, int index, FeatureGeometry geometry, Map<String, AttributeValue> attributes) {

    public FeatureRecord {
        if (layer == null || layer.isBlank()) {
            throw new IllegalArgumentException("要素图层不能为空");
        }
        if (geometry == null) {
            geometry = new FeatureGeometry.UnsupportedGeometry(null);
        }
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes == null ? Map.of() : attributes));
    }

    public RecordKind recordKind() {
        return geometry.kind();
    }

    public String label() {
        return layer + "#" + index;
    }
}
