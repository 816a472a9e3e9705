package org.example.gis2bim.conversion.feature;

import org.example.gis2bim.conversion.geometry.Vector3;

import java.util.List;

/**
 * 源要素的二维/三维几何：点、折线、多边形（外环 + 洞），以及读取器无法映射的其他类型。
 */
public sealed interface FeatureGeometry
        permits FeatureGeometry.PointGeometry, FeatureGeometry.LineGeometry,
        FeatureGeometry.PolygonGeometry, FeatureGeometry.UnsupportedGeometry {

    RecordKind kind();

    record PointGeometry(Vector3 position) implements FeatureGeometry {

        @Override
        public RecordKind kind() {
            return RecordKind.POINT;
        }
    }

    record LineGeometry(List<Vector3> vertices) implements FeatureGeometry {

        public LineGeometry {
            vertices = List.copyOf(vertices);
        }

        @Override
        public RecordKind kind() {
            return RecordKind.LINE;
        }
    }

    record PolygonGeometry(List<Vector3> outerRing, List<List<Vector3>> innerRings) implements FeatureGeometry {

        public PolygonGeometry {
            outerRing = List.copyOf(outerRing);
            innerRings = innerRings.stream().map(List::copyOf).toList();
        }

        @Override
        public RecordKind kind() {
            return RecordKind.POLYGON;
        }
    }

    /**
     * @param typeName 源几何类型名（如 MultiPolygon），几何缺失时为 {@code null}
     */
    record UnsupportedGeometry(String typeName) implements FeatureGeometry {

        @Override
        public RecordKind kind() {
            return RecordKind.UNSUPPORTED;
        }
    }
}
