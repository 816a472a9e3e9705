package org.example.gis2bim.conversion.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.gis2bim.conversion.attribute.JsonAttributes;
import org.example.gis2bim.conversion.feature.FeatureGeometry;
import org.example.gis2bim.conversion.feature.FeatureRecord;
import org.example.gis2bim.conversion.geometry.Vector3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 读取 GeoJSON 文件（FeatureCollection 或单个 Feature）为要素记录。
 * <p>
 * 图层名取 FeatureCollection 的 {@code name} 成员，没有时取文件名（去扩展名）。
 * Point / LineString / Polygon 之外的几何类型（含缺失几何）记为 {@link FeatureGeometry.UnsupportedGeometry}，
 * 由转换阶段跳过并告警。坐标缺失或不是数值时记为 NaN，由几何构造阶段报告为无效几何。
 * <p>
 * 扩展名为 {@code .json} 的文件可能是同目录下的样式表等其它 JSON：顶层不是 Feature / FeatureCollection 时
 * 记 WARN 并跳过；{@code .geojson} 文件仍按严格格式处理。
 */
public class GeoJsonRecordReader {

    private static final Logger log = LoggerFactory.getLogger(GeoJsonRecordReader.class);

    private final ObjectMapper objectMapper;

    public GeoJsonRecordReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static boolean isGeoJson(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".geojson") || name.endsWith(".json");
    }

    public List<FeatureRecord> read(Path file) {
        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("读取 GeoJSON 文件失败：" + file + "（" + e.getMessage() + "）", e);
        }
        if (!isGeoJsonDocument(root) && !isStrictGeoJson(file)) {
            log.warn("不是 GeoJSON 文档，已跳过：{}", file);
            return List.of();
        }
        List<FeatureRecord> records = parse(root, layerNameOf(file));
        log.info("GeoJSON 已读取：file={}, features={}", file, records.size());
        return records;
    }

    /**
     * 顶层是否为 Feature 或 FeatureCollection 对象。
     */
    public static boolean isGeoJsonDocument(JsonNode root) {
        if (root == null || !root.isObject()) {
            return false;
        }
        String type = root.path("type").asText("");
        return "FeatureCollection".equals(type) || "Feature".equals(type);
    }

    private static boolean isStrictGeoJson(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".geojson");
    }

    public List<FeatureRecord> parse(JsonNode root, String fallbackLayer) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("GeoJSON 顶层必须是对象");
        }
        String type = root.path("type").asText("");
        List<FeatureRecord> out = new ArrayList<>();
        if ("FeatureCollection".equals(type)) {
            String layer = root.hasNonNull("name") && root.get("name").isTextual() && !root.get("name").textValue().isBlank()
                    ? root.get("name").textValue()
                    : fallbackLayer;
            JsonNode features = root.path("features");
            if (!features.isArray()) {
                throw new IllegalArgumentException("FeatureCollection 缺少 features 数组");
            }
            int index = 0;
            for (JsonNode feature : features) {
                out.add(toRecord(feature, layer, index++));
            }
        } else if ("Feature".equals(type)) {
            out.add(toRecord(root, fallbackLayer, 0));
        } else {
            throw new IllegalArgumentException("不支持的 GeoJSON 顶层类型：" + (type.isEmpty() ? "（缺失）" : type));
        }
        return out;
    }

    private static FeatureRecord toRecord(JsonNode feature, String layer, int index) {
        if (feature == null || !feature.isObject()) {
            return new FeatureRecord(layer, index, new FeatureGeometry.UnsupportedGeometry(null), null);
        }
        return new FeatureRecord(layer, index, toGeometry(feature.get("geometry")),
                JsonAttributes.fromObject(feature.get("properties")));
    }

    static FeatureGeometry toGeometry(JsonNode geometry) {
        if (geometry == null || geometry.isNull() || !geometry.isObject()) {
            return new FeatureGeometry.UnsupportedGeometry(null);
        }
        String type = geometry.path("type").asText("");
        JsonNode coordinates = geometry.path("coordinates");
        switch (type) {
            case "Point" -> {
                return new FeatureGeometry.PointGeometry(toVector(coordinates));
            }
            case "LineString" -> {
                return new FeatureGeometry.LineGeometry(toVectors(coordinates));
            }
            case "Polygon" -> {
                List<List<Vector3>> rings = new ArrayList<>();
                if (coordinates.isArray()) {
                    for (JsonNode ring : coordinates) {
                        rings.add(toVectors(ring));
                    }
                }
                List<Vector3> outer = rings.isEmpty() ? List.of() : rings.get(0);
                List<List<Vector3>> inners = rings.size() > 1 ? rings.subList(1, rings.size()) : List.of();
                return new FeatureGeometry.PolygonGeometry(outer, inners);
            }
            default -> {
                return new FeatureGeometry.UnsupportedGeometry(type.isEmpty() ? null : type);
            }
        }
    }

    private static List<Vector3> toVectors(JsonNode positions) {
        List<Vector3> out = new ArrayList<>();
        if (positions != null && positions.isArray()) {
            for (JsonNode position : positions) {
                out.add(toVector(position));
            }
        }
        return out;
    }

    private static Vector3 toVector(JsonNode position) {
        if (position == null || !position.isArray() || position.size() < 2) {
            return Vector3.of(Double.NaN, Double.NaN, Double.NaN);
        }
        double x = number(position.get(0));
        double y = number(position.get(1));
        double z = position.size() > 2 ? number(position.get(2)) : 0.0;
        return Vector3.of(x, y, z);
    }

    private static double number(JsonNode node) {
        return (node != null && node.isNumber()) ? node.doubleValue() : Double.NaN;
    }

    static String layerNameOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
