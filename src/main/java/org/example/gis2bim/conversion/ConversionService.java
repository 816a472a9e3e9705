package org.example.gis2bim.conversion;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.gis2bim.conversion.attribute.AttributeMapper;
import org.example.gis2bim.conversion.feature.ConversionParameters;
import org.example.gis2bim.conversion.feature.ConversionReport;
import org.example.gis2bim.conversion.feature.FeatureConverter;
import org.example.gis2bim.conversion.feature.FeatureRecord;
import org.example.gis2bim.conversion.geometry.GeometryPrimitives;
import org.example.gis2bim.conversion.io.GeoJsonRecordReader;
import org.example.gis2bim.conversion.io.IfcStepWriter;
import org.example.gis2bim.conversion.io.Representation;
import org.example.gis2bim.conversion.model.ModelAssembler;
import org.example.gis2bim.conversion.style.ResolvedStyle;
import org.example.gis2bim.conversion.style.RgbColor;
import org.example.gis2bim.conversion.style.StyleResolver;
import org.example.gis2bim.conversion.style.StyleTable;
import org.example.gis2bim.conversion.style.StyleTableLoader;
import org.example.gis2bim.conversion.transfer.FootprintPropertyTransfer;
import org.example.gis2bim.conversion.transfer.TransferReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * 一次完整转换：加载样式表 → 按文件名顺序读取目录中的 GeoJSON → 逐要素转换 → 写出 IFC。
 * 另提供足迹属性迁移（{@link #copyFootprintProperties}）。
 * <p>
 * 每次调用都新建装配器与转换器，并发调用之间不共享可变状态。
 */
public class ConversionService {

    private static final Logger log = LoggerFactory.getLogger(ConversionService.class);

    private final ConversionProperties properties;
    private final GeoJsonRecordReader recordReader;
    private final StyleTableLoader styleTableLoader;
    private final StyleResolver styleResolver = new StyleResolver();
    private final Clock clock;

    public ConversionService(ConversionProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.recordReader = new GeoJsonRecordReader(objectMapper);
        this.styleTableLoader = new StyleTableLoader(objectMapper);
        this.clock = clock;
    }

    public ConversionOutcome convertFolder(ConversionRequest request) {
        long startNanos = System.nanoTime();
        Path inputFolder = request.inputFolder();
        if (inputFolder == null || !Files.isDirectory(inputFolder)) {
            throw new IllegalArgumentException("输入目录不存在或不是目录：" + inputFolder);
        }
        Path output = normalizeOutput(request.outputFile());
        Representation representation = request.representation() != null
                ? request.representation()
                : properties.getRepresentation();
        log.info("开始转换：input={}, output={}, style={}, representation={}",
                inputFolder, output, request.styleFile(), representation);

        // 样式表错误是致命的，必须在读取任何要素之前暴露
        StyleTable styleTable = loadStyleTable(request.styleFile());

        List<Path> files = listInputFiles(inputFolder, request.styleFile());
        if (files.isEmpty()) {
            log.warn("输入目录中没有 GeoJSON 文件：{}", inputFolder);
        }
        List<FeatureRecord> records = new ArrayList<>();
        for (Path file : files) {
            records.addAll(recordReader.read(file));
        }

        ConversionParameters parameters = properties.toParameters();
        ModelAssembler assembler = new ModelAssembler(properties.getProject().toProjectInfo(), RunFingerprint.of(output, files));
        FeatureConverter converter = new FeatureConverter(
                assembler,
                new GeometryPrimitives(properties.getPipeSegments()),
                styleResolver,
                new AttributeMapper(properties.getPropertySetName()));
        ConversionReport report = converter.convertAll(records, styleTable, parameters);

        new IfcStepWriter(representation, clock).write(report.graph(), output);

        long elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000L;
        log.info("转换完成：files={}, records={}, converted={}, skipped={}, elements={}, warnings={}, elapsedMs={}",
                files.size(), records.size(), report.convertedCount(), report.skippedCount(),
                report.graph().elementCount(), report.warnings().size(), elapsedMillis);
        return new ConversionOutcome(output, files, report, styleTable.size(), elapsedMillis);
    }

    /**
     * 把足迹 IFC 的属性集迁移到 3D 模型 IFC 中位置重合的构件上，按样式表重新着色后写到 outputFile。
     * 样式表错误同样是致命的，在读取任何 IFC 之前抛出。
     */
    public TransferOutcome copyFootprintProperties(Path footprintFile, Path targetFile, Path outputFile, Path styleFile) {
        long startNanos = System.nanoTime();
        Path output = normalizeOutput(outputFile);
        log.info("开始属性迁移：footprint={}, target={}, output={}, style={}", footprintFile, targetFile, output, styleFile);
        StyleTable styleTable = loadStyleTable(styleFile);
        TransferReport report = new FootprintPropertyTransfer(styleResolver).transfer(footprintFile, targetFile, output, styleTable);
        long elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000L;
        log.info("属性迁移完成：output={}, elapsedMs={}", output, elapsedMillis);
        return new TransferOutcome(output, report, styleTable.size(), elapsedMillis);
    }

    /**
     * 加载样式表；未指定文件时返回只有默认样式的空表。
     */
    public StyleTable loadStyleTable(Path styleFile) {
        ResolvedStyle defaultStyle = defaultStyle();
        if (styleFile == null) {
            return StyleTable.empty(defaultStyle);
        }
        return styleTableLoader.load(styleFile, defaultStyle);
    }

    public StyleResolver styleResolver() {
        return styleResolver;
    }

    public ResolvedStyle defaultStyle() {
        return ResolvedStyle.defaultStyle(RgbColor.parseHex(properties.getDefaultColor()), properties.getDefaultCategory());
    }

    /**
     * 输出文件名不以 .ifc 结尾时追加 .ifc。
     */
    public static Path normalizeOutput(Path output) {
        if (output == null) {
            throw new IllegalArgumentException("输出文件不能为空");
        }
        String name = output.getFileName().toString();
        if (name.toLowerCase(Locale.ROOT).endsWith(".ifc")) {
            return output;
        }
        return output.resolveSibling(name + ".ifc");
    }

    /**
     * 列出目录中的 GeoJSON 文件（按文件名排序）。
     * <p>
     * 符号链接一律跳过，防止链接把目录外的文件带进来；样式表文件本身也不作为输入。
     */
    static List<Path> listInputFiles(Path folder, Path styleFile) {
        Path excluded = styleFile == null ? null : styleFile.toAbsolutePath().normalize();
        try (Stream<Path> stream = Files.list(folder)) {
            return stream
                    .filter(GeoJsonRecordReader::isGeoJson)
                    .filter(ConversionService::isPlainFile)
                    .filter(p -> excluded == null || !p.toAbsolutePath().normalize().equals(excluded))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("列出输入目录失败：" + folder, e);
        }
    }

    private static boolean isPlainFile(Path file) {
        if (Files.isSymbolicLink(file)) {
            log.warn("跳过符号链接输入：{}", file);
            return false;
        }
        return Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS);
    }
}
