package org.example.gis2bim.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.gis2bim.conversion.ConversionOutcome;
import org.example.gis2bim.conversion.ConversionProperties;
import org.example.gis2bim.conversion.ConversionRequest;
import org.example.gis2bim.conversion.ConversionService;
import org.example.gis2bim.conversion.TransferOutcome;
import org.example.gis2bim.conversion.attribute.AttributeMapper;
import org.example.gis2bim.conversion.attribute.AttributeValue;
import org.example.gis2bim.conversion.attribute.JsonAttributes;
import org.example.gis2bim.conversion.attribute.PropertySet;
import org.example.gis2bim.conversion.feature.ConversionReport;
import org.example.gis2bim.conversion.feature.ConversionWarning;
import org.example.gis2bim.conversion.io.IfcModelInspector;
import org.example.gis2bim.conversion.io.Representation;
import org.example.gis2bim.conversion.model.HierarchyNode;
import org.example.gis2bim.conversion.style.ResolvedStyle;
import org.example.gis2bim.conversion.style.StyleTable;
import org.example.gis2bim.conversion.transfer.TransferReport;
import org.example.gis2bim.dto.AllowedRootsResult;
import org.example.gis2bim.dto.ConversionResult;
import org.example.gis2bim.dto.EntityTypeCount;
import org.example.gis2bim.dto.FootprintTransferResult;
import org.example.gis2bim.dto.IfcModelInfoResult;
import org.example.gis2bim.dto.StylePreviewResult;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * GIS → IFC 转换的 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出根目录白名单（{@code gis_list_roots}）。</li>
 *   <li>把目录中的 GeoJSON 转换为 IFC（{@code gis_convert_folder}）。</li>
 *   <li>预览一组属性命中的样式规则（{@code gis_preview_style}）。</li>
 *   <li>把足迹 IFC 的属性迁移到 3D 模型 IFC 并重新着色（{@code gis_copy_footprint_properties}）。</li>
 *   <li>读取 IFC 文件概要（{@code ifc_read_model_info}）。</li>
 * </ul>
 * 所有路径都经过 {@link WorkspacePathResolver} 校验，只能访问 {@code app.convert.roots} 范围内的文件。
 */
@Component
public class GisMcpTools {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    // 单次返回的列表条数上限，避免响应体过大
    private static final int MAX_LIST_ITEMS = 200;
    private static final int TOP_ENTITY_TYPES = 30;

    private final ConversionService conversionService;
    private final ConversionProperties properties;
    private final WorkspacePathResolver pathResolver;

    public GisMcpTools(ConversionService conversionService, ConversionProperties properties, WorkspacePathResolver pathResolver) {
        this.conversionService = conversionService;
        this.properties = properties;
        this.pathResolver = pathResolver;
    }

    @Tool(
            name = "gis_list_roots",
            description = "列出 MCP Server 允许访问的根目录（rootId + path）。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "gis_convert_folder",
            description = "把目录中的 GeoJSON（点/线/面）转换为 IFC2X3 模型：点→长方体，线→圆管，面→拉伸体；按样式表着色并写入属性集。"
    )
    public ConversionResult convertFolder(
            @ToolParam(required = false, description = "rootId（可从 gis_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "输入目录（包含 .geojson/.json 文件，相对 rootId 或绝对路径）") String inputFolder,
            @ToolParam(description = "输出 IFC 文件路径（缺少 .ifc 扩展名时自动补上）") String outputFile,
            @ToolParam(required = false, description = "样式表 JSON 文件路径；为空则全部使用默认样式") String styleFile,
            @ToolParam(required = false, description = "几何表达方式：SWEPT（默认，参数化形体）或 BREP（多面体）") String representation
    ) {
        WorkspacePathResolver.ResolvedPath input = pathResolver.resolve(rootId, inputFolder, true);
        if (!Files.isDirectory(input.absolutePath(), LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("不是目录：" + input.displayPath());
        }
        WorkspacePathResolver.ResolvedPath output = resolveOutput(rootId, outputFile);
        Path style = null;
        if (styleFile != null && !styleFile.isBlank()) {
            style = requireRegularFile(pathResolver.resolve(rootId, styleFile, true));
        }

        ConversionOutcome outcome = conversionService.convertFolder(new ConversionRequest(
                input.absolutePath(), output.absolutePath(), style, parseRepresentation(representation)));
        ConversionReport report = outcome.report();

        List<String> warnings = capped(report.warnings().stream().map(ConversionWarning::toString).toList());
        return new ConversionResult(
                output.rootId(),
                displayPath(output.rootPath(), outcome.outputFile()),
                (representation == null || representation.isBlank()) ? properties.getRepresentation().name()
                        : representation.trim().toUpperCase(Locale.ROOT),
                outcome.inputFiles().stream().map(p -> p.getFileName().toString()).toList(),
                report.graph().layers().stream().map(HierarchyNode::name).toList(),
                report.convertedCount(),
                report.skippedCount(),
                report.graph().elementCount(),
                outcome.styleRules(),
                warnings,
                outcome.elapsedMillis()
        );
    }

    @Tool(
            name = "gis_preview_style",
            description = "预览一组要素属性会命中哪条样式规则（颜色/分类），并返回写入 IFC 属性集时的属性名。"
    )
    public StylePreviewResult previewStyle(
            @ToolParam(required = false, description = "rootId（可从 gis_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "样式表 JSON 文件路径；为空则只有默认样式") String styleFile,
            @ToolParam(description = "要素属性 JSON 对象，例如 {\"bygningstype\":111,\"height\":6.5}") String attributesJson
    ) {
        JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(attributesJson == null ? "" : attributesJson);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("attributesJson 不是合法的 JSON：" + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("attributesJson 格式错误：必须是 JSON 对象");
        }
        Map<String, AttributeValue> attributes = JsonAttributes.fromObject(node);

        Path style = null;
        if (styleFile != null && !styleFile.isBlank()) {
            style = requireRegularFile(pathResolver.resolve(rootId, styleFile, true));
        }
        StyleTable table = conversionService.loadStyleTable(style);
        ResolvedStyle resolved = conversionService.styleResolver().resolve(attributes, table);
        PropertySet propertySet = new AttributeMapper(properties.getPropertySetName()).toPropertySet(attributes);
        return new StylePreviewResult(
                resolved.matchedRuleId(),
                resolved.category(),
                resolved.color().toHex(),
                table.size(),
                propertySet.properties().stream().map(PropertySet.Property::name).toList()
        );
    }

    @Tool(
            name = "gis_copy_footprint_properties",
            description = "把 2D 足迹 IFC 中构件的属性集复制到 3D 模型 IFC 中位置重合的构件上（目标质心落在足迹包围盒内即配对），按样式表重新着色后写出新的 IFC。"
    )
    public FootprintTransferResult copyFootprintProperties(
            @ToolParam(required = false, description = "rootId（可从 gis_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "足迹 IFC 文件路径（属性来源，通常是 gis_convert_folder 的输出）") String footprintFile,
            @ToolParam(description = "3D 模型 IFC 文件路径（属性目标）") String targetFile,
            @ToolParam(description = "输出 IFC 文件路径（缺少 .ifc 扩展名时自动补上；可与目标文件相同）") String outputFile,
            @ToolParam(required = false, description = "样式表 JSON 文件路径；为空则不着色") String styleFile
    ) {
        Path footprint = requireIfcFile(pathResolver.resolve(rootId, footprintFile, true));
        Path target = requireIfcFile(pathResolver.resolve(rootId, targetFile, true));
        WorkspacePathResolver.ResolvedPath output = resolveOutput(rootId, outputFile);
        Path style = null;
        if (styleFile != null && !styleFile.isBlank()) {
            style = requireRegularFile(pathResolver.resolve(rootId, styleFile, true));
        }

        TransferOutcome outcome = conversionService.copyFootprintProperties(footprint, target, output.absolutePath(), style);
        TransferReport report = outcome.report();
        return new FootprintTransferResult(
                output.rootId(),
                displayPath(output.rootPath(), outcome.outputFile()),
                report.footprintCount(),
                report.targetCount(),
                report.matchedFootprints(),
                report.matchCount(),
                report.copiedPropertySets(),
                report.styledElements(),
                outcome.styleRules(),
                capped(report.unmatchedFootprints()),
                capped(report.warnings()),
                outcome.elapsedMillis()
        );
    }

    @Tool(
            name = "ifc_read_model_info",
            description = "读取 IFC(.ifc) 文件概要：HEADER( FILE_DESCRIPTION/FILE_NAME/FILE_SCHEMA )、项目名称、楼层/构件数量与实体类型计数。支持中文（含 \\\\X2\\\\...\\\\X0\\\\ 编码）。"
    )
    public IfcModelInfoResult readModelInfo(
            @ToolParam(required = false, description = "rootId（可从 gis_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "IFC 文件路径（.ifc，相对 rootId 或绝对路径）") String path
    ) {
        WorkspacePathResolver.ResolvedPath resolved = pathResolver.resolve(rootId, path, true);
        Path file = requireIfcFile(resolved);
        IfcModelInspector.IfcModelInfo info = IfcModelInspector.read(file);
        List<EntityTypeCount> top = info.topEntityTypes(TOP_ENTITY_TYPES).entrySet().stream()
                .map(e -> new EntityTypeCount(e.getKey(), e.getValue()))
                .toList();
        return new IfcModelInfoResult(
                resolved.rootId(),
                resolved.displayPath(),
                info.fileDescriptions(),
                info.implementationLevel(),
                info.fileName(),
                info.timeStamp(),
                info.authors(),
                info.organizations(),
                info.originatingSystem(),
                info.schemas(),
                info.projectName(),
                info.entityCount(),
                info.count("IFCBUILDINGSTOREY"),
                info.count("IFCBUILDINGELEMENTPROXY"),
                top,
                info.warnings().isEmpty() ? null : info.warnings()
        );
    }

    static Representation parseRepresentation(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Representation.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("representation 只能是 SWEPT 或 BREP：" + value, e);
        }
    }

    /**
     * 先补齐 .ifc 扩展名再做根目录校验，实际写出的文件与校验过的路径一致。
     */
    private WorkspacePathResolver.ResolvedPath resolveOutput(String rootId, String outputFile) {
        if (outputFile == null || outputFile.isBlank()) {
            throw new IllegalArgumentException("outputFile 不能为空");
        }
        String normalized = ConversionService.normalizeOutput(Path.of(outputFile.trim())).toString();
        WorkspacePathResolver.ResolvedPath output = pathResolver.resolve(rootId, normalized, false);
        if (Files.isDirectory(output.absolutePath(), LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("输出路径是目录：" + output.displayPath());
        }
        return output;
    }

    private static Path requireIfcFile(WorkspacePathResolver.ResolvedPath resolved) {
        Path file = requireRegularFile(resolved);
        if (!file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".ifc")) {
            throw new IllegalArgumentException("不是 IFC 文件（仅支持 .ifc）：" + resolved.displayPath());
        }
        return file;
    }

    private static List<String> capped(List<String> items) {
        if (items.size() <= MAX_LIST_ITEMS) {
            return items;
        }
        List<String> out = new ArrayList<>(items.subList(0, MAX_LIST_ITEMS));
        out.add("条目过多，已省略后续 " + (items.size() - MAX_LIST_ITEMS) + " 条…");
        return out;
    }

    private static Path requireRegularFile(WorkspacePathResolver.ResolvedPath resolved) {
        if (!Files.isRegularFile(resolved.absolutePath(), LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("不是普通文件：" + resolved.displayPath());
        }
        return resolved.absolutePath();
    }

    private static String displayPath(Path root, Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        return absolute.startsWith(root) ? root.relativize(absolute).toString().replace('\\', '/') : absolute.toString();
    }
}
