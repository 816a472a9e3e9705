package org.example.gis2bim.conversion;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.example.gis2bim.conversion.feature.ConversionParameters;
import org.example.gis2bim.conversion.io.Representation;
import org.example.gis2bim.conversion.model.ProjectInfo;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * GIS → IFC 转换的配置（{@code app.convert.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>尺寸默认值（点、管、拉伸）与覆盖字段列表，对应 {@link ConversionParameters}。</li>
 *   <li>{@link #inputFolder} 设置时，启动后直接执行一次批量转换（命令行模式）。</li>
 *   <li>{@link #roots} 是 MCP 工具允许访问的根目录白名单。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.convert")
public class ConversionProperties {

    /**
     * 批量模式的输入目录；为空时不执行批量转换，只提供 MCP 工具。
     */
    private String inputFolder;

    /**
     * 批量模式的输出文件（缺少 .ifc 扩展名时自动补上）。
     */
    @NotBlank
    private String outputFile = "gis2bim.ifc";

    /**
     * 样式表 JSON；为空时所有要素使用默认样式。
     */
    private String styleFile;

    @DecimalMin(value = "0.0", inclusive = false)
    private double pointSize = ConversionParameters.DEFAULT_POINT_SIZE;

    @DecimalMin(value = "0.0", inclusive = false)
    private double pipeRadius = ConversionParameters.DEFAULT_PIPE_RADIUS;

    /**
     * 管截面多边形边数。
     */
    @Min(3)
    @Max(256)
    private int pipeSegments = 16;

    @DecimalMin(value = "0.0", inclusive = false)
    private double extrusionHeight = ConversionParameters.DEFAULT_EXTRUSION_HEIGHT;

    @NotNull
    private List<String> pointHeightFields = List.of("height", "elevation");

    @NotNull
    private List<String> pipeRadiusFields = List.of("radius");

    @NotNull
    private List<String> extrusionHeightFields = List.of("buildingHeight", "height");

    /**
     * 是否保留输入坐标的 z；默认压平到 {@link #baseElevation}。
     */
    private boolean useZ = false;

    private double baseElevation = 0.0;

    /**
     * 为每个面额外生成质心标记长方体。
     */
    private boolean polygonCentroidMarkers = false;

    @DecimalMin(value = "0.0", inclusive = false)
    private double centroidMarkerSize = 2.0;

    @Pattern(regexp = "#?[0-9A-Fa-f]{6}([0-9A-Fa-f]{2})?")
    private String defaultColor = "#B3B3B3";

    @NotBlank
    private String defaultCategory = "Unclassified";

    @NotBlank
    private String propertySetName = "GIS_Attributes";

    @NotNull
    private Representation representation = Representation.SWEPT;

    @Valid
    @NotNull
    private Project project = new Project();

    /**
     * MCP 工具允许访问的根目录白名单（rootId 依次为 root0、root1…）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    public ConversionParameters toParameters() {
        return new ConversionParameters(
                pointSize,
                pipeRadius,
                extrusionHeight,
                pointHeightFields,
                pipeRadiusFields,
                extrusionHeightFields,
                useZ,
                baseElevation,
                polygonCentroidMarkers,
                centroidMarkerSize
        );
    }

    public String getInputFolder() {
        return inputFolder;
    }

    public void setInputFolder(String inputFolder) {
        this.inputFolder = inputFolder;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(String outputFile) {
        this.outputFile = outputFile;
    }

    public String getStyleFile() {
        return styleFile;
    }

    public void setStyleFile(String styleFile) {
        this.styleFile = styleFile;
    }

    public double getPointSize() {
        return pointSize;
    }

    public void setPointSize(double pointSize) {
        this.pointSize = pointSize;
    }

    public double getPipeRadius() {
        return pipeRadius;
    }

    public void setPipeRadius(double pipeRadius) {
        this.pipeRadius = pipeRadius;
    }

    public int getPipeSegments() {
        return pipeSegments;
    }

    public void setPipeSegments(int pipeSegments) {
        this.pipeSegments = pipeSegments;
    }

    public double getExtrusionHeight() {
        return extrusionHeight;
    }

    public void setExtrusionHeight(double extrusionHeight) {
        this.extrusionHeight = extrusionHeight;
    }

    public List<String> getPointHeightFields() {
        return pointHeightFields;
    }

    public void setPointHeightFields(List<String> pointHeightFields) {
        this.pointHeightFields = pointHeightFields;
    }

    public List<String> getPipeRadiusFields() {
        return pipeRadiusFields;
    }

    public void setPipeRadiusFields(List<String> pipeRadiusFields) {
        this.pipeRadiusFields = pipeRadiusFields;
    }

    public List<String> getExtrusionHeightFields() {
        return extrusionHeightFields;
    }

    public void setExtrusionHeightFields(List<String> extrusionHeightFields) {
        this.extrusionHeightFields = extrusionHeightFields;
    }

    public boolean isUseZ() {
        return useZ;
    }

    public void setUseZ(boolean useZ) {
        this.useZ = useZ;
    }

    public double getBaseElevation() {
        return baseElevation;
    }

    public void setBaseElevation(double baseElevation) {
        this.baseElevation = baseElevation;
    }

    public boolean isPolygonCentroidMarkers() {
        return polygonCentroidMarkers;
    }

    public void setPolygonCentroidMarkers(boolean polygonCentroidMarkers) {
        this.polygonCentroidMarkers = polygonCentroidMarkers;
    }

    public double getCentroidMarkerSize() {
        return centroidMarkerSize;
    }

    public void setCentroidMarkerSize(double centroidMarkerSize) {
        this.centroidMarkerSize = centroidMarkerSize;
    }

    public String getDefaultColor() {
        return defaultColor;
    }

    public void setDefaultColor(String defaultColor) {
        this.defaultColor = defaultColor;
    }

    public String getDefaultCategory() {
        return defaultCategory;
    }

    public void setDefaultCategory(String defaultCategory) {
        this.defaultCategory = defaultCategory;
    }

    public String getPropertySetName() {
        return propertySetName;
    }

    public void setPropertySetName(String propertySetName) {
        this.propertySetName = propertySetName;
    }

    public Representation getRepresentation() {
        return representation;
    }

    public void setRepresentation(Representation representation) {
        this.representation = representation;
    }

    public Project getProject() {
        return project;
    }

    public void setProject(Project project) {
        this.project = project;
    }

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    /**
     * 写入 IFC 的项目元数据（{@code app.convert.project.*}）。
     */
    public static class Project {

        @NotBlank
        private String name = "GIS2BIM Project";

        private String description;

        @NotBlank
        private String siteName = "Site";

        @NotBlank
        private String buildingName = "Building";

        private String ownerGivenName;

        private String ownerFamilyName;

        private String organization;

        public ProjectInfo toProjectInfo() {
            return new ProjectInfo(name, description, siteName, buildingName, ownerGivenName, ownerFamilyName,
                    organization, ProjectInfo.DEFAULT_APPLICATION_NAME, ProjectInfo.DEFAULT_APPLICATION_VERSION);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getSiteName() {
            return siteName;
        }

        public void setSiteName(String siteName) {
            this.siteName = siteName;
        }

        public String getBuildingName() {
            return buildingName;
        }

        public void setBuildingName(String buildingName) {
            this.buildingName = buildingName;
        }

        public String getOwnerGivenName() {
            return ownerGivenName;
        }

        public void setOwnerGivenName(String ownerGivenName) {
            this.ownerGivenName = ownerGivenName;
        }

        public String getOwnerFamilyName() {
            return ownerFamilyName;
        }

        public void setOwnerFamilyName(String ownerFamilyName) {
            this.ownerFamilyName = ownerFamilyName;
        }

        public String getOrganization() {
            return organization;
        }

        public void setOrganization(String organization) {
            this.organization = organization;
        }
    }
}
