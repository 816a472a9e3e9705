package org.example.gis2bim.conversion.model;

/**
 * 项目元数据：写进 IfcProject / IfcSite / IfcBuilding 的名称以及 IfcOwnerHistory 的所有者信息。
 */
public record ProjectInfo(
        String projectName,
        String description,
        String siteName,
        String buildingName,
        String ownerGivenName,
        String ownerFamilyName,
        String organization,
        String applicationName,
        String applicationVersion
) {

    public static final String DEFAULT_APPLICATION_NAME = "gis2bim";
    public static final String DEFAULT_APPLICATION_VERSION = "1.0.0";

    public ProjectInfo {
        if (projectName == null || projectName.isBlank()) {
            throw new IllegalArgumentException("项目名称不能为空");
        }
    }

    public static ProjectInfo named(String projectName) {
        return new ProjectInfo(projectName, null, "Site", "Building", null, null, null,
                DEFAULT_APPLICATION_NAME, DEFAULT_APPLICATION_VERSION);
    }
}
