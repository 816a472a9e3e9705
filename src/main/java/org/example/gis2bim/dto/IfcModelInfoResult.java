package org.example.gis2bim.dto;

import java.util.List;

/**
 * {@code ifc_read_model_info} 的返回结果。
 *
 * @param rootId              根目录标识
 * @param path                统一后的路径（使用 '/' 分隔）
 * @param fileDescriptions    {@code FILE_DESCRIPTION} 的 description 列表
 * @param implementationLevel {@code FILE_DESCRIPTION} 的实现级别
 * @param fileName            {@code FILE_NAME} 的 name
 * @param timeStamp           {@code FILE_NAME} 的 time_stamp
 * @param authors             {@code FILE_NAME} 的 author 列表
 * @param organizations       {@code FILE_NAME} 的 organization 列表
 * @param originatingSystem   {@code FILE_NAME} 的 originating_system
 * @param schemas             {@code FILE_SCHEMA} 列表（例如 IFC2X3）
 * @param projectName         IfcProject 的 Name
 * @param entityCount         DATA 段实体总数
 * @param storeyCount         IfcBuildingStorey 数量
 * @param elementCount        IfcBuildingElementProxy 数量
 * @param topEntityTypes      实体类型计数 Top 列表
 * @param warnings            非致命告警
 */
public record IfcModelInfoResult(
        String rootId,
        String path,
        List<String> fileDescriptions,
        String implementationLevel,
        String fileName,
        String timeStamp,
        List<String> authors,
        List<String> organizations,
        String originatingSystem,
        List<String> schemas,
        String projectName,
        int entityCount,
        int storeyCount,
        int elementCount,
        List<EntityTypeCount> topEntityTypes,
        List<String> warnings
) {
}
