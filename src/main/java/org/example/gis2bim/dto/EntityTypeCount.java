package org.example.gis2bim.dto;

/**
 * IFC 实体类型计数。
 */
public record EntityTypeCount(String type, int count) {
}
