package org.example.gis2bim.dto;

import java.util.List;

/**
 * {@code gis_list_roots} 的返回结果。
 */
public record AllowedRootsResult(List<AllowedRoot> roots) {
}
