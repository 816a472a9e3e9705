package org.example.gis2bim.conversion.feature;

import org.example.gis2bim.conversion.model.ModelGraph;

import java.util.List;

/**
 * 一批要素的转换结果：完成的模型、成功/跳过数量、告警。
 * <p>
 * 没有告警为完全成功；有告警但模型可用为部分成功。
 */
public record ConversionReport(ModelGraph graph, int convertedCount, int skippedCount, List<ConversionWarning> warnings) {

    public ConversionReport {
        warnings = List.copyOf(warnings);
    }

    public boolean fullySuccessful() {
        return warnings.isEmpty();
    }
}
