package org.example.gis2bim.conversion;

import org.example.gis2bim.conversion.feature.ConversionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.nio.file.Path;

/**
 * 命令行批量模式：配置了 {@code app.convert.input-folder} 时，启动后执行一次目录转换。
 */
public class ConversionRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ConversionRunner.class);

    private final ConversionService conversionService;
    private final ConversionProperties properties;

    public ConversionRunner(ConversionService conversionService, ConversionProperties properties) {
        this.conversionService = conversionService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        Path style = (properties.getStyleFile() == null || properties.getStyleFile().isBlank())
                ? null
                : Path.of(properties.getStyleFile());
        ConversionOutcome outcome = conversionService.convertFolder(new ConversionRequest(
                Path.of(properties.getInputFolder()),
                Path.of(properties.getOutputFile()),
                style,
                null));
        ConversionReport report = outcome.report();
        if (report.fullySuccessful()) {
            log.info("批量转换成功：{}", outcome.outputFile());
        } else {
            log.warn("批量转换部分成功：{}（跳过 {} 个要素，告警 {} 条）",
                    outcome.outputFile(), report.skippedCount(), report.warnings().size());
        }
    }
}
