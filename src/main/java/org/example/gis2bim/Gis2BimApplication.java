package org.example.gis2bim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class Gis2BimApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(Gis2BimApplication.class, args);
    }

    /**
     * 提前创建日志目录，规则与 logback-spring.xml 一致：系统属性/环境变量 LOG_PATH，默认 ./logs。
     * <p>
     * stdout 专用于 MCP stdio 协议，失败信息只能写到 stderr。
     */
    private static void ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (IOException e) {
            System.err.println("创建日志目录失败：" + logPath + "（" + e.getMessage() + "）");
        }
    }
}
