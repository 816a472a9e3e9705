package org.example.gis2bim.conversion.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 读取 IFC（STEP 物理文件）的概要信息：HEADER 字段、项目名称、DATA 段实体类型计数。
 * <p>
 * 只做线性扫描，不建立实体引用图；文件不规范时尽量给出部分结果，并在 warnings 中说明。
 */
public final class IfcModelInspector {

    private static final Pattern HEADER_START = Pattern.compile("(?is)\\bHEADER\\b\\s*;");
    private static final Pattern DATA_START = Pattern.compile("(?is)\\bDATA\\b\\s*;");
    private static final Pattern ENDSEC = Pattern.compile("(?is)\\bENDSEC\\b\\s*;");
    private static final Pattern ENTITY_HEAD = Pattern.compile("#(\\d+)\\s*=\\s*([A-Za-z0-9_]+)\\s*\\(");

    private IfcModelInspector() {
    }

    /**
     * @param entityTypeCounts 实体类型（大写）→ 数量，按类型名排序
     */
    public record IfcModelInfo(
            List<String> fileDescriptions,
            String implementationLevel,
            String fileName,
            String timeStamp,
            List<String> authors,
            List<String> organizations,
            String preprocessorVersion,
            String originatingSystem,
            List<String> schemas,
            String projectName,
            int entityCount,
            Map<String, Integer> entityTypeCounts,
            List<String> warnings
    ) {

        public int count(String entityType) {
            return entityTypeCounts.getOrDefault(entityType.toUpperCase(Locale.ROOT), 0);
        }

        /**
         * 数量最多的若干类型（同数量按名称）。
         */
        public Map<String, Integer> topEntityTypes(int limit) {
            Map<String, Integer> out = new LinkedHashMap<>();
            entityTypeCounts.entrySet().stream()
                    .sorted(Comparator.<Map.Entry<String, Integer>>comparingInt(Map.Entry::getValue).reversed()
                            .thenComparing(Map.Entry::getKey))
                    .limit(Math.max(0, limit))
                    .forEach(e -> out.put(e.getKey(), e.getValue()));
            return out;
        }
    }

    public static IfcModelInfo read(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.ISO_8859_1));
        } catch (IOException e) {
            throw new UncheckedIOException("读取 IFC 文件失败：" + file, e);
        }
    }

    public static IfcModelInfo parse(String stepText) {
        List<String> warnings = new ArrayList<>();
        if (stepText == null || stepText.isBlank()) {
            warnings.add("IFC 内容为空，无法解析。");
            return new IfcModelInfo(List.of(), null, null, null, List.of(), List.of(), null, null, List.of(), null, 0,
                    Map.of(), warnings);
        }
        if (!stepText.stripLeading().startsWith("ISO-10303-21")) {
            warnings.add("文件不是以 ISO-10303-21; 开头，可能不是 STEP 物理文件。");
        }

        List<String> fileDescriptions = List.of();
        String implementationLevel = null;
        String fileName = null;
        String timeStamp = null;
        List<String> authors = List.of();
        List<String> organizations = List.of();
        String preprocessorVersion = null;
        String originatingSystem = null;
        List<String> schemas = List.of();

        String header = section(stepText, HEADER_START, warnings, "HEADER");
        if (header != null) {
            List<String> args = statementArgs(header, "FILE_DESCRIPTION");
            if (args == null) {
                warnings.add("未找到 FILE_DESCRIPTION。");
            } else {
                fileDescriptions = StepText.stringLiterals(arg(args, 0));
                implementationLevel = StepText.firstStringLiteral(arg(args, 1));
            }
            args = statementArgs(header, "FILE_NAME");
            if (args == null) {
                warnings.add("未找到 FILE_NAME。");
            } else {
                fileName = StepText.firstStringLiteral(arg(args, 0));
                timeStamp = StepText.firstStringLiteral(arg(args, 1));
                authors = StepText.stringLiterals(arg(args, 2));
                organizations = StepText.stringLiterals(arg(args, 3));
                preprocessorVersion = StepText.firstStringLiteral(arg(args, 4));
                originatingSystem = StepText.firstStringLiteral(arg(args, 5));
            }
            args = statementArgs(header, "FILE_SCHEMA");
            if (args == null) {
                warnings.add("未找到 FILE_SCHEMA。");
            } else {
                schemas = StepText.stringLiterals(arg(args, 0));
            }
        }

        Map<String, Integer> counts = new TreeMap<>();
        String projectName = null;
        int entityCount = 0;
        String data = section(stepText, DATA_START, warnings, "DATA");
        if (data != null) {
            Matcher m = ENTITY_HEAD.matcher(data);
            int from = 0;
            while (m.find(from)) {
                String type = m.group(2).toUpperCase(Locale.ROOT);
                int open = m.end() - 1;
                int close = StepText.matchingParen(data, open);
                if (close < 0) {
                    warnings.add("实体 #" + m.group(1) + " 括号不匹配，已停止扫描。");
                    break;
                }
                entityCount++;
                counts.merge(type, 1, Integer::sum);
                if (projectName == null && "IFCPROJECT".equals(type)) {
                    // IfcProject(GlobalId, OwnerHistory, Name, ...)
                    projectName = StepText.firstStringLiteral(arg(StepText.splitArgs(data.substring(open + 1, close)), 2));
                }
                from = close + 1;
            }
            if (entityCount > 0 && projectName == null && !counts.containsKey("IFCPROJECT")) {
                warnings.add("未找到 IFCPROJECT。");
            }
        }

        return new IfcModelInfo(fileDescriptions, implementationLevel, fileName, timeStamp, authors, organizations,
                preprocessorVersion, originatingSystem, schemas, projectName, entityCount, counts, warnings);
    }

    private static String section(String text, Pattern start, List<String> warnings, String name) {
        Matcher m = start.matcher(text);
        if (!m.find()) {
            warnings.add("未找到 " + name + " 段。");
            return null;
        }
        Matcher end = ENDSEC.matcher(text);
        end.region(m.end(), text.length());
        if (!end.find()) {
            warnings.add(name + " 段缺少 ENDSEC;，结果可能不完整。");
            return text.substring(m.end());
        }
        return text.substring(m.end(), end.start());
    }

    private static List<String> statementArgs(String header, String keyword) {
        Matcher m = Pattern.compile("(?is)\\b" + keyword + "\\b\\s*\\(").matcher(header);
        if (!m.find()) {
            return null;
        }
        int open = m.end() - 1;
        int close = StepText.matchingParen(header, open);
        if (close < 0) {
            return null;
        }
        return StepText.splitArgs(header.substring(open + 1, close));
    }

    private static String arg(List<String> args, int index) {
        return index < args.size() ? args.get(index) : null;
    }
}
