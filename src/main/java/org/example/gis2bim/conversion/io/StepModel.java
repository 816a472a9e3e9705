package org.example.gis2bim.conversion.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 可编辑的 STEP 物理文件：DATA 段按实体编号建索引，支持追加新实体和整体替换已有实体的参数。
 * <p>
 * 写回时原文逐字保留，只有被替换的实体改写、追加的实体插在 DATA 段的 ENDSEC 之前，
 * 因此 HEADER、注释和未触及的实体都不会变化。文件按 ISO-8859-1 读写，字节原样往返。
 */
public final class StepModel {

    private static final Logger log = LoggerFactory.getLogger(StepModel.class);

    private static final Pattern DATA_START = Pattern.compile("(?is)\\bDATA\\b\\s*;");
    private static final Pattern ENDSEC = Pattern.compile("(?is)\\bENDSEC\\b\\s*;");
    private static final Pattern ENTITY_HEAD = Pattern.compile("#(\\d+)\\s*=\\s*([A-Za-z0-9_]+)\\s*\\(");

    /**
     * DATA 段中的一个实体。
     *
     * @param type 大写实体类型
     * @param args 最外层参数的原始文本（未解码）
     */
    public record Entity(int id, String type, List<String> args) {

        public String arg(int index) {
            return index < args.size() ? args.get(index) : StepText.NULL;
        }

        public int refArg(int index) {
            return StepText.refOf(arg(index));
        }

        public List<Integer> refListArg(int index) {
            return StepText.refList(arg(index));
        }

        public String stringArg(int index) {
            return StepText.firstStringLiteral(arg(index));
        }

        public boolean is(String entityType) {
            return type.equals(entityType.toUpperCase(Locale.ROOT));
        }
    }

    private record Span(int start, int end) {
    }

    private final String text;
    private final int dataEnd;
    private final TreeMap<Integer, Entity> entities;
    private final Map<Integer, Span> spans;
    private final Map<Integer, Entity> replaced = new LinkedHashMap<>();
    private final List<Entity> appended = new ArrayList<>();
    private int nextId;

    private StepModel(String text, int dataEnd, TreeMap<Integer, Entity> entities, Map<Integer, Span> spans) {
        this.text = text;
        this.dataEnd = dataEnd;
        this.entities = entities;
        this.spans = spans;
        this.nextId = entities.isEmpty() ? 1 : entities.lastKey() + 1;
    }

    public static StepModel read(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.ISO_8859_1));
        } catch (IOException e) {
            throw new UncheckedIOException("读取 IFC 文件失败：" + file, e);
        }
    }

    /**
     * @throws IllegalArgumentException 没有 DATA 段，或实体括号不匹配
     */
    public static StepModel parse(String stepText) {
        if (stepText == null) {
            throw new IllegalArgumentException("STEP 内容为空");
        }
        Matcher start = DATA_START.matcher(stepText);
        if (!start.find()) {
            throw new IllegalArgumentException("未找到 DATA 段");
        }
        Matcher end = ENDSEC.matcher(stepText);
        end.region(start.end(), stepText.length());
        if (!end.find()) {
            throw new IllegalArgumentException("DATA 段缺少 ENDSEC;");
        }
        int dataEnd = end.start();

        TreeMap<Integer, Entity> entities = new TreeMap<>();
        Map<Integer, Span> spans = new LinkedHashMap<>();
        Matcher m = ENTITY_HEAD.matcher(stepText);
        int from = start.end();
        while (from < dataEnd && m.find(from)) {
            if (m.start() >= dataEnd) {
                break;
            }
            int id = Integer.parseInt(m.group(1));
            int open = m.end() - 1;
            int close = StepText.matchingParen(stepText, open);
            if (close < 0 || close >= dataEnd) {
                throw new IllegalArgumentException("实体 #" + id + " 括号不匹配");
            }
            int semicolon = stepText.indexOf(';', close);
            int spanEnd = (semicolon < 0 || semicolon >= dataEnd) ? close + 1 : semicolon + 1;
            String type = m.group(2).toUpperCase(Locale.ROOT);
            Entity entity = new Entity(id, type, List.copyOf(StepText.splitArgs(stepText.substring(open + 1, close))));
            if (entities.put(id, entity) != null) {
                throw new IllegalArgumentException("实体编号重复：#" + id);
            }
            spans.put(id, new Span(m.start(), spanEnd));
            from = spanEnd;
        }
        log.debug("STEP 已解析：entities={}", entities.size());
        return new StepModel(stepText, dataEnd, entities, spans);
    }

    public int size() {
        return entities.size() + appended.size();
    }

    /**
     * 按编号取实体（追加、替换后的状态）。
     */
    public Optional<Entity> get(int id) {
        Entity entity = replaced.get(id);
        if (entity == null) {
            entity = entities.get(id);
        }
        if (entity == null && id >= firstAppendedId()) {
            int index = id - firstAppendedId();
            entity = index < appended.size() ? appended.get(index) : null;
        }
        return Optional.ofNullable(entity);
    }

    /**
     * 某类型的全部原有实体（按编号顺序），不含追加的实体。
     */
    public List<Entity> ofType(String type) {
        String upper = type.toUpperCase(Locale.ROOT);
        List<Entity> out = new ArrayList<>();
        for (Integer id : entities.keySet()) {
            Entity entity = get(id).orElseThrow();
            if (entity.type().equals(upper)) {
                out.add(entity);
            }
        }
        return out;
    }

    public List<Entity> entities() {
        return Collections.unmodifiableList(new ArrayList<>(entities.values()));
    }

    /**
     * 追加实体，返回新编号。参数为已编码的 STEP 文本。
     */
    public int append(String type, String... args) {
        int id = nextId++;
        appended.add(new Entity(id, type.toUpperCase(Locale.ROOT), List.of(args)));
        return id;
    }

    /**
     * 替换实体的全部参数（类型不变），原有实体和追加的实体都可以替换。
     *
     * @throws IllegalArgumentException 实体不存在
     */
    public void replace(int id, String... args) {
        Entity original = entities.get(id);
        if (original != null) {
            replaced.put(id, new Entity(id, original.type(), List.of(args)));
            return;
        }
        int index = id - firstAppendedId();
        if (index < 0 || index >= appended.size()) {
            throw new IllegalArgumentException("实体不存在：#" + id);
        }
        appended.set(index, new Entity(id, appended.get(index).type(), List.of(args)));
    }

    public boolean isModified() {
        return !replaced.isEmpty() || !appended.isEmpty();
    }

    public String toStepText() {
        List<Integer> ordered = new ArrayList<>(replaced.keySet());
        ordered.sort(Comparator.comparingInt(id -> spans.get(id).start()));
        StringBuilder out = new StringBuilder(text.length() + appended.size() * 64);
        int cursor = 0;
        for (Integer id : ordered) {
            Span span = spans.get(id);
            out.append(text, cursor, span.start());
            appendEntity(out, replaced.get(id));
            cursor = span.end();
        }
        out.append(text, cursor, dataEnd);
        for (Entity entity : appended) {
            appendEntity(out, entity);
            out.append('\n');
        }
        out.append(text, dataEnd, text.length());
        return out.toString();
    }

    public void write(Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, toStepText(), StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new UncheckedIOException("写出 IFC 文件失败：" + output, e);
        }
        log.info("IFC 文件已写出：path={}, replaced={}, appended={}", output, replaced.size(), appended.size());
    }

    private int firstAppendedId() {
        return nextId - appended.size();
    }

    private static void appendEntity(StringBuilder out, Entity entity) {
        out.append('#').append(entity.id()).append('=').append(entity.type()).append('(');
        for (int i = 0; i < entity.args().size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append(entity.args().get(i));
        }
        out.append(");");
    }
}
