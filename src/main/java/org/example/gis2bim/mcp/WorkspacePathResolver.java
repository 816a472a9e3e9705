package org.example.gis2bim.mcp;

import org.example.gis2bim.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 把 MCP 工具传入的路径解析为根目录白名单内的绝对路径。
 * <p>
 * 相对路径从 rootId 指定的根目录（默认 root0）解析；绝对路径匹配层级最深的根目录。
 * 路径穿越（{@code ../}）与经由符号链接/junction 的逃逸都会被拒绝。
 */
public class WorkspacePathResolver {

    private final List<Root> roots;

    public WorkspacePathResolver(List<String> configuredRoots) {
        this.roots = normalizeRoots(configuredRoots);
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.path().toString()));
        }
        return result;
    }

    /**
     * @param requireExists 为 true 时目标必须已存在（读取）；为 false 时只校验已存在的父目录链（写出）
     */
    public ResolvedPath resolve(String rootId, String inputPath, boolean requireExists) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.convert.roots）");
        }
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("路径不能为空");
        }
        Path raw = Path.of(inputPath);
        Root root;
        Path absolute;
        if (raw.isAbsolute()) {
            absolute = raw.normalize();
            root = (rootId == null || rootId.isBlank()) ? bestRootFor(absolute) : rootById(rootId);
        } else {
            root = (rootId == null || rootId.isBlank()) ? roots.get(0) : rootById(rootId);
            absolute = root.path().resolve(raw).normalize();
        }
        if (!absolute.startsWith(root.path())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }
        if (requireExists && !Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + inputPath);
        }
        checkNoEscape(root, absolute);
        return new ResolvedPath(root.id(), root.path(), absolute, root.path().relativize(absolute).toString().replace('\\', '/'));
    }

    private static void checkNoEscape(Root root, Path absolute) {
        Path rootReal;
        try {
            rootReal = root.path().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.path(), e);
        }
        // 逐级检查已存在的路径段，任何一级是链接或解析到根目录之外都拒绝
        Path current = root.path();
        for (Path segment : root.path().relativize(absolute)) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            if (Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
            try {
                if (!current.toRealPath().startsWith(rootReal)) {
                    throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + current);
                }
            } catch (IOException e) {
                throw new IllegalArgumentException("路径无法解析：" + current, e);
            }
        }
    }

    private Root rootById(String rootId) {
        return roots.stream()
                .filter(r -> r.id().equals(rootId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的 rootId：" + rootId));
    }

    private Root bestRootFor(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.path()))
                .max(Comparator.comparingInt(r -> r.path().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.convert.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private record Root(String id, Path path) {
    }

    /**
     * @param rootId       命中的根目录
     * @param rootPath     根目录绝对路径
     * @param absolutePath 绝对路径
     * @param displayPath  相对根目录的路径（'/' 分隔）
     */
    public record ResolvedPath(String rootId, Path rootPath, Path absolutePath, String displayPath) {
    }
}
