package org.filesearcher.filesystem;

import org.filesearcher.filesystem.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 搜索起点解析器：只允许从 {@code app.search.roots} 白名单中的目录（及其子目录）开始搜索。
 * <p>
 * 起点必须落在所选 root 之内（不接受 {@code ../} 越界），且必须是已存在的目录；
 * 未开启 {@code allow-symlink} 时，root 以下的任何一级都不能是符号链接，开启后也不能通过链接指向 root 之外。
 */
public class SecurePathResolver {

    private final boolean allowSymlink;
    private final List<Root> roots;

    public SecurePathResolver(FileSearchProperties properties) {
        this.allowSymlink = properties.isAllowSymlink();
        this.roots = configuredRoots(properties.getRoots());
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.path().toString()));
        }
        return result;
    }

    /**
     * 解析搜索起点。
     *
     * @param rootId    根目录标识；为空时使用 root0
     * @param inputPath 相对 root 的路径，或位于该 root 之下的绝对路径；为空表示 root 本身
     * @throws IllegalArgumentException 路径越界、不存在、不是目录或经由链接逃逸
     * @throws IllegalStateException    未配置任何 root，或 root 本身无法访问
     */
    public ResolvedPath resolveDirectory(String rootId, String inputPath) {
        Root root = selectRoot(rootId);
        Path target = toTarget(root, inputPath);
        if (!target.startsWith(root.path())) {
            throw new IllegalArgumentException("路径不在允许搜索的根目录范围内：" + inputPath);
        }
        if (!Files.isDirectory(target)) {
            throw new IllegalArgumentException("搜索起点不存在或不是目录：" + target);
        }
        checkNoEscape(root, target);

        String display = root.path().relativize(target).toString().replace('\\', '/');
        return new ResolvedPath(root.id(), root.path(), target, display);
    }

    private Root selectRoot(String rootId) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许搜索的根目录（app.search.roots）");
        }
        if (rootId == null || rootId.isBlank()) {
            return roots.get(0);
        }
        String id = rootId.trim();
        return roots.stream()
                .filter(r -> r.id().equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的 rootId：" + rootId));
    }

    private static Path toTarget(Root root, String inputPath) {
        if (inputPath == null || inputPath.isBlank()) {
            return root.path();
        }
        try {
            Path raw = Path.of(inputPath.trim());
            return (raw.isAbsolute() ? raw : root.path().resolve(raw)).normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("路径格式不合法：" + inputPath, e);
        }
    }

    private void checkNoEscape(Root root, Path target) {
        Path rootReal;
        Path targetReal;
        try {
            rootReal = root.path().toRealPath();
            targetReal = target.toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("路径无法解析：" + target, e);
        }
        if (!targetReal.startsWith(rootReal)) {
            throw new IllegalArgumentException("路径通过链接逃逸出根目录：" + target);
        }
        if (allowSymlink) {
            return;
        }
        // 逐级检查，中间某一级是链接（即使仍指向 root 内部）也拒绝
        Path current = root.path();
        for (Path segment : root.path().relativize(target)) {
            if (segment.toString().isEmpty()) {
                continue;
            }
            current = current.resolve(segment);
            if (Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
        }
    }

    private static List<Root> configuredRoots(List<String> configured) {
        if (configured == null) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.search.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private record Root(String id, Path path) {
    }

    public record ResolvedPath(String rootId, Path rootPath, Path absolutePath, String displayPath) {
    }
}
