package org.filesearcher.search;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 一次搜索的全部参数（搜索开始后不可变）。
 * <p>
 * 约定：
 * <ul>
 *   <li>{@code extensions} 为 null 或空集合表示不过滤扩展名；否则每个元素必须是小写且以点开头（例如 {@code .txt}）。</li>
 *   <li>{@code dateFrom}/{@code dateTo} 均为闭区间边界，任一为 null 表示该侧不限；“截止日期”扩展到当天结束由调用方负责。</li>
 *   <li>{@code nameFilter}/{@code contentQuery} 为空白时表示不过滤。</li>
 * </ul>
 *
 * @param rootPath     搜索起始目录
 * @param nameFilter   文件名通配符（{@code *}/{@code ?}）
 * @param extensions   规范化后的扩展名集合
 * @param dateFrom     修改时间下界（含）
 * @param dateTo       修改时间上界（含）
 * @param recurse      是否递归子目录
 * @param contentQuery 内容关键字（不区分大小写的字面量子串）
 */
public record SearchOptions(
        Path rootPath,
        String nameFilter,
        Set<String> extensions,
        Instant dateFrom,
        Instant dateTo,
        boolean recurse,
        String contentQuery
) {

    public SearchOptions {
        Objects.requireNonNull(rootPath, "rootPath 不能为空");
        if (extensions != null && extensions.isEmpty()) {
            extensions = null;
        }
        if (extensions != null) {
            for (String ext : extensions) {
                if (ext == null || !ext.startsWith(".") || ext.length() < 2
                        || !ext.equals(ext.toLowerCase(Locale.ROOT))) {
                    throw new IllegalArgumentException("扩展名必须为小写且以点开头：" + ext);
                }
            }
            extensions = Set.copyOf(extensions);
        }
    }

    /**
     * 只指定根目录、递归搜索、不带任何过滤条件。
     */
    public static SearchOptions forRoot(Path rootPath) {
        return new SearchOptions(rootPath, null, null, null, null, true, null);
    }

    public boolean hasContentQuery() {
        return contentQuery != null && !contentQuery.isBlank();
    }
}
