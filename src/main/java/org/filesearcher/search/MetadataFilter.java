package org.filesearcher.search;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * 元数据过滤：扩展名 + 修改时间区间 + 文件名通配符，三者取“与”。
 * <p>
 * 未设置的条件直接放行；该过滤在读取任何文件内容之前执行。
 */
public final class MetadataFilter {

    private final Set<String> extensions;
    private final Instant dateFrom;
    private final Instant dateTo;
    private final WildcardMatcher nameMatcher;

    public MetadataFilter(SearchOptions options) {
        this.extensions = options.extensions();
        this.dateFrom = options.dateFrom();
        this.dateTo = options.dateTo();
        this.nameMatcher = WildcardMatcher.compile(options.nameFilter());
    }

    /**
     * @param fileName     文件名（不含目录）
     * @param lastModified 最后修改时间
     */
    public boolean test(String fileName, Instant lastModified) {
        if (extensions != null && !extensions.contains(extensionOf(fileName).toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (dateFrom != null && lastModified.isBefore(dateFrom)) {
            return false;
        }
        if (dateTo != null && lastModified.isAfter(dateTo)) {
            return false;
        }
        return nameMatcher.matches(fileName);
    }

    /**
     * 取文件名的扩展名（含前导点，保留原始大小写）；没有点或以点结尾时返回空串。
     */
    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot);
    }
}
