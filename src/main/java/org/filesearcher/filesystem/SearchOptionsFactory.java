package org.filesearcher.filesystem;

import org.filesearcher.search.SearchOptions;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * 把调用方输入的文本参数转换为 {@link SearchOptions}。
 * <p>
 * 负责引擎之外的输入规范化：
 * <ul>
 *   <li>扩展名字符串：分号/逗号分隔，前导点可省略，不区分大小写；例如 {@code "TXT; .md,log"}。</li>
 *   <li>日期边界：支持 {@code yyyy-MM-dd}、本地日期时间、带偏移的日期时间；仅日期的截止边界扩展到当天最后一纳秒。</li>
 *   <li>名称通配符与内容关键字去除首尾空白，空白视为不过滤。</li>
 * </ul>
 */
public class SearchOptionsFactory {

    private final ZoneId zone;

    public SearchOptionsFactory(ZoneId zone) {
        this.zone = zone;
    }

    public SearchOptions create(
            Path root,
            String nameFilter,
            String extensions,
            String dateFrom,
            String dateTo,
            Boolean recurse,
            String contentQuery
    ) {
        Instant from = parseBound(dateFrom, false, "dateFrom");
        Instant to = parseBound(dateTo, true, "dateTo");
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("参数错误：dateFrom 晚于 dateTo（" + dateFrom + " > " + dateTo + "）");
        }
        return new SearchOptions(
                root,
                trimToNull(nameFilter),
                parseExtensions(extensions),
                from,
                to,
                recurse == null || recurse,
                trimToNull(contentQuery)
        );
    }

    /**
     * 解析扩展名列表；空白输入返回 null（表示不过滤）。
     */
    public static Set<String> parseExtensions(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Set<String> result = new LinkedHashSet<>();
        for (String part : raw.split("[;,]")) {
            String ext = part.trim().toLowerCase(Locale.ROOT);
            if (ext.isEmpty() || ext.equals(".")) {
                continue;
            }
            result.add(ext.startsWith(".") ? ext : "." + ext);
        }
        return result.isEmpty() ? null : result;
    }

    Instant parseBound(String raw, boolean endOfDay, String field) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw.trim();
        try {
            if (text.length() == 10) {
                LocalDate date = LocalDate.parse(text);
                return endOfDay ? endOfDay(date, zone) : date.atStartOfDay(zone).toInstant();
            }
            if (text.endsWith("Z") || text.matches(".*[+-]\\d{2}:\\d{2}$")) {
                return OffsetDateTime.parse(text).toInstant();
            }
            return LocalDateTime.parse(text).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("参数错误：" + field + " 不是合法的日期（" + raw + "）", e);
        }
    }

    /**
     * 当天的最后一纳秒（闭区间上界）。
     */
    public static Instant endOfDay(LocalDate date, ZoneId zone) {
        return date.plusDays(1).atStartOfDay(zone).toInstant().minusNanos(1);
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
