package org.filesearcher.filesystem.dto;

import java.util.List;

/**
 * {@code fs_search_files} 的返回结果。
 * <p>
 * 注意：搜索被取消（例如超时）时 {@code status=CANCELED}，且不返回任何部分结果。
 *
 * @param rootId          根目录标识
 * @param basePath        本次搜索的起始目录（相对 root 的路径，统一使用 / 分隔）
 * @param status          COMPLETED / CANCELED
 * @param processedFiles  已处理的文件数
 * @param elapsedMillis   耗时（毫秒）
 * @param totalMatches    命中总数
 * @param returnedMatches 实际返回的条数（已应用 maxResults 上限）
 * @param truncated       是否因 maxResults 截断
 * @param matches         命中列表（按文件名排序）
 */
public record FileSearchToolResult(
        String rootId,
        String basePath,
        String status,
        long processedFiles,
        long elapsedMillis,
        int totalMatches,
        int returnedMatches,
        boolean truncated,
        List<FileSearchHit> matches
) {

    public static final String COMPLETED = "COMPLETED";
    public static final String CANCELED = "CANCELED";
}
