package org.filesearcher.filesystem.dto;

/**
 * {@code fs_search_files} 的单条命中。
 *
 * @param name           文件名
 * @param path           文件路径（相对 root 的路径，统一使用 / 分隔）
 * @param absolutePath   绝对路径
 * @param extension      扩展名（保留原始大小写；无扩展名时为空串）
 * @param size           文件大小（字节）
 * @param modified       最后修改时间（ISO-8601）
 * @param attributes     属性描述（POSIX 权限或 DOS 标志）
 * @param previewSnippet 内容片段（仅内容搜索命中时返回）
 */
public record FileSearchHit(
        String name,
        String path,
        String absolutePath,
        String extension,
        long size,
        String modified,
        String attributes,
        String previewSnippet
) {
}
