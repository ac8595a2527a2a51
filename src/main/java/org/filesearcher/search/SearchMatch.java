package org.filesearcher.search;

import java.time.Instant;

/**
 * 单个命中文件。
 *
 * @param name           文件名（不含目录）
 * @param path           绝对路径
 * @param extension      扩展名（保留原始大小写，含前导点；无扩展名时为空串）
 * @param size           文件大小（字节）
 * @param lastModified   最后修改时间
 * @param attributes     平台相关的属性描述（POSIX 权限或 DOS 标志）
 * @param previewSnippet 内容片段（仅在指定了内容关键字且命中时存在，否则为 null）
 */
public record SearchMatch(
        String name,
        String path,
        String extension,
        long size,
        Instant lastModified,
        String attributes,
        String previewSnippet
) {
}
