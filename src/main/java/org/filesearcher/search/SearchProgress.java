package org.filesearcher.search;

/**
 * 搜索进度快照。
 *
 * @param totalFiles     已知的文件总数（不预先统计，恒为 0）
 * @param processedFiles 已处理的文件数（单次搜索内单调不减）
 * @param message        状态文本
 */
public record SearchProgress(long totalFiles, long processedFiles, String message) {
}
