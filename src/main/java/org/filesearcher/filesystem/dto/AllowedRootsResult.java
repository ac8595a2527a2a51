package org.filesearcher.filesystem.dto;

import java.util.List;

/**
 * {@code fs_list_roots} 的返回结果。
 *
 * @param roots 允许搜索的根目录白名单
 */
public record AllowedRootsResult(List<AllowedRoot> roots) {
}
