package org.filesearcher.search;

/**
 * 搜索被取消（预期内的终止状态，不是错误）。
 * <p>
 * 抛出该异常时不会返回任何部分结果。
 */
public class SearchCanceledException extends Exception {

    public SearchCanceledException() {
        super("搜索已取消");
    }
}
