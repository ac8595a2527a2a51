package org.filesearcher.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 线程安全的结果收集器：按绝对路径去重，结束时复制并排序。
 */
public class ResultAggregator {

    /**
     * 按文件名（不区分大小写，再区分大小写）排序，同名按路径排序，保证结果确定。
     */
    public static final Comparator<SearchMatch> ORDER = Comparator
            .comparing(SearchMatch::name, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(SearchMatch::name)
            .thenComparing(SearchMatch::path);

    private final Set<String> seenPaths = ConcurrentHashMap.newKeySet();
    private final ConcurrentLinkedQueue<SearchMatch> matches = new ConcurrentLinkedQueue<>();

    /**
     * @return false 表示该路径已存在，本次未加入
     */
    public boolean add(SearchMatch match) {
        if (!seenPaths.add(match.path())) {
            return false;
        }
        matches.add(match);
        return true;
    }

    public int size() {
        return matches.size();
    }

    public List<SearchMatch> sortedResults() {
        List<SearchMatch> result = new ArrayList<>(matches);
        result.sort(ORDER);
        return result;
    }
}
