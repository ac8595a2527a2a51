package org.filesearcher.mcp;

import org.filesearcher.search.SearchProgress;
import org.filesearcher.search.SearchProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 把引擎进度写入日志的接收方（节流：每 {@code logEvery} 个文件输出一条 DEBUG）。
 * <p>
 * 同时记录最近一次的已处理数，供工具返回结果使用（包括被取消的搜索）。
 */
class LoggingProgressListener implements SearchProgressListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    private final String label;
    private final long logEvery;
    private volatile long processedFiles;

    LoggingProgressListener(String label, long logEvery) {
        this.label = label;
        this.logEvery = Math.max(1, logEvery);
    }

    @Override
    public void onProgress(SearchProgress progress) {
        processedFiles = progress.processedFiles();
        if (progress.processedFiles() == 0 || progress.processedFiles() % logEvery == 0) {
            log.debug("[{}] {}", label, progress.message());
        }
    }

    long processedFiles() {
        return processedFiles;
    }
}
