package org.filesearcher.search;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 进度汇总：每处理完一个文件递增计数，并同步通知接收方。
 * <p>
 * 通知在锁内串行执行，保证接收方看到的已处理数单调不减。
 */
public class ProgressReporter {

    private final SearchProgressListener listener;
    private final AtomicLong processed = new AtomicLong();
    private final Object lock = new Object();

    public ProgressReporter(SearchProgressListener listener) {
        this.listener = (listener == null) ? SearchProgressListener.NONE : listener;
    }

    public void started() {
        publish(new SearchProgress(0, 0, "正在枚举文件..."));
    }

    public void fileProcessed() {
        synchronized (lock) {
            long count = processed.incrementAndGet();
            listener.onProgress(new SearchProgress(0, count, "已处理 " + count + " 个文件"));
        }
    }

    public long processedCount() {
        return processed.get();
    }

    private void publish(SearchProgress progress) {
        synchronized (lock) {
            listener.onProgress(progress);
        }
    }
}
