package org.filesearcher.search;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 协作式取消信号。
 * <p>
 * 由调用方持有并在任意线程调用 {@link #cancel()}；枚举器与工作线程只在安全点（出队、进入目录、逐行扫描）轮询它，
 * 不会中断正在进行的系统调用。
 */
public final class CancellationToken {

    private final AtomicBoolean canceled = new AtomicBoolean(false);

    public void cancel() {
        canceled.set(true);
    }

    public boolean isCancellationRequested() {
        return canceled.get();
    }

    /**
     * 已取消时抛出 {@link SearchCanceledException}。
     */
    public void throwIfCancellationRequested() throws SearchCanceledException {
        if (canceled.get()) {
            throw new SearchCanceledException();
        }
    }
}
