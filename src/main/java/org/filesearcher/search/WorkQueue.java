package org.filesearcher.search;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 枚举线程（单生产者）与工作线程（多消费者）之间的分发队列。
 * <p>
 * 消费者在队列暂时为空且生产者尚未结束时，每轮最多等待 {@code pollBackoff} 后重试；
 * 生产者调用 {@link #complete()} 且队列已取空后，{@link #take(CancellationToken)} 返回 null，消费者据此退出。
 */
public class WorkQueue {

    private final BlockingQueue<Path> queue;
    private final long backoffNanos;
    private volatile boolean producerDone;

    /**
     * @param capacity    队列容量，0 表示不限
     * @param pollBackoff 单轮等待时长
     */
    public WorkQueue(int capacity, Duration pollBackoff) {
        this.queue = capacity > 0 ? new LinkedBlockingQueue<>(capacity) : new LinkedBlockingQueue<>();
        this.backoffNanos = pollBackoff.toNanos();
    }

    /**
     * 入队；有界队列已满时分段等待，期间检查取消信号。
     *
     * @return false 表示已取消，元素未入队
     */
    public boolean put(Path path, CancellationToken token) throws InterruptedException {
        while (!token.isCancellationRequested()) {
            if (queue.offer(path, backoffNanos, TimeUnit.NANOSECONDS)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 标记生产者已结束（正常结束或取消均需调用）。
     */
    public void complete() {
        producerDone = true;
    }

    public boolean isProducerDone() {
        return producerDone;
    }

    /**
     * 取下一个待处理路径。
     *
     * @return 下一个路径；生产者已结束且队列已空、或已取消时返回 null
     */
    public Path take(CancellationToken token) throws InterruptedException {
        while (!token.isCancellationRequested()) {
            // 先读结束标记再取元素：保证“看到结束 + 取不到”时队列确实已空
            boolean done = producerDone;
            Path next = queue.poll();
            if (next != null) {
                return next;
            }
            if (done) {
                return null;
            }
            next = queue.poll(backoffNanos, TimeUnit.NANOSECONDS);
            if (next != null) {
                return next;
            }
        }
        return null;
    }

    public int size() {
        return queue.size();
    }
}
