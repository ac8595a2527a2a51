package org.filesearcher.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 非索引的并发文件搜索引擎。
 * <p>
 * 一次搜索的流程：
 * <ol>
 *   <li>校验根目录（不存在或不是目录时直接失败，不启动任何线程）。</li>
 *   <li>一个枚举任务把文件路径写入 {@link WorkQueue}；同时启动固定数量的 {@link SearchWorker} 消费队列。</li>
 *   <li>按完成顺序等待枚举任务与工作线程；任一任务异常结束时立即取消其余任务。</li>
 *   <li>取消时抛出 {@link SearchCanceledException}，不返回部分结果；否则返回按名称排序的结果。</li>
 * </ol>
 * 引擎本身只持有不可变的 {@link SearchEngineSettings}；队列、结果集、线程池等每次搜索重新创建，搜索返回前线程池一定会关闭。
 */
public class FileSearchEngine {

    private static final Logger log = LoggerFactory.getLogger(FileSearchEngine.class);

    private final SearchEngineSettings settings;

    public FileSearchEngine(SearchEngineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings 不能为空");
    }

    public FileSearchEngine() {
        this(SearchEngineSettings.defaults());
    }

    public SearchEngineSettings settings() {
        return settings;
    }

    /**
     * 执行一次搜索。
     *
     * @param options  搜索参数
     * @param listener 进度接收方（可为 null）
     * @param token    取消信号（可为 null，表示不可取消）
     * @return 按名称排序的命中列表
     * @throws SearchCanceledException  搜索被取消
     * @throws IllegalArgumentException 根目录不存在或不是目录
     */
    public List<SearchMatch> search(SearchOptions options, SearchProgressListener listener, CancellationToken token)
            throws SearchCanceledException {
        Objects.requireNonNull(options, "options 不能为空");
        CancellationToken cancel = (token == null) ? new CancellationToken() : token;
        Path root = options.rootPath().toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("根目录不存在或不是目录：" + root);
        }
        cancel.throwIfCancellationRequested();

        long startedAt = System.nanoTime();
        int workerCount = settings.workerCount();
        log.info("开始搜索：root={}, recurse={}, workers={}", root, options.recurse(), workerCount);

        WorkQueue queue = new WorkQueue(settings.queueCapacity(), settings.pollBackoff());
        ResultAggregator aggregator = new ResultAggregator();
        ProgressReporter progress = new ProgressReporter(listener);
        FileProcessor processor = newProcessor(options);
        FileTreeEnumerator enumerator = new FileTreeEnumerator(root, options.recurse(), settings.followLinks(), cancel);

        progress.started();

        ExecutorService executor = Executors.newFixedThreadPool(workerCount + 1, newThreadFactory());
        CompletionService<Void> tasks = new ExecutorCompletionService<>(executor);
        try {
            tasks.submit(() -> enumerate(enumerator, queue, cancel), null);
            for (int i = 0; i < workerCount; i++) {
                tasks.submit(new SearchWorker(queue, processor, aggregator, progress, cancel), null);
            }
            // 按完成顺序收集：任一任务异常结束时立即取消，不必等枚举走完
            for (int i = 0; i <= workerCount; i++) {
                awaitNext(tasks, cancel);
            }
        } finally {
            executor.shutdown();
        }

        long elapsedMillis = (System.nanoTime() - startedAt) / 1_000_000;
        if (cancel.isCancellationRequested()) {
            log.info("搜索已取消：root={}, 已处理 {} 个文件, 耗时 {} ms", root, progress.processedCount(), elapsedMillis);
            throw new SearchCanceledException();
        }

        List<SearchMatch> results = aggregator.sortedResults();
        log.info("搜索完成：root={}, 已处理 {} 个文件, 命中 {} 个, 耗时 {} ms",
                root, progress.processedCount(), results.size(), elapsedMillis);
        return results;
    }

    private static void enumerate(FileTreeEnumerator enumerator, WorkQueue queue, CancellationToken token) {
        try {
            for (Path file : enumerator) {
                if (!queue.put(file, token)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            token.cancel();
            Thread.currentThread().interrupt();
        } finally {
            // 无论如何都要通知消费者，否则工作线程会一直等待
            queue.complete();
            log.debug("枚举结束，队列中剩余 {} 个文件", queue.size());
        }
    }

    FileProcessor newProcessor(SearchOptions options) {
        return new FileProcessor(options, new ContentClassifier(settings));
    }

    private static void awaitNext(CompletionService<Void> tasks, CancellationToken token) throws SearchCanceledException {
        try {
            tasks.take().get();
        } catch (InterruptedException e) {
            token.cancel();
            Thread.currentThread().interrupt();
            throw new SearchCanceledException();
        } catch (ExecutionException e) {
            token.cancel();
            Throwable cause = e.getCause();
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("搜索任务异常终止：" + cause, cause);
        }
    }

    private static ThreadFactory newThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "file-search-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
