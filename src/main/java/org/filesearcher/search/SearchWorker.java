package org.filesearcher.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * 工作线程：从分发队列取路径、处理、收集结果并汇报进度，直到队列耗尽或被取消。
 * <p>
 * 单个文件的任何异常（权限、瞬时 IO 错误等）只会跳过该文件；{@link Error} 不拦截。
 */
class SearchWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SearchWorker.class);

    private final WorkQueue queue;
    private final FileProcessor processor;
    private final ResultAggregator aggregator;
    private final ProgressReporter progress;
    private final CancellationToken token;

    SearchWorker(WorkQueue queue, FileProcessor processor, ResultAggregator aggregator,
                 ProgressReporter progress, CancellationToken token) {
        this.queue = queue;
        this.processor = processor;
        this.aggregator = aggregator;
        this.progress = progress;
        this.token = token;
    }

    @Override
    public void run() {
        try {
            Path file;
            while ((file = queue.take(token)) != null) {
                processOne(file);
                progress.fileProcessed();
            }
        } catch (InterruptedException e) {
            token.cancel();
            Thread.currentThread().interrupt();
        }
    }

    private void processOne(Path file) {
        try {
            processor.process(file, token).ifPresent(match -> {
                // 取消后产生的结果直接丢弃
                if (!token.isCancellationRequested()) {
                    aggregator.add(match);
                }
            });
        } catch (Exception e) {
            log.debug("处理文件失败，已跳过：{}（{}）", file, e.toString());
        }
    }
}
