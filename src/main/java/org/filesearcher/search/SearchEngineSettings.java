package org.filesearcher.search;

import java.time.Duration;

/**
 * 引擎调优参数（不可变）。
 *
 * @param workerCount         工作线程数
 * @param pollBackoff         队列暂时为空时工作线程的等待时长
 * @param queueCapacity       分发队列容量，0 表示不限
 * @param followLinks         枚举时是否进入符号链接目录
 * @param binarySampleBytes   二进制判定的采样字节数
 * @param snippetLeadingChars 片段中命中位置之前保留的字符数
 * @param snippetMaxChars     片段正文的最大字符数
 */
public record SearchEngineSettings(
        int workerCount,
        Duration pollBackoff,
        int queueCapacity,
        boolean followLinks,
        int binarySampleBytes,
        int snippetLeadingChars,
        int snippetMaxChars
) {

    public static final int DEFAULT_PARALLELISM_MULTIPLIER = 2;
    public static final Duration DEFAULT_POLL_BACKOFF = Duration.ofMillis(50);
    public static final int DEFAULT_SAMPLE_BYTES = 512;
    public static final int DEFAULT_SNIPPET_LEADING_CHARS = 40;
    public static final int DEFAULT_SNIPPET_MAX_CHARS = 160;

    public SearchEngineSettings {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount 必须大于 0：" + workerCount);
        }
        if (pollBackoff == null || pollBackoff.isNegative() || pollBackoff.isZero()) {
            throw new IllegalArgumentException("pollBackoff 必须为正数：" + pollBackoff);
        }
        if (queueCapacity < 0) {
            throw new IllegalArgumentException("queueCapacity 不能为负数：" + queueCapacity);
        }
    }

    public static SearchEngineSettings defaults() {
        return new SearchEngineSettings(
                defaultWorkerCount(DEFAULT_PARALLELISM_MULTIPLIER),
                DEFAULT_POLL_BACKOFF,
                0,
                false,
                DEFAULT_SAMPLE_BYTES,
                DEFAULT_SNIPPET_LEADING_CHARS,
                DEFAULT_SNIPPET_MAX_CHARS
        );
    }

    public static int defaultWorkerCount(int multiplier) {
        return Math.max(1, Runtime.getRuntime().availableProcessors() * Math.max(1, multiplier));
    }

    public SearchEngineSettings withWorkerCount(int count) {
        return new SearchEngineSettings(count, pollBackoff, queueCapacity, followLinks,
                binarySampleBytes, snippetLeadingChars, snippetMaxChars);
    }
}
