package org.filesearcher.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * 文件搜索服务的业务配置（{@code app.search.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许搜索的根目录白名单，搜索起点只能落在这些目录内。</li>
 *   <li>通过 worker/queue/backoff 配置调节并发搜索的吞吐与资源占用。</li>
 *   <li>通过 {@link #timeout} 限制单次搜索时长，超时后按“取消”处理。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.search")
public class FileSearchProperties {

    /**
     * 允许搜索的根目录白名单。
     * <p>
     * 每个 root 会自动分配一个 {@code rootId}（root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许符号链接：解析路径时允许经过符号链接，枚举时进入符号链接目录。
     * <p>
     * 安全建议：默认 false。
     */
    private boolean allowSymlink = false;

    /**
     * 显式指定工作线程数；0 表示按 {@link #workerParallelismMultiplier} × CPU 核数计算。
     */
    @Min(0)
    @Max(1_024)
    private int workerCount = 0;

    /**
     * 每个 CPU 核对应的工作线程数（IO 密集型，默认 2）。
     */
    @Min(1)
    @Max(64)
    private int workerParallelismMultiplier = 2;

    /**
     * 队列暂时为空时工作线程的等待时长。
     */
    @NotNull
    private Duration pollBackoff = Duration.ofMillis(50);

    /**
     * 分发队列容量；0 表示不限。
     * <p>
     * 说明：超大目录树下可设置上限，让枚举线程在队列满时等待，避免路径堆积占用内存。
     */
    @Min(0)
    @Max(10_000_000)
    private int queueCapacity = 0;

    /**
     * 二进制判定时读取的文件头字节数。
     */
    @NotNull
    private DataSize binarySampleSize = DataSize.ofBytes(512);

    /**
     * 内容片段中命中位置之前保留的字符数。
     */
    @Min(0)
    @Max(10_000)
    private int snippetLeadingChars = 40;

    /**
     * 内容片段正文的最大字符数（不含首尾省略号）。
     */
    @Min(1)
    @Max(100_000)
    private int snippetMaxChars = 160;

    /**
     * 单次搜索的最长时间，超过后自动取消。
     */
    @NotNull
    private Duration timeout = Duration.ofMinutes(5);

    /**
     * {@code fs_search_files} 默认最大返回条数。
     */
    @Min(1)
    @Max(1_000_000)
    private int defaultMaxResults = 200;

    /**
     * {@code fs_search_files} 允许的最大返回条数（上限保护）。
     */
    @Min(1)
    @Max(1_000_000)
    private int maxResults = 5_000;

    /**
     * 每处理多少个文件输出一条进度日志（DEBUG）。
     */
    @Min(1)
    private int progressLogEvery = 1_000;

    /**
     * 解析“仅日期”的时间边界时使用的时区；为空表示系统默认时区。
     */
    private String zoneId;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public int getWorkerParallelismMultiplier() {
        return workerParallelismMultiplier;
    }

    public void setWorkerParallelismMultiplier(int workerParallelismMultiplier) {
        this.workerParallelismMultiplier = workerParallelismMultiplier;
    }

    public Duration getPollBackoff() {
        return pollBackoff;
    }

    public void setPollBackoff(Duration pollBackoff) {
        this.pollBackoff = pollBackoff;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public DataSize getBinarySampleSize() {
        return binarySampleSize;
    }

    public void setBinarySampleSize(DataSize binarySampleSize) {
        this.binarySampleSize = binarySampleSize;
    }

    public int getSnippetLeadingChars() {
        return snippetLeadingChars;
    }

    public void setSnippetLeadingChars(int snippetLeadingChars) {
        this.snippetLeadingChars = snippetLeadingChars;
    }

    public int getSnippetMaxChars() {
        return snippetMaxChars;
    }

    public void setSnippetMaxChars(int snippetMaxChars) {
        this.snippetMaxChars = snippetMaxChars;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getDefaultMaxResults() {
        return defaultMaxResults;
    }

    public void setDefaultMaxResults(int defaultMaxResults) {
        this.defaultMaxResults = defaultMaxResults;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }

    public int getProgressLogEvery() {
        return progressLogEvery;
    }

    public void setProgressLogEvery(int progressLogEvery) {
        this.progressLogEvery = progressLogEvery;
    }

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId;
    }
}
