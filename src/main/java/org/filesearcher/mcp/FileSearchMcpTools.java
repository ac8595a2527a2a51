package org.filesearcher.mcp;

import org.filesearcher.filesystem.FileSearchProperties;
import org.filesearcher.filesystem.SearchOptionsFactory;
import org.filesearcher.filesystem.SecurePathResolver;
import org.filesearcher.filesystem.dto.AllowedRootsResult;
import org.filesearcher.filesystem.dto.FileSearchHit;
import org.filesearcher.filesystem.dto.FileSearchToolResult;
import org.filesearcher.search.CancellationToken;
import org.filesearcher.search.FileSearchEngine;
import org.filesearcher.search.SearchCanceledException;
import org.filesearcher.search.SearchMatch;
import org.filesearcher.search.SearchOptions;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 文件搜索 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出允许搜索的根目录（{@code fs_list_roots}）。</li>
 *   <li>按名称通配符/扩展名/修改日期/内容关键字搜索文件（{@code fs_search_files}）。</li>
 * </ul>
 * <p>
 * 安全策略：
 * <ul>
 *   <li>搜索起点只能位于 {@code app.search.roots} 白名单目录内。</li>
 *   <li>只读访问，从不打开文件写入。</li>
 * </ul>
 * <p>
 * 性能策略：
 * <ul>
 *   <li>枚举与内容扫描并发执行，不建立索引、不跨调用缓存。</li>
 *   <li>单次搜索超过 {@code app.search.timeout} 自动取消；返回条数受 {@code maxResults} 上限保护。</li>
 * </ul>
 */
@Component
public class FileSearchMcpTools {

    private final FileSearchProperties properties;
    private final SecurePathResolver pathResolver;
    private final SearchOptionsFactory optionsFactory;
    private final FileSearchEngine engine;
    private final ScheduledExecutorService timeoutScheduler;

    public FileSearchMcpTools(
            FileSearchProperties properties,
            SecurePathResolver pathResolver,
            SearchOptionsFactory optionsFactory,
            FileSearchEngine engine,
            ScheduledExecutorService timeoutScheduler
    ) {
        // properties：服务端配置（根目录白名单、超时、返回条数上限等）
        this.properties = properties;
        // pathResolver：把用户输入的路径解析成“受控的绝对路径”，并做越界/链接逃逸校验
        this.pathResolver = pathResolver;
        // optionsFactory：扩展名/日期等文本参数的规范化
        this.optionsFactory = optionsFactory;
        // engine：并发搜索引擎（无状态，每次搜索独立创建线程池）
        this.engine = engine;
        // timeoutScheduler：到期取消搜索
        this.timeoutScheduler = timeoutScheduler;
    }

    /**
     * 返回服务端允许搜索的根目录白名单。
     */
    @Tool(
            name = "fs_list_roots",
            description = "列出允许搜索的根目录（rootId + path）。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    /**
     * 在目录树中搜索文件。
     * <p>
     * 过滤条件之间是“与”关系；未提供的条件不参与过滤。结果按文件名排序。
     * 超时被取消时返回 {@code status=CANCELED} 且不含任何结果。
     */
    @Tool(
            name = "fs_search_files",
            description = "在目录树中搜索文件：支持文件名通配符（* ?）、扩展名列表、修改日期区间（含边界）、"
                    + "内容关键字（不区分大小写，返回命中行片段）。结果按文件名排序。"
    )
    public FileSearchToolResult searchFiles(
            @ToolParam(required = false, description = "rootId（可从 fs_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "搜索起始目录（相对 rootId，或位于该根目录下的绝对路径；为空表示根目录本身）") String path,
            @ToolParam(required = false, description = "文件名通配符，例如 *report*.txt、?.log（不区分大小写）") String nameFilter,
            @ToolParam(required = false, description = "扩展名列表，分号或逗号分隔，可省略点，例如 txt;.md,LOG") String extensions,
            @ToolParam(required = false, description = "修改日期下界（含），yyyy-MM-dd 或 ISO 日期时间") String dateFrom,
            @ToolParam(required = false, description = "修改日期上界（含），yyyy-MM-dd 表示包含当天全天") String dateTo,
            @ToolParam(required = false, description = "是否递归子目录（默认 true）") Boolean recurse,
            @ToolParam(required = false, description = "内容关键字（不区分大小写的字面量；仅搜索文本文件）") String contentQuery,
            @ToolParam(required = false, description = "最大返回条数（默认 app.search.default-max-results，上限 app.search.max-results）") Integer maxResults
    ) {
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolveDirectory(rootId, path);
        SearchOptions options = optionsFactory.create(
                resolved.absolutePath(), nameFilter, extensions, dateFrom, dateTo, recurse, contentQuery);
        int resolvedMaxResults = resolveMaxResults(maxResults);

        CancellationToken token = new CancellationToken();
        LoggingProgressListener listener = new LoggingProgressListener(
                resolved.rootId() + ":" + normalizeBasePath(resolved.displayPath()), properties.getProgressLogEvery());
        ScheduledFuture<?> timeout = timeoutScheduler.schedule(
                token::cancel, properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);

        long startedAt = System.nanoTime();
        List<SearchMatch> matches;
        try {
            matches = engine.search(options, listener, token);
        } catch (SearchCanceledException e) {
            return new FileSearchToolResult(
                    resolved.rootId(),
                    normalizeBasePath(resolved.displayPath()),
                    FileSearchToolResult.CANCELED,
                    listener.processedFiles(),
                    elapsedMillis(startedAt),
                    0,
                    0,
                    false,
                    List.of()
            );
        } finally {
            timeout.cancel(false);
        }

        int returned = Math.min(matches.size(), resolvedMaxResults);
        List<FileSearchHit> hits = new ArrayList<>(returned);
        for (SearchMatch match : matches.subList(0, returned)) {
            hits.add(toHit(resolved.rootPath(), match));
        }
        return new FileSearchToolResult(
                resolved.rootId(),
                normalizeBasePath(resolved.displayPath()),
                FileSearchToolResult.COMPLETED,
                listener.processedFiles(),
                elapsedMillis(startedAt),
                matches.size(),
                returned,
                matches.size() > returned,
                hits
        );
    }

    private int resolveMaxResults(Integer maxResults) {
        int resolved = (maxResults == null || maxResults <= 0) ? properties.getDefaultMaxResults() : maxResults;
        return Math.min(resolved, properties.getMaxResults());
    }

    private static FileSearchHit toHit(Path rootPath, SearchMatch match) {
        return new FileSearchHit(
                match.name(),
                relativeDisplayPath(rootPath, match.path()),
                match.path(),
                match.extension(),
                match.size(),
                match.lastModified().toString(),
                match.attributes(),
                match.previewSnippet()
        );
    }

    private static String relativeDisplayPath(Path rootPath, String absolutePath) {
        try {
            return rootPath.relativize(Path.of(absolutePath)).toString().replace('\\', '/');
        } catch (Exception e) {
            return absolutePath.replace('\\', '/');
        }
    }

    private static String normalizeBasePath(String displayPath) {
        if (displayPath == null || displayPath.isBlank()) {
            return ".";
        }
        return displayPath.replace('\\', '/');
    }

    private static long elapsedMillis(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000;
    }
}
