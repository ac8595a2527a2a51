package org.filesearcher.filesystem;

import org.filesearcher.search.FileSearchEngine;
import org.filesearcher.search.SearchEngineSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 文件搜索服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>把配置 {@link FileSearchProperties} 转换成引擎参数与路径解析器。</li>
 *   <li>这里不引入任何数据库/外部依赖，全部基于本地文件系统。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class FileSearchConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(FileSearchProperties properties) {
        return new SecurePathResolver(properties);
    }

    @Bean
    public SearchEngineSettings searchEngineSettings(FileSearchProperties properties) {
        return toEngineSettings(properties);
    }

    @Bean
    public FileSearchEngine fileSearchEngine(SearchEngineSettings settings) {
        return new FileSearchEngine(settings);
    }

    @Bean
    public SearchOptionsFactory searchOptionsFactory(FileSearchProperties properties) {
        return new SearchOptionsFactory(resolveZone(properties.getZoneId()));
    }

    /**
     * 搜索超时调度器：到期后取消对应搜索的 token（单线程即可，只做“置位”操作）。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService searchTimeoutScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "search-timeout");
            thread.setDaemon(true);
            return thread;
        });
    }

    static SearchEngineSettings toEngineSettings(FileSearchProperties properties) {
        int workers = properties.getWorkerCount() > 0
                ? properties.getWorkerCount()
                : SearchEngineSettings.defaultWorkerCount(properties.getWorkerParallelismMultiplier());
        return new SearchEngineSettings(
                workers,
                properties.getPollBackoff(),
                properties.getQueueCapacity(),
                properties.isAllowSymlink(),
                (int) Math.min(Integer.MAX_VALUE, Math.max(1, properties.getBinarySampleSize().toBytes())),
                properties.getSnippetLeadingChars(),
                properties.getSnippetMaxChars()
        );
    }

    static ZoneId resolveZone(String zoneId) {
        if (zoneId == null || zoneId.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(zoneId.trim());
    }
}
