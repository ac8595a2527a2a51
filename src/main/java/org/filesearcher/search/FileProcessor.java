package org.filesearcher.search;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Optional;

/**
 * 单个候选文件的处理：读取元数据、元数据过滤、（可选）内容过滤，全部通过后生成 {@link SearchMatch}。
 * <p>
 * 元数据在这里才读取（每个文件只读一次属性），避免枚举阶段重复访问文件系统。
 */
public class FileProcessor {

    private final MetadataFilter metadataFilter;
    private final ContentClassifier classifier;
    private final FileAttributeFormatter attributes;
    private final String contentQuery;

    public FileProcessor(SearchOptions options, ContentClassifier classifier) {
        this.metadataFilter = new MetadataFilter(options);
        this.classifier = classifier;
        this.attributes = new FileAttributeFormatter(options.rootPath().getFileSystem());
        this.contentQuery = options.hasContentQuery() ? options.contentQuery() : null;
    }

    /**
     * @return 命中时返回结果；未命中、文件已不存在或不是普通文件时返回 empty
     * @throws IOException 读取属性失败（除“文件不存在”外），由调用方按单文件失败处理
     */
    public Optional<SearchMatch> process(Path file, CancellationToken token) throws IOException {
        BasicFileAttributes attrs;
        try {
            attrs = attributes.read(file);
        } catch (NoSuchFileException e) {
            // 与并发删除的竞争属于正常情况
            return Optional.empty();
        }
        if (!attrs.isRegularFile()) {
            return Optional.empty();
        }

        Path fileName = file.getFileName();
        String name = (fileName == null) ? file.toString() : fileName.toString();
        Instant modified = attrs.lastModifiedTime().toInstant();
        if (!metadataFilter.test(name, modified)) {
            return Optional.empty();
        }

        String snippet = null;
        if (contentQuery != null) {
            if (!classifier.isText(file)) {
                return Optional.empty();
            }
            Optional<String> found = classifier.findSnippet(file, contentQuery, token);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            snippet = found.get();
        }

        return Optional.of(new SearchMatch(
                name,
                file.toAbsolutePath().toString(),
                MetadataFilter.extensionOf(name),
                attrs.size(),
                modified,
                FileAttributeFormatter.describe(attrs),
                snippet
        ));
    }
}
