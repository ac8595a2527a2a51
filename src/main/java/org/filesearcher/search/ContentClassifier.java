package org.filesearcher.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 内容分类与内容搜索。
 * <ul>
 *   <li>{@link #isText(Path)}：读取文件开头的采样字节，出现 NUL 即判定为二进制；空文件视为文本；读取失败视为二进制。</li>
 *   <li>{@link #findSnippet(Path, String, CancellationToken)}：逐行扫描，第一处不区分大小写的命中生成片段后立即停止。</li>
 * </ul>
 * 两者都不会向外抛出 IO 异常：失败的文件只是被排除在结果之外。
 */
public class ContentClassifier {

    private static final Logger log = LoggerFactory.getLogger(ContentClassifier.class);

    static final String ELLIPSIS = "...";
    private static final char BOM = '\uFEFF';

    private final int sampleBytes;
    private final int leadingChars;
    private final int maxChars;

    public ContentClassifier(int sampleBytes, int leadingChars, int maxChars) {
        if (sampleBytes < 1 || leadingChars < 0 || maxChars < 1) {
            throw new IllegalArgumentException("内容分类参数不合法：sampleBytes=" + sampleBytes
                    + ", leadingChars=" + leadingChars + ", maxChars=" + maxChars);
        }
        this.sampleBytes = sampleBytes;
        this.leadingChars = leadingChars;
        this.maxChars = maxChars;
    }

    public ContentClassifier(SearchEngineSettings settings) {
        this(settings.binarySampleBytes(), settings.snippetLeadingChars(), settings.snippetMaxChars());
    }

    public boolean isText(Path file) {
        byte[] sample;
        try (InputStream in = Files.newInputStream(file)) {
            sample = in.readNBytes(sampleBytes);
        } catch (IOException | RuntimeException e) {
            log.debug("读取采样失败，按二进制处理：{}（{}）", file, e.toString());
            return false;
        }
        for (byte b : sample) {
            if (b == 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * 查找第一处命中并返回片段；未命中、读取失败或已取消时返回 empty。
     */
    public Optional<String> findSnippet(Path file, String query, CancellationToken token) {
        if (query == null || query.isEmpty()) {
            return Optional.empty();
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder))) {
            String line;
            boolean first = true;
            while ((line = reader.readLine()) != null) {
                if (token.isCancellationRequested()) {
                    return Optional.empty();
                }
                if (first) {
                    first = false;
                    if (!line.isEmpty() && line.charAt(0) == BOM) {
                        line = line.substring(1);
                    }
                }
                int idx = indexOfIgnoreCase(line, query);
                if (idx >= 0) {
                    return Optional.of(buildSnippet(line, idx));
                }
            }
        } catch (IOException | RuntimeException e) {
            log.debug("内容扫描失败，按未命中处理：{}（{}）", file, e.toString());
        }
        return Optional.empty();
    }

    String buildSnippet(String line, int matchStart) {
        int start = Math.max(0, matchStart - leadingChars);
        int length = Math.min(line.length() - start, maxChars);
        return ELLIPSIS + line.substring(start, start + length) + ELLIPSIS;
    }

    static int indexOfIgnoreCase(String text, String token) {
        int textLength = text.length();
        int tokenLength = token.length();
        if (tokenLength == 0) {
            return 0;
        }
        if (tokenLength > textLength) {
            return -1;
        }
        for (int i = 0; i <= textLength - tokenLength; i++) {
            if (text.regionMatches(true, i, token, 0, tokenLength)) {
                return i;
            }
        }
        return -1;
    }
}
