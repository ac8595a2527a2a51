package org.filesearcher.search;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileSearchEngineTest {

    @TempDir
    Path root;

    private final FileSearchEngine engine = new FileSearchEngine(
            new SearchEngineSettings(4, Duration.ofMillis(10), 0, false, 512, 40, 160));

    @Test
    void search_withoutFilters_returnsEveryFileSortedByName() throws Exception {
        createTree();

        List<SearchMatch> results = engine.search(SearchOptions.forRoot(root), null, null);

        assertThat(results).extracting(SearchMatch::name)
                .containsExactly("annual_report_final.txt", "app.log", "b.log", "blob.dat", "notes.md", "readme.TXT");
        assertThat(results).extracting(SearchMatch::path).doesNotHaveDuplicates();
        assertThat(results).allSatisfy(m -> {
            assertThat(Path.of(m.path())).isAbsolute().exists();
            assertThat(m.previewSnippet()).isNull();
            assertThat(m.attributes()).isNotBlank();
        });
    }

    @Test
    void search_populatesFileMetadata() throws Exception {
        Path file = Files.writeString(root.resolve("Data.CSV"), "a,b,c\n");
        Instant modified = Instant.parse("2024-03-01T10:00:00Z");
        Files.setLastModifiedTime(file, FileTime.from(modified));

        SearchMatch match = engine.search(SearchOptions.forRoot(root), null, null).get(0);

        assertThat(match.name()).isEqualTo("Data.CSV");
        assertThat(match.extension()).isEqualTo(".CSV");
        assertThat(match.size()).isEqualTo(6L);
        assertThat(match.lastModified()).isEqualTo(modified);
        assertThat(match.path()).isEqualTo(file.toAbsolutePath().toString());
    }

    @Test
    void search_withoutRecurse_onlyRootFiles() throws Exception {
        createTree();
        SearchOptions options = new SearchOptions(root, null, null, null, null, false, null);

        List<SearchMatch> results = engine.search(options, null, null);

        assertThat(results).extracting(SearchMatch::name).containsExactly("b.log", "notes.md", "readme.TXT");
    }

    @Test
    void search_extensionFilter_matchesCaseInsensitively() throws Exception {
        createTree();
        SearchOptions options = new SearchOptions(root, null, Set.of(".txt"), null, null, true, null);

        List<SearchMatch> results = engine.search(options, null, null);

        assertThat(results).extracting(SearchMatch::name).containsExactly("annual_report_final.txt", "readme.TXT");
        assertThat(results).allSatisfy(m -> assertThat(m.extension().toLowerCase()).isIn(".txt"));
    }

    @Test
    void search_nameWildcard_appliesToBareName() throws Exception {
        createTree();
        SearchOptions options = new SearchOptions(root, "*report*.txt", null, null, null, true, null);

        assertThat(engine.search(options, null, null)).extracting(SearchMatch::name)
                .containsExactly("annual_report_final.txt");
        // 目录名不参与匹配
        SearchOptions byDir = new SearchOptions(root, "logs*", null, null, null, true, null);
        assertThat(engine.search(byDir, null, null)).isEmpty();
    }

    @Test
    void search_starWildcard_matchesNamesWithLineTerminators() throws Exception {
        Path odd;
        try {
            odd = Files.writeString(root.resolve("a\nb.txt"), "x");
        } catch (InvalidPathException | IOException e) {
            odd = null;
        }
        assumeTrue(odd != null, "文件系统不支持文件名中包含换行");
        SearchOptions options = new SearchOptions(root, "*", null, null, null, true, null);

        assertThat(engine.search(options, null, null)).extracting(SearchMatch::name).containsExactly("a\nb.txt");
    }

    @Test
    void search_dateRange_isInclusive() throws Exception {
        Instant from = Instant.parse("2024-01-01T00:00:00Z");
        Instant to = Instant.parse("2024-01-31T00:00:00Z");
        touch("at-from.txt", from);
        touch("at-to.txt", to);
        touch("before.txt", from.minusSeconds(1));
        touch("after.txt", to.plusSeconds(1));
        SearchOptions options = new SearchOptions(root, null, null, from, to, true, null);

        assertThat(engine.search(options, null, null)).extracting(SearchMatch::name)
                .containsExactly("at-from.txt", "at-to.txt");
    }

    @Test
    void search_contentQuery_returnsSnippetAndSkipsBinary() throws Exception {
        createTree();
        SearchOptions options = new SearchOptions(root, null, null, null, null, true, "error");

        List<SearchMatch> results = engine.search(options, null, null);

        assertThat(results).extracting(SearchMatch::name).containsExactly("app.log");
        String snippet = results.get(0).previewSnippet();
        assertThat(snippet).contains("ERROR disk full").startsWith("...").endsWith("...");
    }

    @Test
    void search_binaryFile_excludedEvenIfTextWouldMatch() throws Exception {
        Files.write(root.resolve("mixed.txt"), new byte[]{0x00, 0x41});
        SearchOptions options = new SearchOptions(root, null, null, null, null, true, "A");

        assertThat(engine.search(options, null, null)).isEmpty();
    }

    @Test
    void search_reportsProgressForEveryFile() throws Exception {
        createTree();
        List<SearchProgress> progress = Collections.synchronizedList(new ArrayList<>());

        engine.search(SearchOptions.forRoot(root), progress::add, null);

        assertThat(progress).extracting(SearchProgress::processedFiles).isSorted().contains(0L, 6L);
        assertThat(progress).hasSize(7);
        assertThat(progress).allSatisfy(p -> assertThat(p.totalFiles()).isZero());
    }

    @Test
    void search_isRepeatable() throws Exception {
        createTree();
        SearchOptions options = new SearchOptions(root, null, null, null, null, true, "e");

        List<SearchMatch> first = engine.search(options, null, null);
        List<SearchMatch> second = engine.search(options, null, null);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void search_missingRoot_failsBeforeStarting() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> engine.search(SearchOptions.forRoot(root.resolve("nope")), p -> calls.incrementAndGet(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(calls).hasValue(0);
    }

    @Test
    void search_rootIsAFile_fails() throws IOException {
        Path file = Files.writeString(root.resolve("file.txt"), "x");

        assertThatThrownBy(() -> engine.search(SearchOptions.forRoot(file), null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void search_alreadyCanceled_throwsCanceled() throws IOException {
        createTree();
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> engine.search(SearchOptions.forRoot(root), null, token))
                .isInstanceOf(SearchCanceledException.class);
    }

    @Test
    void search_canceledMidFlight_returnsNoPartialResults() throws Exception {
        for (int i = 0; i < 300; i++) {
            Files.writeString(root.resolve("file-" + i + ".txt"), "needle " + i + "\n");
        }
        CancellationToken token = new CancellationToken();
        SearchProgressListener cancelOnFirstFile = progress -> {
            if (progress.processedFiles() >= 1) {
                token.cancel();
            }
        };
        SearchOptions options = new SearchOptions(root, null, null, null, null, true, "needle");

        assertThatThrownBy(() -> engine.search(options, cancelOnFirstFile, token))
                .isInstanceOf(SearchCanceledException.class);
        assertThat(awaitNoSearchThreads()).isTrue();
    }

    @Test
    @Timeout(10)
    void search_workerError_endsSearchWithoutWaitingForEnumeration() throws Exception {
        for (int i = 0; i < 20; i++) {
            Files.writeString(root.resolve("file-" + i + ".txt"), "x");
        }
        // 单工作线程 + 容量为 1 的队列：工作线程崩溃后，枚举线程只能靠取消信号退出
        FileSearchEngine crashing = new FileSearchEngine(
                new SearchEngineSettings(1, Duration.ofMillis(10), 1, false, 512, 40, 160)) {
            @Override
            FileProcessor newProcessor(SearchOptions options) {
                return new FileProcessor(options, new ContentClassifier(settings())) {
                    @Override
                    public Optional<SearchMatch> process(Path file, CancellationToken token) {
                        throw new WorkerCrash();
                    }
                };
            }
        };

        assertThatThrownBy(() -> crashing.search(SearchOptions.forRoot(root), null, null))
                .isInstanceOf(WorkerCrash.class);
        assertThat(awaitNoSearchThreads()).isTrue();
    }

    @Test
    void search_leavesNoThreadsBehind() throws Exception {
        createTree();

        engine.search(SearchOptions.forRoot(root), null, null);

        assertThat(awaitNoSearchThreads()).isTrue();
    }

    private void createTree() throws IOException {
        Files.writeString(root.resolve("readme.TXT"), "read me\n");
        Files.writeString(root.resolve("notes.md"), "# notes\n");
        Files.writeString(root.resolve("b.log"), "nothing to see\n");
        Files.createDirectories(root.resolve("logs/2024"));
        Files.writeString(root.resolve("logs/app.log"),
                "2024-01-01 INFO start\n2024-01-01 WARN slow\n2024-01-01 ERROR disk full\n", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("logs/2024/annual_report_final.txt"), "revenue\n");
        Files.write(root.resolve("logs/blob.dat"), new byte[]{0x00, 'E', 'R', 'R', 'O', 'R'});
    }

    private void touch(String name, Instant modified) throws IOException {
        Path file = Files.writeString(root.resolve(name), name);
        Files.setLastModifiedTime(file, FileTime.from(modified));
    }

    private static boolean awaitNoSearchThreads() throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (System.nanoTime() < deadline) {
            boolean alive = Thread.getAllStackTraces().keySet().stream()
                    .anyMatch(t -> t.getName().startsWith("file-search-") && t.isAlive());
            if (!alive) {
                return true;
            }
            Thread.sleep(20);
        }
        return false;
    }

    private static final class WorkerCrash extends Error {
    }
}
