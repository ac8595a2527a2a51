package org.filesearcher.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * 基于显式栈的深度优先目录遍历，惰性产出文件的绝对路径。
 * <p>
 * 行为约定：
 * <ul>
 *   <li>当前目录的文件先于其任何子目录产出；子目录按列目录顺序入栈。</li>
 *   <li>某个目录无法列出（权限不足、IO 错误、遍历中被删除）时按“空目录”处理并继续，不向调用方抛出异常。</li>
 *   <li>每进入一个目录、每产出一个元素前检查取消信号；取消后立即停止产出。</li>
 *   <li>{@code recurse=false} 时只产出根目录下的文件。</li>
 *   <li>默认不进入符号链接目录；开启 {@code followLinks} 时按真实路径去重，避免循环引用。</li>
 * </ul>
 * 每次调用 {@link #iterator()} 都会从头开始一次新的遍历。
 */
public class FileTreeEnumerator implements Iterable<Path> {

    private static final Logger log = LoggerFactory.getLogger(FileTreeEnumerator.class);

    private final Path root;
    private final boolean recurse;
    private final boolean followLinks;
    private final CancellationToken token;

    public FileTreeEnumerator(Path root, boolean recurse, boolean followLinks, CancellationToken token) {
        this.root = root.toAbsolutePath().normalize();
        this.recurse = recurse;
        this.followLinks = followLinks;
        this.token = token;
    }

    @Override
    public Iterator<Path> iterator() {
        return new Walk();
    }

    private final class Walk implements Iterator<Path> {

        private final Deque<Path> directories = new ArrayDeque<>();
        private final Deque<Path> files = new ArrayDeque<>();
        private final Set<Path> visitedRealDirs = new HashSet<>();

        Walk() {
            directories.push(root);
        }

        @Override
        public boolean hasNext() {
            while (true) {
                if (token.isCancellationRequested()) {
                    return false;
                }
                if (!files.isEmpty()) {
                    return true;
                }
                if (directories.isEmpty()) {
                    return false;
                }
                visit(directories.pop());
            }
        }

        @Override
        public Path next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return files.poll();
        }

        private void visit(Path dir) {
            if (followLinks && !markVisited(dir)) {
                return;
            }
            List<Path> dirFiles = new ArrayList<>();
            List<Path> subDirs = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                for (Path entry : stream) {
                    switch (classify(entry)) {
                        case DIRECTORY -> subDirs.add(entry);
                        case FILE -> dirFiles.add(entry);
                        default -> {
                            // 未跟随的符号链接目录
                        }
                    }
                }
            } catch (IOException | DirectoryIteratorException | SecurityException e) {
                log.debug("目录无法列出，按空目录处理：{}（{}）", dir, e.toString());
                return;
            }
            files.addAll(dirFiles);
            if (recurse) {
                for (Path subDir : subDirs) {
                    directories.push(subDir);
                }
            }
        }

        private boolean markVisited(Path dir) {
            try {
                return visitedRealDirs.add(dir.toRealPath());
            } catch (IOException | SecurityException e) {
                log.debug("目录无法解析真实路径，已跳过：{}（{}）", dir, e.toString());
                return false;
            }
        }
    }

    private enum EntryKind { FILE, DIRECTORY, SKIPPED }

    private EntryKind classify(Path entry) {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException e) {
            // 交给工作线程处理（通常是刚被删除的文件，届时会被静默跳过）
            return EntryKind.FILE;
        }
        if (attrs.isDirectory()) {
            return EntryKind.DIRECTORY;
        }
        if (attrs.isSymbolicLink() && Files.isDirectory(entry)) {
            return followLinks ? EntryKind.DIRECTORY : EntryKind.SKIPPED;
        }
        return EntryKind.FILE;
    }
}
