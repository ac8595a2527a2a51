package org.filesearcher.search;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.DosFileAttributes;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;

/**
 * 按文件系统支持的属性视图一次性读取文件属性，并把平台相关的标志渲染为文本。
 * <ul>
 *   <li>POSIX：权限串，例如 {@code rw-r--r--}。</li>
 *   <li>DOS：标志列表，例如 {@code ReadOnly, Archive}；无任何标志时为 {@code Normal}。</li>
 *   <li>其它：{@code Normal}。</li>
 * </ul>
 */
final class FileAttributeFormatter {

    static final String NORMAL = "Normal";

    private enum View { POSIX, DOS, BASIC }

    private final View view;

    FileAttributeFormatter(FileSystem fileSystem) {
        if (fileSystem.supportedFileAttributeViews().contains("posix")) {
            view = View.POSIX;
        } else if (fileSystem.supportedFileAttributeViews().contains("dos")) {
            view = View.DOS;
        } else {
            view = View.BASIC;
        }
    }

    BasicFileAttributes read(Path file) throws IOException {
        return switch (view) {
            case POSIX -> Files.readAttributes(file, PosixFileAttributes.class);
            case DOS -> Files.readAttributes(file, DosFileAttributes.class);
            case BASIC -> Files.readAttributes(file, BasicFileAttributes.class);
        };
    }

    static String describe(BasicFileAttributes attrs) {
        if (attrs instanceof PosixFileAttributes posix) {
            return PosixFilePermissions.toString(posix.permissions());
        }
        if (attrs instanceof DosFileAttributes dos) {
            List<String> flags = new ArrayList<>(4);
            if (dos.isReadOnly()) {
                flags.add("ReadOnly");
            }
            if (dos.isHidden()) {
                flags.add("Hidden");
            }
            if (dos.isSystem()) {
                flags.add("System");
            }
            if (dos.isArchive()) {
                flags.add("Archive");
            }
            return flags.isEmpty() ? NORMAL : String.join(", ", flags);
        }
        return NORMAL;
    }
}
