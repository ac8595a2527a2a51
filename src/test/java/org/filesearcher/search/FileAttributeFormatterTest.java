package org.filesearcher.search;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermissions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileAttributeFormatterTest {

    @TempDir
    Path dir;

    @Test
    void posix_rendersPermissionString() throws IOException {
        assumeTrue(dir.getFileSystem().supportedFileAttributeViews().contains("posix"));
        Path file = Files.writeString(dir.resolve("a.txt"), "a");
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-r-----"));

        BasicFileAttributes attrs = new FileAttributeFormatter(dir.getFileSystem()).read(file);

        assertThat(attrs).isInstanceOf(PosixFileAttributes.class);
        assertThat(FileAttributeFormatter.describe(attrs)).isEqualTo("rw-r-----");
    }
}
