package org.filesearcher.filesystem;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecurePathResolverTest {

    @TempDir
    Path temp;

    private Path root;
    private Path other;
    private SecurePathResolver resolver;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(temp.resolve("root"));
        other = Files.createDirectories(temp.resolve("other"));
        Files.createDirectories(root.resolve("docs/sub"));
        Files.writeString(root.resolve("docs/file.txt"), "x");

        FileSearchProperties properties = new FileSearchProperties();
        properties.setRoots(List.of(root.toString(), other.toString()));
        resolver = new SecurePathResolver(properties);
    }

    @Test
    void listRoots_assignsSequentialIds() {
        assertThat(resolver.listRoots()).extracting("id").containsExactly("root0", "root1");
    }

    @Test
    void resolveDirectory_relativeToDefaultRoot() {
        SecurePathResolver.ResolvedPath resolved = resolver.resolveDirectory(null, "docs/sub");

        assertThat(resolved.rootId()).isEqualTo("root0");
        assertThat(resolved.absolutePath()).isEqualTo(root.resolve("docs/sub").toAbsolutePath().normalize());
        assertThat(resolved.displayPath()).isEqualTo("docs/sub");
    }

    @Test
    void resolveDirectory_blankPathIsRootItself() {
        SecurePathResolver.ResolvedPath resolved = resolver.resolveDirectory("root1", null);

        assertThat(resolved.absolutePath()).isEqualTo(other.toAbsolutePath().normalize());
    }

    @Test
    void resolveDirectory_absolutePathInsideSelectedRoot() {
        SecurePathResolver.ResolvedPath resolved =
                resolver.resolveDirectory("root0", root.resolve("docs").toAbsolutePath().toString());

        assertThat(resolved.rootId()).isEqualTo("root0");
        assertThat(resolved.displayPath()).isEqualTo("docs");
    }

    @Test
    void resolveDirectory_absolutePathOutsideSelectedRoot_isRejected() {
        assertThatThrownBy(() -> resolver.resolveDirectory(null, other.toAbsolutePath().toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("根目录范围");
    }

    @Test
    void resolveDirectory_rejectsTraversalOutsideRoot() {
        assertThatThrownBy(() -> resolver.resolveDirectory("root0", "../other"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolveDirectory_rejectsFilesAndMissingPaths() {
        assertThatThrownBy(() -> resolver.resolveDirectory(null, "docs/file.txt"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolveDirectory(null, "docs/missing"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolveDirectory_rejectsUnknownRootId() {
        assertThatThrownBy(() -> resolver.resolveDirectory("root9", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("root9");
    }

    @Test
    void resolveDirectory_rejectsSymlinkEscape() throws IOException {
        Path link = root.resolve("escape");
        try {
            Files.createSymbolicLink(link, other);
        } catch (UnsupportedOperationException | IOException e) {
            return;
        }

        assertThatThrownBy(() -> resolver.resolveDirectory("root0", "escape"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolveDirectory_symlinkInsideRoot_onlyWhenAllowed() throws IOException {
        Path link = root.resolve("shortcut");
        try {
            Files.createSymbolicLink(link, root.resolve("docs/sub"));
        } catch (UnsupportedOperationException | IOException e) {
            return;
        }
        FileSearchProperties permissive = new FileSearchProperties();
        permissive.setRoots(List.of(root.toString()));
        permissive.setAllowSymlink(true);

        assertThatThrownBy(() -> resolver.resolveDirectory("root0", "shortcut"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new SecurePathResolver(permissive).resolveDirectory(null, "shortcut").displayPath())
                .isEqualTo("shortcut");
    }

    @Test
    void resolve_withoutRoots_isMisconfiguration() {
        FileSearchProperties properties = new FileSearchProperties();
        properties.setRoots(List.of());

        assertThatThrownBy(() -> new SecurePathResolver(properties).resolveDirectory(null, null))
                .isInstanceOf(IllegalStateException.class);
    }
}
