package org.learningjava.settingscan.infrastructure.adapter.out.fs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileSystemSourceScannerTest {

    private final FileSystemSourceScanner scanner = new FileSystemSourceScanner();

    @Test
    void walks_depth_first_in_lexical_order_and_filters_by_extension(@TempDir Path root) throws Exception {
        Files.createDirectories(root.resolve("b/inner"));
        Files.createDirectories(root.resolve("a"));
        Files.writeString(root.resolve("Z.java"), "class Z {}");
        Files.writeString(root.resolve("b/inner/C.java"), "class C {}");
        Files.writeString(root.resolve("b/B.java"), "class B {}");
        Files.writeString(root.resolve("a/A.java"), "class A {}");
        Files.writeString(root.resolve("a/notes.txt"), "ignored");

        List<String> found = scanner.discover(root, ".java").stream()
                .map(p -> root.relativize(p).toString().replace('\\', '/'))
                .toList();

        // names compare by code point, so upper case sorts first
        assertThat(found, contains("Z.java", "a/A.java", "b/B.java", "b/inner/C.java"));
    }

    @Test
    void symbolic_links_are_not_followed(@TempDir Path root) throws Exception {
        Files.createDirectories(root.resolve("a"));
        Files.writeString(root.resolve("a/A.java"), "class A {}");
        try {
            Files.createSymbolicLink(root.resolve("a/loop"), root.resolve("a"));
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported here");
        }

        List<String> found = scanner.discover(root, ".java").stream()
                .map(p -> root.relativize(p).toString().replace('\\', '/'))
                .toList();

        assertThat(found, contains("a/A.java"));
    }

    @Test
    void missing_root_is_rejected(@TempDir Path root) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> scanner.discover(root.resolve("nope"), ".java"));
        assertTrue(e.getMessage().startsWith("Directory not found"));
    }

    @Test
    void empty_directory_yields_nothing(@TempDir Path root) {
        assertTrue(scanner.discover(root, ".java").isEmpty());
    }
}
