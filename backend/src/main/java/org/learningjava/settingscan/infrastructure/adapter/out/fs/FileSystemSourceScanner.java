package org.learningjava.settingscan.infrastructure.adapter.out.fs;

import org.learningjava.settingscan.application.port.SourceScannerPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

@Component
public class FileSystemSourceScanner implements SourceScannerPort {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSourceScanner.class);

    @Override
    public List<Path> discover(Path root, String extension) {
        if (root == null || !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Directory not found: " + root);
        }
        String suffix = extension == null ? "" : extension;
        List<Path> out = new ArrayList<>();
        try {
            walk(root, suffix, out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + root, e);
        }
        log.debug("Discovered {} '{}' file(s) under {}", out.size(), suffix, root);
        return out;
    }

    // depth-first; entries of one directory in lexical order of their names; links are not followed
    private void walk(Path dir, String suffix, List<Path> out) throws IOException {
        List<Path> entries;
        try (Stream<Path> s = Files.list(dir)) {
            entries = s.sorted(Comparator.comparing(p -> p.getFileName().toString())).toList();
        }
        for (Path p : entries) {
            if (Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS)) {
                walk(p, suffix, out);
            } else if (Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS) && p.getFileName().toString().endsWith(suffix)) {
                out.add(p);
            }
        }
    }
}
