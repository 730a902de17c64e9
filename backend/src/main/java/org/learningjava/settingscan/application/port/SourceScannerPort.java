package org.learningjava.settingscan.application.port;

import java.nio.file.Path;
import java.util.List;

public interface SourceScannerPort {
    List<Path> discover(Path root, String extension); // depth-first, lexical order per directory
}
