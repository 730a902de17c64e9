package org.learningjava.settingscan.application.port;

import java.nio.file.Path;

/**
 * A tree producer could not turn one source file into a syntax tree.
 */
public class UastParseException extends Exception {

    private final transient Path sourceFile;

    public UastParseException(Path sourceFile, String message) {
        super(message);
        this.sourceFile = sourceFile;
    }

    public UastParseException(Path sourceFile, String message, Throwable cause) {
        super(message, cause);
        this.sourceFile = sourceFile;
    }

    public Path getSourceFile() {
        return sourceFile;
    }
}
