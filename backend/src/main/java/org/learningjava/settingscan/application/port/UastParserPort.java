package org.learningjava.settingscan.application.port;

import org.learningjava.settingscan.domain.model.uast.UastNode;

import java.nio.file.Path;

public interface UastParserPort {
    UastNode parse(Path sourceFile) throws UastParseException;
}
