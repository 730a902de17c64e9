package org.learningjava.settingscan.domain.model.settings;

public record ExtractionDiagnostic(
        String sourceFile,
        long sourceLine,
        String rawName,     // empty when the declaration had no resolvable variable name
        String message
) {
}
