package org.learningjava.settingscan.domain.model.settings;

public record ExtractionFailure(
        String sourceFile,
        String reason
) {
}
