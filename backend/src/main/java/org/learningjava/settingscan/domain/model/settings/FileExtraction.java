package org.learningjava.settingscan.domain.model.settings;

import java.util.List;

public record FileExtraction(
        String sourceFile,
        List<SettingRecord> records,
        List<ExtractionDiagnostic> diagnostics
) {
    public FileExtraction {
        records = List.copyOf(records);
        diagnostics = List.copyOf(diagnostics);
    }
}
